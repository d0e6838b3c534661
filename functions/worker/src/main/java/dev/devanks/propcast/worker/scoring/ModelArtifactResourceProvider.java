// functions/worker/src/main/java/dev/devanks/propcast/worker/scoring/ModelArtifactResourceProvider.java
package dev.devanks.propcast.worker.scoring;

import com.google.cloud.spring.storage.GoogleStorageResource;
import com.google.cloud.storage.Storage;
import lombok.RequiredArgsConstructor;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class ModelArtifactResourceProvider {

    private static final String GCS_SCHEME = "gs://";

    private final Storage gcsClient;
    private final ResourceLoader resourceLoader;

    public Resource resourceFor(String location) {
        if (location.startsWith(GCS_SCHEME)) {
            return new GoogleStorageResource(gcsClient, location);
        }
        return resourceLoader.getResource(location);
    }
}
