package dev.devanks.propcast.worker.config;

import com.google.cloud.bigquery.BigQuery;
import com.google.cloud.bigquery.BigQueryOptions;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

/**
 * BigQuery client for the execution log, backed by Application Default Credentials.
 */
@Configuration
public class BigQueryClientConfig {

    @Bean
    @ConditionalOnMissingBean(BigQuery.class)
    public BigQuery bigQueryClient() {
        return BigQueryOptions.getDefaultInstance().getService();
    }
}
