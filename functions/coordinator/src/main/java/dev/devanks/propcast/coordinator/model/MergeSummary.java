package dev.devanks.propcast.coordinator.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Counts from one {@code mergeActive} call. A key whose active record did not change counts as unchanged.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MergeSummary {
    private int keys;
    private int activated;
    private int superseded;
    private int unchanged;

    public MergeSummary plus(MergeSummary other) {
        return new MergeSummary(keys + other.keys, activated + other.activated,
                superseded + other.superseded, unchanged + other.unchanged);
    }
}
