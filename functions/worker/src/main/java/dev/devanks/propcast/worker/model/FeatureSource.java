package dev.devanks.propcast.worker.model;

public enum FeatureSource {
    REAL,
    DEFAULT
}
