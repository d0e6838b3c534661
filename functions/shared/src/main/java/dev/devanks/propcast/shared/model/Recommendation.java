package dev.devanks.propcast.shared.model;

public enum Recommendation {
    OVER,
    UNDER,
    PASS,
    NO_LINE;

    public boolean isDirectional() {
        return this == OVER || this == UNDER;
    }
}
