package io.chimera.core.extract;

public enum Confidence {
    MEDIUM,
    HIGH
}
