package io.chimera.core.provider;

public enum DispatchStatus {
    SUCCEEDED,
    FAILED
}
