package io.chimera.core.provider;

public enum ErrorKind {
    AUTH_ERROR,
    TIMEOUT,
    TRANSPORT_ERROR,
    UPSTREAM_ERROR,
    INTERNAL_ERROR
}
