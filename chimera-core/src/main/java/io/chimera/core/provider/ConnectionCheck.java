package io.chimera.core.provider;

import java.util.Objects;

public record ConnectionCheck(String provider, boolean connected, ErrorKind errorKind, String message) {

    public ConnectionCheck {
        Objects.requireNonNull(provider, "provider must not be null");
        if (connected) {
            errorKind = null;
            message = message == null ? "" : message;
        } else {
            Objects.requireNonNull(errorKind, "errorKind must not be null for a failed check");
            message = message == null || message.isBlank() ? errorKind.name() : message;
        }
    }

    public static ConnectionCheck connected(String provider) {
        return new ConnectionCheck(provider, true, null, "");
    }

    public static ConnectionCheck failed(String provider, ErrorKind errorKind, String message) {
        return new ConnectionCheck(provider, false, errorKind, message);
    }
}
