package io.chimera.core.provider;

import java.util.Locale;
import java.util.Objects;

public record DispatchResult(
    String reply,
    String provider,
    String canonicalModel,
    long tokenUsage,
    DispatchStatus status,
    ErrorKind errorKind,
    String diagnostic
) {

    public DispatchResult {
        Objects.requireNonNull(status, "status must not be null");
        reply = reply == null ? "" : reply;
        provider = provider == null ? "" : provider;
        canonicalModel = canonicalModel == null ? "" : canonicalModel;
        tokenUsage = Math.max(0, tokenUsage);
        if (status == DispatchStatus.SUCCEEDED) {
            errorKind = null;
            diagnostic = null;
        } else {
            Objects.requireNonNull(errorKind, "errorKind must not be null for a failed dispatch");
            diagnostic = diagnostic == null || diagnostic.isBlank() ? errorKind.name() : diagnostic;
        }
    }

    public static DispatchResult succeeded(String reply, String provider, String model, long tokenUsage) {
        return new DispatchResult(reply, provider, model, tokenUsage, DispatchStatus.SUCCEEDED, null, null);
    }

    public static DispatchResult failed(String provider, String model, ErrorKind errorKind, String diagnostic) {
        String label = provider == null || provider.isBlank() ? "dispatch" : provider;
        return new DispatchResult(
            "[" + label.toUpperCase(Locale.ROOT) + " Error] " + (diagnostic == null ? "" : diagnostic),
            provider,
            model,
            0,
            DispatchStatus.FAILED,
            errorKind,
            diagnostic
        );
    }

    public boolean succeeded() {
        return status == DispatchStatus.SUCCEEDED;
    }
}
