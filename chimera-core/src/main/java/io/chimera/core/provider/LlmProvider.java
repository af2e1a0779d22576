package io.chimera.core.provider;

import io.chimera.core.context.ContextBundle;

public interface LlmProvider {
    String name();

    default boolean requiresCredential() {
        return true;
    }

    DispatchResult chat(String model, ContextBundle bundle, String credential);

    default ConnectionCheck verify(String credential) {
        return ConnectionCheck.connected(name());
    }
}
