package io.chimera.core.provider;

import io.chimera.core.context.ContextBundle;

public final class EchoProvider implements LlmProvider {
    public static final String NAME = "echo";

    @Override
    public String name() {
        return NAME;
    }

    @Override
    public boolean requiresCredential() {
        return false;
    }

    @Override
    public DispatchResult chat(String model, ContextBundle bundle, String credential) {
        String message = bundle.userMessage();
        String reply = "[Echo Mode] Received: " + message
            + "\n\nThis is a demo response. Connect an LLM provider to get real AI responses.";
        return DispatchResult.succeeded(reply, NAME, model, wordCount(message));
    }

    static long wordCount(String text) {
        String trimmed = text == null ? "" : text.trim();
        return trimmed.isEmpty() ? 0 : trimmed.split("\\s+").length;
    }
}
