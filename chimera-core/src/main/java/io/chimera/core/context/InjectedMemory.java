package io.chimera.core.context;

import java.util.Objects;

public record InjectedMemory(String memoryId, String title, String body, boolean truncated) {
    public static final String TRUNCATION_MARKER = "[truncated]";

    public InjectedMemory {
        Objects.requireNonNull(memoryId, "memoryId must not be null");
        title = title == null ? "" : title;
        body = body == null ? "" : body;
    }

    String render() {
        StringBuilder out = new StringBuilder()
            .append('\n')
            .append('[').append(title).append(']').append('\n')
            .append(body);
        if (truncated) {
            out.append("... ").append(TRUNCATION_MARKER);
        }
        return out.append('\n').toString();
    }
}
