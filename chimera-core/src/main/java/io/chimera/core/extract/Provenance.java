package io.chimera.core.extract;

import java.util.Locale;

public enum Provenance {
    PATTERN("extracted"),
    KEYWORD("important");

    private final String extractionType;

    Provenance(String extractionType) {
        this.extractionType = extractionType;
    }

    public String extractionType() {
        return extractionType;
    }

    @Override
    public String toString() {
        return name().toLowerCase(Locale.ROOT);
    }
}
