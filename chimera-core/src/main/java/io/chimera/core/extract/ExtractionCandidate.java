package io.chimera.core.extract;

import java.util.Objects;

public record ExtractionCandidate(String text, Confidence confidence, Provenance provenance) {

    public ExtractionCandidate {
        Objects.requireNonNull(text, "text must not be null");
        Objects.requireNonNull(confidence, "confidence must not be null");
        Objects.requireNonNull(provenance, "provenance must not be null");
    }
}
