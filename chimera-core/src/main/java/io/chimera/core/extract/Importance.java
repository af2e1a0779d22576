package io.chimera.core.extract;

import java.util.Locale;

public enum Importance {
    NONE,
    LOW,
    MEDIUM,
    HIGH;

    public String label() {
        return name().toLowerCase(Locale.ROOT);
    }
}
