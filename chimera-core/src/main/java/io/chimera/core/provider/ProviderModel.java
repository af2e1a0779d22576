package io.chimera.core.provider;

import java.util.Objects;

public record ProviderModel(String canonicalModel, String provider, String displayName) {

    public ProviderModel {
        Objects.requireNonNull(canonicalModel, "canonicalModel must not be null");
        Objects.requireNonNull(provider, "provider must not be null");
        displayName = displayName == null || displayName.isBlank() ? displayNameOf(canonicalModel) : displayName;
    }

    public static ProviderModel of(String canonicalModel, String provider) {
        return new ProviderModel(canonicalModel, provider, null);
    }

    public String publicId() {
        return ProviderRouter.MODEL_PREFIX + canonicalModel.replace(".", "").replace("_", "");
    }

    // hyphens become spaces; a letter is upper-cased when the character before it is not a letter
    static String displayNameOf(String model) {
        String spaced = model.replace('-', ' ');
        StringBuilder out = new StringBuilder(spaced.length());
        boolean previousIsLetter = false;
        for (char c : spaced.toCharArray()) {
            if (Character.isLetter(c)) {
                out.append(previousIsLetter ? Character.toLowerCase(c) : Character.toUpperCase(c));
                previousIsLetter = true;
            } else {
                out.append(c);
                previousIsLetter = false;
            }
        }
        return out.toString();
    }
}
