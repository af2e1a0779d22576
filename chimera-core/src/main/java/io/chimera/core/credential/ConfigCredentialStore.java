package io.chimera.core.credential;

import io.chimera.core.config.model.ProviderConfig;
import io.chimera.core.config.model.ProvidersConfig;
import java.util.Objects;
import java.util.Optional;

public final class ConfigCredentialStore implements CredentialStore {
    private final ProvidersConfig providers;

    public ConfigCredentialStore(ProvidersConfig providers) {
        this.providers = Objects.requireNonNull(providers, "providers must not be null");
    }

    @Override
    public Optional<String> credentialFor(String account, String provider) {
        return providers.forTag(provider)
            .filter(ProviderConfig::configured)
            .map(ProviderConfig::apiKey);
    }
}
