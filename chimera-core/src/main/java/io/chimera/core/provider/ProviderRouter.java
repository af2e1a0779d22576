package io.chimera.core.provider;

import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class ProviderRouter {
    public static final String MODEL_PREFIX = "model-";

    private static final Logger LOG = LoggerFactory.getLogger(ProviderRouter.class);

    private final Map<String, ProviderModel> exact;
    private final Map<String, ProviderModel> caseInsensitive;
    private final Map<String, ProviderModel> punctuationFree;

    public ProviderRouter(ModelCatalog catalog) {
        Objects.requireNonNull(catalog, "catalog must not be null");
        Map<String, ProviderModel> exactIndex = new HashMap<>();
        Map<String, ProviderModel> lowerIndex = new HashMap<>();
        Map<String, ProviderModel> strippedIndex = new HashMap<>();
        for (ProviderModel model : catalog.supportedModels()) {
            exactIndex.put(model.canonicalModel(), model);
            lowerIndex.putIfAbsent(model.canonicalModel().toLowerCase(Locale.ROOT), model);
            strippedIndex.putIfAbsent(withoutPunctuation(model.canonicalModel()), model);
        }
        this.exact = Collections.unmodifiableMap(exactIndex);
        this.caseInsensitive = Collections.unmodifiableMap(lowerIndex);
        this.punctuationFree = Collections.unmodifiableMap(strippedIndex);
    }

    public ProviderModel resolve(String modelIdentifier) {
        String clean = stripPrefix(modelIdentifier);

        ProviderModel match = exact.get(clean);
        if (match == null) {
            match = caseInsensitive.get(clean.toLowerCase(Locale.ROOT));
        }
        if (match == null) {
            match = punctuationFree.get(withoutPunctuation(clean));
        }
        if (match != null) {
            LOG.debug("Resolved model {} to {}/{}", modelIdentifier, match.provider(), match.canonicalModel());
            return match;
        }

        LOG.debug("Unrecognised model {}, falling back to {}", modelIdentifier, ModelCatalog.ECHO);
        return ProviderModel.of(clean.isBlank() ? ModelCatalog.ECHO : clean, ModelCatalog.ECHO);
    }

    static String stripPrefix(String modelIdentifier) {
        String clean = modelIdentifier == null ? "" : modelIdentifier.trim();
        if (clean.regionMatches(true, 0, MODEL_PREFIX, 0, MODEL_PREFIX.length())) {
            clean = clean.substring(MODEL_PREFIX.length());
        }
        return clean;
    }

    private static String withoutPunctuation(String value) {
        return value.replace(".", "").replace("-", "").replace("_", "").toLowerCase(Locale.ROOT);
    }
}
