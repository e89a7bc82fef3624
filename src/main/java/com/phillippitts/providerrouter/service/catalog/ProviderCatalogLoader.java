package com.phillippitts.providerrouter.service.catalog;

import com.phillippitts.providerrouter.config.properties.CatalogProperties;
import com.phillippitts.providerrouter.config.properties.CatalogProperties.CandidateProperties;
import com.phillippitts.providerrouter.domain.BillingMode;
import com.phillippitts.providerrouter.domain.Capability;
import com.phillippitts.providerrouter.domain.ProviderCandidate;
import com.phillippitts.providerrouter.exception.ConfigurationException;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.core.env.PropertyResolver;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Builds the {@link ProviderCatalog} from {@code router.catalog.*} properties.
 *
 * <p>Loading rules:
 * <ul>
 *   <li>Blank names, negative costs or context limits fail with {@link ConfigurationException}</li>
 *   <li>Entries with {@code enabled=false} are dropped</li>
 *   <li>Entries naming an {@code api-key-property} that resolves blank are dropped, since the
 *       adapter could never authenticate</li>
 *   <li>Every capability in {@code required-capabilities} must keep at least one entry</li>
 * </ul>
 */
public class ProviderCatalogLoader {

    private static final Logger LOG = LogManager.getLogger(ProviderCatalogLoader.class);

    private final CatalogProperties properties;
    private final PropertyResolver keyResolver;

    public ProviderCatalogLoader(CatalogProperties properties, PropertyResolver keyResolver) {
        this.properties = Objects.requireNonNull(properties, "properties");
        this.keyResolver = Objects.requireNonNull(keyResolver, "keyResolver");
    }

    /**
     * @return validated, immutable catalog
     * @throws ConfigurationException on malformed entries or a required capability left empty
     */
    public ProviderCatalog load() {
        Map<Capability, List<ProviderCandidate>> byCapability = new LinkedHashMap<>();
        properties.getCapabilities().forEach((name, entries) -> {
            Capability capability = Capability.of(name);
            List<ProviderCandidate> usable = new ArrayList<>();
            List<CandidateProperties> list = entries == null ? List.of() : entries;
            for (int i = 0; i < list.size(); i++) {
                CandidateProperties entry = list.get(i);
                ProviderCandidate candidate = toCandidate(capability, i, entry);
                if (!entry.isEnabled()) {
                    LOG.info("Skipping disabled candidate {} for {}", candidate.label(), capability);
                    continue;
                }
                if (!hasApiKey(entry)) {
                    LOG.info("Skipping candidate {} for {}: {} not set",
                            candidate.label(), capability, entry.getApiKeyProperty());
                    continue;
                }
                usable.add(candidate);
            }
            if (usable.isEmpty()) {
                LOG.warn("Capability {} has no usable candidates", capability);
            }
            byCapability.merge(capability, usable, (a, b) -> {
                List<ProviderCandidate> merged = new ArrayList<>(a);
                merged.addAll(b);
                return merged;
            });
        });

        ProviderCatalog catalog = new ProviderCatalog(byCapability);
        for (String required : properties.getRequiredCapabilities()) {
            // throws ConfigurationException when empty
            catalog.candidatesFor(Capability.of(required));
        }
        byCapability.forEach((capability, list) ->
                LOG.info("Catalog capability={} candidates={}", capability, list.size()));
        return catalog;
    }

    private ProviderCandidate toCandidate(Capability capability, int index, CandidateProperties entry) {
        if (entry == null) {
            throw new ConfigurationException(capability.name(), "Candidate #" + index + " is empty");
        }
        if (isBlank(entry.getProviderName()) || isBlank(entry.getModelName())) {
            throw new ConfigurationException(capability.name(),
                    "Candidate #" + index + " needs provider-name and model-name");
        }
        BillingMode mode = entry.getBillingMode() == null ? BillingMode.TOKEN : entry.getBillingMode();
        try {
            return new ProviderCandidate(
                    entry.getProviderName().trim(),
                    entry.getModelName().trim(),
                    mode,
                    entry.getCostPerUnitIn(),
                    entry.getCostPerUnitOut(),
                    entry.getCostPerOperation(),
                    entry.getContextLimit(),
                    entry.getTags(),
                    entry.getPriorityWeight());
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException(capability.name(), "Candidate #" + index + " is invalid: " + e.getMessage());
        }
    }

    private boolean hasApiKey(CandidateProperties entry) {
        String key = entry.getApiKeyProperty();
        return isBlank(key) || !isBlank(keyResolver.getProperty(key));
    }

    private static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
