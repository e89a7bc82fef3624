package com.phillippitts.providerrouter.config.properties;

import com.phillippitts.providerrouter.domain.BillingMode;
import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Provider catalog as configured under {@code router.catalog}.
 *
 * <p>Example:
 * <pre>
 * router.catalog.capabilities.fast-text[0].provider-name=groq
 * router.catalog.capabilities.fast-text[0].model-name=llama-3.3-70b-versatile
 * router.catalog.capabilities.fast-text[0].cost-per-unit-in=0.0
 * router.catalog.capabilities.fast-text[0].api-key-property=GROQ_API_KEY
 * </pre>
 */
@Validated
@ConfigurationProperties(prefix = "router.catalog")
public class CatalogProperties {

    /** Candidates per capability name. */
    @Valid
    private Map<String, List<CandidateProperties>> capabilities = new LinkedHashMap<>();

    /** Capabilities that must have at least one usable candidate at startup. */
    private List<String> requiredCapabilities = new ArrayList<>();

    public Map<String, List<CandidateProperties>> getCapabilities() {
        return capabilities;
    }

    public void setCapabilities(Map<String, List<CandidateProperties>> capabilities) {
        this.capabilities = capabilities;
    }

    public List<String> getRequiredCapabilities() {
        return requiredCapabilities;
    }

    public void setRequiredCapabilities(List<String> requiredCapabilities) {
        this.requiredCapabilities = requiredCapabilities;
    }

    /**
     * One configured (provider, model) entry.
     */
    public static class CandidateProperties {

        @NotBlank(message = "Provider name must not be blank")
        private String providerName;

        @NotBlank(message = "Model name must not be blank")
        private String modelName;

        @NotNull
        private BillingMode billingMode = BillingMode.TOKEN;

        @PositiveOrZero
        private double costPerUnitIn;

        @PositiveOrZero
        private double costPerUnitOut;

        @PositiveOrZero
        private double costPerOperation;

        /** Maximum input+output units; 0 means unknown. */
        @PositiveOrZero
        private long contextLimit;

        private Set<String> tags = new LinkedHashSet<>();

        private int priorityWeight;

        /** Disabled entries are dropped when the catalog is built. */
        private boolean enabled = true;

        /** Property or environment variable that must be non-blank for this entry to be usable. */
        private String apiKeyProperty;

        public CandidateProperties() {
        }

        public CandidateProperties(String providerName, String modelName, double costPerUnitIn, double costPerUnitOut) {
            this.providerName = providerName;
            this.modelName = modelName;
            this.costPerUnitIn = costPerUnitIn;
            this.costPerUnitOut = costPerUnitOut;
        }

        public String getProviderName() {
            return providerName;
        }

        public void setProviderName(String providerName) {
            this.providerName = providerName;
        }

        public String getModelName() {
            return modelName;
        }

        public void setModelName(String modelName) {
            this.modelName = modelName;
        }

        public BillingMode getBillingMode() {
            return billingMode;
        }

        public void setBillingMode(BillingMode billingMode) {
            this.billingMode = billingMode;
        }

        public double getCostPerUnitIn() {
            return costPerUnitIn;
        }

        public void setCostPerUnitIn(double costPerUnitIn) {
            this.costPerUnitIn = costPerUnitIn;
        }

        public double getCostPerUnitOut() {
            return costPerUnitOut;
        }

        public void setCostPerUnitOut(double costPerUnitOut) {
            this.costPerUnitOut = costPerUnitOut;
        }

        public double getCostPerOperation() {
            return costPerOperation;
        }

        public void setCostPerOperation(double costPerOperation) {
            this.costPerOperation = costPerOperation;
        }

        public long getContextLimit() {
            return contextLimit;
        }

        public void setContextLimit(long contextLimit) {
            this.contextLimit = contextLimit;
        }

        public Set<String> getTags() {
            return tags;
        }

        public void setTags(Set<String> tags) {
            this.tags = tags;
        }

        public int getPriorityWeight() {
            return priorityWeight;
        }

        public void setPriorityWeight(int priorityWeight) {
            this.priorityWeight = priorityWeight;
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getApiKeyProperty() {
            return apiKeyProperty;
        }

        public void setApiKeyProperty(String apiKeyProperty) {
            this.apiKeyProperty = apiKeyProperty;
        }
    }
}
