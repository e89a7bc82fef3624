package com.phillippitts.providerrouter.service.catalog;

import com.phillippitts.providerrouter.domain.Capability;
import com.phillippitts.providerrouter.domain.ProviderCandidate;
import com.phillippitts.providerrouter.exception.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static com.phillippitts.providerrouter.testutil.Candidates.token;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ProviderCatalogTest {

    @Test
    void sortsCandidatesByUnitCostAscending() {
        ProviderCatalog catalog = new ProviderCatalog(Map.of(Capability.FAST_TEXT, List.of(
                token("premium", 0.002, 0.002),
                token("budget", 0.001, 0.001),
                token("cheap", 0.0005, 0.0005))));

        assertThat(catalog.candidatesFor(Capability.FAST_TEXT))
                .extracting(ProviderCandidate::providerName)
                .containsExactly("cheap", "budget", "premium");
    }

    @Test
    void breaksPriceTiesByPriorityWeightThenName() {
        ProviderCandidate low = ProviderCandidate.tokenBilled("b", "m", 0.001, 0.001, 0, Set.of(), 1);
        ProviderCandidate high = ProviderCandidate.tokenBilled("c", "m", 0.001, 0.001, 0, Set.of(), 9);
        ProviderCandidate lowAlpha = ProviderCandidate.tokenBilled("a", "m", 0.001, 0.001, 0, Set.of(), 1);

        ProviderCatalog catalog = new ProviderCatalog(Map.of(Capability.FAST_TEXT, List.of(low, high, lowAlpha)));

        assertThat(catalog.candidatesFor(Capability.FAST_TEXT)).containsExactly(high, lowAlpha, low);
    }

    @Test
    void sortsFlatRateCandidatesByCostPerOperation() {
        ProviderCandidate dalle = ProviderCandidate.perOperation("openai", "dall-e-3", 0.04, Set.of(), 0);
        ProviderCandidate flux = ProviderCandidate.perOperation("fal", "flux-schnell", 0.003, Set.of(), 0);

        ProviderCatalog catalog = new ProviderCatalog(Map.of(Capability.IMAGE_GENERATION, List.of(dalle, flux)));

        assertThat(catalog.candidatesFor(Capability.IMAGE_GENERATION)).containsExactly(flux, dalle);
    }

    @Test
    void rejectsDuplicateProviderModelPairWithinCapability() {
        Map<Capability, List<ProviderCandidate>> input = Map.of(Capability.FAST_TEXT,
                List.of(token("groq", 0.1, 0.1), token("groq", 0.2, 0.2)));

        assertThatThrownBy(() -> new ProviderCatalog(input))
                .isInstanceOf(ConfigurationException.class)
                .hasMessageContaining("groq:groq-model");
    }

    @Test
    void unknownCapabilityIsConfigurationError() {
        ProviderCatalog catalog = new ProviderCatalog(Map.of(Capability.FAST_TEXT, List.of(token("groq", 0.1, 0.1))));

        assertThatThrownBy(() -> catalog.candidatesFor(Capability.VIDEO_GENERATION))
                .isInstanceOf(ConfigurationException.class)
                .satisfies(e -> assertThat(((ConfigurationException) e).getCapability())
                        .isEqualTo("video-generation"));
    }

    @Test
    void emptyCapabilityIsConfigurationErrorAndNotListed() {
        ProviderCatalog catalog = new ProviderCatalog(Map.of(
                Capability.FAST_TEXT, List.of(token("groq", 0.1, 0.1)),
                Capability.EMBEDDINGS, List.of()));

        assertThat(catalog.capabilities()).containsExactly(Capability.FAST_TEXT);
        assertThatThrownBy(() -> catalog.candidatesFor(Capability.EMBEDDINGS))
                .isInstanceOf(ConfigurationException.class);
    }

    @Test
    void collectsProviderNamesAcrossCapabilities() {
        ProviderCatalog catalog = new ProviderCatalog(Map.of(
                Capability.FAST_TEXT, List.of(token("groq", 0.1, 0.1), token("openai", 0.2, 0.2)),
                Capability.EMBEDDINGS, List.of(token("cohere", 0.1, 0.0), token("openai", 0.2, 0.0))));

        assertThat(catalog.providerNames()).containsExactlyInAnyOrder("groq", "openai", "cohere");
        assertThat(catalog.isEmpty()).isFalse();
    }

    @Test
    void returnedListsAreImmutable() {
        ProviderCatalog catalog = new ProviderCatalog(Map.of(Capability.FAST_TEXT, List.of(token("groq", 0.1, 0.1))));

        assertThatThrownBy(() -> catalog.candidatesFor(Capability.FAST_TEXT).clear())
                .isInstanceOf(UnsupportedOperationException.class);
    }
}
