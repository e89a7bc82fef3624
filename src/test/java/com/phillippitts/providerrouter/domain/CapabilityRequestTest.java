package com.phillippitts.providerrouter.domain;

import org.junit.jupiter.api.Test;

import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CapabilityRequestTest {

    @Test
    void capabilityNamesAreNormalized() {
        assertThat(Capability.of("  Fast-Text ")).isEqualTo(Capability.FAST_TEXT);
        assertThat(Capability.FAST_TEXT.toString()).isEqualTo("fast-text");
        assertThatThrownBy(() -> Capability.of(" ")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void buildsRequestWithBudgetAndTags() {
        CapabilityRequest<String> request = CapabilityRequest.of(Capability.QUALITY_TEXT, 1200, 300, "prompt")
                .withBudget(0.008)
                .withRequiredTags(Set.of("rag"));

        assertThat(request.budgetUsd()).isEqualTo(0.008);
        assertThat(request.requiredTags()).containsExactly("rag");
        assertThat(request.estimatedTotalSize()).isEqualTo(1500);
        assertThat(request.payload()).isEqualTo("prompt");
    }

    @Test
    void rejectsNegativeSizesAndBudget() {
        assertThatThrownBy(() -> CapabilityRequest.of(Capability.FAST_TEXT, -1, 0, "x"))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> CapabilityRequest.of(Capability.FAST_TEXT).withBudget(-0.5))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void dispatchResultReportsFallback() {
        ProviderCandidate groq = ProviderCandidate.tokenBilled("groq", "llama", 0.1, 0.1, 0, Set.of(), 0);
        DispatchResult<String> direct = new DispatchResult<>("ok", groq, java.time.Duration.ofMillis(5),
                0.01, false, 1, null);

        assertThat(direct.usedFallback()).isFalse();
        assertThat(direct.failures()).isEmpty();
    }
}
