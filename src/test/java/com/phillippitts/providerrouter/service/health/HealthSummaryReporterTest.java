package com.phillippitts.providerrouter.service.health;

import com.phillippitts.providerrouter.config.properties.HealthProperties;
import com.phillippitts.providerrouter.exception.TransientProviderException;
import com.phillippitts.providerrouter.testutil.MutableClock;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class HealthSummaryReporterTest {

    @Test
    void summarizesEveryProviderOnOneLine() {
        HealthTracker tracker = new HealthTracker(new HealthProperties(), new MutableClock(), e -> { });
        tracker.register(List.of("openai", "groq"));
        tracker.recordSuccess("groq", Duration.ofMillis(30));
        for (int i = 0; i < 3; i++) {
            tracker.recordFailure("openai", new TransientProviderException("openai", "HTTP 500"));
        }

        String summary = HealthSummaryReporter.summarize(tracker.snapshot());

        assertThat(summary).isEqualTo("groq=CLOSED(fail=0, req=1) openai=OPEN(fail=3, req=3)");
    }

    @Test
    void emptySnapshotGivesEmptySummary() {
        assertThat(HealthSummaryReporter.summarize(Map.of())).isEmpty();
    }

    @Test
    void scheduledRunDoesNotThrow() {
        HealthTracker tracker = new HealthTracker(new HealthProperties(), new MutableClock(), e -> { });
        tracker.register(List.of("groq"));

        new HealthSummaryReporter(tracker).logHealthSummary();

        assertThat(tracker.isHealthy("groq")).isTrue();
    }
}
