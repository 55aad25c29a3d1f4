package com.agentscheduler.core.model;

import org.junit.jupiter.api.Test;
import java.time.Duration;
import java.util.HashSet;
import java.util.Set;
import static org.junit.jupiter.api.Assertions.*;

class RetrySettingsTest {

    @Test
    void defaultSettings_shouldMatchActivityRetryPolicy() {
        RetrySettings settings = RetrySettings.defaultSettings();

        assertEquals(3, settings.maxAttempts());
        assertEquals(Duration.ofSeconds(1), settings.initialInterval());
        assertEquals(Duration.ofMinutes(1), settings.maximumInterval());
        assertEquals(2.0, settings.backoffCoefficient());
        assertTrue(settings.nonRetryableErrors().contains("java.lang.IllegalArgumentException"));
    }

    @Test
    void nonRetryableErrors_shouldBeCopiedFromBuilder() {
        Set<String> types = new HashSet<>(Set.of("java.lang.IllegalStateException"));
        RetrySettings settings = RetrySettings.builder()
            .nonRetryableErrors(types)
            .build();
        types.add("java.io.IOException");

        assertEquals(Set.of("java.lang.IllegalStateException"), settings.nonRetryableErrors());
    }

    @Test
    void constructor_shouldRejectInvalidValues() {
        assertThrows(IllegalArgumentException.class,
            () -> RetrySettings.builder().maxAttempts(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> RetrySettings.builder().backoffCoefficient(0.5).build());
        assertThrows(IllegalArgumentException.class,
            () -> RetrySettings.builder().maximumInterval(Duration.ofMillis(10)).build());
    }
}
