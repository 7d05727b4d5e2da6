package com.todoflow.core.model;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;

class OrchestrationConfigTest {

    @Test
    void defaults_shouldMatchReferencePolicy() {
        OrchestrationConfig config = OrchestrationConfig.defaults();

        assertEquals(10, config.maxIterations());
        assertEquals(3, config.guidanceInterval());
        assertEquals(Duration.ofSeconds(30), config.defaultTimeout());
        assertEquals(Duration.ofSeconds(60), config.inputTimeout());
        assertEquals(3, config.maxInputAttempts());
        assertFalse(config.interactive());
    }

    @Test
    void guidanceDueBefore_shouldFireAtStartAndEveryIntervalAfter() {
        OrchestrationConfig config = OrchestrationConfig.builder().guidanceInterval(3).build();

        assertTrue(config.guidanceDueBefore(1));
        assertFalse(config.guidanceDueBefore(2));
        assertFalse(config.guidanceDueBefore(3));
        assertTrue(config.guidanceDueBefore(4));
        assertTrue(config.guidanceDueBefore(7));
    }

    @Test
    void guidanceDueBefore_zeroIntervalWithoutStart_shouldNeverFire() {
        OrchestrationConfig config = OrchestrationConfig.builder()
            .guidanceInterval(0)
            .guidanceBeforeStart(false)
            .build();

        for (int i = 1; i < 10; i++) {
            assertFalse(config.guidanceDueBefore(i));
        }
    }

    @Test
    void builder_shouldRejectInvalidValues() {
        assertThrows(IllegalArgumentException.class,
            () -> OrchestrationConfig.builder().maxIterations(-1).build());
        assertThrows(IllegalArgumentException.class,
            () -> OrchestrationConfig.builder().maxInputAttempts(0).build());
        assertThrows(IllegalArgumentException.class,
            () -> OrchestrationConfig.builder().defaultTimeout(Duration.ZERO).build());
    }

    @Test
    void toBuilder_shouldRoundTripEveryField() {
        OrchestrationConfig config = OrchestrationConfig.builder()
            .maxIterations(4)
            .interactive(true)
            .requireApproval(false)
            .build();

        assertEquals(config, config.toBuilder().build());
    }
}
