package com.stepflow.engine.logging;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.slf4j.MDC;

import static org.assertj.core.api.Assertions.*;

class LoggingContextTest {

    @AfterEach
    void tearDown() {
        LoggingContext.clearAll();
    }

    @Test
    @DisplayName("Execution context populates the MDC and is cleared on close")
    void testExecutionContext() {
        try (LoggingContext ignored = LoggingContext.forExecution("exec-1", "nightly")) {
            LoggingContext.setState("Charge", 2);

            assertThat(LoggingContext.getExecutionId()).isEqualTo("exec-1");
            assertThat(MDC.get(LoggingContext.EXECUTION_NAME)).isEqualTo("nightly");
            assertThat(LoggingContext.getStateName()).isEqualTo("Charge");
            assertThat(MDC.get(LoggingContext.ATTEMPT)).isEqualTo("2");
            assertThat(LoggingContext.getTraceId()).hasSize(8);
        }

        assertThat(LoggingContext.getExecutionId()).isNull();
        assertThat(LoggingContext.getStateName()).isNull();
        assertThat(LoggingContext.getTraceId()).isNotNull();
    }

    @Test
    @DisplayName("Closing a nested context restores the outer values")
    void testNestedContexts() {
        try (LoggingContext outer = LoggingContext.forState("exec-1", "Fan", 1)) {
            try (LoggingContext inner = LoggingContext.forState("exec-1", "Branch", 1)) {
                assertThat(LoggingContext.getStateName()).isEqualTo("Branch");
            }
            assertThat(LoggingContext.getStateName()).isEqualTo("Fan");
            assertThat(LoggingContext.getExecutionId()).isEqualTo("exec-1");
        }
    }
}
