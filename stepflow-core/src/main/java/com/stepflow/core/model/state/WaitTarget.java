package com.stepflow.core.model.state;

import java.time.Instant;

/**
 * The four ways a Wait state names the moment it resumes.
 */
public sealed interface WaitTarget {

    /**
     * Name of the definition field this target was read from.
     */
    String fieldName();

    /**
     * Literal non-negative number of seconds.
     */
    record Seconds(long seconds) implements WaitTarget {
        @Override
        public String fieldName() {
            return "Seconds";
        }
    }

    /**
     * Number of seconds read from the effective input.
     */
    record SecondsPath(String path) implements WaitTarget {
        @Override
        public String fieldName() {
            return "SecondsPath";
        }
    }

    /**
     * Literal ISO-8601 instant. The declared text is kept for serialization.
     */
    record Timestamp(String text, Instant instant) implements WaitTarget {
        @Override
        public String fieldName() {
            return "Timestamp";
        }
    }

    /**
     * ISO-8601 instant read from the effective input.
     */
    record TimestampPath(String path) implements WaitTarget {
        @Override
        public String fieldName() {
            return "TimestampPath";
        }
    }
}
