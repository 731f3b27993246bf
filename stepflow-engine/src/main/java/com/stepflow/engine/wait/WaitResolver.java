package com.stepflow.engine.wait;

import com.fasterxml.jackson.databind.JsonNode;
import com.stepflow.core.exception.StatesRuntimeException;
import com.stepflow.core.model.ExecutionError;
import com.stepflow.core.model.Timestamps;
import com.stepflow.core.model.state.WaitSpec;
import com.stepflow.core.model.state.WaitTarget;
import com.stepflow.engine.dataflow.PathQuery;
import com.stepflow.engine.interpreter.Environment;

import java.time.Duration;
import java.time.Instant;

/**
 * Turns a Wait specification and the effective input into a {@link WakeUp}.
 * Path targets read the first match of their path.
 */
public class WaitResolver {

    private final PathQuery paths;

    public WaitResolver(PathQuery paths) {
        this.paths = paths;
    }

    /**
     * @throws StatesRuntimeException with {@code States.Runtime} if a path matches nothing or
     *         selects a value that is not a non-negative integer / a timestamp
     */
    public WakeUp resolve(WaitSpec spec, JsonNode input, Environment env) {
        WaitTarget target = spec.target();
        if (target instanceof WaitTarget.Seconds seconds) {
            return WakeUp.after(Duration.ofSeconds(seconds.seconds()));
        }
        if (target instanceof WaitTarget.Timestamp timestamp) {
            return WakeUp.at(timestamp.instant());
        }
        if (target instanceof WaitTarget.SecondsPath secondsPath) {
            JsonNode value = lookup(secondsPath.path(), input, env, target);
            return WakeUp.after(Duration.ofSeconds(toSeconds(secondsPath.path(), value)));
        }
        WaitTarget.TimestampPath timestampPath = (WaitTarget.TimestampPath) target;
        JsonNode value = lookup(timestampPath.path(), input, env, target);
        return WakeUp.at(toInstant(timestampPath.path(), value));
    }

    private JsonNode lookup(String path, JsonNode input, Environment env, WaitTarget target) {
        return paths.first(path, input, env)
            .orElseThrow(() -> failure(String.format(
                "Invalid path '%s' in %s: the path did not match any value in the input",
                path, target.fieldName())));
    }

    private long toSeconds(String path, JsonNode value) {
        if (!value.isIntegralNumber() || !value.canConvertToLong()) {
            throw failure(String.format(
                "Value of SecondsPath '%s' must be an integer, got %s", path, value));
        }
        long seconds = value.asLong();
        if (seconds < 0) {
            throw failure(String.format(
                "Value of SecondsPath '%s' must not be negative, got %d", path, seconds));
        }
        return seconds;
    }

    private Instant toInstant(String path, JsonNode value) {
        if (!value.isTextual()) {
            throw failure(String.format(
                "Value of TimestampPath '%s' must be a timestamp string, got %s", path, value));
        }
        return Timestamps.parse(value.asText())
            .orElseThrow(() -> failure(String.format(
                "Value of TimestampPath '%s' is not a valid ISO-8601 timestamp: %s", path, value.asText())));
    }

    private static StatesRuntimeException failure(String cause) {
        return new StatesRuntimeException(ExecutionError.runtime(cause));
    }
}
