package com.stepflow.engine.wait;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.stepflow.core.exception.StatesRuntimeException;
import com.stepflow.core.model.ErrorNames;
import com.stepflow.core.model.state.WaitSpec;
import com.stepflow.core.model.state.WaitTarget;
import com.stepflow.core.path.JsonPathEvaluator;
import com.stepflow.engine.dataflow.PathQuery;
import com.stepflow.engine.interpreter.CancellationSignal;
import com.stepflow.engine.interpreter.Environment;
import com.stepflow.engine.interpreter.ExecutionContext;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;

import static org.assertj.core.api.Assertions.*;

class WaitResolverTest {

    private static final Instant NOW = Instant.parse("2026-03-01T12:00:00Z");

    private final ObjectMapper mapper = new ObjectMapper();
    private final WaitResolver resolver = new WaitResolver(new PathQuery(new JsonPathEvaluator()));
    private final Environment env = new Environment(
        new ExecutionContext("exec-1", "exec-1", NOW, mapper.createObjectNode()),
        new CancellationSignal(),
        mapper.createObjectNode());

    @Test
    @DisplayName("Literal Seconds wakes after that many seconds")
    void testSeconds() {
        WakeUp wakeUp = resolver.resolve(new WaitSpec(new WaitTarget.Seconds(10)), mapper.createObjectNode(), env);

        assertThat(wakeUp.wakeTime(NOW)).isEqualTo(NOW.plusSeconds(10));
    }

    @Test
    @DisplayName("SecondsPath reads the delay from the input")
    void testSecondsPath() throws Exception {
        WakeUp wakeUp = resolve(new WaitTarget.SecondsPath("$.delay"), "{\"delay\": 5}");

        assertThat(wakeUp.delay()).isEqualTo(Duration.ofSeconds(5));
        assertThat(wakeUp.wakeTime(NOW)).isEqualTo(NOW.plusSeconds(5));
    }

    @Test
    @DisplayName("Negative SecondsPath value fails with States.Runtime")
    void testNegativeSecondsPath() {
        assertRuntimeError(new WaitTarget.SecondsPath("$.delay"), "{\"delay\": -1}");
    }

    @Test
    @DisplayName("Non-numeric SecondsPath value fails with States.Runtime")
    void testObjectSecondsPath() {
        assertRuntimeError(new WaitTarget.SecondsPath("$.delay"), "{\"delay\": {}}");
        assertRuntimeError(new WaitTarget.SecondsPath("$.delay"), "{\"delay\": 1.5}");
    }

    @Test
    @DisplayName("SecondsPath that matches nothing fails with States.Runtime")
    void testMissingSecondsPath() {
        assertRuntimeError(new WaitTarget.SecondsPath("$.delay"), "{}");
    }

    @Test
    @DisplayName("Delay beyond the largest instant fails with States.Runtime")
    void testSecondsOutOfRange() throws Exception {
        WakeUp fromPath = resolve(new WaitTarget.SecondsPath("$.delay"), "{\"delay\": 100000000000000000}");
        WakeUp literal = resolver.resolve(
            new WaitSpec(new WaitTarget.Seconds(Long.MAX_VALUE)), mapper.createObjectNode(), env);

        for (WakeUp wakeUp : new WakeUp[] {fromPath, literal}) {
            assertThatThrownBy(() -> wakeUp.wakeTime(NOW))
                .isInstanceOfSatisfying(StatesRuntimeException.class,
                    e -> assertThat(e.getError().error()).isEqualTo(ErrorNames.RUNTIME));
        }
    }

    @Test
    @DisplayName("TimestampPath reads an ISO-8601 instant")
    void testTimestampPath() throws Exception {
        WakeUp wakeUp = resolve(new WaitTarget.TimestampPath("$.until"), "{\"until\": \"2026-03-01T13:00:00+01:00\"}");

        assertThat(wakeUp.instant()).isEqualTo(Instant.parse("2026-03-01T12:00:00Z"));
    }

    @Test
    @DisplayName("Malformed TimestampPath value fails with States.Runtime")
    void testMalformedTimestampPath() {
        assertRuntimeError(new WaitTarget.TimestampPath("$.until"), "{\"until\": \"tomorrow\"}");
        assertRuntimeError(new WaitTarget.TimestampPath("$.until"), "{\"until\": 12}");
    }

    @Test
    @DisplayName("A wake instant in the past resumes immediately")
    void testPastTimestamp() {
        Instant past = NOW.minusSeconds(3600);
        WakeUp wakeUp = resolver.resolve(
            new WaitSpec(new WaitTarget.Timestamp(past.toString(), past)), mapper.createObjectNode(), env);

        assertThat(wakeUp.wakeTime(NOW)).isEqualTo(NOW);
    }

    private WakeUp resolve(WaitTarget target, String input) throws Exception {
        return resolver.resolve(new WaitSpec(target), mapper.readTree(input), env);
    }

    private void assertRuntimeError(WaitTarget target, String input) {
        assertThatThrownBy(() -> resolve(target, input))
            .isInstanceOfSatisfying(StatesRuntimeException.class,
                e -> assertThat(e.getError().error()).isEqualTo(ErrorNames.RUNTIME));
    }
}
