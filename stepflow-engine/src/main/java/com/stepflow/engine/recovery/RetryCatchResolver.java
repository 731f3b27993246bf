package com.stepflow.engine.recovery;

import com.stepflow.core.model.Catcher;
import com.stepflow.core.model.ExecutionError;
import com.stepflow.core.model.Retrier;
import com.stepflow.core.model.State;
import com.stepflow.engine.interpreter.Environment;

import java.util.List;

/**
 * Decides how a failed state recovers.
 * 
 * The first Retrier whose ErrorEquals matches is the only one consulted: if it still has
 * attempts left the state is retried, otherwise the Catchers are scanned in order.
 * Retry counters live in the Environment and are incremented here.
 */
public class RetryCatchResolver {

    public RecoveryDecision resolve(State state, ExecutionError error, Environment env) {
        List<Retrier> retriers = state.retriers();
        for (int i = 0; i < retriers.size(); i++) {
            Retrier retrier = retriers.get(i);
            if (!retrier.matches(error)) {
                continue;
            }
            if (retrier.hasMoreAttempts(env.retriesMade(i))) {
                int attempt = env.incrementRetry(i);
                return RecoveryDecision.retry(retrier.delayForAttempt(attempt), attempt);
            }
            break;
        }

        for (Catcher catcher : state.catchers()) {
            if (catcher.matches(error)) {
                return RecoveryDecision.caught(catcher);
            }
        }
        return RecoveryDecision.propagate();
    }
}
