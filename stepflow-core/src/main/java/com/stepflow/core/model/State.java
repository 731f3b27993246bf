package com.stepflow.core.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.stepflow.core.model.state.StateSpec;

import java.util.List;

/**
 * One node of a program: the attributes common to every state type plus the
 * variant-specific {@link StateSpec}.
 * 
 * Invariants:
 * - spec matches type (e.g. TASK carries a TaskSpec)
 * - types requiring a transition declare exactly one of next / end
 * - Succeed, Fail and Choice declare neither next nor end
 */
public record State(
    String name,
    StateType type,
    String comment,
    
    // Transition
    String next,
    boolean end,
    
    // Data flow (null = undeclared)
    DataPath inputPath,
    DataPath outputPath,
    DataPath resultPath,
    JsonNode parameters,
    
    // Recovery
    List<Retrier> retriers,
    List<Catcher> catchers,
    
    // Variant
    StateSpec spec
) {
    public State {
        retriers = retriers != null ? List.copyOf(retriers) : List.of();
        catchers = catchers != null ? List.copyOf(catchers) : List.of();
    }

    public DataPath effectiveInputPath() {
        return DataPath.orRoot(inputPath);
    }

    public DataPath effectiveOutputPath() {
        return DataPath.orRoot(outputPath);
    }

    public DataPath effectiveResultPath() {
        return DataPath.orRoot(resultPath);
    }

    /**
     * Check if this state ends its program once its output is produced.
     */
    public boolean isTerminal() {
        return end || type == StateType.SUCCEED || type == StateType.FAIL;
    }

    /**
     * Get the variant-specific spec as the expected type.
     */
    public <T extends StateSpec> T spec(Class<T> specType) {
        return specType.cast(spec);
    }

    /**
     * Builder for State.
     */
    public static Builder builder() {
        return new Builder();
    }

    public static class Builder {
        private String name;
        private StateType type;
        private String comment;
        private String next;
        private boolean end;
        private DataPath inputPath;
        private DataPath outputPath;
        private DataPath resultPath;
        private JsonNode parameters;
        private List<Retrier> retriers = List.of();
        private List<Catcher> catchers = List.of();
        private StateSpec spec;

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder type(StateType type) {
            this.type = type;
            return this;
        }

        public Builder comment(String comment) {
            this.comment = comment;
            return this;
        }

        public Builder next(String next) {
            this.next = next;
            return this;
        }

        public Builder end(boolean end) {
            this.end = end;
            return this;
        }

        public Builder inputPath(DataPath inputPath) {
            this.inputPath = inputPath;
            return this;
        }

        public Builder outputPath(DataPath outputPath) {
            this.outputPath = outputPath;
            return this;
        }

        public Builder resultPath(DataPath resultPath) {
            this.resultPath = resultPath;
            return this;
        }

        public Builder parameters(JsonNode parameters) {
            this.parameters = parameters;
            return this;
        }

        public Builder retriers(List<Retrier> retriers) {
            this.retriers = retriers;
            return this;
        }

        public Builder catchers(List<Catcher> catchers) {
            this.catchers = catchers;
            return this;
        }

        public Builder spec(StateSpec spec) {
            this.spec = spec;
            return this;
        }

        public State build() {
            return new State(
                name, type, comment, next, end,
                inputPath, outputPath, resultPath, parameters,
                retriers, catchers, spec
            );
        }
    }
}
