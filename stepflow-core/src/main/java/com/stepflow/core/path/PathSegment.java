package com.stepflow.core.path;

import java.util.List;

/**
 * One step of a compiled path.
 */
sealed interface PathSegment {

    /**
     * Check if this step selects at most one child.
     */
    boolean isDefinite();

    /**
     * {@code .name} or {@code ['name']}.
     */
    record Field(String name) implements PathSegment {
        @Override
        public boolean isDefinite() {
            return true;
        }
    }

    /**
     * {@code [n]} or a union {@code [n,m]}; negative indexes count from the end.
     */
    record Index(List<Integer> indexes) implements PathSegment {
        @Override
        public boolean isDefinite() {
            return indexes.size() == 1;
        }
    }

    /**
     * {@code .*} or {@code [*]}.
     */
    record Wildcard() implements PathSegment {
        @Override
        public boolean isDefinite() {
            return false;
        }
    }

    /**
     * {@code [start:end:step]}; a null bound means "from the edge".
     */
    record Slice(Integer start, Integer end, int step) implements PathSegment {
        @Override
        public boolean isDefinite() {
            return false;
        }
    }

    /**
     * {@code ..name} or {@code ..*}; a null name descends into every node.
     */
    record Descent(String name) implements PathSegment {
        @Override
        public boolean isDefinite() {
            return false;
        }
    }
}
