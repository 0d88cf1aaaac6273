package com.hmmtagger.server.ai.model;

import com.hmmtagger.server.ai.EntityIndex;
import com.hmmtagger.server.ai.State;

import java.util.Objects;

/**
 * Common base for probability tables whose rows are keyed by model state.
 * Freezes the state index it is built over.
 */
public abstract class ProbabilityMatrixBase {
    protected final EntityIndex<State> states;

    protected ProbabilityMatrixBase(EntityIndex<State> states) {
        this.states = Objects.requireNonNull(states, "states");
        states.freeze();
    }

    public EntityIndex<State> getStates() {
        return states;
    }

    public int getStateCount() {
        return states.size();
    }

    protected int stateIndex(State state) {
        return states.indexOf(state);
    }

    protected static double sum(double[] row) {
        double total = 0.0;
        for (double p : row) {
            total += p;
        }
        return total;
    }
}
