package com.hmmtagger.server.ai.model;

import com.hmmtagger.server.ai.EntityIndex;
import com.hmmtagger.server.ai.InvalidProbabilityException;
import com.hmmtagger.server.ai.State;

import java.util.Objects;

/**
 * Probability of a sequence starting in each state.
 */
public class InitialStateVector extends ProbabilityMatrixBase {
    private final double[] probabilities;

    public InitialStateVector(EntityIndex<State> states) {
        super(states);
        this.probabilities = new double[states.size()];
    }

    public double getProbability(State state) {
        return probabilities[stateIndex(state)];
    }

    public void setProbability(State state, double probability) {
        InvalidProbabilityException.check(probability);
        probabilities[stateIndex(state)] = probability;
    }

    /**
     * @throws IndexOutOfBoundsException if the state index is out of range
     */
    public double getAt(int state) {
        Objects.checkIndex(state, probabilities.length);
        return probabilities[state];
    }

    public double sum() {
        return sum(probabilities);
    }
}
