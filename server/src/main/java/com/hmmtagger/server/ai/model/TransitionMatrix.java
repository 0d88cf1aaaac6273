package com.hmmtagger.server.ai.model;

import com.hmmtagger.server.ai.EntityIndex;
import com.hmmtagger.server.ai.InvalidProbabilityException;
import com.hmmtagger.server.ai.State;

import java.util.Objects;

/**
 * Probability of moving from one state to another in one step.
 */
public class TransitionMatrix extends ProbabilityMatrixBase {
    // [currentState][nextState]
    private final double[][] probabilities;

    public TransitionMatrix(EntityIndex<State> states) {
        super(states);
        this.probabilities = new double[states.size()][states.size()];
    }

    public double getTransition(State currentState, State nextState) {
        return probabilities[stateIndex(currentState)][stateIndex(nextState)];
    }

    public void setTransition(State currentState, State nextState, double probability) {
        InvalidProbabilityException.check(probability);
        int from = stateIndex(currentState);
        int to = stateIndex(nextState);
        probabilities[from][to] = probability;
    }

    /**
     * @throws IndexOutOfBoundsException if either state index is out of range
     */
    public double getAt(int currentState, int nextState) {
        Objects.checkIndex(currentState, probabilities.length);
        Objects.checkIndex(nextState, probabilities.length);
        return probabilities[currentState][nextState];
    }

    public double rowSum(State currentState) {
        return sum(probabilities[stateIndex(currentState)]);
    }
}
