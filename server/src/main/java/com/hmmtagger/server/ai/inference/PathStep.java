package com.hmmtagger.server.ai.inference;

import com.hmmtagger.server.ai.LabeledObservation;
import com.hmmtagger.server.ai.Observation;
import com.hmmtagger.server.ai.State;

/**
 * One decoded time step: the chosen state, the observation it explains and
 * the probability of the best path ending in that state at that step.
 */
public class PathStep {
    private final State state;
    private final Observation observation;
    private final double probability;

    public PathStep(State state, Observation observation, double probability) {
        this.state = state;
        this.observation = observation;
        this.probability = probability;
    }

    public State getState() {
        return state;
    }

    public Observation getObservation() {
        return observation;
    }

    public double getProbability() {
        return probability;
    }

    public LabeledObservation toLabeledObservation() {
        return new LabeledObservation(state, observation);
    }

    @Override
    public String toString() {
        return "P(" + state + "|" + observation + ")=" + probability;
    }
}
