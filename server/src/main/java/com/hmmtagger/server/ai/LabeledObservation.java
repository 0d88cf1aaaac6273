package com.hmmtagger.server.ai;

import java.util.Objects;

/**
 * One tagged token: an observation together with the state that produced it.
 */
public final class LabeledObservation {
    private final State state;
    private final Observation observation;

    public LabeledObservation(State state, Observation observation) {
        this.state = Objects.requireNonNull(state, "state");
        this.observation = Objects.requireNonNull(observation, "observation");
    }

    public State getState() {
        return state;
    }

    public Observation getObservation() {
        return observation;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof LabeledObservation))
            return false;
        LabeledObservation other = (LabeledObservation) o;
        return state.equals(other.state) && observation.equals(other.observation);
    }

    @Override
    public int hashCode() {
        return 31 * state.hashCode() + observation.hashCode();
    }

    @Override
    public String toString() {
        return observation + "/" + state;
    }
}
