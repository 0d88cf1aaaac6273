package com.hmmtagger.server.ai.model;

import com.hmmtagger.server.ai.EntityIndex;
import com.hmmtagger.server.ai.InvalidProbabilityException;
import com.hmmtagger.server.ai.LabeledObservation;
import com.hmmtagger.server.ai.Observation;
import com.hmmtagger.server.ai.State;

import java.util.Objects;

/**
 * Probability of a state producing each observation of the alphabet.
 */
public class EmissionMatrix extends ProbabilityMatrixBase {
    private final EntityIndex<Observation> observations;
    // [state][observation]
    private final double[][] probabilities;

    public EmissionMatrix(EntityIndex<State> states, EntityIndex<Observation> observations) {
        super(states);
        this.observations = Objects.requireNonNull(observations, "observations");
        observations.freeze();
        this.probabilities = new double[states.size()][observations.size()];
    }

    public EntityIndex<Observation> getObservations() {
        return observations;
    }

    public int getObservationCount() {
        return observations.size();
    }

    public double getEmission(State state, Observation observation) {
        int si = stateIndex(state);
        int oi = observations.indexOf(observation);
        return probabilities[si][oi];
    }

    public double getEmission(LabeledObservation labeled) {
        return getEmission(labeled.getState(), labeled.getObservation());
    }

    public void setEmission(State state, Observation observation, double probability) {
        InvalidProbabilityException.check(probability);
        int si = stateIndex(state);
        int oi = observations.indexOf(observation);
        probabilities[si][oi] = probability;
    }

    /**
     * @throws IndexOutOfBoundsException if either index is out of range
     */
    public double getAt(int state, int observation) {
        Objects.checkIndex(state, probabilities.length);
        Objects.checkIndex(observation, observations.size());
        return probabilities[state][observation];
    }

    public double rowSum(State state) {
        return sum(probabilities[stateIndex(state)]);
    }
}
