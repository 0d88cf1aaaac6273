package com.hmmtagger.server.ai.inference;

import com.hmmtagger.server.ai.Observation;
import com.hmmtagger.server.ai.model.EmissionMatrix;
import com.hmmtagger.server.ai.model.InitialStateVector;
import com.hmmtagger.server.ai.model.TransitionMatrix;

import java.util.List;

final class ModelChecks {

    private ModelChecks() {
    }

    static void requireSameStates(InitialStateVector initial, TransitionMatrix transition, EmissionMatrix emission) {
        if (initial.getStates() != transition.getStates() || initial.getStates() != emission.getStates()) {
            throw new IllegalArgumentException("Initial, transition and emission tables must share one state index");
        }
        if (initial.getStateCount() == 0) {
            throw new IllegalArgumentException("Model must have at least one state");
        }
    }

    /**
     * Maps the sequence onto emission column indices, failing on the first
     * unregistered observation.
     */
    static int[] resolveObservations(EmissionMatrix emission, List<Observation> observations) {
        if (observations == null || observations.isEmpty()) {
            throw new IllegalArgumentException("Observation sequence must not be empty");
        }
        int[] indices = new int[observations.size()];
        for (int t = 0; t < indices.length; t++) {
            indices[t] = emission.getObservations().indexOf(observations.get(t));
        }
        return indices;
    }
}
