package com.hmmtagger.server.ai;

import java.util.Collections;
import java.util.List;

/**
 * A set of tagged training sequences together with the states and
 * observations they use, in first-seen order.
 */
public class TaggedCorpus {
    private final List<List<LabeledObservation>> sequences;
    private final List<State> states;
    private final List<Observation> observations;

    public TaggedCorpus(List<List<LabeledObservation>> sequences, List<State> states,
            List<Observation> observations) {
        this.sequences = Collections.unmodifiableList(sequences);
        this.states = Collections.unmodifiableList(states);
        this.observations = Collections.unmodifiableList(observations);
    }

    public List<List<LabeledObservation>> getSequences() {
        return sequences;
    }

    public List<State> getStates() {
        return states;
    }

    public List<Observation> getObservations() {
        return observations;
    }

    public int getTokenCount() {
        int count = 0;
        for (List<LabeledObservation> sequence : sequences) {
            count += sequence.size();
        }
        return count;
    }
}
