package com.hmmtagger.server.ai.inference;

import com.hmmtagger.server.ai.LabeledObservation;
import com.hmmtagger.server.ai.State;
import com.hmmtagger.server.ai.TaggedCorpusReader;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ViterbiResult {
    private final List<PathStep> steps;

    public ViterbiResult(List<PathStep> steps) {
        this.steps = Collections.unmodifiableList(new ArrayList<>(steps));
    }

    public List<PathStep> getSteps() {
        return steps;
    }

    public List<State> getStates() {
        List<State> states = new ArrayList<>(steps.size());
        for (PathStep step : steps) {
            states.add(step.getState());
        }
        return states;
    }

    public List<LabeledObservation> getTaggedSequence() {
        List<LabeledObservation> tagged = new ArrayList<>(steps.size());
        for (PathStep step : steps) {
            tagged.add(step.toLabeledObservation());
        }
        return tagged;
    }

    /**
     * Probability of the whole decoded path, i.e. the last step's value.
     */
    public double getPathProbability() {
        return steps.get(steps.size() - 1).getProbability();
    }

    @Override
    public String toString() {
        return TaggedCorpusReader.format(getTaggedSequence());
    }
}
