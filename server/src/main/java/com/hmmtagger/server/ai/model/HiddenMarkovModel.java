package com.hmmtagger.server.ai.model;

import com.hmmtagger.server.ai.EntityIndex;
import com.hmmtagger.server.ai.LabeledObservation;
import com.hmmtagger.server.ai.Observation;
import com.hmmtagger.server.ai.State;
import com.hmmtagger.server.ai.inference.ForwardEvaluator;
import com.hmmtagger.server.ai.inference.ForwardResult;
import com.hmmtagger.server.ai.inference.ViterbiDecoder;
import com.hmmtagger.server.ai.inference.ViterbiResult;

import java.util.ArrayList;
import java.util.List;

/**
 * A discrete hidden Markov model: initial, transition and emission tables
 * over one shared state index.
 */
public class HiddenMarkovModel {
    private final InitialStateVector initial;
    private final TransitionMatrix transition;
    private final EmissionMatrix emission;

    private final ViterbiDecoder decoder;
    private final ForwardEvaluator evaluator;

    public HiddenMarkovModel(InitialStateVector initial, TransitionMatrix transition, EmissionMatrix emission) {
        this.initial = initial;
        this.transition = transition;
        this.emission = emission;
        // both reject tables built over different state indices
        this.decoder = new ViterbiDecoder(initial, transition, emission);
        this.evaluator = new ForwardEvaluator(initial, transition, emission);
    }

    public EntityIndex<State> getStates() {
        return initial.getStates();
    }

    public EntityIndex<Observation> getObservations() {
        return emission.getObservations();
    }

    public InitialStateVector getInitial() {
        return initial;
    }

    public TransitionMatrix getTransition() {
        return transition;
    }

    public EmissionMatrix getEmission() {
        return emission;
    }

    /**
     * Probability of a two-token sequence starting with the {@code left}
     * hypothesis and continuing with the {@code right} one.
     */
    public double getProbability(LabeledObservation left, LabeledObservation right) {
        return initial.getProbability(left.getState())
                * emission.getEmission(left)
                * transition.getTransition(left.getState(), right.getState())
                * emission.getEmission(right);
    }

    public ViterbiResult decode(List<Observation> observations) {
        return decoder.decode(observations);
    }

    public double evaluate(List<Observation> observations, boolean logarithmic) {
        return evaluator.evaluate(observations, logarithmic);
    }

    public ForwardResult forward(List<Observation> observations) {
        return evaluator.forward(observations);
    }

    public ForwardEvaluator getEvaluator() {
        return evaluator;
    }

    /**
     * Lists the distributions that do not sum to one within the tolerance.
     * Nothing is repaired; cells are only validated individually on write.
     */
    public List<String> findNonStochasticRows(double tolerance) {
        List<String> violations = new ArrayList<>();
        double initialSum = initial.sum();
        if (Math.abs(initialSum - 1.0) > tolerance) {
            violations.add("initial sums to " + initialSum);
        }
        for (State state : getStates().entries()) {
            double t = transition.rowSum(state);
            if (Math.abs(t - 1.0) > tolerance) {
                violations.add("transition row " + state + " sums to " + t);
            }
            double e = emission.rowSum(state);
            if (Math.abs(e - 1.0) > tolerance) {
                violations.add("emission row " + state + " sums to " + e);
            }
        }
        return violations;
    }
}
