package com.hmmtagger.server.ai.learning;

import com.hmmtagger.server.ai.EntityIndex;
import com.hmmtagger.server.ai.LabeledObservation;
import com.hmmtagger.server.ai.Observation;
import com.hmmtagger.server.ai.State;
import com.hmmtagger.server.ai.model.EmissionMatrix;
import com.hmmtagger.server.ai.model.HiddenMarkovModel;
import com.hmmtagger.server.ai.model.InitialStateVector;
import com.hmmtagger.server.ai.model.TransitionMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Maximum-likelihood estimation of model parameters from fully tagged
 * sequences by relative frequency counting. This is not Baum-Welch: no
 * unlabeled data, no iteration.
 * <p>
 * No smoothing is applied. Combinations that never occur in the training set
 * keep whatever value the table already held.
 */
public class SupervisedEstimator {
    private static final Logger logger = LoggerFactory.getLogger(SupervisedEstimator.class);

    /**
     * Builds fresh tables over the given indices and fills them from the
     * training set.
     */
    public HiddenMarkovModel train(EntityIndex<State> states, EntityIndex<Observation> observations,
            List<? extends List<LabeledObservation>> trainingSet) {
        InitialStateVector initial = new InitialStateVector(states);
        TransitionMatrix transition = new TransitionMatrix(states);
        EmissionMatrix emission = new EmissionMatrix(states, observations);
        estimate(initial, transition, emission, trainingSet);
        return new HiddenMarkovModel(initial, transition, emission);
    }

    /**
     * Fills all three tables from the training set. Every sequence is counted
     * and every label resolved before any table is written, so a rejected
     * training set leaves the tables as they were.
     */
    public void estimate(InitialStateVector initial, TransitionMatrix transition, EmissionMatrix emission,
            List<? extends List<LabeledObservation>> trainingSet) {
        logger.info("Starting supervised estimation with {} sequences", trainingSet.size());
        long startTime = System.currentTimeMillis();

        long[] initialCounts = countInitial(initial.getStates(), trainingSet);
        long[][] transitionCounts = countTransitions(transition.getStates(), trainingSet);
        long[][] emissionCounts = countEmissions(emission.getStates(), emission.getObservations(), trainingSet);

        applyInitial(initial, initialCounts, trainingSet.size());
        applyTransitions(transition, transitionCounts);
        applyEmissions(emission, emissionCounts);

        long duration = System.currentTimeMillis() - startTime;
        logger.info("Estimation complete in {} ms", duration);
    }

    /**
     * I(s) = sequences starting in s / all sequences.
     */
    public void estimateInitial(InitialStateVector initial, List<? extends List<LabeledObservation>> trainingSet) {
        applyInitial(initial, countInitial(initial.getStates(), trainingSet), trainingSet.size());
    }

    /**
     * A(l, r) = adjacent pairs l then r / adjacent pairs starting at l.
     * Pairs never span two sequences.
     */
    public void estimateTransitions(TransitionMatrix transition,
            List<? extends List<LabeledObservation>> trainingSet) {
        applyTransitions(transition, countTransitions(transition.getStates(), trainingSet));
    }

    /**
     * B(s, o) = tokens of o tagged s / tokens tagged s.
     */
    public void estimateEmissions(EmissionMatrix emission, List<? extends List<LabeledObservation>> trainingSet) {
        applyEmissions(emission, countEmissions(emission.getStates(), emission.getObservations(), trainingSet));
    }

    private static long[] countInitial(EntityIndex<State> states,
            List<? extends List<LabeledObservation>> trainingSet) {
        long[] initialCounts = new long[states.size()];
        for (List<LabeledObservation> sequence : trainingSet) {
            requireNonEmpty(sequence);
            initialCounts[states.indexOf(sequence.get(0).getState())]++;
        }
        return initialCounts;
    }

    private static long[][] countTransitions(EntityIndex<State> states,
            List<? extends List<LabeledObservation>> trainingSet) {
        int n = states.size();
        // [prevState][nextState]
        long[][] transitionCounts = new long[n][n];
        for (List<LabeledObservation> sequence : trainingSet) {
            requireNonEmpty(sequence);
            for (int t = 1; t < sequence.size(); t++) {
                int prev = states.indexOf(sequence.get(t - 1).getState());
                int cur = states.indexOf(sequence.get(t).getState());
                transitionCounts[prev][cur]++;
            }
        }
        return transitionCounts;
    }

    private static long[][] countEmissions(EntityIndex<State> states, EntityIndex<Observation> observations,
            List<? extends List<LabeledObservation>> trainingSet) {
        long[][] emissionCounts = new long[states.size()][observations.size()];
        for (List<LabeledObservation> sequence : trainingSet) {
            requireNonEmpty(sequence);
            for (LabeledObservation token : sequence) {
                int s = states.indexOf(token.getState());
                int o = observations.indexOf(token.getObservation());
                emissionCounts[s][o]++;
            }
        }
        return emissionCounts;
    }

    private static void applyInitial(InitialStateVector initial, long[] initialCounts, long total) {
        EntityIndex<State> states = initial.getStates();
        for (int s = 0; s < initialCounts.length; s++) {
            if (initialCounts[s] == 0)
                continue;
            double probability = (double) initialCounts[s] / total;
            initial.setProbability(states.get(s), probability);
            logger.trace("Initial {}: count={}, prob={}", states.get(s), initialCounts[s], probability);
        }
    }

    private static void applyTransitions(TransitionMatrix transition, long[][] transitionCounts) {
        EntityIndex<State> states = transition.getStates();
        for (int prev = 0; prev < transitionCounts.length; prev++) {
            long totalTrans = 0;
            for (long c : transitionCounts[prev]) {
                totalTrans += c;
            }
            for (int cur = 0; cur < transitionCounts[prev].length; cur++) {
                if (transitionCounts[prev][cur] == 0)
                    continue;
                double probability = (double) transitionCounts[prev][cur] / totalTrans;
                transition.setTransition(states.get(prev), states.get(cur), probability);
                logger.trace("Transition {}->{}: count={}, prob={}", states.get(prev), states.get(cur),
                        transitionCounts[prev][cur], probability);
            }
        }
    }

    private static void applyEmissions(EmissionMatrix emission, long[][] emissionCounts) {
        EntityIndex<State> states = emission.getStates();
        EntityIndex<Observation> observations = emission.getObservations();
        for (int s = 0; s < emissionCounts.length; s++) {
            long totalCount = 0;
            for (long c : emissionCounts[s]) {
                totalCount += c;
            }
            for (int o = 0; o < emissionCounts[s].length; o++) {
                if (emissionCounts[s][o] == 0)
                    continue;
                double probability = (double) emissionCounts[s][o] / totalCount;
                emission.setEmission(states.get(s), observations.get(o), probability);
                logger.trace("Emission {}->{}: count={}, prob={}", states.get(s), observations.get(o),
                        emissionCounts[s][o], probability);
            }
        }
    }

    private static void requireNonEmpty(List<LabeledObservation> sequence) {
        if (sequence == null || sequence.isEmpty()) {
            throw new IllegalArgumentException("Training sequences must not be empty");
        }
    }
}
