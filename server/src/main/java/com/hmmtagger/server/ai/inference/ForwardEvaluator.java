package com.hmmtagger.server.ai.inference;

import com.hmmtagger.server.ai.Observation;
import com.hmmtagger.server.ai.model.EmissionMatrix;
import com.hmmtagger.server.ai.model.InitialStateVector;
import com.hmmtagger.server.ai.model.TransitionMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;

/**
 * Scores how likely the model is to have produced an observation sequence,
 * summing over all state paths with the forward recurrence.
 * <p>
 * Each time step is divided by its own sum so the stored values stay in
 * [0, 1] however long the sequence is. A step whose sum is zero is left as is
 * and drives the total to zero (negative infinity in log space).
 */
public class ForwardEvaluator {
    private static final Logger logger = LoggerFactory.getLogger(ForwardEvaluator.class);

    private final InitialStateVector initial;
    private final TransitionMatrix transition;
    private final EmissionMatrix emission;

    public ForwardEvaluator(InitialStateVector initial, TransitionMatrix transition, EmissionMatrix emission) {
        ModelChecks.requireSameStates(initial, transition, emission);
        this.initial = initial;
        this.transition = transition;
        this.emission = emission;
    }

    public double evaluate(List<Observation> observations, boolean logarithmic) {
        return forward(observations).get(logarithmic);
    }

    /**
     * Maps the sequence onto the model's observation indices, failing for an
     * empty sequence or an unregistered observation.
     */
    public int[] resolve(List<Observation> observations) {
        return ModelChecks.resolveObservations(emission, observations);
    }

    public ForwardResult forward(List<Observation> observations) {
        int[] obs = resolve(observations);
        int numStates = initial.getStateCount();
        double[] scalingFactors = new double[obs.length];

        double[] alpha = new double[numStates];
        for (int s = 0; s < numStates; s++) {
            alpha[s] = initial.getAt(s) * emission.getAt(s, obs[0]);
        }
        scalingFactors[0] = MathUtil.sum(alpha);
        MathUtil.scale(alpha, scalingFactors[0]);

        double[] next = new double[numStates];
        for (int t = 1; t < obs.length; t++) {
            for (int s = 0; s < numStates; s++) {
                double incoming = 0.0;
                for (int p = 0; p < numStates; p++) {
                    incoming += alpha[p] * transition.getAt(p, s);
                }
                next[s] = emission.getAt(s, obs[t]) * incoming;
            }
            scalingFactors[t] = MathUtil.sum(next);
            MathUtil.scale(next, scalingFactors[t]);

            if (scalingFactors[t] == 0.0) {
                logger.debug("Forward probability collapsed to zero at step {} ({})", t, observations.get(t));
            }

            double[] tmp = alpha;
            alpha = next;
            next = tmp;
        }

        ForwardResult result = new ForwardResult(scalingFactors);
        logger.debug("Evaluated {} observations: logLikelihood={}", obs.length, result.getLogLikelihood());
        return result;
    }
}
