package com.hmmtagger.server.ai.inference;

import com.hmmtagger.server.ai.EntityIndex;
import com.hmmtagger.server.ai.Observation;
import com.hmmtagger.server.ai.State;
import com.hmmtagger.server.ai.model.EmissionMatrix;
import com.hmmtagger.server.ai.model.InitialStateVector;
import com.hmmtagger.server.ai.model.TransitionMatrix;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Finds the single most probable state sequence for an observation sequence.
 * <p>
 * The lattice is kept as two flat {@code [timestep][state]} tables: the best
 * path probability ending in each cell and the state index of its
 * predecessor on that path. Ties are broken in favour of the state registered
 * first. Values are not normalized, so very long sequences can underflow to
 * zero.
 */
public class ViterbiDecoder {
    private static final Logger logger = LoggerFactory.getLogger(ViterbiDecoder.class);
    private static final int NO_PARENT = -1;

    private final InitialStateVector initial;
    private final TransitionMatrix transition;
    private final EmissionMatrix emission;

    public ViterbiDecoder(InitialStateVector initial, TransitionMatrix transition, EmissionMatrix emission) {
        ModelChecks.requireSameStates(initial, transition, emission);
        this.initial = initial;
        this.transition = transition;
        this.emission = emission;
    }

    public ViterbiResult decode(List<Observation> observations) {
        int[] obs = ModelChecks.resolveObservations(emission, observations);
        EntityIndex<State> states = initial.getStates();
        int numStates = states.size();
        int length = obs.length;

        double[][] delta = new double[length][numStates];
        int[][] parent = new int[length][numStates];

        for (int s = 0; s < numStates; s++) {
            delta[0][s] = initial.getAt(s) * emission.getAt(s, obs[0]);
            parent[0][s] = NO_PARENT;
        }

        double[] candidates = new double[numStates];
        for (int t = 1; t < length; t++) {
            for (int s = 0; s < numStates; s++) {
                double e = emission.getAt(s, obs[t]);
                for (int p = 0; p < numStates; p++) {
                    candidates[p] = delta[t - 1][p] * transition.getAt(p, s) * e;
                }
                int best = MathUtil.argmax(candidates);
                delta[t][s] = candidates[best];
                parent[t][s] = best;
            }
            if (logger.isTraceEnabled()) {
                logger.trace("t={} delta={}", t, Arrays.toString(delta[t]));
            }
        }

        // backtrace from the best terminal cell
        List<PathStep> path = new ArrayList<>(length);
        int current = MathUtil.argmax(delta[length - 1]);
        for (int t = length - 1; t >= 0; t--) {
            path.add(new PathStep(states.get(current), observations.get(t), delta[t][current]));
            current = parent[t][current];
        }
        Collections.reverse(path);

        ViterbiResult result = new ViterbiResult(path);
        logger.debug("Decoded {} observations: {}", length, result);
        return result;
    }
}
