package com.hmmtagger.server.ai.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hmmtagger.server.ai.model.ModelFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class HiddenMarkovModelTest {

    private static final double EPSILON = 1e-6;

    @Test
    void testPairwiseProbability() {
        HiddenMarkovModel hmm = killerClown();

        // P(NN | killer clown)
        assertEquals(0.04, hmm.getProbability(KILLER.as(NOUN), CLOWN.as(NOUN)), EPSILON);
        // adjective emissions of clown/killer are zero
        assertEquals(0.0, hmm.getProbability(KILLER.as(ADJECTIVE), CLOWN.as(ADJECTIVE)), EPSILON);
        assertEquals(0.0, hmm.getProbability(KILLER.as(ADJECTIVE), CLOWN.as(NOUN)), EPSILON);
        assertEquals(0.0, hmm.getProbability(KILLER.as(NOUN), CLOWN.as(ADJECTIVE)), EPSILON);
    }

    @Test
    void testTablesMustShareStateIndex() {
        InitialStateVector initial = new InitialStateVector(partOfSpeechStates());
        TransitionMatrix transition = new TransitionMatrix(partOfSpeechStates());
        EmissionMatrix emission = new EmissionMatrix(partOfSpeechStates(), words());

        assertThrows(IllegalArgumentException.class, () -> new HiddenMarkovModel(initial, transition, emission));
    }

    @Test
    void testStochasticModelHasNoViolations() {
        assertTrue(killerClown().findNonStochasticRows(EPSILON).isEmpty());
        assertTrue(threeState().findNonStochasticRows(EPSILON).isEmpty());
    }

    @Test
    void testNonStochasticRowsAreReportedNotRepaired() {
        HiddenMarkovModel hmm = killerClown();
        hmm.getTransition().setTransition(NOUN, NOUN, 0.2);
        hmm.getInitial().setProbability(ADJECTIVE, 0.0);

        List<String> violations = hmm.findNonStochasticRows(EPSILON);

        assertEquals(2, violations.size());
        assertTrue(violations.get(0).startsWith("initial"));
        assertTrue(violations.get(1).startsWith("transition row N"));
        assertEquals(0.2, hmm.getTransition().getTransition(NOUN, NOUN), 0.0);
    }
}
