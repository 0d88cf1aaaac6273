package com.hmmtagger.server.ai.model;

import com.hmmtagger.server.ai.EntityIndex;
import com.hmmtagger.server.ai.InvalidProbabilityException;
import com.hmmtagger.server.ai.Observation;
import com.hmmtagger.server.ai.State;
import com.hmmtagger.server.ai.UnregisteredEntityException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static com.hmmtagger.server.ai.model.ModelFixtures.*;
import static org.junit.jupiter.api.Assertions.*;

class ProbabilityMatrixTest {

    private static final double[] VALID = { 0.0, Double.MIN_VALUE, 0.25, 1 / 3.0, 0.5, 1.0 };
    private static final double[] INVALID = { -0.1, -Double.MIN_VALUE, 1.0000001, Double.NaN,
            Double.POSITIVE_INFINITY, Double.NEGATIVE_INFINITY };

    @Test
    void testSetThenGetReturnsExactValue() {
        InitialStateVector initial = new InitialStateVector(partOfSpeechStates());
        TransitionMatrix transition = new TransitionMatrix(partOfSpeechStates());
        EmissionMatrix emission = new EmissionMatrix(partOfSpeechStates(), words());

        for (double p : VALID) {
            initial.setProbability(NOUN, p);
            assertEquals(p, initial.getProbability(NOUN), 0.0);

            transition.setTransition(NOUN, ADJECTIVE, p);
            assertEquals(p, transition.getTransition(NOUN, ADJECTIVE), 0.0);

            emission.setEmission(ADJECTIVE, CRAZY, p);
            assertEquals(p, emission.getEmission(ADJECTIVE, CRAZY), 0.0);
        }
    }

    @Test
    void testInvalidWritesLeavePriorValue() {
        InitialStateVector initial = new InitialStateVector(partOfSpeechStates());
        TransitionMatrix transition = new TransitionMatrix(partOfSpeechStates());
        EmissionMatrix emission = new EmissionMatrix(partOfSpeechStates(), words());
        initial.setProbability(NOUN, 0.7);
        transition.setTransition(NOUN, NOUN, 0.6);
        emission.setEmission(NOUN, CLOWN, 0.4);

        for (double p : INVALID) {
            assertThrows(InvalidProbabilityException.class, () -> initial.setProbability(NOUN, p));
            assertThrows(InvalidProbabilityException.class, () -> transition.setTransition(NOUN, NOUN, p));
            assertThrows(InvalidProbabilityException.class, () -> emission.setEmission(NOUN, CLOWN, p));
        }

        assertEquals(0.7, initial.getProbability(NOUN), 0.0);
        assertEquals(0.6, transition.getTransition(NOUN, NOUN), 0.0);
        assertEquals(0.4, emission.getEmission(NOUN, CLOWN), 0.0);
    }

    @Test
    void testInvalidProbabilityReason() {
        InitialStateVector initial = new InitialStateVector(partOfSpeechStates());

        InvalidProbabilityException range = assertThrows(InvalidProbabilityException.class,
                () -> initial.setProbability(NOUN, 1.5));
        assertEquals(InvalidProbabilityException.Reason.OUT_OF_RANGE, range.getReason());
        assertEquals(1.5, range.getValue(), 0.0);

        InvalidProbabilityException nan = assertThrows(InvalidProbabilityException.class,
                () -> initial.setProbability(NOUN, Double.NaN));
        assertEquals(InvalidProbabilityException.Reason.NOT_FINITE, nan.getReason());

        InvalidProbabilityException inf = assertThrows(InvalidProbabilityException.class,
                () -> initial.setProbability(NOUN, Double.POSITIVE_INFINITY));
        assertEquals(InvalidProbabilityException.Reason.NOT_FINITE, inf.getReason());
    }

    @Test
    void testUnregisteredEntitiesFailOnEveryMatrix() {
        State verb = State.of("V");
        Observation dog = Observation.of("dog");
        InitialStateVector initial = new InitialStateVector(partOfSpeechStates());
        TransitionMatrix transition = new TransitionMatrix(partOfSpeechStates());
        EmissionMatrix emission = new EmissionMatrix(partOfSpeechStates(), words());

        assertThrows(UnregisteredEntityException.class, () -> initial.getProbability(verb));
        assertThrows(UnregisteredEntityException.class, () -> initial.setProbability(verb, 0.5));
        assertThrows(UnregisteredEntityException.class, () -> transition.getTransition(NOUN, verb));
        assertThrows(UnregisteredEntityException.class, () -> transition.setTransition(verb, NOUN, 0.5));
        assertThrows(UnregisteredEntityException.class, () -> emission.getEmission(verb, CLOWN));
        assertThrows(UnregisteredEntityException.class, () -> emission.getEmission(NOUN, dog));
        assertThrows(UnregisteredEntityException.class, () -> emission.setEmission(NOUN, dog, 0.5));
    }

    @Test
    void testFullRoundTripHasNoCrossCellInterference() {
        EntityIndex<State> states = EntityIndex.of(List.of(State.of("s0"), State.of("s1"), State.of("s2")));
        EntityIndex<Observation> observations = EntityIndex.of(
                List.of(Observation.of("a"), Observation.of("b"), Observation.of("c"), Observation.of("d")));
        TransitionMatrix transition = new TransitionMatrix(states);
        EmissionMatrix emission = new EmissionMatrix(states, observations);

        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                transition.setTransition(states.get(i), states.get(j), (i * 3 + j) / 9.0);
            }
            for (int o = 0; o < 4; o++) {
                emission.setEmission(states.get(i), observations.get(o), (i * 4 + o) / 12.0);
            }
        }

        for (int i = 0; i < 3; i++) {
            for (int j = 0; j < 3; j++) {
                assertEquals((i * 3 + j) / 9.0, transition.getTransition(states.get(i), states.get(j)), 0.0);
                assertEquals((i * 3 + j) / 9.0, transition.getAt(i, j), 0.0);
            }
            for (int o = 0; o < 4; o++) {
                assertEquals((i * 4 + o) / 12.0, emission.getEmission(states.get(i), observations.get(o)), 0.0);
            }
        }
    }

    @Test
    void testIntegerAccessOutOfRange() {
        InitialStateVector initial = new InitialStateVector(partOfSpeechStates());
        TransitionMatrix transition = new TransitionMatrix(partOfSpeechStates());
        EmissionMatrix emission = new EmissionMatrix(partOfSpeechStates(), words());

        assertThrows(IndexOutOfBoundsException.class, () -> initial.getAt(2));
        assertThrows(IndexOutOfBoundsException.class, () -> transition.getAt(0, -1));
        assertThrows(IndexOutOfBoundsException.class, () -> emission.getAt(0, 4));
    }

    @Test
    void testDimensionsFollowIndices() {
        EmissionMatrix emission = new EmissionMatrix(partOfSpeechStates(), words());
        assertEquals(2, emission.getStateCount());
        assertEquals(4, emission.getObservationCount());
        assertTrue(emission.getStates().isFrozen());
        assertTrue(emission.getObservations().isFrozen());
    }
}
