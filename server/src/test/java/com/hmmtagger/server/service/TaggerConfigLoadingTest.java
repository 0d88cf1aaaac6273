package com.hmmtagger.server.service;

import com.hmmtagger.server.ai.State;
import com.hmmtagger.server.ai.UnregisteredEntityException;
import com.hmmtagger.server.ai.inference.ViterbiResult;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class TaggerConfigLoadingTest {

    @Test
    public void testLoadConfigFromDefaultFile() {
        TaggerService service = new TaggerService();

        TaggerConfig config = service.loadConfig();
        assertNotNull(config);
        assertEquals("killer-clown", config.modelName);
        assertEquals("v1", config.modelVersion);
        assertEquals("/corpus/killer_clown.txt", config.corpusResource);
        assertFalse(config.cache.enabled);
        assertTrue(config.validation.checkRowSums);
        assertEquals(1.0e-6, config.validation.rowSumTolerance, 1e-12);
    }

    @Test
    public void testDefaultsWhenFieldsMissing() {
        TaggerConfig defaults = new TaggerConfig();
        assertEquals("default", defaults.modelName);
        assertNotNull(defaults.cache);
        assertFalse(defaults.cache.enabled);
        assertNull(defaults.hmm_data_directory);
    }

    @Test
    public void testServiceTrainsFromConfiguredCorpus() throws Exception {
        TaggerService service = new TaggerService();
        assertFalse(service.isReady());

        service.initialize();

        assertTrue(service.isReady());
        assertEquals(2, service.getModel().getStates().size());
        assertEquals(4, service.getModel().getObservations().size());

        ViterbiResult result = service.tag(List.of("killer", "crazy", "clown", "problem"));
        assertEquals("killer/N crazy/A clown/N problem/N", result.toString());
        assertEquals(State.of("A"), result.getStates().get(1));

        assertEquals(0.006, service.evaluate(List.of("killer", "crazy", "clown", "problem"), false), 1e-9);
        assertThrows(UnregisteredEntityException.class, () -> service.tag(List.of("killer", "dog")));
        assertThrows(IllegalArgumentException.class, () -> service.evaluate(List.of(), true));
    }

    @Test
    public void testQueriesBeforeTrainingFail() {
        TaggerService service = new TaggerService();
        assertThrows(IllegalStateException.class, () -> service.tag(List.of("killer")));
    }
}
