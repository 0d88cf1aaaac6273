package com.hmmtagger.server.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.hmmtagger.db.ForwardResultDao;
import com.hmmtagger.db.ObservationSequenceDao;
import com.hmmtagger.db.SqliteInitializer;
import com.hmmtagger.server.ai.CachedSequenceEvaluator;
import com.hmmtagger.server.ai.EntityIndex;
import com.hmmtagger.server.ai.LabeledObservation;
import com.hmmtagger.server.ai.Observation;
import com.hmmtagger.server.ai.State;
import com.hmmtagger.server.ai.TaggedCorpus;
import com.hmmtagger.server.ai.TaggedCorpusReader;
import com.hmmtagger.server.ai.inference.ViterbiResult;
import com.hmmtagger.server.ai.learning.SupervisedEstimator;
import com.hmmtagger.server.ai.model.HiddenMarkovModel;
import com.hmmtagger.server.util.DataPathResolver;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.InputStream;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

@Service
public class TaggerService {

    private static final Logger logger = LoggerFactory.getLogger(TaggerService.class);
    private static final String CONFIG_RESOURCE = "/hmm_config.json";

    private final TaggedCorpusReader corpusReader = new TaggedCorpusReader();
    private final SupervisedEstimator estimator = new SupervisedEstimator();

    private volatile TaggerConfig config = new TaggerConfig();
    private volatile HiddenMarkovModel model;
    private volatile CachedSequenceEvaluator cachedEvaluator;
    private volatile boolean isReady = false;

    public boolean isReady() {
        return isReady;
    }

    public HiddenMarkovModel getModel() {
        return model;
    }

    public TaggerConfig getConfig() {
        return config;
    }

    @PostConstruct
    public void init() {
        new Thread(() -> {
            try {
                initialize();
            } catch (Exception e) {
                logger.error("Failed to train tagger model", e);
            }
        }, "tagger-training").start();
    }

    /**
     * Loads configuration and corpus, trains the model and marks the service
     * ready. Blocks until done.
     */
    public void initialize() throws IOException {
        logger.info("Initializing tagger service...");
        TaggerConfig cfg = loadConfig();
        TaggedCorpus corpus = loadCorpus(cfg.corpusResource);
        if (corpus.getSequences().isEmpty()) {
            logger.error("No training sequences found in {}", cfg.corpusResource);
            return;
        }

        HiddenMarkovModel trained = train(corpus);

        if (cfg.validation != null && cfg.validation.checkRowSums) {
            for (String violation : trained.findNonStochasticRows(cfg.validation.rowSumTolerance)) {
                logger.warn("Model {}/{}: {}", cfg.modelName, cfg.modelVersion, violation);
            }
        }

        CachedSequenceEvaluator cached = null;
        if (cfg.cache != null && cfg.cache.enabled) {
            String dbPath = DataPathResolver.resolveDbPath(cfg.hmm_data_directory);
            try {
                SqliteInitializer.initialize(dbPath);
                logger.info("Initialized SQLite cache at {}", dbPath);
                cached = new CachedSequenceEvaluator(trained.getEvaluator(), cfg.modelName, cfg.modelVersion,
                        new ObservationSequenceDao(dbPath), new ForwardResultDao(dbPath));
            } catch (SQLException e) {
                logger.error("Failed to initialize SQLite cache, evaluating without it", e);
            }
        }

        this.config = cfg;
        this.model = trained;
        this.cachedEvaluator = cached;
        this.isReady = true;
        logger.info("Tagger model {}/{} ready: {} sequences, {} tokens, {} states, {} observations",
                cfg.modelName, cfg.modelVersion, corpus.getSequences().size(), corpus.getTokenCount(),
                trained.getStates().size(), trained.getObservations().size());
    }

    public HiddenMarkovModel train(TaggedCorpus corpus) {
        EntityIndex<State> states = EntityIndex.of(corpus.getStates());
        EntityIndex<Observation> observations = EntityIndex.of(corpus.getObservations());
        return estimator.train(states, observations, corpus.getSequences());
    }

    public ViterbiResult tag(List<String> words) {
        return requireModel().decode(toObservations(words));
    }

    public double evaluate(List<String> words, boolean logarithmic) {
        HiddenMarkovModel m = requireModel();
        List<Observation> observations = toObservations(words);
        CachedSequenceEvaluator cached = cachedEvaluator;
        if (cached != null) {
            return cached.evaluate(observations, logarithmic);
        }
        return m.evaluate(observations, logarithmic);
    }

    public double probability(LabeledObservation left, LabeledObservation right) {
        return requireModel().getProbability(left, right);
    }

    TaggerConfig loadConfig() {
        try (InputStream is = getClass().getResourceAsStream(CONFIG_RESOURCE)) {
            if (is == null) {
                logger.warn("{} not found on classpath, using defaults", CONFIG_RESOURCE);
                return new TaggerConfig();
            }
            return new ObjectMapper().readValue(is, TaggerConfig.class);
        } catch (Exception e) {
            logger.warn("Failed to load {}, using defaults. Error: {}", CONFIG_RESOURCE, e.getMessage());
            return new TaggerConfig();
        }
    }

    TaggedCorpus loadCorpus(String resource) throws IOException {
        try (InputStream is = getClass().getResourceAsStream(resource)) {
            if (is == null) {
                throw new IOException("Training corpus not found on classpath: " + resource);
            }
            return corpusReader.read(is);
        }
    }

    private HiddenMarkovModel requireModel() {
        HiddenMarkovModel m = model;
        if (m == null) {
            throw new IllegalStateException("Model is still training");
        }
        return m;
    }

    private static List<Observation> toObservations(List<String> words) {
        List<Observation> observations = new ArrayList<>();
        if (words != null) {
            for (String word : words) {
                observations.add(Observation.of(word));
            }
        }
        return observations;
    }
}
