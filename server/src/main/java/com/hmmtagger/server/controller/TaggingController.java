package com.hmmtagger.server.controller;

import com.hmmtagger.server.ai.LabeledObservation;
import com.hmmtagger.server.ai.Observation;
import com.hmmtagger.server.ai.State;
import com.hmmtagger.server.ai.inference.PathStep;
import com.hmmtagger.server.ai.inference.ViterbiResult;
import com.hmmtagger.server.service.CacheControlService;
import com.hmmtagger.server.service.TaggerConfig;
import com.hmmtagger.server.service.TaggerService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.ArrayList;
import java.util.List;

@RestController
public class TaggingController {

    private static final Logger logger = LoggerFactory.getLogger(TaggingController.class);
    private static final String NOT_READY = "Model is still training, please try again later.";

    private final TaggerService taggerService;
    private final CacheControlService cacheControlService;

    public TaggingController(TaggerService taggerService, CacheControlService cacheControlService) {
        this.taggerService = taggerService;
        this.cacheControlService = cacheControlService;
    }

    public static class SequenceRequest {
        public List<String> observations;
        public boolean logarithmic;
    }

    public static class TokenRequest {
        public String state;
        public String observation;

        LabeledObservation toLabeled() {
            return Observation.of(observation).as(State.of(state));
        }
    }

    public static class PairRequest {
        public TokenRequest left;
        public TokenRequest right;
    }

    public static class TaggedToken {
        private final String observation;
        private final String state;
        private final double probability;

        TaggedToken(PathStep step) {
            this.observation = step.getObservation().getName();
            this.state = step.getState().getName();
            this.probability = step.getProbability();
        }

        public String getObservation() {
            return observation;
        }

        public String getState() {
            return state;
        }

        public double getProbability() {
            return probability;
        }
    }

    public static class TagResponse {
        private final List<TaggedToken> tokens = new ArrayList<>();
        private final String tagged;

        TagResponse(ViterbiResult result) {
            for (PathStep step : result.getSteps()) {
                tokens.add(new TaggedToken(step));
            }
            this.tagged = result.toString();
        }

        public List<TaggedToken> getTokens() {
            return tokens;
        }

        public String getTagged() {
            return tagged;
        }
    }

    public static class ScoreResponse {
        private final double value;
        private final boolean logarithmic;

        ScoreResponse(double value, boolean logarithmic) {
            this.value = value;
            this.logarithmic = logarithmic;
        }

        public double getValue() {
            return value;
        }

        public boolean isLogarithmic() {
            return logarithmic;
        }
    }

    @PostMapping("/tag")
    public ResponseEntity<?> tag(@RequestBody SequenceRequest request) {
        if (!taggerService.isReady()) {
            return ResponseEntity.status(503).body(NOT_READY);
        }
        logger.info("Received tagging request.");
        try {
            ViterbiResult result = taggerService.tag(request.observations);
            return ResponseEntity.ok(new TagResponse(result));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }

    @PostMapping("/evaluate")
    public ResponseEntity<?> evaluate(@RequestBody SequenceRequest request) {
        if (!taggerService.isReady()) {
            return ResponseEntity.status(503).body(NOT_READY);
        }
        try {
            double value = taggerService.evaluate(request.observations, request.logarithmic);
            return ResponseEntity.ok(new ScoreResponse(value, request.logarithmic));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }

    @PostMapping("/probability")
    public ResponseEntity<?> probability(@RequestBody PairRequest request) {
        if (!taggerService.isReady()) {
            return ResponseEntity.status(503).body(NOT_READY);
        }
        if (request.left == null || request.right == null) {
            return ResponseEntity.badRequest().body("Both left and right tokens are required.");
        }
        try {
            double p = taggerService.probability(request.left.toLabeled(), request.right.toLabeled());
            return ResponseEntity.ok(new ScoreResponse(p, false));
        } catch (IllegalArgumentException e) {
            return ResponseEntity.badRequest().body(e.getMessage());
        }
    }

    @DeleteMapping("/cache")
    public ResponseEntity<?> clearCache() {
        if (!taggerService.isReady()) {
            return ResponseEntity.status(503).body(NOT_READY);
        }
        TaggerConfig config = taggerService.getConfig();
        int removed = cacheControlService.clearModel(config.modelName, config.modelVersion);
        return ResponseEntity.ok(removed);
    }
}
