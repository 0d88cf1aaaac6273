package com.hmmtagger.server.service;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Bound from {@code hmm_config.json}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class TaggerConfig {
    public String modelName = "default";
    public String modelVersion = "v1";
    public String corpusResource = "/corpus/killer_clown.txt";
    public String hmm_data_directory;
    public CacheConfig cache = new CacheConfig();
    public ValidationConfig validation = new ValidationConfig();

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CacheConfig {
        public boolean enabled = false;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ValidationConfig {
        // report distributions that do not sum to one after training
        public boolean checkRowSums = true;
        public double rowSumTolerance = 1e-6;
    }
}
