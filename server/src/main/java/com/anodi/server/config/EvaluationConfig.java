package com.anodi.server.config;

import com.anodi.server.ai.ConfigurationException;
import com.anodi.server.ai.EvaluationSettings;
import com.anodi.server.ai.TieBreak;
import com.anodi.server.ai.divergence.LevelCombinationPolicy;
import com.anodi.server.ai.divergence.LogBase;
import com.anodi.server.ai.divergence.MeanLevelCombination;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;

/**
 * Contents of anodi_config.json. Missing fields take the defaults of
 * {@link EvaluationSettings#defaults()}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public class EvaluationConfig {

    public static final String RESOURCE = "/anodi_config.json";

    public static class CacheConfig {
        public Boolean enabled;
        public String fileName;
    }

    public static class SamplingConfig {
        public Integer count;
        public Integer size;
        public Long seed;
        public List<Integer> rotations;
    }

    public Integer patchSize;
    public List<Integer> factors;
    public String tieBreak;
    public String logBase;
    public String combination;
    public Boolean parallel;
    public String anodi_data_directory;
    public CacheConfig cache;
    public SamplingConfig sampling;

    public static EvaluationConfig load(InputStream jsonStream) {
        try {
            ObjectMapper mapper = new ObjectMapper();
            return mapper.readValue(jsonStream, EvaluationConfig.class);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read evaluation config from JSON", e);
        }
    }

    /**
     * Loads {@value #RESOURCE} from the classpath, or an empty config if it is absent.
     */
    public static EvaluationConfig loadDefault() {
        try (InputStream is = EvaluationConfig.class.getResourceAsStream(RESOURCE)) {
            if (is == null) {
                return new EvaluationConfig();
            }
            return load(is);
        } catch (IOException e) {
            throw new RuntimeException("Failed to close " + RESOURCE, e);
        }
    }

    public EvaluationSettings toSettings() {
        EvaluationSettings defaults = EvaluationSettings.defaults();
        int n = patchSize != null ? patchSize : defaults.getPatchSize();
        int[] f = defaults.getFactors();
        if (factors != null) {
            f = new int[factors.size()];
            for (int i = 0; i < f.length; i++) {
                if (factors.get(i) == null) {
                    throw new ConfigurationException("Resolution factor at position " + i + " is null");
                }
                f[i] = factors.get(i);
            }
        }
        return new EvaluationSettings(n, f, parseTieBreak(), parseLogBase(), parseCombination(),
                parallel != null ? parallel : defaults.isParallel());
    }

    private TieBreak parseTieBreak() {
        if (tieBreak == null || tieBreak.trim().isEmpty()) {
            return TieBreak.ZERO;
        }
        switch (tieBreak.trim().toLowerCase()) {
            case "0":
            case "zero":
                return TieBreak.ZERO;
            case "1":
            case "one":
                return TieBreak.ONE;
            default:
                throw new ConfigurationException("Unknown tieBreak '" + tieBreak + "', expected zero or one");
        }
    }

    private LogBase parseLogBase() {
        if (logBase == null || logBase.trim().isEmpty()) {
            return LogBase.NATURAL;
        }
        switch (logBase.trim().toLowerCase()) {
            case "e":
            case "natural":
                return LogBase.NATURAL;
            case "2":
            case "base2":
            case "base_2":
                return LogBase.BASE_2;
            default:
                throw new ConfigurationException("Unknown logBase '" + logBase + "', expected natural or 2");
        }
    }

    private LevelCombinationPolicy parseCombination() {
        if (combination == null || combination.trim().isEmpty()
                || MeanLevelCombination.INSTANCE.getName().equalsIgnoreCase(combination.trim())) {
            return MeanLevelCombination.INSTANCE;
        }
        throw new ConfigurationException("Unknown combination '" + combination + "', expected mean");
    }
}
