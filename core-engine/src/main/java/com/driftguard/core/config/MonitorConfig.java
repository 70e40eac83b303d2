package com.driftguard.core.config;

import com.driftguard.core.detection.DetectorKind;
import com.driftguard.core.drift.EmbedderType;
import com.driftguard.core.drift.SimilarityMethod;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Top-level POJO for the {@code driftguard.yml} configuration.
 *
 * <p>
 * Expected YAML structure (every key is optional; defaults shown):
 * </p>
 *
 * <pre>
 * lookupDirectory: lookups
 * anomaly:
 *   enabled: true
 *   fields: [response_time, token_count, confidence_score]
 *   method: zscore          # zscore | iqr | isolation | trend | all
 *   threshold: 2.0
 *   window: 100
 *   includeAnalysis: true
 * baseline:
 *   enabled: true
 *   metric: response_time
 *   baselineField:          # inline baseline field, optional
 *   modelField: model_id
 *   comparison: percentage
 *   generateAlerts: true
 *   baselineFile: model_baselines.csv
 *   thresholdFile: alert_thresholds.csv
 * drift:
 *   enabled: true
 *   field: response
 *   threshold: 0.8
 *   windowSize: 100
 *   embedder: features      # features | hash
 *   baselineFile: baseline_texts.csv
 * semantic:
 *   enabled: false
 *   field1: prompt
 *   field2: response
 *   method: cosine          # cosine | euclidean | manhattan
 *   includeAnalysis: true
 * metrics:
 *   enabled: false
 *   responseField: response
 *   promptField: prompt
 *   timeField: response_time
 *   tokenField: token_count
 *   confidenceField: confidence_score
 *   includeTrends: false
 * </pre>
 *
 * <p>
 * Call {@link #validate()} after loading.
 * </p>
 *
 * @since 1.0.0
 */
public class MonitorConfig implements Serializable {

    private static final long serialVersionUID = 1L;

    /** Directory holding the CSV lookup tables. */
    private String lookupDirectory = "lookups";

    private AnomalySettings anomaly = new AnomalySettings();
    private BaselineSettings baseline = new BaselineSettings();
    private DriftSettings drift = new DriftSettings();
    private SemanticSettings semantic = new SemanticSettings();
    private MetricsSettings metrics = new MetricsSettings();

    // ---------------------------------------------------------------
    // Validation
    // ---------------------------------------------------------------

    /**
     * Validate every section. Collects all errors and throws a single
     * exception.
     *
     * @throws IllegalStateException if one or more settings are invalid
     */
    public void validate() {
        List<String> errors = new ArrayList<>();
        if (isBlank(lookupDirectory)) {
            errors.add("'lookupDirectory' is required");
        }
        anomaly.collectErrors(errors);
        baseline.collectErrors(errors);
        drift.collectErrors(errors);
        semantic.collectErrors(errors);
        metrics.collectErrors(errors);

        if (!errors.isEmpty()) {
            throw new IllegalStateException(
                    "Monitor configuration validation failed:\n  - "
                            + String.join("\n  - ", errors));
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

    // ---------------------------------------------------------------
    // Getters / Setters
    // ---------------------------------------------------------------

    public String getLookupDirectory() {
        return lookupDirectory;
    }

    public void setLookupDirectory(String lookupDirectory) {
        this.lookupDirectory = lookupDirectory;
    }

    public AnomalySettings getAnomaly() {
        return anomaly;
    }

    public void setAnomaly(AnomalySettings anomaly) {
        this.anomaly = anomaly != null ? anomaly : new AnomalySettings();
    }

    public BaselineSettings getBaseline() {
        return baseline;
    }

    public void setBaseline(BaselineSettings baseline) {
        this.baseline = baseline != null ? baseline : new BaselineSettings();
    }

    public DriftSettings getDrift() {
        return drift;
    }

    public void setDrift(DriftSettings drift) {
        this.drift = drift != null ? drift : new DriftSettings();
    }

    public SemanticSettings getSemantic() {
        return semantic;
    }

    public void setSemantic(SemanticSettings semantic) {
        this.semantic = semantic != null ? semantic : new SemanticSettings();
    }

    public MetricsSettings getMetrics() {
        return metrics;
    }

    public void setMetrics(MetricsSettings metrics) {
        this.metrics = metrics != null ? metrics : new MetricsSettings();
    }

    @Override
    public String toString() {
        return "MonitorConfig{" +
                "lookupDirectory='" + lookupDirectory + '\'' +
                ", anomaly=" + anomaly +
                ", baseline=" + baseline +
                ", drift=" + drift +
                ", semantic=" + semantic +
                ", metrics=" + metrics +
                '}';
    }

    // ---------------------------------------------------------------
    // Sections
    // ---------------------------------------------------------------

    /**
     * Windowed anomaly detection over numeric fields.
     */
    public static class AnomalySettings implements Serializable {

        private static final long serialVersionUID = 1L;

        public static final double MIN_THRESHOLD = 0.1;
        public static final double MAX_THRESHOLD = 10.0;
        public static final int MIN_WINDOW = 10;
        public static final int MAX_WINDOW = 1000;

        private boolean enabled = true;
        private List<String> fields = new ArrayList<>(List.of("response_time", "token_count", "confidence_score"));
        private String method = "zscore";
        private double threshold = 2.0;
        private int window = 100;
        private boolean includeAnalysis = true;

        void collectErrors(List<String> errors) {
            if (enabled && fields.isEmpty()) {
                errors.add("anomaly.fields must list at least one field");
            }
            for (String field : fields) {
                if (isBlank(field)) {
                    errors.add("anomaly.fields must not contain blank names");
                    break;
                }
            }
            try {
                DetectorKind.parseSelection(method);
            } catch (IllegalArgumentException | NullPointerException e) {
                errors.add("anomaly.method: " + e.getMessage());
            }
            if (threshold < MIN_THRESHOLD || threshold > MAX_THRESHOLD) {
                errors.add("anomaly.threshold must be in [" + MIN_THRESHOLD + ", " + MAX_THRESHOLD
                        + "], got: " + threshold);
            }
            if (window < MIN_WINDOW || window > MAX_WINDOW) {
                errors.add("anomaly.window must be in [" + MIN_WINDOW + ", " + MAX_WINDOW + "], got: " + window);
            }
        }

        /**
         * @return the detector kinds selected by {@link #getMethod()}
         * @throws IllegalArgumentException if the method is unknown
         */
        public Set<DetectorKind> detectorKinds() {
            return DetectorKind.parseSelection(method);
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public List<String> getFields() {
            return Collections.unmodifiableList(fields);
        }

        public void setFields(List<String> fields) {
            this.fields = fields != null ? new ArrayList<>(fields) : new ArrayList<>();
        }

        public String getMethod() {
            return method;
        }

        public void setMethod(String method) {
            this.method = method;
        }

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }

        public int getWindow() {
            return window;
        }

        public void setWindow(int window) {
            this.window = window;
        }

        public boolean isIncludeAnalysis() {
            return includeAnalysis;
        }

        public void setIncludeAnalysis(boolean includeAnalysis) {
            this.includeAnalysis = includeAnalysis;
        }

        @Override
        public String toString() {
            return "AnomalySettings{enabled=" + enabled + ", fields=" + fields + ", method='" + method
                    + "', threshold=" + threshold + ", window=" + window + '}';
        }
    }

    /**
     * Comparison of one metric against per-model baselines.
     */
    public static class BaselineSettings implements Serializable {

        private static final long serialVersionUID = 1L;

        private boolean enabled = true;
        private String metric = "response_time";
        private String baselineField;
        private String modelField = "model_id";
        private String comparison = "percentage";
        private boolean generateAlerts = true;
        private String baselineFile = "model_baselines.csv";
        private String thresholdFile = "alert_thresholds.csv";

        void collectErrors(List<String> errors) {
            if (enabled && isBlank(metric)) {
                errors.add("baseline.metric is required when the baseline stage is enabled");
            }
            if (isBlank(modelField)) {
                errors.add("baseline.modelField is required");
            }
            if (isBlank(baselineFile)) {
                errors.add("baseline.baselineFile is required");
            }
            if (isBlank(thresholdFile)) {
                errors.add("baseline.thresholdFile is required");
            }
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getMetric() {
            return metric;
        }

        public void setMetric(String metric) {
            this.metric = metric;
        }

        public String getBaselineField() {
            return baselineField;
        }

        public void setBaselineField(String baselineField) {
            this.baselineField = baselineField;
        }

        public String getModelField() {
            return modelField;
        }

        public void setModelField(String modelField) {
            this.modelField = modelField;
        }

        public String getComparison() {
            return comparison;
        }

        public void setComparison(String comparison) {
            this.comparison = comparison;
        }

        public boolean isGenerateAlerts() {
            return generateAlerts;
        }

        public void setGenerateAlerts(boolean generateAlerts) {
            this.generateAlerts = generateAlerts;
        }

        public String getBaselineFile() {
            return baselineFile;
        }

        public void setBaselineFile(String baselineFile) {
            this.baselineFile = baselineFile;
        }

        public String getThresholdFile() {
            return thresholdFile;
        }

        public void setThresholdFile(String thresholdFile) {
            this.thresholdFile = thresholdFile;
        }

        @Override
        public String toString() {
            return "BaselineSettings{enabled=" + enabled + ", metric='" + metric + "', baselineField='"
                    + baselineField + "', comparison='" + comparison + "'}";
        }
    }

    /**
     * Semantic drift of a text field against the baseline texts.
     */
    public static class DriftSettings implements Serializable {

        private static final long serialVersionUID = 1L;

        public static final int MIN_WINDOW_SIZE = 1;
        public static final int MAX_WINDOW_SIZE = 10_000;

        private boolean enabled = true;
        private String field = "response";
        private double threshold = 0.8;
        private int windowSize = 100;
        private String embedder = EmbedderType.FEATURES.getId();
        private String baselineFile = "baseline_texts.csv";

        void collectErrors(List<String> errors) {
            if (enabled && isBlank(field)) {
                errors.add("drift.field is required when the drift stage is enabled");
            }
            if (threshold < 0.0 || threshold > 1.0) {
                errors.add("drift.threshold must be in [0.0, 1.0], got: " + threshold);
            }
            if (windowSize < MIN_WINDOW_SIZE || windowSize > MAX_WINDOW_SIZE) {
                errors.add("drift.windowSize must be in [" + MIN_WINDOW_SIZE + ", " + MAX_WINDOW_SIZE
                        + "], got: " + windowSize);
            }
            try {
                EmbedderType.fromName(embedder);
            } catch (IllegalArgumentException | NullPointerException e) {
                errors.add("drift.embedder: " + e.getMessage());
            }
            if (isBlank(baselineFile)) {
                errors.add("drift.baselineFile is required");
            }
        }

        public EmbedderType embedderType() {
            return EmbedderType.fromName(embedder);
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getField() {
            return field;
        }

        public void setField(String field) {
            this.field = field;
        }

        public double getThreshold() {
            return threshold;
        }

        public void setThreshold(double threshold) {
            this.threshold = threshold;
        }

        public int getWindowSize() {
            return windowSize;
        }

        public void setWindowSize(int windowSize) {
            this.windowSize = windowSize;
        }

        public String getEmbedder() {
            return embedder;
        }

        public void setEmbedder(String embedder) {
            this.embedder = embedder;
        }

        public String getBaselineFile() {
            return baselineFile;
        }

        public void setBaselineFile(String baselineFile) {
            this.baselineFile = baselineFile;
        }

        @Override
        public String toString() {
            return "DriftSettings{enabled=" + enabled + ", field='" + field + "', threshold=" + threshold
                    + ", windowSize=" + windowSize + ", embedder='" + embedder + "'}";
        }
    }

    /**
     * Similarity between two text fields of the same record.
     */
    public static class SemanticSettings implements Serializable {

        private static final long serialVersionUID = 1L;

        private boolean enabled = false;
        private String field1 = "prompt";
        private String field2 = "response";
        private String method = SimilarityMethod.COSINE.getId();
        private boolean includeAnalysis = true;

        void collectErrors(List<String> errors) {
            if (enabled && (isBlank(field1) || isBlank(field2))) {
                errors.add("semantic.field1 and semantic.field2 are required when the semantic stage is enabled");
            }
            String normalized = method == null ? "" : method.trim().toLowerCase(Locale.ROOT);
            boolean known = false;
            for (SimilarityMethod m : SimilarityMethod.values()) {
                known |= m.getId().equals(normalized);
            }
            if (!known) {
                errors.add("semantic.method: Unknown similarity method: '" + method
                        + "'. Supported: cosine, euclidean, manhattan");
            }
        }

        public SimilarityMethod similarityMethod() {
            return SimilarityMethod.fromName(method);
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getField1() {
            return field1;
        }

        public void setField1(String field1) {
            this.field1 = field1;
        }

        public String getField2() {
            return field2;
        }

        public void setField2(String field2) {
            this.field2 = field2;
        }

        public String getMethod() {
            return method;
        }

        public void setMethod(String method) {
            this.method = method;
        }

        public boolean isIncludeAnalysis() {
            return includeAnalysis;
        }

        public void setIncludeAnalysis(boolean includeAnalysis) {
            this.includeAnalysis = includeAnalysis;
        }

        @Override
        public String toString() {
            return "SemanticSettings{enabled=" + enabled + ", field1='" + field1 + "', field2='" + field2
                    + "', method='" + method + "'}";
        }
    }

    /**
     * Response quality, performance and trend metrics.
     */
    public static class MetricsSettings implements Serializable {

        private static final long serialVersionUID = 1L;

        private boolean enabled = false;
        private String responseField = "response";
        private String promptField = "prompt";
        private String timeField = "response_time";
        private String tokenField = "token_count";
        private String confidenceField = "confidence_score";
        private boolean includeTrends = false;

        void collectErrors(List<String> errors) {
            if (enabled && isBlank(responseField)) {
                errors.add("metrics.responseField is required when the metrics stage is enabled");
            }
        }

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getResponseField() {
            return responseField;
        }

        public void setResponseField(String responseField) {
            this.responseField = responseField;
        }

        public String getPromptField() {
            return promptField;
        }

        public void setPromptField(String promptField) {
            this.promptField = promptField;
        }

        public String getTimeField() {
            return timeField;
        }

        public void setTimeField(String timeField) {
            this.timeField = timeField;
        }

        public String getTokenField() {
            return tokenField;
        }

        public void setTokenField(String tokenField) {
            this.tokenField = tokenField;
        }

        public String getConfidenceField() {
            return confidenceField;
        }

        public void setConfidenceField(String confidenceField) {
            this.confidenceField = confidenceField;
        }

        public boolean isIncludeTrends() {
            return includeTrends;
        }

        public void setIncludeTrends(boolean includeTrends) {
            this.includeTrends = includeTrends;
        }

        @Override
        public String toString() {
            return "MetricsSettings{enabled=" + enabled + ", responseField='" + responseField
                    + "', includeTrends=" + includeTrends + '}';
        }
    }
}
