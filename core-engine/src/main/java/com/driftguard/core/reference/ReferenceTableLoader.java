package com.driftguard.core.reference;

import com.driftguard.core.drift.EmbeddingVector;
import com.driftguard.core.drift.TextEmbedder;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;

/**
 * Loads the CSV reference tables.
 *
 * <h3>Formats</h3>
 * <ul>
 * <li>Baselines: {@code model_id} plus arbitrary metric columns. Cells are
 * parsed as numbers, falling back to the raw string; empty cells are
 * skipped; a missing {@code model_id} maps the row to
 * {@value BaselineTable#DEFAULT_MODEL}.</li>
 * <li>Thresholds: {@code metric_name, threshold_type, warning_threshold,
 * critical_threshold, unit, description}. Rows without a metric name are
 * ignored.</li>
 * <li>Baseline texts: an {@code embedding} column holding
 * {@code [v1, v2, ...]}, or a {@code text} column that is embedded on
 * load.</li>
 * </ul>
 *
 * <h3>Failure policy</h3>
 * <p>
 * The {@code read*} methods throw on malformed content. The {@code load*}
 * methods never throw: a missing file is logged as a warning, an unreadable
 * or malformed one as an error, and an empty table is returned.
 * </p>
 *
 * @since 1.0.0
 */
public final class ReferenceTableLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ReferenceTableLoader.class);

    private static final CsvMapper CSV_MAPPER = new CsvMapper();
    private static final CsvSchema HEADER_SCHEMA = CsvSchema.emptySchema().withHeader();

    static final String MODEL_ID_COLUMN = "model_id";
    static final String METRIC_NAME_COLUMN = "metric_name";
    static final String EMBEDDING_COLUMN = "embedding";
    static final String TEXT_COLUMN = "text";

    private ReferenceTableLoader() {
        // utility class - not instantiable
    }

    // ---------------------------------------------------------------
    // Baselines
    // ---------------------------------------------------------------

    /**
     * Parse a baseline table.
     *
     * @param reader CSV content with header row
     * @return the table
     * @throws IOException if the content cannot be read or parsed
     */
    public static BaselineTable readBaselines(Reader reader) throws IOException {
        Map<String, Map<String, Object>> rows = new LinkedHashMap<>();
        for (Map<String, String> row : readRows(reader)) {
            String modelId = row.getOrDefault(MODEL_ID_COLUMN, BaselineTable.DEFAULT_MODEL);
            Map<String, Object> metrics = new LinkedHashMap<>();
            row.forEach((column, value) -> {
                if (!MODEL_ID_COLUMN.equals(column) && value != null && !value.isEmpty()) {
                    metrics.put(column, numberOrRaw(value));
                }
            });
            rows.put(modelId, metrics);
        }
        return new BaselineTable(rows);
    }

    /**
     * Load a baseline table from a file, never failing.
     *
     * @param path CSV file
     * @return the table, empty if the file is missing or malformed
     */
    public static BaselineTable loadBaselines(Path path) {
        return load(path, "Baseline", BaselineTable.empty(), ReferenceTableLoader::readBaselines);
    }

    // ---------------------------------------------------------------
    // Thresholds
    // ---------------------------------------------------------------

    /**
     * Parse a threshold table. Missing numeric columns default to {@code 0}
     * and a missing type to {@code upper}.
     *
     * @param reader CSV content with header row
     * @return the table
     * @throws IOException              if the content cannot be read or parsed
     * @throws IllegalArgumentException if a threshold cell is not numeric
     */
    public static ThresholdTable readThresholds(Reader reader) throws IOException {
        Map<String, ThresholdRule> rules = new LinkedHashMap<>();
        for (Map<String, String> row : readRows(reader)) {
            String metricName = row.get(METRIC_NAME_COLUMN);
            if (metricName == null || metricName.isEmpty()) {
                continue;
            }
            rules.put(metricName, new ThresholdRule(
                    metricName,
                    row.getOrDefault("threshold_type", "upper"),
                    parseThreshold(row, "warning_threshold"),
                    parseThreshold(row, "critical_threshold"),
                    row.getOrDefault("unit", ""),
                    row.getOrDefault("description", "")));
        }
        return new ThresholdTable(rules);
    }

    /**
     * Load a threshold table from a file, never failing.
     *
     * @param path CSV file
     * @return the table, empty if the file is missing or malformed
     */
    public static ThresholdTable loadThresholds(Path path) {
        return load(path, "Threshold", ThresholdTable.empty(), ReferenceTableLoader::readThresholds);
    }

    // ---------------------------------------------------------------
    // Baseline embeddings
    // ---------------------------------------------------------------

    /**
     * Parse baseline embeddings. When the header has an
     * {@value #EMBEDDING_COLUMN} column every row must carry a vector;
     * otherwise rows are embedded from their {@value #TEXT_COLUMN} column.
     *
     * @param reader   CSV content with header row
     * @param embedder embedder for text rows; must not be {@code null}
     * @return the embeddings, in file order
     * @throws IOException              if the content cannot be read or parsed
     * @throws IllegalArgumentException if a vector cell is malformed
     */
    public static List<EmbeddingVector> readBaselineEmbeddings(Reader reader, TextEmbedder embedder)
            throws IOException {
        Objects.requireNonNull(embedder, "TextEmbedder must not be null");
        List<EmbeddingVector> embeddings = new ArrayList<>();
        for (Map<String, String> row : readRows(reader)) {
            if (row.containsKey(EMBEDDING_COLUMN)) {
                embeddings.add(parseVector(row.get(EMBEDDING_COLUMN)));
            } else if (row.containsKey(TEXT_COLUMN)) {
                embeddings.add(embedder.embed(row.get(TEXT_COLUMN)));
            }
        }
        return List.copyOf(embeddings);
    }

    /**
     * Load baseline embeddings from a file, never failing.
     *
     * @param path     CSV file
     * @param embedder embedder for text rows
     * @return the embeddings, empty if the file is missing or malformed
     */
    public static List<EmbeddingVector> loadBaselineEmbeddings(Path path, TextEmbedder embedder) {
        return load(path, "Baseline text", List.of(), r -> readBaselineEmbeddings(r, embedder));
    }

    // ---------------------------------------------------------------
    // Internal
    // ---------------------------------------------------------------

    @FunctionalInterface
    private interface TableParser<T> {
        T parse(Reader reader) throws IOException;
    }

    private static <T> T load(Path path, String label, T empty, TableParser<T> parser) {
        Objects.requireNonNull(path, label + " file path must not be null");
        if (!Files.isRegularFile(path)) {
            LOG.warn("{} file {} not found. Using empty table.", label, path);
            return empty;
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            T table = parser.parse(reader);
            LOG.info("Loaded {} table from {}", label.toLowerCase(Locale.ROOT), path);
            return table;
        } catch (IOException | UncheckedIOException | IllegalArgumentException e) {
            LOG.error("Error loading {} file {}: {}. Using empty table.", label, path, e.getMessage(), e);
            return empty;
        }
    }

    private static List<Map<String, String>> readRows(Reader reader) throws IOException {
        Objects.requireNonNull(reader, "reader must not be null");
        List<Map<String, String>> rows = new ArrayList<>();
        try (MappingIterator<Map<String, String>> it = CSV_MAPPER
                .readerForMapOf(String.class)
                .with(HEADER_SCHEMA)
                .readValues(reader)) {
            while (it.hasNextValue()) {
                rows.add(it.nextValue());
            }
        }
        return rows;
    }

    private static Object numberOrRaw(String value) {
        try {
            return Double.parseDouble(value.trim());
        } catch (NumberFormatException e) {
            return value;
        }
    }

    private static double parseThreshold(Map<String, String> row, String column) {
        String raw = row.get(column);
        if (raw == null) {
            return 0.0;
        }
        try {
            return Double.parseDouble(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Invalid " + column + " for metric " + row.get(METRIC_NAME_COLUMN) + ": '" + raw + "'", e);
        }
    }

    static EmbeddingVector parseVector(String cell) {
        if (cell == null) {
            throw new IllegalArgumentException("Missing embedding value");
        }
        String body = cell.strip();
        int start = 0;
        int end = body.length();
        while (start < end && (body.charAt(start) == '[' || body.charAt(start) == ']')) {
            start++;
        }
        while (end > start && (body.charAt(end - 1) == '[' || body.charAt(end - 1) == ']')) {
            end--;
        }
        String[] parts = body.substring(start, end).split(",");
        double[] values = new double[parts.length];
        for (int i = 0; i < parts.length; i++) {
            try {
                values[i] = Double.parseDouble(parts[i].trim());
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Invalid embedding component '" + parts[i] + "'", e);
            }
        }
        return EmbeddingVector.of(values);
    }
}
