package com.bank.bakeoff.engine.features;

import com.bank.bakeoff.exception.ValidationException;
import com.bank.bakeoff.model.ColumnSchema;
import com.bank.bakeoff.model.TabularData;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Turns parsed rows into an encoded numeric matrix.
 * <p>
 * Training mode derives the encodings (statistics, top categories) from the rows;
 * scoring mode replays the encodings frozen in a model artifact so the columns line
 * up with the training feature order.
 */
public final class FeatureMatrixBuilder {

    static final int MAX_CATEGORIES = 10;

    private FeatureMatrixBuilder() {}

    public static FeatureMatrix buildForTraining(TabularData data, List<ColumnSchema> schema, String labelColumn) {
        if (!data.getHeaders().contains(labelColumn)) {
            throw new ValidationException("Label column not found in dataset: " + labelColumn);
        }
        String wireIdColumn = SchemaInferrer.detectWireIdColumn(data.getHeaders());
        List<ColumnEncoding> encodings = deriveEncodings(data, schema, labelColumn, wireIdColumn);
        if (encodings.isEmpty()) {
            throw new ValidationException("Dataset has no usable feature columns besides the label");
        }

        double[][] x = encodeRows(data, encodings);
        int[] y = new int[data.size()];
        for (int i = 0; i < data.size(); i++) {
            y[i] = CellValues.parseLabel(data.getRows().get(i).get(labelColumn));
        }

        return FeatureMatrix.builder()
                .featureNames(featureNames(encodings))
                .encodings(encodings)
                .labelColumn(labelColumn)
                .x(x)
                .y(y)
                .build();
    }

    /**
     * Encodes rows with training-time encodings. Callers check {@link #missingColumns} first.
     */
    public static double[][] encodeRows(TabularData data, List<ColumnEncoding> encodings) {
        int width = encodings.stream().mapToInt(ColumnEncoding::width).sum();
        double[][] x = new double[data.size()][width];
        for (int i = 0; i < data.size(); i++) {
            Map<String, String> row = data.getRows().get(i);
            int offset = 0;
            for (ColumnEncoding encoding : encodings) {
                encoding.encode(row.get(encoding.getColumn()), x[i], offset);
                offset += encoding.width();
            }
        }
        return x;
    }

    public static List<String> featureNames(List<ColumnEncoding> encodings) {
        List<String> names = new ArrayList<>();
        for (ColumnEncoding encoding : encodings) {
            names.addAll(encoding.featureNames());
        }
        return names;
    }

    public static List<String> requiredColumns(List<ColumnEncoding> encodings) {
        Set<String> columns = new LinkedHashSet<>();
        for (ColumnEncoding encoding : encodings) columns.add(encoding.getColumn());
        return new ArrayList<>(columns);
    }

    public static List<String> missingColumns(List<ColumnEncoding> encodings, List<String> headers) {
        List<String> missing = new ArrayList<>();
        for (String column : requiredColumns(encodings)) {
            if (!headers.contains(column)) missing.add(column);
        }
        return missing;
    }

    private static List<ColumnEncoding> deriveEncodings(TabularData data, List<ColumnSchema> schema,
                                                        String labelColumn, String wireIdColumn) {
        List<ColumnSchema> numeric = new ArrayList<>();
        List<ColumnSchema> categorical = new ArrayList<>();
        List<ColumnSchema> dates = new ArrayList<>();
        List<ColumnSchema> booleans = new ArrayList<>();

        for (ColumnSchema col : schema) {
            if (col.getName().equals(labelColumn) || col.getName().equals(wireIdColumn)) continue;
            if (!data.getHeaders().contains(col.getName())) continue;
            switch (col.getType()) {
                case NUMBER, INTEGER, CURRENCY -> numeric.add(col);
                case DATE -> dates.add(col);
                case BOOLEAN -> booleans.add(col);
                default -> categorical.add(col);
            }
        }

        List<ColumnEncoding> encodings = new ArrayList<>();
        for (ColumnSchema col : numeric) {
            encodings.add(numericEncoding(data, col.getName(), EncodingKind.NUMERIC));
        }
        for (ColumnSchema col : numeric) {
            if (col.getName().toLowerCase(Locale.ROOT).contains("amount")) {
                encodings.add(numericEncoding(data, col.getName(), EncodingKind.AMOUNT));
            }
        }
        for (ColumnSchema col : categorical) {
            List<String> top = topCategories(data, col.getName());
            if (!top.isEmpty()) {
                encodings.add(ColumnEncoding.builder()
                        .column(col.getName()).kind(EncodingKind.CATEGORICAL).categories(top).build());
            }
        }
        for (ColumnSchema col : dates) {
            encodings.add(ColumnEncoding.builder().column(col.getName()).kind(EncodingKind.DATE).build());
        }
        for (ColumnSchema col : booleans) {
            encodings.add(ColumnEncoding.builder().column(col.getName()).kind(EncodingKind.BOOLEAN).build());
        }
        return encodings;
    }

    private static ColumnEncoding numericEncoding(TabularData data, String column, EncodingKind kind) {
        double sum = 0.0;
        int count = 0;
        for (Map<String, String> row : data.getRows()) {
            double v = CellValues.parseNumeric(row.get(column));
            if (!Double.isNaN(v)) {
                sum += v;
                count++;
            }
        }
        double mean = count == 0 ? 0.0 : sum / count;
        double sq = 0.0;
        for (Map<String, String> row : data.getRows()) {
            double v = CellValues.parseNumeric(row.get(column));
            if (!Double.isNaN(v)) sq += (v - mean) * (v - mean);
        }
        double std = count == 0 ? 0.0 : Math.sqrt(sq / count);
        return ColumnEncoding.builder().column(column).kind(kind).mean(mean).std(std).build();
    }

    private static List<String> topCategories(TabularData data, String column) {
        Map<String, Integer> freq = new HashMap<>();
        List<String> firstSeen = new ArrayList<>();
        for (Map<String, String> row : data.getRows()) {
            String v = row.get(column);
            if (CellValues.isBlank(v)) continue;
            String key = v.trim();
            if (freq.merge(key, 1, Integer::sum) == 1) firstSeen.add(key);
        }
        // Stable: frequency descending, then first appearance
        return firstSeen.stream()
                .sorted(Comparator.comparingInt((String v) -> freq.get(v)).reversed())
                .limit(MAX_CATEGORIES)
                .toList();
    }
}
