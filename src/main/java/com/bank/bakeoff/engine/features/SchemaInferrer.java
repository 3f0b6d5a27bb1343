package com.bank.bakeoff.engine.features;

import com.bank.bakeoff.model.ColumnSchema;
import com.bank.bakeoff.model.ColumnType;
import com.bank.bakeoff.model.TabularData;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Infers a column type for every header from the non-blank cell values.
 */
public final class SchemaInferrer {

    private static final Pattern CURRENCY_NAME =
            Pattern.compile("amount|price|cost|fee|balance|total|payment|credit|debit|value", Pattern.CASE_INSENSITIVE);

    private static final List<String> LABEL_NAMES = List.of("IsAnomaly", "is_anomaly", "Label", "label", "target");
    private static final Pattern LABEL_NAME =
            Pattern.compile("^(is_?anomal|label|target|fraud|flag)", Pattern.CASE_INSENSITIVE);

    private static final List<String> WIRE_ID_NAMES = List.of("WireID", "wire_id", "wireId");

    private SchemaInferrer() {}

    public static List<ColumnSchema> infer(TabularData data) {
        List<ColumnSchema> columns = new ArrayList<>();
        for (String header : data.getHeaders()) {
            List<String> nonBlank = new ArrayList<>();
            for (Map<String, String> row : data.getRows()) {
                String v = row.get(header);
                if (!CellValues.isBlank(v)) nonBlank.add(v.trim());
            }
            Set<String> unique = new HashSet<>();
            for (String v : nonBlank) unique.add(v.toLowerCase(Locale.ROOT));

            columns.add(ColumnSchema.builder()
                    .name(header)
                    .type(nonBlank.isEmpty() ? ColumnType.STRING : inferType(header, nonBlank, unique.size()))
                    .nullCount(data.size() - nonBlank.size())
                    .uniqueCount(unique.size())
                    .build());
        }
        return columns;
    }

    static ColumnType inferType(String header, List<String> values, int uniqueCount) {
        int total = values.size();

        long dates = values.stream().filter(v -> CellValues.parseDate(v) != null).count();
        if ((double) dates / total > 0.9) return ColumnType.DATE;

        int numeric = 0;
        boolean allIntegers = true;
        for (String v : values) {
            double d = CellValues.parseNumeric(v);
            if (!Double.isNaN(d)) {
                numeric++;
                if (d != Math.rint(d)) allIntegers = false;
            }
        }
        if ((double) numeric / total > 0.95) {
            if (CURRENCY_NAME.matcher(header).find()) return ColumnType.CURRENCY;
            return allIntegers ? ColumnType.INTEGER : ColumnType.NUMBER;
        }

        long booleans = values.stream().filter(CellValues::isBooleanToken).count();
        if ((double) booleans / total > 0.95) return ColumnType.BOOLEAN;

        if ((double) uniqueCount / total < 0.2 && total >= 10) return ColumnType.CATEGORICAL;
        return ColumnType.STRING;
    }

    /**
     * @return the ground-truth label column by conventional name, or null
     */
    public static String detectLabelColumn(List<String> headers) {
        for (String name : LABEL_NAMES) {
            if (headers.contains(name)) return name;
        }
        return headers.stream().filter(h -> LABEL_NAME.matcher(h).find()).findFirst().orElse(null);
    }

    /**
     * @return the wire identifier column, or null when rows are identified by position
     */
    public static String detectWireIdColumn(List<String> headers) {
        return WIRE_ID_NAMES.stream().filter(headers::contains).findFirst().orElse(null);
    }
}
