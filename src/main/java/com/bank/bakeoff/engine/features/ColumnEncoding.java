package com.bank.bakeoff.engine.features;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.DayOfWeek;
import java.time.LocalDateTime;
import java.util.List;

/**
 * How one source column turns into one or more feature values. Training-time
 * statistics (mean/std, category list) are frozen here and reused at scoring time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnEncoding {

    private String column;
    private EncodingKind kind;
    private double mean;
    private double std;
    private List<String> categories;

    public List<String> featureNames() {
        return switch (kind) {
            case NUMERIC, BOOLEAN -> List.of(column);
            case AMOUNT -> List.of(column + "_zScore", column + "_log");
            case CATEGORICAL -> categories.stream().map(c -> column + "_" + c).toList();
            case DATE -> List.of(column + "_hourOfDay", column + "_dayOfWeek", column + "_isWeekend",
                    column + "_isOutOfHours", column + "_isExtendedHours");
        };
    }

    public int width() {
        return switch (kind) {
            case NUMERIC, BOOLEAN -> 1;
            case AMOUNT -> 2;
            case CATEGORICAL -> categories.size();
            case DATE -> 5;
        };
    }

    /**
     * Writes this column's features for one cell into {@code out} starting at {@code offset}.
     */
    public void encode(String raw, double[] out, int offset) {
        switch (kind) {
            case NUMERIC -> out[offset] = zScore(CellValues.parseNumeric(raw));
            case AMOUNT -> {
                double v = CellValues.parseNumeric(raw);
                out[offset] = zScore(v);
                out[offset + 1] = Double.isNaN(v) || v < 0 ? 0.0 : Math.log(v + 1);
            }
            case CATEGORICAL -> {
                String v = raw == null ? "" : raw.trim();
                for (int i = 0; i < categories.size(); i++) {
                    out[offset + i] = categories.get(i).equals(v) ? 1.0 : 0.0;
                }
            }
            case DATE -> encodeDate(CellValues.parseDate(raw), out, offset);
            case BOOLEAN -> out[offset] = CellValues.parseBoolean(raw);
        }
    }

    private double zScore(double v) {
        if (Double.isNaN(v) || std == 0) return 0.0;
        return (v - mean) / std;
    }

    private static void encodeDate(LocalDateTime d, double[] out, int offset) {
        if (d == null) {
            for (int i = 0; i < 5; i++) out[offset + i] = 0.0;
            return;
        }
        int hour = d.getHour();
        DayOfWeek dow = d.getDayOfWeek();
        out[offset] = hour;
        out[offset + 1] = dow.getValue() % 7; // Sunday = 0
        out[offset + 2] = dow == DayOfWeek.SATURDAY || dow == DayOfWeek.SUNDAY ? 1.0 : 0.0;
        out[offset + 3] = hour < 6 || hour >= 22 ? 1.0 : 0.0;
        out[offset + 4] = (hour >= 6 && hour < 8) || (hour >= 17 && hour < 22) ? 1.0 : 0.0;
    }
}
