package com.bank.bakeoff.engine.trainer;

import com.bank.bakeoff.exception.ValidationException;

import java.util.Map;

/**
 * Typed reads of loosely-typed hyperparameter maps coming from JSON.
 */
public final class Hyperparams {

    private Hyperparams() {}

    public static int getInt(Map<String, Object> params, String key, int defaultValue) {
        Object value = params == null ? null : params.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number n) return n.intValue();
        try {
            return (int) Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Hyperparameter " + key + " must be numeric, got: " + value);
        }
    }

    public static long getLong(Map<String, Object> params, String key, long defaultValue) {
        Object value = params == null ? null : params.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number n) return n.longValue();
        try {
            return (long) Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Hyperparameter " + key + " must be numeric, got: " + value);
        }
    }

    public static double getDouble(Map<String, Object> params, String key, double defaultValue) {
        Object value = params == null ? null : params.get(key);
        if (value == null) return defaultValue;
        if (value instanceof Number n) return n.doubleValue();
        try {
            return Double.parseDouble(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new ValidationException("Hyperparameter " + key + " must be numeric, got: " + value);
        }
    }

    public static int getPositiveInt(Map<String, Object> params, String key, int defaultValue) {
        int value = getInt(params, key, defaultValue);
        if (value < 1) {
            throw new ValidationException("Hyperparameter " + key + " must be at least 1, got: " + value);
        }
        return value;
    }

    public static double getPositiveDouble(Map<String, Object> params, String key, double defaultValue) {
        double value = getDouble(params, key, defaultValue);
        if (!(value > 0) || Double.isInfinite(value)) {
            throw new ValidationException("Hyperparameter " + key + " must be greater than 0, got: " + value);
        }
        return value;
    }

    /**
     * Resolves {@code maxFeatures}: "sqrt", "log2", "all", a fraction in (0,1], or an absolute count.
     */
    public static int resolveMaxFeatures(Map<String, Object> params, int featureCount, String defaultValue) {
        Object raw = params == null ? null : params.get("maxFeatures");
        String value = raw == null ? defaultValue : raw.toString().trim();
        int resolved;
        switch (value.toLowerCase()) {
            case "sqrt" -> resolved = (int) Math.round(Math.sqrt(featureCount));
            case "log2" -> resolved = (int) Math.round(Math.log(featureCount) / Math.log(2));
            case "all", "none" -> resolved = featureCount;
            default -> {
                double d;
                try {
                    d = Double.parseDouble(value);
                } catch (NumberFormatException e) {
                    throw new ValidationException("Unsupported maxFeatures: " + value);
                }
                resolved = d > 0 && d <= 1.0 && value.contains(".") ? (int) Math.ceil(d * featureCount) : (int) d;
            }
        }
        return Math.max(1, Math.min(featureCount, resolved));
    }
}
