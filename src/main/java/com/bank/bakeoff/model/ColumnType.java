package com.bank.bakeoff.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

public enum ColumnType {
    STRING,
    NUMBER,
    INTEGER,
    BOOLEAN,
    DATE,
    CURRENCY,
    CATEGORICAL;

    @JsonValue
    public String toJson() {
        return name().toLowerCase(Locale.ROOT);
    }

    @JsonCreator
    public static ColumnType fromJson(String value) {
        return valueOf(value.toUpperCase(Locale.ROOT));
    }

    public boolean isNumeric() {
        return this == NUMBER || this == INTEGER || this == CURRENCY;
    }
}
