package com.bank.bakeoff.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ColumnSchema {
    private String name;
    private ColumnType type;
    private int nullCount;
    private int uniqueCount;
}
