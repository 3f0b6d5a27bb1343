package com.bank.bakeoff.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;
import java.util.Map;

/**
 * Parsed rows of a dataset file, keyed by header, in file order.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TabularData {
    private List<String> headers;
    private List<Map<String, String>> rows;

    public int size() {
        return rows == null ? 0 : rows.size();
    }
}
