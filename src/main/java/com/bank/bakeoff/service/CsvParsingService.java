package com.bank.bakeoff.service;

import com.bank.bakeoff.exception.PipelineException;
import com.bank.bakeoff.exception.ValidationException;
import com.bank.bakeoff.model.TabularData;
import com.opencsv.CSVReader;
import com.opencsv.CSVWriter;
import com.opencsv.exceptions.CsvValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStreamWriter;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads uploaded datasets into header-keyed rows and writes scored output files.
 */
@Service
public class CsvParsingService {

    private static final Logger log = LoggerFactory.getLogger(CsvParsingService.class);

    private static final String BOM = "\uFEFF";

    /**
     * @param sourceFormat file extension of the upload; only {@code csv} is readable
     */
    public TabularData parse(byte[] content, String sourceFormat) {
        if (sourceFormat != null && !"csv".equals(sourceFormat.toLowerCase(Locale.ROOT))) {
            throw new ValidationException("Unsupported file format: " + sourceFormat + " (only csv is accepted)");
        }

        List<Map<String, String>> rows = new ArrayList<>();
        List<String> headers;

        try (CSVReader reader = new CSVReader(
                new InputStreamReader(new ByteArrayInputStream(content), StandardCharsets.UTF_8))) {

            String[] headerRow = reader.readNext();
            if (headerRow == null || headerRow.length == 0) {
                throw new ValidationException("CSV file has no headers");
            }
            if (headerRow[0].startsWith(BOM)) {
                headerRow[0] = headerRow[0].substring(1);
            }
            headers = Arrays.stream(headerRow).map(String::trim).toList();

            String[] row;
            while ((row = reader.readNext()) != null) {
                if (row.length == 1 && row[0].isBlank()) continue;
                if (row.length != headerRow.length) {
                    log.debug("Skipping row with incorrect column count: {} vs {}", row.length, headerRow.length);
                    continue;
                }
                Map<String, String> values = new LinkedHashMap<>();
                for (int i = 0; i < headerRow.length; i++) {
                    values.put(headers.get(i), row[i]);
                }
                rows.add(values);
            }
        } catch (IOException | CsvValidationException e) {
            throw new ValidationException("Unreadable CSV file: " + e.getMessage());
        }

        return new TabularData(headers, rows);
    }

    /**
     * Original columns followed by {@code AnomalyScore} (6 decimals) and {@code Flagged}.
     */
    public byte[] writeScored(TabularData data, double[] scores, boolean[] flagged) {
        ByteArrayOutputStream out = new ByteArrayOutputStream();
        try (CSVWriter writer = new CSVWriter(new OutputStreamWriter(out, StandardCharsets.UTF_8))) {
            List<String> headers = data.getHeaders();
            String[] header = new String[headers.size() + 2];
            for (int i = 0; i < headers.size(); i++) header[i] = headers.get(i);
            header[headers.size()] = "AnomalyScore";
            header[headers.size() + 1] = "Flagged";
            writer.writeNext(header);

            for (int r = 0; r < data.size(); r++) {
                Map<String, String> row = data.getRows().get(r);
                String[] line = new String[header.length];
                for (int i = 0; i < headers.size(); i++) {
                    String value = row.get(headers.get(i));
                    line[i] = value != null ? value : "";
                }
                line[headers.size()] = String.format(Locale.ROOT, "%.6f", scores[r]);
                line[headers.size() + 1] = flagged[r] ? "1" : "0";
                writer.writeNext(line);
            }
        } catch (IOException e) {
            throw new PipelineException("Failed to write scored CSV", e);
        }
        return out.toByteArray();
    }
}
