package com.bank.bakeoff.service;

import com.bank.bakeoff.exception.ValidationException;
import com.bank.bakeoff.model.TabularData;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CsvParsingServiceTest {

    private final CsvParsingService service = new CsvParsingService();

    @Test
    void parse_stripsBomAndTrimsHeaders() {
        byte[] csv = "\uFEFFWireID , Amount,IsAnomaly\nW-1,\"1,250.00\",0\nW-2,99,1\n".getBytes(StandardCharsets.UTF_8);

        TabularData data = service.parse(csv, "csv");

        assertThat(data.getHeaders()).containsExactly("WireID", "Amount", "IsAnomaly");
        assertThat(data.size()).isEqualTo(2);
        assertThat(data.getRows().get(0)).containsEntry("Amount", "1,250.00");
    }

    @Test
    void parse_skipsBlankAndMalformedRows() {
        byte[] csv = "A,B\n1,2\n\n3\n4,5\n".getBytes(StandardCharsets.UTF_8);

        TabularData data = service.parse(csv, "CSV");

        assertThat(data.getRows()).extracting(r -> r.get("A")).containsExactly("1", "4");
    }

    @Test
    void parse_unsupportedFormat_rejected() {
        assertThatThrownBy(() -> service.parse(new byte[] {1, 2}, "xlsx"))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("xlsx");
    }

    @Test
    void parse_noHeader_rejected() {
        assertThatThrownBy(() -> service.parse(new byte[0], "csv")).isInstanceOf(ValidationException.class);
    }

    @Test
    void writeScored_appendsScoreAndFlag() {
        TabularData data = new TabularData(List.of("WireID"), List.of(Map.of("WireID", "W-1"), Map.of("WireID", "W-2")));

        byte[] scored = service.writeScored(data, new double[] {0.1234567, 0.9}, new boolean[] {false, true});

        TabularData reread = service.parse(scored, "csv");
        assertThat(reread.getHeaders()).containsExactly("WireID", "AnomalyScore", "Flagged");
        assertThat(reread.getRows().get(0)).containsEntry("AnomalyScore", "0.123457").containsEntry("Flagged", "0");
        assertThat(reread.getRows().get(1)).containsEntry("AnomalyScore", "0.900000").containsEntry("Flagged", "1");
    }
}
