package com.complexityscan.core.report;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.util.DefaultIndenter;
import com.fasterxml.jackson.core.util.DefaultPrettyPrinter;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;

/**
 * Serializes a {@link ScanReport} to its canonical JSON form.
 *
 * <p>Output is pretty-printed, map keys are sorted and property order is fixed, so two
 * scans of identical input differ only in {@code scan_time_ms}. Lines end with {@code \n}
 * on every platform. The whole document is
 * serialized in memory before anything is written, so a failure never leaves a truncated
 * report behind.
 */
public class JsonReportEmitter {

    private final ObjectWriter writer;

    public JsonReportEmitter() {
        ObjectMapper mapper = new ObjectMapper()
            .enable(SerializationFeature.ORDER_MAP_ENTRIES_BY_KEYS)
            .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
        DefaultPrettyPrinter printer = new DefaultPrettyPrinter()
            .withObjectIndenter(new DefaultIndenter("  ", "\n"));
        this.writer = mapper.writer(printer);
    }

    /**
     * Renders a report.
     *
     * @param report report to serialize
     * @return JSON text terminated by a newline
     * @throws IllegalStateException if serialization fails
     */
    public String toJson(ScanReport report) {
        try {
            return writer.writeValueAsString(report) + "\n";
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize complexity report", e);
        }
    }
}
