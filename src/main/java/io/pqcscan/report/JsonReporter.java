package io.pqcscan.report;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import io.pqcscan.model.AuditReport;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;

/**
 * Formats audit reports as JSON for machine processing.
 * <p>
 * The report records are written field for field, so {@link #read} restores
 * an equal {@link AuditReport}. Null fields (an absent key size or timestamp)
 * are omitted.
 */
public class JsonReporter implements Reporter {

    private final ObjectMapper mapper;
    private final boolean prettyPrint;

    public JsonReporter() {
        this(true);
    }

    public JsonReporter(boolean prettyPrint) {
        this.prettyPrint = prettyPrint;
        this.mapper = createMapper();
    }

    private ObjectMapper createMapper() {
        ObjectMapper m = new ObjectMapper();
        m.registerModule(new JavaTimeModule());
        m.setSerializationInclusion(JsonInclude.Include.NON_NULL);
        m.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        m.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        if (prettyPrint) {
            m.enable(SerializationFeature.INDENT_OUTPUT);
        }
        return m;
    }

    @Override
    public String format() {
        return "json";
    }

    @Override
    public void write(AuditReport report, Writer writer) throws IOException {
        mapper.writeValue(writer, report);
    }

    /**
     * Reads a report previously written by this reporter.
     */
    public AuditReport read(Reader reader) throws IOException {
        return mapper.readValue(reader, AuditReport.class);
    }

    public AuditReport read(String json) throws IOException {
        return mapper.readValue(json, AuditReport.class);
    }
}
