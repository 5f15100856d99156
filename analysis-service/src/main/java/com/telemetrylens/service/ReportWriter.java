package com.telemetrylens.service;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.fasterxml.jackson.databind.module.SimpleModule;
import com.fasterxml.jackson.databind.ser.std.StdSerializer;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.OutputStream;
import java.io.UncheckedIOException;
import java.math.BigDecimal;
import java.math.RoundingMode;

/**
 * Renders reports as JSON.
 *
 * <p>
 * Timestamps are written as ISO-8601 strings. Every {@code double} is
 * rounded to 2 decimals ({@link RoundingMode#HALF_UP}) on the way out; the
 * engine itself never rounds. Infinite values, such as the threshold of a
 * constant baseline, are written as the strings {@code "Infinity"} and
 * {@code "-Infinity"}.
 * </p>
 */
public class ReportWriter {

    private static final Logger LOG = LoggerFactory.getLogger(ReportWriter.class);

    static final int DECIMALS = 2;

    private final ObjectMapper mapper;

    public ReportWriter() {
        this.mapper = objectMapper();
    }

    /**
     * @return the JSON rendering of {@code report}
     * @throws IllegalStateException if the report cannot be serialised
     */
    public String write(Object report) {
        try {
            return mapper.writeValueAsString(report);
        } catch (JsonProcessingException e) {
            LOG.error("Failed to serialize report: {}", e.getMessage(), e);
            throw new IllegalStateException("Failed to serialize report: " + e.getMessage(), e);
        }
    }

    /**
     * Write the report to a stream, leaving the stream open.
     */
    public void write(Object report, OutputStream out) {
        try {
            mapper.writer().without(JsonGenerator.Feature.AUTO_CLOSE_TARGET).writeValue(out, report);
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to write report", e);
        }
    }

    static double round(double value) {
        return BigDecimal.valueOf(value).setScale(DECIMALS, RoundingMode.HALF_UP).doubleValue();
    }

    private static ObjectMapper objectMapper() {
        SimpleModule rounding = new SimpleModule("two-decimal-doubles");
        rounding.addSerializer(Double.class, new RoundingSerializer());
        rounding.addSerializer(Double.TYPE, new RoundingSerializer());

        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.registerModule(rounding);
        mapper.configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false);
        mapper.configure(SerializationFeature.INDENT_OUTPUT, true);
        return mapper;
    }

    private static final class RoundingSerializer extends StdSerializer<Double> {

        private static final long serialVersionUID = 1L;

        RoundingSerializer() {
            super(Double.class);
        }

        @Override
        public void serialize(Double value, JsonGenerator gen, SerializerProvider provider) throws IOException {
            if (value.isNaN() || value.isInfinite()) {
                gen.writeString(value.toString());
            } else {
                gen.writeNumber(BigDecimal.valueOf(value).setScale(DECIMALS, RoundingMode.HALF_UP));
            }
        }
    }
}
