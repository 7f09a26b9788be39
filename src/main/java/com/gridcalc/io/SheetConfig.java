package com.gridcalc.io;

import java.io.IOException;
import java.io.InputStream;
import java.io.UncheckedIOException;
import java.nio.file.Path;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gridcalc.engine.RecalcMode;
import com.gridcalc.engine.RecalcOrder;

import lombok.Data;
import lombok.extern.log4j.Log4j2;

/**
 * Sheet settings, read from JSON.
 *
 * <pre>
 * {
 *   "maxRows": 65536,
 *   "maxCols": 256,
 *   "recalcMode": "AUTOMATIC",
 *   "recalcOrder": "NATURAL",
 *   "defaultFormat": "G"
 * }
 * </pre>
 *
 * Missing keys keep their defaults; unknown keys are ignored.
 */
@Data
@Log4j2
@JsonIgnoreProperties(ignoreUnknown = true)
public final class SheetConfig {
    public static final String RESOURCE = "gridcalc.json";

    private int maxRows = 65536;
    private int maxCols = 256;
    private RecalcMode recalcMode = RecalcMode.AUTOMATIC;
    private RecalcOrder recalcOrder = RecalcOrder.NATURAL;
    private String defaultFormat = "G";
    private boolean protectionEnabled;
    private long errorLogIntervalMillis = 1000;
    private int editRingBufferSize = 1024;

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Settings from {@value #RESOURCE} on the classpath, or the defaults when there is none. */
    public static SheetConfig load() {
        try (InputStream in = SheetConfig.class.getClassLoader().getResourceAsStream(RESOURCE)) {
            if (in == null) {
                log.info("No {} on the classpath, using defaults", RESOURCE);
                return new SheetConfig();
            }
            return MAPPER.readValue(in, SheetConfig.class).validate();
        } catch (IOException e) {
            throw new UncheckedIOException("Cannot read " + RESOURCE, e);
        }
    }

    public static SheetConfig load(Path path) throws IOException {
        return MAPPER.readValue(path.toFile(), SheetConfig.class).validate();
    }

    public static SheetConfig parse(String json) throws IOException {
        return MAPPER.readValue(json, SheetConfig.class).validate();
    }

    /** Checks ranges; returns this. */
    public SheetConfig validate() {
        if (maxRows <= 0 || maxCols <= 0)
            throw new IllegalArgumentException("Sheet bounds must be positive: " + maxRows + "x" + maxCols);
        if (Integer.bitCount(editRingBufferSize) != 1)
            throw new IllegalArgumentException("editRingBufferSize must be a power of two: " + editRingBufferSize);
        if (recalcMode == null)
            recalcMode = RecalcMode.AUTOMATIC;
        if (recalcOrder == null)
            recalcOrder = RecalcOrder.NATURAL;
        return this;
    }
}
