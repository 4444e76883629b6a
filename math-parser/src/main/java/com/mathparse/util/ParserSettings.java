package com.mathparse.util;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.mathparse.expr.AngleUnit;
import com.mathparse.expr.BatchFailureMode;
import com.mathparse.expr.EvaluationConfig;

import java.io.File;
import java.io.IOException;
import java.io.InputStream;

/**
 * ParserSettings - loads and holds the runtime settings of the parser from a JSON file.
 *
 * <pre>
 * {
 *   "angleUnit": "DEGREES",
 *   "failureMode": "WARNING",
 *   "logging": { "level": "INFO", "console": true, "file": false, "fileName": "mathparse.log" }
 * }
 * </pre>
 *
 * Missing keys keep their defaults.
 */
public class ParserSettings {

    public static final String DEFAULT_RESOURCE = "mathparse.json";

    private AngleUnit angleUnit = AngleUnit.DEGREES;
    private BatchFailureMode failureMode = BatchFailureMode.WARNING;

    // Logging configuration
    private String loggingLevel = "INFO";
    private boolean consoleLoggingEnabled = true;
    private boolean fileLoggingEnabled = false;
    private String logFileName = "mathparse.log";

    /**
     * Default constructor, all defaults
     */
    public ParserSettings() {
    }

    /**
     * Constructor that loads from file
     */
    public ParserSettings(String settingsFilePath) throws IOException {
        loadFromFile(settingsFilePath);
    }

    /**
     * Settings bundled on the classpath, or the defaults when the resource is absent.
     */
    public static ParserSettings fromClasspath() throws IOException {
        ParserSettings settings = new ParserSettings();
        try (InputStream in = ParserSettings.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                LoggingUtil.debug("No " + DEFAULT_RESOURCE + " on the classpath, using defaults");
                return settings;
            }
            settings.apply(new ObjectMapper().readTree(in));
        }
        return settings;
    }

    public void loadFromFile(String settingsFilePath) throws IOException {
        File settingsFile = new File(settingsFilePath);
        if (!settingsFile.exists()) {
            LoggingUtil.warn("Parser settings file not found: " + settingsFilePath);
            LoggingUtil.info("Using default parser settings");
            return;
        }

        ObjectMapper mapper = new ObjectMapper();
        apply(mapper.readTree(settingsFile));
        LoggingUtil.debug("Loaded parser settings from " + settingsFilePath + ": " + this);
    }

    /**
     * Apply the recognised keys of a settings document.
     */
    public void apply(JsonNode json) {
        if (json == null || json.isNull()) return;

        if (json.has("angleUnit")) {
            angleUnit = parseEnum(AngleUnit.class, json.get("angleUnit").asText(), "angleUnit");
        }

        if (json.has("failureMode")) {
            failureMode = parseEnum(BatchFailureMode.class, json.get("failureMode").asText(), "failureMode");
        }

        if (json.has("logging")) {
            JsonNode loggingNode = json.get("logging");

            if (loggingNode.has("level")) {
                loggingLevel = loggingNode.get("level").asText();
            }

            if (loggingNode.has("console")) {
                consoleLoggingEnabled = loggingNode.get("console").asBoolean();
            }

            if (loggingNode.has("file")) {
                fileLoggingEnabled = loggingNode.get("file").asBoolean();
            }

            if (loggingNode.has("fileName")) {
                logFileName = loggingNode.get("fileName").asText();
            }
        }
    }

    private static <E extends Enum<E>> E parseEnum(Class<E> type, String value, String key) {
        try {
            return Enum.valueOf(type, value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Invalid value for " + key + ": " + value, e);
        }
    }

    public EvaluationConfig toEvaluationConfig() {
        return EvaluationConfig.of(angleUnit);
    }

    public AngleUnit getAngleUnit() {
        return angleUnit;
    }

    public BatchFailureMode getFailureMode() {
        return failureMode;
    }

    public String getLoggingLevel() {
        return loggingLevel;
    }

    public boolean isConsoleLoggingEnabled() {
        return consoleLoggingEnabled;
    }

    public boolean isFileLoggingEnabled() {
        return fileLoggingEnabled;
    }

    public String getLogFileName() {
        return logFileName;
    }

    @Override
    public String toString() {
        return "ParserSettings{angleUnit=" + angleUnit +
                ", failureMode=" + failureMode +
                ", loggingLevel=" + loggingLevel +
                ", console=" + consoleLoggingEnabled +
                ", file=" + (fileLoggingEnabled ? logFileName : "disabled") + "}";
    }
}
