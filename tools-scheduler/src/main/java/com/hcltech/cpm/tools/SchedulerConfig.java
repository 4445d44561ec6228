package com.hcltech.cpm.tools;

import com.hcltech.cpm.common.IEnvGetter;
import com.hcltech.cpm.schedule.SinkAnchor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;
import java.util.Properties;

/**
 * Settings of one scheduler run. Each key resolves from the environment variable
 * ({@code scheduler.input.file} -> {@code SCHEDULER_INPUT_FILE}), then the JVM system
 * property, then {@code application.properties}, then the built-in default.
 */
public record SchedulerConfig(Path inputFile,
                              Path outputFile,
                              Path timelineFile,
                              Path jsonFile,
                              char dependencySeparator,
                              int parallelism,
                              SinkAnchor sinkAnchor) {

    public static final String INPUT_FILE = "scheduler.input.file";
    public static final String OUTPUT_FILE = "scheduler.output.file";
    public static final String TIMELINE_FILE = "scheduler.timeline.file";
    public static final String JSON_FILE = "scheduler.json.file";
    public static final String DEPENDENCY_SEPARATOR = "scheduler.dependency.separator";
    public static final String PARALLELISM = "scheduler.parallelism";
    public static final String SINK_ANCHOR = "scheduler.sink.anchor";

    public SchedulerConfig {
        Objects.requireNonNull(inputFile, "inputFile");
        Objects.requireNonNull(outputFile, "outputFile");
        Objects.requireNonNull(timelineFile, "timelineFile");
        Objects.requireNonNull(sinkAnchor, "sinkAnchor");
        if (dependencySeparator == ',') {
            throw new IllegalArgumentException("Dependency separator cannot be the column delimiter ','");
        }
        if (parallelism < 1) throw new IllegalArgumentException("parallelism must be >= 1 but was " + parallelism);
    }

    /** Optional JSON report target; absent unless {@code scheduler.json.file} is set. */
    public Optional<Path> jsonReport() {
        return Optional.ofNullable(jsonFile);
    }

    public SchedulerConfig withInputFile(Path input) {
        return new SchedulerConfig(input, outputFile, timelineFile, jsonFile, dependencySeparator, parallelism, sinkAnchor);
    }

    public static SchedulerConfig fromEnvironment() {
        return load(IEnvGetter.env, System.getProperties(), loadApplicationProperties());
    }

    public static SchedulerConfig load(IEnvGetter env, Properties system, Properties defaults) {
        IEnvGetter layered = key -> get(key, env, system, defaults);

        String separator = IEnvGetter.getStringOr(layered, DEPENDENCY_SEPARATOR, ";");
        if (separator.length() != 1) {
            throw new IllegalStateException("Invalid " + DEPENDENCY_SEPARATOR + ": expected one character but got '" + separator + "'");
        }
        String json = layered.get(JSON_FILE);

        return new SchedulerConfig(
                Path.of(IEnvGetter.getStringOr(layered, INPUT_FILE, "tasks.csv")),
                Path.of(IEnvGetter.getStringOr(layered, OUTPUT_FILE, "output.csv")),
                Path.of(IEnvGetter.getStringOr(layered, TIMELINE_FILE, "timeline.csv")),
                json == null || json.isBlank() ? null : Path.of(json),
                separator.charAt(0),
                IEnvGetter.getIntOr(layered, PARALLELISM, 1),
                parseAnchor(IEnvGetter.getStringOr(layered, SINK_ANCHOR, SinkAnchor.OWN_EARLY_FINISH.name())));
    }

    static Properties loadApplicationProperties() {
        Properties defaults = new Properties();
        try (InputStream is = SchedulerConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (is != null) defaults.load(is);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to load application.properties", e);
        }
        return defaults;
    }

    private static String get(String key, IEnvGetter env, Properties system, Properties defaults) {
        String fromEnv = env.get(IEnvGetter.envKey(key));
        if (fromEnv != null && !fromEnv.isBlank()) return fromEnv;
        String sys = system.getProperty(key);
        if (sys != null && !sys.isBlank()) return sys;
        return defaults.getProperty(key);
    }

    private static SinkAnchor parseAnchor(String value) {
        try {
            return SinkAnchor.valueOf(value.trim().toUpperCase(Locale.ROOT).replace('-', '_'));
        } catch (IllegalArgumentException e) {
            throw new IllegalStateException("Invalid " + SINK_ANCHOR + ": '" + value + "'", e);
        }
    }
}
