package timetabler.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import java.util.Set;
import java.util.TreeSet;

/**
 * Reads {@link SchedulingConfig} overrides from a {@code .properties} file.
 * Keys that are absent keep their default; unknown keys and malformed values
 * are rejected.
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    public static final String DEFAULTS_RESOURCE = "/timetabler-defaults.properties";

    private static final Set<String> KNOWN_KEYS = Set.of(
            "slotsPerDay", "minGap", "turnaroundGap", "largeExamThreshold", "examinerCapacity",
            "maxExamsPerDay", "largeExamDemand", "smallExamDemand",
            "weight.roomDouble", "weight.clash", "weight.minGap", "weight.dayCap",
            "weight.turnaround", "weight.lastSlot", "weight.invigilator",
            "anneal.maxIterations", "anneal.startTemperature", "anneal.endTemperature",
            "seed");

    public static SchedulingConfig load(Path path) throws IOException {
        Properties props = new Properties();
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            props.load(reader);
        }
        log.info("Loaded {} setting(s) from {}", props.size(), path);
        return fromProperties(props, SchedulingConfig.defaults());
    }

    /**
     * Loads the bundled defaults resource. Mostly useful to check that the
     * documented defaults and the compiled-in ones agree.
     */
    public static SchedulingConfig loadBundledDefaults() throws IOException {
        Properties props = new Properties();
        try (InputStream in = ConfigLoader.class.getResourceAsStream(DEFAULTS_RESOURCE)) {
            if (in == null) {
                throw new IOException("Missing classpath resource " + DEFAULTS_RESOURCE);
            }
            props.load(in);
        }
        return fromProperties(props, SchedulingConfig.defaults());
    }

    public static SchedulingConfig fromProperties(Properties props, SchedulingConfig base) {
        Set<String> unknown = new TreeSet<>(props.stringPropertyNames());
        unknown.removeAll(KNOWN_KEYS);
        if (!unknown.isEmpty()) {
            throw new IllegalArgumentException("Unknown configuration key(s): " + unknown);
        }

        SchedulingConfig.Builder b = base.toBuilder();
        for (String key : new TreeSet<>(props.stringPropertyNames())) {
            String raw = props.getProperty(key).trim();
            switch (key) {
                case "slotsPerDay": b.slotsPerDay(intValue(key, raw)); break;
                case "minGap": b.minGap(intValue(key, raw)); break;
                case "turnaroundGap": b.turnaroundGap(intValue(key, raw)); break;
                case "largeExamThreshold": b.largeExamThreshold(intValue(key, raw)); break;
                case "examinerCapacity": b.examinerCapacity(intValue(key, raw)); break;
                case "maxExamsPerDay": b.maxExamsPerDay(intValue(key, raw)); break;
                case "largeExamDemand": b.largeExamDemand(intValue(key, raw)); break;
                case "smallExamDemand": b.smallExamDemand(intValue(key, raw)); break;
                case "weight.roomDouble": b.roomDoubleWeight(intValue(key, raw)); break;
                case "weight.clash": b.clashWeight(intValue(key, raw)); break;
                case "weight.minGap": b.minGapWeight(intValue(key, raw)); break;
                case "weight.dayCap": b.dayCapWeight(intValue(key, raw)); break;
                case "weight.turnaround": b.turnaroundWeight(intValue(key, raw)); break;
                case "weight.lastSlot": b.lastSlotWeight(intValue(key, raw)); break;
                case "weight.invigilator": b.invigilatorWeight(intValue(key, raw)); break;
                case "anneal.maxIterations": b.maxIterations(intValue(key, raw)); break;
                case "anneal.startTemperature": b.startTemperature(doubleValue(key, raw)); break;
                case "anneal.endTemperature": b.endTemperature(doubleValue(key, raw)); break;
                case "seed": b.randomSeed(longValue(key, raw)); break;
                default:
                    throw new IllegalStateException("Unhandled key " + key);
            }
        }
        return b.build();
    }

    private static int intValue(String key, String raw) {
        try {
            return Integer.parseInt(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting '" + key + "' is not an integer: " + raw, e);
        }
    }

    private static long longValue(String key, String raw) {
        try {
            return Long.parseLong(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting '" + key + "' is not an integer: " + raw, e);
        }
    }

    private static double doubleValue(String key, String raw) {
        try {
            return Double.parseDouble(raw);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Setting '" + key + "' is not a number: " + raw, e);
        }
    }
}
