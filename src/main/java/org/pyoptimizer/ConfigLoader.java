package org.pyoptimizer;

import org.pyoptimizer.exception.ConfigurationException;
import org.pyoptimizer.model.RuleKind;
import org.snakeyaml.engine.v2.api.Load;
import org.snakeyaml.engine.v2.api.LoadSettings;
import org.snakeyaml.engine.v2.exceptions.YamlEngineException;
import org.snakeyaml.engine.v2.schema.CoreSchema;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Overlays settings from a YAML file onto {@link OptimizerOptions}.
 * <p>
 * The document is a flat mapping. Keys match the option field names; durations are
 * given in seconds and {@code enabledRules} is a list of rule names:
 * <pre>
 * highIterationThreshold: 5000
 * improvementThreshold: 0.1
 * candidateTimeout: 20
 * enabledRules: [flatten, cache]
 * </pre>
 * Keys that are absent keep their current value.
 */
public class ConfigLoader {

    public static void load(Path file, OptimizerOptions options) {
        String text;
        try {
            text = new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new ConfigurationException("cannot read configuration file " + file + ": " + e.getMessage(), e);
        }
        apply(file.toString(), text, options);
    }

    /**
     * Applies a YAML document to {@code options}.
     *
     * @param source name used in error messages
     */
    public static void apply(String source, String yaml, OptimizerOptions options) {
        LoadSettings settings = LoadSettings.builder()
                .setSchema(new CoreSchema())
                .setLabel(source)
                .build();
        Object document;
        try {
            document = new Load(settings).loadFromString(yaml);
        } catch (YamlEngineException e) {
            throw new ConfigurationException(source + ": invalid YAML: " + e.getMessage(), e);
        }
        if (document == null) {
            return;
        }
        if (!(document instanceof Map<?, ?> map)) {
            throw new ConfigurationException(source + ": expected a mapping at the top level");
        }
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            String key = String.valueOf(entry.getKey());
            Object value = entry.getValue();
            if (value == null) {
                continue;
            }
            try {
                applyKey(source, key, value, options);
            } catch (IllegalArgumentException e) {
                throw new ConfigurationException(source + ": bad value for '" + key + "': " + e.getMessage(), e);
            }
        }
    }

    private static void applyKey(String source, String key, Object value, OptimizerOptions options) {
        switch (key) {
            case "highIterationThreshold":
                options.highIterationThreshold = positiveLong(value);
                break;
            case "improvementThreshold":
                options.improvementThreshold = fraction(value);
                break;
            case "candidateTimeout":
                options.candidateTimeout = seconds(value);
                break;
            case "fileTimeout":
                options.fileTimeout = seconds(value);
                break;
            case "enabledRules":
                options.enabledRules = rules(value);
                break;
            case "pythonExecutable":
                options.pythonExecutable = value.toString();
                break;
            case "repeats":
                options.repeats = (int) positiveLong(value);
                break;
            case "workers":
                options.workers = (int) positiveLong(value);
                break;
            case "memoryLimitMb":
                options.memoryLimitMb = (int) nonNegativeLong(value);
                break;
            case "outputDirectory":
                options.outputDirectory = Path.of(value.toString());
                break;
            case "reportFile":
                options.reportFile = Path.of(value.toString());
                break;
            case "analyzeOnly":
                if (!(value instanceof Boolean flag)) {
                    throw new IllegalArgumentException("expected true or false, got " + value);
                }
                options.analyzeOnly = flag;
                break;
            default:
                throw new ConfigurationException(source + ": unknown configuration key '" + key + "'");
        }
    }

    static long positiveLong(Object value) {
        long number = nonNegativeLong(value);
        if (number == 0) {
            throw new IllegalArgumentException("must be positive");
        }
        return number;
    }

    static long nonNegativeLong(Object value) {
        long number;
        if (value instanceof Number n && !(value instanceof Double) && !(value instanceof Float)) {
            number = n.longValue();
        } else {
            number = Long.parseLong(value.toString().trim());
        }
        if (number < 0) {
            throw new IllegalArgumentException("must not be negative");
        }
        return number;
    }

    static double fraction(Object value) {
        double number = value instanceof Number n ? n.doubleValue() : Double.parseDouble(value.toString().trim());
        if (Double.isNaN(number) || number < 0 || number >= 1) {
            throw new IllegalArgumentException("expected a fraction in [0, 1), got " + value);
        }
        return number;
    }

    static Duration seconds(Object value) {
        double number = value instanceof Number n ? n.doubleValue() : Double.parseDouble(value.toString().trim());
        if (Double.isNaN(number) || number <= 0) {
            throw new IllegalArgumentException("expected a positive number of seconds, got " + value);
        }
        return Duration.ofMillis(Math.round(number * 1000));
    }

    static Set<RuleKind> rules(Object value) {
        Set<RuleKind> rules = EnumSet.noneOf(RuleKind.class);
        if (value instanceof List<?> list) {
            for (Object item : list) {
                rules.add(RuleKind.fromOptionName(String.valueOf(item)));
            }
        } else {
            for (String name : value.toString().split(",")) {
                if (!name.isBlank()) {
                    rules.add(RuleKind.fromOptionName(name));
                }
            }
        }
        return rules;
    }
}
