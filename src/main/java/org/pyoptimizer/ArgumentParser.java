package org.pyoptimizer;

import org.pyoptimizer.exception.ConfigurationException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

/**
 * The ArgumentParser class turns command-line arguments into an {@link OptimizerOptions}.
 * <p>
 * Settings are layered: the defaults from {@link Configuration}, then the YAML file
 * named by {@code --config} (or {@code pyoptimizer.yaml} in the working directory when
 * it exists), then the remaining switches. Every argument that is not a switch is an
 * input path.
 */
public class ArgumentParser {

    private static final Set<String> VALUE_SWITCHES = Set.of("--threshold", "--improvement", "--timeout",
            "--file-timeout", "--rules", "--python", "--repeats", "--workers", "--memory-limit", "--output",
            "--report", "--config");

    /**
     * Parses the command-line arguments.
     *
     * @param args The command-line arguments to parse.
     * @return the options the run should use
     * @throws ConfigurationException for an unknown switch, a missing or bad value, or
     *                                an invalid configuration file
     */
    public static OptimizerOptions parseArguments(String[] args) {
        OptimizerOptions parsedArgs = new OptimizerOptions();
        loadConfigFile(args, parsedArgs);
        processArgs(args, parsedArgs);
        return parsedArgs;
    }

    /**
     * Applies the configuration file first so that switches override it regardless of
     * their position.
     */
    private static void loadConfigFile(String[] args, OptimizerOptions parsedArgs) {
        Path configFile = null;
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (arg.equals("--")) {
                break;
            }
            if (arg.equals("--config")) {
                configFile = Path.of(requireValue(args, i, arg));
            } else if (arg.startsWith("--config=")) {
                configFile = Path.of(arg.substring("--config=".length()));
            }
        }
        if (configFile == null) {
            Path fallback = Path.of(Configuration.DEFAULT_CONFIG_FILE);
            if (!Files.isRegularFile(fallback)) {
                return;
            }
            configFile = fallback;
        }
        parsedArgs.configFile = configFile;
        ConfigLoader.load(configFile, parsedArgs);
    }

    private static void processArgs(String[] args, OptimizerOptions parsedArgs) {
        boolean readingInputs = false; // after "--" everything is a path

        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            if (readingInputs || !arg.startsWith("-") || arg.equals("-")) {
                parsedArgs.inputs.add(Path.of(arg));
                continue;
            }
            if (arg.equals("--")) {
                readingInputs = true;
                continue;
            }
            if (arg.startsWith("--")) {
                i = processLongSwitches(args, parsedArgs, arg, i);
            } else {
                i = processShortSwitch(args, parsedArgs, arg, i);
            }
        }
    }

    private static int processShortSwitch(String[] args, OptimizerOptions parsedArgs, String arg, int index) {
        switch (arg) {
            case "-h":
                printHelp();
                System.exit(0);
                break;
            case "-o":
                parsedArgs.outputDirectory = Path.of(requireValue(args, index, arg));
                return index + 1;
            case "-j":
                parsedArgs.workers = (int) parseNumber(arg, requireValue(args, index, arg), true);
                return index + 1;
            default:
                throw new ConfigurationException("Unrecognized switch: " + arg + "  (-h will show valid options)");
        }
        return index;
    }

    /**
     * Processes long-form switches. Switches that take a value accept both
     * {@code --name value} and {@code --name=value}.
     *
     * @return The updated index after processing the switch.
     */
    private static int processLongSwitches(String[] args, OptimizerOptions parsedArgs, String arg, int index) {
        String name = arg;
        String inlineValue = null;
        int equals = arg.indexOf('=');
        if (equals > 0) {
            name = arg.substring(0, equals);
            inlineValue = arg.substring(equals + 1);
        }
        switch (name) {
            case "--analyze-only":
                rejectValue(name, inlineValue);
                parsedArgs.analyzeOnly = true;
                return index;
            case "--help":
                printHelp();
                System.exit(0);
                return index;
            case "--version":
                System.out.println("pyoptimizer " + Configuration.version);
                System.exit(0);
                return index;
            default:
                break;
        }
        if (!VALUE_SWITCHES.contains(name)) {
            throw new ConfigurationException("Unrecognized switch: " + name + "  (-h will show valid options)");
        }

        String value = inlineValue;
        int next = index;
        if (value == null) {
            value = requireValue(args, index, name);
            next = index + 1;
        }
        try {
            switch (name) {
                case "--threshold":
                    parsedArgs.highIterationThreshold = parseNumber(name, value, true);
                    break;
                case "--improvement":
                    parsedArgs.improvementThreshold = ConfigLoader.fraction(value);
                    break;
                case "--timeout":
                    parsedArgs.candidateTimeout = ConfigLoader.seconds(value);
                    break;
                case "--file-timeout":
                    parsedArgs.fileTimeout = ConfigLoader.seconds(value);
                    break;
                case "--rules":
                    parsedArgs.enabledRules = ConfigLoader.rules(value);
                    break;
                case "--python":
                    parsedArgs.pythonExecutable = value;
                    break;
                case "--repeats":
                    parsedArgs.repeats = (int) parseNumber(name, value, true);
                    break;
                case "--workers":
                    parsedArgs.workers = (int) parseNumber(name, value, true);
                    break;
                case "--memory-limit":
                    parsedArgs.memoryLimitMb = (int) parseNumber(name, value, false);
                    break;
                case "--output":
                    parsedArgs.outputDirectory = Path.of(value);
                    break;
                case "--report":
                    parsedArgs.reportFile = Path.of(value);
                    break;
                case "--config":
                    // Already applied by loadConfigFile
                    break;
                default:
                    throw new ConfigurationException("Unrecognized switch: " + name + "  (-h will show valid options)");
            }
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Error: bad value for " + name + ": " + e.getMessage(), e);
        }
        return next;
    }

    private static String requireValue(String[] args, int index, String name) {
        if (index + 1 >= args.length) {
            throw new ConfigurationException("Error: " + name + " requires a value");
        }
        return args[index + 1];
    }

    private static void rejectValue(String name, String inlineValue) {
        if (inlineValue != null) {
            throw new ConfigurationException("Error: " + name + " does not take a value");
        }
    }

    private static long parseNumber(String name, String value, boolean positive) {
        try {
            return positive ? ConfigLoader.positiveLong(value) : ConfigLoader.nonNegativeLong(value);
        } catch (IllegalArgumentException e) {
            throw new ConfigurationException("Error: bad value for " + name + ": " + value, e);
        }
    }

    /**
     * Prints the help message detailing the usage of the program and its options.
     */
    private static void printHelp() {
        System.out.println("Usage: java -jar target/pyoptimizer-" + Configuration.version + ".jar [options] path...");
        System.out.println();
        System.out.println("Each path is a Python script or a directory searched recursively for scripts.");
        System.out.println();
        System.out.println("  --threshold N         report counted loops with more than N iterations (default "
                + Configuration.DEFAULT_HIGH_ITERATION_THRESHOLD + ")");
        System.out.println("  --improvement F       minimum runtime or memory gain to accept a patch (default "
                + Configuration.DEFAULT_IMPROVEMENT_THRESHOLD + ")");
        System.out.println("  --timeout SECONDS     limit for one run of a script variant (default "
                + Configuration.DEFAULT_CANDIDATE_TIMEOUT.toSeconds() + ")");
        System.out.println("  --file-timeout SEC    limit for all work on one file (default "
                + Configuration.DEFAULT_FILE_TIMEOUT.toSeconds() + ")");
        System.out.println("  --rules LIST          comma separated rules to enable: flatten,vectorize,cache");
        System.out.println("  --python PATH         Python interpreter used for validation (default "
                + Configuration.DEFAULT_PYTHON + ")");
        System.out.println("  --repeats N           runs per script variant, the fastest counts (default "
                + Configuration.DEFAULT_REPEATS + ")");
        System.out.println("  -j, --workers N       files processed in parallel");
        System.out.println("  --memory-limit MB     address space limit for each run, 0 for none");
        System.out.println("  -o, --output DIR      directory for *_optimized.py files (default: next to the input)");
        System.out.println("  --report FILE         write the JSON report to FILE instead of standard output");
        System.out.println("  --config FILE         YAML configuration file (default: ./"
                + Configuration.DEFAULT_CONFIG_FILE + " if present)");
        System.out.println("  --analyze-only        report findings and planned patches without running Python");
        System.out.println("  --version             print the version");
        System.out.println("  -h, --help            displays this help message");
        System.out.println();
        System.out.println("Set PYOPT_TRACE_ANALYZER=1 to trace the analyzer.");
    }
}
