// file: src/main/java/io/treeyaml/editor/EditorConfig.java
package io.treeyaml.editor;

import io.treeyaml.core.NodeIdAllocator;
import io.treeyaml.editor.dto.JsonEditorConfig;

import java.nio.file.Path;
import java.util.Objects;

/**
 * Editor session configuration parsed from CLI args and an optional JSON file.
 *
 * Supports:
 *  - rangeMin / rangeMax: window used by the range query shown with the traversals
 *  - idStrategy:          how node ids are minted (sequential or random)
 *  - idPrefix:            prefix for sequential ids
 *  - echoCommands:        console echoes each command before its output
 */
public record EditorConfig(
        int rangeMin,
        int rangeMax,
        IdStrategy idStrategy,
        String idPrefix,
        boolean echoCommands
) {

    public static final int DEFAULT_RANGE_MIN = 0;
    public static final int DEFAULT_RANGE_MAX = 100;
    public static final String DEFAULT_ID_PREFIX = "node";

    public EditorConfig {
        Objects.requireNonNull(idStrategy, "idStrategy");
        if (idPrefix == null || idPrefix.isBlank()) throw new IllegalArgumentException("idPrefix must not be blank");
    }

    public static EditorConfig defaults() {
        return new EditorConfig(DEFAULT_RANGE_MIN, DEFAULT_RANGE_MAX, IdStrategy.SEQUENTIAL, DEFAULT_ID_PREFIX, false);
    }

    /** Fresh allocator for one editor session. */
    public NodeIdAllocator newAllocator() {
        return idStrategy.allocator(idPrefix);
    }

    /**
     * Small CLI parser.
     *
     * Supported flags:
     *   --config, -c  <path>   JSON config file
     *   --range-min   <int>
     *   --range-max   <int>
     *   --ids         sequential|random
     *   --id-prefix   <text>
     *   --echo
     *   --help,   -h           (handled by the console entry point; ignored here)
     *
     * Precedence: flag, then config file, then default.
     *
     * @throws IllegalArgumentException on unknown flags, missing or malformed values,
     *                                  or an unreadable config file
     */
    public static EditorConfig fromArgs(String[] args) {
        String configPath = null;
        Integer rangeMin = null;
        Integer rangeMax = null;
        IdStrategy ids = null;
        String idPrefix = null;
        Boolean echo = null;

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> {
                    // Console.main prints usage before getting here
                }

                case "--config", "-c" -> {
                    ensureValue(args, i);
                    configPath = args[++i];
                }

                case "--range-min" -> {
                    ensureValue(args, i);
                    rangeMin = parseInt(args[i], args[++i]);
                }

                case "--range-max" -> {
                    ensureValue(args, i);
                    rangeMax = parseInt(args[i], args[++i]);
                }

                case "--ids" -> {
                    ensureValue(args, i);
                    ids = IdStrategy.fromToken(args[++i]);
                }

                case "--id-prefix" -> {
                    ensureValue(args, i);
                    idPrefix = args[++i];
                }

                case "--echo" -> echo = true;

                default -> throw new IllegalArgumentException("Unknown option: " + args[i]);
            }
        }

        JsonEditorConfig file = configPath != null ? EditorJson.readConfig(Path.of(configPath)) : new JsonEditorConfig();

        return new EditorConfig(
                firstNonNull(rangeMin, file.rangeMin, DEFAULT_RANGE_MIN),
                firstNonNull(rangeMax, file.rangeMax, DEFAULT_RANGE_MAX),
                firstNonNull(ids, file.idStrategy != null ? IdStrategy.fromToken(file.idStrategy) : null, IdStrategy.SEQUENTIAL),
                firstNonNull(idPrefix, file.idPrefix, DEFAULT_ID_PREFIX),
                firstNonNull(echo, file.echoCommands, false)
        );
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            throw new IllegalArgumentException("Missing value for option: " + args[i]);
        }
    }

    private static int parseInt(String flag, String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Invalid " + flag.substring(2) + ": " + raw);
        }
    }

    private static <T> T firstNonNull(T flag, T file, T fallback) {
        if (flag != null) return flag;
        return file != null ? file : fallback;
    }

    static String usage() {
        return """
            Usage: treeyaml [options]

            Options:
              --config, -c   Path to JSON editor config (optional)
              --range-min    Lower bound of the range query (default: 0)
              --range-max    Upper bound of the range query (default: 100)
              --ids          Node id strategy: sequential | random (default: sequential)
              --id-prefix    Prefix for sequential ids (default: node)
              --echo         Echo each command before its output
              --help,   -h   Show this help message
            """;
    }
}
