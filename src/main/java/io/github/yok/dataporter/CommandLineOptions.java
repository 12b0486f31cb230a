package io.github.yok.dataporter;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;

/**
 * Parsed command line: a command name followed by {@code --name value} options and
 * {@code --flag} switches.
 *
 * <p>
 * An option takes the following token as its value unless that token starts with {@code -} (or
 * there is none), in which case it is a flag. Option names may be written with underscores
 * ({@code --table_name}); they are normalized to dashes. Short aliases such as {@code -s},
 * {@code -rr} and {@code -gis} map to their long names.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
@Slf4j
@Getter
public final class CommandLineOptions {

    private static final Map<String, String> SHORT_ALIASES = Map.ofEntries(
            Map.entry("-f", "file"), Map.entry("-o", "output"), Map.entry("-s", "start"),
            Map.entry("-e", "end"), Map.entry("-r", "runtime-file"),
            Map.entry("-rr", "rewrite-runtime-file"), Map.entry("-t", "table"),
            Map.entry("-c", "connection"), Map.entry("-gis", "gin-inspection-script"),
            Map.entry("-d", "debug"), Map.entry("-tt", "truncate-table"),
            Map.entry("-dt", "drop-table"), Map.entry("-rd", "random-drop"));

    // Long names accepted as synonyms of the canonical option name
    private static final Map<String, String> SYNONYMS =
            Map.of("table-name", "table", "config-file", "connection");

    private final String command;

    @Getter(lombok.AccessLevel.NONE)
    private final Map<String, String> values;

    @Getter(lombok.AccessLevel.NONE)
    private final Set<String> flags;

    private CommandLineOptions(String command, Map<String, String> values, Set<String> flags) {
        this.command = command;
        this.values = Collections.unmodifiableMap(values);
        this.flags = Collections.unmodifiableSet(flags);
    }

    /**
     * Parses the raw arguments.
     *
     * @param args command-line arguments; the first non-option token is the command
     * @return parsed options
     */
    public static CommandLineOptions parse(String... args) {
        String command = null;
        Map<String, String> values = new LinkedHashMap<>();
        Set<String> flags = new LinkedHashSet<>();
        for (int i = 0; i < args.length; i++) {
            String arg = args[i];
            String name = optionName(arg);
            if (name == null) {
                if (command == null) {
                    command = arg;
                } else {
                    log.warn("Unknown argument: {}", arg);
                }
                continue;
            }
            if (i + 1 < args.length && !args[i + 1].startsWith("-")) {
                values.put(name, args[++i]);
            } else {
                flags.add(name);
            }
        }
        return new CommandLineOptions(command, values, flags);
    }

    /**
     * Returns the value of an option.
     *
     * @param name canonical option name without dashes
     * @return value, or empty when not given
     */
    public Optional<String> get(String name) {
        return Optional.ofNullable(values.get(name)).filter(StringUtils::isNotBlank);
    }

    /**
     * Returns the value of a mandatory option.
     *
     * @param name canonical option name without dashes
     * @return value
     * @throws IllegalArgumentException when the option is missing
     */
    public String require(String name) {
        return get(name).orElseThrow(
                () -> new IllegalArgumentException("Missing required option --" + name));
    }

    /**
     * Returns the value of an integer option.
     *
     * @param name canonical option name without dashes
     * @param defaultValue value used when the option is missing
     * @return parsed value
     * @throws IllegalArgumentException when the value is not an integer
     */
    public int getInt(String name, int defaultValue) {
        Optional<String> raw = get(name);
        if (raw.isEmpty()) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(raw.get().trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(
                    "Option --" + name + " must be an integer: " + raw.get(), e);
        }
    }

    /**
     * Returns whether a switch was given.
     *
     * @param name canonical option name without dashes
     * @return {@code true} when present
     */
    public boolean has(String name) {
        return flags.contains(name) || values.containsKey(name);
    }

    /**
     * Returns the names of all given options and switches.
     *
     * @return option names in command-line order
     */
    public List<String> names() {
        Set<String> all = new LinkedHashSet<>(values.keySet());
        all.addAll(flags);
        return List.copyOf(all);
    }

    private static String optionName(String arg) {
        if (arg.startsWith("--") && arg.length() > 2) {
            String name = arg.substring(2).replace('_', '-');
            return SYNONYMS.getOrDefault(name, name);
        }
        if (arg.startsWith("-") && arg.length() > 1) {
            return SHORT_ALIASES.getOrDefault(arg, arg.substring(1));
        }
        return null;
    }
}
