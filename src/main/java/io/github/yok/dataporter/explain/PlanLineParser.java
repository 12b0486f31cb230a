package io.github.yok.dataporter.explain;

import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.apache.commons.lang3.StringUtils;

/**
 * Classifies a single line of PostgreSQL {@code EXPLAIN ANALYZE} text output.
 *
 * <p>
 * The rules are evaluated in the order of {@link PlanLineKind}; the first rule whose pattern
 * matches the start of the cleaned line wins. Lines matching no rule yield an empty result.
 * </p>
 *
 * <p>
 * Before matching, leading {@code (}, {@code '} and {@code "} characters are stripped together
 * with surrounding whitespace, so that lines captured as quoted tuple output such as
 * {@code ('  ->  Sort (cost=...)',)} are recognized too.
 * </p>
 *
 * @author Yasuharu.Okawauchi
 */
public class PlanLineParser {

    /**
     * One (pattern, handler) pair.
     */
    private static final class Rule {
        private final PlanLineKind kind;
        private final Pattern pattern;
        private final Function<Matcher, PlanLineMatch> handler;

        private Rule(PlanLineKind kind, String regex, Function<Matcher, PlanLineMatch> handler) {
            this.kind = kind;
            this.pattern = Pattern.compile(regex);
            this.handler = handler;
        }
    }

    // Priority order; first match wins
    private static final List<Rule> RULES = List.of(
            new Rule(PlanLineKind.OPERATION,
                    "\\s*(?:->\\s*)?([^()]+)\\s+\\(.*?\\)\\s+"
                            + "\\(actual time=(\\d+\\.\\d+)\\.\\.(\\d+\\.\\d+)"
                            + " rows=(\\d+) loops=(\\d+)",
                    m -> PlanLineMatch.operation(m.group(1).trim(),
                            Double.parseDouble(m.group(2)), Double.parseDouble(m.group(3)),
                            Long.parseLong(m.group(4)), Long.parseLong(m.group(5)))),
            new Rule(PlanLineKind.BUFFERS, "Buffers: (.+)",
                    m -> PlanLineMatch.buffers(m.group(1))),
            new Rule(PlanLineKind.HEAP_BLOCKS, "Heap Blocks: exact=(\\d+)",
                    m -> PlanLineMatch.heapBlocks(Long.parseLong(m.group(1)))),
            new Rule(PlanLineKind.PLANNING_TIME, "Planning Time: (\\d+(?:\\.\\d+)?) ms",
                    m -> PlanLineMatch.planningTime(Double.parseDouble(m.group(1)))),
            new Rule(PlanLineKind.EXECUTION_TIME, "Execution Time: (\\d+(?:\\.\\d+)?) ms",
                    m -> PlanLineMatch.executionTime(Double.parseDouble(m.group(1)))),
            new Rule(PlanLineKind.SORT_METHOD,
                    "Sort Method: (\\w+(?: \\w+)?) .*(Memory|Disk): (\\d+\\w+)",
                    m -> PlanLineMatch.sortMethod(m.group(1), m.group(2), m.group(3))));

    /**
     * Returns the line kinds in the order they are tried.
     *
     * @return rule kinds in priority order
     */
    public List<PlanLineKind> priorityOrder() {
        return RULES.stream().map(r -> r.kind).collect(Collectors.toList());
    }

    /**
     * Parses one line.
     *
     * @param line raw line (may be {@code null})
     * @return the first matching rule's fields, or empty if no rule applies
     */
    public Optional<PlanLineMatch> parse(String line) {
        if (line == null) {
            return Optional.empty();
        }
        String cleaned = clean(line);
        for (Rule rule : RULES) {
            Matcher m = rule.pattern.matcher(cleaned);
            if (m.lookingAt()) {
                return Optional.of(rule.handler.apply(m));
            }
        }
        return Optional.empty();
    }

    /**
     * Strips tuple/quote wrapping and surrounding whitespace from a line.
     *
     * @param line raw line
     * @return cleaned line
     */
    static String clean(String line) {
        String stripped = StringUtils.stripStart(line, "('");
        stripped = StringUtils.stripStart(stripped, "(\"");
        return stripped.strip();
    }
}
