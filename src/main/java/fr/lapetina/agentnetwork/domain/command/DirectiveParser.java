package fr.lapetina.agentnetwork.domain.command;

import fr.lapetina.agentnetwork.domain.model.ModelType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Turns one mother-agent response into an ordered list of {@link Command}s.
 *
 * Grammar (one directive per line, keywords case-sensitive):
 * - {@code ANALYZE: <text>}
 * - {@code CREATE: <role> | <model_type> | <responsibility>}
 * - {@code TO <instance_ref>: <message>}
 * - {@code SYNTHESIZE}, which must be the last non-blank line
 *
 * Leading whitespace and markdown bullets are ignored. Lines that match nothing
 * are reported as warnings rather than failing the block. Parsing is pure: the
 * same input always yields the same result.
 */
public final class DirectiveParser {

    private static final Logger log = LoggerFactory.getLogger(DirectiveParser.class);

    private static final String ANALYZE = "ANALYZE:";
    private static final String CREATE = "CREATE:";
    private static final String SYNTHESIZE = "SYNTHESIZE";

    private static final Pattern BULLET = Pattern.compile("^[-*]\\s+");
    private static final Pattern ROUTE_PREFIX = Pattern.compile("^TO\\s");
    private static final Pattern ROUTE = Pattern.compile("^TO\\s+([^:]+?)\\s*:\\s*(.*)$");

    /**
     * Parses a directive block.
     *
     * @param rawText mother response, may be null or blank
     * @return commands in parsed order (empty for blank input) and warnings
     * @throws DirectiveParseException if non-blank input does not end with {@code SYNTHESIZE}
     */
    public ParseResult parse(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return ParseResult.empty();
        }

        String[] lines = rawText.split("\\R", -1);
        int terminal = lastNonBlankIndex(lines);
        if (!isSynthesize(normalize(lines[terminal]))) {
            throw new DirectiveParseException(
                    "Directive block must end with " + SYNTHESIZE, lines.length);
        }

        List<Command> commands = new ArrayList<>();
        List<ParseWarning> warnings = new ArrayList<>();
        boolean analyzeSeen = false;
        boolean createContinuation = false;

        for (int i = 0; i < lines.length; i++) {
            String line = normalize(lines[i]);
            int lineNumber = i + 1;

            if (line.isEmpty()) {
                createContinuation = false;
                continue;
            }

            if (line.startsWith(ANALYZE)) {
                createContinuation = false;
                if (analyzeSeen) {
                    warnings.add(new ParseWarning(ParseWarning.Kind.DUPLICATE_ANALYZE, lineNumber, line));
                } else {
                    analyzeSeen = true;
                    commands.add(new Command.Analyze(line.substring(ANALYZE.length()).trim()));
                }
            } else if (line.startsWith(CREATE)) {
                String payload = line.substring(CREATE.length()).trim();
                createContinuation = payload.isEmpty();
                if (!createContinuation) {
                    parseCreate(payload).ifPresentOrElse(commands::add,
                            () -> warnings.add(createWarning(payload, lineNumber, line)));
                }
            } else if (isSynthesize(line)) {
                createContinuation = false;
                if (i == terminal) {
                    commands.add(new Command.Synthesize());
                } else {
                    warnings.add(new ParseWarning(ParseWarning.Kind.MISPLACED_SYNTHESIZE, lineNumber, line));
                }
            } else if (ROUTE_PREFIX.matcher(line).find()) {
                createContinuation = false;
                parseRoute(line).ifPresentOrElse(commands::add,
                        () -> warnings.add(new ParseWarning(ParseWarning.Kind.MALFORMED_ROUTE, lineNumber, line)));
            } else if (createContinuation) {
                parseCreate(line).ifPresentOrElse(commands::add,
                        () -> warnings.add(createWarning(line, lineNumber, line)));
            } else {
                warnings.add(new ParseWarning(ParseWarning.Kind.UNRECOGNIZED_LINE, lineNumber, line));
            }
        }

        log.debug("Directive block parsed: lines={}, commands={}, warnings={}",
                lines.length, commands.size(), warnings.size());

        return new ParseResult(commands, warnings);
    }

    /**
     * Returns true if any line of the text looks like a directive.
     * Used to tell a direct natural-language answer apart from a directive block.
     */
    public boolean containsDirectives(String rawText) {
        if (rawText == null || rawText.isBlank()) {
            return false;
        }
        for (String raw : rawText.split("\\R")) {
            String line = normalize(raw);
            if (line.startsWith(ANALYZE)
                    || line.startsWith(CREATE)
                    || isSynthesize(line)
                    || ROUTE.matcher(line).matches()) {
                return true;
            }
        }
        return false;
    }

    private Optional<Command> parseCreate(String fields) {
        String[] parts = fields.split("\\|", 3);
        String role = parts[0].trim();
        if (role.isEmpty()) {
            return Optional.empty();
        }

        if (parts.length == 3) {
            return ModelType.fromString(parts[1])
                    .map(type -> new Command.Create(role, type, parts[2].trim()));
        }
        if (parts.length == 2) {
            // role | model_type, or role | responsibility
            Optional<ModelType> type = ModelType.fromString(parts[1]);
            if (type.isPresent()) {
                return Optional.of(new Command.Create(role, type.get(), ""));
            }
            return Optional.of(new Command.Create(role, ModelType.NORMAL, parts[1].trim()));
        }
        return Optional.of(new Command.Create(role, ModelType.NORMAL, ""));
    }

    private ParseWarning createWarning(String fields, int lineNumber, String line) {
        String[] parts = fields.split("\\|", 3);
        if (parts.length == 3 && !parts[0].isBlank()) {
            return new ParseWarning(ParseWarning.Kind.UNKNOWN_MODEL_TYPE, lineNumber, line);
        }
        return new ParseWarning(ParseWarning.Kind.MALFORMED_CREATE, lineNumber, line);
    }

    private Optional<Command> parseRoute(String line) {
        Matcher matcher = ROUTE.matcher(line);
        if (!matcher.matches()) {
            return Optional.empty();
        }
        String ref = matcher.group(1).trim();
        String message = matcher.group(2).trim();
        if (ref.isEmpty() || message.isEmpty()) {
            return Optional.empty();
        }
        return Optional.of(new Command.RouteTo(ref, message));
    }

    private static boolean isSynthesize(String line) {
        return line.equals(SYNTHESIZE) || line.equals(SYNTHESIZE + ":");
    }

    private static String normalize(String raw) {
        String line = raw.trim();
        return BULLET.matcher(line).replaceFirst("").trim();
    }

    private static int lastNonBlankIndex(String[] lines) {
        for (int i = lines.length - 1; i >= 0; i--) {
            if (!lines[i].isBlank()) {
                return i;
            }
        }
        return 0;
    }
}
