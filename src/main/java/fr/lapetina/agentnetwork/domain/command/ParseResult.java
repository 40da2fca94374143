package fr.lapetina.agentnetwork.domain.command;

import java.util.List;

/**
 * Commands in parsed order plus the warnings collected on the way.
 */
public record ParseResult(List<Command> commands, List<ParseWarning> warnings) {
    public ParseResult {
        commands = commands != null ? List.copyOf(commands) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
    }

    public static ParseResult empty() {
        return new ParseResult(List.of(), List.of());
    }

    public boolean isEmpty() {
        return commands.isEmpty();
    }

    public List<Command> ofType(CommandType type) {
        return commands.stream()
                .filter(command -> command.type() == type)
                .toList();
    }
}
