package fr.lapetina.agentnetwork.domain.command;

/**
 * Thrown when a mother response is structurally invalid as a directive block.
 */
public final class DirectiveParseException extends RuntimeException {

    private final int lineCount;

    public DirectiveParseException(String message, int lineCount) {
        super(message);
        this.lineCount = lineCount;
    }

    public int getLineCount() {
        return lineCount;
    }
}
