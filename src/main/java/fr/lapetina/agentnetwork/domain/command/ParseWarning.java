package fr.lapetina.agentnetwork.domain.command;

/**
 * Non-fatal problem found while parsing a directive block.
 *
 * @param kind       what went wrong
 * @param lineNumber 1-based line in the raw response
 * @param line       the offending line, trimmed
 */
public record ParseWarning(Kind kind, int lineNumber, String line) {

    public enum Kind {
        UNRECOGNIZED_LINE("Unrecognized line"),
        UNKNOWN_MODEL_TYPE("Unknown model type"),
        MALFORMED_CREATE("Malformed CREATE directive"),
        MALFORMED_ROUTE("Malformed TO directive"),
        DUPLICATE_ANALYZE("Extra ANALYZE directive ignored"),
        MISPLACED_SYNTHESIZE("SYNTHESIZE before the end of the block ignored");

        private final String message;

        Kind(String message) {
            this.message = message;
        }

        public String getMessage() {
            return message;
        }
    }

    public String describe() {
        return kind.getMessage() + " (line " + lineNumber + "): " + line;
    }
}
