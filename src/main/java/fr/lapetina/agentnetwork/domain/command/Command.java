package fr.lapetina.agentnetwork.domain.command;

import fr.lapetina.agentnetwork.domain.model.ModelType;

import java.util.Objects;

/**
 * A single parsed directive from the mother agent.
 *
 * <p>The set of implementations is closed: consumers switch over {@link #type()}
 * and cast to the matching record.
 */
public interface Command {

    CommandType type();

    /**
     * {@code ANALYZE: <text>}
     */
    record Analyze(String text) implements Command {
        public Analyze {
            Objects.requireNonNull(text, "Text is required");
        }

        @Override
        public CommandType type() {
            return CommandType.ANALYZE;
        }
    }

    /**
     * {@code CREATE: <role> | <model_type> | <responsibility>}
     */
    record Create(String role, ModelType modelType, String responsibility) implements Command {
        public Create {
            Objects.requireNonNull(role, "Role is required");
            Objects.requireNonNull(modelType, "Model type is required");
            responsibility = responsibility != null ? responsibility : "";
        }

        @Override
        public CommandType type() {
            return CommandType.CREATE;
        }
    }

    /**
     * {@code TO <instance_ref>: <message>}. The reference is resolved at execution time.
     */
    record RouteTo(String instanceRef, String message) implements Command {
        public RouteTo {
            Objects.requireNonNull(instanceRef, "Instance reference is required");
            Objects.requireNonNull(message, "Message is required");
        }

        @Override
        public CommandType type() {
            return CommandType.ROUTE_TO;
        }
    }

    /**
     * {@code SYNTHESIZE}, always the terminal command of a block.
     */
    record Synthesize() implements Command {
        @Override
        public CommandType type() {
            return CommandType.SYNTHESIZE;
        }
    }
}
