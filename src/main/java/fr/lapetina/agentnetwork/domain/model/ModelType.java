package fr.lapetina.agentnetwork.domain.model;

import java.util.Locale;
import java.util.Optional;

/**
 * Model flavour an instance runs on.
 */
public enum ModelType {
    NORMAL,
    THINKING;

    /**
     * Lower-case wire name ({@code normal}, {@code thinking}).
     */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Case-insensitive lookup; returns empty for anything else.
     */
    public static Optional<ModelType> fromString(String value) {
        if (value == null) {
            return Optional.empty();
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "normal" -> Optional.of(NORMAL);
            case "thinking" -> Optional.of(THINKING);
            default -> Optional.empty();
        };
    }
}
