package fr.lapetina.agentnetwork.domain.model;

import java.util.Locale;

/**
 * Lifecycle status of an agent instance.
 */
public enum InstanceStatus {
    /** Registered, never called */
    CREATED,

    /** A model call is in flight */
    BUSY,

    /** Last call succeeded */
    IDLE,

    /** Last call failed */
    ERRORED;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
