package fr.lapetina.agentnetwork.domain.command;

/**
 * Discriminator for the closed set of directive commands.
 */
public enum CommandType {
    ANALYZE,
    CREATE,
    ROUTE_TO,
    SYNTHESIZE
}
