package fr.lapetina.agentnetwork.infrastructure.config;

/**
 * Notified each time {@link ConfigLoader} installs a validated configuration.
 */
@FunctionalInterface
public interface ConfigChangeListener {

    /**
     * @param previous configuration being replaced, null on the first load
     * @param current  configuration now in effect
     */
    void onConfigChanged(AgentNetworkConfig previous, AgentNetworkConfig current);
}
