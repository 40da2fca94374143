package fr.lapetina.agentnetwork.orchestration;

import fr.lapetina.agentnetwork.infrastructure.config.AgentNetworkConfig;

import java.time.Duration;

/**
 * Tunables of the turn loop.
 *
 * @param callTimeout      per model call, independent of rate-limiter backoff
 * @param turnTimeout      whole turn; outstanding worker calls are abandoned when it passes
 * @param historyWindow    past outputs of a worker included in its prompt
 * @param maxMessageLength longest accepted user message
 */
public record OrchestratorSettings(
        Duration callTimeout,
        Duration turnTimeout,
        int historyWindow,
        int maxMessageLength
) {
    public static OrchestratorSettings from(AgentNetworkConfig.OrchestrationConfig config) {
        return new OrchestratorSettings(
                Duration.ofMillis(config.getCallTimeoutMs()),
                Duration.ofMillis(config.getTurnTimeoutMs()),
                config.getHistoryWindow(),
                config.getMaxMessageLength());
    }
}
