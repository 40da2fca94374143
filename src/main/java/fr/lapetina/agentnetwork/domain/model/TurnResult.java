package fr.lapetina.agentnetwork.domain.model;

import fr.lapetina.agentnetwork.domain.event.TurnState;

import java.time.Duration;
import java.util.List;
import java.util.Objects;

/**
 * Outcome of one completed user turn.
 *
 * @param turnId        identifier used in logs and MDC
 * @param finalResponse the synthesized (or degraded) answer
 * @param listing       instance listing after the turn
 * @param workerOutputs outputs in parsed TO order, failures included
 * @param warnings      non-fatal problems encountered during the turn
 * @param degraded      true when synthesis failed and outputs were concatenated
 * @param finalState    always {@link TurnState#COMPLETE} for a returned result
 * @param duration      wall time of the turn
 */
public record TurnResult(
        String turnId,
        String finalResponse,
        InstanceListing listing,
        List<WorkerOutput> workerOutputs,
        List<String> warnings,
        boolean degraded,
        TurnState finalState,
        Duration duration
) {
    public TurnResult {
        Objects.requireNonNull(turnId, "Turn ID is required");
        Objects.requireNonNull(finalResponse, "Final response is required");
        listing = listing != null ? listing : InstanceListing.empty();
        workerOutputs = workerOutputs != null ? List.copyOf(workerOutputs) : List.of();
        warnings = warnings != null ? List.copyOf(warnings) : List.of();
        finalState = finalState != null ? finalState : TurnState.COMPLETE;
        duration = duration != null ? duration : Duration.ZERO;
    }
}
