package fr.lapetina.agentnetwork.orchestration;

import fr.lapetina.agentnetwork.domain.event.TurnState;
import fr.lapetina.agentnetwork.domain.model.ErrorType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable state of one user turn.
 *
 * Only the orchestrating thread touches it. Each state change is logged so a turn
 * can be followed through the logs by its id.
 */
final class Turn {

    private static final Logger log = LoggerFactory.getLogger(Turn.class);

    private final String id;
    private final String userMessage;
    private final String taskContext;
    private final boolean followUp;
    private final Instant startedAt;
    private final Instant deadline;

    private TurnState state = TurnState.AWAITING_DIRECTIVES;
    private String analysis;
    private final List<String> warnings = new ArrayList<>();
    private ErrorType errorType;

    Turn(String id, String userMessage, String previousTaskContext, Duration timeout) {
        this.id = id;
        this.userMessage = userMessage;
        this.followUp = previousTaskContext != null;
        this.taskContext = followUp ? previousTaskContext : userMessage;
        this.startedAt = Instant.now();
        this.deadline = startedAt.plus(timeout);
    }

    void transition(TurnState next) {
        if (state.isTerminal()) {
            throw new IllegalStateException("Turn " + id + " already " + state);
        }
        log.debug("Turn state changed: turnId={}, {} -> {}", id, state, next);
        state = next;
    }

    void fail(ErrorType errorType) {
        this.errorType = errorType;
        if (!state.isTerminal()) {
            log.debug("Turn state changed: turnId={}, {} -> {}", id, state, TurnState.FAILED);
            state = TurnState.FAILED;
        }
    }

    void warn(String warning) {
        log.warn("Turn warning: turnId={}, warning={}", id, warning);
        warnings.add(warning);
    }

    /**
     * Time left before the turn deadline, never negative.
     */
    Duration remaining() {
        Duration left = Duration.between(Instant.now(), deadline);
        return left.isNegative() ? Duration.ZERO : left;
    }

    /**
     * The shorter of {@code callTimeout} and the time left in the turn.
     */
    Duration boundedBy(Duration callTimeout) {
        Duration left = remaining();
        return left.compareTo(callTimeout) < 0 ? left : callTimeout;
    }

    Duration elapsed() {
        return Duration.between(startedAt, Instant.now());
    }

    String getId() {
        return id;
    }

    String getUserMessage() {
        return userMessage;
    }

    /**
     * The first turn's message on follow-ups, this turn's message otherwise.
     */
    String getTaskContext() {
        return taskContext;
    }

    boolean isFollowUp() {
        return followUp;
    }

    Instant getDeadline() {
        return deadline;
    }

    TurnState getState() {
        return state;
    }

    String getAnalysis() {
        return analysis;
    }

    void setAnalysis(String analysis) {
        this.analysis = analysis;
    }

    List<String> getWarnings() {
        return List.copyOf(warnings);
    }

    ErrorType getErrorType() {
        return errorType;
    }
}
