package fr.lapetina.agentnetwork.orchestration;

import fr.lapetina.agentnetwork.domain.command.Command;
import fr.lapetina.agentnetwork.domain.command.DirectiveParseException;
import fr.lapetina.agentnetwork.domain.command.DirectiveParser;
import fr.lapetina.agentnetwork.domain.command.ParseResult;
import fr.lapetina.agentnetwork.domain.event.TurnState;
import fr.lapetina.agentnetwork.domain.model.AgentNetworkException;
import fr.lapetina.agentnetwork.domain.model.ErrorType;
import fr.lapetina.agentnetwork.domain.model.Instance;
import fr.lapetina.agentnetwork.domain.model.InstanceListing;
import fr.lapetina.agentnetwork.domain.model.InstanceStatus;
import fr.lapetina.agentnetwork.domain.model.InstanceView;
import fr.lapetina.agentnetwork.domain.model.NetworkStats;
import fr.lapetina.agentnetwork.domain.model.TurnResult;
import fr.lapetina.agentnetwork.domain.model.WorkerOutput;
import fr.lapetina.agentnetwork.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.agentnetwork.infrastructure.ratelimit.RateLimitExceededException;
import fr.lapetina.agentnetwork.orchestration.WorkerDispatcher.Assignment;
import fr.lapetina.agentnetwork.orchestration.exception.DuplicateRoleException;
import fr.lapetina.agentnetwork.orchestration.exception.TurnFailedException;
import fr.lapetina.agentnetwork.orchestration.exception.UnknownInstanceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Drives user turns through the mother agent and its workers.
 *
 * One turn: ask the mother for a directive block, realize CREATE commands in order,
 * fan out TO commands concurrently, then synthesize the outputs into one answer.
 * Turns on the same network run one at a time.
 *
 * <p>Only two conditions abort a turn: the mother cannot be reached, or it keeps answering
 * with malformed directive blocks after one corrective re-prompt. Everything else
 * (unknown references, failing workers, a failing synthesis call) degrades the result
 * and is reported as a warning.
 */
public final class Orchestrator implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(Orchestrator.class);
    private static final AtomicLong TURN_SEQUENCE = new AtomicLong();

    private final InstanceRegistry registry;
    private final DirectiveParser parser;
    private final ModelGateway gateway;
    private final WorkerDispatcher dispatcher;
    private final SynthesisEngine synthesisEngine;
    private final PromptLibrary prompts;
    private final MetricsRegistry metrics;
    private final OrchestratorSettings settings;

    private final ReentrantLock turnLock = new ReentrantLock(true);
    private final AtomicInteger turnCount = new AtomicInteger();
    private volatile String lastResponse;

    public Orchestrator(
            InstanceRegistry registry,
            DirectiveParser parser,
            ModelGateway gateway,
            WorkerDispatcher dispatcher,
            PromptLibrary prompts,
            MetricsRegistry metrics,
            OrchestratorSettings settings
    ) {
        this.registry = registry;
        this.parser = parser;
        this.gateway = gateway;
        this.dispatcher = dispatcher;
        this.prompts = prompts;
        this.metrics = metrics;
        this.settings = settings;
        this.synthesisEngine = new SynthesisEngine(gateway, prompts);
    }

    /**
     * Runs one full turn.
     *
     * @return final response plus the instance listing after the turn
     * @throws TurnFailedException if the message is invalid or the turn cannot produce a response
     */
    public TurnResult submitUserMessage(String message) {
        validate(message);

        try {
            turnLock.lockInterruptibly();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TurnFailedException(ErrorType.INTERNAL_ERROR, "Interrupted while waiting for the previous turn");
        }

        Turn turn = new Turn("turn-" + TURN_SEQUENCE.incrementAndGet(), message,
                registry.getFirstTaskContext().orElse(null), settings.turnTimeout());
        MDC.put("turnId", turn.getId());
        metrics.turnStarted();

        try {
            log.info("Turn started: turnId={}, followUp={}, messageLength={}",
                    turn.getId(), turn.isFollowUp(), message.length());
            log.debug("User message: turnId={}, message={}", turn.getId(), message);

            TurnResult result = runTurn(turn);

            metrics.recordTurn(TurnState.COMPLETE, null, result.degraded(), result.duration());
            log.info("Turn completed: turnId={}, workers={}, failed={}, degraded={}, warnings={}, latencyMs={}",
                    turn.getId(), result.workerOutputs().size(),
                    result.workerOutputs().stream().filter(WorkerOutput::isFailure).count(),
                    result.degraded(), result.warnings().size(), result.duration().toMillis());
            return result;

        } catch (TurnFailedException e) {
            turn.fail(e.getErrorType());
            metrics.recordTurn(TurnState.FAILED, e.getErrorType(), false, turn.elapsed());
            log.error("Turn failed: turnId={}, state={}, errorType={}, error={}",
                    turn.getId(), e.getFailedIn(), e.getErrorType(), e.getMessage());
            throw e;
        } catch (RuntimeException e) {
            TurnState failedIn = turn.getState();
            turn.fail(ErrorType.INTERNAL_ERROR);
            metrics.recordTurn(TurnState.FAILED, ErrorType.INTERNAL_ERROR, false, turn.elapsed());
            log.error("Turn failed unexpectedly: turnId={}, state={}", turn.getId(), failedIn, e);
            throw new TurnFailedException(ErrorType.INTERNAL_ERROR, "Failed to process message",
                    turn.getId(), failedIn, e);
        } finally {
            turnCount.incrementAndGet();
            metrics.turnFinished();
            metrics.setInstanceCount(instanceCount());
            MDC.remove("turnId");
            turnLock.unlock();
        }
    }

    private TurnResult runTurn(Turn turn) {
        Instance mother = registry.getOrCreateMother();
        String reply = callMother(turn, mother, directivePrompt(turn));

        if (turn.isFollowUp() && !parser.containsDirectives(reply)) {
            log.info("Mother answered directly: turnId={}", turn.getId());
            return complete(turn, mother, reply.strip(), List.of(), false);
        }

        ParseResult parsed;
        try {
            parsed = parser.parse(reply);
        } catch (DirectiveParseException e) {
            log.warn("Malformed directive block, re-prompting: turnId={}, error={}", turn.getId(), e.getMessage());
            String corrected = callMother(turn, mother, correctivePrompt(turn, reply, e.getMessage()));
            if (turn.isFollowUp() && !parser.containsDirectives(corrected)) {
                return complete(turn, mother, corrected.strip(), List.of(), false);
            }
            try {
                parsed = parser.parse(corrected);
            } catch (DirectiveParseException retryError) {
                throw new TurnFailedException(ErrorType.PARSE_ERROR,
                        "Mother response is not a valid directive block", turn.getId(), turn.getState(), retryError);
            }
        }
        parsed.warnings().forEach(warning -> turn.warn(warning.describe()));

        turn.transition(TurnState.EXECUTING_COMMANDS);
        List<Assignment> assignments = execute(turn, parsed);

        turn.transition(TurnState.AWAITING_WORKER_OUTPUTS);
        List<WorkerOutput> outputs = runWorkers(turn, mother, assignments);

        turn.transition(TurnState.SYNTHESIZING);
        if (outputs.isEmpty()) {
            return complete(turn, mother, answerDirectly(turn), outputs, false);
        }

        try {
            String synthesized = dispatcher.callWithTimeout(
                    () -> synthesisEngine.synthesize(turn.getUserMessage(), priorTurn(turn), outputs),
                    settings.callTimeout());
            if (synthesized.isBlank()) {
                throw new AgentNetworkException(ErrorType.SYNTHESIS_FAILED, "Synthesis returned an empty response");
            }
            return complete(turn, mother, synthesized, outputs, false);
        } catch (AgentNetworkException e) {
            turn.warn("Synthesis failed (" + e.getErrorType() + "), returning raw worker outputs");
            return complete(turn, mother, SynthesisEngine.degrade(outputs), outputs, true);
        }
    }

    private List<Assignment> execute(Turn turn, ParseResult parsed) {
        List<Assignment> assignments = new ArrayList<>();
        for (Command command : parsed.commands()) {
            switch (command.type()) {
                case ANALYZE -> turn.setAnalysis(((Command.Analyze) command).text());
                case CREATE -> realize(turn, (Command.Create) command);
                case ROUTE_TO -> route(turn, (Command.RouteTo) command).ifPresent(assignments::add);
                case SYNTHESIZE -> log.debug("Synthesize directive reached: turnId={}, assignments={}",
                        turn.getId(), assignments.size());
            }
        }
        return assignments;
    }

    private void realize(Turn turn, Command.Create create) {
        try {
            registry.create(create.role(), create.modelType(), create.responsibility());
        } catch (DuplicateRoleException e) {
            Instance existing = e.getExisting();
            turn.warn("Reusing instance " + existing.getId() + " for role " + create.role());
        }
    }

    private Optional<Assignment> route(Turn turn, Command.RouteTo routeTo) {
        try {
            return Optional.of(new Assignment(registry.resolve(routeTo.instanceRef()), routeTo.message()));
        } catch (UnknownInstanceException e) {
            turn.warn("Unknown instance '" + e.getReference() + "', message skipped");
            return Optional.empty();
        }
    }

    private List<WorkerOutput> runWorkers(Turn turn, Instance mother, List<Assignment> assignments) {
        if (assignments.isEmpty()) {
            return List.of();
        }

        for (Assignment assignment : assignments) {
            registry.markStatus(assignment.target().getId(), InstanceStatus.BUSY);
            registry.connect(mother.getId(), assignment.target().getId());
        }

        List<WorkerOutput> outputs = dispatcher.dispatch(assignments,
                (assignment, earlier) -> gateway.call(ModelGateway.CallKind.WORKER,
                        workerPrompt(turn, assignment, earlier), assignment.target().getModelType()),
                turn.getDeadline());

        // Results are recorded only once settled, so late arrivals never reach the registry
        for (WorkerOutput output : outputs) {
            if (output.isSuccess()) {
                registry.recordOutput(output.instanceId(), output.text());
                registry.markStatus(output.instanceId(), InstanceStatus.IDLE);
            } else {
                registry.markStatus(output.instanceId(), InstanceStatus.ERRORED);
                metrics.incrementWorkerFailure(output.errorType());
                turn.warn("Instance " + output.instanceId() + " failed to respond: " + output.errorType());
            }
        }
        return outputs;
    }

    private String answerDirectly(Turn turn) {
        try {
            String answer = dispatcher.callWithTimeout(
                    () -> synthesisEngine.directAnswer(turn.getUserMessage(), turn.getAnalysis(), priorTurn(turn)),
                    settings.callTimeout());
            if (!answer.isBlank()) {
                return answer;
            }
        } catch (AgentNetworkException e) {
            log.warn("Direct answer failed: turnId={}, errorType={}", turn.getId(), e.getErrorType());
        }

        String analysis = turn.getAnalysis();
        if (analysis != null && !analysis.isBlank()) {
            turn.warn("Direct answer failed, returning the mother's analysis");
            return analysis;
        }
        throw new TurnFailedException(ErrorType.SYNTHESIS_FAILED, "Failed to produce a response",
                turn.getId(), turn.getState(), null);
    }

    private String callMother(Turn turn, Instance mother, String prompt) {
        registry.markStatus(mother.getId(), InstanceStatus.BUSY);
        try {
            String reply = dispatcher.callWithTimeout(
                    () -> gateway.call(ModelGateway.CallKind.MOTHER, prompt, mother.getModelType()),
                    turn.boundedBy(settings.callTimeout()));
            if (reply == null || reply.isBlank()) {
                throw new AgentNetworkException(ErrorType.PROVIDER_ERROR, "Mother returned an empty response");
            }
            registry.markStatus(mother.getId(), InstanceStatus.IDLE);
            return reply;
        } catch (AgentNetworkException e) {
            registry.markStatus(mother.getId(), InstanceStatus.ERRORED);
            if (isTimeout(e)) {
                throw new TurnFailedException(ErrorType.TIMEOUT, "Mother agent timed out",
                        turn.getId(), turn.getState(), e);
            }
            throw new TurnFailedException(ErrorType.MOTHER_UNAVAILABLE, "Mother agent unavailable: " + e.getMessage(),
                    turn.getId(), turn.getState(), e);
        }
    }

    private static boolean isTimeout(AgentNetworkException e) {
        if (e.getErrorType() == ErrorType.TIMEOUT) {
            return true;
        }
        return e instanceof RateLimitExceededException
                && ((RateLimitExceededException) e).getLastErrorType() == ErrorType.TIMEOUT;
    }

    private TurnResult complete(Turn turn, Instance mother, String finalResponse, List<WorkerOutput> outputs, boolean degraded) {
        turn.transition(TurnState.COMPLETE);
        // The mother's history holds the answers it gave the user, not its directive blocks
        registry.recordOutput(mother.getId(), finalResponse);
        registry.setFirstTaskContext(turn.getUserMessage());
        lastResponse = finalResponse;
        return new TurnResult(turn.getId(), finalResponse, registry.list(), outputs,
                turn.getWarnings(), degraded, TurnState.COMPLETE, turn.elapsed());
    }

    private String directivePrompt(Turn turn) {
        if (!turn.isFollowUp()) {
            return prompts.render(PromptTemplate.MOTHER_INITIALIZATION, Map.of(
                    "user_message", turn.getUserMessage(),
                    "team", describeTeam()));
        }
        String previous = lastResponse;
        return prompts.render(PromptTemplate.FOLLOW_UP, Map.of(
                "task_context", turn.getTaskContext(),
                "previous_response", previous != null ? previous : "(none)",
                "team", describeTeam(),
                "user_message", turn.getUserMessage()));
    }

    private SynthesisEngine.PriorTurn priorTurn(Turn turn) {
        return turn.isFollowUp() ? new SynthesisEngine.PriorTurn(turn.getTaskContext(), lastResponse) : null;
    }

    private String correctivePrompt(Turn turn, String reply, String error) {
        return prompts.render(PromptTemplate.CORRECTIVE_REPROMPT, Map.of(
                "error", error,
                "previous_response", reply,
                "user_message", turn.getUserMessage()));
    }

    private String workerPrompt(Turn turn, Assignment assignment, List<String> earlier) {
        Instance target = assignment.target();
        List<String> history = new ArrayList<>(target.recentOutputs(settings.historyWindow()));
        history.addAll(earlier);
        if (history.size() > settings.historyWindow()) {
            history = history.subList(history.size() - settings.historyWindow(), history.size());
        }

        return prompts.render(PromptTemplate.WORKER_TASK, Map.of(
                "role", target.getRole(),
                "responsibility", target.getResponsibility().isBlank() ? "(unspecified)" : target.getResponsibility(),
                "task_context", turn.getTaskContext(),
                "history", history.isEmpty() ? "(none)" : history.stream()
                        .map(output -> "- " + output)
                        .collect(Collectors.joining("\n")),
                "message", assignment.message()));
    }

    private String describeTeam() {
        List<Instance> workers = registry.getWorkers();
        if (workers.isEmpty()) {
            return "(no specialists yet)";
        }
        return workers.stream()
                .map(i -> "- " + i.getId() + ": " + i.getRole()
                        + " (" + i.getModelType().wireName() + ", " + i.getStatus().wireName() + ")")
                .collect(Collectors.joining("\n"));
    }

    private void validate(String message) {
        if (message == null || message.isBlank()) {
            throw new TurnFailedException(ErrorType.VALIDATION_ERROR, "Message must not be empty");
        }
        if (message.length() > settings.maxMessageLength()) {
            throw new TurnFailedException(ErrorType.VALIDATION_ERROR,
                    "Message exceeds " + settings.maxMessageLength() + " characters");
        }
    }

    /**
     * Mother plus workers in creation order.
     */
    public InstanceListing listInstances() {
        return registry.list();
    }

    public Optional<InstanceView> getInstance(String id) {
        return registry.getInstance(id).map(Instance::toView);
    }

    /**
     * Resets the network. Waits for a running turn to finish first.
     */
    public void clear() {
        turnLock.lock();
        try {
            registry.clear();
            turnCount.set(0);
            lastResponse = null;
            metrics.setInstanceCount(0);
            log.info("Network cleared");
        } finally {
            turnLock.unlock();
        }
    }

    public NetworkStats networkStats() {
        Optional<Instance> mother = registry.getMother();
        List<Instance> workers = registry.getWorkers();

        int totalMessages = workers.stream().mapToInt(Instance::getOutputCount).sum()
                + mother.map(Instance::getOutputCount).orElse(0);
        long uptime = mother
                .map(m -> Math.max(0, Duration.between(m.getCreatedAt(), Instant.now()).getSeconds()))
                .orElse(0L);

        return new NetworkStats(
                workers.size() + (mother.isPresent() ? 1 : 0),
                totalMessages,
                uptime,
                mother.isPresent() ? "active" : "inactive",
                turnCount.get());
    }

    private int instanceCount() {
        return registry.size() + (registry.getMother().isPresent() ? 1 : 0);
    }

    public InstanceRegistry getRegistry() {
        return registry;
    }

    @Override
    public void close() {
        dispatcher.close();
    }
}
