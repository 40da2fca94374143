package fr.lapetina.agentnetwork.orchestration;

import fr.lapetina.agentnetwork.domain.command.DirectiveParser;
import fr.lapetina.agentnetwork.domain.event.TurnState;
import fr.lapetina.agentnetwork.domain.model.ErrorType;
import fr.lapetina.agentnetwork.domain.model.InstanceListing;
import fr.lapetina.agentnetwork.domain.model.InstanceView;
import fr.lapetina.agentnetwork.domain.model.ModelType;
import fr.lapetina.agentnetwork.domain.model.NetworkStats;
import fr.lapetina.agentnetwork.domain.model.TurnResult;
import fr.lapetina.agentnetwork.domain.model.WorkerOutput;
import fr.lapetina.agentnetwork.infrastructure.client.ModelClientException;
import fr.lapetina.agentnetwork.infrastructure.metrics.MetricsRegistry;
import fr.lapetina.agentnetwork.infrastructure.ratelimit.BackoffPolicy;
import fr.lapetina.agentnetwork.infrastructure.ratelimit.RateLimiter;
import fr.lapetina.agentnetwork.integration.StubModelClient;
import fr.lapetina.agentnetwork.integration.StubModelClient.Kind;
import fr.lapetina.agentnetwork.orchestration.exception.TurnFailedException;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class OrchestratorTest {

    private static final String TEAM_BLOCK = """
            ANALYZE: The user wants a comparison of two databases
            CREATE: researcher | thinking | gathers facts
            CREATE: writer | normal | writes the answer
            TO researcher: compare Postgres and MySQL
            TO writer: draft a short comparison
            SYNTHESIZE
            """;

    private StubModelClient stub;
    private InstanceRegistry registry;
    private MetricsRegistry metrics;
    private Orchestrator orchestrator;

    @BeforeEach
    void setUp() {
        stub = new StubModelClient();
        registry = new InstanceRegistry();
        metrics = new MetricsRegistry("test");

        RateLimiter rateLimiter = new RateLimiter(BackoffPolicy.fixed(Duration.ofMillis(1), Duration.ofMillis(5)));
        rateLimiter.configureEndpoint("test_api", 1000, 1000.0, 0);

        ModelGateway gateway = new ModelGateway(stub, rateLimiter,
                Map.of(ModelType.NORMAL, "test_api", ModelType.THINKING, "test_api"), metrics);

        orchestrator = new Orchestrator(
                registry,
                new DirectiveParser(),
                gateway,
                new WorkerDispatcher(4, Duration.ofMillis(500)),
                PromptLibrary.load("prompts.md"),
                metrics,
                new OrchestratorSettings(Duration.ofMillis(500), Duration.ofSeconds(3), 3, 2000));
    }

    @AfterEach
    void tearDown() {
        orchestrator.close();
        metrics.close();
    }

    @Nested
    @DisplayName("complete turns")
    class CompleteTurns {

        @Test
        @DisplayName("should create workers, dispatch messages and synthesize")
        void shouldRunFullTurn() {
            stub.motherReplies(TEAM_BLOCK)
                    .onSynthesis(prompt -> "Postgres for analytics, MySQL for simple web apps.");

            TurnResult result = orchestrator.submitUserMessage("Compare Postgres and MySQL");

            assertThat(result.finalResponse()).isEqualTo("Postgres for analytics, MySQL for simple web apps.");
            assertThat(result.finalState()).isEqualTo(TurnState.COMPLETE);
            assertThat(result.degraded()).isFalse();
            assertThat(result.warnings()).isEmpty();
            assertThat(result.workerOutputs()).extracting(WorkerOutput::role).containsExactly("researcher", "writer");
            assertThat(result.workerOutputs()).allMatch(WorkerOutput::isSuccess);

            InstanceListing listing = result.listing();
            String motherId = listing.mother().id();
            assertThat(listing.instances()).hasSize(2);
            assertThat(listing.instances()).allSatisfy(view -> {
                assertThat(view.status()).isEqualTo("idle");
                assertThat(view.connectedTo()).containsExactly(motherId);
                assertThat(view.outputHistory()).containsExactly("Output of " + view.role());
            });
            assertThat(listing.mother().outputHistory()).containsExactly(result.finalResponse());
            assertThat(registry.getFirstTaskContext()).contains("Compare Postgres and MySQL");
        }

        @Test
        @DisplayName("should send each worker its role, task context and message on its model type")
        void shouldBuildWorkerPrompts() {
            stub.motherReplies(TEAM_BLOCK);

            orchestrator.submitUserMessage("Compare Postgres and MySQL");

            StubModelClient.Call researcher = stub.calls(Kind.WORKER).stream()
                    .filter(call -> call.role().equals("researcher"))
                    .findFirst()
                    .orElseThrow();
            assertThat(researcher.modelType()).isEqualTo(ModelType.THINKING);
            assertThat(researcher.prompt())
                    .contains("Your responsibility: gathers facts")
                    .contains("Compare Postgres and MySQL")
                    .contains("compare Postgres and MySQL")
                    .contains("(none)");
        }

        @Test
        @DisplayName("should report parse warnings without failing the turn")
        void shouldCollectParseWarnings() {
            stub.motherReplies("""
                    Here is my plan:
                    CREATE: writer | genius | writes
                    CREATE: writer
                    TO writer: write it
                    SYNTHESIZE
                    """);

            TurnResult result = orchestrator.submitUserMessage("Write a haiku");

            assertThat(result.warnings()).hasSize(2);
            assertThat(result.warnings().get(0)).startsWith("Unrecognized line (line 1)");
            assertThat(result.warnings().get(1)).startsWith("Unknown model type (line 2)");
            assertThat(result.workerOutputs()).hasSize(1);
        }

        @Test
        @DisplayName("should answer directly when no worker is addressed")
        void shouldAnswerDirectly() {
            stub.motherReplies("ANALYZE: simple greeting\nSYNTHESIZE")
                    .onDirectAnswer(prompt -> "Hello there!");

            TurnResult result = orchestrator.submitUserMessage("Hi");

            assertThat(result.finalResponse()).isEqualTo("Hello there!");
            assertThat(result.workerOutputs()).isEmpty();
            assertThat(stub.calls(Kind.DIRECT).get(0).prompt()).contains("simple greeting");
            assertThat(stub.calls(Kind.SYNTHESIS)).isEmpty();
        }

        @Test
        @DisplayName("should fall back to the analysis when the direct answer fails")
        void shouldFallBackToAnalysis() {
            stub.motherReplies("ANALYZE: The answer is 4\nSYNTHESIZE")
                    .onDirectAnswer(prompt -> {
                        throw ModelClientException.providerError("HTTP 500");
                    });

            TurnResult result = orchestrator.submitUserMessage("What is 2 + 2?");

            assertThat(result.finalResponse()).isEqualTo("The answer is 4");
            assertThat(result.warnings()).anyMatch(w -> w.contains("analysis"));
        }

        @Test
        @DisplayName("should skip messages to unknown instances with a warning")
        void shouldSkipUnknownReferences() {
            stub.motherReplies("""
                    CREATE: writer
                    TO ghost: are you there?
                    TO writer: write it
                    SYNTHESIZE
                    """);

            TurnResult result = orchestrator.submitUserMessage("Write something");

            assertThat(result.warnings()).containsExactly("Unknown instance 'ghost', message skipped");
            assertThat(result.workerOutputs()).extracting(WorkerOutput::role).containsExactly("writer");
        }
    }

    @Nested
    @DisplayName("follow-up turns")
    class FollowUps {

        @Test
        @DisplayName("should reuse an existing instance instead of creating a duplicate")
        void shouldReuseExistingRole() {
            stub.motherReplies(TEAM_BLOCK, """
                    CREATE: researcher | normal | gathers facts
                    TO researcher: add SQLite to the comparison
                    SYNTHESIZE
                    """);

            orchestrator.submitUserMessage("Compare Postgres and MySQL");
            String researcherId = registry.resolve("researcher").getId();

            TurnResult second = orchestrator.submitUserMessage("What about SQLite?");

            assertThat(registry.size()).isEqualTo(2);
            assertThat(second.warnings()).containsExactly("Reusing instance " + researcherId + " for role researcher");
            assertThat(second.workerOutputs()).extracting(WorkerOutput::instanceId).containsExactly(researcherId);
            assertThat(registry.getFirstTaskContext()).contains("Compare Postgres and MySQL");
        }

        @Test
        @DisplayName("should give the mother the original task and its previous answer")
        void shouldBuildFollowUpPrompt() {
            stub.motherReplies(TEAM_BLOCK, "TO writer: shorten it\nSYNTHESIZE")
                    .onSynthesis(prompt -> "First answer");

            orchestrator.submitUserMessage("Compare Postgres and MySQL");
            orchestrator.submitUserMessage("Make it shorter");

            List<StubModelClient.Call> motherCalls = stub.calls(Kind.MOTHER);
            assertThat(motherCalls).hasSize(2);
            assertThat(motherCalls.get(1).prompt())
                    .contains("existing team")
                    .contains("Compare Postgres and MySQL")
                    .contains("First answer")
                    .contains("Make it shorter")
                    .contains("writer");
        }

        @Test
        @DisplayName("should give synthesis the original task and the previous answer")
        void shouldSynthesizeFollowUpWithPriorTurn() {
            stub.motherReplies(TEAM_BLOCK, "TO writer: shorten it\nSYNTHESIZE")
                    .onSynthesis(prompt -> "Postgres wins on features, MySQL on simplicity.");

            orchestrator.submitUserMessage("Compare Postgres and MySQL");
            orchestrator.submitUserMessage("Make it shorter");

            List<StubModelClient.Call> synthesisCalls = stub.calls(Kind.SYNTHESIS);
            assertThat(synthesisCalls).hasSize(2);
            assertThat(synthesisCalls.get(0).prompt()).contains("(none, this is the first request)");
            assertThat(synthesisCalls.get(1).prompt())
                    .contains("Make it shorter")
                    .contains("Original task:\nCompare Postgres and MySQL")
                    .contains("Your previous answer:\nPostgres wins on features, MySQL on simplicity.");
        }

        @Test
        @DisplayName("should include a worker's earlier outputs in its prompt")
        void shouldIncludeWorkerHistory() {
            stub.motherReplies(TEAM_BLOCK, "TO writer: shorten it\nSYNTHESIZE");

            orchestrator.submitUserMessage("Compare Postgres and MySQL");
            orchestrator.submitUserMessage("Make it shorter");

            List<StubModelClient.Call> writerCalls = stub.calls(Kind.WORKER).stream()
                    .filter(call -> call.role().equals("writer"))
                    .toList();
            assertThat(writerCalls).hasSize(2);
            assertThat(writerCalls.get(1).prompt()).contains("- Output of writer");
        }

        @Test
        @DisplayName("should use a plain-text mother reply as the final answer")
        void shouldAcceptDirectMotherAnswer() {
            stub.motherReplies(TEAM_BLOCK, "Postgres, as explained above.");

            orchestrator.submitUserMessage("Compare Postgres and MySQL");
            int synthesisCalls = stub.calls(Kind.SYNTHESIS).size();

            TurnResult second = orchestrator.submitUserMessage("So which one?");

            assertThat(second.finalResponse()).isEqualTo("Postgres, as explained above.");
            assertThat(second.workerOutputs()).isEmpty();
            assertThat(stub.calls(Kind.SYNTHESIS)).hasSize(synthesisCalls);
        }
    }

    @Nested
    @DisplayName("partial failures")
    class PartialFailures {

        @Test
        @DisplayName("should synthesize two outputs and one failure marker when one of three workers times out")
        void shouldSurviveWorkerTimeout() {
            stub.motherReplies("""
                    CREATE: alpha
                    CREATE: beta
                    CREATE: gamma
                    TO alpha: part one
                    TO beta: part two
                    TO gamma: part three
                    SYNTHESIZE
                    """)
                    .onWorker("beta", prompt -> {
                        StubModelClient.sleep(Duration.ofSeconds(2));
                        return "too late";
                    });

            TurnResult result = orchestrator.submitUserMessage("Split the work");

            assertThat(result.workerOutputs()).hasSize(3);
            assertThat(result.workerOutputs()).filteredOn(WorkerOutput::isSuccess).hasSize(2);
            WorkerOutput beta = result.workerOutputs().get(1);
            assertThat(beta.errorType()).isEqualTo(ErrorType.TIMEOUT);

            assertThat(stub.calls(Kind.SYNTHESIS)).hasSize(1);
            assertThat(stub.calls(Kind.SYNTHESIS).get(0).prompt())
                    .contains("Output of alpha", "Output of gamma", "[instance failed to respond: TIMEOUT]");
            assertThat(result.finalResponse()).isEqualTo("Synthesized answer");
            assertThat(result.degraded()).isFalse();

            assertThat(orchestrator.getInstance(beta.instanceId()))
                    .hasValueSatisfying(view -> assertThat(view.status()).isEqualTo("errored"));
            assertThat(result.warnings()).containsExactly("Instance " + beta.instanceId() + " failed to respond: TIMEOUT");
        }

        @Test
        @DisplayName("should keep parsed order in the synthesis input when the last call finishes first")
        void shouldKeepParsedOrder() {
            stub.motherReplies("""
                    CREATE: alpha
                    CREATE: beta
                    CREATE: gamma
                    TO alpha: part one
                    TO beta: part two
                    TO gamma: part three
                    SYNTHESIZE
                    """)
                    .onWorker("alpha", prompt -> {
                        StubModelClient.sleep(Duration.ofMillis(250));
                        return "alpha result";
                    })
                    .onWorker("beta", prompt -> {
                        StubModelClient.sleep(Duration.ofMillis(150));
                        return "beta result";
                    })
                    .onWorker("gamma", prompt -> "gamma result");

            TurnResult result = orchestrator.submitUserMessage("Split the work");

            assertThat(result.workerOutputs()).extracting(WorkerOutput::text)
                    .containsExactly("alpha result", "beta result", "gamma result");
            String synthesisPrompt = stub.calls(Kind.SYNTHESIS).get(0).prompt();
            assertThat(synthesisPrompt.indexOf("### alpha"))
                    .isLessThan(synthesisPrompt.indexOf("### beta"));
            assertThat(synthesisPrompt.indexOf("### beta"))
                    .isLessThan(synthesisPrompt.indexOf("### gamma"));
        }

        @Test
        @DisplayName("should serialize messages addressed to the same instance")
        void shouldSerializeSameInstanceMessages() {
            AtomicInteger inFlight = new AtomicInteger();
            AtomicInteger maxInFlight = new AtomicInteger();
            AtomicInteger counter = new AtomicInteger();
            stub.motherReplies("""
                    CREATE: researcher
                    TO researcher: first question
                    TO researcher: second question
                    SYNTHESIZE
                    """)
                    .onWorker("researcher", prompt -> {
                        maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
                        StubModelClient.sleep(Duration.ofMillis(100));
                        inFlight.decrementAndGet();
                        return "researcher answer " + counter.incrementAndGet();
                    });

            TurnResult result = orchestrator.submitUserMessage("Two questions");

            assertThat(maxInFlight).hasValue(1);
            assertThat(result.workerOutputs()).extracting(WorkerOutput::text)
                    .containsExactly("researcher answer 1", "researcher answer 2");
            List<StubModelClient.Call> calls = stub.calls(Kind.WORKER);
            assertThat(calls.get(0).prompt()).contains("first question");
            assertThat(calls.get(1).prompt()).contains("second question").contains("- researcher answer 1");
        }

        @Test
        @DisplayName("should return labeled worker outputs when synthesis fails")
        void shouldDegradeWhenSynthesisFails() {
            stub.motherReplies(TEAM_BLOCK)
                    .onSynthesis(prompt -> {
                        throw ModelClientException.providerError("HTTP 503");
                    });

            TurnResult result = orchestrator.submitUserMessage("Compare Postgres and MySQL");

            assertThat(result.degraded()).isTrue();
            assertThat(result.finalResponse())
                    .isEqualTo("researcher: Output of researcher\n\nwriter: Output of writer");
            assertThat(result.warnings()).anyMatch(w -> w.startsWith("Synthesis failed (PROVIDER_ERROR)"));
            assertThat(registry.getFirstTaskContext()).isPresent();
        }
    }

    @Nested
    @DisplayName("turn-fatal failures")
    class FatalFailures {

        @Test
        @DisplayName("should fail with MOTHER_UNAVAILABLE when the mother call fails")
        void shouldFailWhenMotherUnavailable() {
            stub.onMother(prompt -> {
                throw ModelClientException.providerError("HTTP 500");
            });

            assertThatThrownBy(() -> orchestrator.submitUserMessage("Hello"))
                    .isInstanceOf(TurnFailedException.class)
                    .satisfies(e -> {
                        TurnFailedException failure = (TurnFailedException) e;
                        assertThat(failure.getErrorType()).isEqualTo(ErrorType.MOTHER_UNAVAILABLE);
                        assertThat(failure.getFailedIn()).isEqualTo(TurnState.AWAITING_DIRECTIVES);
                    });

            assertThat(registry.getFirstTaskContext()).isEmpty();
            assertThat(orchestrator.listInstances().mother().status()).isEqualTo("errored");
        }

        @Test
        @DisplayName("should fail with MOTHER_UNAVAILABLE when rate limit retries are exhausted")
        void shouldFailWhenMotherRateLimited() {
            stub.onMother(prompt -> {
                throw ModelClientException.rateLimited("429");
            });

            assertThatThrownBy(() -> orchestrator.submitUserMessage("Hello"))
                    .isInstanceOf(TurnFailedException.class)
                    .extracting(e -> ((TurnFailedException) e).getErrorType())
                    .isEqualTo(ErrorType.MOTHER_UNAVAILABLE);
        }

        @Test
        @DisplayName("should fail with TIMEOUT when the mother does not answer in time")
        void shouldFailWhenMotherTimesOut() {
            stub.onMother(prompt -> {
                StubModelClient.sleep(Duration.ofSeconds(2));
                return "SYNTHESIZE";
            });

            assertThatThrownBy(() -> orchestrator.submitUserMessage("Hello"))
                    .isInstanceOf(TurnFailedException.class)
                    .extracting(e -> ((TurnFailedException) e).getErrorType())
                    .isEqualTo(ErrorType.TIMEOUT);
        }

        @Test
        @DisplayName("should re-prompt once after a malformed directive block")
        void shouldRepromptOnce() {
            stub.motherReplies("I will ask a researcher.", TEAM_BLOCK);

            TurnResult result = orchestrator.submitUserMessage("Compare Postgres and MySQL");

            assertThat(result.workerOutputs()).hasSize(2);
            assertThat(stub.calls(Kind.CORRECTIVE)).hasSize(1);
            assertThat(stub.calls(Kind.CORRECTIVE).get(0).prompt())
                    .contains("must end with SYNTHESIZE")
                    .contains("I will ask a researcher.");
        }

        @Test
        @DisplayName("should fail with PARSE_ERROR when the corrected block is malformed too")
        void shouldFailAfterSecondMalformedBlock() {
            stub.motherReplies("I will ask a researcher.");

            assertThatThrownBy(() -> orchestrator.submitUserMessage("Compare Postgres and MySQL"))
                    .isInstanceOf(TurnFailedException.class)
                    .extracting(e -> ((TurnFailedException) e).getErrorType())
                    .isEqualTo(ErrorType.PARSE_ERROR);

            assertThat(stub.calls(Kind.CORRECTIVE)).hasSize(1);
            assertThat(stub.calls(Kind.WORKER)).isEmpty();
        }

        @Test
        @DisplayName("should reject blank and oversized messages")
        void shouldValidateMessages() {
            assertThatThrownBy(() -> orchestrator.submitUserMessage("   "))
                    .isInstanceOf(TurnFailedException.class)
                    .extracting(e -> ((TurnFailedException) e).getErrorType())
                    .isEqualTo(ErrorType.VALIDATION_ERROR);
            assertThatThrownBy(() -> orchestrator.submitUserMessage("x".repeat(2001)))
                    .isInstanceOf(TurnFailedException.class)
                    .extracting(e -> ((TurnFailedException) e).getErrorType())
                    .isEqualTo(ErrorType.VALIDATION_ERROR);

            assertThat(stub.calls()).isEmpty();
        }
    }

    @Test
    @DisplayName("should reset the network on clear and create a fresh mother next turn")
    void shouldClearNetwork() {
        stub.motherReplies(TEAM_BLOCK);
        String firstMother = orchestrator.submitUserMessage("Compare Postgres and MySQL").listing().mother().id();

        orchestrator.clear();

        InstanceListing cleared = orchestrator.listInstances();
        assertThat(cleared.mother()).isNull();
        assertThat(cleared.instances()).isEmpty();
        assertThat(orchestrator.networkStats().turnCount()).isZero();
        assertThat(registry.getFirstTaskContext()).isEmpty();

        TurnResult next = orchestrator.submitUserMessage("Start over");
        assertThat(next.listing().mother().id()).isNotEqualTo(firstMother);
        assertThat(stub.calls(Kind.MOTHER).get(1).prompt()).doesNotContain("existing team");
    }

    @Test
    @DisplayName("should report network statistics")
    void shouldReportStats() {
        NetworkStats empty = orchestrator.networkStats();
        assertThat(empty.instanceCount()).isZero();
        assertThat(empty.motherStatus()).isEqualTo("inactive");

        stub.motherReplies(TEAM_BLOCK);
        orchestrator.submitUserMessage("Compare Postgres and MySQL");

        NetworkStats stats = orchestrator.networkStats();
        assertThat(stats.instanceCount()).isEqualTo(3);
        assertThat(stats.totalMessages()).isEqualTo(3);
        assertThat(stats.turnCount()).isEqualTo(1);
        assertThat(stats.motherStatus()).isEqualTo("active");
        assertThat(stats.uptimeSeconds()).isGreaterThanOrEqualTo(0);
        assertThat(metrics.scrape()).contains("test_turns_total");
    }

    @Test
    @DisplayName("should look up instances by id")
    void shouldGetInstance() {
        stub.motherReplies(TEAM_BLOCK);
        TurnResult result = orchestrator.submitUserMessage("Compare Postgres and MySQL");
        InstanceView writer = result.listing().instances().get(1);

        assertThat(orchestrator.getInstance(writer.id())).hasValueSatisfying(view ->
                assertThat(view.responsibility()).isEqualTo("writes the answer"));
        assertThat(orchestrator.getInstance(result.listing().mother().id())).isPresent();
        assertThat(orchestrator.getInstance("nobody-1")).isEmpty();
    }
}
