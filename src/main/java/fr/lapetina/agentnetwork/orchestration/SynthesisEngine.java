package fr.lapetina.agentnetwork.orchestration;

import fr.lapetina.agentnetwork.domain.model.ModelType;
import fr.lapetina.agentnetwork.domain.model.WorkerOutput;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Builds the final answer of a turn from worker outputs.
 *
 * Outputs are embedded in the order given, which the orchestrator keeps equal to the parsed
 * order of the TO directives. Failed workers appear as explicit markers.
 */
public final class SynthesisEngine {

    private static final Logger log = LoggerFactory.getLogger(SynthesisEngine.class);

    private static final String FIRST_REQUEST = "(none, this is the first request)";

    /**
     * What came before a follow-up turn: the team's original task and the last answer the user received.
     */
    public record PriorTurn(String taskContext, String previousResponse) {
    }

    private final ModelGateway gateway;
    private final PromptLibrary prompts;

    public SynthesisEngine(ModelGateway gateway, PromptLibrary prompts) {
        this.gateway = gateway;
        this.prompts = prompts;
    }

    /**
     * One model call merging all outputs into a user-facing answer.
     *
     * @param prior context of the previous turn, null on the first request
     *
     * @throws fr.lapetina.agentnetwork.domain.model.AgentNetworkException if the call fails
     */
    public String synthesize(String userMessage, PriorTurn prior, List<WorkerOutput> outputs) {
        String prompt = buildPrompt(userMessage, prior, outputs);
        log.info("Synthesis started: outputs={}, failed={}",
                outputs.size(), outputs.stream().filter(WorkerOutput::isFailure).count());
        return gateway.call(ModelGateway.CallKind.SYNTHESIS, prompt, ModelType.NORMAL).strip();
    }

    /**
     * Answer for a turn where no worker was addressed.
     */
    public String directAnswer(String userMessage, String analysis, PriorTurn prior) {
        String prompt = prompts.render(PromptTemplate.DIRECT_ANSWER, Map.of(
                "user_message", userMessage,
                "prior_turn", formatPriorTurn(prior),
                "analysis", analysis == null || analysis.isBlank() ? "(none)" : analysis));
        log.info("Direct answer requested: analysisLength={}", analysis == null ? 0 : analysis.length());
        return gateway.call(ModelGateway.CallKind.SYNTHESIS, prompt, ModelType.NORMAL).strip();
    }

    String buildPrompt(String userMessage, PriorTurn prior, List<WorkerOutput> outputs) {
        return prompts.render(PromptTemplate.SYNTHESIS, Map.of(
                "user_message", userMessage,
                "prior_turn", formatPriorTurn(prior),
                "outputs", formatOutputs(outputs)));
    }

    static String formatPriorTurn(PriorTurn prior) {
        if (prior == null) {
            return FIRST_REQUEST;
        }
        String previous = prior.previousResponse();
        return "Original task:\n" + prior.taskContext()
                + "\n\nYour previous answer:\n" + (previous == null || previous.isBlank() ? "(none)" : previous);
    }

    static String formatOutputs(List<WorkerOutput> outputs) {
        return outputs.stream()
                .map(output -> "### " + output.role() + "\n" + output.displayText())
                .collect(Collectors.joining("\n\n"));
    }

    /**
     * Fallback when synthesis fails: every output labeled with its role, in order.
     */
    public static String degrade(List<WorkerOutput> outputs) {
        return outputs.stream()
                .map(output -> output.role() + ": " + output.displayText())
                .collect(Collectors.joining("\n\n"));
    }
}
