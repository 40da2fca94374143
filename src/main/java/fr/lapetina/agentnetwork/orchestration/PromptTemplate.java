package fr.lapetina.agentnetwork.orchestration;

/**
 * Templates the orchestrator needs, keyed by their {@code ## } heading in the prompt file.
 */
public enum PromptTemplate {
    MOTHER_INITIALIZATION("Mother Node Initialization"),
    FOLLOW_UP("Follow-up Turn"),
    CORRECTIVE_REPROMPT("Corrective Reprompt"),
    WORKER_TASK("Worker Task"),
    SYNTHESIS("Synthesis Prompt"),
    DIRECT_ANSWER("Direct Answer");

    private final String heading;

    PromptTemplate(String heading) {
        this.heading = heading;
    }

    public String getHeading() {
        return heading;
    }
}
