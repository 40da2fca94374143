package fr.lapetina.agentnetwork.orchestration.exception;

import fr.lapetina.agentnetwork.domain.model.AgentNetworkException;
import fr.lapetina.agentnetwork.domain.model.ErrorType;
import fr.lapetina.agentnetwork.domain.model.Instance;

/**
 * Thrown on a follow-up turn when an active instance already holds the requested role.
 * The caller is expected to reuse {@link #getExisting()}.
 */
public final class DuplicateRoleException extends AgentNetworkException {

    private final transient Instance existing;

    public DuplicateRoleException(Instance existing) {
        super(ErrorType.DUPLICATE_ROLE, "Role already taken: role=" + existing.getRole() + ", id=" + existing.getId());
        this.existing = existing;
    }

    public Instance getExisting() {
        return existing;
    }
}
