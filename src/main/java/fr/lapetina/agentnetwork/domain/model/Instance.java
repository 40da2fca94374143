package fr.lapetina.agentnetwork.domain.model;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.atomic.AtomicReference;

/**
 * One agent of the network: the mother or a worker.
 * Thread-safe for concurrent access from the turn thread and worker calls.
 */
public final class Instance {
    private final String id;
    private final String role;
    private final ModelType modelType;
    private final String responsibility;
    private final Instant createdAt;

    // Mutable state - thread-safe
    private final AtomicReference<InstanceStatus> status;
    private final Set<String> connectedTo = Collections.synchronizedSet(new LinkedHashSet<>());
    private final List<String> outputHistory = Collections.synchronizedList(new ArrayList<>());

    private Instance(Builder builder) {
        this.id = Objects.requireNonNull(builder.id, "Instance ID is required");
        this.role = Objects.requireNonNull(builder.role, "Role is required");
        this.modelType = builder.modelType != null ? builder.modelType : ModelType.NORMAL;
        this.responsibility = builder.responsibility != null ? builder.responsibility : "";
        this.createdAt = builder.createdAt != null ? builder.createdAt : Instant.now();
        this.status = new AtomicReference<>(InstanceStatus.CREATED);
    }

    public String getId() {
        return id;
    }

    public String getRole() {
        return role;
    }

    public ModelType getModelType() {
        return modelType;
    }

    public String getResponsibility() {
        return responsibility;
    }

    public Instant getCreatedAt() {
        return createdAt;
    }

    public InstanceStatus getStatus() {
        return status.get();
    }

    public void setStatus(InstanceStatus newStatus) {
        status.set(Objects.requireNonNull(newStatus));
    }

    public boolean isActive() {
        return status.get() != InstanceStatus.ERRORED;
    }

    public void connect(String otherId) {
        if (!id.equals(otherId)) {
            connectedTo.add(otherId);
        }
    }

    public Set<String> getConnectedTo() {
        synchronized (connectedTo) {
            return Set.copyOf(connectedTo);
        }
    }

    /**
     * Appends an output. History is never truncated.
     */
    public void appendOutput(String output) {
        outputHistory.add(Objects.requireNonNull(output));
    }

    public List<String> getOutputHistory() {
        synchronized (outputHistory) {
            return List.copyOf(outputHistory);
        }
    }

    /**
     * Returns at most the last {@code count} outputs, oldest first.
     */
    public List<String> recentOutputs(int count) {
        synchronized (outputHistory) {
            int from = Math.max(0, outputHistory.size() - Math.max(0, count));
            return List.copyOf(outputHistory.subList(from, outputHistory.size()));
        }
    }

    public int getOutputCount() {
        return outputHistory.size();
    }

    /**
     * Immutable snapshot for reporting.
     */
    public InstanceView toView() {
        synchronized (connectedTo) {
            return new InstanceView(
                    id, role, modelType.wireName(), responsibility, status.get().wireName(),
                    connectedTo.stream().sorted().toList(), getOutputHistory(), createdAt);
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        Instance that = (Instance) o;
        return id.equals(that.id);
    }

    @Override
    public int hashCode() {
        return Objects.hash(id);
    }

    @Override
    public String toString() {
        return "Instance{" +
                "id='" + id + '\'' +
                ", role='" + role + '\'' +
                ", modelType=" + modelType +
                ", status=" + status.get() +
                '}';
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private String id;
        private String role;
        private ModelType modelType = ModelType.NORMAL;
        private String responsibility;
        private Instant createdAt;

        public Builder id(String id) {
            this.id = id;
            return this;
        }

        public Builder role(String role) {
            this.role = role;
            return this;
        }

        public Builder modelType(ModelType modelType) {
            this.modelType = modelType;
            return this;
        }

        public Builder responsibility(String responsibility) {
            this.responsibility = responsibility;
            return this;
        }

        public Builder createdAt(Instant createdAt) {
            this.createdAt = createdAt;
            return this;
        }

        public Instance build() {
            return new Instance(this);
        }
    }
}
