package fr.lapetina.agentnetwork.orchestration;

import fr.lapetina.agentnetwork.domain.model.Instance;
import fr.lapetina.agentnetwork.domain.model.InstanceListing;
import fr.lapetina.agentnetwork.domain.model.InstanceStatus;
import fr.lapetina.agentnetwork.domain.model.InstanceView;
import fr.lapetina.agentnetwork.domain.model.ModelType;
import fr.lapetina.agentnetwork.orchestration.exception.DuplicateRoleException;
import fr.lapetina.agentnetwork.orchestration.exception.UnknownInstanceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Registry for the mother agent and its workers.
 *
 * All methods are synchronized: mutations are visible to the next call immediately,
 * and readers (HTTP listing) may run while a turn is in progress.
 * Instances are never removed individually; {@link #clear()} drops the whole network.
 */
public final class InstanceRegistry {

    private static final Logger log = LoggerFactory.getLogger(InstanceRegistry.class);

    public static final String MOTHER_ROLE = "scrum_master";

    // Process-wide so ids stay unique across clears
    private static final AtomicLong SEQUENCE = new AtomicLong();

    private final Map<String, Instance> instances = new LinkedHashMap<>();

    private Instance mother;
    private String firstTaskContext;

    /**
     * Returns the mother, creating it on first use.
     */
    public synchronized Instance getOrCreateMother() {
        if (mother == null) {
            mother = Instance.builder()
                    .id("mother-" + SEQUENCE.incrementAndGet())
                    .role(MOTHER_ROLE)
                    .modelType(ModelType.NORMAL)
                    .responsibility("Plans the work, delegates to workers and synthesizes their outputs")
                    .build();
            log.info("Mother instance created: id={}", mother.getId());
        }
        return mother;
    }

    public synchronized Optional<Instance> getMother() {
        return Optional.ofNullable(mother);
    }

    /**
     * Creates a worker.
     *
     * @throws DuplicateRoleException on a follow-up turn when an active worker already has the role
     */
    public synchronized Instance create(String role, ModelType modelType, String responsibility) {
        String normalizedRole = normalizeRole(role);
        if (firstTaskContext != null) {
            Optional<Instance> existing = latest(i -> i.isActive() && normalizeRole(i.getRole()).equals(normalizedRole));
            if (existing.isPresent()) {
                throw new DuplicateRoleException(existing.get());
            }
        }

        Instance instance = Instance.builder()
                .id(slug(role) + "-" + SEQUENCE.incrementAndGet())
                .role(role.trim())
                .modelType(modelType)
                .responsibility(responsibility)
                .build();
        instances.put(instance.getId(), instance);

        log.info("Instance created: id={}, role={}, modelType={}", instance.getId(), instance.getRole(), modelType.wireName());
        return instance;
    }

    /**
     * Resolves a reference: exact role, normalized role, exact id, then normalized id.
     * Among several matches the latest active worker wins, else the latest one.
     *
     * @throws UnknownInstanceException if nothing matches
     */
    public synchronized Instance resolve(String reference) {
        String trimmed = reference == null ? "" : reference.trim();
        String normalized = normalizeRole(trimmed);

        List<Predicate<Instance>> lookups = List.of(
                i -> i.getRole().equals(trimmed),
                i -> normalizeRole(i.getRole()).equals(normalized),
                i -> i.getId().equals(trimmed),
                i -> i.getId().equals(normalized)
        );

        for (Predicate<Instance> lookup : lookups) {
            Optional<Instance> active = latest(lookup.and(Instance::isActive));
            if (active.isPresent()) {
                return active.get();
            }
            Optional<Instance> any = latest(lookup);
            if (any.isPresent()) {
                return any.get();
            }
        }
        throw new UnknownInstanceException(trimmed);
    }

    /**
     * Looks up the mother or a worker by id.
     */
    public synchronized Optional<Instance> getInstance(String id) {
        if (mother != null && mother.getId().equals(id)) {
            return Optional.of(mother);
        }
        return Optional.ofNullable(instances.get(id));
    }

    public synchronized void markStatus(String id, InstanceStatus status) {
        Instance instance = require(id);
        InstanceStatus previous = instance.getStatus();
        instance.setStatus(status);
        if (previous != status) {
            log.debug("Instance status changed: id={}, {} -> {}", id, previous, status);
        }
    }

    /**
     * Appends to an instance's output history.
     */
    public synchronized void recordOutput(String id, String output) {
        require(id).appendOutput(output);
    }

    /**
     * Links two instances in both directions.
     */
    public synchronized void connect(String firstId, String secondId) {
        require(firstId).connect(secondId);
        require(secondId).connect(firstId);
    }

    /**
     * Workers in creation order.
     */
    public synchronized List<Instance> getWorkers() {
        return new ArrayList<>(instances.values());
    }

    public synchronized InstanceListing list() {
        InstanceView motherView = mother != null ? mother.toView() : null;
        return new InstanceListing(motherView, instances.values().stream().map(Instance::toView).toList());
    }

    /**
     * Workers only.
     */
    public synchronized int size() {
        return instances.size();
    }

    public synchronized Optional<String> getFirstTaskContext() {
        return Optional.ofNullable(firstTaskContext);
    }

    /**
     * Sets the task context once; later calls are ignored until {@link #clear()}.
     *
     * @return true if this call set it
     */
    public synchronized boolean setFirstTaskContext(String context) {
        if (firstTaskContext != null) {
            return false;
        }
        firstTaskContext = context;
        log.info("First task context set: length={}", context.length());
        return true;
    }

    /**
     * Drops the mother, every worker and the task context.
     */
    public synchronized void clear() {
        int dropped = instances.size() + (mother != null ? 1 : 0);
        instances.clear();
        mother = null;
        firstTaskContext = null;
        log.info("Instance registry cleared: {} instances dropped", dropped);
    }

    private Optional<Instance> latest(Predicate<Instance> filter) {
        Instance match = null;
        for (Instance instance : instances.values()) {
            if (filter.test(instance)) {
                match = instance;
            }
        }
        return Optional.ofNullable(match);
    }

    private Instance require(String id) {
        return getInstance(id).orElseThrow(() -> new UnknownInstanceException(id));
    }

    /**
     * Lower-cases and replaces whitespace runs with {@code -}.
     */
    public static String normalizeRole(String role) {
        return role.trim().toLowerCase(Locale.ROOT).replaceAll("\\s+", "-");
    }

    private static String slug(String role) {
        String slug = normalizeRole(role).replaceAll("[^a-z0-9_-]", "-");
        return slug.isEmpty() ? "instance" : slug;
    }
}
