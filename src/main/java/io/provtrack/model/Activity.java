package io.provtrack.model;

import io.provtrack.persistence.PersistentObject;
import io.provtrack.persistence.PersistentType;
import io.provtrack.persistence.StateReader;
import io.provtrack.persistence.StateWriter;
import io.provtrack.util.Hashing;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * One execution of a {@link Plan}: which files it read and wrote, which
 * files it removed, and when it ran. The order is assigned once, by the
 * provenance graph, and never changes afterwards.
 */
public final class Activity extends PersistentObject {
    private static final String ID_PREFIX = "/activities/";

    private String id;
    private Plan plan;
    private long order;
    private List<Usage> usages = new ArrayList<>();
    private List<Generation> generations = new ArrayList<>();
    private List<Entity> invalidations = new ArrayList<>();
    private Instant startedAt;
    private Instant endedAt;

    Activity() {
    }

    public Activity(
            Plan plan,
            Instant startedAt,
            Instant endedAt,
            List<Entity> used,
            List<Entity> generated,
            List<Entity> invalidated
    ) {
        this.id = generateId();
        this.plan = Objects.requireNonNull(plan, "plan");
        this.startedAt = startedAt;
        this.endedAt = endedAt;
        for (Entity entity : used) {
            usages.add(new Usage(id + "/usages/" + Hashing.randomHex(16), entity));
        }
        for (Entity entity : generated) {
            generations.add(new Generation(id + "/generations/" + Hashing.randomHex(16), entity));
        }
        if (invalidated != null) {
            invalidations.addAll(invalidated);
        }
    }

    public static String generateId() {
        return ID_PREFIX + UUID.randomUUID();
    }

    @Override
    public PersistentType type() {
        return ModelType.ACTIVITY;
    }

    @Override
    protected String naturalId() {
        return id;
    }

    public String id() {
        activate();
        return id;
    }

    public Plan plan() {
        activate();
        return plan;
    }

    /** Position in the provenance log, or {@code 0} when not recorded yet. */
    public long order() {
        activate();
        return order;
    }

    public boolean hasOrder() {
        return order() > 0;
    }

    public void assignOrder(long value) {
        if (value <= 0) {
            throw new IllegalArgumentException("order must be positive: " + value);
        }
        if (hasOrder()) {
            throw new IllegalStateException("Activity " + id + " already has order " + order);
        }
        changed();
        order = value;
    }

    public List<Usage> usages() {
        activate();
        return Collections.unmodifiableList(usages);
    }

    public List<Generation> generations() {
        activate();
        return Collections.unmodifiableList(generations);
    }

    public List<Entity> invalidations() {
        activate();
        return Collections.unmodifiableList(invalidations);
    }

    public Instant startedAt() {
        activate();
        return startedAt;
    }

    public Instant endedAt() {
        activate();
        return endedAt;
    }

    @Override
    protected void writeState(StateWriter out) {
        out.string("id", id)
                .reference("plan", plan)
                .longValue("order", order)
                .embeddedList("usages", usages)
                .embeddedList("generations", generations)
                .references("invalidations", invalidations)
                .instant("started_at", startedAt)
                .instant("ended_at", endedAt);
    }

    @Override
    protected void readState(StateReader in) {
        id = in.string("id");
        plan = in.reference("plan", Plan.class);
        order = in.longValue("order", 0L);
        usages = in.embeddedList("usages", Usage::read);
        generations = in.embeddedList("generations", Generation::read);
        invalidations = in.references("invalidations", Entity.class);
        startedAt = in.instant("started_at");
        endedAt = in.instant("ended_at");
    }
}
