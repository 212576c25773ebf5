package io.provtrack.graph;

import io.provtrack.model.Activity;
import io.provtrack.model.ModelType;
import io.provtrack.model.Usage;
import io.provtrack.persistence.Database;
import io.provtrack.persistence.DuplicateIdentifierException;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Append-only log of activities. Every added activity gets the next order
 * number; orders only grow.
 */
public final class ProvenanceGraph {
    private final Database database;
    private final List<Activity> activities = new ArrayList<>();
    private final Set<String> ids = new HashSet<>();
    private long nextOrder;

    private ProvenanceGraph(Database database, List<Activity> loaded) {
        this.database = database;
        loaded.sort(Comparator.comparingLong(Activity::order));
        long max = 0;
        for (Activity activity : loaded) {
            activities.add(activity);
            ids.add(activity.id());
            max = Math.max(max, activity.order());
        }
        this.nextOrder = max + 1;
    }

    public static ProvenanceGraph from(Database database) {
        Objects.requireNonNull(database, "database");
        return new ProvenanceGraph(database, database.all(ModelType.ACTIVITY, Activity.class));
    }

    /**
     * Records {@code activity} and returns the order assigned to it.
     *
     * @throws DuplicateIdentifierException if an activity with the same id was already recorded
     * @throws io.provtrack.persistence.ObjectAlreadyOwnedException if another database owns it; nothing is recorded
     */
    public long add(Activity activity) {
        Objects.requireNonNull(activity, "activity");
        if (ids.contains(activity.id())) {
            throw new DuplicateIdentifierException(activity.id());
        }
        if (activity.hasOrder()) {
            throw new IllegalStateException("Activity " + activity.id() + " already has order " + activity.order());
        }
        database.add(activity);
        activity.assignOrder(nextOrder++);
        activities.add(activity);
        ids.add(activity.id());
        return activity.order();
    }

    /** Records every activity in iteration order; the returned orders are strictly increasing. */
    public List<Long> addAll(Collection<Activity> batch) {
        Set<String> seen = new HashSet<>();
        for (Activity activity : batch) {
            if (ids.contains(activity.id()) || !seen.add(activity.id())) {
                throw new DuplicateIdentifierException(activity.id());
            }
        }
        List<Long> orders = new ArrayList<>(batch.size());
        for (Activity activity : batch) {
            orders.add(add(activity));
        }
        return orders;
    }

    public List<Activity> activities() {
        return Collections.unmodifiableList(activities);
    }

    public int size() {
        return activities.size();
    }

    /** The most recent execution of the plan with id {@code planId}. */
    public Optional<Activity> latestActivity(String planId) {
        for (int i = activities.size() - 1; i >= 0; i--) {
            Activity activity = activities.get(i);
            if (activity.plan().id().equals(planId)) {
                return Optional.of(activity);
            }
        }
        return Optional.empty();
    }

    /**
     * For every plan that was executed at least once, the usages recorded by
     * its latest execution.
     */
    public List<PlanUsage> getLatestPlansUsages() {
        Map<String, Activity> latest = new LinkedHashMap<>();
        for (Activity activity : activities) {
            latest.put(activity.plan().id(), activity);
        }
        List<PlanUsage> out = new ArrayList<>();
        for (Map.Entry<String, Activity> entry : latest.entrySet()) {
            for (Usage usage : entry.getValue().usages()) {
                out.add(new PlanUsage(entry.getKey(), usage.path(), usage.checksum()));
            }
        }
        return out;
    }
}
