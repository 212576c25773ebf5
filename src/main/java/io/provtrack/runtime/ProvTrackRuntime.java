package io.provtrack.runtime;

import com.fasterxml.jackson.databind.JsonNode;
import io.provtrack.ProvTrackException;
import io.provtrack.config.ProvTrackConfig;
import io.provtrack.graph.BlockedByDeletedInputException;
import io.provtrack.graph.DependencyGraph;
import io.provtrack.graph.Downstream;
import io.provtrack.graph.PlanUsage;
import io.provtrack.graph.ProvenanceGraph;
import io.provtrack.model.Activity;
import io.provtrack.model.CommandInput;
import io.provtrack.model.CommandOutput;
import io.provtrack.model.Entity;
import io.provtrack.model.Generation;
import io.provtrack.model.ModelType;
import io.provtrack.model.Plan;
import io.provtrack.model.Usage;
import io.provtrack.observability.CommandJournal;
import io.provtrack.persistence.Database;
import io.provtrack.revision.Revisions;
import io.provtrack.revision.WorkingTreeRevisions;
import io.provtrack.storage.FileStorage;
import io.provtrack.workflow.PlannedStep;
import io.provtrack.workflow.ProcessWorkflowExecutor;
import io.provtrack.workflow.StepExecutionException;
import io.provtrack.workflow.StepResult;
import io.provtrack.workflow.WorkflowExecutor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.function.Supplier;

/**
 * Repository-level operations: recording runs, reporting what is stale and
 * re-running it. Every call holds the repository lock and opens its own
 * {@link Database} over the object directory.
 */
public final class ProvTrackRuntime {
    private static final Logger log = LoggerFactory.getLogger(ProvTrackRuntime.class);

    private final ProvTrackConfig config;
    private final WorkflowExecutor executor;
    private final Revisions workingTree;
    private Database database;
    private CommandJournal journal;

    public ProvTrackRuntime(ProvTrackConfig config) {
        this(config, new ProcessWorkflowExecutor(config.rootDir(), config.stepTimeoutMs()));
    }

    public ProvTrackRuntime(ProvTrackConfig config, WorkflowExecutor executor) {
        this.config = config;
        this.executor = executor;
        this.workingTree = new WorkingTreeRevisions(config.rootDir());
    }

    public ProvTrackConfig config() {
        return config;
    }

    public InitOutcome init() {
        return locked(() -> {
            boolean created = !database.contains(Database.ROOT_OID);
            database.root();
            database.commit();
            journal().record("init", created ? "created" : "exists", Map.of("root", config.rootDir().toString()));
            log.info("Repository metadata ready at {}", config.metadataDir());
            return new InitOutcome(config.rootDir().toString(), config.objectsDir().toString(), created);
        });
    }

    /**
     * Compares the latest recorded usages against {@code revisions}. Read-only:
     * nothing is stored.
     */
    public StatusReport status(Revisions revisions) {
        return locked(() -> {
            ProvenanceGraph provenance = ProvenanceGraph.from(database);
            DependencyGraph dependencies = DependencyGraph.from(database);
            Changes changes = changes(provenance, revisions);

            List<List<String>> cycles = dependencies.cycles();
            Set<String> blocked = new TreeSet<>();
            Set<String> blockedOutputs = new LinkedHashSet<>();
            if (cycles.isEmpty()) {
                List<PlanUsage> changed = new ArrayList<>(changes.modified());
                changed.addAll(changes.deleted());
                for (Plan plan : dependencies.getDownstream(changed, changes.deleted()).blocked()) {
                    blocked.add(plan.name());
                    for (CommandOutput output : plan.outputs()) {
                        blockedOutputs.add(output.produces());
                    }
                }
            } else {
                log.warn("Plan graph has {} cycle(s); blocked plans are not computed", cycles.size());
            }

            Map<String, Set<String>> stale = new TreeMap<>();
            for (PlanUsage usage : changes.modified()) {
                for (String path : dependencies.getDependentPaths(usage.planId(), usage.path())) {
                    if (!blockedOutputs.contains(path)) {
                        stale.computeIfAbsent(path, k -> new TreeSet<>()).add(usage.path());
                    }
                }
            }
            Map<String, List<String>> stalePaths = new LinkedHashMap<>();
            stale.forEach((path, causes) -> stalePaths.put(path, List.copyOf(causes)));
            return new StatusReport(
                    stalePaths,
                    List.copyOf(paths(changes.modified())),
                    List.copyOf(paths(changes.deleted())),
                    List.copyOf(blocked),
                    cycles
            );
        });
    }

    /**
     * Re-runs every plan downstream of a modified input, producers first, and
     * records one activity per executed plan. With {@code dryRun} only the
     * plan is computed.
     *
     * @throws BlockedByDeletedInputException if every affected plan is blocked by a deleted path
     * @throws StepExecutionException if a step fails; the plans that ran before it are recorded first
     */
    public UpdatePlan update(Revisions revisions, boolean dryRun) {
        return locked(() -> {
            ProvenanceGraph provenance = ProvenanceGraph.from(database);
            DependencyGraph dependencies = DependencyGraph.from(database);
            Changes changes = changes(provenance, revisions);
            if (changes.modified().isEmpty()) {
                log.info("Everything is up-to-date");
                return new UpdatePlan(List.of(), List.of(), dryRun, List.of());
            }
            Downstream downstream = dependencies.getDownstream(changes.modified(), changes.deleted());
            List<String> planNames = names(downstream.plans());
            List<String> blockedNames = names(downstream.blocked());
            if (!blockedNames.isEmpty()) {
                log.warn("Steps cannot be executed because one of their inputs is deleted: {}", blockedNames);
            }
            if (downstream.plans().isEmpty() && !blockedNames.isEmpty()) {
                throw new BlockedByDeletedInputException(blockedNames);
            }
            if (dryRun) {
                return new UpdatePlan(planNames, blockedNames, true, List.of());
            }

            List<PlannedStep> steps = new ArrayList<>();
            for (Plan plan : downstream.plans()) {
                steps.add(PlannedStep.of(plan));
            }
            List<StepResult> results;
            StepExecutionException failure = null;
            try {
                results = executor.execute(steps);
            } catch (StepExecutionException e) {
                results = e.completed();
                failure = e;
            }
            List<Long> orders = new ArrayList<>();
            for (StepResult result : results) {
                Activity activity = newActivity(result.plan(), result.startedAt(), result.endedAt(), List.of());
                orders.add(provenance.add(activity));
            }
            database.commit();

            Map<String, Object> details = new LinkedHashMap<>();
            details.put("plans", planNames);
            details.put("blocked", blockedNames);
            details.put("recorded", orders);
            if (failure != null) {
                details.put("failed", failure.planName());
                journal().record("update", "failed", details);
                log.warn("Update stopped at {} after recording {} plan(s)", failure.planName(), orders.size());
                throw failure;
            }
            journal().record("update", "ok", details);
            log.info("Updated {} plan(s)", orders.size());
            return new UpdatePlan(planNames, blockedNames, false, orders);
        });
    }

    /**
     * Records one step: finds or adds its plan, runs it when {@code execute}
     * is set, and stores the resulting activity. {@code revisions} is only
     * asked about the paths the step removes.
     */
    public RunOutcome run(StepDefinition step, Revisions revisions, boolean execute) {
        return locked(() -> {
            DependencyGraph dependencies = DependencyGraph.from(database);
            ProvenanceGraph provenance = ProvenanceGraph.from(database);
            Plan candidate = step.toPlan();
            Plan plan = dependencies.add(candidate);
            boolean reused = plan != candidate;

            List<Entity> removed = new ArrayList<>();
            for (String path : step.removes()) {
                Optional<String> checksum = revisions.checksumAt(path, config.revision());
                if (checksum.isPresent()) {
                    removed.add(Entity.findOrCreate(database, path, checksum.get()));
                } else {
                    log.warn("Removed path {} has no checksum at {}; not recorded", path, config.revision());
                }
            }

            Instant startedAt = Instant.now();
            Instant endedAt = startedAt;
            if (execute) {
                List<StepResult> results = executor.execute(List.of(PlannedStep.of(plan)));
                startedAt = results.get(0).startedAt();
                endedAt = results.get(0).endedAt();
            }
            Activity activity = newActivity(plan, startedAt, endedAt, removed);
            long order = provenance.add(activity);
            database.commit();
            journal().record("run", "ok", Map.of("plan", plan.name(), "order", order, "reused_plan", reused));
            log.info("Recorded {} as activity #{}", plan.name(), order);
            return new RunOutcome(plan.id(), plan.name(), reused, activity.id(), order, execute);
        });
    }

    /** Soft-deletes the plan named or identified by {@code nameOrId}. */
    public PlanView invalidate(String nameOrId) {
        return locked(() -> {
            Plan plan = findPlan(nameOrId)
                    .orElseThrow(() -> new IllegalArgumentException("Unknown plan: " + nameOrId));
            if (!plan.isInvalidated()) {
                plan.invalidate(Instant.now());
                database.commit();
                journal().record("invalidate", "ok", Map.of("plan", plan.name()));
            }
            return PlanView.of(plan);
        });
    }

    public List<PlanView> plans(boolean includeInvalidated) {
        return locked(() -> {
            List<PlanView> out = new ArrayList<>();
            for (Plan plan : database.all(ModelType.PLAN, Plan.class)) {
                if (includeInvalidated || !plan.isInvalidated()) {
                    out.add(PlanView.of(plan));
                }
            }
            return out;
        });
    }

    public List<ActivityView> log(int limit) {
        return locked(() -> {
            List<Activity> activities = ProvenanceGraph.from(database).activities();
            int from = limit > 0 ? Math.max(0, activities.size() - limit) : 0;
            List<ActivityView> out = new ArrayList<>();
            for (Activity activity : activities.subList(from, activities.size())) {
                out.add(ActivityView.of(activity));
            }
            return out;
        });
    }

    public List<JsonNode> journalTail(int lines) {
        return journal().tail(lines);
    }

    /** Line number of the first broken journal entry, {@code 0} when the chain is intact. */
    public int verifyJournal() {
        return journal().verify();
    }

    private Optional<Plan> findPlan(String nameOrId) {
        for (Plan plan : database.all(ModelType.PLAN, Plan.class)) {
            if (plan.id().equals(nameOrId) || nameOrId.equals(plan.name())) {
                return Optional.of(plan);
            }
        }
        return Optional.empty();
    }

    /** Usages and generations are checksummed on disk, where the step read and wrote them. */
    private Activity newActivity(Plan plan, Instant startedAt, Instant endedAt, List<Entity> removed) {
        List<Entity> used = new ArrayList<>();
        for (CommandInput input : plan.inputs()) {
            used.add(entityOnDisk(plan, input.consumes()));
        }
        List<Entity> generated = new ArrayList<>();
        for (CommandOutput output : plan.outputs()) {
            generated.add(entityOnDisk(plan, output.produces()));
        }
        return new Activity(plan, startedAt, endedAt, used, generated, removed);
    }

    private Entity entityOnDisk(Plan plan, String path) {
        String checksum = workingTree.checksumAt(path, config.revision())
                .orElseThrow(() -> new ProvTrackException("Path " + path + " of " + plan.name()
                        + " does not exist in " + config.rootDir()));
        return Entity.findOrCreate(database, path, checksum);
    }

    private Changes changes(ProvenanceGraph provenance, Revisions revisions) {
        List<PlanUsage> modified = new ArrayList<>();
        List<PlanUsage> deleted = new ArrayList<>();
        for (PlanUsage usage : provenance.getLatestPlansUsages()) {
            Optional<String> current = revisions.checksumAt(usage.path(), config.revision());
            if (current.isEmpty()) {
                deleted.add(usage);
            } else if (!current.get().equals(usage.checksum())) {
                modified.add(usage);
            }
        }
        return new Changes(modified, deleted);
    }

    private CommandJournal journal() {
        if (journal == null) {
            journal = new CommandJournal(config.journalFile());
        }
        return journal;
    }

    private <T> T locked(Supplier<T> action) {
        try (RepositoryLock ignored = RepositoryLock.acquire(config.lockFile())) {
            // Each call starts from committed state only.
            database = new Database(new FileStorage(config.objectsDir()), ModelType.registry());
            return action.get();
        }
    }

    private static Set<String> paths(List<PlanUsage> usages) {
        Set<String> out = new TreeSet<>();
        for (PlanUsage usage : usages) {
            out.add(usage.path());
        }
        return out;
    }

    private static List<String> names(List<Plan> plans) {
        List<String> out = new ArrayList<>(plans.size());
        for (Plan plan : plans) {
            out.add(plan.name());
        }
        return out;
    }

    private record Changes(List<PlanUsage> modified, List<PlanUsage> deleted) {
    }

    public record InitOutcome(String root, String objectsDir, boolean created) {
    }

    public record StatusReport(
            Map<String, List<String>> stalePaths,
            List<String> modifiedInputs,
            List<String> deletedInputs,
            List<String> blockedPlans,
            List<List<String>> cycles
    ) {
        public boolean upToDate() {
            return stalePaths.isEmpty() && modifiedInputs.isEmpty() && deletedInputs.isEmpty();
        }
    }

    public record UpdatePlan(List<String> plans, List<String> blocked, boolean dryRun, List<Long> recordedOrders) {
    }

    public record RunOutcome(
            String planId,
            String planName,
            boolean reusedPlan,
            String activityId,
            long order,
            boolean executed
    ) {
    }

    public record PlanView(
            String id,
            String name,
            String command,
            List<String> argv,
            List<String> inputs,
            List<String> outputs,
            Instant invalidatedAt,
            String derivedFrom
    ) {
        static PlanView of(Plan plan) {
            return new PlanView(
                    plan.id(),
                    plan.name(),
                    plan.command(),
                    plan.toArgv(),
                    plan.inputs().stream().map(CommandInput::consumes).toList(),
                    plan.outputs().stream().map(CommandOutput::produces).toList(),
                    plan.invalidatedAt(),
                    plan.derivedFrom()
            );
        }
    }

    public record ActivityView(
            long order,
            String id,
            String plan,
            Instant startedAt,
            Instant endedAt,
            Map<String, String> usages,
            Map<String, String> generations,
            List<String> invalidations
    ) {
        static ActivityView of(Activity activity) {
            Map<String, String> usages = new LinkedHashMap<>();
            for (Usage usage : activity.usages()) {
                usages.put(usage.path(), usage.checksum());
            }
            Map<String, String> generations = new LinkedHashMap<>();
            for (Generation generation : activity.generations()) {
                generations.put(generation.path(), generation.checksum());
            }
            List<String> invalidations = new ArrayList<>();
            for (Entity entity : activity.invalidations()) {
                invalidations.add(entity.path());
            }
            return new ActivityView(
                    activity.order(),
                    activity.id(),
                    activity.plan().name(),
                    activity.startedAt(),
                    activity.endedAt(),
                    usages,
                    generations,
                    invalidations
            );
        }
    }
}
