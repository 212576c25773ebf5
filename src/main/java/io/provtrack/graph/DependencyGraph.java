package io.provtrack.graph;

import io.provtrack.model.CommandInput;
import io.provtrack.model.CommandOutput;
import io.provtrack.model.ModelType;
import io.provtrack.model.Plan;
import io.provtrack.persistence.Database;
import io.provtrack.persistence.PersistentObject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Directed graph of the active plans. There is an edge {@code A -> B} when
 * some output of A is the same path as, or a parent directory of, some input
 * of B. Plans added through {@link #add(Plan)} keep the graph acyclic.
 */
public final class DependencyGraph {
    private static final Logger log = LoggerFactory.getLogger(DependencyGraph.class);
    private static final int WHITE = 0;
    private static final int GREY = 1;
    private static final int BLACK = 2;

    private final Database database;
    private final Map<String, Plan> nodes = new LinkedHashMap<>();
    private final Map<String, Set<String>> successors = new HashMap<>();
    private final Map<String, Set<String>> predecessors = new HashMap<>();

    private DependencyGraph(Database database) {
        this.database = database;
    }

    /** Graph over every plan in the catalog that has not been invalidated. */
    public static DependencyGraph from(Database database) {
        Objects.requireNonNull(database, "database");
        DependencyGraph graph = new DependencyGraph(database);
        for (Plan plan : database.all(ModelType.PLAN, Plan.class)) {
            if (!plan.isInvalidated()) {
                graph.insert(plan);
            }
        }
        return graph;
    }

    /**
     * Adds {@code plan} unless an equivalent plan is already present, in which
     * case that plan is returned instead. A plan whose id is already taken by
     * a different plan is given a fresh id first.
     *
     * @throws GraphCycleException if the plan would close a cycle; the graph is left unchanged
     */
    public Plan add(Plan plan) {
        Objects.requireNonNull(plan, "plan");
        if (plan.isInvalidated()) {
            throw new IllegalArgumentException("Cannot add an invalidated plan: " + plan);
        }
        for (Plan existing : nodes.values()) {
            if (existing == plan || existing.isSimilarTo(plan)) {
                return existing;
            }
        }
        if (plan.database() == null && idTaken(plan)) {
            String previous = plan.id();
            plan.assignNewId();
            log.info("Plan id {} already in use, re-identified as {}", previous, plan.id());
        }
        insert(plan);
        List<List<String>> found = cycles();
        if (!found.isEmpty()) {
            remove(plan);
            throw new GraphCycleException(found);
        }
        database.add(plan);
        return plan;
    }

    public List<Plan> plans() {
        return new ArrayList<>(nodes.values());
    }

    public boolean contains(Plan plan) {
        return nodes.get(plan.id()) == plan;
    }

    public List<Plan> successors(Plan plan) {
        return resolve(successors.getOrDefault(plan.id(), Set.of()));
    }

    public List<Plan> predecessors(Plan plan) {
        return resolve(predecessors.getOrDefault(plan.id(), Set.of()));
    }

    /** Every plan {@code plan} transitively depends on. */
    public List<Plan> upstream(Plan plan) {
        return resolve(reachable(Set.of(plan.id()), predecessors));
    }

    /** Every plan that transitively depends on {@code plan}. */
    public List<Plan> descendants(Plan plan) {
        return resolve(reachable(Set.of(plan.id()), successors));
    }

    /**
     * A cycle of the graph, as the names of its plans in edge order, or an
     * empty list for an acyclic graph. At most one cycle is reported.
     */
    public List<List<String>> cycles() {
        Map<String, Integer> colour = new HashMap<>();
        for (String id : nodes.keySet()) {
            if (colour.getOrDefault(id, WHITE) == WHITE) {
                List<String> cycle = findCycle(id, colour, new ArrayList<>());
                if (cycle != null) {
                    return List.of(cycle);
                }
            }
        }
        return List.of();
    }

    /**
     * Plans to re-run after {@code modified} paths changed. A plan is a seed
     * when its id matches the usage and one of its inputs (or outputs) lies at
     * or under the usage path; seeds and everything downstream of them are
     * returned producers first. Reached plans consuming a path in
     * {@code deleted}, and reached plans downstream of those, are reported as
     * blocked instead.
     *
     * @throws GraphCycleException if the graph is cyclic
     */
    public Downstream getDownstream(Collection<PlanUsage> modified, Collection<PlanUsage> deleted) {
        Set<String> seeds = new LinkedHashSet<>();
        for (PlanUsage usage : modified) {
            for (Plan plan : nodes.values()) {
                if (plan.id().equals(usage.planId())
                        && (consumes(plan, usage.path()) || produces(plan, usage.path()))) {
                    seeds.add(plan.id());
                }
            }
        }
        Set<String> reached = reachable(seeds, successors);
        reached.addAll(seeds);

        List<Plan> plans = new ArrayList<>();
        List<Plan> blocked = new ArrayList<>();
        Set<String> blockedIds = new HashSet<>();
        for (Plan plan : topologicalOrder()) {
            if (!reached.contains(plan.id())) {
                continue;
            }
            if (hasDeletedInput(plan, deleted) || hasBlockedPredecessor(plan, blockedIds)) {
                blocked.add(plan);
                blockedIds.add(plan.id());
            } else {
                plans.add(plan);
            }
        }
        return new Downstream(plans, blocked);
    }

    /** Output patterns of every plan reachable from the plans consuming {@code path}. */
    public Set<String> getDependentPaths(String planId, String path) {
        Deque<String> queue = new ArrayDeque<>();
        Set<String> visited = new HashSet<>();
        for (Plan plan : nodes.values()) {
            if (plan.id().equals(planId) && consumes(plan, path)) {
                queue.add(plan.id());
                visited.add(plan.id());
            }
        }
        Set<String> paths = new LinkedHashSet<>();
        while (!queue.isEmpty()) {
            String id = queue.poll();
            for (CommandOutput output : nodes.get(id).outputs()) {
                paths.add(output.produces());
            }
            for (String next : successors.getOrDefault(id, Set.of())) {
                if (visited.add(next)) {
                    queue.add(next);
                }
            }
        }
        return paths;
    }

    /** True when {@code child} is {@code parent} or lies below it. */
    public static boolean isSuperPath(String parent, String child) {
        if (parent == null || child == null) {
            return false;
        }
        try {
            Path p = Path.of(parent).normalize();
            Path c = Path.of(child).normalize();
            return c.equals(p) || c.startsWith(p) && !p.toString().isEmpty();
        } catch (InvalidPathException e) {
            return parent.equals(child);
        }
    }

    static boolean connects(Plan from, Plan to) {
        for (CommandOutput output : from.outputs()) {
            for (CommandInput input : to.inputs()) {
                if (isSuperPath(output.produces(), input.consumes())) {
                    return true;
                }
            }
        }
        return false;
    }

    private boolean idTaken(Plan plan) {
        if (nodes.containsKey(plan.id())) {
            return true;
        }
        PersistentObject stored = database.contains(Database.hashId(plan.id()))
                ? database.get(Database.hashId(plan.id()))
                : null;
        return stored != null && stored != plan;
    }

    private void insert(Plan plan) {
        String id = plan.id();
        nodes.put(id, plan);
        successors.computeIfAbsent(id, k -> new LinkedHashSet<>());
        predecessors.computeIfAbsent(id, k -> new LinkedHashSet<>());
        for (Plan other : nodes.values()) {
            if (connects(plan, other)) {
                link(id, other.id());
            }
            if (other != plan && connects(other, plan)) {
                link(other.id(), id);
            }
        }
    }

    private void remove(Plan plan) {
        String id = plan.id();
        nodes.remove(id);
        for (String next : successors.getOrDefault(id, Set.of())) {
            predecessors.getOrDefault(next, new HashSet<>()).remove(id);
        }
        for (String previous : predecessors.getOrDefault(id, Set.of())) {
            successors.getOrDefault(previous, new HashSet<>()).remove(id);
        }
        successors.remove(id);
        predecessors.remove(id);
    }

    private void link(String from, String to) {
        successors.get(from).add(to);
        predecessors.get(to).add(from);
    }

    private List<String> findCycle(String id, Map<String, Integer> colour, List<String> stack) {
        colour.put(id, GREY);
        stack.add(id);
        for (String next : successors.getOrDefault(id, Set.of())) {
            int state = colour.getOrDefault(next, WHITE);
            if (state == GREY) {
                List<String> names = new ArrayList<>();
                for (String member : stack.subList(stack.indexOf(next), stack.size())) {
                    names.add(nodes.get(member).name());
                }
                return names;
            }
            if (state == WHITE) {
                List<String> found = findCycle(next, colour, stack);
                if (found != null) {
                    return found;
                }
            }
        }
        stack.remove(stack.size() - 1);
        colour.put(id, BLACK);
        return null;
    }

    private List<Plan> topologicalOrder() {
        Map<String, Integer> inDegree = new HashMap<>();
        for (String id : nodes.keySet()) {
            inDegree.put(id, predecessors.getOrDefault(id, Set.of()).size());
        }
        Deque<String> ready = new ArrayDeque<>();
        for (String id : nodes.keySet()) {
            if (inDegree.get(id) == 0) {
                ready.add(id);
            }
        }
        List<Plan> sorted = new ArrayList<>(nodes.size());
        while (!ready.isEmpty()) {
            String id = ready.poll();
            sorted.add(nodes.get(id));
            for (String next : successors.getOrDefault(id, Set.of())) {
                if (inDegree.merge(next, -1, Integer::sum) == 0) {
                    ready.add(next);
                }
            }
        }
        if (sorted.size() < nodes.size()) {
            throw new GraphCycleException(cycles());
        }
        return sorted;
    }

    private static Set<String> reachable(Set<String> from, Map<String, Set<String>> edges) {
        Set<String> seen = new LinkedHashSet<>();
        Deque<String> queue = new ArrayDeque<>(from);
        while (!queue.isEmpty()) {
            for (String next : edges.getOrDefault(queue.poll(), Set.of())) {
                if (seen.add(next)) {
                    queue.add(next);
                }
            }
        }
        return seen;
    }

    private List<Plan> resolve(Collection<String> ids) {
        List<Plan> out = new ArrayList<>(ids.size());
        for (String id : ids) {
            Plan plan = nodes.get(id);
            if (plan != null) {
                out.add(plan);
            }
        }
        return out;
    }

    private static boolean consumes(Plan plan, String path) {
        for (CommandInput input : plan.inputs()) {
            if (isSuperPath(path, input.consumes())) {
                return true;
            }
        }
        return false;
    }

    private static boolean produces(Plan plan, String path) {
        for (CommandOutput output : plan.outputs()) {
            if (isSuperPath(path, output.produces())) {
                return true;
            }
        }
        return false;
    }

    private boolean hasBlockedPredecessor(Plan plan, Set<String> blockedIds) {
        for (String previous : predecessors.getOrDefault(plan.id(), Set.of())) {
            if (blockedIds.contains(previous)) {
                return true;
            }
        }
        return false;
    }

    private static boolean hasDeletedInput(Plan plan, Collection<PlanUsage> deleted) {
        for (PlanUsage usage : deleted) {
            if (consumes(plan, usage.path())) {
                return true;
            }
        }
        return false;
    }
}
