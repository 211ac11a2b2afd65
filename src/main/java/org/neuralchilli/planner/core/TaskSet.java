package org.neuralchilli.planner.core;

import org.jgrapht.Graph;
import org.jgrapht.Graphs;
import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.graph.DirectedAcyclicGraph;
import org.jgrapht.traverse.BreadthFirstIterator;
import org.jgrapht.traverse.TopologicalOrderIterator;
import org.neuralchilli.planner.domain.Task;
import org.neuralchilli.planner.domain.TaskId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Output of one loader pass: every task keyed by canonical id, plus the two
 * graphs over them.
 *
 * Containment is a DAG with edges parent -> child. Dependencies may contain
 * cycles; edges run from the dependency to the dependent, so a task's
 * dependencies are its predecessors and its dependents its successors.
 * Dependency targets that are not tasks are kept in {@link Task#dependsOn()}
 * but have no vertex here.
 */
public final class TaskSet {

    private static final Logger log = LoggerFactory.getLogger(TaskSet.class);

    private final List<Task> tasks;
    private final Map<TaskId, Task> index;
    private final DirectedAcyclicGraph<TaskId, DefaultEdge> containment;
    private final Graph<TaskId, DefaultEdge> dependencies;
    private final int skippedContainmentEdges;

    private TaskSet(
            List<Task> tasks,
            Map<TaskId, Task> index,
            DirectedAcyclicGraph<TaskId, DefaultEdge> containment,
            Graph<TaskId, DefaultEdge> dependencies,
            int skippedContainmentEdges
    ) {
        this.tasks = tasks;
        this.index = index;
        this.containment = containment;
        this.dependencies = dependencies;
        this.skippedContainmentEdges = skippedContainmentEdges;
    }

    public static TaskSet empty() {
        return of(List.of());
    }

    /**
     * Build the set from materialized tasks.
     * The first task wins when two share an id. Containment comes from each
     * task's parent link; an edge that would close a cycle is skipped.
     */
    public static TaskSet of(Collection<Task> input) {
        Map<TaskId, Task> index = new TreeMap<>();
        for (Task task : input) {
            index.putIfAbsent(task.id(), task);
        }

        DirectedAcyclicGraph<TaskId, DefaultEdge> containment =
                new DirectedAcyclicGraph<>(DefaultEdge.class);
        Graph<TaskId, DefaultEdge> dependencies = new DefaultDirectedGraph<>(DefaultEdge.class);
        index.keySet().forEach(id -> {
            containment.addVertex(id);
            dependencies.addVertex(id);
        });

        int skipped = 0;
        for (Task task : index.values()) {
            TaskId parent = task.parentTaskId();
            if (parent == null || parent.equals(task.id()) || !index.containsKey(parent)) {
                continue;
            }
            try {
                containment.addEdge(parent, task.id());
                log.trace("Containment edge: {} -> {}", parent, task.id());
            } catch (IllegalArgumentException e) {
                // Adding this edge would create a containment cycle
                skipped++;
                log.warn("Skipping containment edge {} -> {}: it would close a cycle",
                        parent, task.id());
            }
        }

        for (Task task : index.values()) {
            for (TaskId target : task.dependsOn()) {
                if (!target.equals(task.id()) && index.containsKey(target)) {
                    dependencies.addEdge(target, task.id());
                }
            }
        }

        log.debug("Task set built: {} tasks, {} containment edges, {} dependency edges",
                index.size(), containment.edgeSet().size(), dependencies.edgeSet().size());

        return new TaskSet(
                List.copyOf(index.values()),
                Collections.unmodifiableMap(index),
                containment,
                dependencies,
                skipped
        );
    }

    /**
     * Tasks in canonical-id order.
     */
    public List<Task> tasks() {
        return tasks;
    }

    public int size() {
        return tasks.size();
    }

    public boolean contains(TaskId id) {
        return index.containsKey(id);
    }

    public Optional<Task> task(TaskId id) {
        return Optional.ofNullable(index.get(id));
    }

    public int skippedContainmentEdges() {
        return skippedContainmentEdges;
    }

    /**
     * Containment parent, if it is a task.
     */
    public Optional<Task> parentOf(TaskId id) {
        if (!containment.containsVertex(id)) {
            return Optional.empty();
        }
        return containment.incomingEdgesOf(id).stream()
                .map(containment::getEdgeSource)
                .findFirst()
                .map(index::get);
    }

    /**
     * Direct child tasks, in the parent's outline order.
     */
    public List<Task> childrenOf(TaskId id) {
        Task parent = index.get(id);
        if (parent == null) {
            return List.of();
        }

        Set<TaskId> successors = new TreeSet<>(Graphs.successorListOf(containment, id));
        List<Task> children = new ArrayList<>();
        for (TaskId childId : parent.childTaskIds()) {
            if (successors.remove(childId)) {
                children.add(index.get(childId));
            }
        }
        // Children whose parent link points here but which the outline did not list
        successors.forEach(childId -> children.add(index.get(childId)));
        return children;
    }

    /**
     * All tasks below this one in the containment tree, breadth first.
     */
    public List<Task> descendantsOf(TaskId id) {
        return reachableFrom(containment, id);
    }

    /**
     * Resolvable dependency targets, in declaration order.
     */
    public List<Task> dependenciesOf(TaskId id) {
        Task task = index.get(id);
        if (task == null) {
            return List.of();
        }
        return task.dependsOn().stream()
                .filter(target -> !target.equals(id))
                .map(index::get)
                .filter(Objects::nonNull)
                .toList();
    }

    /**
     * Tasks that list this one as a dependency.
     */
    public List<Task> directDependentsOf(TaskId id) {
        if (!dependencies.containsVertex(id)) {
            return List.of();
        }
        return Graphs.successorListOf(dependencies, id).stream()
                .distinct()
                .sorted()
                .map(index::get)
                .toList();
    }

    /**
     * Tasks that depend on this one directly or through other tasks.
     * Bounded by the visited set, so dependency cycles terminate.
     */
    public List<Task> transitiveDependentsOf(TaskId id) {
        return reachableFrom(dependencies, id);
    }

    /**
     * Every task with its containment parent before it; ties by id.
     */
    public List<Task> containmentOrder() {
        List<Task> order = new ArrayList<>(tasks.size());
        TopologicalOrderIterator<TaskId, DefaultEdge> iterator =
                new TopologicalOrderIterator<>(containment, Comparator.naturalOrder());
        while (iterator.hasNext()) {
            order.add(index.get(iterator.next()));
        }
        return order;
    }

    public int containmentEdgeCount() {
        return containment.edgeSet().size();
    }

    public int dependencyEdgeCount() {
        return dependencies.edgeSet().size();
    }

    private List<Task> reachableFrom(Graph<TaskId, DefaultEdge> graph, TaskId start) {
        if (!graph.containsVertex(start)) {
            return List.of();
        }
        List<Task> reached = new ArrayList<>();
        BreadthFirstIterator<TaskId, DefaultEdge> iterator = new BreadthFirstIterator<>(graph, start);
        while (iterator.hasNext()) {
            TaskId next = iterator.next();
            if (!next.equals(start)) {
                reached.add(index.get(next));
            }
        }
        return reached;
    }

    @Override
    public String toString() {
        return "TaskSet[tasks=" + tasks.size() +
                ", containmentEdges=" + containment.edgeSet().size() +
                ", dependencyEdges=" + dependencies.edgeSet().size() + "]";
    }
}
