package org.neuralchilli.planner.core;

import org.junit.jupiter.api.Test;
import org.neuralchilli.planner.domain.Task;
import org.neuralchilli.planner.domain.TaskId;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

class TaskSetTest {

    private static TaskId id(long value) {
        return TaskId.of(value);
    }

    private static List<TaskId> ids(List<Task> tasks) {
        return tasks.stream().map(Task::id).toList();
    }

    @Test
    void shouldBuildEmptySet() {
        TaskSet taskSet = TaskSet.empty();

        assertThat(taskSet.size()).isZero();
        assertThat(taskSet.containmentOrder()).isEmpty();
        assertThat(taskSet.descendantsOf(id(1))).isEmpty();
        assertThat(taskSet.parentOf(id(1))).isEmpty();
    }

    @Test
    void shouldKeepFirstTaskForDuplicateId() {
        Task first = Task.builder(1).text("first").build();
        Task second = Task.builder(1).text("second").build();

        TaskSet taskSet = TaskSet.of(List.of(first, second));

        assertThat(taskSet.size()).isEqualTo(1);
        assertThat(taskSet.task(id(1))).get().extracting(Task::text).isEqualTo("first");
    }

    @Test
    void shouldListTasksInIdOrder() {
        TaskSet taskSet = TaskSet.of(List.of(
                Task.builder(30).build(),
                Task.builder(10).build(),
                Task.builder(20).build()
        ));

        assertThat(ids(taskSet.tasks())).containsExactly(id(10), id(20), id(30));
    }

    @Test
    void shouldOrderChildrenByParentOutline() {
        // Given: The parent lists 3 before 2; task 4 points at the parent but is not listed
        Task parent = Task.builder(1).childTaskIds(List.of(id(3), id(2))).build();
        Task second = Task.builder(2).parentTaskId(id(1)).build();
        Task first = Task.builder(3).parentTaskId(id(1)).build();
        Task unlisted = Task.builder(4).parentTaskId(id(1)).build();

        TaskSet taskSet = TaskSet.of(List.of(parent, second, first, unlisted));

        assertThat(ids(taskSet.childrenOf(id(1)))).containsExactly(id(3), id(2), id(4));
        assertThat(taskSet.parentOf(id(4))).get().extracting(Task::id).isEqualTo(id(1));
    }

    @Test
    void shouldIgnoreOutlineEntriesWithoutParentLink() {
        // The child's parent link is the truth
        Task parent = Task.builder(1).childTaskIds(List.of(id(2))).build();
        Task elsewhere = Task.builder(2).parentTaskId(id(3)).build();
        Task other = Task.builder(3).build();

        TaskSet taskSet = TaskSet.of(List.of(parent, elsewhere, other));

        assertThat(taskSet.childrenOf(id(1))).isEmpty();
        assertThat(ids(taskSet.childrenOf(id(3)))).containsExactly(id(2));
    }

    @Test
    void shouldCollectDescendantsBreadthFirst() {
        Task root = Task.builder(1).build();
        Task child = Task.builder(2).parentTaskId(id(1)).build();
        Task grandchild = Task.builder(3).parentTaskId(id(2)).build();
        Task sibling = Task.builder(4).parentTaskId(id(1)).build();

        TaskSet taskSet = TaskSet.of(List.of(root, child, grandchild, sibling));

        assertThat(ids(taskSet.descendantsOf(id(1)))).containsExactlyInAnyOrder(id(2), id(3), id(4));
        assertThat(ids(taskSet.descendantsOf(id(1))).indexOf(id(3)))
                .isGreaterThan(ids(taskSet.descendantsOf(id(1))).indexOf(id(2)));
        assertThat(taskSet.descendantsOf(id(3))).isEmpty();
    }

    @Test
    void shouldSkipContainmentEdgeClosingCycle() {
        // Given: 1 -> 2 -> 1
        Task a = Task.builder(1).parentTaskId(id(2)).build();
        Task b = Task.builder(2).parentTaskId(id(1)).build();

        // When
        TaskSet taskSet = TaskSet.of(List.of(a, b));

        // Then: One edge kept, the other skipped, and ordering still works
        assertThat(taskSet.containmentEdgeCount()).isEqualTo(1);
        assertThat(taskSet.skippedContainmentEdges()).isEqualTo(1);
        assertThat(taskSet.containmentOrder()).hasSize(2);
    }

    @Test
    void shouldIgnoreParentThatIsNotTask() {
        Task orphan = Task.builder(1).parentTaskId(id(99)).build();

        TaskSet taskSet = TaskSet.of(List.of(orphan));

        assertThat(taskSet.parentOf(id(1))).isEmpty();
        assertThat(taskSet.containmentEdgeCount()).isZero();
    }

    @Test
    void shouldPlaceParentsBeforeChildren() {
        Task leaf = Task.builder(1).parentTaskId(id(3)).build();
        Task middle = Task.builder(3).parentTaskId(id(5)).build();
        Task root = Task.builder(5).build();
        Task loose = Task.builder(2).build();

        List<TaskId> order = ids(TaskSet.of(List.of(leaf, middle, root, loose)).containmentOrder());

        assertThat(order).hasSize(4);
        assertThat(order.indexOf(id(5))).isLessThan(order.indexOf(id(3)));
        assertThat(order.indexOf(id(3))).isLessThan(order.indexOf(id(1)));
    }

    @Test
    void shouldResolveDependenciesInDeclarationOrder() {
        Task task = Task.builder(1).dependsOn(3, 99, 2).build();

        TaskSet taskSet = TaskSet.of(List.of(task, Task.builder(2).build(), Task.builder(3).build()));

        assertThat(ids(taskSet.dependenciesOf(id(1)))).containsExactly(id(3), id(2));
        assertThat(taskSet.task(id(1)).orElseThrow().dependsOn()).contains(id(99));
        assertThat(taskSet.dependencyEdgeCount()).isEqualTo(2);
    }

    @Test
    void shouldFindDirectAndTransitiveDependents() {
        // Given: 3 depends on 2, 2 depends on 1, 4 depends on 1
        Task one = Task.builder(1).build();
        Task two = Task.builder(2).dependsOn(1).build();
        Task three = Task.builder(3).dependsOn(2).build();
        Task four = Task.builder(4).dependsOn(1).build();

        TaskSet taskSet = TaskSet.of(List.of(one, two, three, four));

        assertThat(ids(taskSet.directDependentsOf(id(1)))).containsExactly(id(2), id(4));
        assertThat(ids(taskSet.transitiveDependentsOf(id(1)))).containsExactlyInAnyOrder(id(2), id(3), id(4));
        assertThat(taskSet.transitiveDependentsOf(id(3))).isEmpty();
    }

    @Test
    void shouldTerminateTransitiveDependentsOnCycle() {
        Task a = Task.builder(1).dependsOn(3).build();
        Task b = Task.builder(2).dependsOn(1).build();
        Task c = Task.builder(3).dependsOn(2).build();

        TaskSet taskSet = TaskSet.of(List.of(a, b, c));

        assertThat(ids(taskSet.transitiveDependentsOf(id(1)))).containsExactlyInAnyOrder(id(2), id(3));
    }

    @Test
    void shouldNotAddSelfDependencyEdge() {
        TaskSet taskSet = TaskSet.of(List.of(Task.builder(1).dependsOn(1).build()));

        assertThat(taskSet.dependencyEdgeCount()).isZero();
        assertThat(taskSet.dependenciesOf(id(1))).isEmpty();
    }
}
