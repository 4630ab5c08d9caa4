package com.example.taskquery.domain.repository.memory;

import com.example.taskquery.domain.entity.Task;
import com.example.taskquery.domain.enums.SortKey;
import com.example.taskquery.domain.enums.TaskPriority;
import com.example.taskquery.domain.enums.TaskStatus;
import com.example.taskquery.domain.query.SeekKey;
import com.example.taskquery.domain.query.SortOrder;
import com.example.taskquery.domain.query.TaskQuery;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.time.LocalTime;
import java.util.ArrayList;
import java.util.List;

import static com.example.taskquery.TaskFixtures.BASE_TIME;
import static com.example.taskquery.TaskFixtures.OTHER_PROJECT_ID;
import static com.example.taskquery.TaskFixtures.PROJECT_ID;
import static com.example.taskquery.TaskFixtures.sequentialTasks;
import static com.example.taskquery.TaskFixtures.task;
import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("InMemoryTaskEvaluator Tests")
class InMemoryTaskEvaluatorTest {

    private static List<String> ids(List<Task> tasks) {
        return tasks.stream().map(Task::getId).toList();
    }

    private static List<String> evaluateIds(List<Task> tasks, TaskQuery query) {
        return ids(InMemoryTaskEvaluator.evaluate(tasks, PROJECT_ID, query));
    }

    @Nested
    @DisplayName("Keyset Pagination Tests")
    class KeysetPaginationTests {

        @Test
        @DisplayName("Five rows with limit 2 should page as [1,2], [3,4], [5]")
        void shouldPageThroughAllRows() {
            var tasks = new ArrayList<>(sequentialTasks(5));
            tasks.add(task("task-999", 3).projectId(OTHER_PROJECT_ID).build());
            var query = TaskQuery.builder().limit(2).build();

            var pages = new ArrayList<List<String>>();
            SeekKey seekKey = null;
            do {
                var rows = InMemoryTaskEvaluator.evaluate(tasks, PROJECT_ID, seekKey == null ? query : query.withCursor(seekKey));
                var page = rows.subList(0, Math.min(rows.size(), query.getLimit()));
                pages.add(ids(page));
                seekKey = null;
                if (rows.size() > query.getLimit()) {
                    var last = page.get(page.size() - 1);
                    seekKey = SeekKey.builder().createdAt(last.getCreatedAt()).id(last.getId()).build();
                }
            } while (seekKey != null);

            assertThat(pages).containsExactly(
                    List.of("task-001", "task-002"),
                    List.of("task-003", "task-004"),
                    List.of("task-005"));
        }

        @Test
        @DisplayName("Should return at most limit + 1 rows")
        void shouldCapAtFetchSize() {
            var rows = InMemoryTaskEvaluator.evaluate(sequentialTasks(10), PROJECT_ID, TaskQuery.builder().limit(3).build());

            assertThat(rows).hasSize(4);
        }

        @Test
        @DisplayName("Rows sharing a creation time should be ordered and sought by id")
        void sameCreationTimeShouldTieBreakById() {
            var tasks = List.of(
                    task("task-c", 0).build(),
                    task("task-a", 0).build(),
                    task("task-b", 0).build());

            assertThat(evaluateIds(tasks, TaskQuery.builder().build())).containsExactly("task-a", "task-b", "task-c");

            var afterA = SeekKey.builder().createdAt(BASE_TIME).id("task-a").build();
            assertThat(evaluateIds(tasks, TaskQuery.builder().build().withCursor(afterA))).containsExactly("task-b", "task-c");
        }

        @Test
        @DisplayName("A cursor should force creation order even when the stored rows differ")
        void cursorShouldForceCreationOrder() {
            var tasks = List.of(
                    task("task-1", 1).priority(TaskPriority.LOW).build(),
                    task("task-2", 2).priority(TaskPriority.HIGH).build(),
                    task("task-3", 3).priority(TaskPriority.HIGH).build());
            var seekKey = SeekKey.builder().createdAt(tasks.get(0).getCreatedAt()).id("task-1").build();

            assertThat(evaluateIds(tasks, TaskQuery.builder().build().withCursor(seekKey))).containsExactly("task-2", "task-3");
        }
    }

    @Nested
    @DisplayName("Ordering Tests")
    class OrderingTests {

        private final List<Task> tasks = List.of(
                task("task-1", 1).priority(TaskPriority.LOW).dueDate(LocalDate.of(2026, 1, 3)).build(),
                task("task-2", 2).priority(null).dueDate(null).build(),
                task("task-3", 3).priority(TaskPriority.HIGH).dueDate(LocalDate.of(2026, 1, 1)).build(),
                task("task-4", 4).priority(TaskPriority.MEDIUM).dueDate(LocalDate.of(2026, 1, 2)).build());

        @Test
        @DisplayName("Default order should be creation time ascending")
        void defaultOrderShouldBeCreationTime() {
            assertThat(evaluateIds(tasks, TaskQuery.builder().build())).containsExactly("task-1", "task-2", "task-3", "task-4");
        }

        @Test
        @DisplayName("Priority descending should rank high, medium, low, then unknown")
        void priorityShouldOrderByRank() {
            var query = TaskQuery.builder().sortOrders(List.of(SortOrder.desc(SortKey.PRIORITY))).build();

            assertThat(evaluateIds(tasks, query)).containsExactly("task-3", "task-4", "task-1", "task-2");
        }

        @Test
        @DisplayName("Missing due dates should go last ascending and first descending")
        void nullDueDatesShouldFollowDirection() {
            var ascending = TaskQuery.builder().sortOrders(List.of(SortOrder.asc(SortKey.DUE_DATE))).build();
            var descending = TaskQuery.builder().sortOrders(List.of(SortOrder.desc(SortKey.DUE_DATE))).build();

            assertThat(evaluateIds(tasks, ascending)).containsExactly("task-3", "task-4", "task-1", "task-2");
            assertThat(evaluateIds(tasks, descending)).containsExactly("task-2", "task-1", "task-4", "task-3");
        }

        @Test
        @DisplayName("sortOrder alone should fall back to creation order")
        void sortOrderKeyShouldFallBack() {
            var query = TaskQuery.builder().sortOrders(List.of(SortOrder.desc(SortKey.SORT_ORDER))).build();

            assertThat(evaluateIds(tasks, query)).containsExactly("task-1", "task-2", "task-3", "task-4");
        }
    }

    @Nested
    @DisplayName("Filter Tests")
    class FilterTests {

        @Test
        @DisplayName("Should combine filters with AND")
        void shouldCombineFilters() {
            var tasks = List.of(
                    task("task-1", 1).status(TaskStatus.TODO).assigneeId("user-1").build(),
                    task("task-2", 2).status(TaskStatus.DONE).assigneeId("user-1").build(),
                    task("task-3", 3).status(TaskStatus.TODO).assigneeId("user-2").build());
            var query = TaskQuery.builder().statuses(List.of(TaskStatus.TODO)).assigneeId("user-1").build();

            assertThat(evaluateIds(tasks, query)).containsExactly("task-1");
        }

        @Test
        @DisplayName("Due date window should include both boundary days and skip missing dates")
        void dueDateWindowShouldBeInclusive() {
            var tasks = List.of(
                    task("task-1", 1).dueDate(LocalDate.of(2026, 1, 9)).build(),
                    task("task-2", 2).dueDate(LocalDate.of(2026, 1, 10)).build(),
                    task("task-3", 3).dueDate(LocalDate.of(2026, 1, 12)).build(),
                    task("task-4", 4).dueDate(LocalDate.of(2026, 1, 13)).build(),
                    task("task-5", 5).dueDate(null).build());
            var query = TaskQuery.builder()
                    .dueDateFrom(LocalDate.of(2026, 1, 10).atStartOfDay())
                    .dueDateTo(LocalDate.of(2026, 1, 12).atTime(LocalTime.MAX))
                    .build();

            assertThat(evaluateIds(tasks, query)).containsExactly("task-2", "task-3");
        }

        @Test
        @DisplayName("Free text should match titles case-insensitively and literally")
        void freeTextShouldMatchLiterally() {
            var tasks = List.of(
                    task("task-1", 1).title("Fix LOGIN page").build(),
                    task("task-2", 2).title("50% off banner").build(),
                    task("task-3", 3).title("500 error").build(),
                    task("task-4", 4).title("'; DROP TABLE tasks; --").build());

            assertThat(evaluateIds(tasks, TaskQuery.builder().freeText("login").build())).containsExactly("task-1");
            assertThat(evaluateIds(tasks, TaskQuery.builder().freeText("50%").build())).containsExactly("task-2");
            assertThat(evaluateIds(tasks, TaskQuery.builder().freeText("'; drop table").build())).containsExactly("task-4");
            assertThat(evaluateIds(tasks, TaskQuery.builder().freeText("_").build())).isEmpty();
        }
    }
}
