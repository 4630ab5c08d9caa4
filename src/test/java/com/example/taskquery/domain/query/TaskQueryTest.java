package com.example.taskquery.domain.query;

import com.example.taskquery.domain.enums.SortKey;
import com.example.taskquery.exception.IssueCode;
import com.example.taskquery.exception.QueryValidationException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.time.Instant;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("TaskQuery Tests")
class TaskQueryTest {

    @Nested
    @DisplayName("Limit Tests")
    class LimitTests {

        @ParameterizedTest
        @ValueSource(ints = {0, -5, 201, 500})
        @DisplayName("Out of range limits should become the default")
        void outOfRangeShouldBecomeDefault(int requested) {
            assertThat(TaskQuery.normalizeLimit(requested)).isEqualTo(TaskQuery.DEFAULT_LIMIT);
        }

        @ParameterizedTest
        @ValueSource(ints = {1, 150, 200})
        @DisplayName("In range limits should be kept")
        void inRangeShouldBeKept(int requested) {
            assertThat(TaskQuery.normalizeLimit(requested)).isEqualTo(requested);
        }

        @Test
        @DisplayName("Fetch size should be one more than the limit")
        void fetchSizeShouldBeLimitPlusOne() {
            assertThat(TaskQuery.builder().limit(20).build().getFetchSize()).isEqualTo(21);
            assertThat(TaskQuery.builder().build().getFetchSize()).isEqualTo(201);
        }
    }

    @Nested
    @DisplayName("Validation Tests")
    class ValidationTests {

        @Test
        @DisplayName("Should reject a limit outside the range")
        void shouldRejectLimitOutsideRange() {
            var query = TaskQuery.builder().limit(0).build();

            assertThatThrownBy(query::validate)
                    .isInstanceOf(QueryValidationException.class)
                    .hasFieldOrPropertyWithValue("field", "limit")
                    .hasFieldOrPropertyWithValue("code", IssueCode.INVALID_RANGE);
        }

        @Test
        @DisplayName("Should reject a due date window that ends before it starts")
        void shouldRejectInvertedDateWindow() {
            var query = TaskQuery.builder()
                    .dueDateFrom(LocalDate.of(2026, 2, 1).atStartOfDay())
                    .dueDateTo(LocalDate.of(2026, 1, 1).atStartOfDay())
                    .build();

            assertThatThrownBy(query::validate)
                    .isInstanceOf(QueryValidationException.class)
                    .hasFieldOrPropertyWithValue("field", "dueDateFrom")
                    .hasFieldOrPropertyWithValue("code", IssueCode.CONSTRAINT_VIOLATION);
        }

        @Test
        @DisplayName("Should reject a cursor combined with an explicit sort")
        void shouldRejectCursorWithSort() {
            var query = TaskQuery.builder()
                    .sortOrders(List.of(SortOrder.asc(SortKey.PRIORITY)))
                    .cursor(SeekKey.builder().createdAt(Instant.EPOCH).id("task-1").build())
                    .build();

            assertThatThrownBy(query::validate)
                    .isInstanceOf(QueryValidationException.class)
                    .hasFieldOrPropertyWithValue("field", "sort")
                    .hasFieldOrPropertyWithValue("code", IssueCode.INCOMPATIBLE_WITH_CURSOR);
        }

        @Test
        @DisplayName("Default query should be valid")
        void defaultQueryShouldBeValid() {
            var query = TaskQuery.builder().build();

            query.validate();

            assertThat(query.getLimit()).isEqualTo(200);
            assertThat(query.hasCursor()).isFalse();
        }
    }
}
