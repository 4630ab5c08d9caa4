package com.example.taskquery.service.query;

import com.example.taskquery.domain.enums.SortDirection;
import com.example.taskquery.domain.enums.SortKey;
import com.example.taskquery.domain.enums.TaskPriority;
import com.example.taskquery.domain.enums.TaskStatus;
import com.example.taskquery.domain.query.SortOrder;
import com.example.taskquery.domain.query.TaskQuery;
import com.example.taskquery.dto.TaskQueryParams;
import com.example.taskquery.exception.IssueCode;
import com.example.taskquery.exception.QueryValidationException;
import com.example.taskquery.service.cursor.CursorCodec;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.time.LocalTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.format.ResolverStyle;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Builds a validated {@link TaskQuery} from raw list parameters.
 * <p>
 * Rules:
 * - status/priority: comma-separated, trimmed, {@code doing} means {@code in_progress}, duplicates dropped
 * - dueDateFrom/dueDateTo: {@code YYYY-MM-DD}, widened to the whole day
 * - sort: whitelisted keys, {@code -} prefix for descending
 * - limit: clamped into [1, 200], out of range becomes 200
 * - cursor: decoded, verified against the normalized filters, never combined with sort
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class TaskQueryNormalizer {

    private static final DateTimeFormatter DATE_FORMAT = DateTimeFormatter.ofPattern("uuuu-MM-dd")
            .withResolverStyle(ResolverStyle.STRICT);

    private final CursorCodec cursorCodec;

    /**
     * Normalize and validate the parameters of one list request.
     *
     * @throws QueryValidationException                          for invalid filter, sort or limit input
     * @throws com.example.taskquery.exception.InvalidCursorException for a cursor that cannot be used
     */
    public TaskQuery normalize(String projectId, TaskQueryParams params) {
        if (!hasText(projectId)) {
            throw new QueryValidationException("projectId", IssueCode.REQUIRED, null);
        }

        var builder = TaskQuery.builder()
                .statuses(parseEnumList("status", params.getStatus(), TaskStatus::findByCode))
                .priorities(parseEnumList("priority", params.getPriority(), TaskPriority::findByCode));

        if (hasText(params.getAssigneeId())) {
            builder.assigneeId(params.getAssigneeId());
        }

        var dueDateFrom = parseDate("dueDateFrom", params.getDueDateFrom()).map(LocalDate::atStartOfDay);
        var dueDateTo = parseDate("dueDateTo", params.getDueDateTo()).map(date -> date.atTime(LocalTime.MAX));
        if (dueDateFrom.isPresent() && dueDateTo.isPresent() && dueDateFrom.get().isAfter(dueDateTo.get())) {
            throw new QueryValidationException("dueDateFrom", IssueCode.CONSTRAINT_VIOLATION, params.getDueDateFrom());
        }
        builder.dueDateFrom(dueDateFrom.orElse(null)).dueDateTo(dueDateTo.orElse(null));

        if (hasText(params.getQ())) {
            builder.freeText(params.getQ().trim());
        }

        var hasSort = hasText(params.getSort());
        var hasCursor = hasText(params.getCursor());
        if (hasSort && hasCursor) {
            throw new QueryValidationException("sort", IssueCode.INCOMPATIBLE_WITH_CURSOR, params.getSort());
        }
        if (hasSort) {
            builder.sortOrders(parseSort(params.getSort()));
        }

        builder.limit(parseLimit(params.getLimit()));

        var query = builder.build();
        if (hasCursor) {
            var payload = cursorCodec.decode(params.getCursor());
            var seekKey = cursorCodec.verify(payload, projectId, query.computeFingerprint(projectId));
            query = query.withCursor(seekKey);
        }

        query.validate();
        log.debug("Normalized task query for project {}: {}", projectId, query);
        return query;
    }

    private <E> List<E> parseEnumList(String field, String raw, Function<String, Optional<E>> lookup) {
        if (!hasText(raw)) {
            return List.of();
        }
        var values = new LinkedHashSet<E>();
        for (var token : raw.split(",")) {
            var trimmed = token.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            values.add(lookup.apply(trimmed).orElseThrow(() -> QueryValidationException.invalidEnum(field, trimmed)));
        }
        return List.copyOf(values);
    }

    private Optional<LocalDate> parseDate(String field, String raw) {
        if (raw == null || raw.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(LocalDate.parse(raw, DATE_FORMAT));
        } catch (DateTimeParseException e) {
            throw QueryValidationException.invalidFormat(field, raw, e);
        }
    }

    private List<SortOrder> parseSort(String raw) {
        var orders = new ArrayList<SortOrder>();
        for (var token : raw.split(",")) {
            var trimmed = token.trim();
            if (trimmed.isEmpty()) {
                continue;
            }
            var descending = trimmed.startsWith("-");
            var keyCode = descending ? trimmed.substring(1) : trimmed;
            var key = SortKey.findSortable(keyCode)
                    .orElseThrow(() -> QueryValidationException.invalidEnum("sort", keyCode));
            orders.add(new SortOrder(key, descending ? SortDirection.DESC : SortDirection.ASC));
        }
        return List.copyOf(orders);
    }

    private int parseLimit(String raw) {
        if (!hasText(raw)) {
            return TaskQuery.DEFAULT_LIMIT;
        }
        try {
            return TaskQuery.normalizeLimit(Integer.parseInt(raw.trim()));
        } catch (NumberFormatException e) {
            throw QueryValidationException.invalidFormat("limit", raw, e);
        }
    }

    private static boolean hasText(String value) {
        return value != null && !value.isBlank();
    }
}
