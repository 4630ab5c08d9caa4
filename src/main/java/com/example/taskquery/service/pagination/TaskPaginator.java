package com.example.taskquery.service.pagination;

import com.example.taskquery.domain.entity.Task;
import com.example.taskquery.domain.query.TaskQuery;
import com.example.taskquery.service.cursor.CursorCodec;
import com.example.taskquery.service.cursor.CursorPayload;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.List;

/**
 * Turns the {@code limit + 1} rows fetched for a query into a page.
 * <p>
 * When the extra row is present the page is cut to {@code limit} rows and the next cursor is
 * minted from the last returned row, bound to the project and the query fingerprint.
 */
@Component
@RequiredArgsConstructor
public class TaskPaginator {

    private final CursorCodec cursorCodec;
    private final Clock clock;

    public TaskPage paginate(String projectId, TaskQuery query, List<Task> rows) {
        var limit = query.getLimit();
        if (rows.size() <= limit) {
            return new TaskPage(List.copyOf(rows), null, limit);
        }

        var lastReturned = rows.get(limit - 1);
        var payload = CursorPayload.forRow(
                lastReturned.getCreatedAt(),
                lastReturned.getId(),
                projectId,
                query.computeFingerprint(projectId),
                clock.instant());
        return new TaskPage(List.copyOf(rows.subList(0, limit)), cursorCodec.encode(payload), limit);
    }
}
