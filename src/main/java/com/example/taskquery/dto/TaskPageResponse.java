package com.example.taskquery.dto;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * One page of the task list
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TaskPageResponse {

    private List<TaskResponse> tasks;
    private PageInfo page;

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class PageInfo {

        /**
         * Cursor of the next page; null on the last page
         */
        private String nextCursor;

        /**
         * Effective page size after clamping
         */
        private int limit;
    }
}
