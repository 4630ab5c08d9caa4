package com.example.taskquery.dto;

import com.example.taskquery.exception.IssueCode;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One rejected request parameter
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonInclude(JsonInclude.Include.NON_NULL)
public class ValidationIssue {

    /**
     * Where the parameter came from: query or path
     */
    private String location;

    private String field;

    private IssueCode code;

    private String message;

    private String rejectedValue;
}
