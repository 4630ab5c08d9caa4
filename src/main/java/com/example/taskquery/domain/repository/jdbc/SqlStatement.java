package com.example.taskquery.domain.repository.jdbc;

import lombok.Value;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

/**
 * SQL text with its named parameter values.
 * The text only contains column names, fixed keywords and {@code :name} placeholders.
 */
@Value
public class SqlStatement {

    String sql;
    MapSqlParameterSource parameters;
}
