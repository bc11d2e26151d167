package com.eventseries.service.storage.impl;

import java.util.List;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

/**
 * SQL text plus bound parameters.
 *
 * @param groupColumns result labels of the group-by columns, in nesting order
 * @param valueColumns result labels of the aggregate and other projected value columns
 */
public record RenderedQuery(
        String sql, MapSqlParameterSource params, List<String> groupColumns, List<String> valueColumns) {}
