package com.eventseries.service.storage.impl;

import com.eventseries.service.core.model.ColumnExpansion;
import com.eventseries.service.core.model.Condition;
import com.eventseries.service.core.query.AggregateFunction;
import com.eventseries.service.core.query.Aggregation;
import com.eventseries.service.core.query.OrderBy;
import com.eventseries.service.core.query.QueryBuilder;
import com.eventseries.service.core.query.QueryRequest;
import com.eventseries.service.core.query.TimeBucketExpression;
import com.eventseries.service.storage.config.StorageProperties;
import java.sql.Timestamp;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;

/**
 * Renders a {@link QueryRequest} as a ClickHouse aggregation query.
 *
 * <p>Column names come from model settings and caller conditions, so every column is validated against
 * {@link #COLUMN}; values are always bound as named parameters.
 */
public class ClickHouseSqlRenderer {

    private static final Pattern COLUMN = Pattern.compile("[A-Za-z_][A-Za-z0-9_.]*");
    private static final Pattern TAG = Pattern.compile("tags\\[([A-Za-z0-9_.:\\-]+)]");

    private final StorageProperties properties;

    public ClickHouseSqlRenderer(StorageProperties properties) {
        this.properties = properties;
    }

    public RenderedQuery render(QueryRequest request) {
        MapSqlParameterSource params = new MapSqlParameterSource();
        Map<String, String> expansions = new LinkedHashMap<>();
        for (ColumnExpansion expansion : request.selectedColumns()) {
            expansions.put(
                    expansion.alias(),
                    expansion.function() + "(" + column(expansion.sourceColumn()) + ")");
        }

        List<String> select = new ArrayList<>();
        for (String group : request.groupBy()) {
            if (!expansions.containsKey(group)) {
                select.add(projection(group, request) + " AS " + alias(group));
            }
        }
        List<String> valueColumns = new ArrayList<>();
        for (Aggregation aggregation : request.aggregations()) {
            select.add(aggregate(aggregation) + " AS " + alias(aggregation.alias()));
            valueColumns.add(aggregation.alias());
        }
        if (request.timeBucket() != null && !request.groupBy().contains(request.timeBucket().alias())) {
            select.add(timeBucket(request.timeBucket()) + " AS " + alias(request.timeBucket().alias()));
        }
        if (request.timeBucket() != null) {
            valueColumns.add(request.timeBucket().alias());
        }
        expansions.forEach((alias, expression) -> {
            select.add(expression + " AS " + alias(alias));
            valueColumns.add(alias);
        });

        String ts = column(properties.getTimestampColumn());
        List<String> where = new ArrayList<>();
        where.add(ts + " >= :start");
        where.add(ts + " < :end");
        params.addValue("start", Timestamp.from(request.start()));
        params.addValue("end", Timestamp.from(request.end()));

        int index = 0;
        for (Map.Entry<String, List<Object>> filter : request.filterKeys().entrySet()) {
            if (filter.getValue().isEmpty()) {
                where.add("1 = 0");
                continue;
            }
            String name = "fk" + index++;
            where.add(filterColumn(filter.getKey(), filter.getValue(), expansions) + " IN (:" + name + ")");
            params.addValue(name, filter.getValue());
        }

        index = 0;
        for (Condition condition : request.conditions()) {
            String name = "c" + index++;
            String placeholder = condition.operator().multiValued() ? "(:" + name + ")" : ":" + name;
            where.add(reference(condition.column(), expansions) + " " + condition.operator().symbol() + " "
                    + placeholder);
            params.addValue(name, condition.value());
        }

        StringBuilder sql = new StringBuilder();
        sql.append("/* ").append(request.referrer().replace("*/", "")).append(" */\n");
        sql.append("SELECT ").append(String.join(", ", select)).append('\n');
        sql.append("  FROM ").append(column(properties.tableFor(request.dataset()))).append('\n');
        sql.append(" WHERE ").append(String.join("\n   AND ", where)).append('\n');
        if (!request.groupBy().isEmpty()) {
            sql.append(" GROUP BY ")
                    .append(request.groupBy().stream().map(this::alias).collect(Collectors.joining(", ")))
                    .append('\n');
        }
        if (!request.orderBy().isEmpty()) {
            sql.append(" ORDER BY ")
                    .append(request.orderBy().stream().map(this::order).collect(Collectors.joining(", ")))
                    .append('\n');
        }
        sql.append(" LIMIT ").append(request.limit());
        if (request.useCache()) {
            sql.append("\n SETTINGS use_query_cache = 1");
        }
        return new RenderedQuery(sql.toString(), params, request.groupBy(), valueColumns);
    }

    private String projection(String group, QueryRequest request) {
        if (QueryBuilder.TIME_COLUMN.equals(group)) {
            return "toUnixTimestamp(toStartOfInterval(" + column(properties.getTimestampColumn())
                    + ", INTERVAL " + request.rollup() + " SECOND))";
        }
        if (request.timeBucket() != null && request.timeBucket().alias().equals(group)) {
            return timeBucket(request.timeBucket());
        }
        return column(group);
    }

    String timeBucket(TimeBucketExpression expression) {
        String ts = column(properties.getTimestampColumn());
        return expression
                .startOfFunction()
                .map(fn -> "toUnixTimestamp(" + fn + "(" + ts + "))")
                .orElseGet(() -> "multiply(intDiv(toUInt32(toUnixTimestamp(" + ts + ")), " + expression.rollup()
                        + "), " + expression.rollup() + ")");
    }

    String aggregate(Aggregation aggregation) {
        if (aggregation.column() == null) {
            if (aggregation.function() != AggregateFunction.COUNT) {
                throw new IllegalArgumentException(aggregation.expression() + " requires an aggregate column");
            }
            return "count()";
        }
        String target = column(aggregation.column());
        if (aggregation.function() == AggregateFunction.COUNT) {
            return "count(" + target + ")";
        }
        if (aggregation.function() == AggregateFunction.TOP_K) {
            return aggregation.expression() + "(" + target + ")";
        }
        return aggregation.function().functionName() + "(" + target + ")";
    }

    /** Expression for a column name; {@code tags[key]} reads the tag value of that key. */
    String column(String name) {
        Matcher tag = TAG.matcher(name);
        if (tag.matches()) {
            return "arrayElement(tags.value, indexOf(tags.key, '" + tag.group(1) + "'))";
        }
        if (!COLUMN.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid column name: " + name);
        }
        return name;
    }

    /** Environment ids filter on the id column; environment names keep the name column. */
    private String filterColumn(String key, List<Object> values, Map<String, String> expansions) {
        if (QueryBuilder.ENVIRONMENT_COLUMN.equals(key) && values.stream().allMatch(Number.class::isInstance)) {
            return column(properties.getEnvironmentIdColumn());
        }
        return reference(key, expansions);
    }

    private String reference(String name, Map<String, String> expansions) {
        return expansions.containsKey(name) ? alias(name) : column(name);
    }

    private String alias(String name) {
        if (COLUMN.matcher(name).matches() && !name.contains(".")) {
            return name;
        }
        column(name);
        return "`" + name + "`";
    }

    private String order(OrderBy orderBy) {
        return alias(orderBy.column()) + (orderBy.descending() ? " DESC" : " ASC");
    }
}
