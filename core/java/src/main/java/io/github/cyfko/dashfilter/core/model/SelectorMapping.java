package io.github.cyfko.dashfilter.core.model;

import io.github.cyfko.dashfilter.core.api.Operator;
import io.github.cyfko.dashfilter.core.config.PatternConfig;
import io.github.cyfko.dashfilter.core.exception.SelectorDefinitionException;

/**
 * Binding of one selector to one column of one chart.
 * <p>
 * {@code targetTable} qualifies the column and is required when the chart query joins several
 * tables exposing a column of that name. {@code operatorOverride} replaces the selector's default
 * operator for this chart only.
 * </p>
 * <p>
 * Two mappings are duplicates when selector, chart, column and table are equal (names compared
 * case-insensitively); the store rejects the second one.
 * </p>
 *
 * @param id               store identifier, {@code null} until saved
 * @param selectorId       selector being mapped
 * @param chartId          chart receiving the predicate
 * @param targetColumn     column the predicate applies to
 * @param targetTable      table or alias qualifying the column, or {@code null}
 * @param operatorOverride operator replacing the selector default, or {@code null}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record SelectorMapping(
        Long id,
        long selectorId,
        long chartId,
        String targetColumn,
        String targetTable,
        Operator operatorOverride
) {

    public SelectorMapping {
        if (!PatternConfig.isSqlIdentifier(targetColumn)) {
            throw new SelectorDefinitionException("Invalid target column: '" + targetColumn + "'");
        }
        if (targetTable != null && targetTable.isBlank()) {
            targetTable = null;
        }
        if (targetTable != null && !PatternConfig.isSqlIdentifier(targetTable)) {
            throw new SelectorDefinitionException("Invalid target table: '" + targetTable + "'");
        }
    }

    public SelectorMapping(long selectorId, long chartId, String targetColumn) {
        this(null, selectorId, chartId, targetColumn, null, null);
    }

    public SelectorMapping withId(long newId) {
        return new SelectorMapping(newId, selectorId, chartId, targetColumn, targetTable, operatorOverride);
    }

    public SelectorMapping withSelectorId(long newSelectorId) {
        return new SelectorMapping(id, newSelectorId, chartId, targetColumn, targetTable, operatorOverride);
    }

    /**
     * @return {@code table.column} when a table is set, the bare column otherwise
     */
    public String qualifiedColumn() {
        return targetTable != null ? targetTable + "." + targetColumn : targetColumn;
    }

    /**
     * Whether both mappings put a predicate on the same column of the same chart, whatever the selector.
     */
    public boolean sameTarget(SelectorMapping other) {
        return chartId == other.chartId
                && targetColumn.equalsIgnoreCase(other.targetColumn)
                && (targetTable == null ? other.targetTable == null : targetTable.equalsIgnoreCase(other.targetTable));
    }

    /**
     * Whether the other mapping has the same selector and target, i.e. would be a duplicate of this one.
     */
    public boolean duplicates(SelectorMapping other) {
        return selectorId == other.selectorId && sameTarget(other);
    }
}
