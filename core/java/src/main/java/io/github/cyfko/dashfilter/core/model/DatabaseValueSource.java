package io.github.cyfko.dashfilter.core.model;

import io.github.cyfko.dashfilter.core.config.PatternConfig;
import io.github.cyfko.dashfilter.core.exception.SelectorDefinitionException;

/**
 * Options read as the distinct values of {@code sourceTable.sourceColumn}.
 * <p>
 * When the three label fields are set, each value is displayed with
 * {@code labelTable.labelColumn} of the row whose {@code labelValueColumn} equals it; for example
 * {@code crm_deals.assigned_by_id} labelled by {@code crm_users.name} joined on {@code crm_users.bitrix_id}.
 * The label join is all-or-nothing.
 * </p>
 * <p>
 * Every name is spliced into SQL, so each must be a plain identifier.
 * </p>
 *
 * @param sourceTable      table holding the values
 * @param sourceColumn     column holding the values
 * @param labelTable       lookup table for display labels, or {@code null}
 * @param labelColumn      label column in the lookup table, or {@code null}
 * @param labelValueColumn column of the lookup table matched against the values, or {@code null}
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record DatabaseValueSource(
        String sourceTable,
        String sourceColumn,
        String labelTable,
        String labelColumn,
        String labelValueColumn
) implements ValueSource {

    public DatabaseValueSource {
        requireIdentifier("source table", sourceTable);
        requireIdentifier("source column", sourceColumn);

        labelTable = blankToNull(labelTable);
        labelColumn = blankToNull(labelColumn);
        labelValueColumn = blankToNull(labelValueColumn);

        int labelFields = (labelTable != null ? 1 : 0) + (labelColumn != null ? 1 : 0) + (labelValueColumn != null ? 1 : 0);
        if (labelFields != 0 && labelFields != 3) {
            throw new SelectorDefinitionException(
                    "Label join requires label table, label column and label value column together");
        }
        if (labelFields == 3) {
            requireIdentifier("label table", labelTable);
            requireIdentifier("label column", labelColumn);
            requireIdentifier("label value column", labelValueColumn);
        }
    }

    /**
     * Source without a label join.
     */
    public DatabaseValueSource(String sourceTable, String sourceColumn) {
        this(sourceTable, sourceColumn, null, null, null);
    }

    public boolean hasLabelJoin() {
        return labelTable != null;
    }

    private static void requireIdentifier(String what, String value) {
        if (!PatternConfig.isSqlIdentifier(value)) {
            throw new SelectorDefinitionException("Invalid " + what + " name: '" + value + "'");
        }
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value.trim();
    }
}
