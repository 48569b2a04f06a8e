package io.github.cyfko.dashfilter.core.option;

import io.github.cyfko.dashfilter.core.config.OptionPolicy;
import io.github.cyfko.dashfilter.core.model.DatabaseValueSource;

import java.util.Objects;

/**
 * Builds the {@code SELECT DISTINCT} query listing the options of a database value source.
 * <p>
 * Identifiers are validated by {@link DatabaseValueSource} and spliced as-is. Without a label join:
 * </p>
 * <pre>{@code
 * SELECT DISTINCT stage_id AS option_value FROM crm_deals
 * WHERE stage_id IS NOT NULL ORDER BY stage_id LIMIT 500
 * }</pre>
 * <p>With a label join, both sides are cast to text so integer ids match text keys:</p>
 * <pre>{@code
 * SELECT DISTINCT s.assigned_by_id AS option_value, l.name AS option_label
 * FROM crm_deals s LEFT JOIN crm_users l
 * ON CAST(s.assigned_by_id AS TEXT) = CAST(l.bitrix_id AS TEXT)
 * WHERE s.assigned_by_id IS NOT NULL ORDER BY l.name, s.assigned_by_id LIMIT 500
 * }</pre>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class OptionQueryBuilder {

    private final OptionPolicy policy;

    public OptionQueryBuilder(OptionPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy");
    }

    public String build(DatabaseValueSource source) {
        String column = source.sourceColumn();
        if (!source.hasLabelJoin()) {
            return "SELECT DISTINCT " + column + " AS option_value FROM " + source.sourceTable()
                    + " WHERE " + column + " IS NOT NULL ORDER BY " + column + " LIMIT " + policy.maxOptions();
        }

        String cast = policy.castType();
        return "SELECT DISTINCT s." + column + " AS option_value, l." + source.labelColumn() + " AS option_label"
                + " FROM " + source.sourceTable() + " s LEFT JOIN " + source.labelTable() + " l"
                + " ON CAST(s." + column + " AS " + cast + ") = CAST(l." + source.labelValueColumn() + " AS " + cast + ")"
                + " WHERE s." + column + " IS NOT NULL"
                + " ORDER BY l." + source.labelColumn() + ", s." + column
                + " LIMIT " + policy.maxOptions();
    }
}
