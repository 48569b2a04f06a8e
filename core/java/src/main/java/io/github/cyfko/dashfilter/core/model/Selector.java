package io.github.cyfko.dashfilter.core.model;

import io.github.cyfko.dashfilter.core.api.Operator;
import io.github.cyfko.dashfilter.core.api.SelectorType;
import io.github.cyfko.dashfilter.core.config.PatternConfig;
import io.github.cyfko.dashfilter.core.exception.SelectorDefinitionException;

/**
 * Immutable definition of a dashboard selector: a typed filter control whose value is turned into
 * predicates on every chart it is mapped to.
 *
 * <h2>Validation</h2>
 * <p>The canonical constructor validates structure eagerly:</p>
 * <ul>
 *   <li>{@code name} matches {@code [a-zA-Z0-9_]+} (it keys the viewer's filter-value map), at most 100 chars</li>
 *   <li>{@code label} is not blank, at most 255 chars</li>
 *   <li>{@code type} is required; a missing {@code defaultOperator} falls back to the type's default</li>
 *   <li>a {@code valueSource} is only accepted for dropdown and multi-select selectors</li>
 * </ul>
 * <p>
 * Name uniqueness within a dashboard needs the store and is checked by
 * {@link io.github.cyfko.dashfilter.core.store.SelectorManager}. Renaming a selector does not rewrite
 * filter-value maps saved under the old name: a rename is a breaking change for callers.
 * </p>
 *
 * <h2>Usage</h2>
 * <pre>{@code
 * Selector status = Selector.builder(42L, "status", SelectorType.DROPDOWN)
 *     .label("Deal status")
 *     .valueSource(new DatabaseValueSource("crm_deals", "stage_id"))
 *     .build();
 * }</pre>
 *
 * @param id              store identifier, {@code null} until saved
 * @param dashboardId     dashboard the selector belongs to
 * @param name            identifier-safe name, unique within the dashboard
 * @param label           display label
 * @param type            kind of control
 * @param defaultOperator operator used by mappings without an override
 * @param required        whether the dashboard refuses to render without a value
 * @param sortOrder       display position, ties broken by id
 * @param valueSource     option source for list selectors, {@code null} otherwise
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record Selector(
        Long id,
        long dashboardId,
        String name,
        String label,
        SelectorType type,
        Operator defaultOperator,
        boolean required,
        int sortOrder,
        ValueSource valueSource
) {

    public Selector {
        if (name == null || !PatternConfig.SELECTOR_NAME_PATTERN.matcher(name).matches()) {
            throw new SelectorDefinitionException("Selector name '" + name + "' must match [a-zA-Z0-9_]+");
        }
        if (name.length() > PatternConfig.MAX_SELECTOR_NAME_LENGTH) {
            throw new SelectorDefinitionException("Selector name exceeds "
                    + PatternConfig.MAX_SELECTOR_NAME_LENGTH + " characters: '" + name + "'");
        }
        if (label == null || label.isBlank()) {
            throw new SelectorDefinitionException("Selector '" + name + "' requires a label");
        }
        if (label.length() > PatternConfig.MAX_LABEL_LENGTH) {
            throw new SelectorDefinitionException("Label of selector '" + name + "' exceeds "
                    + PatternConfig.MAX_LABEL_LENGTH + " characters");
        }
        if (type == null) {
            throw new SelectorDefinitionException("Selector '" + name + "' requires a type");
        }
        if (defaultOperator == null) {
            defaultOperator = type.getDefaultOperator();
        }
        if (valueSource != null && !type.isValueSourceAllowed()) {
            throw new SelectorDefinitionException("Selector type " + type.getCode()
                    + " cannot have a value source (selector '" + name + "')");
        }
    }

    /**
     * Resolves the operator a mapping applies: its override when present, this selector's default otherwise.
     *
     * @param mapping a mapping of this selector
     * @return the effective operator
     */
    public Operator effectiveOperator(SelectorMapping mapping) {
        return mapping.operatorOverride() != null ? mapping.operatorOverride() : defaultOperator;
    }

    public Selector withId(long newId) {
        return new Selector(newId, dashboardId, name, label, type, defaultOperator, required, sortOrder, valueSource);
    }

    public static Builder builder(long dashboardId, String name, SelectorType type) {
        return new Builder(dashboardId, name, type);
    }

    public static class Builder {
        private Long _id;
        private final long _dashboardId;
        private final String _name;
        private String _label;
        private final SelectorType _type;
        private Operator _defaultOperator;
        private boolean _required;
        private int _sortOrder;
        private ValueSource _valueSource;

        private Builder(long dashboardId, String name, SelectorType type) {
            this._dashboardId = dashboardId;
            this._name = name;
            this._type = type;
        }

        public Selector build() {
            return new Selector(_id, _dashboardId, _name, _label != null ? _label : _name, _type,
                    _defaultOperator, _required, _sortOrder, _valueSource);
        }

        public Builder id(Long id) { this._id = id; return this; }
        public Builder label(String label) { this._label = label; return this; }
        public Builder defaultOperator(Operator operator) { this._defaultOperator = operator; return this; }
        public Builder required(boolean required) { this._required = required; return this; }
        public Builder sortOrder(int sortOrder) { this._sortOrder = sortOrder; return this; }
        public Builder valueSource(ValueSource valueSource) { this._valueSource = valueSource; return this; }
    }
}
