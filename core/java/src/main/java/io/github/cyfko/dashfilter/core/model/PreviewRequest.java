package io.github.cyfko.dashfilter.core.model;

import io.github.cyfko.dashfilter.core.api.Operator;
import io.github.cyfko.dashfilter.core.api.SelectorType;

/**
 * One hypothetical mapping to preview against a chart while the editor is still configuring it.
 * <p>
 * Nothing here needs to be saved: {@code selectorId} is optional and only supplies defaults
 * (type, operator) for fields the editor left empty. The sample value is illustrative and is not
 * checked against the selector's real options.
 * </p>
 *
 * @param chartId      chart whose current query is previewed
 * @param selectorId   stored selector providing defaults, or {@code null}
 * @param selectorName name shown in logs, or {@code null}
 * @param selectorType type override, or {@code null}
 * @param operator     operator override, or {@code null}
 * @param targetColumn column the predicate applies to
 * @param targetTable  table qualifying the column, or {@code null}
 * @param sampleValue  editor-supplied sample, {@code null} or blank for a per-type placeholder
 * @author Frank KOSSI
 * @since 1.0.0
 */
public record PreviewRequest(
        long chartId,
        Long selectorId,
        String selectorName,
        SelectorType selectorType,
        Operator operator,
        String targetColumn,
        String targetTable,
        Object sampleValue
) {

    public static Builder builder(long chartId, String targetColumn) {
        return new Builder(chartId, targetColumn);
    }

    public static class Builder {
        private final long _chartId;
        private final String _targetColumn;
        private Long _selectorId;
        private String _selectorName;
        private SelectorType _selectorType;
        private Operator _operator;
        private String _targetTable;
        private Object _sampleValue;

        private Builder(long chartId, String targetColumn) {
            this._chartId = chartId;
            this._targetColumn = targetColumn;
        }

        public PreviewRequest build() {
            return new PreviewRequest(_chartId, _selectorId, _selectorName, _selectorType, _operator,
                    _targetColumn, _targetTable, _sampleValue);
        }

        public Builder selectorId(Long selectorId) { this._selectorId = selectorId; return this; }
        public Builder selectorName(String selectorName) { this._selectorName = selectorName; return this; }
        public Builder selectorType(SelectorType selectorType) { this._selectorType = selectorType; return this; }
        public Builder operator(Operator operator) { this._operator = operator; return this; }
        public Builder targetTable(String targetTable) { this._targetTable = targetTable; return this; }
        public Builder sampleValue(Object sampleValue) { this._sampleValue = sampleValue; return this; }
    }
}
