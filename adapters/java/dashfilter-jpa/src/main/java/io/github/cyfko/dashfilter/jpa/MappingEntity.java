package io.github.cyfko.dashfilter.jpa;

import io.github.cyfko.dashfilter.core.api.Operator;
import io.github.cyfko.dashfilter.core.model.SelectorMapping;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

/**
 * Row of {@code selector_chart_mappings}.
 * <p>
 * The unique constraint does not cover rows without a target table (SQL {@code NULL}s never collide)
 * nor case differences; {@link JpaMappingStore} checks those before writing.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@Entity
@Table(name = "selector_chart_mappings",
        uniqueConstraints = @UniqueConstraint(name = "uq_mapping_target",
                columnNames = {"selector_id", "chart_id", "target_column", "target_table"}),
        indexes = {
                @Index(name = "ix_mapping_selector", columnList = "selector_id"),
                @Index(name = "ix_mapping_chart", columnList = "chart_id")
        })
public class MappingEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "selector_id", nullable = false)
    private long selectorId;

    @Column(name = "chart_id", nullable = false)
    private long chartId;

    @Column(name = "target_column", nullable = false, length = 255)
    private String targetColumn;

    @Column(name = "target_table", length = 255)
    private String targetTable;

    @Column(name = "operator_override", length = 16)
    private String operatorOverride;

    protected MappingEntity() {}

    static MappingEntity from(SelectorMapping mapping) {
        MappingEntity entity = new MappingEntity();
        entity.id = mapping.id();
        entity.copy(mapping);
        return entity;
    }

    void copy(SelectorMapping mapping) {
        this.selectorId = mapping.selectorId();
        this.chartId = mapping.chartId();
        this.targetColumn = mapping.targetColumn();
        this.targetTable = mapping.targetTable();
        this.operatorOverride = mapping.operatorOverride() != null ? mapping.operatorOverride().getCode() : null;
    }

    SelectorMapping toMapping() {
        return new SelectorMapping(id, selectorId, chartId, targetColumn, targetTable,
                operatorOverride != null ? Operator.fromString(operatorOverride) : null);
    }

    public Long getId() { return id; }
    public long getSelectorId() { return selectorId; }
    public long getChartId() { return chartId; }
}
