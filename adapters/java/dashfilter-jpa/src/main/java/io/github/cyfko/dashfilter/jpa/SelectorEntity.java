package io.github.cyfko.dashfilter.jpa;

import io.github.cyfko.dashfilter.core.api.Operator;
import io.github.cyfko.dashfilter.core.api.SelectorType;
import io.github.cyfko.dashfilter.core.model.Selector;
import io.github.cyfko.dashfilter.core.model.ValueSource;
import jakarta.persistence.Column;
import jakarta.persistence.Convert;
import jakarta.persistence.Entity;
import jakarta.persistence.GeneratedValue;
import jakarta.persistence.GenerationType;
import jakarta.persistence.Id;
import jakarta.persistence.Index;
import jakarta.persistence.Table;
import jakarta.persistence.UniqueConstraint;

/**
 * Row of {@code dashboard_selectors}. Type and operator are stored by their wire code.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@Entity
@Table(name = "dashboard_selectors",
        uniqueConstraints = @UniqueConstraint(name = "uq_selector_dashboard_name", columnNames = {"dashboard_id", "name"}),
        indexes = @Index(name = "ix_selector_dashboard", columnList = "dashboard_id"))
public class SelectorEntity {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "dashboard_id", nullable = false)
    private long dashboardId;

    @Column(name = "name", nullable = false, length = 100)
    private String name;

    @Column(name = "label", nullable = false, length = 255)
    private String label;

    @Column(name = "selector_type", nullable = false, length = 32)
    private String type;

    @Column(name = "operator", nullable = false, length = 16)
    private String defaultOperator;

    @Column(name = "is_required", nullable = false)
    private boolean required;

    @Column(name = "sort_order", nullable = false)
    private int sortOrder;

    @Convert(converter = ValueSourceConverter.class)
    @Column(name = "config", length = 8000)
    private ValueSource valueSource;

    protected SelectorEntity() {}

    static SelectorEntity from(Selector selector) {
        SelectorEntity entity = new SelectorEntity();
        entity.id = selector.id();
        entity.copy(selector);
        return entity;
    }

    void copy(Selector selector) {
        this.dashboardId = selector.dashboardId();
        this.name = selector.name();
        this.label = selector.label();
        this.type = selector.type().getCode();
        this.defaultOperator = selector.defaultOperator().getCode();
        this.required = selector.required();
        this.sortOrder = selector.sortOrder();
        this.valueSource = selector.valueSource();
    }

    Selector toSelector() {
        return new Selector(id, dashboardId, name, label,
                SelectorType.fromString(type), Operator.fromString(defaultOperator),
                required, sortOrder, valueSource);
    }

    public Long getId() { return id; }
    public long getDashboardId() { return dashboardId; }
    public String getName() { return name; }
    public int getSortOrder() { return sortOrder; }
}
