package io.github.cyfko.dashfilter.spring.service.impl;

import io.github.cyfko.dashfilter.core.compose.FilterComposer;
import io.github.cyfko.dashfilter.core.model.ChartResult;
import io.github.cyfko.dashfilter.core.model.FilterValues;
import io.github.cyfko.dashfilter.core.model.OptionItem;
import io.github.cyfko.dashfilter.core.model.PreviewRequest;
import io.github.cyfko.dashfilter.core.model.RewriteResult;
import io.github.cyfko.dashfilter.core.render.DashboardRenderer;
import io.github.cyfko.dashfilter.core.spi.OptionSource;
import io.github.cyfko.dashfilter.spring.service.DashboardFilterService;

import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public class DashboardFilterServiceImpl implements DashboardFilterService {

    private final FilterComposer composer;
    private final DashboardRenderer renderer;
    private final OptionSource optionSource;

    public DashboardFilterServiceImpl(FilterComposer composer, DashboardRenderer renderer, OptionSource optionSource) {
        this.composer = Objects.requireNonNull(composer, "FilterComposer cannot be null");
        this.renderer = Objects.requireNonNull(renderer, "DashboardRenderer cannot be null");
        this.optionSource = Objects.requireNonNull(optionSource, "OptionSource cannot be null");
    }

    @Override
    public RewriteResult preview(PreviewRequest request) {
        return composer.preview(request);
    }

    @Override
    public Map<Long, RewriteResult> apply(long dashboardId, Map<String, ?> filterValues) {
        return composer.apply(dashboardId, toFilterValues(filterValues));
    }

    @Override
    public Map<Long, ChartResult> render(long dashboardId, Map<String, ?> filterValues) {
        return renderer.render(dashboardId, toFilterValues(filterValues));
    }

    @Override
    public List<OptionItem> options(long selectorId) {
        return optionSource.listOptions(selectorId);
    }

    @Override
    public Map<Long, List<OptionItem>> options(Collection<Long> selectorIds) {
        return optionSource.listOptionsBatch(selectorIds);
    }

    private static FilterValues toFilterValues(Map<String, ?> values) {
        return values == null ? FilterValues.empty() : FilterValues.of(values);
    }
}
