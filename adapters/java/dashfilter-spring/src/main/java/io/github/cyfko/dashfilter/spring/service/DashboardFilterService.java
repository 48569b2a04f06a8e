package io.github.cyfko.dashfilter.spring.service;

import io.github.cyfko.dashfilter.core.model.ChartResult;
import io.github.cyfko.dashfilter.core.model.OptionItem;
import io.github.cyfko.dashfilter.core.model.PreviewRequest;
import io.github.cyfko.dashfilter.core.model.RewriteResult;

import java.util.Collection;
import java.util.List;
import java.util.Map;

/**
 * Entry point for applications serving filtered dashboards.
 * <p>
 * Filter values arrive as the raw map the viewer sends, keyed by selector name. Transport (REST,
 * messaging) is left to the application; this service only composes, executes and lists options.
 * </p>
 *
 * <h2>Usage Context</h2>
 * <ul>
 *   <li>{@link #preview(PreviewRequest)} backs the mapping editor: one predicate on one chart</li>
 *   <li>{@link #apply(long, Map)} returns the rewritten queries without running them</li>
 *   <li>{@link #render(long, Map)} composes and executes every chart of the dashboard</li>
 * </ul>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public interface DashboardFilterService {

    RewriteResult preview(PreviewRequest request);

    /**
     * @throws io.github.cyfko.dashfilter.core.exception.MissingRequiredFilterException if a required selector has no value
     * @throws RuntimeException the first chart composition error
     */
    Map<Long, RewriteResult> apply(long dashboardId, Map<String, ?> filterValues);

    /**
     * @return one result per chart; failed charts carry an error instead of rows
     * @throws io.github.cyfko.dashfilter.core.exception.MissingRequiredFilterException if a required selector has no value
     */
    Map<Long, ChartResult> render(long dashboardId, Map<String, ?> filterValues);

    List<OptionItem> options(long selectorId);

    Map<Long, List<OptionItem>> options(Collection<Long> selectorIds);
}
