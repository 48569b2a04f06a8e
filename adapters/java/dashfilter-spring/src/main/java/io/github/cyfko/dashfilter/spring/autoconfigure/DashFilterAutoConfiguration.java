package io.github.cyfko.dashfilter.spring.autoconfigure;

import io.github.cyfko.dashfilter.core.compose.FilterComposer;
import io.github.cyfko.dashfilter.core.config.ExecutionPolicy;
import io.github.cyfko.dashfilter.core.config.OptionPolicy;
import io.github.cyfko.dashfilter.core.option.DefaultOptionSource;
import io.github.cyfko.dashfilter.core.option.OptionQueryBuilder;
import io.github.cyfko.dashfilter.core.render.DashboardRenderer;
import io.github.cyfko.dashfilter.core.sql.PredicateBuilder;
import io.github.cyfko.dashfilter.core.sql.QueryRewriter;
import io.github.cyfko.dashfilter.core.spi.ChartQueryExecutor;
import io.github.cyfko.dashfilter.core.spi.ChartRegistry;
import io.github.cyfko.dashfilter.core.spi.OptionLoader;
import io.github.cyfko.dashfilter.core.spi.OptionSource;
import io.github.cyfko.dashfilter.core.store.InMemoryMappingStore;
import io.github.cyfko.dashfilter.core.store.InMemorySelectorStore;
import io.github.cyfko.dashfilter.core.store.MappingStore;
import io.github.cyfko.dashfilter.core.store.SelectorManager;
import io.github.cyfko.dashfilter.core.store.SelectorStore;
import io.github.cyfko.dashfilter.spring.jdbc.JdbcChartQueryExecutor;
import io.github.cyfko.dashfilter.spring.jdbc.JdbcChartRegistry;
import io.github.cyfko.dashfilter.spring.jdbc.JdbcOptionLoader;
import io.github.cyfko.dashfilter.spring.service.DashboardFilterService;
import io.github.cyfko.dashfilter.spring.service.impl.DashboardFilterServiceImpl;
import org.springframework.boot.autoconfigure.AutoConfiguration;
import org.springframework.boot.autoconfigure.condition.ConditionalOnBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnClass;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.jdbc.core.JdbcTemplate;

import java.util.logging.Logger;

/**
 * Wires the filter engine on top of the application's {@link JdbcTemplate}.
 * <p>
 * Every bean backs off when the application declares its own. Selectors and mappings are kept in
 * memory unless the application provides {@link SelectorStore} and {@link MappingStore} beans
 * (for instance the JPA stores of {@code dashfilter-jpa}). Chart queries are read with
 * {@link JdbcChartRegistry} unless {@code dashfilter.charts.enabled=false}, in which case a
 * {@link ChartRegistry} bean is required.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
@AutoConfiguration(afterName = "org.springframework.boot.autoconfigure.jdbc.JdbcTemplateAutoConfiguration")
@ConditionalOnClass(JdbcTemplate.class)
@ConditionalOnBean(JdbcTemplate.class)
@EnableConfigurationProperties(DashFilterProperties.class)
public class DashFilterAutoConfiguration {

    private static final Logger logger = Logger.getLogger(DashFilterAutoConfiguration.class.getName());

    @Bean
    @ConditionalOnMissingBean
    public ExecutionPolicy dashFilterExecutionPolicy(DashFilterProperties properties) {
        return properties.getExecution().toPolicy();
    }

    @Bean
    @ConditionalOnMissingBean
    public OptionPolicy dashFilterOptionPolicy(DashFilterProperties properties) {
        return properties.getOptions().toPolicy();
    }

    @Bean
    @ConditionalOnMissingBean
    public SelectorStore selectorStore() {
        logger.info("No SelectorStore bean found, selectors are kept in memory");
        return new InMemorySelectorStore();
    }

    @Bean
    @ConditionalOnMissingBean
    public MappingStore mappingStore() {
        logger.info("No MappingStore bean found, mappings are kept in memory");
        return new InMemoryMappingStore();
    }

    @Bean
    @ConditionalOnMissingBean
    @ConditionalOnProperty(prefix = "dashfilter.charts", name = "enabled", matchIfMissing = true)
    public ChartRegistry chartRegistry(JdbcTemplate jdbcTemplate, DashFilterProperties properties) {
        return new JdbcChartRegistry(jdbcTemplate, properties.getCharts());
    }

    @Bean
    @ConditionalOnMissingBean
    public SelectorManager selectorManager(SelectorStore selectorStore, MappingStore mappingStore,
                                           ChartRegistry chartRegistry) {
        return new SelectorManager(selectorStore, mappingStore, chartRegistry);
    }

    @Bean
    @ConditionalOnMissingBean
    public PredicateBuilder predicateBuilder(DashFilterProperties properties) {
        return new PredicateBuilder(properties.getSql().getStringEscape());
    }

    @Bean
    @ConditionalOnMissingBean
    public FilterComposer filterComposer(SelectorStore selectorStore, MappingStore mappingStore,
                                         ChartRegistry chartRegistry, PredicateBuilder predicateBuilder) {
        return new FilterComposer(selectorStore, mappingStore, chartRegistry, predicateBuilder, new QueryRewriter());
    }

    @Bean
    @ConditionalOnMissingBean
    public ChartQueryExecutor chartQueryExecutor(JdbcTemplate jdbcTemplate, ExecutionPolicy policy) {
        return new JdbcChartQueryExecutor(jdbcTemplate, policy);
    }

    @Bean
    @ConditionalOnMissingBean
    public OptionLoader optionLoader(JdbcTemplate jdbcTemplate) {
        return new JdbcOptionLoader(jdbcTemplate);
    }

    @Bean
    @ConditionalOnMissingBean
    public OptionSource optionSource(SelectorStore selectorStore, OptionLoader optionLoader, OptionPolicy policy) {
        return new DefaultOptionSource(selectorStore, optionLoader, new OptionQueryBuilder(policy));
    }

    @Bean
    @ConditionalOnMissingBean
    public DashboardRenderer dashboardRenderer(FilterComposer composer, ChartQueryExecutor executor,
                                               ExecutionPolicy policy) {
        return new DashboardRenderer(composer, executor, policy);
    }

    @Bean
    @ConditionalOnMissingBean
    public DashboardFilterService dashboardFilterService(FilterComposer composer, DashboardRenderer renderer,
                                                         OptionSource optionSource) {
        return new DashboardFilterServiceImpl(composer, renderer, optionSource);
    }
}
