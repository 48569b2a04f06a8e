package io.github.cyfko.dashfilter.core.option;

import io.github.cyfko.dashfilter.core.exception.UnknownSelectorException;
import io.github.cyfko.dashfilter.core.model.DatabaseValueSource;
import io.github.cyfko.dashfilter.core.model.OptionItem;
import io.github.cyfko.dashfilter.core.model.Selector;
import io.github.cyfko.dashfilter.core.model.StaticValueSource;
import io.github.cyfko.dashfilter.core.model.ValueSource;
import io.github.cyfko.dashfilter.core.spi.OptionLoader;
import io.github.cyfko.dashfilter.core.spi.OptionSource;
import io.github.cyfko.dashfilter.core.store.SelectorStore;

import java.util.Collection;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * {@link OptionSource} reading static options from the selector definition and database options
 * through an {@link OptionLoader}.
 * <p>
 * A loader failure (missing table, lost connection) is logged and yields no options, so a dashboard
 * still renders with an empty dropdown. The batch lookup runs each distinct database source once.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class DefaultOptionSource implements OptionSource {

    private static final Logger logger = Logger.getLogger(DefaultOptionSource.class.getName());

    private final SelectorStore selectorStore;
    private final OptionLoader loader;
    private final OptionQueryBuilder queryBuilder;

    public DefaultOptionSource(SelectorStore selectorStore, OptionLoader loader, OptionQueryBuilder queryBuilder) {
        this.selectorStore = Objects.requireNonNull(selectorStore, "selectorStore");
        this.loader = Objects.requireNonNull(loader, "loader");
        this.queryBuilder = Objects.requireNonNull(queryBuilder, "queryBuilder");
    }

    @Override
    public List<OptionItem> listOptions(long selectorId) {
        Selector selector = selectorStore.findById(selectorId)
                .orElseThrow(() -> new UnknownSelectorException(selectorId));
        return optionsOf(selector, new HashMap<>());
    }

    /**
     * Unknown selector ids are left out of the result.
     */
    @Override
    public Map<Long, List<OptionItem>> listOptionsBatch(Collection<Long> selectorIds) {
        Map<DatabaseValueSource, List<OptionItem>> loaded = new HashMap<>();
        Map<Long, List<OptionItem>> result = new LinkedHashMap<>();

        for (Long selectorId : selectorIds) {
            Optional<Selector> selector = selectorStore.findById(selectorId);
            if (selector.isEmpty()) {
                logger.fine(() -> "Skipping options of unknown selector " + selectorId);
                continue;
            }
            result.put(selectorId, optionsOf(selector.get(), loaded));
        }
        logger.fine(() -> "Loaded options of " + result.size() + " selector(s) with " + loaded.size() + " query(ies)");
        return result;
    }

    private List<OptionItem> optionsOf(Selector selector, Map<DatabaseValueSource, List<OptionItem>> loaded) {
        ValueSource source = selector.valueSource();
        if (source == null || !selector.type().isValueSourceAllowed()) {
            return List.of();
        }
        if (source instanceof StaticValueSource staticSource) {
            return staticSource.items();
        }
        DatabaseValueSource database = (DatabaseValueSource) source;
        return loaded.computeIfAbsent(database, this::load);
    }

    private List<OptionItem> load(DatabaseValueSource source) {
        String sql = queryBuilder.build(source);
        long start = System.nanoTime();
        try {
            List<OptionItem> options = loader.load(sql);
            long elapsedMs = (System.nanoTime() - start) / 1_000_000;
            logger.fine(() -> "Loaded " + options.size() + " option(s) from " + source.sourceTable() + "."
                    + source.sourceColumn() + " in " + elapsedMs + " ms");
            return List.copyOf(options);
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, e, () -> "Failed to load options from " + source.sourceTable() + "."
                    + source.sourceColumn());
            return List.of();
        }
    }
}
