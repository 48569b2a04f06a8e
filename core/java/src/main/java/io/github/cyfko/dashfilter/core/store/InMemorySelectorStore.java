package io.github.cyfko.dashfilter.core.store;

import io.github.cyfko.dashfilter.core.exception.DuplicateDefinitionException;
import io.github.cyfko.dashfilter.core.exception.UnknownSelectorException;
import io.github.cyfko.dashfilter.core.model.Selector;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;

/**
 * Thread-safe in-memory {@link SelectorStore}.
 * <p>
 * Reads share a {@link ReadWriteLock}; writes are exclusive, so the name uniqueness check and the
 * insert happen atomically. Suitable for tests and single-node deployments without a database.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class InMemorySelectorStore implements SelectorStore {

    static final Comparator<Selector> DISPLAY_ORDER =
            Comparator.comparingInt(Selector::sortOrder).thenComparing(Selector::id);

    private final Map<Long, Selector> selectors = new LinkedHashMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public Selector save(Selector selector) {
        lock.writeLock().lock();
        try {
            if (selector.id() != null && !selectors.containsKey(selector.id())) {
                throw new UnknownSelectorException(selector.id());
            }
            for (Selector existing : selectors.values()) {
                if (existing.dashboardId() == selector.dashboardId()
                        && existing.name().equals(selector.name())
                        && !existing.id().equals(selector.id())) {
                    throw new DuplicateDefinitionException("Selector '" + selector.name()
                            + "' already exists on dashboard " + selector.dashboardId());
                }
            }
            Selector saved = selector.id() != null ? selector : selector.withId(sequence.incrementAndGet());
            selectors.put(saved.id(), saved);
            return saved;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<Selector> findById(long id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(selectors.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public Optional<Selector> findByName(long dashboardId, String name) {
        lock.readLock().lock();
        try {
            return selectors.values().stream()
                    .filter(s -> s.dashboardId() == dashboardId && s.name().equals(name))
                    .findFirst();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<Selector> findByDashboard(long dashboardId) {
        lock.readLock().lock();
        try {
            return selectors.values().stream()
                    .filter(s -> s.dashboardId() == dashboardId)
                    .sorted(DISPLAY_ORDER)
                    .toList();
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public boolean deleteById(long id) {
        lock.writeLock().lock();
        try {
            return selectors.remove(id) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }
}
