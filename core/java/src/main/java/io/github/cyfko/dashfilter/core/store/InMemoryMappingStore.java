package io.github.cyfko.dashfilter.core.store;

import io.github.cyfko.dashfilter.core.exception.DuplicateDefinitionException;
import io.github.cyfko.dashfilter.core.exception.UnknownMappingException;
import io.github.cyfko.dashfilter.core.model.SelectorMapping;

import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReadWriteLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;

/**
 * Thread-safe in-memory {@link MappingStore}, ordered by id.
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class InMemoryMappingStore implements MappingStore {

    private final Map<Long, SelectorMapping> mappings = new TreeMap<>();
    private final AtomicLong sequence = new AtomicLong();
    private final ReadWriteLock lock = new ReentrantReadWriteLock();

    @Override
    public SelectorMapping save(SelectorMapping mapping) {
        lock.writeLock().lock();
        try {
            if (mapping.id() != null && !mappings.containsKey(mapping.id())) {
                throw new UnknownMappingException(mapping.id());
            }
            for (SelectorMapping existing : mappings.values()) {
                if (existing.duplicates(mapping) && !existing.id().equals(mapping.id())) {
                    throw new DuplicateDefinitionException("Selector " + mapping.selectorId()
                            + " is already mapped to " + mapping.qualifiedColumn() + " on chart " + mapping.chartId());
                }
            }
            SelectorMapping saved = mapping.id() != null ? mapping : mapping.withId(sequence.incrementAndGet());
            mappings.put(saved.id(), saved);
            return saved;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public Optional<SelectorMapping> findById(long id) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(mappings.get(id));
        } finally {
            lock.readLock().unlock();
        }
    }

    @Override
    public List<SelectorMapping> findBySelector(long selectorId) {
        return select(m -> m.selectorId() == selectorId);
    }

    @Override
    public List<SelectorMapping> findByChart(long chartId) {
        return select(m -> m.chartId() == chartId);
    }

    @Override
    public boolean deleteById(long id) {
        lock.writeLock().lock();
        try {
            return mappings.remove(id) != null;
        } finally {
            lock.writeLock().unlock();
        }
    }

    @Override
    public int deleteBySelector(long selectorId) {
        lock.writeLock().lock();
        try {
            int before = mappings.size();
            mappings.values().removeIf(m -> m.selectorId() == selectorId);
            return before - mappings.size();
        } finally {
            lock.writeLock().unlock();
        }
    }

    private List<SelectorMapping> select(Predicate<SelectorMapping> filter) {
        lock.readLock().lock();
        try {
            return mappings.values().stream().filter(filter).toList();
        } finally {
            lock.readLock().unlock();
        }
    }
}
