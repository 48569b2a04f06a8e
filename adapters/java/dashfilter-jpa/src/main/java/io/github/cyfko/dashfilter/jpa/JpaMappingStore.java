package io.github.cyfko.dashfilter.jpa;

import io.github.cyfko.dashfilter.core.exception.DuplicateDefinitionException;
import io.github.cyfko.dashfilter.core.exception.UnknownMappingException;
import io.github.cyfko.dashfilter.core.model.SelectorMapping;
import io.github.cyfko.dashfilter.core.store.MappingStore;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

/**
 * {@link MappingStore} backed by the {@code selector_chart_mappings} table.
 * <p>
 * Duplicates are detected with {@link SelectorMapping#duplicates(SelectorMapping)} inside the write
 * transaction, which also catches the case-insensitive and table-less collisions the unique
 * constraint cannot see.
 * </p>
 *
 * @author Frank KOSSI
 * @since 1.0.0
 */
public class JpaMappingStore implements MappingStore {

    private final JpaTransactions transactions;

    public JpaMappingStore(EntityManagerFactory emf) {
        this.transactions = new JpaTransactions(emf);
    }

    @Override
    public SelectorMapping save(SelectorMapping mapping) {
        return transactions.write(em -> {
            if (isDuplicate(em, mapping)) {
                throw new DuplicateDefinitionException(duplicateMessage(mapping));
            }
            if (mapping.id() == null) {
                MappingEntity entity = MappingEntity.from(mapping);
                em.persist(entity);
                em.flush();
                return entity.toMapping();
            }
            MappingEntity entity = em.find(MappingEntity.class, mapping.id());
            if (entity == null) {
                throw new UnknownMappingException(mapping.id());
            }
            entity.copy(mapping);
            return entity.toMapping();
        }, () -> duplicateMessage(mapping));
    }

    @Override
    public Optional<SelectorMapping> findById(long id) {
        return transactions.read(em -> Optional.ofNullable(em.find(MappingEntity.class, id))
                .map(MappingEntity::toMapping));
    }

    @Override
    public List<SelectorMapping> findBySelector(long selectorId) {
        return transactions.read(em -> em.createQuery(
                        "SELECT m FROM MappingEntity m WHERE m.selectorId = :selectorId ORDER BY m.id",
                        MappingEntity.class)
                .setParameter("selectorId", selectorId)
                .getResultList()
                .stream()
                .map(MappingEntity::toMapping)
                .toList());
    }

    @Override
    public List<SelectorMapping> findByChart(long chartId) {
        return transactions.read(em -> em.createQuery(
                        "SELECT m FROM MappingEntity m WHERE m.chartId = :chartId ORDER BY m.id",
                        MappingEntity.class)
                .setParameter("chartId", chartId)
                .getResultList()
                .stream()
                .map(MappingEntity::toMapping)
                .toList());
    }

    /**
     * Single query for all selectors instead of one per selector.
     */
    @Override
    public List<SelectorMapping> findBySelectors(Collection<Long> selectorIds) {
        if (selectorIds.isEmpty()) {
            return List.of();
        }
        return transactions.read(em -> em.createQuery(
                        "SELECT m FROM MappingEntity m WHERE m.selectorId IN :selectorIds ORDER BY m.id",
                        MappingEntity.class)
                .setParameter("selectorIds", selectorIds)
                .getResultList()
                .stream()
                .map(MappingEntity::toMapping)
                .toList());
    }

    @Override
    public boolean deleteById(long id) {
        return transactions.write(em -> em.createQuery("DELETE FROM MappingEntity m WHERE m.id = :id")
                .setParameter("id", id)
                .executeUpdate() > 0, () -> "Mapping " + id + " is still referenced");
    }

    @Override
    public int deleteBySelector(long selectorId) {
        return transactions.write(em -> em.createQuery("DELETE FROM MappingEntity m WHERE m.selectorId = :selectorId")
                .setParameter("selectorId", selectorId)
                .executeUpdate(), () -> "Mappings of selector " + selectorId + " are still referenced");
    }

    private static boolean isDuplicate(EntityManager em, SelectorMapping mapping) {
        return em.createQuery("SELECT m FROM MappingEntity m WHERE m.selectorId = :selectorId AND m.chartId = :chartId",
                        MappingEntity.class)
                .setParameter("selectorId", mapping.selectorId())
                .setParameter("chartId", mapping.chartId())
                .getResultStream()
                .map(MappingEntity::toMapping)
                .anyMatch(existing -> existing.duplicates(mapping) && !existing.id().equals(mapping.id()));
    }

    private static String duplicateMessage(SelectorMapping mapping) {
        return "Selector " + mapping.selectorId() + " is already mapped to " + mapping.qualifiedColumn()
                + " on chart " + mapping.chartId();
    }
}
