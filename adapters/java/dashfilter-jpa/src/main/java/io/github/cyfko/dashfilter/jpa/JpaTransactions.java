package io.github.cyfko.dashfilter.jpa;

import io.github.cyfko.dashfilter.core.exception.DuplicateDefinitionException;
import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.EntityTransaction;
import jakarta.persistence.PersistenceException;

import java.sql.SQLException;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs each store operation in its own resource-local transaction.
 * <p>
 * Integrity violations raised by the database (SQLSTATE class {@code 23}) are reported as
 * {@link DuplicateDefinitionException}; any other failure rolls back and propagates.
 * </p>
 */
final class JpaTransactions {

    private static final Logger logger = Logger.getLogger(JpaTransactions.class.getName());

    private static final String INTEGRITY_VIOLATION_CLASS = "23";

    private final EntityManagerFactory emf;

    JpaTransactions(EntityManagerFactory emf) {
        this.emf = Objects.requireNonNull(emf, "EntityManagerFactory cannot be null");
    }

    <T> T read(Function<EntityManager, T> work) {
        EntityManager em = emf.createEntityManager();
        try {
            return work.apply(em);
        } finally {
            em.close();
        }
    }

    <T> T write(Function<EntityManager, T> work, Supplier<String> duplicateMessage) {
        EntityManager em = emf.createEntityManager();
        EntityTransaction tx = em.getTransaction();
        try {
            tx.begin();
            T result = work.apply(em);
            em.flush();
            tx.commit();
            return result;
        } catch (PersistenceException e) {
            rollback(tx);
            if (isIntegrityViolation(e)) {
                logger.log(Level.FINE, "Integrity violation translated to duplicate definition", e);
                throw new DuplicateDefinitionException(duplicateMessage.get());
            }
            throw e;
        } catch (RuntimeException e) {
            rollback(tx);
            throw e;
        } finally {
            em.close();
        }
    }

    private static void rollback(EntityTransaction tx) {
        if (tx.isActive()) {
            tx.rollback();
        }
    }

    static boolean isIntegrityViolation(Throwable error) {
        for (Throwable t = error; t != null; t = t.getCause()) {
            if (t instanceof SQLException sql && sql.getSQLState() != null
                    && sql.getSQLState().startsWith(INTEGRITY_VIOLATION_CLASS)) {
                return true;
            }
            if (t.getCause() == t) {
                break;
            }
        }
        return false;
    }
}
