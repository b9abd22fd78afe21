package com.sailfish.jobs.repository;

import jakarta.persistence.EntityManager;
import jakarta.persistence.EntityManagerFactory;
import jakarta.persistence.EntityTransaction;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Runs repository work in a resource-local transaction on a fresh {@link EntityManager}.
 * The transaction commits when the callback returns and rolls back when it throws; the
 * exception is rethrown unchanged.
 */
public class JpaTransactions {

    private static final Logger log = LoggerFactory.getLogger(JpaTransactions.class);

    private final EntityManagerFactory entityManagerFactory;

    public JpaTransactions(EntityManagerFactory entityManagerFactory) {
        this.entityManagerFactory = Objects.requireNonNull(entityManagerFactory, "entityManagerFactory cannot be null");
    }

    public <T> T execute(Function<EntityManager, T> work) {
        EntityManager entityManager = entityManagerFactory.createEntityManager();
        EntityTransaction transaction = entityManager.getTransaction();
        try {
            transaction.begin();
            T result = work.apply(entityManager);
            transaction.commit();
            return result;
        } catch (RuntimeException e) {
            rollbackQuietly(transaction, e);
            throw e;
        } finally {
            entityManager.close();
        }
    }

    public void executeWithoutResult(Consumer<EntityManager> work) {
        execute(entityManager -> {
            work.accept(entityManager);
            return null;
        });
    }

    private void rollbackQuietly(EntityTransaction transaction, RuntimeException cause) {
        if (!transaction.isActive()) {
            return;
        }
        try {
            transaction.rollback();
        } catch (RuntimeException rollbackFailure) {
            log.error("Rollback failed after: {}", cause.getMessage(), rollbackFailure);
            cause.addSuppressed(rollbackFailure);
        }
    }
}
