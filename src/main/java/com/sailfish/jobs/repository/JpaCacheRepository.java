package com.sailfish.jobs.repository;

import com.sailfish.jobs.model.CacheEntry;
import jakarta.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * JPA implementation of the CacheRepository.
 */
public class JpaCacheRepository implements CacheRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaCacheRepository.class);

    private final JpaTransactions transactions;

    public JpaCacheRepository(JpaTransactions transactions) {
        this.transactions = Objects.requireNonNull(transactions, "transactions cannot be null");
    }

    @Override
    public Optional<CacheEntry> findLive(String id, LocalDateTime now) {
        List<CacheEntry> entries = transactions.execute(entityManager ->
                entityManager.createQuery("SELECT c FROM CacheEntry c WHERE c.id = :id AND c.expires > :now", CacheEntry.class)
                        .setParameter("id", id)
                        .setParameter("now", now)
                        .getResultList());
        return entries.stream().findFirst();
    }

    @Override
    public void upsert(CacheEntry entry) {
        if (update(entry) > 0) {
            return;
        }
        try {
            transactions.executeWithoutResult(entityManager -> entityManager.persist(entry));
        } catch (PersistenceException e) {
            // Lost an insert race on the same key: the row exists now, overwrite it.
            if (update(entry) == 0) {
                throw e;
            }
            log.debug("Concurrent insert of cache key '{}', overwrote it", entry.getId());
        }
    }

    private int update(CacheEntry entry) {
        return transactions.execute(entityManager ->
                entityManager.createQuery("UPDATE CacheEntry c SET c.payload = :payload, c.expires = :expires WHERE c.id = :id")
                        .setParameter("payload", entry.getPayload())
                        .setParameter("expires", entry.getExpires())
                        .setParameter("id", entry.getId())
                        .executeUpdate());
    }

    @Override
    public boolean deleteById(String id) {
        int deleted = transactions.execute(entityManager ->
                entityManager.createQuery("DELETE FROM CacheEntry c WHERE c.id = :id")
                        .setParameter("id", id)
                        .executeUpdate());
        return deleted > 0;
    }

    @Override
    public int deleteExpired(LocalDateTime now) {
        return transactions.execute(entityManager ->
                entityManager.createQuery("DELETE FROM CacheEntry c WHERE c.expires < :now")
                        .setParameter("now", now)
                        .executeUpdate());
    }

    @Override
    public int deleteAll() {
        return transactions.execute(entityManager ->
                entityManager.createQuery("DELETE FROM CacheEntry c").executeUpdate());
    }
}
