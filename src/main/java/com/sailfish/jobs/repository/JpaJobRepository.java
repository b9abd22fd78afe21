package com.sailfish.jobs.repository;

import com.sailfish.jobs.model.JobRecord;
import jakarta.persistence.EntityManager;
import jakarta.persistence.TypedQuery;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * JPA implementation of the JobRepository.
 *
 * <p>A claim selects the due candidates and deletes them one by one by id inside a single
 * transaction. A job belongs to the caller only if its delete affected a row: a concurrent
 * claimer that already deleted it leaves a count of zero, so the same job is never handed
 * to two workers. When every candidate was taken by someone else the claim is repeated, so
 * an empty result always means no due job was seen.
 */
public class JpaJobRepository implements JobRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaJobRepository.class);

    private final JpaTransactions transactions;

    public JpaJobRepository(JpaTransactions transactions) {
        this.transactions = Objects.requireNonNull(transactions, "transactions cannot be null");
    }

    @Override
    public void insert(JobRecord record) {
        transactions.executeWithoutResult(entityManager -> entityManager.persist(record));
        log.debug("Inserted job {} '{}' due at {}", record.getId(), record.getName(), record.getRunAt());
    }

    @Override
    public List<JobRecord> claimDue(LocalDateTime now, int limit) {
        while (true) {
            List<JobRecord> claimed = transactions.execute(entityManager -> {
                List<JobRecord> candidates = findDue(entityManager, now, limit);
                List<JobRecord> won = deleteClaimed(entityManager, candidates);
                return candidates.isEmpty() || !won.isEmpty() ? won : null;
            });
            if (claimed != null) {
                return claimed;
            }
            // every candidate went to other workers; rows behind them may still be due
            log.debug("Lost all candidates due at {} to other workers, claiming again.", now);
        }
    }

    @Override
    public long count() {
        return transactions.execute(entityManager ->
                entityManager.createQuery("SELECT COUNT(j) FROM JobRecord j", Long.class).getSingleResult());
    }

    List<JobRecord> findDue(EntityManager entityManager, LocalDateTime now, int limit) {
        // Served by the (priority, run_at) index
        String jpql = "SELECT j FROM JobRecord j " +
                      "WHERE j.runAt <= :now " +
                      "ORDER BY j.priority ASC, j.runAt ASC, j.id ASC";

        TypedQuery<JobRecord> query = entityManager.createQuery(jpql, JobRecord.class);
        query.setParameter("now", now);
        query.setMaxResults(limit);
        return query.getResultList();
    }

    List<JobRecord> deleteClaimed(EntityManager entityManager, List<JobRecord> candidates) {
        List<JobRecord> claimed = new ArrayList<>(candidates.size());
        for (JobRecord candidate : candidates) {
            int deleted = entityManager.createQuery("DELETE FROM JobRecord j WHERE j.id = :id")
                    .setParameter("id", candidate.getId())
                    .executeUpdate();
            if (deleted > 0) {
                claimed.add(candidate);
            } else {
                log.debug("Job {} was claimed by another worker", candidate.getId());
            }
        }
        entityManager.clear(); // hand out detached copies
        return claimed;
    }
}
