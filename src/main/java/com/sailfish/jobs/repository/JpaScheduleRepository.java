package com.sailfish.jobs.repository;

import com.sailfish.jobs.model.ScheduleRecord;
import jakarta.persistence.PersistenceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDateTime;
import java.util.List;
import java.util.Objects;

/**
 * JPA implementation of the ScheduleRepository.
 */
public class JpaScheduleRepository implements ScheduleRepository {

    private static final Logger log = LoggerFactory.getLogger(JpaScheduleRepository.class);

    private final JpaTransactions transactions;

    public JpaScheduleRepository(JpaTransactions transactions) {
        this.transactions = Objects.requireNonNull(transactions, "transactions cannot be null");
    }

    @Override
    public List<ScheduleRecord> findAll() {
        return transactions.execute(entityManager ->
                entityManager.createQuery("SELECT s FROM ScheduleRecord s ORDER BY s.id", ScheduleRecord.class)
                        .getResultList());
    }

    @Override
    public List<ScheduleRecord> findDue(LocalDateTime now) {
        return transactions.execute(entityManager ->
                entityManager.createQuery("SELECT s FROM ScheduleRecord s WHERE s.nextRun <= :now ORDER BY s.nextRun ASC", ScheduleRecord.class)
                        .setParameter("now", now)
                        .getResultList());
    }

    @Override
    public boolean insertIfAbsent(ScheduleRecord record) {
        try {
            return transactions.execute(entityManager -> {
                if (entityManager.find(ScheduleRecord.class, record.getId()) != null) {
                    return false;
                }
                entityManager.persist(record);
                entityManager.flush();
                log.debug("Created schedule {} with next run {}", record.getId(), record.getNextRun());
                return true;
            });
        } catch (PersistenceException e) {
            // Another instance inserted the same schedule between our find and commit.
            if (!exists(record.getId())) {
                throw e;
            }
            log.debug("Schedule {} was created concurrently by another instance", record.getId());
            return false;
        }
    }

    private boolean exists(String id) {
        return transactions.execute(entityManager -> entityManager.find(ScheduleRecord.class, id) != null);
    }

    @Override
    public boolean deleteById(String id) {
        int deleted = transactions.execute(entityManager ->
                entityManager.createQuery("DELETE FROM ScheduleRecord s WHERE s.id = :id")
                        .setParameter("id", id)
                        .executeUpdate());
        return deleted > 0;
    }

    @Override
    public boolean tryAdvance(String id, LocalDateTime now, LocalDateTime nextRun) {
        String jpql = "UPDATE ScheduleRecord s SET s.lastRan = :now, s.nextRun = :nextRun " +
                      "WHERE s.id = :id AND s.nextRun <= :now";

        int updatedCount = transactions.execute(entityManager ->
                entityManager.createQuery(jpql)
                        .setParameter("now", now)
                        .setParameter("nextRun", nextRun)
                        .setParameter("id", id)
                        .executeUpdate());

        if (updatedCount > 0) {
            log.debug("Advanced schedule {} to {}", id, nextRun);
            return true;
        }
        log.debug("Schedule {} was already advanced past {} by another instance", id, now);
        return false;
    }
}
