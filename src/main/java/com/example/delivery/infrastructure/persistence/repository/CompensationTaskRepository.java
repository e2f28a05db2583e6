package com.example.delivery.infrastructure.persistence.repository;

import com.example.delivery.infrastructure.persistence.entity.CompensationTaskEntity;
import com.example.delivery.infrastructure.persistence.entity.CompensationTaskStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.time.Instant;
import java.util.Collection;
import java.util.List;

/**
 * JPA Repository for compensation tasks.
 */
@Repository
public interface CompensationTaskRepository extends JpaRepository<CompensationTaskEntity, String> {

    @Query("SELECT t FROM CompensationTaskEntity t WHERE t.orderId = :orderId AND t.status = :status " +
            "ORDER BY t.createdAt ASC, t.sequence ASC")
    List<CompensationTaskEntity> findByOrderIdAndStatus(@Param("orderId") String orderId,
                                                        @Param("status") CompensationTaskStatus status);

    @Query("SELECT t FROM CompensationTaskEntity t WHERE t.status = :status " +
            "ORDER BY t.createdAt ASC, t.sequence ASC LIMIT :limit")
    List<CompensationTaskEntity> findByStatus(@Param("status") CompensationTaskStatus status, @Param("limit") int limit);

    @Query("SELECT t FROM CompensationTaskEntity t WHERE t.status = :status AND t.retryCount < :maxRetries " +
            "ORDER BY t.createdAt ASC, t.sequence ASC LIMIT :limit")
    List<CompensationTaskEntity> findRetryable(@Param("status") CompensationTaskStatus status,
                                               @Param("maxRetries") int maxRetries,
                                               @Param("limit") int limit);

    List<CompensationTaskEntity> findByOrderIdOrderBySequenceAsc(String orderId);

    /**
     * Moves a task from {@code expected} to PROCESSING. Returns 0 when another worker got there
     * first or when an earlier step of the same order is still pending or running.
     */
    @Transactional
    @Modifying
    @Query("UPDATE CompensationTaskEntity t SET t.status = :processing, t.claimedAt = :claimedAt " +
            "WHERE t.id = :id AND t.status = :expected AND NOT EXISTS (" +
            "SELECT p.id FROM CompensationTaskEntity p WHERE p.orderId = t.orderId " +
            "AND p.sequence < t.sequence AND p.status IN :unsettled)")
    int claim(@Param("id") String id,
              @Param("expected") CompensationTaskStatus expected,
              @Param("processing") CompensationTaskStatus processing,
              @Param("unsettled") Collection<CompensationTaskStatus> unsettled,
              @Param("claimedAt") Instant claimedAt);

    /**
     * Fails tasks whose claim is older than {@code before}; their worker is presumed dead.
     */
    @Transactional
    @Modifying
    @Query("UPDATE CompensationTaskEntity t SET t.status = :failed, t.retryCount = t.retryCount + 1, " +
            "t.lastError = :error WHERE t.status = :processing AND t.claimedAt < :before")
    int failExpiredClaims(@Param("processing") CompensationTaskStatus processing,
                          @Param("failed") CompensationTaskStatus failed,
                          @Param("error") String error,
                          @Param("before") Instant before);

    @Modifying
    @Query("DELETE FROM CompensationTaskEntity t WHERE t.status = :status AND t.processedAt < :before")
    int deleteByStatusAndProcessedAtBefore(@Param("status") CompensationTaskStatus status,
                                           @Param("before") Instant before);
}
