package com.example.delivery.infrastructure.persistence.repository;

import com.example.delivery.infrastructure.persistence.entity.OrderEntity;
import com.example.delivery.infrastructure.persistence.entity.OrderStatusEnum;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.Collection;

/**
 * JPA Repository for Order entities.
 */
@Repository
public interface OrderJpaRepository extends JpaRepository<OrderEntity, String> {

    @Query("SELECT COALESCE(SUM(o.totalPrice), 0L) FROM OrderEntity o " +
            "WHERE o.userId = :userId AND o.status = :status AND o.paid = false AND o.totalPrice > 0")
    long sumUnpaidTotal(@Param("userId") String userId, @Param("status") OrderStatusEnum status);

    boolean existsByCourierIdAndStatusInAndIdNot(String courierId, Collection<OrderStatusEnum> statuses, String id);
}
