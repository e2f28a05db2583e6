package com.example.delivery.infrastructure.persistence.repository;

import com.example.delivery.infrastructure.persistence.entity.OrderStatusEventEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface OrderStatusEventRepository extends JpaRepository<OrderStatusEventEntity, Long> {

    List<OrderStatusEventEntity> findByOrderIdOrderByIdAsc(String orderId);
}
