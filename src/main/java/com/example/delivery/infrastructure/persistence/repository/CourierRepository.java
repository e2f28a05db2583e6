package com.example.delivery.infrastructure.persistence.repository;

import com.example.delivery.infrastructure.persistence.entity.CourierEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface CourierRepository extends JpaRepository<CourierEntity, String> {
}
