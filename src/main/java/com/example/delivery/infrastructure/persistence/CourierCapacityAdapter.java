package com.example.delivery.infrastructure.persistence;

import com.example.delivery.application.port.out.CourierCapacityPort;
import com.example.delivery.infrastructure.persistence.entity.CourierEntity;
import com.example.delivery.infrastructure.persistence.repository.CourierRepository;
import org.springframework.stereotype.Component;
import org.springframework.transaction.annotation.Transactional;

@Component
public class CourierCapacityAdapter implements CourierCapacityPort {

    private final CourierRepository courierRepository;

    public CourierCapacityAdapter(CourierRepository courierRepository) {
        this.courierRepository = courierRepository;
    }

    @Override
    @Transactional
    public void setBusy(String courierId, boolean busy) {
        CourierEntity courier = courierRepository.findById(courierId)
                .orElseGet(() -> new CourierEntity(courierId));
        courier.setBusy(busy);
        courierRepository.save(courier);
    }

    @Override
    @Transactional(readOnly = true)
    public boolean isBusy(String courierId) {
        return courierRepository.findById(courierId).map(CourierEntity::isBusy).orElse(false);
    }
}
