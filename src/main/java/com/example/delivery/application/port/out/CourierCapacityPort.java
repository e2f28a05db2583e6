package com.example.delivery.application.port.out;

/**
 * Outbound port for the courier busy flag.
 * Only {@link com.example.delivery.application.service.CourierCapacityService} writes through it.
 */
public interface CourierCapacityPort {

    void setBusy(String courierId, boolean busy);

    boolean isBusy(String courierId);
}
