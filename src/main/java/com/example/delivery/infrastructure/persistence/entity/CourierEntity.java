package com.example.delivery.infrastructure.persistence.entity;

import jakarta.persistence.*;

@Entity
@Table(name = "couriers")
public class CourierEntity {

    @Id
    @Column(name = "id", length = 64)
    private String id;

    @Column(name = "busy", nullable = false)
    private boolean busy;

    protected CourierEntity() {
    }

    public CourierEntity(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public boolean isBusy() {
        return busy;
    }

    public void setBusy(boolean busy) {
        this.busy = busy;
    }
}
