package com.example.delivery.domain.model;

import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Lifecycle states of a delivery order.
 * <p>
 * Orders progress forward along
 * {@code unassigned → assigned → accepted → enroute → servicing → complete}.
 * {@link #CANCELLED} is reachable from any state in the cancellable set.
 */
public enum OrderStatus {

    /**
     * Created, no courier bound yet.
     */
    UNASSIGNED("unassigned"),

    /**
     * A courier has been bound to the order.
     */
    ASSIGNED("assigned"),

    /**
     * The courier has accepted the order.
     */
    ACCEPTED("accepted"),

    /**
     * The courier is driving to the customer.
     */
    ENROUTE("enroute"),

    /**
     * The courier is servicing the vehicle.
     */
    SERVICING("servicing"),

    /**
     * Terminal: the delivery was completed.
     */
    COMPLETE("complete"),

    /**
     * Terminal: the order was cancelled.
     */
    CANCELLED("cancelled");

    private static final Set<OrderStatus> NON_TERMINAL =
            Collections.unmodifiableSet(EnumSet.of(UNASSIGNED, ASSIGNED, ACCEPTED, ENROUTE, SERVICING));

    private final String wireName;

    OrderStatus(String wireName) {
        this.wireName = wireName;
    }

    /**
     * Looks up the forward successor of this status.
     *
     * @return the next status, or empty for {@link #COMPLETE} and {@link #CANCELLED}
     */
    public Optional<OrderStatus> next() {
        return switch (this) {
            case UNASSIGNED -> Optional.of(ASSIGNED);
            case ASSIGNED -> Optional.of(ACCEPTED);
            case ACCEPTED -> Optional.of(ENROUTE);
            case ENROUTE -> Optional.of(SERVICING);
            case SERVICING -> Optional.of(COMPLETE);
            case COMPLETE, CANCELLED -> Optional.empty();
        };
    }

    public boolean isTerminal() {
        return !NON_TERMINAL.contains(this);
    }

    public String wireName() {
        return wireName;
    }

    /**
     * Statuses from which an order may be cancelled when no override is configured.
     */
    public static Set<OrderStatus> defaultCancellable() {
        return NON_TERMINAL;
    }

    /**
     * Parses a lowercase wire name such as {@code "enroute"}.
     *
     * @throws IllegalArgumentException if the name matches no status
     */
    public static OrderStatus fromWireName(String name) {
        if (name == null) {
            throw new IllegalArgumentException("Order status cannot be null");
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values())
                .filter(status -> status.wireName.equals(normalized))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown order status: " + name));
    }
}
