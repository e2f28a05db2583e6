package com.example.delivery.application.service;

import com.example.delivery.application.port.out.UserDirectoryPort.UserAccount;

/**
 * Texts pushed to customers and couriers.
 */
public final class NotificationMessages {

    public static final String COURIER_ASSIGNED = "You have been assigned a new order.";
    public static final String COURIER_ORDER_CANCELLED = "The current order has been cancelled.";
    public static final String CUSTOMER_COURIER_ENROUTE =
            "A courier is enroute to your location. Please ensure that your fueling door is open.";
    public static final String CUSTOMER_SERVICING = "We are currently servicing your vehicle.";

    // Private-use glyph the iOS client renders as a gift.
    private static final String GIFT_GLYPH = "\uE112";

    private NotificationMessages() {
    }

    public static String orderCancelled(String supportEmail) {
        return "Your order has been cancelled. If you have any questions, please email us at "
                + supportEmail + " or use the Feedback form on the left-hand menu.";
    }

    /**
     * Completion notice; self-serve customers also get their referral code.
     *
     * @param customer the customer, or null when the account could not be read
     */
    public static String orderCompleted(UserAccount customer) {
        StringBuilder message = new StringBuilder("Your delivery has been completed.");
        if (customer != null && !customer.managedAccount()) {
            message.append(" Share your code ")
                    .append(customer.referralCode())
                    .append(" to earn free gas");
            if (customer.supportsRichText()) {
                message.append(' ').append(GIFT_GLYPH);
            }
            message.append('.');
        }
        message.append(" Thank you!");
        return message.toString();
    }
}
