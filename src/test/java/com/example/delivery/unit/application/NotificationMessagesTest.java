package com.example.delivery.unit.application;

import com.example.delivery.application.port.out.UserDirectoryPort.UserAccount;
import com.example.delivery.application.service.NotificationMessages;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("NotificationMessages Tests")
class NotificationMessagesTest {

    private static UserAccount account(boolean managed, boolean richText) {
        return new UserAccount("u1", "Ann", "ann@example.com", "+1555", "ANN1", BigDecimal.ZERO, managed, richText);
    }

    @Test
    @DisplayName("should_include_referral_code_and_gift_glyph_for_rich_text_device")
    void should_include_referral_code_and_gift_glyph_for_rich_text_device() {
        assertThat(NotificationMessages.orderCompleted(account(false, true)))
                .isEqualTo("Your delivery has been completed. Share your code ANN1 to earn free gas \uE112. Thank you!");
    }

    @Test
    @DisplayName("should_omit_glyph_for_plain_text_device")
    void should_omit_glyph_for_plain_text_device() {
        assertThat(NotificationMessages.orderCompleted(account(false, false)))
                .isEqualTo("Your delivery has been completed. Share your code ANN1 to earn free gas. Thank you!");
    }

    @Test
    @DisplayName("should_omit_referral_pitch_for_managed_account")
    void should_omit_referral_pitch_for_managed_account() {
        assertThat(NotificationMessages.orderCompleted(account(true, true)))
                .isEqualTo("Your delivery has been completed. Thank you!");
    }

    @Test
    @DisplayName("should_name_support_address_in_cancellation_notice")
    void should_name_support_address_in_cancellation_notice() {
        assertThat(NotificationMessages.orderCancelled("help@example.com"))
                .isEqualTo("Your order has been cancelled. If you have any questions, please email us at "
                        + "help@example.com or use the Feedback form on the left-hand menu.");
    }
}
