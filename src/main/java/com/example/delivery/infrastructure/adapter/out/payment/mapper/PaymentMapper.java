package com.example.delivery.infrastructure.adapter.out.payment.mapper;

import com.example.delivery.application.port.out.PaymentGatewayPort.CaptureResult;
import com.example.delivery.application.port.out.PaymentGatewayPort.RefundResult;
import com.example.delivery.domain.model.CardSummary;
import com.example.delivery.domain.model.ChargeCapture;
import com.example.delivery.infrastructure.adapter.out.payment.dto.ChargeResponse;
import com.example.delivery.infrastructure.adapter.out.payment.dto.GatewayErrorResponse;
import com.example.delivery.infrastructure.adapter.out.payment.dto.RefundResponse;
import com.example.delivery.infrastructure.exception.BusinessException;
import org.springframework.stereotype.Component;

import java.time.Instant;

/**
 * Mapper between gateway DTOs and payment port results.
 */
@Component
public class PaymentMapper {

    public CaptureResult toCaptureResult(ChargeResponse response) {
        ChargeResponse.CardSource source = response.source();
        CardSummary card = source == null ? null : new CardSummary(
                source.id(), source.brand(), source.expMonth(), source.expYear(), source.last4());

        return CaptureResult.success(new ChargeCapture(
                response.captured(),
                response.id(),
                response.customer(),
                response.balanceTransaction(),
                response.created() != null ? Instant.ofEpochSecond(response.created()) : null,
                card));
    }

    public RefundResult toRefundResult(RefundResponse response) {
        if ("failed".equalsIgnoreCase(response.status()) || "canceled".equalsIgnoreCase(response.status())) {
            return RefundResult.failure("refund_" + response.status().toLowerCase(),
                    "Refund " + response.id() + " ended as " + response.status());
        }
        return RefundResult.success(response.id());
    }

    /**
     * Turns a 4xx error envelope into a business exception carrying the gateway's code.
     */
    public BusinessException toRejection(GatewayErrorResponse response, int statusCode) {
        GatewayErrorResponse.ErrorBody error = response != null ? response.error() : null;
        String code = error != null && error.code() != null ? error.code() : "http_" + statusCode;
        String message = error != null && error.message() != null
                ? error.message()
                : "Payment gateway rejected the request with status " + statusCode;
        return new BusinessException(code, message);
    }
}
