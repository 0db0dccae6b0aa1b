package com.payment.plan.api;

import com.payment.plan.domain.PaymentRecord;
import com.payment.plan.domain.PaymentRecordStatus;
import lombok.Builder;
import lombok.Value;

import java.math.BigDecimal;
import java.time.Instant;

@Value
@Builder
public class PaymentRecordDto {

    int paymentNumber;
    int totalPayments;
    BigDecimal amount;
    PaymentRecordStatus status;
    String transactionId;
    Instant paidAt;
    Instant failedAt;

    public static PaymentRecordDto from(PaymentRecord record) {
        return PaymentRecordDto.builder()
                .paymentNumber(record.getPaymentNumber())
                .totalPayments(record.getTotalPayments())
                .amount(record.getAmount())
                .status(record.getStatus())
                .transactionId(record.getTransactionId())
                .paidAt(record.getPaidAt())
                .failedAt(record.getFailedAt())
                .build();
    }
}
