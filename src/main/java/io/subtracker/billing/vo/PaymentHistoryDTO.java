package io.subtracker.billing.vo;

import java.math.BigDecimal;
import java.time.LocalDate;

import lombok.Data;

@Data
public class PaymentHistoryDTO {
    private Long subscriptionId;
    private BigDecimal amount;
    private Long currencyId;
    private Long paymentMethodId;
    private LocalDate paymentDate;
    private String status; // paid, pending, failed, refunded
    private String notes;
}
