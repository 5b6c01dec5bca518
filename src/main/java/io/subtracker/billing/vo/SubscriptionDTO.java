package io.subtracker.billing.vo;

import java.math.BigDecimal;
import java.time.LocalDate;

import io.subtracker.billing.util.BillingCycle;
import lombok.Data;

@Data
public class SubscriptionDTO {
    private Long id;
    private Long userId;
    private String name;
    private BigDecimal price;
    private Long currencyId;
    private String currencyCode;
    private String currencySymbol;
    private Long paymentMethodId;
    private BillingCycle billingCycle;
    private Integer billingInterval;
    private Integer billingCycleDay;
    private LocalDate startDate;
    private LocalDate firstBillingDate;
    private LocalDate endDate;
    private long paidPaymentCount;

    public BillingConfiguration toBillingConfiguration() {
        return BillingConfiguration.builder()
                .subscriptionId(id)
                .billingCycle(billingCycle)
                .billingInterval(billingInterval)
                .billingCycleDay(billingCycleDay)
                .firstBillingDate(firstBillingDate)
                .startDate(startDate)
                .endDate(endDate)
                .price(price)
                .build();
    }
}
