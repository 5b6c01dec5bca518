package io.subtracker.billing.response;

import java.math.BigDecimal;
import java.time.LocalDate;

import io.subtracker.billing.util.SubscriptionStatus;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionBillingSummaryDTO {
	private Long subscriptionId;
	private String name;
	private BigDecimal price;
	private String currencyCode;
	private LocalDate nextBillingDate;
	private SubscriptionStatus computedStatus;
	private boolean overdue;
	// negative when overdue, null when there is no next billing date
	private Long daysUntilDue;
}
