package io.subtracker.billing.vo;

import java.math.BigDecimal;
import java.time.LocalDate;

import io.subtracker.billing.util.BillingCycle;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Billing-relevant subset of a subscription. Treated as immutable; changes go through
 * {@code toBuilder()}.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class BillingConfiguration {
	private Long subscriptionId; // log context only
	private BillingCycle billingCycle;
	private Integer billingInterval;
	private Integer billingCycleDay;
	private LocalDate firstBillingDate;
	private LocalDate startDate;
	private LocalDate endDate;
	private BigDecimal price;

	public BillingCycle resolvedCycle() {
		return billingCycle == null ? BillingCycle.MONTHLY : billingCycle;
	}

	public int resolvedInterval() {
		return billingInterval == null ? 1 : billingInterval;
	}
}
