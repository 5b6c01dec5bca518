package io.subtracker.billing.service;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.util.List;

import io.subtracker.billing.response.MonthlyForecastDTO;
import io.subtracker.billing.response.SubscriptionBillingSummaryDTO;
import io.subtracker.billing.vo.SubscriptionDTO;

public interface SubscriptionBillingService {

	SubscriptionBillingSummaryDTO getBillingSummary(Long subscriptionId, LocalDateTime now);

	List<SubscriptionBillingSummaryDTO> getDueSoon(Long userId, int days, LocalDateTime now);

	List<SubscriptionBillingSummaryDTO> getUpcomingBills(Long userId, int days, LocalDateTime now);

	List<SubscriptionBillingSummaryDTO> getExpiredBills(Long userId, LocalDateTime now);

	List<SubscriptionBillingSummaryDTO> getCurrentMonthBills(Long userId, LocalDateTime now);

	List<MonthlyForecastDTO> getMonthlyForecast(Long userId, YearMonth month, LocalDateTime now);

	List<MonthlyForecastDTO> getMonthlyForecast(Long userId);

	SubscriptionDTO prepareForCreate(SubscriptionDTO subscription);

	SubscriptionDTO changeFirstBillingDate(Long subscriptionId, LocalDate firstBillingDate);

	/**
	 * Records a paid cycle. Every argument after the id is optional and falls back to the
	 * subscription's price, today's date, its payment method and its currency.
	 */
	SubscriptionBillingSummaryDTO markAsPaid(Long subscriptionId, BigDecimal amount, LocalDate paymentDate,
			Long paymentMethodId, Long currencyId, String notes);
}
