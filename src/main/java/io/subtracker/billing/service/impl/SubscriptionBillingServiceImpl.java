package io.subtracker.billing.service.impl;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import io.subtracker.billing.dao.SubscriptionDAO;
import io.subtracker.billing.exception.NotValidException;
import io.subtracker.billing.exception.ResourceNotFoundException;
import io.subtracker.billing.response.MonthlyForecastDTO;
import io.subtracker.billing.response.SubscriptionBillingSummaryDTO;
import io.subtracker.billing.service.SubscriptionBillingService;
import io.subtracker.billing.util.ConstantUtility;
import io.subtracker.billing.vo.BillingConfiguration;
import io.subtracker.billing.vo.PaymentHistoryDTO;
import io.subtracker.billing.vo.SubscriptionDTO;
import lombok.RequiredArgsConstructor;

@Service
@RequiredArgsConstructor
public class SubscriptionBillingServiceImpl implements SubscriptionBillingService {

	private static final Logger log = LoggerFactory.getLogger(SubscriptionBillingServiceImpl.class);

	private final SubscriptionDAO subscriptionDAO;

	private final BillingDateEngine billingDateEngine;

	private final Clock billingClock;

	@Override
	public SubscriptionBillingSummaryDTO getBillingSummary(Long subscriptionId, LocalDateTime now) {
		log.debug("Loading billing summary for subscription {}", subscriptionId);
		return toSummary(findSubscription(subscriptionId), now);
	}

	@Override
	public List<SubscriptionBillingSummaryDTO> getDueSoon(Long userId, int days, LocalDateTime now) {
		LocalDateTime cutoff = now.plusDays(requireNonNegative(days));
		return filterByNextBillingDate(userId, now, next -> !next.atStartOfDay().isAfter(cutoff));
	}

	@Override
	public List<SubscriptionBillingSummaryDTO> getUpcomingBills(Long userId, int days, LocalDateTime now) {
		LocalDateTime cutoff = now.plusDays(requireNonNegative(days));
		return filterByNextBillingDate(userId, now,
				next -> next.atStartOfDay().isAfter(now) && !next.atStartOfDay().isAfter(cutoff));
	}

	@Override
	public List<SubscriptionBillingSummaryDTO> getExpiredBills(Long userId, LocalDateTime now) {
		return filterByNextBillingDate(userId, now, next -> next.atStartOfDay().isBefore(now));
	}

	@Override
	public List<SubscriptionBillingSummaryDTO> getCurrentMonthBills(Long userId, LocalDateTime now) {
		YearMonth month = YearMonth.from(now);
		return filterByNextBillingDate(userId, now,
				next -> !next.isBefore(month.atDay(1)) && !next.isAfter(month.atEndOfMonth()));
	}

	@Override
	public List<MonthlyForecastDTO> getMonthlyForecast(Long userId, YearMonth month, LocalDateTime now) {
		Map<String, MonthlyForecastDTO> byCurrency = new LinkedHashMap<>();

		for (SubscriptionDTO subscription : subscriptionDAO.findActiveByUser(userId, now.toLocalDate())) {
			BigDecimal amount = billingDateEngine.monthlyForecastAmount(subscription.toBillingConfiguration(), month);
			if (amount.signum() <= 0) {
				continue;
			}
			byCurrency
					.computeIfAbsent(subscription.getCurrencyCode(),
							code -> new MonthlyForecastDTO(code, subscription.getCurrencySymbol()))
					.add(subscription.getId(), subscription.getName(), amount);
		}

		log.debug("Forecast for user {} in {} covers {} currencies", userId, month, byCurrency.size());
		return new ArrayList<>(byCurrency.values());
	}

	@Override
	public List<MonthlyForecastDTO> getMonthlyForecast(Long userId) {
		LocalDateTime now = LocalDateTime.now(billingClock);
		return getMonthlyForecast(userId, YearMonth.from(now), now);
	}

	@Override
	public SubscriptionDTO prepareForCreate(SubscriptionDTO subscription) {
		if (subscription.getFirstBillingDate() == null) {
			subscription.setFirstBillingDate(subscription.getStartDate());
		}
		BillingConfiguration assigned = billingDateEngine.assignBillingCycleDay(subscription.toBillingConfiguration());
		subscription.setBillingCycleDay(assigned.getBillingCycleDay());
		return subscription;
	}

	@Override
	@Transactional
	public SubscriptionDTO changeFirstBillingDate(Long subscriptionId, LocalDate firstBillingDate) {
		SubscriptionDTO subscription = findSubscription(subscriptionId);
		subscription.setFirstBillingDate(firstBillingDate);

		BillingConfiguration recalculated = billingDateEngine
				.recalculateBillingCycleDay(subscription.toBillingConfiguration());
		subscription.setBillingCycleDay(recalculated.getBillingCycleDay());

		subscriptionDAO.updateBillingCycleDay(subscriptionId, firstBillingDate, subscription.getBillingCycleDay());
		log.info("First billing date of subscription {} moved to {}, billing cycle day {}", subscriptionId,
				firstBillingDate, subscription.getBillingCycleDay());
		return subscription;
	}

	@Override
	@Transactional
	public SubscriptionBillingSummaryDTO markAsPaid(Long subscriptionId, BigDecimal amount, LocalDate paymentDate,
			Long paymentMethodId, Long currencyId, String notes) {
		SubscriptionDTO subscription = findSubscription(subscriptionId);
		BigDecimal paid = amount != null ? amount : subscription.getPrice();
		if (paid == null || paid.signum() <= 0) {
			throw new NotValidException(ConstantUtility.INVALID_PAYMENT_AMOUNT, paid);
		}

		LocalDateTime now = LocalDateTime.now(billingClock);

		PaymentHistoryDTO history = new PaymentHistoryDTO();
		history.setSubscriptionId(subscriptionId);
		history.setAmount(paid);
		history.setCurrencyId(currencyId != null ? currencyId : subscription.getCurrencyId());
		history.setPaymentMethodId(paymentMethodId != null ? paymentMethodId : subscription.getPaymentMethodId());
		history.setPaymentDate(paymentDate != null ? paymentDate : now.toLocalDate());
		history.setStatus(ConstantUtility.PAYMENT_STATUS_PAID);
		history.setNotes(StringUtils.trimToNull(notes));
		subscriptionDAO.insertPaymentHistory(history);

		subscription.setPaidPaymentCount(subscriptionDAO.countPaidPayments(subscriptionId));
		log.info("Recorded payment of {} for subscription {}, paid cycles now {}", paid, subscriptionId,
				subscription.getPaidPaymentCount());
		return toSummary(subscription, now);
	}

	private List<SubscriptionBillingSummaryDTO> filterByNextBillingDate(Long userId, LocalDateTime now,
			Predicate<LocalDate> condition) {
		List<SubscriptionBillingSummaryDTO> result = new ArrayList<>();
		for (SubscriptionDTO subscription : subscriptionDAO.findActiveByUser(userId, now.toLocalDate())) {
			SubscriptionBillingSummaryDTO summary = toSummary(subscription, now);
			if (summary.getNextBillingDate() != null && condition.test(summary.getNextBillingDate())) {
				result.add(summary);
			}
		}
		return result;
	}

	private SubscriptionBillingSummaryDTO toSummary(SubscriptionDTO subscription, LocalDateTime now) {
		BillingConfiguration config = subscription.toBillingConfiguration();
		long paidCount = subscription.getPaidPaymentCount();
		Optional<LocalDate> next = billingDateEngine.nextBillingDate(config, paidCount, now);

		return SubscriptionBillingSummaryDTO.builder()
				.subscriptionId(subscription.getId())
				.name(subscription.getName())
				.price(subscription.getPrice())
				.currencyCode(subscription.getCurrencyCode())
				.nextBillingDate(next.orElse(null))
				.computedStatus(billingDateEngine.computedStatus(config, now))
				.overdue(billingDateEngine.isOverdue(config, paidCount, now))
				.daysUntilDue(next.map(date -> ChronoUnit.DAYS.between(now.toLocalDate(), date)).orElse(null))
				.build();
	}

	private SubscriptionDTO findSubscription(Long subscriptionId) {
		return subscriptionDAO.findById(subscriptionId)
				.orElseThrow(() -> ResourceNotFoundException.subscription(subscriptionId));
	}

	private static int requireNonNegative(int days) {
		if (days < 0) {
			throw new NotValidException(ConstantUtility.INVALID_DAYS_WINDOW, days);
		}
		return days;
	}
}
