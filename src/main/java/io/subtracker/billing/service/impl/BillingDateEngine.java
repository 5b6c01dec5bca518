package io.subtracker.billing.service.impl;

import java.math.BigDecimal;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.YearMonth;
import java.time.temporal.ChronoUnit;
import java.util.Optional;

import org.springframework.stereotype.Component;

import io.subtracker.billing.config.BillingEngineProperties;
import io.subtracker.billing.util.BillingCycle;
import io.subtracker.billing.util.SubscriptionStatus;
import io.subtracker.billing.vo.BillingConfiguration;
import lombok.extern.slf4j.Slf4j;

/**
 * Derives billing dates from a subscription's billing configuration and its paid payment count.
 * <p>
 * The next billing date is never stored: it is the date of cycle number {@code paidPaymentCount}
 * counted from {@code firstBillingDate}. Every method is a pure function of its arguments, "now"
 * and month boundaries included, so callers capture the clock once per request.
 */
@Component
@Slf4j
public class BillingDateEngine {

	private final BillingEngineProperties properties;

	public BillingDateEngine(BillingEngineProperties properties) {
		this.properties = properties;
	}

	/**
	 * @return the date the next unpaid cycle is due, or empty for ended and one-time subscriptions
	 */
	public Optional<LocalDate> nextBillingDate(BillingConfiguration config, long paidPaymentCount,
			LocalDateTime now) {
		if (isEnded(config, now)) {
			return Optional.empty();
		}
		if (config.resolvedCycle() == BillingCycle.ONE_TIME || config.getFirstBillingDate() == null) {
			return Optional.empty();
		}
		return Optional.of(billingDateForCycle(config, paidPaymentCount));
	}

	public boolean isOverdue(BillingConfiguration config, long paidPaymentCount, LocalDateTime now) {
		if (isEnded(config, now) || config.resolvedCycle() == BillingCycle.ONE_TIME) {
			return false;
		}
		return nextBillingDate(config, paidPaymentCount, now)
				.map(next -> next.atStartOfDay().isBefore(now))
				.orElse(false);
	}

	public boolean isEnded(BillingConfiguration config, LocalDateTime now) {
		return config.getEndDate() != null && config.getEndDate().atStartOfDay().isBefore(now);
	}

	public SubscriptionStatus computedStatus(BillingConfiguration config, LocalDateTime now) {
		return isEnded(config, now) ? SubscriptionStatus.ENDED : SubscriptionStatus.ACTIVE;
	}

	/**
	 * Raw cycle arithmetic: the due date of cycle {@code cycleIndex}, where cycle 0 is the first
	 * billing date. Ignores end dates.
	 */
	public LocalDate billingDateForCycle(BillingConfiguration config, long cycleIndex) {
		LocalDate first = config.getFirstBillingDate();
		long steps = (long) config.resolvedInterval() * cycleIndex;

		switch (config.resolvedCycle()) {
			case DAILY -> {
				return first.plusDays(steps);
			}
			case WEEKLY -> {
				return first.plusWeeks(steps);
			}
			case QUARTERLY -> {
				return monthlyBillingDate(first, steps * 3, config.getBillingCycleDay());
			}
			case YEARLY -> {
				// plusYears moves Feb 29 to Feb 28 when the target year is not a leap year
				return first.plusYears(steps);
			}
			case ONE_TIME -> {
				return first;
			}
			default -> {
				return monthlyBillingDate(first, steps, config.getBillingCycleDay());
			}
		}
	}

	/**
	 * Adds whole months and pins the day to the preferred billing day, falling back to the last
	 * day of shorter months. Jan 31 therefore runs Feb 28/29, Mar 31, Apr 30, May 31.
	 */
	LocalDate monthlyBillingDate(LocalDate first, long monthsToAdd, Integer billingCycleDay) {
		if (monthsToAdd == 0) {
			return first;
		}
		// 0 and below mean "no preferred day", as for a missing one
		if (billingCycleDay == null || billingCycleDay < 1) {
			return first.plusMonths(monthsToAdd);
		}
		YearMonth target = YearMonth.from(first).plusMonths(monthsToAdd);
		int day = Math.min(billingCycleDay, target.lengthOfMonth());
		return target.atDay(day);
	}

	public BigDecimal monthlyForecastAmount(BillingConfiguration config, YearMonth month) {
		return monthlyForecastAmount(config, month.atDay(1), month.atEndOfMonth());
	}

	/**
	 * Total of every cycle due within {@code [startOfMonth, endOfMonth]}, paid or not. A
	 * configuration whose walk cannot be resolved within the iteration cap contributes nothing.
	 */
	public BigDecimal monthlyForecastAmount(BillingConfiguration config, LocalDate startOfMonth,
			LocalDate endOfMonth) {
		if (config.getPrice() == null || config.getFirstBillingDate() == null
				|| !isActiveInMonth(config, startOfMonth, endOfMonth)) {
			return BigDecimal.ZERO;
		}

		LocalDate effectiveEnd = endOfMonth;
		if (config.getEndDate() != null && config.getEndDate().isBefore(endOfMonth)) {
			effectiveEnd = config.getEndDate();
		}

		if (config.resolvedCycle() == BillingCycle.ONE_TIME) {
			LocalDate charge = config.getFirstBillingDate();
			boolean inWindow = !charge.isBefore(startOfMonth) && !charge.isAfter(effectiveEnd);
			return inWindow ? config.getPrice() : BigDecimal.ZERO;
		}

		Optional<Long> firstIndex = findFirstCycleIndexInMonth(config, startOfMonth, endOfMonth);
		if (firstIndex.isEmpty()) {
			return BigDecimal.ZERO;
		}

		return countCyclesUntil(config, firstIndex.get(), effectiveEnd)
				.map(count -> config.getPrice().multiply(BigDecimal.valueOf(count)))
				.orElse(BigDecimal.ZERO);
	}

	/**
	 * @return the cycle index of the first billing date inside the window, empty when no cycle
	 *         lands in it or the iteration cap was hit
	 */
	Optional<Long> findFirstCycleIndexInMonth(BillingConfiguration config, LocalDate startOfMonth,
			LocalDate endOfMonth) {
		LocalDate first = config.getFirstBillingDate();
		if (!first.isBefore(startOfMonth) && !first.isAfter(endOfMonth)) {
			return Optional.of(0L);
		}
		if (first.isAfter(endOfMonth)) {
			return Optional.empty();
		}

		int cap = properties.capFor(config.resolvedCycle());
		long index = estimateCycleIndexBefore(config, startOfMonth);
		LocalDate current = billingDateForCycle(config, index);
		int iterations = 0;

		while (current.isBefore(startOfMonth)) {
			if (iterations >= cap) {
				log.warn("findFirstCycleIndexInMonth hit iteration limit {} for subscription {}", cap,
						config.getSubscriptionId());
				return Optional.empty();
			}
			index++;
			iterations++;
			current = billingDateForCycle(config, index);
		}

		return current.isAfter(endOfMonth) ? Optional.empty() : Optional.of(index);
	}

	private Optional<Long> countCyclesUntil(BillingConfiguration config, long firstIndex,
			LocalDate effectiveEnd) {
		int cap = properties.capFor(config.resolvedCycle());
		long count = 0;
		long index = firstIndex;
		LocalDate current = billingDateForCycle(config, index);

		while (!current.isAfter(effectiveEnd)) {
			if (count >= cap) {
				log.warn("countCyclesUntil hit iteration limit {} for subscription {}", cap,
						config.getSubscriptionId());
				return Optional.empty();
			}
			count++;
			index++;
			current = billingDateForCycle(config, index);
		}
		return Optional.of(count);
	}

	/**
	 * A cycle index whose date is on or before {@code target}, close enough that the forward
	 * walk needs only a few steps. Non-positive intervals start at 0 and are stopped by the cap.
	 */
	private long estimateCycleIndexBefore(BillingConfiguration config, LocalDate target) {
		LocalDate first = config.getFirstBillingDate();
		int interval = config.resolvedInterval();
		if (interval <= 0 || !first.isBefore(target)) {
			return 0;
		}

		long estimate = switch (config.resolvedCycle()) {
			case DAILY -> ChronoUnit.DAYS.between(first, target) / interval;
			case WEEKLY -> ChronoUnit.DAYS.between(first, target) / (7L * interval);
			case QUARTERLY -> monthsBetween(first, target) / (3L * interval) - 1;
			case YEARLY -> (target.getYear() - first.getYear()) / (long) interval - 1;
			case ONE_TIME -> 0;
			default -> monthsBetween(first, target) / interval - 1;
		};
		return Math.max(0, estimate);
	}

	private static long monthsBetween(LocalDate from, LocalDate to) {
		return ChronoUnit.MONTHS.between(YearMonth.from(from), YearMonth.from(to));
	}

	private boolean isActiveInMonth(BillingConfiguration config, LocalDate startOfMonth, LocalDate endOfMonth) {
		if (config.getStartDate() != null && config.getStartDate().isAfter(endOfMonth)) {
			return false;
		}
		return config.getEndDate() == null || !config.getEndDate().isBefore(startOfMonth);
	}

	/**
	 * Billing cycle day as set when a subscription is created: the start date's day of month for
	 * monthly and quarterly cycles, otherwise none.
	 */
	public BillingConfiguration assignBillingCycleDay(BillingConfiguration config) {
		return config.toBuilder().billingCycleDay(dayOfMonthFor(config, config.getStartDate())).build();
	}

	/**
	 * Billing cycle day after the first billing date was edited.
	 */
	public BillingConfiguration recalculateBillingCycleDay(BillingConfiguration config) {
		return config.toBuilder().billingCycleDay(dayOfMonthFor(config, config.getFirstBillingDate())).build();
	}

	private Integer dayOfMonthFor(BillingConfiguration config, LocalDate source) {
		if (!config.resolvedCycle().usesBillingCycleDay() || source == null) {
			return null;
		}
		return source.getDayOfMonth();
	}
}
