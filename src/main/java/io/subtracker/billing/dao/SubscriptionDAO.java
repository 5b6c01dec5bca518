package io.subtracker.billing.dao;

import java.time.LocalDate;
import java.util.List;
import java.util.Optional;

import io.subtracker.billing.vo.PaymentHistoryDTO;
import io.subtracker.billing.vo.SubscriptionDTO;

public interface SubscriptionDAO {

	Optional<SubscriptionDTO> findById(Long subscriptionId);

	/**
	 * Subscriptions of the user with no end date or an end date after {@code today}.
	 */
	List<SubscriptionDTO> findActiveByUser(Long userId, LocalDate today);

	long countPaidPayments(Long subscriptionId);

	void insertPaymentHistory(PaymentHistoryDTO dto);

	void updateBillingCycleDay(Long subscriptionId, LocalDate firstBillingDate, Integer billingCycleDay);
}
