package io.subtracker.billing.util;

public class ConstantUtility {

	public static final String PAYMENT_STATUS_PAID = "paid";

	public static final String SUBSCRIPTION = "Subscription";

	public static final String RESOURCE_NOT_FOUND = "%s not found with id:%s";

	public static final String INVALID_PAYMENT_AMOUNT = "Payment amount must be greater than zero";

	public static final String SUBTRACKER_POOL = "subtracker-billing-pool";

	public static final String INVALID_DAYS_WINDOW = "Number of days must not be negative";

	private ConstantUtility() {
	}
}
