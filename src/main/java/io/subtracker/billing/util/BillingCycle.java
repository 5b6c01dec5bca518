package io.subtracker.billing.util;

import org.apache.commons.lang3.StringUtils;

public enum BillingCycle {
	DAILY("daily"), WEEKLY("weekly"), MONTHLY("monthly"), QUARTERLY("quarterly"), YEARLY("yearly"),
	ONE_TIME("one-time");

	private final String dbValue;

	BillingCycle(String dbValue) {
		this.dbValue = dbValue;
	}

	public String toDb() {
		return dbValue;
	}

	/**
	 * Unknown or missing cycle names resolve to {@link #MONTHLY} so legacy rows keep a usable
	 * schedule instead of failing the read.
	 */
	public static BillingCycle fromDb(String cycleName) {
		if (StringUtils.isBlank(cycleName)) return MONTHLY;
		return switch (StringUtils.upperCase(cycleName.trim())) {
			case "DAY", "DAILY" -> DAILY;
			case "WEEK", "WEEKLY" -> WEEKLY;
			case "MONTH", "MONTHLY" -> MONTHLY;
			case "QUARTER", "QUARTERLY" -> QUARTERLY;
			case "YEAR", "YEARLY", "ANNUAL" -> YEARLY;
			case "ONE-TIME", "ONE_TIME", "ONETIME" -> ONE_TIME;
			default -> MONTHLY;
		};
	}

	/**
	 * Cycles that keep a preferred day of month.
	 */
	public boolean usesBillingCycleDay() {
		return this == MONTHLY || this == QUARTERLY;
	}
}
