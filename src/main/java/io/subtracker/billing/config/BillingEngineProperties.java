package io.subtracker.billing.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

import io.subtracker.billing.util.BillingCycle;

/**
 * Safety caps for the cycle-walking loops of the billing date engine.
 *
 * Daily cycles need far more steps to cross a month than yearly ones, so each
 * cycle family has its own cap. Non-positive values fall back to the defaults.
 */
@ConfigurationProperties(prefix = "subtracker.billing.engine")
public record BillingEngineProperties(

	Integer dailyIterationCap,

	Integer weeklyIterationCap,

	/**
	 * Shared by monthly, quarterly and yearly cycles.
	 */
	Integer periodicIterationCap

) {

	public static final int DEFAULT_DAILY_CAP = 1000;
	public static final int DEFAULT_WEEKLY_CAP = 100;
	public static final int DEFAULT_PERIODIC_CAP = 50;

	public BillingEngineProperties {
		dailyIterationCap = positiveOr(dailyIterationCap, DEFAULT_DAILY_CAP);
		weeklyIterationCap = positiveOr(weeklyIterationCap, DEFAULT_WEEKLY_CAP);
		periodicIterationCap = positiveOr(periodicIterationCap, DEFAULT_PERIODIC_CAP);
	}

	public static BillingEngineProperties defaults() {
		return new BillingEngineProperties(null, null, null);
	}

	public int capFor(BillingCycle cycle) {
		if (cycle == null) {
			return periodicIterationCap;
		}
		return switch (cycle) {
			case DAILY -> dailyIterationCap;
			case WEEKLY -> weeklyIterationCap;
			default -> periodicIterationCap;
		};
	}

	private static Integer positiveOr(Integer value, int fallback) {
		return value == null || value <= 0 ? fallback : value;
	}
}
