package io.subtracker.billing.util;

public enum SubscriptionStatus {
	ACTIVE("active"), ENDED("ended");

	private final String value;

	SubscriptionStatus(String value) {
		this.value = value;
	}

	public String getValue() {
		return value;
	}
}
