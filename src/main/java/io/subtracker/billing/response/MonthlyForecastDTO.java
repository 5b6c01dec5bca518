package io.subtracker.billing.response;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Forecast for one currency: the sum of every billing cycle that lands in the month, paid or not.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class MonthlyForecastDTO {
	private String currencyCode;
	private String currencySymbol;
	private BigDecimal total = BigDecimal.ZERO;
	private int count;
	private List<ForecastLine> subscriptions = new ArrayList<>();

	public MonthlyForecastDTO(String currencyCode, String currencySymbol) {
		this.currencyCode = currencyCode;
		this.currencySymbol = currencySymbol;
	}

	public void add(Long subscriptionId, String name, BigDecimal forecastAmount) {
		total = total.add(forecastAmount);
		count++;
		subscriptions.add(new ForecastLine(subscriptionId, name, forecastAmount));
	}

	@Data
	@NoArgsConstructor
	@AllArgsConstructor
	public static class ForecastLine {
		private Long subscriptionId;
		private String name;
		private BigDecimal forecastAmount;
	}
}
