package io.subtracker.billing.config;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

import io.subtracker.billing.util.BillingCycle;

class BillingEnginePropertiesTest {

    @Test
    void defaults_scaleWithCycleLength() {
        BillingEngineProperties properties = BillingEngineProperties.defaults();

        assertThat(properties.capFor(BillingCycle.DAILY)).isEqualTo(1000);
        assertThat(properties.capFor(BillingCycle.WEEKLY)).isEqualTo(100);
        assertThat(properties.capFor(BillingCycle.MONTHLY)).isEqualTo(50);
        assertThat(properties.capFor(BillingCycle.QUARTERLY)).isEqualTo(50);
        assertThat(properties.capFor(BillingCycle.YEARLY)).isEqualTo(50);
        assertThat(properties.capFor(null)).isEqualTo(50);
    }

    @Test
    void nonPositiveCaps_fallBackToDefaults() {
        BillingEngineProperties properties = new BillingEngineProperties(0, -5, 12);

        assertThat(properties.dailyIterationCap()).isEqualTo(BillingEngineProperties.DEFAULT_DAILY_CAP);
        assertThat(properties.weeklyIterationCap()).isEqualTo(BillingEngineProperties.DEFAULT_WEEKLY_CAP);
        assertThat(properties.periodicIterationCap()).isEqualTo(12);
    }
}
