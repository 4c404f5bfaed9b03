package com.flaretrack.api.analytics;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;

/**
 * Analytics tuning knobs from {@code flaretrack.analytics.*}.
 */
@Configuration
public class AnalyticsConfig {

    @Bean
    public FlareAnalyticsEngine flareAnalyticsEngine(
            @Value("${flaretrack.analytics.problem-area-threshold:3}") int problemAreaThreshold,
            @Value("${flaretrack.analytics.recurrence-period-days:90}") int recurrencePeriodDays,
            @Value("${flaretrack.analytics.follow-up-hours:48}") long followUpHours,
            @Value("${flaretrack.analytics.follow-up-tolerance-hours:24}") long followUpToleranceHours,
            @Value("${flaretrack.analytics.sufficient-usage-count:5}") int sufficientUsageCount,
            @Value("${flaretrack.analytics.trend-slope-threshold:0.3}") double trendSlopeThreshold) {
        return new FlareAnalyticsEngine(
                problemAreaThreshold,
                recurrencePeriodDays,
                Duration.ofHours(followUpHours),
                Duration.ofHours(followUpToleranceHours),
                sufficientUsageCount,
                trendSlopeThreshold);
    }
}
