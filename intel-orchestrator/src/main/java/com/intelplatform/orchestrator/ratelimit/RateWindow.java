package com.intelplatform.orchestrator.ratelimit;

import com.intelplatform.common.model.RateLimitBudget;

import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Fixed calendar windows a provider budget is enforced over. Bucket keys are derived from
 * the local calendar fields, so a new minute, hour or day always starts a fresh bucket.
 */
public enum RateWindow {
    MINUTE {
        @Override
        String bucketKey(ZonedDateTime now) {
            return HOUR.bucketKey(now) + "-" + now.getMinute();
        }

        @Override
        ZonedDateTime windowEnd(ZonedDateTime now) {
            return now.truncatedTo(ChronoUnit.MINUTES).plusMinutes(1);
        }

        @Override
        int limit(RateLimitBudget budget) {
            return budget.requestsPerMinute();
        }
    },
    HOUR {
        @Override
        String bucketKey(ZonedDateTime now) {
            return DAY.bucketKey(now) + "-" + now.getHour();
        }

        @Override
        ZonedDateTime windowEnd(ZonedDateTime now) {
            return now.truncatedTo(ChronoUnit.HOURS).plusHours(1);
        }

        @Override
        int limit(RateLimitBudget budget) {
            return budget.requestsPerHour();
        }
    },
    DAY {
        @Override
        String bucketKey(ZonedDateTime now) {
            return now.getYear() + "-" + now.getMonthValue() + "-" + now.getDayOfMonth();
        }

        @Override
        ZonedDateTime windowEnd(ZonedDateTime now) {
            return now.truncatedTo(ChronoUnit.DAYS).plusDays(1);
        }

        @Override
        int limit(RateLimitBudget budget) {
            return budget.requestsPerDay();
        }
    };

    abstract String bucketKey(ZonedDateTime now);

    abstract ZonedDateTime windowEnd(ZonedDateTime now);

    abstract int limit(RateLimitBudget budget);
}
