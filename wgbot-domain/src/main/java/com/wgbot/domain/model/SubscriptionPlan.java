package com.wgbot.domain.model;

import java.math.BigDecimal;

public record SubscriptionPlan(
        long id,
        String name,
        String description,
        BigDecimal price,
        int durationDays,
        boolean active
) {
    public SubscriptionPlan {
        if (durationDays <= 0) {
            throw new IllegalArgumentException("durationDays must be > 0");
        }
    }
}
