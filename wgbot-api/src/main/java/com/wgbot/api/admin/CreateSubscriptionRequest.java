package com.wgbot.api.admin;

import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;

public record CreateSubscriptionRequest(
    @NotNull @Positive Long userId,
    @NotNull @Positive Long planId
) {}
