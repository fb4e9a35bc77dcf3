package com.wgbot.application.lifecycle;

import com.wgbot.domain.model.Subscription;
import com.wgbot.domain.model.User;

import java.time.Instant;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.List;

/**
 * Plain-text bodies of user and admin notifications. Dates render as dd.MM.yyyy in the configured zone.
 */
public final class SubscriptionMessages {

    private final DateTimeFormatter dateFormat;

    public SubscriptionMessages(ZoneId zone) {
        this.dateFormat = DateTimeFormatter.ofPattern("dd.MM.yyyy").withZone(zone);
    }

    public String date(Instant instant) {
        return dateFormat.format(instant);
    }

    public String expired(Subscription s, String planName) {
        return "Your subscription has expired\n\n"
                + "Subscription: #" + s.id() + "\n"
                + "Plan: " + planName + "\n"
                + "Start date: " + date(s.startDate()) + "\n"
                + "End date: " + date(s.endDate()) + "\n\n"
                + "Your VPN connection has been disabled. Use /buy to get a new subscription.";
    }

    public String expiringSoon(Subscription s, String planName, long daysLeft) {
        return "Your subscription expires soon\n\n"
                + "Subscription: #" + s.id() + "\n"
                + "Plan: " + planName + "\n"
                + "End date: " + date(s.endDate()) + "\n\n"
                + "Days left: " + daysLeft + "\n\n"
                + "Use /buy to renew. Without renewal the VPN connection is disabled when the subscription ends.";
    }

    public String reportLine(int position, Subscription s, User user, String planName) {
        return position + ". Subscription #" + s.id()
                + " - User: " + user.displayName()
                + " - Plan: " + planName
                + " - End date: " + date(s.endDate());
    }

    public String expiredReport(int processed, List<String> lines) {
        StringBuilder sb = new StringBuilder()
                .append("Expired subscriptions report\n\n")
                .append("Expired subscriptions processed: ").append(processed).append("\n\n");
        for (String line : lines) {
            sb.append(line).append('\n');
        }
        sb.append("\nThese subscriptions were marked expired and their VPN configs were revoked.");
        return sb.toString();
    }

    public String blockedByAdmin(Subscription s, String planName) {
        return "Your subscription #" + s.id() + " (" + planName + ") was blocked by an administrator";
    }

    public String unblockedByAdmin(Subscription s, String planName) {
        return "Your subscription #" + s.id() + " (" + planName + ") was unblocked by an administrator";
    }

    public String revokedByAdmin(Subscription s, String planName) {
        return "Your subscription #" + s.id() + " (" + planName + ") was revoked by an administrator";
    }

    public String provisioned(Subscription s, String planName) {
        return "Your subscription #" + s.id() + " (" + planName + ") is active until " + date(s.endDate())
                + ". Your WireGuard config is ready.";
    }
}
