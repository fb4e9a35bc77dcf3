package com.wgbot.application.lifecycle;

import com.wgbot.application.provisioning.ProvisioningError;
import com.wgbot.application.provisioning.ProvisioningException;
import com.wgbot.application.support.InMemoryStores;
import com.wgbot.application.support.RecordingEngine;
import com.wgbot.application.support.RecordingNotifier;
import com.wgbot.domain.model.Server;
import com.wgbot.domain.model.Subscription;
import com.wgbot.domain.model.SubscriptionPlan;
import com.wgbot.domain.model.SubscriptionStatus;
import com.wgbot.domain.model.User;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class SubscriptionReconcilerTest {

    private static final Instant NOW = Instant.parse("2024-05-10T12:00:00Z");
    private static final long USER_CHAT = 5001;
    private static final long ADMIN_CHAT = 9001;

    private InMemoryStores stores;
    private RecordingEngine engine;
    private RecordingNotifier notifier;
    private SubscriptionReconciler reconciler;

    @BeforeEach
    void setUp() {
        stores = new InMemoryStores()
                .add(new User(1, USER_CHAT, "alice", "Alice", null, false))
                .add(new User(2, ADMIN_CHAT, "root", null, null, true))
                .add(new SubscriptionPlan(3, "Monthly", "30 days", new BigDecimal("5.00"), 30, true))
                .add(new Server(4, "198.51.100.7", 22, "root", "pw", 10, 5, true));
        engine = new RecordingEngine();
        notifier = new RecordingNotifier();
        reconciler = new SubscriptionReconciler(stores, stores, engine, notifier,
                new SubscriptionMessages(ZoneOffset.UTC), SubscriptionReconciler.DEFAULT_WARNING_DAYS);
    }

    private static Subscription sub(long id, Instant end) {
        return new Subscription(id, 1, 4, 3, end.minus(Duration.ofDays(30)), end, SubscriptionStatus.ACTIVE,
                "vpn_configs/user_1.conf", 0, null);
    }

    @Test
    void expiredSubscriptionIsRevokedAndReported() {
        stores.add(sub(10, NOW.minus(Duration.ofHours(1))));

        SweepReport report = reconciler.sweep(NOW);

        assertThat(stores.subscriptions.get(10L).status()).isEqualTo(SubscriptionStatus.EXPIRED);
        assertThat(engine.calls()).containsExactly("revoke:4:vpn_configs/user_1.conf");
        assertThat(notifier.to(USER_CHAT)).hasSize(1);
        assertThat(notifier.to(USER_CHAT).get(0).text()).contains("has expired").contains("Subscription: #10");
        assertThat(notifier.to(ADMIN_CHAT)).hasSize(1);
        assertThat(notifier.to(ADMIN_CHAT).get(0).text())
                .contains("Expired subscriptions processed: 1")
                .contains("1. Subscription #10 - User: alice - Plan: Monthly - End date: 10.05.2024");
        assertThat(stores.servers.get(4L).currentClients()).isEqualTo(4);
        assertThat(report.expiredIds()).containsExactly(10L);
    }

    @Test
    void subscriptionEndingExactlyNowIsExpired() {
        stores.add(sub(10, NOW));
        reconciler.sweep(NOW);
        assertThat(stores.subscriptions.get(10L).status()).isEqualTo(SubscriptionStatus.EXPIRED);
    }

    @Test
    void nearExpiryWarnsOncePerSweepWithoutStateChange() {
        stores.add(sub(11, NOW.plus(Duration.ofHours(50))));

        SweepReport first = reconciler.sweep(NOW);
        reconciler.sweep(NOW.plus(Duration.ofHours(1)));

        assertThat(first.warned()).isEqualTo(1);
        assertThat(notifier.to(USER_CHAT)).hasSize(2);
        assertThat(notifier.to(USER_CHAT).get(0).text()).contains("Days left: 2");
        assertThat(stores.updates).isEmpty();
        assertThat(engine.calls()).isEmpty();
        assertThat(notifier.to(ADMIN_CHAT)).isEmpty();
    }

    @Test
    void farFromExpiryIsLeftAlone() {
        stores.add(sub(12, NOW.plus(Duration.ofDays(4))));
        reconciler.sweep(NOW);
        assertThat(notifier.sent).isEmpty();
    }

    @Test
    void failedStatusUpdateSkipsRevokeAndNotification() {
        stores.add(sub(10, NOW.minus(Duration.ofDays(1))));
        stores.failUpdatesFor.add(10L);

        SweepReport report = reconciler.sweep(NOW);

        assertThat(report.updateFailures()).isEqualTo(1);
        assertThat(stores.subscriptions.get(10L).status()).isEqualTo(SubscriptionStatus.ACTIVE);
        assertThat(engine.calls()).isEmpty();
        assertThat(notifier.sent).isEmpty();
    }

    @Test
    void revokeFailureKeepsExpiredStatusAndStillNotifies() {
        stores.add(sub(10, NOW.minus(Duration.ofDays(1))));
        engine.failure = new ProvisioningException(ProvisioningError.UNREACHABLE, "connection refused");

        SweepReport report = reconciler.sweep(NOW);

        assertThat(report.revokeFailures()).isEqualTo(1);
        assertThat(stores.subscriptions.get(10L).status()).isEqualTo(SubscriptionStatus.EXPIRED);
        assertThat(notifier.to(USER_CHAT)).hasSize(1);
        assertThat(notifier.to(ADMIN_CHAT)).hasSize(1);
        assertThat(stores.servers.get(4L).currentClients()).isEqualTo(5);
    }

    @Test
    void reportSkipsSubscriptionsWhoseUserCannotBeResolved() {
        stores.add(sub(10, NOW.minus(Duration.ofDays(1))));
        stores.add(new Subscription(20, 77, 4, 3, NOW.minus(Duration.ofDays(31)), NOW.minus(Duration.ofDays(1)),
                SubscriptionStatus.ACTIVE, "vpn_configs/user_77.conf", 0, null));

        reconciler.sweep(NOW);

        String report = notifier.to(ADMIN_CHAT).get(0).text();
        assertThat(report).contains("Expired subscriptions processed: 2").contains("Subscription #10").doesNotContain("#20");
        assertThat(stores.subscriptions.get(20L).status()).isEqualTo(SubscriptionStatus.EXPIRED);
    }

    @Test
    void unreachableAdminDoesNotStopOtherAdmins() {
        stores.add(new User(8, 9002, "", null, null, true));
        stores.add(sub(10, NOW.minus(Duration.ofDays(1))));
        notifier.unreachable.add(ADMIN_CHAT);

        SweepReport report = reconciler.sweep(NOW);

        assertThat(notifier.to(9002)).hasSize(1);
        assertThat(report.notificationFailures()).isEqualTo(1);
    }

    @Test
    void loadFailureEndsSweepQuietly() {
        stores.failLoad = true;

        SweepReport report = reconciler.sweep(NOW);

        assertThat(report.loadFailed()).isTrue();
        assertThat(notifier.sent).isEmpty();
    }

    @Test
    void nothingExpiredMeansNoAdminReport() {
        reconciler.sweep(NOW);
        assertThat(notifier.sent).isEmpty();
    }
}
