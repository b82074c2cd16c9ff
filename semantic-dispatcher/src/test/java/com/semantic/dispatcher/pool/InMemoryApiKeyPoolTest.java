package com.semantic.dispatcher.pool;

import com.semantic.common.dto.ApiKeyInfo;
import com.semantic.common.exception.KeyPoolExhaustedException;
import com.semantic.dispatcher.support.MutableClock;
import com.semantic.dispatcher.support.RecordingWaiter;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemoryApiKeyPoolTest {

    private static final Duration SPACING = Duration.ofSeconds(60);

    private MutableClock clock;
    private RecordingWaiter waiter;

    @BeforeEach
    void setUp() {
        clock = new MutableClock(Instant.parse("2025-01-01T00:00:00Z"));
        waiter = new RecordingWaiter(clock);
    }

    private InMemoryApiKeyPool pool(boolean autoRotate, String... keys) {
        return new InMemoryApiKeyPool("test", List.of(keys), autoRotate, SPACING, clock, waiter);
    }

    @Test
    void forcedRotationAdvancesExactlyOnePosition() {
        InMemoryApiKeyPool pool = pool(false, "k0", "k1", "k2");

        assertThat(pool.currentKey()).isEqualTo("k0");
        assertThat(pool.rotate(true)).isEqualTo("k1");
        assertThat(pool.rotate(true)).isEqualTo("k2");
        assertThat(pool.rotate(true)).isEqualTo("k0");
        assertThat(waiter.getWaits()).isEmpty();
    }

    @Test
    void firstKeyIsStableAcrossRotations() {
        InMemoryApiKeyPool pool = pool(true, "k0", "k1", "k2");
        pool.rotate(true);
        pool.rotate(true);

        assertThat(pool.firstKey()).isEqualTo("k0");
        assertThat(pool.currentKey()).isEqualTo("k2");
        assertThat(pool.rotate(true)).isEqualTo("k0");
    }

    @Test
    void forcedRotationIgnoresCooldown() {
        InMemoryApiKeyPool pool = pool(true, "k0", "k1");
        pool.coolDown("k1", Duration.ofSeconds(300));

        assertThat(pool.rotate(true)).isEqualTo("k1");
        assertThat(waiter.getWaits()).isEmpty();
    }

    @Test
    void manualPolicyKeepsCurrentKeyWithoutForce() {
        InMemoryApiKeyPool pool = pool(false, "k0", "k1");

        assertThat(pool.rotate(false)).isEqualTo("k0");
        assertThat(pool.rotate(false)).isEqualTo("k0");
        assertThat(pool.isAutoRotate()).isFalse();
    }

    @Test
    void coolingKeyIsSkippedAndFreeKeyReturnedImmediately() {
        InMemoryApiKeyPool pool = pool(true, "A", "B");
        assertThat(pool.rotate(false)).isEqualTo("B");

        pool.coolDown("B", Duration.ofSeconds(60));
        clock.advance(Duration.ofSeconds(1));

        assertThat(pool.rotate(false)).isEqualTo("A");
        assertThat(waiter.getWaits()).isEmpty();
    }

    @Test
    void reusedKeyWaitsForRemainingSpacing() {
        InMemoryApiKeyPool pool = pool(true, "A", "B");
        assertThat(pool.rotate(false)).isEqualTo("B");
        clock.advance(Duration.ofSeconds(1));
        assertThat(pool.rotate(false)).isEqualTo("A");
        clock.advance(Duration.ofSeconds(1));

        assertThat(pool.rotate(false)).isEqualTo("B");

        assertThat(waiter.getWaits()).containsExactly(Duration.ofSeconds(58));
    }

    @Test
    void consecutiveUsesOfSameKeyNeverCloserThanSpacing() {
        InMemoryApiKeyPool pool = pool(true, "A", "B", "C");
        List<Instant> usesOfA = new ArrayList<>();

        for (int i = 0; i < 12; i++) {
            String key = pool.rotate(false);
            if (key.equals("A")) {
                usesOfA.add(clock.instant());
            }
            clock.advance(Duration.ofSeconds(7));
        }

        assertThat(usesOfA).hasSizeGreaterThan(1);
        for (int i = 1; i < usesOfA.size(); i++) {
            assertThat(Duration.between(usesOfA.get(i - 1), usesOfA.get(i))).isGreaterThanOrEqualTo(SPACING);
        }
    }

    @Test
    void singleKeyPoolDoesNotWaitForSpacing() {
        InMemoryApiKeyPool pool = pool(true, "only");

        assertThat(pool.rotate(false)).isEqualTo("only");
        assertThat(pool.rotate(false)).isEqualTo("only");
        assertThat(waiter.getWaits()).isEmpty();
    }

    @Test
    void allCoolingWaitsForShortestRemainingCooldown() {
        InMemoryApiKeyPool pool = pool(true, "k0", "k1", "k2");
        pool.coolDown("k0", Duration.ofSeconds(30));
        pool.coolDown("k1", Duration.ofSeconds(10));
        pool.coolDown("k2", Duration.ofSeconds(20));

        String key = pool.rotate(false);

        assertThat(waiter.getWaits()).containsExactly(Duration.ofSeconds(10));
        assertThat(key).isEqualTo("k1");
    }

    @Test
    void stillCoolingAfterWaitFallsBackToForcedRotation() {
        RecordingWaiter frozenWaiter = new RecordingWaiter();
        InMemoryApiKeyPool pool = new InMemoryApiKeyPool("test", List.of("k0", "k1"), true,
                SPACING, clock, frozenWaiter);
        pool.coolDown("k0", Duration.ofSeconds(40));
        pool.coolDown("k1", Duration.ofSeconds(15));

        String key = pool.rotate(false);

        assertThat(frozenWaiter.getWaits()).containsExactly(Duration.ofSeconds(15), Duration.ofSeconds(15));
        assertThat(key).isEqualTo("k1");
    }

    @Test
    void emptyPoolThrows() {
        InMemoryApiKeyPool pool = pool(true);

        assertThat(pool.isEmpty()).isTrue();
        assertThatThrownBy(() -> pool.rotate(false)).isInstanceOf(KeyPoolExhaustedException.class);
        assertThatThrownBy(pool::currentKey).isInstanceOf(KeyPoolExhaustedException.class);
    }

    @Test
    void snapshotReportsCooldownAndMasksKeys() {
        InMemoryApiKeyPool pool = pool(false, "sk-abcdefghijkl", "sk-mnopqrstuvwx");
        pool.coolDown("sk-mnopqrstuvwx", Duration.ofSeconds(30));

        List<ApiKeyInfo> snapshot = pool.snapshot();

        assertThat(snapshot).hasSize(2);
        assertThat(snapshot.get(0).getStatus()).isEqualTo(ApiKeyInfo.Status.ACTIVE);
        assertThat(snapshot.get(0).isCurrent()).isTrue();
        assertThat(snapshot.get(1).getStatus()).isEqualTo(ApiKeyInfo.Status.COOLDOWN);
        assertThat(snapshot.get(1).getCooldownRemainingSeconds()).isEqualTo(30);
        assertThat(snapshot.get(1).getMaskedKey()).isEqualTo("sk-mnopq***");
    }

    @Test
    void concurrentForcedRotationsAreNotLost() throws Exception {
        InMemoryApiKeyPool pool = pool(false, "k0", "k1", "k2");
        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<?>> futures = new ArrayList<>();
            for (int t = 0; t < 4; t++) {
                futures.add(executor.submit(() -> {
                    for (int i = 0; i < 100; i++) {
                        pool.rotate(true);
                    }
                }));
            }
            for (Future<?> future : futures) {
                future.get();
            }
        } finally {
            executor.shutdownNow();
        }

        // 400 次前进，400 % 3 = 1
        assertThat(pool.currentKey()).isEqualTo("k1");
    }
}
