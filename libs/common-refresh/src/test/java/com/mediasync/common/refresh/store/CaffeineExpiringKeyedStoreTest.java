package com.mediasync.common.refresh.store;

import com.github.benmanes.caffeine.cache.Caffeine;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CaffeineExpiringKeyedStoreTest {

    private static final Duration TTL = Duration.ofMinutes(10);

    private final AtomicLong nanos = new AtomicLong();
    private CaffeineExpiringKeyedStore<String, StringBuilder> store;

    @BeforeEach
    void setUp() {
        store = new CaffeineExpiringKeyedStore<>(Caffeine.newBuilder()
                .ticker(nanos::get)
                .executor(Runnable::run));
    }

    @Test
    void getOrCreateReturnsExistingValue() {
        StringBuilder first = store.getOrCreate("host-a", StringBuilder::new, TTL);
        StringBuilder second = store.getOrCreate("host-a", StringBuilder::new, TTL);

        assertThat(second).isSameAs(first);
        assertThat(store.size()).isEqualTo(1);
        assertThat(store.keys()).containsExactly("host-a");
    }

    @Test
    void findDoesNotCreate() {
        assertThat(store.find("missing")).isEmpty();
        assertThat(store.size()).isZero();
    }

    @Test
    void concurrentGetOrCreateCreatesOnce() throws Exception {
        AtomicInteger created = new AtomicInteger();
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<StringBuilder>> results = new ArrayList<>();
            for (int i = 0; i < 8; i++) {
                results.add(pool.submit(() -> {
                    start.await();
                    return store.getOrCreate("host-a", () -> {
                        created.incrementAndGet();
                        return new StringBuilder();
                    }, TTL);
                }));
            }
            start.countDown();

            StringBuilder expected = results.get(0).get(5, TimeUnit.SECONDS);
            for (Future<StringBuilder> result : results) {
                assertThat(result.get(5, TimeUnit.SECONDS)).isSameAs(expected);
            }
        } finally {
            pool.shutdownNow();
        }
        assertThat(created).hasValue(1);
    }

    @Test
    void entryExpiresAfterTtl() {
        store.getOrCreate("host-a", StringBuilder::new, TTL);

        advance(TTL.plusSeconds(1));

        assertThat(store.find("host-a")).isEmpty();
    }

    @Test
    void readsDoNotExtendLifetime() {
        store.put("host-a", new StringBuilder(), TTL);

        advance(Duration.ofMinutes(6));
        assertThat(store.find("host-a")).isPresent();
        advance(Duration.ofMinutes(6));

        assertThat(store.find("host-a")).isEmpty();
    }

    @Test
    void putRestartsTtl() {
        StringBuilder value = store.getOrCreate("host-a", StringBuilder::new, TTL);

        advance(Duration.ofMinutes(6));
        store.put("host-a", value, TTL);
        advance(Duration.ofMinutes(6));

        assertThat(store.find("host-a")).containsSame(value);
    }

    @Test
    void expiredEntryIsRecreated() {
        StringBuilder first = store.getOrCreate("host-a", StringBuilder::new, TTL);
        advance(TTL.plusSeconds(1));

        StringBuilder second = store.getOrCreate("host-a", StringBuilder::new, TTL);

        assertThat(second).isNotSameAs(first);
    }

    @Test
    void rejectsNonPositiveTtl() {
        assertThatThrownBy(() -> store.put("host-a", new StringBuilder(), Duration.ZERO))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> store.getOrCreate("host-a", StringBuilder::new, Duration.ofSeconds(-1)))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private void advance(Duration duration) {
        nanos.addAndGet(duration.toNanos());
        store.cleanUp();
    }
}
