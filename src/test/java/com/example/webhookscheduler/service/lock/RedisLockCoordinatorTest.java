package com.example.webhookscheduler.service.lock;

import com.example.webhookscheduler.config.MetricsConfig;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.data.redis.RedisConnectionFailureException;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.core.ValueOperations;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.Callable;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("RedisLockCoordinator Tests")
class RedisLockCoordinatorTest {

    private static final String PREFIX = "webhook-scheduler:lock:";

    @Mock
    private StringRedisTemplate redisTemplate;

    @Mock
    private ValueOperations<String, String> valueOperations;

    @Mock
    private MetricsConfig metricsConfig;

    private final Map<String, String> store = new ConcurrentHashMap<>();

    private final UUID scheduleId = UUID.randomUUID();

    @BeforeEach
    void setUp() {
        lenient().when(redisTemplate.opsForValue()).thenReturn(valueOperations);
        lenient().when(valueOperations.setIfAbsent(anyString(), anyString(), any(Duration.class)))
                .thenAnswer(invocation -> store.putIfAbsent(invocation.getArgument(0), invocation.getArgument(1)) == null);
    }

    private RedisLockCoordinator coordinator(String instanceId) {
        var identity = mock(InstanceIdentity.class);
        when(identity.getInstanceId()).thenReturn(instanceId);
        return new RedisLockCoordinator(redisTemplate, PREFIX, identity, metricsConfig);
    }

    @Nested
    @DisplayName("tryAcquire Tests")
    class TryAcquireTests {

        @Test
        @DisplayName("Should store the owner under the prefixed key")
        void shouldStoreOwner() {
            // Given
            var coordinator = coordinator("node-a");

            // When
            var acquired = coordinator.tryAcquire(scheduleId, Duration.ofSeconds(30));

            // Then
            assertThat(acquired).isTrue();
            assertThat(store).containsEntry(PREFIX + scheduleId, "node-a");
            verify(valueOperations).setIfAbsent(PREFIX + scheduleId, "node-a", Duration.ofSeconds(30));
        }

        @Test
        @DisplayName("Should let exactly one of many concurrent instances win")
        void shouldGrantLockToOneInstance() throws Exception {
            // Given
            var instances = 10;
            var coordinators = new ArrayList<RedisLockCoordinator>();
            for (var i = 0; i < instances; i++) {
                coordinators.add(coordinator("node-" + i));
            }
            var start = new CountDownLatch(1);
            var executor = Executors.newFixedThreadPool(instances);
            var attempts = new ArrayList<Callable<Boolean>>();
            for (var coordinator : coordinators) {
                attempts.add(() -> {
                    start.await();
                    return coordinator.tryAcquire(scheduleId, Duration.ofSeconds(30));
                });
            }

            // When
            var futures = attempts.stream().map(executor::submit).toList();
            start.countDown();
            var winners = 0;
            for (var future : futures) {
                if (future.get()) {
                    winners++;
                }
            }
            executor.shutdown();

            // Then
            assertThat(winners).isEqualTo(1);
            verify(metricsConfig, times(instances - 1)).recordLockContention("redis");
        }

        @Test
        @DisplayName("Should report not acquired when Redis is unavailable")
        void shouldTreatRedisErrorAsNotAcquired() {
            // Given
            var coordinator = coordinator("node-a");
            doThrow(new RedisConnectionFailureException("connection refused"))
                    .when(valueOperations).setIfAbsent(anyString(), anyString(), any(Duration.class));

            // When
            var acquired = coordinator.tryAcquire(scheduleId, Duration.ofSeconds(30));

            // Then
            assertThat(acquired).isFalse();
            verify(metricsConfig).recordLockError("redis");
        }
    }

    @Nested
    @DisplayName("release Tests")
    class ReleaseTests {

        @Test
        @DisplayName("Should delete the key through the owner-checking script")
        void shouldReleaseOwnLock() {
            // Given
            var coordinator = coordinator("node-a");
            when(redisTemplate.execute(eq(RedisLockCoordinator.RELEASE_SCRIPT), eq(List.of(PREFIX + scheduleId)), eq("node-a")))
                    .thenReturn(1L);

            // When
            coordinator.release(scheduleId);

            // Then
            verify(redisTemplate).execute(eq(RedisLockCoordinator.RELEASE_SCRIPT), eq(List.of(PREFIX + scheduleId)), eq("node-a"));
            verify(metricsConfig, never()).recordLockError(anyString());
        }

        @Test
        @DisplayName("Should swallow Redis errors on release since the key expires by TTL")
        void shouldTolerateReleaseFailure() {
            // Given
            var coordinator = coordinator("node-a");
            when(redisTemplate.execute(eq(RedisLockCoordinator.RELEASE_SCRIPT), eq(List.of(PREFIX + scheduleId)), eq("node-a")))
                    .thenThrow(new RedisConnectionFailureException("connection reset"));

            // When
            coordinator.release(scheduleId);

            // Then
            verify(metricsConfig).recordLockError("redis");
        }
    }
}
