package com.lanparty.booking.integration;

import com.lanparty.booking.dto.request.CreateReservationRequest;
import com.lanparty.booking.dto.response.ErrorResponse;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.test.context.TestPropertySource;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

@TestPropertySource(properties = "booking.locking.station-lock-timeout=1s")
class StationLockTimeoutTest extends AbstractIntegrationTest {

    private static final String RESERVATIONS_URL = "/api/v1/reservations";
    private static final Instant T14 = Instant.parse("2025-12-05T14:00:00Z");
    private static final Instant T16 = Instant.parse("2025-12-05T16:00:00Z");

    @Autowired
    private PlatformTransactionManager transactionManager;

    @Test
    void create_whileStationRowIsLocked_givesUpAfterTimeoutWith409() throws Exception {
        Long stationId = createStation("Locked Station");
        Long userId = createUser("waiter");

        CountDownLatch locked = new CountDownLatch(1);
        CountDownLatch release = new CountDownLatch(1);
        ExecutorService executor = Executors.newSingleThreadExecutor();
        Future<?> holder = executor.submit(() -> new TransactionTemplate(transactionManager).executeWithoutResult(status -> {
            jdbcTemplate.queryForObject("SELECT id FROM stations WHERE id = ? FOR UPDATE", Long.class, stationId);
            locked.countDown();
            try {
                release.await(30, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }));

        try {
            assertThat(locked.await(10, TimeUnit.SECONDS)).isTrue();

            long startedAt = System.nanoTime();
            ResponseEntity<ErrorResponse> response = restTemplate.postForEntity(RESERVATIONS_URL,
                new CreateReservationRequest(stationId, userId, T14, T16, null), ErrorResponse.class);
            Duration waited = Duration.ofNanos(System.nanoTime() - startedAt);

            assertThat(response.getStatusCode()).isEqualTo(HttpStatus.CONFLICT);
            assertThat(response.getBody().message()).contains("busy");
            assertThat(waited).isBetween(Duration.ofMillis(900), Duration.ofSeconds(10));
        } finally {
            release.countDown();
            holder.get(10, TimeUnit.SECONDS);
            executor.shutdown();
        }

        assertThat(jdbcTemplate.queryForObject(
            "SELECT COUNT(*) FROM reservations WHERE station_id = ?", Long.class, stationId)).isZero();
    }
}
