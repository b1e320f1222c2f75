import com.skylarkarms.cell.Locks;
import org.junit.jupiter.api.Test;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class LocksTest {

    @Test
    void predefinedConfigs() {
        assertThat(Locks.Config.DEFAULT_CONFIG.isBounded()).isFalse();
        assertThat(Locks.Config.DEFAULT_CONFIG.isUnbridled()).isFalse();
        assertThat(Locks.Config.DEFAULT_CONFIG.getMaxWaitNanos()).isEqualTo(1_000_000);
        assertThat(Locks.Config.UNBRIDLED.isUnbridled()).isTrue();
        assertThat(Locks.Config.UNBRIDLED.toString()).contains("UNBRIDLED");
    }

    @Test
    void builderValidatesItsParameters() {
        assertThatThrownBy(() -> Locks.Config.of(b -> b.setBackOffFactor(1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Locks.Config.of(b -> b.setSpins(-1)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Locks.Config.of(b -> b.setMaxWait(10, TimeUnit.NANOSECONDS)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("initialWaitNanos");
        assertThatThrownBy(() -> Locks.ExceptionConfig.custom(IllegalStateException::new, b -> b.setSpins(2)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("deadline");
    }

    @Test
    void builderDerivesFromItsBase() {
        Locks.Config config = Locks.Config.of(b -> b
                .setInitialWait(5, TimeUnit.MICROSECONDS)
                .setMaxWait(2, TimeUnit.MILLISECONDS)
                .setTotal(1, TimeUnit.SECONDS)
        );

        assertThat(config.getSpins()).isEqualTo(Locks.Config.DEFAULT_CONFIG.getSpins());
        assertThat(config.getInitialWaitNanos()).isEqualTo(5_000);
        assertThat(config.getMaxWaitNanos()).isEqualTo(2_000_000);
        assertThat(config.getTotalNanos()).isEqualTo(1_000_000_000);
        assertThat(config.isBounded()).isTrue();

        Locks.Config parking = Locks.Config.of(Locks.Config.UNBRIDLED, b -> b.setInitialWait(1, TimeUnit.MICROSECONDS));
        assertThat(parking.isUnbridled()).isFalse();
        assertThat(parking.getBackOffFactor()).isEqualTo(Locks.Config.DEFAULT_CONFIG.getBackOffFactor());
    }

    @Test
    void getUnlessReturnsOnceTheConditionClears() {
        AtomicInteger polls = new AtomicInteger();

        int res = Locks.getUnless(Locks.Config.DEFAULT_CONFIG, polls::incrementAndGet, v -> v < 200);

        assertThat(res).isEqualTo(200);
    }

    @Test
    void getUnlessThrowsTheConfiguredExceptionOnExpiry() {
        long start = System.nanoTime();

        assertThatThrownBy(() -> Locks.getUnless(
                Locks.ExceptionConfig.timeout(30),
                () -> "pending", "pending"::equals,
                () -> "still pending"
        ))
                .isInstanceOf(TimeoutException.class)
                .cause()
                .hasMessageContaining("Expired")
                .hasMessageContaining("still pending");

        assertThat(System.nanoTime() - start).isGreaterThanOrEqualTo(TimeUnit.MILLISECONDS.toNanos(30));
    }

    @Test
    void interruptedWaitsKeepParkingAndKeepTheirInterruptStatus() {
        AtomicInteger polls = new AtomicInteger();
        Thread.currentThread().interrupt();
        try {
            assertThatThrownBy(() -> Locks.getUnless(
                    Locks.ExceptionConfig.timeout(50),
                    polls::incrementAndGet, v -> true,
                    null
            ))
                    .isInstanceOf(TimeoutException.class);
            assertThat(Thread.currentThread().isInterrupted()).isTrue();
        } finally {
            Thread.interrupted();
        }
        assertThat(polls.get()).isLessThan(5_000);
    }

    @Test
    void unbridledWaitsHonorTheirDeadline() {
        Locks.Config config = Locks.Config.of(Locks.Config.UNBRIDLED, b -> b.setTotalMillis(20));

        assertThatThrownBy(() -> Locks.getUnless(config, () -> 0, v -> v == 0))
                .isInstanceOf(RuntimeException.class)
                .cause()
                .hasMessageContaining("Expired");
    }

    @Test
    void robustParkRejectsInvalidDurations() {
        assertThatThrownBy(() -> Locks.robustPark(0))
                .isInstanceOf(IllegalArgumentException.class);
        assertThatThrownBy(() -> Locks.robustPark(Long.MAX_VALUE))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void formatsNanos() {
        assertThat(Locks.formatNanos(1_500_000_123L)).isEqualTo("1[seconds]: 500[millis]: 000123[nanos]");
    }
}
