package com.skylarkarms.cell;

import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.locks.LockSupport;
import java.util.function.Consumer;
import java.util.function.Predicate;
import java.util.function.Supplier;

/**
 * Waiting strategies used by {@link PublishedCell} while a publication is still pending.
 * <p> A wait is defined by a {@link Config}: a short busy-spin phase, followed by an
 * <b>Adaptive Thread Parking</b> phase whose park time grows by {@link Config#backOffFactor}
 * until it is capped at {@link Config#maxWaitNanos}.
 * <p> A {@link Config} with a {@link Config#totalNanos} of {@code 0} never expires.
 * */
public final class Locks {

    private Locks() {}

    static void durationExcep(long duration) {
        if (duration <= 0 || duration == Long.MAX_VALUE) throw new IllegalArgumentException("Not a valid duration [" + duration + "]");
    }

    private static void unitExcept(TimeUnit unit) {
        if (unit == null) throw new NullPointerException("Unit cannot be null");
    }

    public static void robustPark(long duration, TimeUnit unit) {
        unitExcept(unit);
        robustPark(unit.toNanos(duration));
    }

    /**
     * Parks the current {@link Thread} for the whole {@code nanos} period, even on spurious wake-ups.
     * */
    public static void robustPark(long nanos) {
        durationExcep(nanos);
        long currentNano = System.nanoTime();
        final long end = currentNano + nanos;
        while (end - currentNano > 0) {
            LockSupport.parkNanos(end - currentNano);
            currentNano = System.nanoTime();
        }
    }

    /**
     * Will default to the values of {@link Config#DEFAULT_CONFIG}
     * */
    private static Config globalConfig = Config.DEFAULT_CONFIG;
    private static boolean grabbed;
    record GLOBAL_CONFIG() { static {grabbed = true;}
        static final Config ref = globalConfig;
    }

    /**
     * Sets the {@link Config} adopted by every {@link PublishedCell} that does not define its own.
     * <p> Can only be set once, and only before any cell has been instantiated.
     * */
    public static synchronized void setGlobalConfig(Consumer<Config.Builder> builder) {
        if (builder == null) throw new NullPointerException("`builder` was null");
        if (globalConfig != Config.DEFAULT_CONFIG) throw new IllegalStateException("Can only set once");
        if (grabbed) throw new IllegalStateException("A PublishedCell has already been instantiated with the `globalConfig` Config instance.");

        Config.Builder builder1 = new Config.Builder(globalConfig);
        builder.accept(builder1);
        globalConfig = builder1.build();
    }

    public static Config getGlobalConfig() { return GLOBAL_CONFIG.ref; }

    /**
     * Class which holds the parameters needed to perform an <b>Adaptive Thread Parking</b>
     * */
    public static final class Config {
        final int spins;
        final long initialWaitNanos, maxWaitNanos, totalNanos;
        final double backOffFactor;

        /**
         * Default implementation of {@link Config} that uses these values as default:
         * <ul>
         *     <li>
         *         {@link #spins} = 64
         *     </li>
         *     <li>
         *         {@link #initialWaitNanos} = 1000 (1 micro)
         *     </li>
         *     <li>
         *         {@link #maxWaitNanos} = 1000000 (1 milli)
         *     </li>
         *     <li>
         *         {@link #backOffFactor} = 1.5
         *     </li>
         *     <li>
         *         {@link #totalNanos} = 0 (never expires)
         *     </li>
         * </ul>
         * */
        public static final Config DEFAULT_CONFIG = new Config(
                64,
                1_000,
                1_000_000,
                1.5,
                0
        );

        /**
         * "UNBRIDLED" type of busy spin-lock.
         * The waiting Thread will never park, it will only hint {@link Thread#onSpinWait()}.
         * For Adaptive Parking use {@link #DEFAULT_CONFIG} instead.
         * */
        public static final Config UNBRIDLED = new Config(
                0,
                0,
                0,
                0,
                0
        );

        Config(int spins, long initialWaitNanos, long maxWaitNanos, double backOffFactor, long totalNanos) {
            this.spins = spins;
            this.initialWaitNanos = initialWaitNanos;
            this.maxWaitNanos = maxWaitNanos;
            this.backOffFactor = backOffFactor;
            this.totalNanos = totalNanos;
        }

        Config(long duration, TimeUnit unit, Config parent) {
            durationExcep(duration);
            unitExcept(unit);
            this.totalNanos = unit.toNanos(duration);
            this.spins = parent.spins;
            Config parking = parent.isUnbridled() ? DEFAULT_CONFIG : parent;
            this.initialWaitNanos = parking.initialWaitNanos;
            this.maxWaitNanos = parking.maxWaitNanos;
            this.backOffFactor = parking.backOffFactor;
        }

        public static final class Builder {
            int spins;
            long initialWaitNanos;
            long maxWaitNanos;
            double backOffFactor;
            long totalNanos;

            Builder(Config defaultConfig) {
                this.spins = defaultConfig.spins;
                this.initialWaitNanos = defaultConfig.initialWaitNanos;
                this.maxWaitNanos = defaultConfig.maxWaitNanos;
                this.backOffFactor = defaultConfig.backOffFactor;
                this.totalNanos = defaultConfig.totalNanos;
            }

            public Builder setSpins(int spins) {
                if (spins < 0) throw new IllegalArgumentException("`spins` [" + spins + "] cannot be negative.");
                this.spins = spins;
                return this;
            }

            public Builder setInitialWait(long duration, TimeUnit unit) {
                durationExcep(duration);
                unitExcept(unit);
                this.initialWaitNanos = unit.toNanos(duration);
                if (maxWaitNanos < initialWaitNanos) maxWaitNanos = initialWaitNanos;
                if (backOffFactor == 0) backOffFactor = DEFAULT_CONFIG.backOffFactor;
                return this;
            }

            public Builder setMaxWait(long duration, TimeUnit unit) {
                durationExcep(duration);
                unitExcept(unit);
                long maxWaitNanos = unit.toNanos(duration);
                if (maxWaitNanos < initialWaitNanos)
                    throw new IllegalArgumentException("`maxWaitNanos` [" + maxWaitNanos + "] cannot be LESSER THAN `initialWaitNanos` [" + initialWaitNanos + "]");
                this.maxWaitNanos = maxWaitNanos;
                return this;
            }

            public Builder setBackOffFactor(double backOffFactor) {
                if (!(backOffFactor > 1)) throw new IllegalArgumentException("The factor should be greater than 1 to ensure a proper increase.");
                this.backOffFactor = backOffFactor;
                return this;
            }

            /**
             * Sets the deadline of the wait.
             * A {@code duration} of {@code 0} removes the deadline.
             * */
            public Builder setTotal(long duration, TimeUnit unit) {
                if (duration == 0) {
                    totalNanos = 0;
                } else {
                    durationExcep(duration);
                    unitExcept(unit);
                    this.totalNanos = unit.toNanos(duration);
                }
                return this;
            }

            public Builder setTotalMillis(long totalMillis) {
                return setTotal(totalMillis, TimeUnit.MILLISECONDS);
            }

            /**
             * The waiting Thread will never park.
             * A deadline, if any, will still be honored.
             * */
            public Builder setUnbridled() {
                initialWaitNanos = 0;
                maxWaitNanos = 0;
                return this;
            }

            public long getTotalNanos() {
                return totalNanos;
            }

            boolean isUnbridled() { return initialWaitNanos == 0; }

            Config build() {
                if (!isUnbridled() && !(backOffFactor > 1))
                    throw new IllegalStateException("A parking Config requires a `backOffFactor` greater than 1, found [" + backOffFactor + "]");
                return new Config(spins, initialWaitNanos, maxWaitNanos, backOffFactor, totalNanos);
            }
        }

        /**
         * Will use the values defined at {@link #DEFAULT_CONFIG} as base predefined values.
         * */
        public static Config of(Consumer<Builder> builder) {
            return of(DEFAULT_CONFIG, builder);
        }

        public static Config of(Config defaultConfig, Consumer<Builder> builder) {
            Builder builder1 = new Builder(defaultConfig);
            builder.accept(builder1);
            return builder1.build();
        }

        /**
         * @return true if this config never parks the waiting Thread.
         * */
        public boolean isUnbridled() {
            return initialWaitNanos == 0;
        }

        /**
         * @return true if this config has a deadline.
         * */
        public boolean isBounded() {
            return totalNanos > 0;
        }

        public int getSpins() { return spins; }

        public long getInitialWaitNanos() { return initialWaitNanos; }

        public long getMaxWaitNanos() { return maxWaitNanos; }

        public double getBackOffFactor() { return backOffFactor; }

        public long getTotalNanos() { return totalNanos; }

        @Override
        public String toString() {
            String total = totalNanos == 0 ? "[NEVER EXPIRES]" : formatNanos(totalNanos);
            if (isUnbridled()) return "Config{ UNBRIDLED, spins=" + spins + ", total=" + total + " }";
            return "Config{" +
                    "\n   >> spins=" + spins +
                    ",\n   >> initialWaitNanos=" + initialWaitNanos +
                    ",\n   >> maxWaitNanos=" + maxWaitNanos +
                    ",\n   >> backOffFactor=" + backOffFactor +
                    ",\n   >> total=" + total
                    + '}';
        }
    }

    public static String formatNanos(long nanos) {
        long seconds = TimeUnit.NANOSECONDS.toSeconds(nanos);
        long millis = TimeUnit.NANOSECONDS.toMillis(nanos) % 1000;
        long remainingNanos = nanos % 1_000_000;

        return String.format("%d[seconds]: %03d[millis]: %06d[nanos]", seconds, millis, remainingNanos);
    }

    /**
     * Component holding information about the type of both:
     * <ul>
     *     <li>{@link Config} timeout configurations</li>
     *     <li>{@link Supplier}&#60;{@link Exception}&#62; defining the Exception to be generated.</li>
     * </ul>
     * */
    public static final class ExceptionConfig<E extends Exception> {
        final Supplier<E> exception; final Config config;

        ExceptionConfig(Supplier<E> exception, Config config) {
            if (exception == null) throw new NullPointerException("`exception` Supplier was null");
            if (!config.isBounded()) throw new IllegalArgumentException("An ExceptionConfig requires a deadline, found " + config);
            this.exception = exception;
            this.config = config;
        }

        public Config getConfig() {
            return config;
        }

        public Supplier<E> getException() {
            return exception;
        }

        /**
         * Will use the values defined at {@link Config#DEFAULT_CONFIG} for all parameters except the deadline.
         * */
        public static ExceptionConfig<TimeoutException> timeout(long duration, TimeUnit unit) {
            return new ExceptionConfig<>(
                    TimeoutException::new, new Config(duration, unit, Config.DEFAULT_CONFIG));
        }

        public static ExceptionConfig<TimeoutException> timeout(long millis) {
            return timeout(millis, TimeUnit.MILLISECONDS);
        }

        public static ExceptionConfig<RuntimeException> runtime(long duration, TimeUnit unit) {
            return new ExceptionConfig<>(
                    RuntimeException::new, new Config(duration, unit, Config.DEFAULT_CONFIG));
        }

        /**
         * Will use {@link Config#DEFAULT_CONFIG} instance as base reference.
         * The {@code builder} must define a deadline via {@link Config.Builder#setTotal(long, TimeUnit)}.
         * */
        public static<E extends Exception> ExceptionConfig<E> custom(Supplier<E> exception, Consumer<Config.Builder> builder) {
            return new ExceptionConfig<>(exception, Config.of(builder));
        }

        @Override
        public String toString() {
            return "ExceptionConfig{" +
                    "\n    >> exception=" + exception +
                    ",\n    >> config=\n" + config.toString().indent(3) +
                    '}';
        }
    }

    /**
     * Polls the {@code supplier} until its result no longer satisfies {@code unless}.
     * <p> Phases:
     * <ol>
     *     <li>{@link Config#spins} busy polls.</li>
     *     <li>Parking polls starting at {@link Config#initialWaitNanos},
     *     growing by {@link Config#backOffFactor} up to {@link Config#maxWaitNanos}.
     *     An {@link Config#isUnbridled()} config keeps busy polling instead.</li>
     * </ol>
     * If the {@code config} {@link Config#isBounded()} and its deadline passes, the exception
     * provided by {@code exception} is thrown with a cause describing the expiration.
     * <p> Interrupts do not end the wait, the interrupt status is restored before returning or throwing.
     * @param exception may be null only if the {@code config} is not bounded.
     * @param cause an optional description appended to the expiration cause.
     * */
    public static<E extends Exception, T> T getUnless(
            Supplier<E> exception,
            Config config,
            Supplier<T> supplier,
            Predicate<T> unless,
            Supplier<String> cause
    ) throws E {
        T res;
        if (!unless.test(res = supplier.get())) return res;

        for (int i = config.spins; i > 0; i--) {
            Thread.onSpinWait();
            if (!unless.test(res = supplier.get())) return res;
        }

        final boolean bounded = config.isBounded();
        final long totalTimeNanos = config.totalNanos;
        long currentNanoTime = System.nanoTime();
        final long end = currentNanoTime + totalTimeNanos;

        if (config.isUnbridled()) {
            while (!bounded || end - currentNanoTime > 0) {
                Thread.onSpinWait();
                if (!unless.test(res = supplier.get())) return res;
                if (bounded) currentNanoTime = System.nanoTime();
            }
        } else {
            final long maxWaitNanos = config.maxWaitNanos;
            final double backOffFactor = config.backOffFactor;

            long waitTime = config.initialWaitNanos;
            boolean maxReached = false;

            // The wait is uninterruptible: a pending interrupt would make every park return at once.
            boolean interrupted = false;
            try {
                while (!bounded || end - currentNanoTime > 0) {
                    if (Thread.interrupted()) interrupted = true;
                    LockSupport.parkNanos(bounded ? Math.min(waitTime, end - currentNanoTime) : waitTime);
                    if (!unless.test(res = supplier.get())) return res;

                    if (!maxReached) {
                        waitTime = Math.min(Math.max(waitTime + 1, (long)(waitTime * backOffFactor)), maxWaitNanos);
                        maxReached = waitTime == maxWaitNanos;
                    }
                    currentNanoTime = System.nanoTime();
                }
            } finally {
                if (interrupted) Thread.currentThread().interrupt();
            }
        }

        if (unless.test(res = supplier.get())) {
            E e = exception.get();
            String initialCause = "Expired: " + formatNanos(totalTimeNanos);
            if (cause != null) {
                initialCause = initialCause.concat("\n Cause: " + cause.get());
            }
            e.initCause(
                    new Throwable(initialCause)
            );
            throw e;
        } else return res;
    }

    /**
     * @see #getUnless(Supplier, Config, Supplier, Predicate, Supplier)
     * */
    public static<E extends Exception, T> T getUnless(
            ExceptionConfig<E> config,
            Supplier<T> supplier,
            Predicate<T> unless,
            Supplier<String> cause
    ) throws E {
        return getUnless(
                config.exception, config.config,
                supplier, unless, cause
        );
    }

    /**
     * Waits without deadline, unless the {@code config} defines one,
     * in which case a {@link RuntimeException} will be thrown on expiration.
     * */
    public static<T> T getUnless(
            Config config,
            Supplier<T> supplier,
            Predicate<T> unless
    ) {
        return Locks.<RuntimeException, T>getUnless(
                RuntimeException::new, config,
                supplier, unless, null
        );
    }
}
