package com.skylarkarms.cell;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.function.BiFunction;
import java.util.function.Function;
import java.util.function.LongConsumer;
import java.util.function.Supplier;

/**
 * Lock-free, single-instance holder.
 * <p> The cell constructs exactly one instance of {@link T} via {@link #construct(Supplier)}
 * and publishes it with a release store.
 * Any thread calling {@link #get()} will observe the fully constructed instance,
 * concurrent calls that arrive before publication will wait following the cell's {@link Locks.Config}.
 * <p> {@link #tearDown()} (or {@link #close()}) destroys the instance exactly once,
 * no matter how many threads trigger it concurrently.
 * <p> Lifecycle:
 * <pre>
 *     UNPUBLISHED -> [construct] -> PUBLISHED -> [tearDown] -> TORN_DOWN
 * </pre>
 * Accessing a cell after its teardown, or after its constructor failed, throws an {@link IllegalStateException}.
 * */
public class PublishedCell<T> implements Supplier<T>, AutoCloseable {
    /**
     * Set to {@code true} to capture the creation site of every cell.
     * <p> Setting this to {@code true} will hamper performance.
     * */
    private static volatile boolean debug = false;

    static volatile boolean debug_grabbed;

    public static synchronized void setDebug(boolean debug) {
        if (debug_grabbed) throw new IllegalStateException("A PublishedCell instance has already been created." +
                "This setting should be set before any instance has been initialized.");
        PublishedCell.debug = debug;
    }

    record DEBUG() {
        static {debug_grabbed = true;}
        static final boolean ref = debug;
    }

    private static final LongConsumer emp = value -> {};
    private static volatile LongConsumer waitLogger = emp;
    private static volatile boolean logger_grabbed;

    /**
     * @param logger a consumer of the nanos spent waiting by every {@link #get()} that could not return immediately.
     * */
    public static synchronized void setWaitLogger(LongConsumer logger) {
        if (logger_grabbed) throw new IllegalStateException("Logger already initialized.");
        PublishedCell.waitLogger = logger == null ? emp : logger;
    }

    record WAIT_LOG() {
        static {logger_grabbed = true;}
        static final LongConsumer ref = waitLogger;
    }

    private static String logToS(LongConsumer l) {
        return l == emp ? "[NONE]" :
                l == WAIT_LOG.ref ? "[PublishedCell.GLOBAL_LOGGER] = ".concat(String.valueOf(l)) :
                        String.valueOf(l);
    }

    volatile Publication<T> ref;

    private static final VarHandle VALUE;
    private static final VarHandle HOOK;
    static {
        try {
            MethodHandles.Lookup lookup = MethodHandles.lookup();
            VALUE = lookup.findVarHandle(PublishedCell.class, "ref", Publication.class);
            HOOK = lookup.findVarHandle(PublishedCell.class, "exitHook", Thread.class);
        } catch (ReflectiveOperationException e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    private final Slot<T> slot = new Slot<>();
    private final Destructor<? super T> destructor;
    final Locks.Config config;
    private final LongConsumer instanceLogger;
    final StackTraceElement[] es;
    volatile Thread exitHook;

    /**
     * Cell with a {@link Destructor#defaultDestruct()}, waiting with the {@link Locks#getGlobalConfig()}.
     * */
    public PublishedCell() {
        this(Destructor.defaultDestruct(), Locks.GLOBAL_CONFIG.ref, WAIT_LOG.ref);
    }

    public PublishedCell(Destructor<? super T> destructor) {
        this(destructor, Locks.GLOBAL_CONFIG.ref, WAIT_LOG.ref);
    }

    public PublishedCell(Locks.Config config) {
        this(Destructor.defaultDestruct(), config, WAIT_LOG.ref);
    }

    public PublishedCell(Destructor<? super T> destructor, Locks.Config config) {
        this(destructor, config, WAIT_LOG.ref);
    }

    /**
     * @param destructor see {@link Destructor}.
     * @param config the waiting strategy of {@link #get()}.
     * @param waitLogger consumer of the nanos waited by {@link #get()}, if null no logging will be performed.
     * */
    public PublishedCell(Destructor<? super T> destructor, Locks.Config config, LongConsumer waitLogger) {
        this(destructor, config, waitLogger, DEBUG.ref);
    }

    /**
     * @param provenance if true, the creation site of this cell is captured.
     * */
    PublishedCell(Destructor<? super T> destructor, Locks.Config config, LongConsumer waitLogger, boolean provenance) {
        if (destructor == null) throw new NullPointerException("`destructor` was null");
        if (config == null) throw new NullPointerException("`config` was null");
        this.es = provenance ? Thread.currentThread().getStackTrace() : null;
        this.destructor = destructor;
        this.config = config;
        this.instanceLogger = waitLogger != null ? waitLogger : emp;
        this.ref = Publication.unpublished();
    }

    /**
     * Creates a cell and constructs its instance on the calling thread.
     * */
    public static <T> PublishedCell<T> of(Supplier<? extends T> constructor) {
        PublishedCell<T> cell = new PublishedCell<>();
        cell.construct(constructor);
        return cell;
    }

    /**
     * @see #of(Supplier)
     * */
    public static <A, T> PublishedCell<T> of(Function<? super A, ? extends T> constructor, A a) {
        PublishedCell<T> cell = new PublishedCell<>();
        cell.construct(constructor, a);
        return cell;
    }

    /**
     * @see #of(Supplier)
     * */
    public static <A, B, T> PublishedCell<T> of(BiFunction<? super A, ? super B, ? extends T> constructor, A a, B b) {
        PublishedCell<T> cell = new PublishedCell<>();
        cell.construct(constructor, a, b);
        return cell;
    }

    /**
     * @see #of(Supplier)
     * */
    public static <A, B, C, T> PublishedCell<T> of(TriFunction<? super A, ? super B, ? super C, ? extends T> constructor, A a, B b, C c) {
        PublishedCell<T> cell = new PublishedCell<>();
        cell.construct(constructor, a, b, c);
        return cell;
    }

    @SuppressWarnings("unchecked")
    private Publication<T> load() { return (Publication<T>) VALUE.getAcquire(this); }

    /**
     * Builds the instance and publishes it.
     * <p> Can only be called once per cell.
     * If the {@code constructor} throws, the exception is propagated to this caller
     * and the cell is left permanently unusable: threads waiting on {@link #get()} will fail.
     * @return the published instance.
     * @throws IllegalStateException if this cell was already constructed, or is being constructed.
     * @throws NullPointerException if the {@code constructor} is null or returns null.
     * */
    public final T construct(Supplier<? extends T> constructor) {
        if (constructor == null) throw new NullPointerException("`constructor` was null");
        if (!VALUE.compareAndSet(this, Publication.UNPUBLISHED, Publication.CONSTRUCTING)) {
            throw new IllegalStateException(
                    "Construction can only occur once per cell."
                            + "\n current state = " + Publication.toPhaseString(load().phase())
                            + provenance()
            );
        }
        final T res;
        try {
            res = slot.emplace(constructor);
        } catch (Throwable e) {
            VALUE.setRelease(this, Publication.failed(e));
            throw e;
        }
        VALUE.setRelease(this, Publication.published(res));
        return res;
    }

    /**
     * @see #construct(Supplier)
     * */
    public final <A> T construct(Function<? super A, ? extends T> constructor, A a) {
        if (constructor == null) throw new NullPointerException("`constructor` was null");
        return construct(() -> constructor.apply(a));
    }

    /**
     * @see #construct(Supplier)
     * */
    public final <A, B> T construct(BiFunction<? super A, ? super B, ? extends T> constructor, A a, B b) {
        if (constructor == null) throw new NullPointerException("`constructor` was null");
        return construct(() -> constructor.apply(a, b));
    }

    /**
     * @see #construct(Supplier)
     * */
    public final <A, B, C> T construct(TriFunction<? super A, ? super B, ? super C, ? extends T> constructor, A a, B b, C c) {
        if (constructor == null) throw new NullPointerException("`constructor` was null");
        return construct(() -> constructor.apply(a, b, c));
    }

    /**
     * Returns immediately once the instance is published.
     * <p> If called before publication, will wait, as defined by this cell's {@link Locks.Config},
     * until the constructing thread publishes.
     * With a config that never expires, a constructor that never completes will keep this call waiting.
     * @throws IllegalStateException if the cell was torn down or its constructor failed.
     * */
    @Override
    public final T get() {
        Publication<T> p = load();
        if (p.isPending()) {
            long start = System.nanoTime();
            p = Locks.<RuntimeException, Publication<T>>getUnless(
                    RuntimeException::new, config,
                    this::load, Publication::isPending, this::pendingCause
            );
            instanceLogger.accept(System.nanoTime() - start);
        }
        return valueOf(p);
    }

    /**
     * Bounded version of {@link #get()}.
     * @throws E provided by {@link Locks.ExceptionConfig#getException()} if the instance is not published in time.
     * */
    public final <E extends Exception> T get(Locks.ExceptionConfig<E> timeoutConfig) throws E {
        Publication<T> p = load();
        if (p.isPending()) {
            long start = System.nanoTime();
            p = Locks.getUnless(timeoutConfig, this::load, Publication::isPending, this::pendingCause);
            instanceLogger.accept(System.nanoTime() - start);
        }
        return valueOf(p);
    }

    private T valueOf(Publication<T> p) {
        return switch (p.phase()) {
            case Publication.PUBLISHED_PHASE -> p.value();
            case Publication.TORN_DOWN_PHASE -> throw new IllegalStateException(
                    "Cell accessed after teardown." + provenance()
            );
            case Publication.FAILED_PHASE -> throw new IllegalStateException(
                    "Cell construction failed, this cell is unusable." + provenance(),
                    p.cause()
            );
            default -> throw new IllegalStateException("Unexpected value: " + p);
        };
    }

    private String pendingCause() {
        return "This cell was never published, state = [" + Publication.toPhaseString(load().phase()) + "]"
                + (es == null ?
                "\n to find the cell, set 'PublishedCell.setDebug(true)'." :
                provenance());
    }

    private String provenance() {
        return es == null ? "" : "\n at = " + formatStack(es);
    }

    /**
     * Will not wait.
     * @return the published instance, or null if this cell is not in its published state.
     * */
    public final T peek() { return load().value(); }

    public final boolean isPublished() { return load().isPublished(); }

    public final boolean isTornDown() { return load().phase() == Publication.TORN_DOWN_PHASE; }

    public final boolean isFailed() { return load().phase() == Publication.FAILED_PHASE; }

    /**
     * Destroys the published instance with this cell's {@link Destructor}.
     * <p> Concurrent callers will compete for the teardown, only one will run the {@link Destructor}.
     * A cell that is not published will not be affected.
     * @return true if this caller was the one that destroyed the instance.
     * @throws IllegalStateException if the {@link Destructor} failed, the cell remains torn down.
     * */
    public final boolean tearDown() {
        final Publication<T> prev = load();
        if (!prev.isPublished()
                || !VALUE.compareAndSet(this, prev, Publication.TORN_DOWN)) return false;
        releaseExitHook();
        try {
            slot.destroy(destructor);
        } catch (Exception e) {
            throw new IllegalStateException("Destructor " + destructor + " failed." + provenance(), e);
        }
        return true;
    }

    /**
     * @see #tearDown()
     * */
    @Override
    public final void close() { tearDown(); }

    /**
     * Registers a JVM shutdown hook that will {@link #tearDown()} this cell.
     * <p> The hook competes with any other teardown trigger, the instance is still destroyed only once.
     * Subsequent calls will not register additional hooks.
     * */
    public final PublishedCell<T> tearDownOnExit() {
        Thread hook = new Thread(
                () -> {
                    try {
                        tearDown();
                    } catch (RuntimeException e) {
                        e.printStackTrace(System.err);
                    }
                },
                "PublishedCell-exit@".concat(Integer.toString(hashCode()))
        );
        if (HOOK.compareAndSet(this, null, hook)) {
            Runtime.getRuntime().addShutdownHook(hook);
            // a teardown that won before the hook was stored will not see it.
            if (isTornDown()) releaseExitHook();
        }
        return this;
    }

    /**
     * @return true if a registered hook was removed from the {@link Runtime}.
     * */
    private boolean releaseExitHook() {
        Thread hook = (Thread) HOOK.getAndSet(this, null);
        if (hook == null || hook == Thread.currentThread()) return false;
        try {
            return Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException shutdownInProgress) {
            // hooks are frozen once the JVM shuts down, the teardown CAS leaves this one without effect.
            return false;
        }
    }

    private static String formatStack(StackTraceElement[] es) {
        int le = es.length;
        StringBuilder sb = new StringBuilder((le * 2) + 2);
        sb.append("\n >> stack {");
        for (int i = 0; i < le; i++) {
            StackTraceElement e = es[i];
            sb.append("\n   - at [").append(i).append("] ").append(e);
        }
        return sb.append("\n } << stack. [total length = ").append(le).append("]").toString();
    }

    @Override
    public String toString() {
        String hash = Integer.toString(hashCode());
        Publication<T> current = load();
        return "PublishedCell@".concat(hash).concat("{"
                + "\n >>> status=[" + Publication.toPhaseString(current.phase()) + "]"
                + ",\n >>> ref=\n" + current.toString().concat(",").indent(3)
                + " >>> config=\n" + config.toString().indent(3)
                + " }@").concat(hash);
    }

    public String toStringDetailed() {
        String hash = Integer.toString(hashCode());
        Publication<T> current = load();
        return "PublishedCell@".concat(hash).concat("{"
                + "\n >>> status=[" + Publication.toPhaseString(current.phase()) + "]"
                + ",\n >>> ref=\n" + current.toString().concat(",").indent(3)
                + " >>> slot=" + slot + ","
                + "\n >>> destructor=" + destructor + ","
                + "\n >>> config=\n" + config.toString().concat(",").indent(3)
                + " >>> waitLogger=" + logToS(instanceLogger)
                + (es != null ? ",\n >>> provenance=" + formatStack(es).indent(3) : "\n")
                + "}@").concat(hash);
    }
}
