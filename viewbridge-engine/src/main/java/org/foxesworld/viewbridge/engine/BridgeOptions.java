package org.foxesworld.viewbridge.engine;

import org.foxesworld.viewbridge.engine.util.Props;

import java.nio.file.Path;
import java.util.Objects;
import java.util.Set;

/**
 * Bridge configuration. {@link #fromSystemProperties()} reads the {@code viewbridge.*}
 * properties; {@link #builder()} starts from the same defaults.
 */
public final class BridgeOptions {

    public static final int DEFAULT_CREATE_WARMUP_STEPS = 8;
    public static final int DEFAULT_LOAD_WARMUP_STEPS = 20;
    public static final long DEFAULT_WARMUP_DELAY_MS = 10L;
    public static final int DEFAULT_PRIMING_TICKS = 2;
    public static final int DEFAULT_BINDING_TICKS = 3;
    public static final int DEFAULT_BINDING_RETRY_BUDGET = 120;
    public static final long DEFAULT_SHUTDOWN_JOIN_MS = 5_000L;

    private final Path baseDirectory;
    private final boolean debug;
    private final int createWarmupSteps;
    private final int loadWarmupSteps;
    private final long warmupDelayMillis;
    private final int primingTicks;
    private final int bindingTicks;
    private final int bindingRetryBudget;
    private final long shutdownJoinMillis;
    private final Set<String> vfsIgnoredDirs;

    private BridgeOptions(Builder b) {
        this.baseDirectory = b.baseDirectory.toAbsolutePath().normalize();
        this.debug = b.debug;
        this.createWarmupSteps = Math.max(0, b.createWarmupSteps);
        this.loadWarmupSteps = Math.max(0, b.loadWarmupSteps);
        this.warmupDelayMillis = Math.max(0L, b.warmupDelayMillis);
        this.primingTicks = Math.max(1, b.primingTicks);
        this.bindingTicks = Math.max(1, b.bindingTicks);
        this.bindingRetryBudget = Math.max(0, b.bindingRetryBudget);
        this.shutdownJoinMillis = Math.max(0L, b.shutdownJoinMillis);
        this.vfsIgnoredDirs = Set.copyOf(b.vfsIgnoredDirs);
    }

    public static Builder builder() {
        return new Builder();
    }

    public static BridgeOptions defaults() {
        return builder().build();
    }

    public static BridgeOptions fromSystemProperties() {
        return builder()
                .baseDirectory(Path.of(Props.str("viewbridge.baseDir", ".")))
                .debug(Props.bool("viewbridge.debug", false))
                .createWarmupSteps(Props.i32("viewbridge.warmup.create", DEFAULT_CREATE_WARMUP_STEPS))
                .loadWarmupSteps(Props.i32("viewbridge.warmup.load", DEFAULT_LOAD_WARMUP_STEPS))
                .warmupDelayMillis(Props.i64("viewbridge.warmup.delayMs", DEFAULT_WARMUP_DELAY_MS))
                .primingTicks(Props.i32("viewbridge.load.primingTicks", DEFAULT_PRIMING_TICKS))
                .bindingTicks(Props.i32("viewbridge.load.bindingTicks", DEFAULT_BINDING_TICKS))
                .bindingRetryBudget(Props.i32("viewbridge.bindings.retryBudget", DEFAULT_BINDING_RETRY_BUDGET))
                .shutdownJoinMillis(Props.i64("viewbridge.shutdown.joinMs", DEFAULT_SHUTDOWN_JOIN_MS))
                .vfsIgnoredDirs(Props.csv("viewbridge.vfs.ignore", Set.of()))
                .build();
    }

    /** Copy with a different disk root and debug flag (what init receives). */
    public BridgeOptions withBase(Path baseDirectory, boolean debug) {
        return toBuilder().baseDirectory(baseDirectory).debug(debug).build();
    }

    public Builder toBuilder() {
        return new Builder()
                .baseDirectory(baseDirectory)
                .debug(debug)
                .createWarmupSteps(createWarmupSteps)
                .loadWarmupSteps(loadWarmupSteps)
                .warmupDelayMillis(warmupDelayMillis)
                .primingTicks(primingTicks)
                .bindingTicks(bindingTicks)
                .bindingRetryBudget(bindingRetryBudget)
                .shutdownJoinMillis(shutdownJoinMillis)
                .vfsIgnoredDirs(vfsIgnoredDirs);
    }

    public Path baseDirectory() { return baseDirectory; }
    public boolean debug() { return debug; }
    public int createWarmupSteps() { return createWarmupSteps; }
    public int loadWarmupSteps() { return loadWarmupSteps; }
    public long warmupDelayMillis() { return warmupDelayMillis; }
    public int primingTicks() { return primingTicks; }
    public int bindingTicks() { return bindingTicks; }
    public int bindingRetryBudget() { return bindingRetryBudget; }
    public long shutdownJoinMillis() { return shutdownJoinMillis; }
    public Set<String> vfsIgnoredDirs() { return vfsIgnoredDirs; }

    @Override
    public String toString() {
        return "BridgeOptions{base=" + baseDirectory + ", debug=" + debug
                + ", warmup=" + createWarmupSteps + "/" + loadWarmupSteps + "@" + warmupDelayMillis + "ms"
                + ", ticks=" + primingTicks + "/" + bindingTicks
                + ", bindingRetryBudget=" + bindingRetryBudget + '}';
    }

    public static final class Builder {
        private Path baseDirectory = Path.of(".");
        private boolean debug;
        private int createWarmupSteps = DEFAULT_CREATE_WARMUP_STEPS;
        private int loadWarmupSteps = DEFAULT_LOAD_WARMUP_STEPS;
        private long warmupDelayMillis = DEFAULT_WARMUP_DELAY_MS;
        private int primingTicks = DEFAULT_PRIMING_TICKS;
        private int bindingTicks = DEFAULT_BINDING_TICKS;
        private int bindingRetryBudget = DEFAULT_BINDING_RETRY_BUDGET;
        private long shutdownJoinMillis = DEFAULT_SHUTDOWN_JOIN_MS;
        private Set<String> vfsIgnoredDirs = Set.of();

        private Builder() {}

        public Builder baseDirectory(Path dir) {
            this.baseDirectory = Objects.requireNonNull(dir, "baseDirectory");
            return this;
        }

        public Builder debug(boolean debug) {
            this.debug = debug;
            return this;
        }

        public Builder createWarmupSteps(int steps) {
            this.createWarmupSteps = steps;
            return this;
        }

        public Builder loadWarmupSteps(int steps) {
            this.loadWarmupSteps = steps;
            return this;
        }

        public Builder warmupDelayMillis(long millis) {
            this.warmupDelayMillis = millis;
            return this;
        }

        public Builder primingTicks(int ticks) {
            this.primingTicks = ticks;
            return this;
        }

        public Builder bindingTicks(int ticks) {
            this.bindingTicks = ticks;
            return this;
        }

        public Builder bindingRetryBudget(int ticks) {
            this.bindingRetryBudget = ticks;
            return this;
        }

        public Builder shutdownJoinMillis(long millis) {
            this.shutdownJoinMillis = millis;
            return this;
        }

        public Builder vfsIgnoredDirs(Set<String> names) {
            this.vfsIgnoredDirs = Objects.requireNonNull(names, "vfsIgnoredDirs");
            return this;
        }

        public BridgeOptions build() {
            return new BridgeOptions(this);
        }
    }
}
