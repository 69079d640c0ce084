package com.questrail.reconnect.config;

import com.questrail.reconnect.api.ConnectionStateListener;
import com.questrail.reconnect.api.ReconnectErrorHandler;
import com.questrail.reconnect.internal.time.SystemWallClock;
import com.questrail.reconnect.internal.time.WallClock;
import com.questrail.reconnect.observability.NullObservabilitySink;
import com.questrail.reconnect.observability.ReconnectObservabilitySink;

import java.util.Objects;
import java.util.Optional;
import java.util.function.Consumer;

/**
 * Immutable retry policy and hooks for a reconnector.
 *
 * <p>A limit of {@code 0} means unlimited. Absent hooks are represented as
 * empty {@link Optional}s.</p>
 */
public record ReconnectConfig(
    int maxConnectAttempts,
    int maxConnectionErrors,
    Optional<ReconnectErrorHandler> errorHandler,
    Optional<ConnectionStateListener> stateListener,
    ReconnectObservabilitySink observabilitySink,
    WallClock wallClock
) {
    public ReconnectConfig {
        if (maxConnectAttempts < 0) {
            throw new IllegalArgumentException("maxConnectAttempts must be >= 0");
        }
        if (maxConnectionErrors < 0) {
            throw new IllegalArgumentException("maxConnectionErrors must be >= 0");
        }
        Objects.requireNonNull(errorHandler, "errorHandler");
        Objects.requireNonNull(stateListener, "stateListener");
        Objects.requireNonNull(observabilitySink, "observabilitySink");
        Objects.requireNonNull(wallClock, "wallClock");
    }

    /**
     * Unlimited retries, no hooks.
     */
    public static ReconnectConfig defaults() {
        return builder().build();
    }

    /**
     * Builds a config by applying each customizer in order; later customizers
     * override earlier ones.
     */
    @SafeVarargs
    public static ReconnectConfig of(Consumer<Builder>... customizers) {
        Builder builder = builder();
        for (Consumer<Builder> customizer : customizers) {
            Objects.requireNonNull(customizer, "customizer").accept(builder);
        }
        return builder.build();
    }

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int maxConnectAttempts;
        private int maxConnectionErrors;
        private ReconnectErrorHandler errorHandler;
        private ConnectionStateListener stateListener;
        private ReconnectObservabilitySink observabilitySink = NullObservabilitySink.INSTANCE;
        private WallClock wallClock = SystemWallClock.INSTANCE;

        public Builder withMaxConnectAttempts(int maxConnectAttempts) {
            this.maxConnectAttempts = maxConnectAttempts;
            return this;
        }

        public Builder withMaxConnectionErrors(int maxConnectionErrors) {
            this.maxConnectionErrors = maxConnectionErrors;
            return this;
        }

        /**
         * @param errorHandler veto hook, or {@code null} to remove it
         */
        public Builder withErrorHandler(ReconnectErrorHandler errorHandler) {
            this.errorHandler = errorHandler;
            return this;
        }

        /**
         * @param stateListener state hook, or {@code null} to remove it
         */
        public Builder withStateListener(ConnectionStateListener stateListener) {
            this.stateListener = stateListener;
            return this;
        }

        public Builder withObservabilitySink(ReconnectObservabilitySink sink) {
            this.observabilitySink = Objects.requireNonNull(sink, "sink");
            return this;
        }

        public Builder withWallClock(WallClock wallClock) {
            this.wallClock = Objects.requireNonNull(wallClock, "wallClock");
            return this;
        }

        public ReconnectConfig build() {
            return new ReconnectConfig(
                maxConnectAttempts,
                maxConnectionErrors,
                Optional.ofNullable(errorHandler),
                Optional.ofNullable(stateListener),
                observabilitySink,
                wallClock);
        }
    }
}
