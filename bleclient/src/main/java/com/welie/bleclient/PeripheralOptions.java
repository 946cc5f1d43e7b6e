/*
 *   Copyright (c) 2021 Martijn van Welie
 *
 *   Permission is hereby granted, free of charge, to any person obtaining a copy
 *   of this software and associated documentation files (the "Software"), to deal
 *   in the Software without restriction, including without limitation the rights
 *   to use, copy, modify, merge, publish, distribute, sublicense, and/or sell
 *   copies of the Software, and to permit persons to whom the Software is
 *   furnished to do so, subject to the following conditions:
 *
 *   The above copyright notice and this permission notice shall be included in all
 *   copies or substantial portions of the Software.
 *
 *   THE SOFTWARE IS PROVIDED "AS IS", WITHOUT WARRANTY OF ANY KIND, EXPRESS OR
 *   IMPLIED, INCLUDING BUT NOT LIMITED TO THE WARRANTIES OF MERCHANTABILITY,
 *   FITNESS FOR A PARTICULAR PURPOSE AND NONINFRINGEMENT. IN NO EVENT SHALL THE
 *   AUTHORS OR COPYRIGHT HOLDERS BE LIABLE FOR ANY CLAIM, DAMAGES OR OTHER
 *   LIABILITY, WHETHER IN AN ACTION OF CONTRACT, TORT OR OTHERWISE, ARISING FROM,
 *   OUT OF OR IN CONNECTION WITH THE SOFTWARE OR THE USE OR OTHER DEALINGS IN THE
 *   SOFTWARE.
 *
 */

package com.welie.bleclient;

import org.jetbrains.annotations.NotNull;

/**
 * Timing and MTU settings of a {@link BluetoothPeripheral}.
 */
public final class PeripheralOptions {

    public static final long DEFAULT_CONNECT_TIMEOUT = 35000L;
    public static final long DEFAULT_REQUEST_TIMEOUT = 10000L;
    public static final long DEFAULT_DISCONNECT_TIMEOUT = 100L;
    public static final long DEFAULT_CLEANUP_GRACE_PERIOD = 300L;
    public static final int DEFAULT_MTU = 517;
    public static final int MIN_MTU = 23;
    public static final int MAX_MTU = 517;

    public static final PeripheralOptions DEFAULT = builder().build();

    private final long connectTimeout;
    private final long requestTimeout;
    private final long disconnectTimeout;
    private final long cleanupGracePeriod;
    private final int initialMtu;

    private PeripheralOptions(@NotNull final Builder builder) {
        this.connectTimeout = builder.connectTimeout;
        this.requestTimeout = builder.requestTimeout;
        this.disconnectTimeout = builder.disconnectTimeout;
        this.cleanupGracePeriod = builder.cleanupGracePeriod;
        this.initialMtu = builder.initialMtu;
    }

    @NotNull
    public static Builder builder() {
        return new Builder();
    }

    public long getConnectTimeout() {
        return connectTimeout;
    }

    /**
     * @return timeout in milliseconds for pending requests, 0 when requests never time out
     */
    public long getRequestTimeout() {
        return requestTimeout;
    }

    public long getDisconnectTimeout() {
        return disconnectTimeout;
    }

    public long getCleanupGracePeriod() {
        return cleanupGracePeriod;
    }

    public int getInitialMtu() {
        return initialMtu;
    }

    @Override
    public String toString() {
        return "PeripheralOptions{connectTimeout=" + connectTimeout +
                ", requestTimeout=" + requestTimeout +
                ", disconnectTimeout=" + disconnectTimeout +
                ", cleanupGracePeriod=" + cleanupGracePeriod +
                ", initialMtu=" + initialMtu + '}';
    }

    public static final class Builder {
        private long connectTimeout = DEFAULT_CONNECT_TIMEOUT;
        private long requestTimeout = DEFAULT_REQUEST_TIMEOUT;
        private long disconnectTimeout = DEFAULT_DISCONNECT_TIMEOUT;
        private long cleanupGracePeriod = DEFAULT_CLEANUP_GRACE_PERIOD;
        private int initialMtu = DEFAULT_MTU;

        private Builder() {
        }

        @NotNull
        public Builder connectTimeout(final long millis) {
            this.connectTimeout = requirePositive(millis, "connect timeout");
            return this;
        }

        @NotNull
        public Builder requestTimeout(final long millis) {
            if (millis < 0) throw new IllegalArgumentException("request timeout cannot be negative");
            this.requestTimeout = millis;
            return this;
        }

        @NotNull
        public Builder disconnectTimeout(final long millis) {
            this.disconnectTimeout = requirePositive(millis, "disconnect timeout");
            return this;
        }

        @NotNull
        public Builder cleanupGracePeriod(final long millis) {
            if (millis < 0) throw new IllegalArgumentException("cleanup grace period cannot be negative");
            this.cleanupGracePeriod = millis;
            return this;
        }

        @NotNull
        public Builder initialMtu(final int mtu) {
            if (mtu < MIN_MTU || mtu > MAX_MTU) throw new IllegalArgumentException("mtu must be between 23 and 517");
            this.initialMtu = mtu;
            return this;
        }

        @NotNull
        public PeripheralOptions build() {
            return new PeripheralOptions(this);
        }

        private static long requirePositive(final long millis, final String name) {
            if (millis <= 0) throw new IllegalArgumentException(name + " must be positive");
            return millis;
        }
    }
}
