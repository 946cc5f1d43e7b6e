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
import org.jetbrains.annotations.Nullable;

import java.util.Objects;

/**
 * Connection lifecycle event of a peripheral.
 */
public final class PeripheralEvent {

    public enum Type {
        DEVICE_CONNECTED,
        DEVICE_DISCONNECTED
    }

    private final @NotNull Type type;
    private final @NotNull String address;
    private final @Nullable DisconnectReason reason;

    private PeripheralEvent(@NotNull final Type type, @NotNull final String address, @Nullable final DisconnectReason reason) {
        this.type = type;
        this.address = Objects.requireNonNull(address, "address is null");
        this.reason = reason;
    }

    @NotNull
    public static PeripheralEvent connected(@NotNull final String address) {
        return new PeripheralEvent(Type.DEVICE_CONNECTED, address, null);
    }

    @NotNull
    public static PeripheralEvent disconnected(@NotNull final String address, @NotNull final DisconnectReason reason) {
        return new PeripheralEvent(Type.DEVICE_DISCONNECTED, address, Objects.requireNonNull(reason, "reason is null"));
    }

    @NotNull
    public Type getType() {
        return type;
    }

    @NotNull
    public String getAddress() {
        return address;
    }

    /**
     * @return why the connection ended, null for connected events
     */
    @Nullable
    public DisconnectReason getReason() {
        return reason;
    }

    @Override
    public String toString() {
        return "PeripheralEvent{" + type + ", address=" + address + (reason != null ? ", reason=" + reason : "") + '}';
    }
}
