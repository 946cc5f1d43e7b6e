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
import java.util.UUID;

/**
 * Exception used to fail the futures returned by {@link BluetoothPeripheral}.
 */
public class GattException extends Exception {

    private static final long serialVersionUID = 1L;

    /**
     * Marker for errors that did not originate from a status code.
     */
    public static final int NO_STATUS = -1;

    private final @NotNull GattError error;
    private final @Nullable OperationType operation;
    private final int status;
    private final @Nullable DisconnectReason reason;

    public GattException(@NotNull final GattError error, @Nullable final OperationType operation, final int status, @Nullable final DisconnectReason reason, @NotNull final String message) {
        super(message);
        this.error = Objects.requireNonNull(error, "error is null");
        this.operation = operation;
        this.status = status;
        this.reason = reason;
    }

    @NotNull
    public GattError getError() {
        return error;
    }

    @Nullable
    public OperationType getOperation() {
        return operation;
    }

    /**
     * @return the raw status code reported by the stack, or {@link #NO_STATUS}
     */
    public int getStatus() {
        return status;
    }

    @Nullable
    public DisconnectReason getReason() {
        return reason;
    }

    @NotNull
    public static GattException notConnected(@NotNull final OperationType operation) {
        return new GattException(GattError.NOT_CONNECTED, operation, NO_STATUS, null, "peripheral not connected");
    }

    @NotNull
    public static GattException alreadyConnected() {
        return new GattException(GattError.ALREADY_CONNECTED, OperationType.CONNECT, NO_STATUS, null, "peripheral already connected or connecting");
    }

    @NotNull
    public static GattException characteristicNotFound(@NotNull final OperationType operation, @NotNull final UUID serviceUuid, @NotNull final UUID characteristicUuid) {
        return new GattException(GattError.CHARACTERISTIC_NOT_FOUND, operation, NO_STATUS, null,
                String.format("characteristic %s not found in service %s", characteristicUuid, serviceUuid));
    }

    @NotNull
    public static GattException descriptorNotFound(@NotNull final UUID characteristicUuid) {
        return new GattException(GattError.DESCRIPTOR_NOT_FOUND, OperationType.DESCRIPTOR_WRITE, NO_STATUS, null,
                String.format("characteristic %s has no client characteristic configuration descriptor", characteristicUuid));
    }

    @NotNull
    public static GattException serviceDiscoveryFailed(final int status) {
        return new GattException(GattError.SERVICE_DISCOVERY_FAILED, OperationType.DISCOVER_SERVICES, status, null,
                String.format("service discovery failed with status %d (%s)", status, GattStatus.fromValue(status)));
    }

    @NotNull
    public static GattException operationFailed(@NotNull final OperationType operation, final int status) {
        return new GattException(GattError.OPERATION_FAILED, operation, status, null,
                String.format("%s failed with status %d (%s)", operation, status, GattStatus.fromValue(status)));
    }

    @NotNull
    public static GattException overwritten(@NotNull final OperationType operation) {
        return new GattException(GattError.OVERWRITTEN, operation, NO_STATUS, null, operation + " request overwritten by a newer request");
    }

    @NotNull
    public static GattException unexpectedDescriptor(@NotNull final UUID descriptorUuid) {
        return new GattException(GattError.UNEXPECTED_DESCRIPTOR, OperationType.DESCRIPTOR_WRITE, NO_STATUS, null, "unexpected descriptor " + descriptorUuid);
    }

    @NotNull
    public static GattException startFailed(@NotNull final OperationType operation) {
        return new GattException(GattError.START_FAILED, operation, NO_STATUS, null, operation + " could not be started");
    }

    @NotNull
    public static GattException timeout(@NotNull final OperationType operation) {
        return new GattException(GattError.TIMEOUT, operation, NO_STATUS, null, operation + " timed out");
    }

    @NotNull
    public static GattException connectionFailed(@NotNull final DisconnectReason reason, final int status) {
        return new GattException(GattError.CONNECTION_FAILED, OperationType.CONNECT, status, reason,
                String.format("connection failed: %s (status %d)", reason.getDescription(), status));
    }

    @NotNull
    public static GattException disconnected(@Nullable final OperationType operation) {
        return new GattException(GattError.DISCONNECTED, operation, NO_STATUS, null, "peripheral disconnected");
    }

    @NotNull
    public static GattException sessionClosed(@Nullable final OperationType operation) {
        return new GattException(GattError.SESSION_CLOSED, operation, NO_STATUS, null, "session closed");
    }

    @Override
    public String toString() {
        return "GattException{" + error + (operation != null ? ", " + operation : "") + ", " + getMessage() + '}';
    }
}
