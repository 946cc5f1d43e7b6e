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
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Function;

import static com.welie.bleclient.ConnectionState.CLEANING_UP;
import static com.welie.bleclient.ConnectionState.CONNECTED;
import static com.welie.bleclient.ConnectionState.CONNECTING;
import static com.welie.bleclient.ConnectionState.DISCONNECTED;
import static com.welie.bleclient.ConnectionState.DISCONNECTING;

/**
 * Owns the connection handle of a peripheral and drives it through its states.
 *
 * <p>On every terminal path the handle is closed before the state returns to {@link ConnectionState#DISCONNECTED}.
 * In between the machine is {@link ConnectionState#CLEANING_UP} for the configured grace period, which absorbs
 * duplicate terminal callbacks for the same connection.
 */
final class ConnectionStateMachine {

    private static final String TAG = ConnectionStateMachine.class.getSimpleName();

    /**
     * Receives the side effects of state transitions.
     */
    interface Listener {
        void onConnected();

        /**
         * Called before the handle is released so pending requests never see a stale handle.
         */
        void onTearDown(@NotNull Function<OperationType, GattException> cause);

        /**
         * @param notify true if the cycle reached the connected state and a disconnected event is due
         */
        void onDisconnected(@NotNull DisconnectReason reason, boolean notify);
    }

    private final @NotNull GattDevice device;
    private final @NotNull GattCallback gattCallback;
    private final @NotNull Handler handler;
    private final @NotNull PeripheralOptions options;
    private final @NotNull Listener listener;

    private final Object lock = new Object();
    private @NotNull ConnectionState state = DISCONNECTED;
    private @Nullable GattConnection gatt;
    private @Nullable CompletableFuture<Void> pendingConnect;
    private @Nullable CompletableFuture<Void> pendingDisconnect;
    private @Nullable ScheduledFuture<?> connectTimer;
    private @Nullable ScheduledFuture<?> disconnectTimer;
    private @Nullable ScheduledFuture<?> cleanupTimer;
    private boolean established;
    private boolean closed;

    ConnectionStateMachine(@NotNull final GattDevice device,
                           @NotNull final GattCallback gattCallback,
                           @NotNull final Handler handler,
                           @NotNull final PeripheralOptions options,
                           @NotNull final Listener listener) {
        this.device = Objects.requireNonNull(device, "no valid device provided");
        this.gattCallback = Objects.requireNonNull(gattCallback, "no valid gatt callback provided");
        this.handler = Objects.requireNonNull(handler, "no valid handler provided");
        this.options = Objects.requireNonNull(options, "no valid options provided");
        this.listener = Objects.requireNonNull(listener, "no valid listener provided");
    }

    @NotNull
    ConnectionState getState() {
        synchronized (lock) {
            return state;
        }
    }

    boolean isClosed() {
        synchronized (lock) {
            return closed;
        }
    }

    /**
     * @return the live handle, or null if the peripheral is not connected
     */
    @Nullable
    GattConnection getConnection() {
        synchronized (lock) {
            return state == CONNECTED ? gatt : null;
        }
    }

    /**
     * @return true if the callback belongs to the live handle
     */
    boolean isCurrent(@NotNull final GattConnection connection) {
        synchronized (lock) {
            return gatt == connection;
        }
    }

    @NotNull
    CompletableFuture<Void> connect() {
        final CompletableFuture<Void> future = new CompletableFuture<>();
        synchronized (lock) {
            if (closed) {
                future.completeExceptionally(GattException.sessionClosed(OperationType.CONNECT));
                return future;
            }

            // Without a grace timer the previous handle is not closed yet
            if (state == CONNECTING || state == CONNECTED || state == DISCONNECTING || (state == CLEANING_UP && cleanupTimer == null)) {
                Logger.w(TAG, "connect to '%s' refused, state is %s", device.getAddress(), state);
                future.completeExceptionally(GattException.alreadyConnected());
                return future;
            }

            if (state == CLEANING_UP) {
                Logger.d(TAG, "cleanup of previous connection already done, skipping grace period");
                handler.removeCallbacks(cleanupTimer);
                cleanupTimer = null;
            }

            state = CONNECTING;
            established = false;
            pendingConnect = future;
        }

        Logger.i(TAG, "connect to '%s' (%s)", device.getName(), device.getAddress());
        GattConnection connection;
        try {
            connection = device.connectGatt(false, gattCallback);
        } catch (RuntimeException ex) {
            Logger.e(TAG, ex, "connectGatt threw for '%s'", device.getAddress());
            connection = null;
        }

        boolean superseded = false;
        synchronized (lock) {
            if (state == CONNECTING && pendingConnect == future) {
                if (connection == null) {
                    state = DISCONNECTED;
                    pendingConnect = null;
                } else {
                    if (gatt == null) gatt = connection;
                    connectTimer = handler.postDelayed(() -> connectTimedOut(future), options.getConnectTimeout());
                }
            } else {
                superseded = true;
            }
        }

        if (connection == null) {
            Logger.e(TAG, "could not start connection to '%s'", device.getAddress());
            future.completeExceptionally(GattException.startFailed(OperationType.CONNECT));
        } else if (superseded) {
            // A disconnect or close happened while connectGatt was running
            Logger.d(TAG, "connection attempt to '%s' was cancelled", device.getAddress());
            closeQuietly(connection);
        }
        return future;
    }

    @NotNull
    CompletableFuture<Void> disconnect() {
        final CompletableFuture<Void> future = new CompletableFuture<>();
        final GattConnection connection;
        synchronized (lock) {
            if (closed) {
                future.completeExceptionally(GattException.sessionClosed(null));
                return future;
            }

            if (state == DISCONNECTED || state == CLEANING_UP || state == DISCONNECTING) {
                Logger.d(TAG, "disconnect ignored, state is %s", state);
                future.complete(null);
                return future;
            }

            Logger.i(TAG, "disconnect from '%s' requested in state %s", device.getAddress(), state);
            state = DISCONNECTING;
            connection = gatt;
            pendingDisconnect = future;
            handler.removeCallbacks(connectTimer);
            connectTimer = null;
        }

        listener.onTearDown(GattException::disconnected);

        if (connection != null) {
            disconnectQuietly(connection);
        }

        final ScheduledFuture<?> timer = handler.postDelayed(
                () -> completeDisconnect(connection, HciStatus.CONNECTION_TERMINATED_BY_LOCAL_HOST.value),
                options.getDisconnectTimeout());
        synchronized (lock) {
            if (state == DISCONNECTING && pendingDisconnect == future) {
                disconnectTimer = timer;
            } else {
                handler.removeCallbacks(timer);
            }
        }
        if (timer == null) {
            completeDisconnect(connection, HciStatus.CONNECTION_TERMINATED_BY_LOCAL_HOST.value);
        }
        return future;
    }

    /**
     * Entry point for {@link GattCallback#onConnectionStateChange}.
     */
    void onConnectionStateChange(@NotNull final GattConnection connection, final int status, final int newState) {
        final CompletableFuture<Void> connectFuture;
        synchronized (lock) {
            // The handle may arrive here before connectGatt has returned it
            final boolean current = gatt == connection || (gatt == null && state == CONNECTING);
            if (!current) {
                Logger.d(TAG, "ignoring state change %d (status %d) from stale connection", newState, status);
                return;
            }
            if (gatt == null) gatt = connection;

            if (status == HciStatus.SUCCESS.value && newState == GattCallback.STATE_CONNECTED) {
                if (state != CONNECTING) {
                    Logger.d(TAG, "ignoring connected event in state %s", state);
                    return;
                }
                state = CONNECTED;
                established = true;
                connectFuture = pendingConnect;
                pendingConnect = null;
                handler.removeCallbacks(connectTimer);
                connectTimer = null;
            } else if (newState == GattCallback.STATE_DISCONNECTED || status != HciStatus.SUCCESS.value) {
                connectFuture = null;
            } else {
                Logger.d(TAG, "ignoring intermediate state %d", newState);
                return;
            }
        }

        if (status == HciStatus.SUCCESS.value && newState == GattCallback.STATE_CONNECTED) {
            Logger.i(TAG, "connected to '%s' (%s)", device.getName(), device.getAddress());
            if (connectFuture != null) connectFuture.complete(null);
            listener.onConnected();
        } else {
            if (status != HciStatus.SUCCESS.value) {
                Logger.e(TAG, "connection state change for '%s' with status %d (%s)", device.getAddress(), status, HciStatus.fromValue(status));
            }
            completeDisconnect(connection, status);
        }
    }

    /**
     * Close the handle and release every resource immediately. The machine cannot be used afterwards.
     */
    void close() {
        final GattConnection connection;
        final ConnectionState previous;
        final boolean notify;
        final CompletableFuture<Void> connectFuture;
        final CompletableFuture<Void> disconnectFuture;
        synchronized (lock) {
            if (closed) return;
            closed = true;
            previous = state;
            notify = established && (previous == CONNECTED || previous == DISCONNECTING);
            established = false;
            connection = gatt;
            gatt = null;
            state = DISCONNECTED;
            connectFuture = pendingConnect;
            disconnectFuture = pendingDisconnect;
            pendingConnect = null;
            pendingDisconnect = null;
            cancelTimers();
            handler.removeCallbacks(cleanupTimer);
            cleanupTimer = null;
        }

        Logger.i(TAG, "closing session for '%s' in state %s", device.getAddress(), previous);
        listener.onTearDown(GattException::sessionClosed);
        if (connection != null) {
            disconnectQuietly(connection);
            closeQuietly(connection);
        }
        listener.onDisconnected(DisconnectReason.NORMAL, notify);

        if (connectFuture != null) connectFuture.completeExceptionally(GattException.sessionClosed(OperationType.CONNECT));
        if (disconnectFuture != null) disconnectFuture.complete(null);
    }

    private void connectTimedOut(@NotNull final CompletableFuture<Void> attempt) {
        final GattConnection connection;
        synchronized (lock) {
            if (state != CONNECTING || pendingConnect != attempt) return;
            connection = gatt;
            connectTimer = null;
        }

        Logger.e(TAG, "connection to '%s' timed out after %d ms", device.getAddress(), options.getConnectTimeout());
        if (connection != null) {
            disconnectQuietly(connection);
        }
        completeDisconnect(connection, HciStatus.CONNECTION_FAILED_ESTABLISHMENT.value);
    }

    /**
     * Runs the terminal path of a connection cycle exactly once: release the handle, then report.
     */
    private void completeDisconnect(@Nullable final GattConnection expected, final int status) {
        final GattConnection connection;
        final ConnectionState previous;
        final boolean notify;
        final CompletableFuture<Void> connectFuture;
        final CompletableFuture<Void> disconnectFuture;
        synchronized (lock) {
            if (state == DISCONNECTED || state == CLEANING_UP) {
                Logger.d(TAG, "cleanup already done, ignoring terminal event with status %d", status);
                return;
            }
            if (expected != null && gatt != null && gatt != expected) {
                Logger.d(TAG, "ignoring terminal event for stale connection");
                return;
            }

            previous = state;
            state = CLEANING_UP;
            notify = established;
            established = false;
            connection = gatt;
            gatt = null;
            connectFuture = pendingConnect;
            disconnectFuture = pendingDisconnect;
            pendingConnect = null;
            pendingDisconnect = null;
            cancelTimers();
        }

        final DisconnectReason reason = DisconnectReason.fromStatus(status);
        Logger.i(TAG, "disconnected from '%s': %s", device.getAddress(), reason.getDescription());

        listener.onTearDown(GattException::disconnected);
        if (connection != null) {
            closeQuietly(connection);
        }
        listener.onDisconnected(reason, notify);

        // The handle is closed, so callers continuing on the futures below may connect again
        scheduleCleanupDone();

        if (connectFuture != null) {
            connectFuture.completeExceptionally(previous == DISCONNECTING
                    ? GattException.disconnected(OperationType.CONNECT)
                    : GattException.connectionFailed(reason, status));
        }
        if (disconnectFuture != null) {
            disconnectFuture.complete(null);
        }
    }

    private void scheduleCleanupDone() {
        synchronized (lock) {
            if (state != CLEANING_UP) return;
            final long grace = options.getCleanupGracePeriod();
            final ScheduledFuture<?> timer = grace > 0 ? handler.postDelayed(this::cleanupDone, grace) : null;
            if (timer == null) {
                state = DISCONNECTED;
            } else {
                cleanupTimer = timer;
            }
        }
    }

    private void cleanupDone() {
        synchronized (lock) {
            if (state == CLEANING_UP) {
                state = DISCONNECTED;
                Logger.d(TAG, "cleanup grace period ended for '%s'", device.getAddress());
            }
            cleanupTimer = null;
        }
    }

    // Callers hold the lock
    private void cancelTimers() {
        handler.removeCallbacks(connectTimer);
        handler.removeCallbacks(disconnectTimer);
        connectTimer = null;
        disconnectTimer = null;
    }

    private void disconnectQuietly(@NotNull final GattConnection connection) {
        try {
            connection.disconnect();
        } catch (RuntimeException ex) {
            Logger.e(TAG, ex, "disconnect failed for '%s'", device.getAddress());
        }
    }

    private void closeQuietly(@NotNull final GattConnection connection) {
        try {
            connection.close();
        } catch (RuntimeException ex) {
            Logger.e(TAG, ex, "close failed for '%s', continuing cleanup", device.getAddress());
        }
    }
}
