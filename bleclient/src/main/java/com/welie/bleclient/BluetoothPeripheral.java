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

import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.BooleanSupplier;
import java.util.function.Function;

import static com.welie.bleclient.BluetoothGattDescriptor.CCC_DESCRIPTOR_UUID;
import static com.welie.bleclient.BluetoothGattDescriptor.DISABLE_NOTIFICATION_VALUE;
import static com.welie.bleclient.BluetoothGattDescriptor.ENABLE_INDICATION_VALUE;
import static com.welie.bleclient.BluetoothGattDescriptor.ENABLE_NOTIFICATION_VALUE;
import static com.welie.bleclient.PeripheralOptions.MAX_MTU;
import static com.welie.bleclient.PeripheralOptions.MIN_MTU;

/**
 * Represents a remote Bluetooth peripheral and replaces BluetoothDevice and BluetoothGatt
 *
 * <p>A {@link BluetoothPeripheral} lets you connect to a peripheral, discover its services and
 * read, write or subscribe to its characteristics.
 *
 * <p>Every asynchronous operation returns a {@link CompletableFuture} that completes exactly once. Failures
 * are reported with a {@link GattException}. Reads and writes on different characteristics may be outstanding
 * at the same time; a second request for the same characteristic, or a second descriptor write or MTU request,
 * fails the earlier request with {@link GattError#OVERWRITTEN}.
 */
public class BluetoothPeripheral {

    private static final String TAG = BluetoothPeripheral.class.getSimpleName();

    private static final String NO_VALID_SERVICE_UUID_PROVIDED = "no valid service UUID provided";
    private static final String NO_VALID_CHARACTERISTIC_UUID_PROVIDED = "no valid characteristic UUID provided";
    private static final String NO_VALID_WRITE_TYPE_PROVIDED = "no valid writeType provided";
    private static final String NO_VALID_VALUE_PROVIDED = "no valid value provided";
    private static final String NO_VALID_DEVICE_PROVIDED = "no valid device provided";
    private static final String NO_VALID_OPTIONS_PROVIDED = "no valid options provided";
    private static final String PERIPHERAL_NOT_CONNECTED = "peripheral not connected";

    private final @NotNull GattDevice device;
    private final @NotNull PeripheralOptions options;
    private final @NotNull Handler handler;
    private final @NotNull ConnectionStateMachine connection;
    private final @NotNull ServiceCatalog catalog = new ServiceCatalog();
    private final @NotNull NotificationDispatcher notificationDispatcher = new NotificationDispatcher();
    private final @NotNull EventEmitter eventEmitter = new EventEmitter();
    private final @NotNull Set<CharacteristicKey> notifyingCharacteristics = ConcurrentHashMap.newKeySet();

    private final @NotNull OperationRegistry<OperationType, Void> discoveryRequests;
    private final @NotNull OperationRegistry<CharacteristicKey, byte[]> readRequests;
    private final @NotNull OperationRegistry<CharacteristicKey, Void> writeRequests;
    private final @NotNull OperationRegistry<OperationType, Void> descriptorWriteRequests;
    private final @NotNull OperationRegistry<OperationType, Integer> mtuRequests;

    private volatile int currentMtu;

    public BluetoothPeripheral(@NotNull final GattDevice device) {
        this(device, PeripheralOptions.DEFAULT);
    }

    public BluetoothPeripheral(@NotNull final GattDevice device, @NotNull final PeripheralOptions options) {
        this.device = Objects.requireNonNull(device, NO_VALID_DEVICE_PROVIDED);
        this.options = Objects.requireNonNull(options, NO_VALID_OPTIONS_PROVIDED);
        this.handler = new Handler("peripheral-" + device.getAddress());
        this.currentMtu = options.getInitialMtu();

        final long timeout = options.getRequestTimeout();
        this.discoveryRequests = new OperationRegistry<>(OperationType.DISCOVER_SERVICES, handler, timeout);
        this.readRequests = new OperationRegistry<>(OperationType.READ, handler, timeout);
        this.writeRequests = new OperationRegistry<>(OperationType.WRITE, handler, timeout);
        this.descriptorWriteRequests = new OperationRegistry<>(OperationType.DESCRIPTOR_WRITE, handler, timeout);
        this.mtuRequests = new OperationRegistry<>(OperationType.REQUEST_MTU, handler, timeout);

        this.connection = new ConnectionStateMachine(device, new PeripheralGattCallback(), handler, options, new SessionListener());
    }

    /**
     * Connect to the peripheral. The connection attempt does not auto-reconnect.
     *
     * @return a future that completes when the peripheral is connected, or fails with
     * {@link GattError#ALREADY_CONNECTED}, {@link GattError#START_FAILED} or {@link GattError#CONNECTION_FAILED}
     */
    @NotNull
    public CompletableFuture<Void> connect() {
        return connection.connect();
    }

    /**
     * Disconnect from the peripheral. Pending requests are failed with {@link GattError#DISCONNECTED}.
     *
     * <p>Calling this while not connected, or while a disconnect is already in progress, completes immediately.
     *
     * @return a future that completes when the connection handle has been released
     */
    @NotNull
    public CompletableFuture<Void> disconnect() {
        return connection.disconnect();
    }

    /**
     * Discover the services of the peripheral. On success the result is available via {@link #getServices()}.
     * On failure the previously discovered services are cleared.
     */
    @NotNull
    public CompletableFuture<Void> discoverServices() {
        final CompletableFuture<Void> future = new CompletableFuture<>();
        final GattConnection gatt = requireConnection(OperationType.DISCOVER_SERVICES, future);
        if (gatt == null) return future;

        discoveryRequests.register(OperationType.DISCOVER_SERVICES, future);
        if (!stillConnected(gatt, discoveryRequests, OperationType.DISCOVER_SERVICES, future)) return future;
        if (commandStarted(OperationType.DISCOVER_SERVICES, gatt::discoverServices)) {
            Logger.i(TAG, "discovering services of '%s'", getAddress());
        } else {
            discoveryRequests.abort(OperationType.DISCOVER_SERVICES, future, GattException.startFailed(OperationType.DISCOVER_SERVICES));
        }
        return future;
    }

    /**
     * Get the services found by the most recent successful service discovery.
     *
     * @return the services, an empty list if none were discovered or the peripheral is disconnected
     */
    @NotNull
    public List<BluetoothGattService> getServices() {
        return catalog.getServices();
    }

    /**
     * Get the BluetoothGattCharacteristic object for a characteristic UUID.
     *
     * @param serviceUUID        the service UUID the characteristic is part of
     * @param characteristicUUID the UUID of the characteristic
     * @return the BluetoothGattCharacteristic object for the characteristic UUID or null if it was not found
     */
    @Nullable
    public BluetoothGattCharacteristic getCharacteristic(@NotNull final UUID serviceUUID, @NotNull final UUID characteristicUUID) {
        Objects.requireNonNull(serviceUUID, NO_VALID_SERVICE_UUID_PROVIDED);
        Objects.requireNonNull(characteristicUUID, NO_VALID_CHARACTERISTIC_UUID_PROVIDED);

        return catalog.getCharacteristic(serviceUUID, characteristicUUID);
    }

    /**
     * Read the value of a characteristic.
     *
     * @param serviceUUID        the service UUID the characteristic belongs to
     * @param characteristicUUID the characteristic's UUID
     * @return a future that completes with the value read
     */
    @NotNull
    public CompletableFuture<byte[]> readCharacteristic(@NotNull final UUID serviceUUID, @NotNull final UUID characteristicUUID) {
        Objects.requireNonNull(serviceUUID, NO_VALID_SERVICE_UUID_PROVIDED);
        Objects.requireNonNull(characteristicUUID, NO_VALID_CHARACTERISTIC_UUID_PROVIDED);

        final CompletableFuture<byte[]> future = new CompletableFuture<>();
        final GattConnection gatt = requireConnection(OperationType.READ, future);
        if (gatt == null) return future;
        final BluetoothGattCharacteristic characteristic = requireCharacteristic(OperationType.READ, serviceUUID, characteristicUUID, future);
        if (characteristic == null) return future;

        final CharacteristicKey key = CharacteristicKey.of(characteristic);
        readRequests.register(key, future);
        if (!stillConnected(gatt, readRequests, key, future)) return future;
        if (commandStarted(OperationType.READ, () -> gatt.readCharacteristic(characteristic))) {
            Logger.v(TAG, "reading characteristic <%s>", characteristicUUID);
        } else {
            readRequests.abort(key, future, GattException.startFailed(OperationType.READ));
        }
        return future;
    }

    /**
     * Write a value to a characteristic using the specified write type.
     *
     * <p>Writes without response also complete through the write callback of the stack.
     *
     * @param serviceUUID        the service UUID the characteristic belongs to
     * @param characteristicUUID the characteristic's UUID
     * @param value              the byte array to write
     * @param writeType          the write type to use when writing.
     * @return a future that completes when the stack reports the write as done
     */
    @NotNull
    public CompletableFuture<Void> writeCharacteristic(@NotNull final UUID serviceUUID, @NotNull final UUID characteristicUUID, @NotNull final byte[] value, @NotNull final WriteType writeType) {
        Objects.requireNonNull(serviceUUID, NO_VALID_SERVICE_UUID_PROVIDED);
        Objects.requireNonNull(characteristicUUID, NO_VALID_CHARACTERISTIC_UUID_PROVIDED);
        Objects.requireNonNull(value, NO_VALID_VALUE_PROVIDED);
        Objects.requireNonNull(writeType, NO_VALID_WRITE_TYPE_PROVIDED);

        final CompletableFuture<Void> future = new CompletableFuture<>();
        final GattConnection gatt = requireConnection(OperationType.WRITE, future);
        if (gatt == null) return future;
        final BluetoothGattCharacteristic characteristic = requireCharacteristic(OperationType.WRITE, serviceUUID, characteristicUUID, future);
        if (characteristic == null) return future;

        // Copy the value so the caller can't change it while the write is in progress
        final byte[] bytesToWrite = value.clone();
        final CharacteristicKey key = CharacteristicKey.of(characteristic);
        writeRequests.register(key, future);
        if (!stillConnected(gatt, writeRequests, key, future)) return future;
        if (commandStarted(OperationType.WRITE, () -> gatt.writeCharacteristic(characteristic, bytesToWrite, writeType.writeType))) {
            Logger.v(TAG, "writing <%s> to characteristic <%s> (%s)", BluetoothBytes.toHex(bytesToWrite), characteristicUUID, writeType);
        } else {
            writeRequests.abort(key, future, GattException.startFailed(OperationType.WRITE));
        }
        return future;
    }

    /**
     * Write a value to a characteristic, with or without response.
     *
     * @param serviceUUID        the service UUID the characteristic belongs to
     * @param characteristicUUID the characteristic's UUID
     * @param value              the byte array to write
     * @param withResponse       true to request an acknowledgement from the peripheral
     * @return a future that completes when the stack reports the write as done
     */
    @NotNull
    public CompletableFuture<Void> writeCharacteristic(@NotNull final UUID serviceUUID, @NotNull final UUID characteristicUUID, @NotNull final byte[] value, final boolean withResponse) {
        return writeCharacteristic(serviceUUID, characteristicUUID, value, WriteType.of(withResponse));
    }

    /**
     * Set the notification state of a characteristic to 'on' or 'off'.
     *
     * <p>The Client Characteristic Configuration descriptor is written with the indication value if the characteristic
     * only supports indications, otherwise with the notification value.
     *
     * @param serviceUUID        the service UUID the characteristic belongs to
     * @param characteristicUUID the characteristic's UUID
     * @param enable             true for setting notification on, false for turning it off
     * @return a future that completes when the descriptor write has been confirmed
     */
    @NotNull
    public CompletableFuture<Void> setNotify(@NotNull final UUID serviceUUID, @NotNull final UUID characteristicUUID, final boolean enable) {
        Objects.requireNonNull(serviceUUID, NO_VALID_SERVICE_UUID_PROVIDED);
        Objects.requireNonNull(characteristicUUID, NO_VALID_CHARACTERISTIC_UUID_PROVIDED);

        final CompletableFuture<Void> future = new CompletableFuture<>();
        final GattConnection gatt = requireConnection(OperationType.DESCRIPTOR_WRITE, future);
        if (gatt == null) return future;
        final BluetoothGattCharacteristic characteristic = requireCharacteristic(OperationType.DESCRIPTOR_WRITE, serviceUUID, characteristicUUID, future);
        if (characteristic == null) return future;

        final BluetoothGattDescriptor descriptor = characteristic.getDescriptor(CCC_DESCRIPTOR_UUID);
        if (descriptor == null) {
            Logger.e(TAG, "could not get CCC descriptor for characteristic %s", characteristicUUID);
            future.completeExceptionally(GattException.descriptorNotFound(characteristicUUID));
            return future;
        }

        final byte[] value;
        if (!enable) {
            value = DISABLE_NOTIFICATION_VALUE;
        } else if (characteristic.supportsIndicating() && !characteristic.supportsNotifying()) {
            value = ENABLE_INDICATION_VALUE;
        } else {
            value = ENABLE_NOTIFICATION_VALUE;
        }

        if (!commandStarted(OperationType.DESCRIPTOR_WRITE, () -> gatt.setCharacteristicNotification(characteristic, enable))) {
            Logger.e(TAG, "setCharacteristicNotification failed for characteristic: %s", characteristicUUID);
            future.completeExceptionally(GattException.startFailed(OperationType.DESCRIPTOR_WRITE));
            return future;
        }

        final CharacteristicKey key = CharacteristicKey.of(characteristic);
        if (enable) {
            notifyingCharacteristics.add(key);
        } else {
            notifyingCharacteristics.remove(key);
        }

        descriptorWriteRequests.register(OperationType.DESCRIPTOR_WRITE, future);
        if (!stillConnected(gatt, descriptorWriteRequests, OperationType.DESCRIPTOR_WRITE, future)) return future;
        if (commandStarted(OperationType.DESCRIPTOR_WRITE, () -> gatt.writeDescriptor(descriptor, value))) {
            Logger.i(TAG, "writing <%s> descriptor <%s> for characteristic <%s>", BluetoothBytes.toHex(value), descriptor.getUuid(), characteristicUUID);
        } else {
            descriptorWriteRequests.abort(OperationType.DESCRIPTOR_WRITE, future, GattException.startFailed(OperationType.DESCRIPTOR_WRITE));
        }
        return future;
    }

    /**
     * Request an MTU size used for a given connection.
     *
     * <p>Note that requesting an MTU should only take place once per connection, according to the Bluetooth standard.
     *
     * @param mtu the desired MTU size
     * @return a future that completes with the negotiated MTU
     * @throws IllegalArgumentException if the mtu is not between 23 and 517
     */
    @NotNull
    public CompletableFuture<Integer> requestMtu(final int mtu) {
        if (mtu < MIN_MTU || mtu > MAX_MTU) {
            throw new IllegalArgumentException("mtu must be between 23 and 517");
        }

        final CompletableFuture<Integer> future = new CompletableFuture<>();
        final GattConnection gatt = requireConnection(OperationType.REQUEST_MTU, future);
        if (gatt == null) return future;

        mtuRequests.register(OperationType.REQUEST_MTU, future);
        if (!stillConnected(gatt, mtuRequests, OperationType.REQUEST_MTU, future)) return future;
        if (commandStarted(OperationType.REQUEST_MTU, () -> gatt.requestMtu(mtu))) {
            Logger.i(TAG, "requesting MTU of %d", mtu);
        } else {
            mtuRequests.abort(OperationType.REQUEST_MTU, future, GattException.startFailed(OperationType.REQUEST_MTU));
        }
        return future;
    }

    /**
     * Get the current MTU size. Until a successful negotiation this is the initial MTU from the options.
     */
    public int getCurrentMtu() {
        return currentMtu;
    }

    /**
     * Boolean to indicate if the specified characteristic is currently notifying or indicating.
     *
     * @param serviceUUID        the service UUID the characteristic belongs to
     * @param characteristicUUID the characteristic's UUID
     * @return true if the characteristic is notifying or indicating, false if it is not
     */
    public boolean isNotifying(@NotNull final UUID serviceUUID, @NotNull final UUID characteristicUUID) {
        Objects.requireNonNull(serviceUUID, NO_VALID_SERVICE_UUID_PROVIDED);
        Objects.requireNonNull(characteristicUUID, NO_VALID_CHARACTERISTIC_UUID_PROVIDED);

        return notifyingCharacteristics.contains(new CharacteristicKey(characteristicUUID, serviceUUID));
    }

    /**
     * Get a set of characteristics that are currently notifying
     *
     * @return Set of characteristics or empty set
     */
    @NotNull
    public Set<CharacteristicKey> getNotifyingCharacteristics() {
        return Set.copyOf(notifyingCharacteristics);
    }

    public boolean isConnected() {
        return connection.getState() == ConnectionState.CONNECTED;
    }

    /**
     * Returns the bond state of the peripheral, independent of the connection state.
     */
    public boolean isBonded() {
        return device.getBondState() == BondState.BONDED;
    }

    @NotNull
    public BondState getBondState() {
        return device.getBondState();
    }

    @NotNull
    public ConnectionState getState() {
        return connection.getState();
    }

    /**
     * Get the mac address of the peripheral.
     *
     * @return the mac address of the peripheral
     */
    @NotNull
    public String getAddress() {
        return device.getAddress();
    }

    /**
     * Get the name of the peripheral, null if the stack does not know it.
     */
    @Nullable
    public String getName() {
        return device.getName();
    }

    @NotNull
    public PeripheralOptions getOptions() {
        return options;
    }

    /**
     * Attach or detach the sink for notifications. Notifications arriving while no sink is attached are dropped.
     */
    public void setNotificationSink(@Nullable final NotificationSink sink) {
        notificationDispatcher.setSink(sink);
    }

    /**
     * Attach or detach the sink for connection lifecycle events.
     */
    public void setEventSink(@Nullable final PeripheralEventSink sink) {
        eventEmitter.setSink(sink);
    }

    /**
     * Release the session. Pending requests fail with {@link GattError#SESSION_CLOSED}, a live connection is
     * closed immediately and both sinks are detached. Every later operation fails with {@link GattError#SESSION_CLOSED}.
     */
    public void close() {
        if (connection.isClosed()) return;

        connection.close();
        notificationDispatcher.setSink(null);
        eventEmitter.setSink(null);
        handler.shutdown();
    }

    int getPendingRequestCount() {
        return discoveryRequests.size() + readRequests.size() + writeRequests.size() + descriptorWriteRequests.size() + mtuRequests.size();
    }

    @Nullable
    private GattConnection requireConnection(@NotNull final OperationType operation, @NotNull final CompletableFuture<?> future) {
        if (connection.isClosed()) {
            future.completeExceptionally(GattException.sessionClosed(operation));
            return null;
        }

        final GattConnection gatt = connection.getConnection();
        if (gatt == null) {
            Logger.e(TAG, "%s: %s", operation, PERIPHERAL_NOT_CONNECTED);
            future.completeExceptionally(GattException.notConnected(operation));
        }
        return gatt;
    }

    @Nullable
    private BluetoothGattCharacteristic requireCharacteristic(@NotNull final OperationType operation, @NotNull final UUID serviceUUID, @NotNull final UUID characteristicUUID, @NotNull final CompletableFuture<?> future) {
        final BluetoothGattCharacteristic characteristic = catalog.getCharacteristic(serviceUUID, characteristicUUID);
        if (characteristic == null) {
            Logger.e(TAG, "characteristic %s not found in service %s", characteristicUUID, serviceUUID);
            future.completeExceptionally(GattException.characteristicNotFound(operation, serviceUUID, characteristicUUID));
        }
        return characteristic;
    }

    /**
     * A disconnect may have torn down the registries between the connection check and the registration.
     * The state changes before the teardown runs, so checking again after registering closes that gap.
     */
    private <K, V> boolean stillConnected(@NotNull final GattConnection gatt, @NotNull final OperationRegistry<K, V> registry, @NotNull final K key, @NotNull final CompletableFuture<V> future) {
        if (connection.isCurrent(gatt) && connection.getState() == ConnectionState.CONNECTED) return true;

        Logger.w(TAG, "%s: connection lost while registering the request", registry.getOperation());
        registry.abort(key, future, GattException.disconnected(registry.getOperation()));
        return false;
    }

    private boolean commandStarted(@NotNull final OperationType operation, @NotNull final BooleanSupplier command) {
        try {
            if (command.getAsBoolean()) return true;
            Logger.e(TAG, "%s could not be started", operation);
        } catch (RuntimeException ex) {
            Logger.e(TAG, ex, "%s threw while starting", operation);
        }
        return false;
    }

    private void failAllRequests(@NotNull final Function<OperationType, GattException> cause) {
        discoveryRequests.failAll(cause);
        readRequests.failAll(cause);
        writeRequests.failAll(cause);
        descriptorWriteRequests.failAll(cause);
        mtuRequests.failAll(cause);
    }

    private final class SessionListener implements ConnectionStateMachine.Listener {
        @Override
        public void onConnected() {
            eventEmitter.emit(PeripheralEvent.connected(getAddress()));
        }

        @Override
        public void onTearDown(@NotNull final Function<OperationType, GattException> cause) {
            failAllRequests(cause);
        }

        @Override
        public void onDisconnected(@NotNull final DisconnectReason reason, final boolean notify) {
            catalog.clear();
            notifyingCharacteristics.clear();
            if (notify) {
                eventEmitter.emit(PeripheralEvent.disconnected(getAddress(), reason));
            }
        }
    }

    /**
     * Callbacks from the radio stack. Anything reported for a handle other than the live one is ignored.
     */
    private final class PeripheralGattCallback implements GattCallback {

        @Override
        public void onConnectionStateChange(@NotNull final GattConnection gatt, final int status, final int newState) {
            connection.onConnectionStateChange(gatt, status, newState);
        }

        @Override
        public void onServicesDiscovered(@NotNull final GattConnection gatt, final int status) {
            if (isStale(gatt, "onServicesDiscovered")) return;

            if (status == GattStatus.SUCCESS.value) {
                catalog.replace(gatt.getServices());
                Logger.i(TAG, "discovered %d services for '%s'", catalog.getServices().size(), getAddress());
                discoveryRequests.resolve(OperationType.DISCOVER_SERVICES, null);
            } else {
                Logger.e(TAG, "service discovery failed due to internal error '%s', clearing services", GattStatus.fromValue(status));
                catalog.clear();
                discoveryRequests.reject(OperationType.DISCOVER_SERVICES, GattException.serviceDiscoveryFailed(status));
            }
        }

        @Override
        public void onCharacteristicRead(@NotNull final GattConnection gatt, @NotNull final BluetoothGattCharacteristic characteristic, @NotNull final byte[] value, final int status) {
            if (isStale(gatt, "onCharacteristicRead")) return;

            final CharacteristicKey key = CharacteristicKey.of(characteristic);
            if (status == GattStatus.SUCCESS.value) {
                readRequests.resolve(key, value.clone());
            } else {
                Logger.e(TAG, "read failed for characteristic <%s>, status '%s'", characteristic.getUuid(), GattStatus.fromValue(status));
                readRequests.reject(key, GattException.operationFailed(OperationType.READ, status));
            }
        }

        @Override
        public void onCharacteristicWrite(@NotNull final GattConnection gatt, @NotNull final BluetoothGattCharacteristic characteristic, final int status) {
            if (isStale(gatt, "onCharacteristicWrite")) return;

            final CharacteristicKey key = CharacteristicKey.of(characteristic);
            if (status == GattStatus.SUCCESS.value) {
                writeRequests.resolve(key, null);
            } else {
                Logger.e(TAG, "writing to characteristic <%s> failed, status '%s'", characteristic.getUuid(), GattStatus.fromValue(status));
                writeRequests.reject(key, GattException.operationFailed(OperationType.WRITE, status));
            }
        }

        @Override
        public void onCharacteristicChanged(@NotNull final GattConnection gatt, @NotNull final BluetoothGattCharacteristic characteristic, @NotNull final byte[] value) {
            if (isStale(gatt, "onCharacteristicChanged")) return;

            notificationDispatcher.dispatch(characteristic.getServiceUuid(), characteristic.getUuid(), value);
        }

        @Override
        public void onDescriptorWrite(@NotNull final GattConnection gatt, @NotNull final BluetoothGattDescriptor descriptor, final int status) {
            if (isStale(gatt, "onDescriptorWrite")) return;

            if (!descriptor.getUuid().equals(CCC_DESCRIPTOR_UUID)) {
                Logger.e(TAG, "unexpected write to descriptor <%s>", descriptor.getUuid());
                descriptorWriteRequests.reject(OperationType.DESCRIPTOR_WRITE, GattException.unexpectedDescriptor(descriptor.getUuid()));
            } else if (status != GattStatus.SUCCESS.value) {
                Logger.e(TAG, "failed to write <%s> for characteristic <%s>, status '%s'", descriptor.getUuid(), descriptor.getCharacteristic().getUuid(), GattStatus.fromValue(status));
                descriptorWriteRequests.reject(OperationType.DESCRIPTOR_WRITE, GattException.operationFailed(OperationType.DESCRIPTOR_WRITE, status));
            } else {
                descriptorWriteRequests.resolve(OperationType.DESCRIPTOR_WRITE, null);
            }
        }

        @Override
        public void onMtuChanged(@NotNull final GattConnection gatt, final int mtu, final int status) {
            if (isStale(gatt, "onMtuChanged")) return;

            if (status == GattStatus.SUCCESS.value) {
                currentMtu = mtu;
                Logger.i(TAG, "MTU changed to %d", mtu);
                mtuRequests.resolve(OperationType.REQUEST_MTU, mtu);
            } else {
                Logger.e(TAG, "change MTU failed, status '%s'", GattStatus.fromValue(status));
                mtuRequests.reject(OperationType.REQUEST_MTU, GattException.operationFailed(OperationType.REQUEST_MTU, status));
            }
        }

        private boolean isStale(@NotNull final GattConnection gatt, @NotNull final String callback) {
            if (connection.isCurrent(gatt)) return false;
            Logger.d(TAG, "ignoring %s from stale connection", callback);
            return true;
        }
    }
}
