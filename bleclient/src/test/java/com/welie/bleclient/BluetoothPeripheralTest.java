package com.welie.bleclient;

import org.junit.After;
import org.junit.Before;
import org.junit.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.InOrder;
import org.mockito.Mock;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import static com.welie.bleclient.BluetoothGattCharacteristic.PROPERTY_INDICATE;
import static com.welie.bleclient.BluetoothGattCharacteristic.PROPERTY_NOTIFY;
import static com.welie.bleclient.BluetoothGattCharacteristic.PROPERTY_READ;
import static com.welie.bleclient.BluetoothGattCharacteristic.PROPERTY_WRITE;
import static com.welie.bleclient.BluetoothGattDescriptor.CCC_DESCRIPTOR_UUID;
import static com.welie.bleclient.ConnectionState.CONNECTED;
import static com.welie.bleclient.ConnectionState.CONNECTING;
import static com.welie.bleclient.ConnectionState.DISCONNECTED;
import static com.welie.bleclient.ConnectionState.DISCONNECTING;
import static com.welie.bleclient.GattCallback.STATE_CONNECTED;
import static com.welie.bleclient.GattCallback.STATE_DISCONNECTED;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotNull;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.doAnswer;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.mockito.MockitoAnnotations.openMocks;

public class BluetoothPeripheralTest {
    private static final String ADDRESS = "12:23:34:98:76:54";
    private static final UUID SERVICE_UUID = UUID.fromString("00001809-0000-1000-8000-00805f9b34fb");
    private static final UUID OTHER_SERVICE_UUID = UUID.fromString("0000180a-0000-1000-8000-00805f9b34fb");
    private static final UUID TEMPERATURE_UUID = UUID.fromString("00002a1c-0000-1000-8000-00805f9b34fb");
    private static final UUID INTERVAL_UUID = UUID.fromString("00002a21-0000-1000-8000-00805f9b34fb");
    private static final UUID INDICATE_ONLY_UUID = UUID.fromString("00002a1e-0000-1000-8000-00805f9b34fb");
    private static final UUID USER_DESCRIPTION_UUID = UUID.fromString("00002901-0000-1000-8000-00805f9b34fb");

    private BluetoothPeripheral peripheral;

    @Mock
    private GattDevice device;

    @Mock
    private GattConnection gatt;

    @Mock
    private PeripheralEventSink eventSink;

    @Mock
    private NotificationSink notificationSink;

    @Captor
    ArgumentCaptor<GattCallback> captorCallback;

    @Captor
    ArgumentCaptor<PeripheralEvent> captorEvent;

    @Captor
    ArgumentCaptor<byte[]> captorValue;

    @Captor
    ArgumentCaptor<Notification> captorNotification;

    private BluetoothGattService service;
    private BluetoothGattCharacteristic temperature;
    private BluetoothGattCharacteristic interval;
    private BluetoothGattCharacteristic indicateOnly;

    @Before
    public void setUp() {
        openMocks(this);

        temperature = new BluetoothGattCharacteristic(TEMPERATURE_UUID, SERVICE_UUID, PROPERTY_READ | PROPERTY_NOTIFY, Collections.singletonList(CCC_DESCRIPTOR_UUID));
        interval = new BluetoothGattCharacteristic(INTERVAL_UUID, SERVICE_UUID, PROPERTY_READ | PROPERTY_WRITE, Collections.singletonList(USER_DESCRIPTION_UUID));
        indicateOnly = new BluetoothGattCharacteristic(INDICATE_ONLY_UUID, SERVICE_UUID, PROPERTY_INDICATE, Collections.singletonList(CCC_DESCRIPTOR_UUID));
        service = new BluetoothGattService(SERVICE_UUID, true, List.of(temperature, interval, indicateOnly));

        when(device.getAddress()).thenReturn(ADDRESS);
        when(device.getName()).thenReturn("Thermometer");
        when(device.getBondState()).thenReturn(BondState.NONE);
        when(device.connectGatt(anyBoolean(), any(GattCallback.class))).thenReturn(gatt);
        stubCommands(gatt);

        peripheral = new BluetoothPeripheral(device, quickOptions().build());
        peripheral.setEventSink(eventSink);
    }

    @After
    public void tearDown() {
        peripheral.close();
    }

    @Test
    public void Given_a_not_connected_peripheral_when_connect_is_called_and_succeeds_then_the_state_is_connected() {
        // When
        CompletableFuture<Void> future = peripheral.connect();

        // Then
        assertEquals(CONNECTING, peripheral.getState());
        verify(device).connectGatt(eq(false), captorCallback.capture());

        // When
        captorCallback.getValue().onConnectionStateChange(gatt, HciStatus.SUCCESS.value, STATE_CONNECTED);

        // Then
        assertTrue(future.isDone());
        assertFalse(future.isCompletedExceptionally());
        assertEquals(CONNECTED, peripheral.getState());
        assertTrue(peripheral.isConnected());
        verify(eventSink, times(1)).onEvent(captorEvent.capture());
        assertEquals(PeripheralEvent.Type.DEVICE_CONNECTED, captorEvent.getValue().getType());
        assertEquals(ADDRESS, captorEvent.getValue().getAddress());
    }

    @Test
    public void Given_a_connecting_peripheral_when_the_connection_fails_with_status_133_then_the_handle_is_closed_and_the_connect_fails() {
        // Given
        CompletableFuture<Void> future = peripheral.connect();
        verify(device).connectGatt(anyBoolean(), captorCallback.capture());

        // When
        captorCallback.getValue().onConnectionStateChange(gatt, HciStatus.ERROR.value, STATE_DISCONNECTED);

        // Then
        verify(gatt).close();
        GattException exception = failure(future);
        assertEquals(GattError.CONNECTION_FAILED, exception.getError());
        assertEquals(DisconnectReason.OUT_OF_RANGE, exception.getReason());
        assertEquals(133, exception.getStatus());
        awaitState(DISCONNECTED);
        assertFalse(peripheral.isConnected());
        verifyNoInteractions(eventSink);
    }

    @Test
    public void Given_a_connected_peripheral_when_the_link_is_lost_then_the_handle_is_closed_before_the_state_is_disconnected() {
        // Given
        GattCallback callback = connectPeripheral();
        List<ConnectionState> statesDuringClose = new ArrayList<>();
        doAnswer(invocation -> {
            statesDuringClose.add(peripheral.getState());
            return null;
        }).when(gatt).close();

        // When
        callback.onConnectionStateChange(gatt, HciStatus.CONNECTION_TIMEOUT.value, STATE_DISCONNECTED);

        // Then
        assertEquals(1, statesDuringClose.size());
        assertEquals(ConnectionState.CLEANING_UP, statesDuringClose.get(0));
        awaitState(DISCONNECTED);
    }

    @Test
    public void Given_a_connected_peripheral_when_connect_is_called_then_it_fails_with_already_connected() {
        // Given
        connectPeripheral();

        // When
        CompletableFuture<Void> future = peripheral.connect();

        // Then
        assertEquals(GattError.ALREADY_CONNECTED, failure(future).getError());
        verify(device, times(1)).connectGatt(anyBoolean(), any(GattCallback.class));
        assertEquals(CONNECTED, peripheral.getState());
    }

    @Test
    public void When_the_connection_cannot_be_started_then_connect_fails_with_start_failed() {
        // Given
        when(device.connectGatt(anyBoolean(), any(GattCallback.class))).thenReturn(null);

        // When
        CompletableFuture<Void> future = peripheral.connect();

        // Then
        assertEquals(GattError.START_FAILED, failure(future).getError());
        assertEquals(DISCONNECTED, peripheral.getState());
    }

    @Test
    public void When_calling_disconnect_on_an_unconnected_peripheral_then_it_completes_without_side_effects() {
        // When
        CompletableFuture<Void> future = peripheral.disconnect();

        // Then
        assertTrue(future.isDone());
        assertFalse(future.isCompletedExceptionally());
        assertEquals(DISCONNECTED, peripheral.getState());
        verifyNoInteractions(gatt);
        verifyNoInteractions(eventSink);
    }

    @Test
    public void Given_a_connected_peripheral_with_pending_requests_when_disconnect_is_called_then_everything_is_cleared() {
        // Given
        GattCallback callback = connectAndDiscover();
        CompletableFuture<byte[]> read = peripheral.readCharacteristic(SERVICE_UUID, TEMPERATURE_UUID);
        CompletableFuture<Integer> mtu = peripheral.requestMtu(185);

        // When
        CompletableFuture<Void> future = peripheral.disconnect();

        // Then
        assertEquals(GattError.DISCONNECTED, failure(read).getError());
        assertEquals(GattError.DISCONNECTED, failure(mtu).getError());
        assertEquals(0, peripheral.getPendingRequestCount());
        assertEquals(DISCONNECTING, peripheral.getState());
        verify(gatt).disconnect();

        // When
        callback.onConnectionStateChange(gatt, HciStatus.SUCCESS.value, STATE_DISCONNECTED);

        // Then
        assertTrue(future.isDone());
        verify(gatt).close();
        assertTrue(peripheral.getServices().isEmpty());
        assertNull(peripheral.getCharacteristic(SERVICE_UUID, TEMPERATURE_UUID));
        verify(eventSink, times(2)).onEvent(captorEvent.capture());
        PeripheralEvent event = captorEvent.getAllValues().get(1);
        assertEquals(PeripheralEvent.Type.DEVICE_DISCONNECTED, event.getType());
        assertEquals(DisconnectReason.NORMAL, event.getReason());
        awaitState(DISCONNECTED);
    }

    @Test
    public void Given_a_disconnect_in_progress_when_disconnect_is_called_again_then_it_completes_immediately() {
        // Given
        connectPeripheral();
        CompletableFuture<Void> first = peripheral.disconnect();

        // When
        CompletableFuture<Void> second = peripheral.disconnect();

        // Then
        assertTrue(second.isDone());
        assertFalse(first.isDone());
        verify(gatt, times(1)).disconnect();
    }

    @Test
    public void Given_a_connected_peripheral_when_the_stack_never_reports_the_disconnect_then_cleanup_still_happens() {
        // Given
        connectPeripheral();

        // When
        CompletableFuture<Void> future = peripheral.disconnect();

        // Then
        verify(gatt, timeout(2000)).close();
        assertNull(failureOrNull(future));
        awaitState(DISCONNECTED);
        verify(eventSink, timeout(2000).times(2)).onEvent(any(PeripheralEvent.class));
    }

    @Test
    public void Given_a_connected_peripheral_when_duplicate_terminal_callbacks_arrive_then_cleanup_runs_once() {
        // Given
        GattCallback callback = connectPeripheral();

        // When
        callback.onConnectionStateChange(gatt, HciStatus.CONNECTION_TIMEOUT.value, STATE_DISCONNECTED);
        callback.onConnectionStateChange(gatt, HciStatus.CONNECTION_TIMEOUT.value, STATE_DISCONNECTED);
        callback.onConnectionStateChange(gatt, HciStatus.SUCCESS.value, STATE_DISCONNECTED);

        // Then
        verify(gatt, times(1)).close();
        verify(eventSink, times(2)).onEvent(captorEvent.capture());
        PeripheralEvent event = captorEvent.getAllValues().get(1);
        assertEquals(PeripheralEvent.Type.DEVICE_DISCONNECTED, event.getType());
        assertEquals(DisconnectReason.OUT_OF_RANGE, event.getReason());
    }

    @Test
    public void Given_a_disconnected_peripheral_when_reconnecting_then_callbacks_of_the_old_connection_are_ignored() {
        // Given
        GattConnection secondGatt = mock(GattConnection.class);
        stubCommands(secondGatt);
        when(device.connectGatt(anyBoolean(), any(GattCallback.class))).thenReturn(gatt, secondGatt);
        GattCallback callback = connectPeripheral();
        callback.onConnectionStateChange(gatt, HciStatus.REMOTE_USER_TERMINATED_CONNECTION.value, STATE_DISCONNECTED);

        // When
        CompletableFuture<Void> future = peripheral.connect();
        callback.onConnectionStateChange(gatt, HciStatus.CONNECTION_TIMEOUT.value, STATE_DISCONNECTED);
        callback.onConnectionStateChange(secondGatt, HciStatus.SUCCESS.value, STATE_CONNECTED);

        // Then
        assertTrue(future.isDone());
        assertFalse(future.isCompletedExceptionally());
        assertEquals(CONNECTED, peripheral.getState());
        verify(gatt, times(1)).close();
        verify(secondGatt, never()).close();

        // When
        peripheral.discoverServices();
        callback.onServicesDiscovered(gatt, GattStatus.SUCCESS.value);

        // Then
        assertTrue(peripheral.getServices().isEmpty());
    }

    @Test
    public void Given_a_connecting_peripheral_when_disconnect_is_called_then_the_connect_fails_and_no_event_is_emitted() {
        // Given
        CompletableFuture<Void> connect = peripheral.connect();

        // When
        CompletableFuture<Void> disconnect = peripheral.disconnect();

        // Then
        assertEquals(GattError.DISCONNECTED, failure(connect).getError());
        assertNull(failureOrNull(disconnect));
        verify(gatt).disconnect();
        verify(gatt).close();
        verifyNoInteractions(eventSink);
    }

    @Test
    public void Given_a_connecting_peripheral_when_the_connect_timeout_expires_then_the_connect_fails_with_timeout() {
        // Given
        peripheral.close();
        peripheral = new BluetoothPeripheral(device, quickOptions().connectTimeout(100).build());
        peripheral.setEventSink(eventSink);

        // When
        CompletableFuture<Void> future = peripheral.connect();

        // Then
        GattException exception = failure(future);
        assertEquals(GattError.CONNECTION_FAILED, exception.getError());
        assertEquals(DisconnectReason.TIMEOUT, exception.getReason());
        InOrder inOrder = inOrder(gatt);
        inOrder.verify(gatt).disconnect();
        inOrder.verify(gatt).close();
        verifyNoInteractions(eventSink);
    }

    @Test
    public void Given_a_connected_peripheral_when_services_are_discovered_then_the_catalog_lists_them() {
        // Given
        GattCallback callback = connectPeripheral();

        // When
        CompletableFuture<Void> future = peripheral.discoverServices();
        callback.onServicesDiscovered(gatt, GattStatus.SUCCESS.value);

        // Then
        assertNull(failureOrNull(future));
        List<BluetoothGattService> services = peripheral.getServices();
        assertEquals(1, services.size());
        assertEquals(SERVICE_UUID, services.get(0).getUuid());
        assertTrue(services.get(0).isPrimary());
        BluetoothGattCharacteristic characteristic = peripheral.getCharacteristic(SERVICE_UUID, TEMPERATURE_UUID);
        assertNotNull(characteristic);
        assertTrue(characteristic.supportsNotifying());
        assertEquals(List.of(CCC_DESCRIPTOR_UUID), characteristic.getDescriptorUuids());
    }

    @Test
    public void Given_discovered_services_when_a_rediscovery_fails_then_the_catalog_is_cleared() {
        // Given
        GattCallback callback = connectAndDiscover();

        // When
        CompletableFuture<Void> future = peripheral.discoverServices();
        callback.onServicesDiscovered(gatt, GattStatus.INTERNAL_ERROR.value);

        // Then
        GattException exception = failure(future);
        assertEquals(GattError.SERVICE_DISCOVERY_FAILED, exception.getError());
        assertEquals(GattStatus.INTERNAL_ERROR.value, exception.getStatus());
        assertTrue(peripheral.getServices().isEmpty());
    }

    @Test
    public void Given_a_not_connected_peripheral_when_discoverServices_is_called_then_it_fails_with_not_connected() {
        // When
        CompletableFuture<Void> future = peripheral.discoverServices();

        // Then
        assertEquals(GattError.NOT_CONNECTED, failure(future).getError());
        verifyNoInteractions(gatt);
    }

    @Test
    public void Given_a_connected_peripheral_without_discovery_when_reading_then_it_fails_with_characteristic_not_found() {
        // Given
        connectPeripheral();

        // When
        CompletableFuture<byte[]> future = peripheral.readCharacteristic(SERVICE_UUID, TEMPERATURE_UUID);

        // Then
        assertEquals(GattError.CHARACTERISTIC_NOT_FOUND, failure(future).getError());
        verify(gatt, never()).readCharacteristic(any(BluetoothGattCharacteristic.class));
        assertEquals(0, peripheral.getPendingRequestCount());
    }

    @Test
    public void Given_a_not_connected_peripheral_when_reading_writing_or_subscribing_then_it_fails_with_not_connected() {
        assertEquals(GattError.NOT_CONNECTED, failure(peripheral.readCharacteristic(SERVICE_UUID, TEMPERATURE_UUID)).getError());
        assertEquals(GattError.NOT_CONNECTED, failure(peripheral.writeCharacteristic(SERVICE_UUID, INTERVAL_UUID, new byte[]{1}, WriteType.WITH_RESPONSE)).getError());
        assertEquals(GattError.NOT_CONNECTED, failure(peripheral.setNotify(SERVICE_UUID, TEMPERATURE_UUID, true)).getError());
        assertEquals(GattError.NOT_CONNECTED, failure(peripheral.requestMtu(185)).getError());
    }

    @Test
    public void Given_a_discovered_characteristic_when_it_is_read_then_the_value_is_returned() {
        // Given
        GattCallback callback = connectAndDiscover();

        // When
        CompletableFuture<byte[]> future = peripheral.readCharacteristic(SERVICE_UUID, TEMPERATURE_UUID);
        verify(gatt).readCharacteristic(temperature);
        callback.onCharacteristicRead(gatt, temperature, new byte[]{0x01, 0x02}, GattStatus.SUCCESS.value);

        // Then
        assertArrayEquals(new byte[]{0x01, 0x02}, future.getNow(null));
    }

    @Test
    public void Given_a_pending_read_when_the_same_characteristic_is_read_again_then_the_first_read_is_overwritten() {
        // Given
        GattCallback callback = connectAndDiscover();
        CompletableFuture<byte[]> first = peripheral.readCharacteristic(SERVICE_UUID, TEMPERATURE_UUID);

        // When
        CompletableFuture<byte[]> second = peripheral.readCharacteristic(SERVICE_UUID, TEMPERATURE_UUID);
        callback.onCharacteristicRead(gatt, temperature, new byte[]{0x05}, GattStatus.SUCCESS.value);

        // Then
        GattException exception = failure(first);
        assertEquals(GattError.OVERWRITTEN, exception.getError());
        assertEquals(OperationType.READ, exception.getOperation());
        assertArrayEquals(new byte[]{0x05}, second.getNow(null));
    }

    @Test
    public void Given_pending_reads_on_different_characteristics_then_each_receives_its_own_value() {
        // Given
        GattCallback callback = connectAndDiscover();
        CompletableFuture<byte[]> temperatureRead = peripheral.readCharacteristic(SERVICE_UUID, TEMPERATURE_UUID);
        CompletableFuture<byte[]> intervalRead = peripheral.readCharacteristic(SERVICE_UUID, INTERVAL_UUID);

        // When
        callback.onCharacteristicRead(gatt, interval, new byte[]{0x3C}, GattStatus.SUCCESS.value);
        callback.onCharacteristicRead(gatt, temperature, new byte[]{0x24}, GattStatus.SUCCESS.value);

        // Then
        assertArrayEquals(new byte[]{0x24}, temperatureRead.getNow(null));
        assertArrayEquals(new byte[]{0x3C}, intervalRead.getNow(null));
    }

    @Test
    public void Given_a_write_with_response_when_the_peripheral_reports_status_5_then_the_write_fails_and_is_removed() {
        // Given
        GattCallback callback = connectAndDiscover();

        // When
        CompletableFuture<Void> future = peripheral.writeCharacteristic(SERVICE_UUID, INTERVAL_UUID, new byte[]{0x3C, 0x00}, WriteType.WITH_RESPONSE);
        callback.onCharacteristicWrite(gatt, interval, GattStatus.INSUFFICIENT_AUTHENTICATION.value);

        // Then
        GattException exception = failure(future);
        assertEquals(GattError.OPERATION_FAILED, exception.getError());
        assertEquals(OperationType.WRITE, exception.getOperation());
        assertEquals(5, exception.getStatus());
        assertEquals(0, peripheral.getPendingRequestCount());
    }

    @Test
    public void When_writing_then_the_value_is_copied_and_the_write_type_is_passed_on() {
        // Given
        GattCallback callback = connectAndDiscover();
        byte[] value = {0x01, 0x02};

        // When
        CompletableFuture<Void> future = peripheral.writeCharacteristic(SERVICE_UUID, INTERVAL_UUID, value, WriteType.WITHOUT_RESPONSE);
        value[0] = 0x7F;

        // Then
        verify(gatt).writeCharacteristic(eq(interval), captorValue.capture(), eq(WriteType.WITHOUT_RESPONSE.writeType));
        assertArrayEquals(new byte[]{0x01, 0x02}, captorValue.getValue());

        // When
        callback.onCharacteristicWrite(gatt, interval, GattStatus.SUCCESS.value);

        // Then
        assertNull(failureOrNull(future));
    }

    @Test
    public void When_the_stack_refuses_a_read_then_it_fails_with_start_failed_and_nothing_stays_pending() {
        // Given
        connectAndDiscover();
        when(gatt.readCharacteristic(any(BluetoothGattCharacteristic.class))).thenReturn(false);

        // When
        CompletableFuture<byte[]> future = peripheral.readCharacteristic(SERVICE_UUID, TEMPERATURE_UUID);

        // Then
        assertEquals(GattError.START_FAILED, failure(future).getError());
        assertEquals(0, peripheral.getPendingRequestCount());
    }

    @Test
    public void When_setNotify_is_called_then_the_notification_value_is_written_to_the_ccc_descriptor() {
        // Given
        GattCallback callback = connectAndDiscover();

        // When
        CompletableFuture<Void> future = peripheral.setNotify(SERVICE_UUID, TEMPERATURE_UUID, true);

        // Then
        verify(gatt).setCharacteristicNotification(temperature, true);
        ArgumentCaptor<BluetoothGattDescriptor> captorDescriptor = ArgumentCaptor.forClass(BluetoothGattDescriptor.class);
        verify(gatt).writeDescriptor(captorDescriptor.capture(), captorValue.capture());
        assertEquals(CCC_DESCRIPTOR_UUID, captorDescriptor.getValue().getUuid());
        assertArrayEquals(BluetoothGattDescriptor.ENABLE_NOTIFICATION_VALUE, captorValue.getValue());

        // When
        callback.onDescriptorWrite(gatt, captorDescriptor.getValue(), GattStatus.SUCCESS.value);

        // Then
        assertNull(failureOrNull(future));
        assertTrue(peripheral.isNotifying(SERVICE_UUID, TEMPERATURE_UUID));
        assertEquals(1, peripheral.getNotifyingCharacteristics().size());
    }

    @Test
    public void When_setNotify_is_called_on_an_indicate_only_characteristic_then_the_indication_value_is_written() {
        // Given
        connectAndDiscover();

        // When
        peripheral.setNotify(SERVICE_UUID, INDICATE_ONLY_UUID, true);

        // Then
        verify(gatt).writeDescriptor(any(BluetoothGattDescriptor.class), captorValue.capture());
        assertArrayEquals(BluetoothGattDescriptor.ENABLE_INDICATION_VALUE, captorValue.getValue());
    }

    @Test
    public void Given_a_pending_subscribe_when_unsubscribing_then_the_subscribe_is_overwritten() {
        // Given
        GattCallback callback = connectAndDiscover();
        CompletableFuture<Void> subscribe = peripheral.setNotify(SERVICE_UUID, TEMPERATURE_UUID, true);

        // When
        CompletableFuture<Void> unsubscribe = peripheral.setNotify(SERVICE_UUID, TEMPERATURE_UUID, false);

        // Then
        assertEquals(GattError.OVERWRITTEN, failure(subscribe).getError());
        assertFalse(unsubscribe.isDone());

        // When
        callback.onDescriptorWrite(gatt, temperature.getDescriptor(CCC_DESCRIPTOR_UUID), GattStatus.SUCCESS.value);

        // Then
        assertNull(failureOrNull(unsubscribe));
        assertFalse(peripheral.isNotifying(SERVICE_UUID, TEMPERATURE_UUID));
    }

    @Test
    public void When_setNotify_is_called_on_a_characteristic_without_ccc_descriptor_then_it_fails_with_descriptor_not_found() {
        // Given
        connectAndDiscover();

        // When
        CompletableFuture<Void> future = peripheral.setNotify(SERVICE_UUID, INTERVAL_UUID, true);

        // Then
        assertEquals(GattError.DESCRIPTOR_NOT_FOUND, failure(future).getError());
        verify(gatt, never()).writeDescriptor(any(BluetoothGattDescriptor.class), any(byte[].class));
    }

    @Test
    public void Given_a_pending_subscribe_when_another_descriptor_is_written_then_it_fails_with_unexpected_descriptor() {
        // Given
        GattCallback callback = connectAndDiscover();
        CompletableFuture<Void> future = peripheral.setNotify(SERVICE_UUID, TEMPERATURE_UUID, true);

        // When
        callback.onDescriptorWrite(gatt, interval.getDescriptor(USER_DESCRIPTION_UUID), GattStatus.SUCCESS.value);

        // Then
        assertEquals(GattError.UNEXPECTED_DESCRIPTOR, failure(future).getError());
    }

    @Test
    public void Given_a_pending_subscribe_when_the_descriptor_write_fails_then_the_status_is_reported() {
        // Given
        GattCallback callback = connectAndDiscover();
        CompletableFuture<Void> future = peripheral.setNotify(SERVICE_UUID, TEMPERATURE_UUID, true);

        // When
        callback.onDescriptorWrite(gatt, temperature.getDescriptor(CCC_DESCRIPTOR_UUID), GattStatus.WRITE_NOT_PERMITTED.value);

        // Then
        GattException exception = failure(future);
        assertEquals(GattError.OPERATION_FAILED, exception.getError());
        assertEquals(OperationType.DESCRIPTOR_WRITE, exception.getOperation());
        assertEquals(GattStatus.WRITE_NOT_PERMITTED.value, exception.getStatus());
    }

    @Test
    public void When_requesting_an_mtu_and_it_succeeds_then_the_new_mtu_is_returned_and_cached() {
        // Given
        GattCallback callback = connectPeripheral();

        // When
        CompletableFuture<Integer> future = peripheral.requestMtu(185);
        verify(gatt).requestMtu(185);
        callback.onMtuChanged(gatt, 185, GattStatus.SUCCESS.value);

        // Then
        assertEquals(Integer.valueOf(185), future.getNow(null));
        assertEquals(185, peripheral.getCurrentMtu());
    }

    @Test
    public void When_requesting_an_mtu_and_it_fails_then_the_cached_mtu_is_unchanged() {
        // Given
        GattCallback callback = connectPeripheral();

        // When
        CompletableFuture<Integer> future = peripheral.requestMtu(185);
        callback.onMtuChanged(gatt, 185, GattStatus.REQUEST_NOT_SUPPORTED.value);

        // Then
        GattException exception = failure(future);
        assertEquals(GattError.OPERATION_FAILED, exception.getError());
        assertEquals(OperationType.REQUEST_MTU, exception.getOperation());
        assertEquals(PeripheralOptions.DEFAULT_MTU, peripheral.getCurrentMtu());
    }

    @Test
    public void When_the_peer_changes_the_mtu_then_the_cached_mtu_is_updated() {
        // Given
        GattCallback callback = connectPeripheral();

        // When
        callback.onMtuChanged(gatt, 247, GattStatus.SUCCESS.value);

        // Then
        assertEquals(247, peripheral.getCurrentMtu());
    }

    @Test(expected = IllegalArgumentException.class)
    public void When_requesting_an_mtu_that_is_too_small_then_an_exception_is_thrown() {
        peripheral.requestMtu(22);
    }

    @Test
    public void Given_a_notification_sink_when_a_notification_arrives_then_it_is_delivered_as_base64() {
        // Given
        GattCallback callback = connectAndDiscover();
        peripheral.setNotificationSink(notificationSink);

        // When
        callback.onCharacteristicChanged(gatt, temperature, new byte[]{0x01, 0x02, 0x03});

        // Then
        verify(notificationSink).onNotification(captorNotification.capture());
        Notification notification = captorNotification.getValue();
        assertEquals(SERVICE_UUID, notification.getServiceUuid());
        assertEquals(TEMPERATURE_UUID, notification.getCharacteristicUuid());
        assertEquals("AQID", notification.getData());
        assertArrayEquals(new byte[]{0x01, 0x02, 0x03}, notification.getValue());
    }

    @Test
    public void Given_no_notification_sink_when_a_notification_arrives_then_it_is_dropped() {
        // Given
        GattCallback callback = connectAndDiscover();
        callback.onCharacteristicChanged(gatt, temperature, new byte[]{0x01});

        // When
        peripheral.setNotificationSink(notificationSink);

        // Then
        verifyNoInteractions(notificationSink);
    }

    @Test
    public void When_the_device_is_bonded_then_isBonded_is_true_regardless_of_connection_state() {
        // Given
        when(device.getBondState()).thenReturn(BondState.BONDED);

        // Then
        assertTrue(peripheral.isBonded());
        assertFalse(peripheral.isConnected());
    }

    @Test
    public void When_calling_getAddress_then_the_peripherals_address_is_returned() {
        assertEquals(ADDRESS, peripheral.getAddress());
        assertEquals("Thermometer", peripheral.getName());
    }

    @Test
    public void Given_a_request_timeout_when_the_stack_never_answers_then_the_request_fails_with_timeout() {
        // Given
        peripheral.close();
        peripheral = new BluetoothPeripheral(device, quickOptions().requestTimeout(100).build());
        GattCallback callback = connectAndDiscover();

        // When
        CompletableFuture<byte[]> future = peripheral.readCharacteristic(SERVICE_UUID, TEMPERATURE_UUID);

        // Then
        GattException exception = failure(future);
        assertEquals(GattError.TIMEOUT, exception.getError());
        assertEquals(OperationType.READ, exception.getOperation());
        assertEquals(0, peripheral.getPendingRequestCount());

        // A late answer is ignored
        callback.onCharacteristicRead(gatt, temperature, new byte[]{0x01}, GattStatus.SUCCESS.value);
    }

    @Test
    public void Given_a_connected_peripheral_when_the_session_is_closed_then_everything_is_released() {
        // Given
        connectPeripheral();
        CompletableFuture<Integer> mtu = peripheral.requestMtu(185);

        // When
        peripheral.close();

        // Then
        assertEquals(GattError.SESSION_CLOSED, failure(mtu).getError());
        verify(gatt).disconnect();
        verify(gatt).close();
        assertEquals(DISCONNECTED, peripheral.getState());
        verify(eventSink, times(2)).onEvent(captorEvent.capture());
        assertEquals(PeripheralEvent.Type.DEVICE_DISCONNECTED, captorEvent.getValue().getType());
        assertEquals(GattError.SESSION_CLOSED, failure(peripheral.connect()).getError());
        assertEquals(GattError.SESSION_CLOSED, failure(peripheral.readCharacteristic(SERVICE_UUID, TEMPERATURE_UUID)).getError());
    }

    @Test
    public void Given_a_connected_peripheral_when_connecting_again_as_soon_as_the_disconnect_completes_then_the_connect_is_accepted() {
        // Given
        GattConnection secondGatt = mock(GattConnection.class);
        stubCommands(secondGatt);
        when(device.connectGatt(anyBoolean(), any(GattCallback.class))).thenReturn(gatt, secondGatt);
        GattCallback callback = connectPeripheral();

        // When
        CompletableFuture<Void> reconnect = peripheral.disconnect().thenCompose(v -> peripheral.connect());
        callback.onConnectionStateChange(gatt, HciStatus.SUCCESS.value, STATE_DISCONNECTED);

        // Then
        verify(gatt).close();
        verify(device, times(2)).connectGatt(anyBoolean(), any(GattCallback.class));
        assertEquals(CONNECTING, peripheral.getState());

        // When
        callback.onConnectionStateChange(secondGatt, HciStatus.SUCCESS.value, STATE_CONNECTED);

        // Then
        assertNull(failureOrNull(reconnect));
        assertEquals(CONNECTED, peripheral.getState());
    }

    @Test
    public void Given_a_connect_that_fails_with_status_133_when_retrying_from_the_failure_then_the_retry_is_accepted() {
        // Given
        GattConnection secondGatt = mock(GattConnection.class);
        stubCommands(secondGatt);
        when(device.connectGatt(anyBoolean(), any(GattCallback.class))).thenReturn(gatt, secondGatt);
        CompletableFuture<Void> attempt = peripheral.connect()
                .handle((v, e) -> e == null ? CompletableFuture.<Void>completedFuture(null) : peripheral.connect())
                .thenCompose(future -> future);
        verify(device).connectGatt(anyBoolean(), captorCallback.capture());
        GattCallback callback = captorCallback.getValue();

        // When
        callback.onConnectionStateChange(gatt, HciStatus.ERROR.value, STATE_DISCONNECTED);

        // Then
        verify(gatt).close();
        verify(device, times(2)).connectGatt(anyBoolean(), any(GattCallback.class));
        assertFalse(attempt.isDone());

        // When
        callback.onConnectionStateChange(secondGatt, HciStatus.SUCCESS.value, STATE_CONNECTED);

        // Then
        assertNull(failureOrNull(attempt));
        assertTrue(peripheral.isConnected());
    }

    @Test
    public void Given_a_disconnect_while_a_subscribe_is_being_issued_then_the_subscribe_fails_and_nothing_stays_pending() {
        // Given
        connectAndDiscover();
        doAnswer(invocation -> {
            peripheral.disconnect();
            return true;
        }).when(gatt).setCharacteristicNotification(any(BluetoothGattCharacteristic.class), anyBoolean());

        // When
        CompletableFuture<Void> future = peripheral.setNotify(SERVICE_UUID, TEMPERATURE_UUID, true);

        // Then
        GattException exception = failure(future);
        assertEquals(GattError.DISCONNECTED, exception.getError());
        assertEquals(OperationType.DESCRIPTOR_WRITE, exception.getOperation());
        assertEquals(0, peripheral.getPendingRequestCount());
        verify(gatt, never()).writeDescriptor(any(BluetoothGattDescriptor.class), any(byte[].class));
    }

    @Test
    public void When_writing_without_response_by_flag_then_the_write_type_is_without_response() {
        // Given
        connectAndDiscover();

        // When
        peripheral.writeCharacteristic(SERVICE_UUID, INTERVAL_UUID, new byte[]{0x01}, false);

        // Then
        verify(gatt).writeCharacteristic(eq(interval), any(byte[].class), eq(WriteType.WITHOUT_RESPONSE.writeType));
    }

    private static PeripheralOptions.Builder quickOptions() {
        return PeripheralOptions.builder()
                .connectTimeout(5000)
                .requestTimeout(0)
                .disconnectTimeout(300)
                .cleanupGracePeriod(50);
    }

    private void stubCommands(GattConnection connection) {
        when(connection.discoverServices()).thenReturn(true);
        when(connection.getServices()).thenReturn(List.of(service));
        when(connection.readCharacteristic(any(BluetoothGattCharacteristic.class))).thenReturn(true);
        when(connection.writeCharacteristic(any(BluetoothGattCharacteristic.class), any(byte[].class), anyInt())).thenReturn(true);
        when(connection.setCharacteristicNotification(any(BluetoothGattCharacteristic.class), anyBoolean())).thenReturn(true);
        when(connection.writeDescriptor(any(BluetoothGattDescriptor.class), any(byte[].class))).thenReturn(true);
        when(connection.requestMtu(anyInt())).thenReturn(true);
    }

    private GattCallback connectPeripheral() {
        CompletableFuture<Void> future = peripheral.connect();
        verify(device, timeout(1000).atLeastOnce()).connectGatt(anyBoolean(), captorCallback.capture());
        GattCallback callback = captorCallback.getValue();
        callback.onConnectionStateChange(gatt, HciStatus.SUCCESS.value, STATE_CONNECTED);
        assertTrue(future.isDone());
        return callback;
    }

    private GattCallback connectAndDiscover() {
        GattCallback callback = connectPeripheral();
        CompletableFuture<Void> future = peripheral.discoverServices();
        callback.onServicesDiscovered(gatt, GattStatus.SUCCESS.value);
        assertTrue(future.isDone());
        return callback;
    }

    private void awaitState(ConnectionState expected) {
        long deadline = System.currentTimeMillis() + 2000;
        while (peripheral.getState() != expected && System.currentTimeMillis() < deadline) {
            try {
                Thread.sleep(10);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                break;
            }
        }
        assertEquals(expected, peripheral.getState());
    }

    private static GattException failure(CompletableFuture<?> future) {
        GattException exception = failureOrNull(future);
        if (exception == null) {
            throw new AssertionError("expected the request to fail");
        }
        return exception;
    }

    private static GattException failureOrNull(CompletableFuture<?> future) {
        try {
            future.get(2, TimeUnit.SECONDS);
            return null;
        } catch (ExecutionException e) {
            return (GattException) e.getCause();
        } catch (InterruptedException | TimeoutException e) {
            throw new AssertionError("request did not complete", e);
        }
    }
}
