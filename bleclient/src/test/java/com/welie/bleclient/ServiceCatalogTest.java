package com.welie.bleclient;

import org.junit.Test;

import java.util.Collections;
import java.util.List;
import java.util.UUID;

import static com.welie.bleclient.BluetoothGattCharacteristic.PROPERTY_NOTIFY;
import static com.welie.bleclient.BluetoothGattCharacteristic.PROPERTY_READ;
import static com.welie.bleclient.BluetoothGattDescriptor.CCC_DESCRIPTOR_UUID;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertTrue;

public class ServiceCatalogTest {
    private static final UUID BATTERY_SERVICE_UUID = UUID.fromString("0000180f-0000-1000-8000-00805f9b34fb");
    private static final UUID VENDOR_SERVICE_UUID = UUID.fromString("6e400001-b5a3-f393-e0a9-e50e24dcca9e");
    private static final UUID LEVEL_UUID = UUID.fromString("00002a19-0000-1000-8000-00805f9b34fb");

    private final ServiceCatalog catalog = new ServiceCatalog();

    @Test
    public void When_services_are_replaced_then_characteristics_can_be_found_by_service_and_uuid() {
        // Given
        BluetoothGattCharacteristic battery = new BluetoothGattCharacteristic(LEVEL_UUID, BATTERY_SERVICE_UUID, PROPERTY_READ | PROPERTY_NOTIFY, List.of(CCC_DESCRIPTOR_UUID));
        BluetoothGattCharacteristic vendor = new BluetoothGattCharacteristic(LEVEL_UUID, VENDOR_SERVICE_UUID, PROPERTY_READ, Collections.emptyList());

        // When
        catalog.replace(List.of(
                new BluetoothGattService(BATTERY_SERVICE_UUID, true, List.of(battery)),
                new BluetoothGattService(VENDOR_SERVICE_UUID, false, List.of(vendor))));

        // Then
        assertEquals(2, catalog.getServices().size());
        assertSame(battery, catalog.getCharacteristic(BATTERY_SERVICE_UUID, LEVEL_UUID));
        assertSame(vendor, catalog.getCharacteristic(VENDOR_SERVICE_UUID, LEVEL_UUID));
        assertNotSame(catalog.getCharacteristic(BATTERY_SERVICE_UUID, LEVEL_UUID), catalog.getCharacteristic(VENDOR_SERVICE_UUID, LEVEL_UUID));
    }

    @Test
    public void Given_a_catalog_when_it_is_replaced_then_old_entries_are_gone() {
        // Given
        BluetoothGattCharacteristic battery = new BluetoothGattCharacteristic(LEVEL_UUID, BATTERY_SERVICE_UUID, PROPERTY_READ, Collections.emptyList());
        catalog.replace(List.of(new BluetoothGattService(BATTERY_SERVICE_UUID, true, List.of(battery))));

        // When
        catalog.replace(List.of(new BluetoothGattService(VENDOR_SERVICE_UUID, true, Collections.emptyList())));

        // Then
        assertNull(catalog.getCharacteristic(BATTERY_SERVICE_UUID, LEVEL_UUID));
        assertEquals(VENDOR_SERVICE_UUID, catalog.getServices().get(0).getUuid());
    }

    @Test
    public void When_the_catalog_is_cleared_then_it_is_empty() {
        // Given
        BluetoothGattCharacteristic battery = new BluetoothGattCharacteristic(LEVEL_UUID, BATTERY_SERVICE_UUID, PROPERTY_READ, Collections.emptyList());
        catalog.replace(List.of(new BluetoothGattService(BATTERY_SERVICE_UUID, true, List.of(battery))));

        // When
        catalog.clear();

        // Then
        assertTrue(catalog.isEmpty());
        assertTrue(catalog.getServices().isEmpty());
        assertNull(catalog.getCharacteristic(BATTERY_SERVICE_UUID, LEVEL_UUID));
    }

    @Test(expected = UnsupportedOperationException.class)
    public void When_modifying_the_service_list_then_an_exception_is_thrown() {
        catalog.replace(List.of(new BluetoothGattService(BATTERY_SERVICE_UUID, true, Collections.emptyList())));
        catalog.getServices().clear();
    }

    @Test
    public void When_a_characteristic_is_created_then_its_descriptors_refer_back_to_it() {
        BluetoothGattCharacteristic battery = new BluetoothGattCharacteristic(LEVEL_UUID, BATTERY_SERVICE_UUID, PROPERTY_NOTIFY, List.of(CCC_DESCRIPTOR_UUID));

        BluetoothGattDescriptor descriptor = battery.getDescriptor(CCC_DESCRIPTOR_UUID);

        assertSame(battery, descriptor.getCharacteristic());
        assertTrue(battery.supportsNotifying());
    }
}
