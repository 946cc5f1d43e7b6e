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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.UUID;

/**
 * A characteristic as reported by service discovery.
 *
 * <p>Instances are immutable. The descriptors are created together with the characteristic and
 * refer back to it.
 */
public final class BluetoothGattCharacteristic {

    public static final int PROPERTY_BROADCAST = 0x01;
    public static final int PROPERTY_READ = 0x02;
    public static final int PROPERTY_WRITE_NO_RESPONSE = 0x04;
    public static final int PROPERTY_WRITE = 0x08;
    public static final int PROPERTY_NOTIFY = 0x10;
    public static final int PROPERTY_INDICATE = 0x20;
    public static final int PROPERTY_SIGNED_WRITE = 0x40;
    public static final int PROPERTY_EXTENDED_PROPS = 0x80;

    private final @NotNull UUID uuid;
    private final @NotNull UUID serviceUuid;
    private final int properties;
    private final @NotNull List<BluetoothGattDescriptor> descriptors;

    public BluetoothGattCharacteristic(@NotNull final UUID uuid, @NotNull final UUID serviceUuid, final int properties, @NotNull final List<UUID> descriptorUuids) {
        this.uuid = Objects.requireNonNull(uuid, "characteristic uuid is null");
        this.serviceUuid = Objects.requireNonNull(serviceUuid, "service uuid is null");
        Objects.requireNonNull(descriptorUuids, "descriptor uuids are null");
        this.properties = properties;

        final List<BluetoothGattDescriptor> list = new ArrayList<>(descriptorUuids.size());
        for (UUID descriptorUuid : descriptorUuids) {
            list.add(new BluetoothGattDescriptor(descriptorUuid, this));
        }
        this.descriptors = Collections.unmodifiableList(list);
    }

    @NotNull
    public UUID getUuid() {
        return uuid;
    }

    @NotNull
    public UUID getServiceUuid() {
        return serviceUuid;
    }

    public int getProperties() {
        return properties;
    }

    @NotNull
    public List<BluetoothGattDescriptor> getDescriptors() {
        return descriptors;
    }

    @NotNull
    public List<UUID> getDescriptorUuids() {
        final List<UUID> result = new ArrayList<>(descriptors.size());
        for (BluetoothGattDescriptor descriptor : descriptors) {
            result.add(descriptor.getUuid());
        }
        return result;
    }

    @Nullable
    public BluetoothGattDescriptor getDescriptor(@NotNull final UUID descriptorUuid) {
        Objects.requireNonNull(descriptorUuid, "descriptor uuid is null");
        for (BluetoothGattDescriptor descriptor : descriptors) {
            if (descriptor.getUuid().equals(descriptorUuid)) return descriptor;
        }
        return null;
    }

    public boolean hasProperty(final int property) {
        return (properties & property) > 0;
    }

    public boolean supportsReading() {
        return hasProperty(PROPERTY_READ);
    }

    public boolean supportsWriteType(@NotNull final WriteType writeType) {
        return hasProperty(writeType.property);
    }

    public boolean supportsNotifying() {
        return hasProperty(PROPERTY_NOTIFY);
    }

    public boolean supportsIndicating() {
        return hasProperty(PROPERTY_INDICATE);
    }

    @Override
    public String toString() {
        return String.format("BluetoothGattCharacteristic{uuid=%s, service=%s, properties=0x%02X}", uuid, serviceUuid, properties);
    }
}
