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

import java.util.Objects;
import java.util.UUID;

/**
 * A descriptor belonging to a {@link BluetoothGattCharacteristic}.
 */
public final class BluetoothGattDescriptor {

    /**
     * UUID of the Client Characteristic Configuration Descriptor (0x2902)
     */
    public static final UUID CCC_DESCRIPTOR_UUID = UUID.fromString("00002902-0000-1000-8000-00805f9b34fb");

    public static final byte[] ENABLE_NOTIFICATION_VALUE = {0x01, 0x00};
    public static final byte[] ENABLE_INDICATION_VALUE = {0x02, 0x00};
    public static final byte[] DISABLE_NOTIFICATION_VALUE = {0x00, 0x00};

    private final @NotNull UUID uuid;
    private final @NotNull BluetoothGattCharacteristic characteristic;

    BluetoothGattDescriptor(@NotNull final UUID uuid, @NotNull final BluetoothGattCharacteristic characteristic) {
        this.uuid = Objects.requireNonNull(uuid, "descriptor uuid is null");
        this.characteristic = characteristic;
    }

    @NotNull
    public UUID getUuid() {
        return uuid;
    }

    @NotNull
    public BluetoothGattCharacteristic getCharacteristic() {
        return characteristic;
    }

    @Override
    public String toString() {
        return "BluetoothGattDescriptor{uuid=" + uuid + ", characteristic=" + characteristic.getUuid() + '}';
    }
}
