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
 * Callbacks from the radio stack. Implementations can expect calls for one connection to be serialized.
 */
public interface GattCallback {

    int STATE_DISCONNECTED = 0;
    int STATE_CONNECTING = 1;
    int STATE_CONNECTED = 2;
    int STATE_DISCONNECTING = 3;

    /**
     * @param status   HCI status, see {@link HciStatus}
     * @param newState one of the STATE constants
     */
    void onConnectionStateChange(@NotNull GattConnection gatt, int status, int newState);

    void onServicesDiscovered(@NotNull GattConnection gatt, int status);

    void onCharacteristicRead(@NotNull GattConnection gatt, @NotNull BluetoothGattCharacteristic characteristic, @NotNull byte[] value, int status);

    void onCharacteristicWrite(@NotNull GattConnection gatt, @NotNull BluetoothGattCharacteristic characteristic, int status);

    void onCharacteristicChanged(@NotNull GattConnection gatt, @NotNull BluetoothGattCharacteristic characteristic, @NotNull byte[] value);

    void onDescriptorWrite(@NotNull GattConnection gatt, @NotNull BluetoothGattDescriptor descriptor, int status);

    void onMtuChanged(@NotNull GattConnection gatt, int mtu, int status);
}
