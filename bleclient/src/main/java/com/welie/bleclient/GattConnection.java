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

import java.util.List;

/**
 * Handle of a single connection attempt to a {@link GattDevice}.
 *
 * <p>The command methods return false when the stack refused to issue the command. Completions arrive on
 * the {@link GattCallback} that was given to {@link GattDevice#connectGatt}.
 */
public interface GattConnection {

    void disconnect();

    /**
     * Release the handle and every resource the stack holds for it. The handle cannot be used afterwards.
     */
    void close();

    boolean discoverServices();

    @NotNull
    List<BluetoothGattService> getServices();

    boolean readCharacteristic(@NotNull BluetoothGattCharacteristic characteristic);

    boolean writeCharacteristic(@NotNull BluetoothGattCharacteristic characteristic, @NotNull byte[] value, int writeType);

    /**
     * Enable or disable local delivery of value changes. Does not write anything to the peripheral.
     */
    boolean setCharacteristicNotification(@NotNull BluetoothGattCharacteristic characteristic, boolean enable);

    boolean writeDescriptor(@NotNull BluetoothGattDescriptor descriptor, @NotNull byte[] value);

    boolean requestMtu(int mtu);
}
