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
import java.util.UUID;

/**
 * A service as reported by service discovery.
 */
public final class BluetoothGattService {

    private final @NotNull UUID uuid;
    private final boolean primary;
    private final @NotNull List<BluetoothGattCharacteristic> characteristics;

    public BluetoothGattService(@NotNull final UUID uuid, final boolean primary, @NotNull final List<BluetoothGattCharacteristic> characteristics) {
        this.uuid = Objects.requireNonNull(uuid, "service uuid is null");
        this.primary = primary;
        this.characteristics = List.copyOf(Objects.requireNonNull(characteristics, "characteristics are null"));
    }

    @NotNull
    public UUID getUuid() {
        return uuid;
    }

    public boolean isPrimary() {
        return primary;
    }

    @NotNull
    public List<BluetoothGattCharacteristic> getCharacteristics() {
        return characteristics;
    }

    @Nullable
    public BluetoothGattCharacteristic getCharacteristic(@NotNull final UUID characteristicUuid) {
        for (BluetoothGattCharacteristic characteristic : characteristics) {
            if (characteristic.getUuid().equals(characteristicUuid)) return characteristic;
        }
        return null;
    }

    @Override
    public String toString() {
        return "BluetoothGattService{uuid=" + uuid + ", primary=" + primary + ", characteristics=" + characteristics.size() + '}';
    }
}
