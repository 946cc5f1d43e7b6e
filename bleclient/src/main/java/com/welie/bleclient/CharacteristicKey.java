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
 * Identity of a characteristic within a peripheral. A characteristic uuid is only unique within its service.
 */
public final class CharacteristicKey {

    private final @NotNull UUID characteristicUuid;
    private final @NotNull UUID serviceUuid;

    public CharacteristicKey(@NotNull final UUID characteristicUuid, @NotNull final UUID serviceUuid) {
        this.characteristicUuid = Objects.requireNonNull(characteristicUuid, "characteristic uuid is null");
        this.serviceUuid = Objects.requireNonNull(serviceUuid, "service uuid is null");
    }

    @NotNull
    public static CharacteristicKey of(@NotNull final BluetoothGattCharacteristic characteristic) {
        return new CharacteristicKey(characteristic.getUuid(), characteristic.getServiceUuid());
    }

    @NotNull
    public UUID getCharacteristicUuid() {
        return characteristicUuid;
    }

    @NotNull
    public UUID getServiceUuid() {
        return serviceUuid;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (o == null || getClass() != o.getClass()) return false;
        CharacteristicKey that = (CharacteristicKey) o;
        return characteristicUuid.equals(that.characteristicUuid) && serviceUuid.equals(that.serviceUuid);
    }

    @Override
    public int hashCode() {
        return Objects.hash(characteristicUuid, serviceUuid);
    }

    @Override
    public String toString() {
        return characteristicUuid + "@" + serviceUuid;
    }
}
