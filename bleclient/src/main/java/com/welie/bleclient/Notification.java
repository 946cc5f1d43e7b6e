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

import java.util.Base64;
import java.util.Objects;
import java.util.UUID;

/**
 * A value change reported by the peripheral for a characteristic with notifications or indications enabled.
 */
public final class Notification {

    private final @NotNull UUID serviceUuid;
    private final @NotNull UUID characteristicUuid;
    private final @NotNull String data;

    public Notification(@NotNull final UUID serviceUuid, @NotNull final UUID characteristicUuid, @NotNull final byte[] value) {
        this.serviceUuid = Objects.requireNonNull(serviceUuid, "service uuid is null");
        this.characteristicUuid = Objects.requireNonNull(characteristicUuid, "characteristic uuid is null");
        this.data = Base64.getEncoder().encodeToString(Objects.requireNonNull(value, "value is null"));
    }

    @NotNull
    public UUID getServiceUuid() {
        return serviceUuid;
    }

    @NotNull
    public UUID getCharacteristicUuid() {
        return characteristicUuid;
    }

    /**
     * @return the value as Base64 text
     */
    @NotNull
    public String getData() {
        return data;
    }

    /**
     * @return a decoded copy of the value
     */
    @NotNull
    public byte[] getValue() {
        return Base64.getDecoder().decode(data);
    }

    @Override
    public String toString() {
        return "Notification{service=" + serviceUuid + ", characteristic=" + characteristicUuid + ", data=" + data + '}';
    }
}
