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

import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

/**
 * Result of the most recent successful service discovery.
 *
 * <p>The catalog is replaced as a whole, never patched. Readers always see a consistent snapshot.
 */
final class ServiceCatalog {

    private static final String TAG = ServiceCatalog.class.getSimpleName();

    private static final Snapshot EMPTY = new Snapshot(Collections.emptyList());

    private volatile @NotNull Snapshot snapshot = EMPTY;

    void replace(@NotNull final List<BluetoothGattService> services) {
        Objects.requireNonNull(services, "services are null");
        final Snapshot next = new Snapshot(services);
        snapshot = next;
        Logger.d(TAG, "catalog holds %d service(s), %d characteristic(s)", next.services.size(), next.index.size());
    }

    void clear() {
        snapshot = EMPTY;
    }

    @NotNull
    List<BluetoothGattService> getServices() {
        return snapshot.services;
    }

    @Nullable
    BluetoothGattCharacteristic getCharacteristic(@NotNull final UUID serviceUuid, @NotNull final UUID characteristicUuid) {
        return snapshot.index.get(new CharacteristicKey(characteristicUuid, serviceUuid));
    }

    boolean isEmpty() {
        return snapshot.services.isEmpty();
    }

    private static final class Snapshot {
        final @NotNull List<BluetoothGattService> services;
        final @NotNull Map<CharacteristicKey, BluetoothGattCharacteristic> index;

        Snapshot(@NotNull final List<BluetoothGattService> services) {
            this.services = List.copyOf(services);
            final Map<CharacteristicKey, BluetoothGattCharacteristic> map = new HashMap<>();
            for (BluetoothGattService service : this.services) {
                for (BluetoothGattCharacteristic characteristic : service.getCharacteristics()) {
                    map.put(new CharacteristicKey(characteristic.getUuid(), service.getUuid()), characteristic);
                }
            }
            this.index = Collections.unmodifiableMap(map);
        }
    }
}
