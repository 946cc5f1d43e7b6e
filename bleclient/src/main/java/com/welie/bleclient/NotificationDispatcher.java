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

import java.util.UUID;

/**
 * Hands value changes to the attached {@link NotificationSink}, one at a time. Without a sink they are dropped.
 */
final class NotificationDispatcher {

    private static final String TAG = NotificationDispatcher.class.getSimpleName();

    private final Object deliveryLock = new Object();
    private volatile @Nullable NotificationSink sink;

    void setSink(@Nullable final NotificationSink sink) {
        this.sink = sink;
    }

    /**
     * @return true if the notification was handed to a sink
     */
    boolean dispatch(@NotNull final UUID serviceUuid, @NotNull final UUID characteristicUuid, @NotNull final byte[] value) {
        final NotificationSink current = sink;
        if (current == null) {
            Logger.v(TAG, "no sink attached, dropping notification for '%s'", characteristicUuid);
            return false;
        }

        final Notification notification = new Notification(serviceUuid, characteristicUuid, value);
        synchronized (deliveryLock) {
            try {
                current.onNotification(notification);
            } catch (RuntimeException ex) {
                Logger.e(TAG, ex, "notification sink failed for '%s'", characteristicUuid);
            }
        }
        return true;
    }
}
