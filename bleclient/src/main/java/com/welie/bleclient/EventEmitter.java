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

/**
 * Best effort delivery of {@link PeripheralEvent}s. Events are delivered in the order they are emitted.
 */
final class EventEmitter {

    private static final String TAG = EventEmitter.class.getSimpleName();

    private volatile @Nullable PeripheralEventSink sink;

    void setSink(@Nullable final PeripheralEventSink sink) {
        this.sink = sink;
    }

    synchronized void emit(@NotNull final PeripheralEvent event) {
        final PeripheralEventSink current = sink;
        if (current == null) {
            Logger.d(TAG, "no event sink attached, dropping %s", event);
            return;
        }

        try {
            current.onEvent(event);
        } catch (RuntimeException ex) {
            Logger.e(TAG, ex, "event sink failed for %s", event);
        }
    }
}
