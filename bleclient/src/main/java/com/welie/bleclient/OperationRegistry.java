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
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ScheduledFuture;
import java.util.function.Function;

/**
 * Keeps track of the requests of one {@link OperationType} that are waiting for a completion from the stack.
 *
 * <p>There is at most one pending request per key. Registering a request for an occupied key fails the
 * previous request with {@link GattError#OVERWRITTEN}. Futures are always completed outside the lock so
 * that caller code running on completion cannot deadlock with the stack's callback thread.
 *
 * @param <K> key type, a {@link CharacteristicKey} or the {@link OperationType} itself for single-slot operations
 * @param <V> result type
 */
final class OperationRegistry<K, V> {

    private static final String TAG = OperationRegistry.class.getSimpleName();

    private final @NotNull OperationType operation;
    private final @NotNull Handler handler;
    private final long timeoutMillis;
    private final Map<K, CompletableFuture<V>> pending = new HashMap<>();
    private final Object lock = new Object();

    OperationRegistry(@NotNull final OperationType operation, @NotNull final Handler handler, final long timeoutMillis) {
        this.operation = Objects.requireNonNull(operation, "operation is null");
        this.handler = Objects.requireNonNull(handler, "handler is null");
        this.timeoutMillis = timeoutMillis;
    }

    @NotNull
    OperationType getOperation() {
        return operation;
    }

    /**
     * Install a request. A request already registered under the same key is failed with {@link GattError#OVERWRITTEN}.
     */
    void register(@NotNull final K key, @NotNull final CompletableFuture<V> future) {
        final CompletableFuture<V> previous;
        synchronized (lock) {
            previous = pending.put(key, future);
        }

        if (previous != null && previous != future) {
            Logger.w(TAG, "%s request for '%s' overwritten by a newer request", operation, key);
            previous.completeExceptionally(GattException.overwritten(operation));
        }

        if (timeoutMillis > 0) {
            final ScheduledFuture<?> timer = handler.postDelayed(() -> expire(key, future), timeoutMillis);
            if (timer != null) {
                future.whenComplete((value, throwable) -> handler.removeCallbacks(timer));
            }
        }
    }

    /**
     * Remove the request for the key and complete it with a value.
     *
     * @return false if there was no pending request
     */
    boolean resolve(@NotNull final K key, @Nullable final V value) {
        final CompletableFuture<V> future = take(key);
        if (future == null) {
            Logger.d(TAG, "no pending %s request for '%s', result ignored", operation, key);
            return false;
        }
        future.complete(value);
        return true;
    }

    /**
     * Remove the request for the key and fail it.
     *
     * @return false if there was no pending request
     */
    boolean reject(@NotNull final K key, @NotNull final GattException exception) {
        final CompletableFuture<V> future = take(key);
        if (future == null) {
            Logger.w(TAG, "no pending %s request for '%s', error ignored: %s", operation, key, exception.getMessage());
            return false;
        }
        future.completeExceptionally(exception);
        return true;
    }

    /**
     * Fail a request whose command could not be issued. Only removes the entry if it still belongs to this request.
     */
    void abort(@NotNull final K key, @NotNull final CompletableFuture<V> future, @NotNull final GattException exception) {
        synchronized (lock) {
            pending.remove(key, future);
        }
        future.completeExceptionally(exception);
    }

    /**
     * Fail and remove every pending request.
     *
     * @param exceptionFactory creates the exception for each request
     * @return the number of requests that were failed
     */
    int failAll(@NotNull final Function<OperationType, GattException> exceptionFactory) {
        final List<CompletableFuture<V>> failed;
        synchronized (lock) {
            failed = new ArrayList<>(pending.values());
            pending.clear();
        }

        for (CompletableFuture<V> future : failed) {
            future.completeExceptionally(exceptionFactory.apply(operation));
        }
        if (!failed.isEmpty()) {
            Logger.d(TAG, "failed %d pending %s request(s)", failed.size(), operation);
        }
        return failed.size();
    }

    boolean isPending(@NotNull final K key) {
        synchronized (lock) {
            return pending.containsKey(key);
        }
    }

    int size() {
        synchronized (lock) {
            return pending.size();
        }
    }

    @Nullable
    private CompletableFuture<V> take(@NotNull final K key) {
        synchronized (lock) {
            return pending.remove(key);
        }
    }

    private void expire(@NotNull final K key, @NotNull final CompletableFuture<V> future) {
        final boolean removed;
        synchronized (lock) {
            removed = pending.remove(key, future);
        }
        if (removed) {
            Logger.e(TAG, "%s request for '%s' timed out after %d ms", operation, key, timeoutMillis);
            future.completeExceptionally(GattException.timeout(operation));
        }
    }
}
