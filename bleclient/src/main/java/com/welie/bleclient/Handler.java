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

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

/**
 * Runs tasks, optionally delayed, on a single named daemon thread.
 *
 * <p>Tasks posted to the same handler run one after another in the order they become due.
 * Exceptions thrown by a task are logged and do not stop the handler.
 */
public class Handler {

    private static final String TAG = Handler.class.getSimpleName();

    private final @NotNull String name;
    private final @NotNull ScheduledExecutorService executor;

    /**
     * Create a handler with its own thread.
     *
     * @param name name of the handler thread
     */
    public Handler(@NotNull final String name) {
        this.name = Objects.requireNonNull(name, "no valid name provided");
        this.executor = Executors.newSingleThreadScheduledExecutor(runnable -> {
            final Thread thread = new Thread(runnable, name);
            thread.setDaemon(true);
            return thread;
        });
    }

    /**
     * Run a task after a delay.
     *
     * @param runnable the task
     * @param delayMillis delay in milliseconds
     * @return the scheduled task that can be used for cancelling, or null if the handler has been shut down
     */
    @Nullable
    public ScheduledFuture<?> postDelayed(@NotNull final Runnable runnable, final long delayMillis) {
        Objects.requireNonNull(runnable, "no valid runnable provided");
        try {
            return executor.schedule(() -> {
                try {
                    runnable.run();
                } catch (RuntimeException ex) {
                    Logger.e(TAG, ex, "task exception on handler '%s'", name);
                }
            }, Math.max(0, delayMillis), TimeUnit.MILLISECONDS);
        } catch (RejectedExecutionException ex) {
            Logger.w(TAG, "handler '%s' is shut down, task not scheduled", name);
            return null;
        }
    }

    /**
     * Cancel a task returned by {@link #postDelayed(Runnable, long)}. Null is ignored.
     *
     * @param task the task to cancel
     */
    public void removeCallbacks(@Nullable final ScheduledFuture<?> task) {
        if (task != null) {
            task.cancel(false);
        }
    }

    /**
     * Stop the handler thread. Pending tasks are discarded.
     */
    public void shutdown() {
        executor.shutdownNow();
    }
}
