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
 * Why a connection ended or could not be established, derived from the status code the radio stack reported.
 */
public enum DisconnectReason {
    NORMAL("disconnected normally"),
    TIMEOUT("connection timeout"),
    OUT_OF_RANGE("device unavailable or out of range"),
    TERMINATED_BY_PEER("connection terminated by peer"),
    LINK_LOSS("link loss"),
    RESOURCE_EXHAUSTED("too many concurrent clients"),
    UNKNOWN("unknown error");

    private final @NotNull String description;

    DisconnectReason(@NotNull final String description) {
        this.description = description;
    }

    @NotNull
    public String getDescription() {
        return description;
    }

    @NotNull
    public static DisconnectReason fromStatus(final int status) {
        return fromStatus(HciStatus.fromValue(status));
    }

    @NotNull
    public static DisconnectReason fromStatus(@NotNull final HciStatus status) {
        switch (status) {
            case SUCCESS:
            case CONNECTION_TERMINATED_BY_LOCAL_HOST:
            case OPERATION_CANCELLED_BY_HOST:
                return NORMAL;
            case PAGE_TIMEOUT:
            case CONNECTION_ACCEPT_TIMEOUT_EXCEEDED:
            case CONNECTION_FAILED_ESTABLISHMENT:
            case ADVERTISING_TIMEOUT:
                return TIMEOUT;
            case ERROR:
            case CONNECTION_TIMEOUT:
            case UNKNOWN_CONNECTION_IDENTIFIER:
                return OUT_OF_RANGE;
            case REMOTE_USER_TERMINATED_CONNECTION:
            case REMOTE_DEVICE_TERMINATED_CONNECTION_LOW_RESOURCES:
            case REMOTE_DEVICE_TERMINATED_CONNECTION_POWER_OFF:
                return TERMINATED_BY_PEER;
            case LMP_OR_LL_RESPONSE_TIMEOUT:
            case CONNECTION_TERMINATED_MIC_FAILURE:
            case INSTANT_PASSED:
                return LINK_LOSS;
            case FAILURE_REGISTERING_CLIENT:
            case MEMORY_FULL:
            case CONNECTION_LIMIT_EXCEEDED:
            case MAX_NUM_OF_CONNECTIONS_EXCEEDED:
            case CONNECTION_REJECTED_LIMITED_RESOURCES:
            case LIMIT_REACHED:
                return RESOURCE_EXHAUSTED;
            default:
                return UNKNOWN;
        }
    }
}
