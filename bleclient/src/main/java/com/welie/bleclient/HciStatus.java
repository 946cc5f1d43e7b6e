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
 * Status codes reported with connection state changes.
 *
 * <p>Most values are HCI error codes from the Bluetooth Core Specification, Volume 1, Part F.
 * {@link #ERROR} and {@link #FAILURE_REGISTERING_CLIENT} are vendor codes that radio stacks use for
 * failed connection attempts.
 */
public enum HciStatus {

    SUCCESS(0x00),
    UNKNOWN_CONNECTION_IDENTIFIER(0x02),
    HARDWARE_FAILURE(0x03),
    PAGE_TIMEOUT(0x04),
    AUTHENTICATION_FAILURE(0x05),
    MEMORY_FULL(0x07),

    /**
     * The link supervision timeout has expired, usually because the peripheral went out of range.
     */
    CONNECTION_TIMEOUT(0x08),
    CONNECTION_LIMIT_EXCEEDED(0x09),
    MAX_NUM_OF_CONNECTIONS_EXCEEDED(0x0A),
    CONNECTION_ALREADY_EXISTS(0x0B),
    COMMAND_DISALLOWED(0x0C),
    CONNECTION_REJECTED_LIMITED_RESOURCES(0x0D),
    CONNECTION_REJECTED_SECURITY_REASONS(0x0E),
    CONNECTION_ACCEPT_TIMEOUT_EXCEEDED(0x10),
    REMOTE_USER_TERMINATED_CONNECTION(0x13),
    REMOTE_DEVICE_TERMINATED_CONNECTION_LOW_RESOURCES(0x14),
    REMOTE_DEVICE_TERMINATED_CONNECTION_POWER_OFF(0x15),
    CONNECTION_TERMINATED_BY_LOCAL_HOST(0x16),
    UNSPECIFIED(0x1F),
    LMP_OR_LL_RESPONSE_TIMEOUT(0x22),
    INSTANT_PASSED(0x28),
    CONTROLLER_BUSY(0x3A),
    ADVERTISING_TIMEOUT(0x3C),
    CONNECTION_TERMINATED_MIC_FAILURE(0x3D),
    CONNECTION_FAILED_ESTABLISHMENT(0x3E),
    LIMIT_REACHED(0x43),
    OPERATION_CANCELLED_BY_HOST(0x44),

    /**
     * Generic connection failure (133). Usually the peripheral is not advertising or out of range.
     */
    ERROR(0x85),

    /**
     * Failure to register client when trying to connect. Probably because the maximum number of clients has been reached,
     * which happens when connection handles are not closed after a disconnect.
     */
    FAILURE_REGISTERING_CLIENT(0x101),

    /**
     * Used when status code is not defined in the class
     */
    UNKNOWN_STATUS_CODE(0xFFFF);

    HciStatus(final int value) {
        this.value = value;
    }

    public final int value;

    @NotNull
    public static HciStatus fromValue(final int value) {
        for (HciStatus type : values()) {
            if (type.value == value)
                return type;
        }
        return UNKNOWN_STATUS_CODE;
    }
}
