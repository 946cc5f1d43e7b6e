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
 * The GattStatus describes the result of a GATT operation.
 *
 * <p>Codes 0x01-0x13 are the ATT error codes from the Bluetooth Core Specification, Volume 3, Part F, 3.4.1.
 * Codes 0x80-0x8F and above 0xFF are stack specific.
 */
public enum GattStatus {

    SUCCESS(0x00),
    INVALID_HANDLE(0x01),
    READ_NOT_PERMITTED(0x02),
    WRITE_NOT_PERMITTED(0x03),
    INVALID_PDU(0x04),
    INSUFFICIENT_AUTHENTICATION(0x05),
    REQUEST_NOT_SUPPORTED(0x06),
    INVALID_OFFSET(0x07),
    INSUFFICIENT_AUTHORIZATION(0x08),
    PREPARE_QUEUE_FULL(0x09),
    ATTRIBUTE_NOT_FOUND(0x0A),
    ATTRIBUTE_NOT_LONG(0x0B),
    INSUFFICIENT_ENCRYPTION_KEY_SIZE(0x0C),
    INVALID_ATTRIBUTE_VALUE_LENGTH(0x0D),
    UNLIKELY_ERROR(0x0E),
    INSUFFICIENT_ENCRYPTION(0x0F),
    UNSUPPORTED_GROUP_TYPE(0x10),
    INSUFFICIENT_RESOURCES(0x11),
    DATABASE_OUT_OF_SYNC(0x12),
    VALUE_NOT_ALLOWED(0x13),

    NO_RESOURCES(0x80),
    INTERNAL_ERROR(0x81),
    WRONG_STATE(0x82),
    DB_FULL(0x83),
    BUSY(0x84),

    /**
     * Generic failure, the infamous 133
     */
    ERROR(0x85),
    ILLEGAL_PARAMETER(0x87),
    AUTHORIZATION_FAILED(0x89),
    CONNECTION_CONGESTED(0x8f),

    /**
     * Client Characteristic Configuration Descriptor improperly configured
     */
    CCCD_CFG_ERROR(0xFD),
    PROCEDURE_IN_PROGRESS(0xFE),
    VALUE_OUT_OF_RANGE(0xFF),

    /**
     * Used when status code is not defined in the class
     */
    UNKNOWN_STATUS_CODE(0xFFFF);

    GattStatus(final int value) {
        this.value = value;
    }

    public final int value;

    @NotNull
    public static GattStatus fromValue(final int value) {
        for (GattStatus type : values()) {
            if (type.value == value)
                return type;
        }
        return UNKNOWN_STATUS_CODE;
    }
}
