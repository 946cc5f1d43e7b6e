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

/**
 * Category of a {@link GattException}.
 */
public enum GattError {
    /**
     * There is no live connection to the peripheral
     */
    NOT_CONNECTED,

    /**
     * A connection exists or is being set up
     */
    ALREADY_CONNECTED,

    /**
     * The characteristic is not part of the most recent service discovery
     */
    CHARACTERISTIC_NOT_FOUND,

    /**
     * The characteristic has no Client Characteristic Configuration descriptor
     */
    DESCRIPTOR_NOT_FOUND,
    SERVICE_DISCOVERY_FAILED,

    /**
     * The peripheral or the stack reported a non-success status
     */
    OPERATION_FAILED,

    /**
     * A newer request for the same operation took over
     */
    OVERWRITTEN,
    UNEXPECTED_DESCRIPTOR,

    /**
     * The stack refused to issue the command
     */
    START_FAILED,
    TIMEOUT,
    CONNECTION_FAILED,

    /**
     * The request was torn down by a disconnect
     */
    DISCONNECTED,
    SESSION_CLOSED
}
