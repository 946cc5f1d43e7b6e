package com.welie.bleclient;

import org.junit.Test;

import static org.junit.Assert.assertEquals;

public class PeripheralOptionsTest {

    @Test
    public void When_using_the_defaults_then_the_documented_values_are_used() {
        PeripheralOptions options = PeripheralOptions.DEFAULT;

        assertEquals(35000L, options.getConnectTimeout());
        assertEquals(10000L, options.getRequestTimeout());
        assertEquals(100L, options.getDisconnectTimeout());
        assertEquals(300L, options.getCleanupGracePeriod());
        assertEquals(517, options.getInitialMtu());
    }

    @Test
    public void When_request_timeout_is_zero_then_it_is_accepted() {
        assertEquals(0L, PeripheralOptions.builder().requestTimeout(0).build().getRequestTimeout());
    }

    @Test(expected = IllegalArgumentException.class)
    public void When_the_initial_mtu_is_too_large_then_an_exception_is_thrown() {
        PeripheralOptions.builder().initialMtu(518);
    }

    @Test(expected = IllegalArgumentException.class)
    public void When_the_connect_timeout_is_not_positive_then_an_exception_is_thrown() {
        PeripheralOptions.builder().connectTimeout(0);
    }
}
