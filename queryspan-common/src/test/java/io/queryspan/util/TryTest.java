package io.queryspan.util;

import org.junit.Assert;
import org.junit.Test;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.concurrent.atomic.AtomicInteger;

public class TryTest {

    @Test
    public void failureIsLoggedOnlyTest() {
        AtomicInteger calls = new AtomicInteger();
        Try.on(() -> {
            calls.incrementAndGet();
            throw new IOException("close failed");
        }, LoggerFactory.getLogger(TryTest.class), "close");
        Try.on(calls::incrementAndGet, null);
        Assert.assertEquals(2, calls.get());
    }
}
