package io.chatsocket.impl;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.After;
import org.junit.Assert;
import org.junit.Test;

import io.chatsocket.impl.ChatSocketConnectionHandler.SerialLane;

public class SerialLaneTest {

    private final ExecutorService _pool = Executors.newFixedThreadPool(8);

    @After
    public void shutdown() {
        _pool.shutdownNow();
    }

    @Test
    public void tasksRunInOrderOneAtATime() throws InterruptedException {
        SerialLane lane = new SerialLane(_pool, "s1");
        List<Integer> order = new ArrayList<>();
        AtomicInteger concurrent = new AtomicInteger();
        AtomicInteger maxConcurrent = new AtomicInteger();
        CountDownLatch done = new CountDownLatch(500);

        for (int i = 0; i < 500; i++) {
            int n = i;
            lane.execute(() -> {
                maxConcurrent.accumulateAndGet(concurrent.incrementAndGet(), Math::max);
                // Unsynchronized list: the lane runs one task at a time.
                order.add(n);
                concurrent.decrementAndGet();
                done.countDown();
            });
        }

        Assert.assertTrue(done.await(10, TimeUnit.SECONDS));
        Assert.assertEquals(1, maxConcurrent.get());
        for (int i = 0; i < 500; i++) {
            Assert.assertEquals(Integer.valueOf(i), order.get(i));
        }
    }

    @Test
    public void failingTaskDoesNotStopLane() throws InterruptedException {
        SerialLane lane = new SerialLane(_pool, "s1");
        CountDownLatch after = new CountDownLatch(1);

        lane.execute(() -> {
            throw new IllegalStateException("Task failure");
        });
        lane.execute(after::countDown);

        Assert.assertTrue(after.await(10, TimeUnit.SECONDS));
    }

    @Test
    public void shutDownPoolDropsTasks() {
        _pool.shutdown();
        SerialLane lane = new SerialLane(_pool, "s1");
        AtomicInteger ran = new AtomicInteger();

        lane.execute(ran::incrementAndGet);
        lane.execute(ran::incrementAndGet);

        Assert.assertEquals(0, ran.get());
    }
}
