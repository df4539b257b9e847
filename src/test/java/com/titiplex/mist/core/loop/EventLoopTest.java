package com.titiplex.mist.core.loop;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;

class EventLoopTest {

    private final EventLoop loop = new EventLoop("test-loop");

    @AfterEach
    void tearDown() {
        loop.shutdown();
    }

    @Test
    void tasksRunInOrderOnTheLoopThread() throws Exception {
        List<Integer> seen = new CopyOnWriteArrayList<>();
        List<Boolean> inLoop = new CopyOnWriteArrayList<>();
        CountDownLatch done = new CountDownLatch(1);

        for (int i = 0; i < 5; i++) {
            int n = i;
            loop.execute(() -> {
                seen.add(n);
                inLoop.add(loop.inLoop());
            });
        }
        loop.execute(done::countDown);

        assertThat(done.await(2, TimeUnit.SECONDS)).isTrue();
        assertThat(seen).containsExactly(0, 1, 2, 3, 4);
        assertThat(inLoop).containsOnly(true);
        assertThat(loop.inLoop()).isFalse();
    }

    @Test
    void failingTaskDoesNotStopTheLoop() throws Exception {
        CountDownLatch after = new CountDownLatch(1);
        loop.execute(() -> {
            throw new IllegalStateException("boom");
        });
        loop.execute(after::countDown);
        assertThat(after.await(2, TimeUnit.SECONDS)).isTrue();
    }

    @Test
    void cancelledTimerNeverFires() throws Exception {
        CountDownLatch fired = new CountDownLatch(1);
        EventLoop.Handle h = loop.schedule(fired::countDown, 200);
        h.cancel();
        assertThat(fired.await(400, TimeUnit.MILLISECONDS)).isFalse();

        CountDownLatch periodic = new CountDownLatch(3);
        EventLoop.Handle p = loop.scheduleAtFixedRate(periodic::countDown, 0, 10);
        assertThat(periodic.await(2, TimeUnit.SECONDS)).isTrue();
        p.cancel();
    }
}
