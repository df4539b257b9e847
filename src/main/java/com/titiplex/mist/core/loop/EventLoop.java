package com.titiplex.mist.core.loop;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

public class EventLoop {
    private static final Logger log = LoggerFactory.getLogger(EventLoop.class);

    private final String name;
    private ScheduledExecutorService ses;
    private volatile Thread loopThread;

    public EventLoop(String name) {
        this.name = name;
    }

    private synchronized ScheduledExecutorService executor() {
        if (ses == null) {
            ses = Executors.newSingleThreadScheduledExecutor(r -> {
                var t = new Thread(r, name);
                t.setDaemon(true);
                loopThread = t;
                return t;
            });
        }
        return ses;
    }

    public void execute(Runnable task) {
        try {
            executor().execute(guard(task));
        } catch (RejectedExecutionException e) {
            log.debug("Event loop {} stopped, task dropped", name);
        }
    }

    public Handle schedule(Runnable task, long delayMs) {
        try {
            ScheduledFuture<?> f = executor().schedule(guard(task), delayMs, TimeUnit.MILLISECONDS);
            return () -> f.cancel(false);
        } catch (RejectedExecutionException e) {
            log.debug("Event loop {} stopped, timer dropped", name);
            return () -> { };
        }
    }

    public Handle scheduleAtFixedRate(Runnable task, long initialDelayMs, long periodMs) {
        try {
            ScheduledFuture<?> f = executor().scheduleAtFixedRate(guard(task), initialDelayMs, periodMs,
                    TimeUnit.MILLISECONDS);
            return () -> f.cancel(false);
        } catch (RejectedExecutionException e) {
            log.debug("Event loop {} stopped, periodic task dropped", name);
            return () -> { };
        }
    }

    public long now() {
        return System.currentTimeMillis();
    }

    public boolean inLoop() {
        return Thread.currentThread() == loopThread;
    }

    public synchronized void shutdown() {
        if (ses == null) return;
        ses.shutdown();
        try {
            if (!ses.awaitTermination(2, TimeUnit.SECONDS)) ses.shutdownNow();
        } catch (InterruptedException e) {
            ses.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // une tâche en échec ne doit pas tuer la boucle (ni annuler une tâche périodique)
    private Runnable guard(Runnable task) {
        return () -> {
            try {
                task.run();
            } catch (RuntimeException e) {
                log.error("Uncaught error on event loop {}", name, e);
            }
        };
    }

    @FunctionalInterface
    public interface Handle {
        void cancel();
    }
}
