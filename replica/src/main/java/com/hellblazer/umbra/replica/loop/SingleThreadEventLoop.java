/**
 * Copyright (C) 2025 Hal Hildebrand. All rights reserved.
 *
 * This file is part of the Umbra.
 *
 * This program is free software: you can redistribute it and/or modify it under the terms of the GNU Affero General
 * Public License as published by the Free Software Foundation, either version 3 of the License, or (at your option) any
 * later version.
 *
 * This program is distributed in the hope that it will be useful, but WITHOUT ANY WARRANTY; without even the implied
 * warranty of MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE. See the GNU Affero General Public License for more
 * details.
 *
 * You should have received a copy of the GNU Affero General Public License along with this program. If not, see
 * <http://www.gnu.org/licenses/>.
 */
package com.hellblazer.umbra.replica.loop;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Objects;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;

/**
 * {@link EventLoop} backed by a single named daemon thread.
 * <p>
 * A task that throws is logged and does not stop the loop. Tasks submitted after {@link #close()} are dropped with a
 * debug message.
 *
 * @author hal.hildebrand
 */
public class SingleThreadEventLoop implements EventLoop {
    private static final Logger log = LoggerFactory.getLogger(SingleThreadEventLoop.class);

    private final ScheduledExecutorService executor;
    private volatile Thread                thread;

    public SingleThreadEventLoop(String name) {
        Objects.requireNonNull(name, "Name cannot be null");
        this.executor = Executors.newSingleThreadScheduledExecutor(r -> {
            var t = new Thread(r, name);
            t.setDaemon(true);
            thread = t;
            return t;
        });
    }

    @Override
    public void execute(Runnable task) {
        Objects.requireNonNull(task, "Task cannot be null");
        try {
            executor.execute(() -> runGuarded(task));
        } catch (RejectedExecutionException e) {
            log.debug("Event loop closed, dropping task");
        }
    }

    @Override
    public Cancellable schedule(Runnable task, long delay, TimeUnit unit) {
        Objects.requireNonNull(task, "Task cannot be null");
        try {
            var future = executor.schedule(() -> runGuarded(task), delay, unit);
            return () -> future.cancel(false);
        } catch (RejectedExecutionException e) {
            log.debug("Event loop closed, dropping scheduled task");
            return () -> {
            };
        }
    }

    @Override
    public boolean inEventLoop() {
        return Thread.currentThread() == thread;
    }

    @Override
    public void close() {
        executor.shutdownNow();
    }

    /**
     * Wait for the loop thread to finish after {@link #close()}.
     *
     * @return true if the loop terminated within the timeout
     */
    public boolean awaitTermination(long timeout, TimeUnit unit) throws InterruptedException {
        return executor.awaitTermination(timeout, unit);
    }

    private void runGuarded(Runnable task) {
        try {
            task.run();
        } catch (RuntimeException e) {
            log.error("Event loop task failed", e);
        }
    }
}
