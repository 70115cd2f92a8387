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

import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;

/**
 * The single logical thread on which all replica, registry and lifecycle mutation runs. Tasks execute one at a time, in
 * submission order.
 *
 * @author hal.hildebrand
 */
public interface EventLoop extends Executor, AutoCloseable {

    /**
     * Run a task once after a delay.
     *
     * @return cancels the task if it has not yet run
     */
    Cancellable schedule(Runnable task, long delay, TimeUnit unit);

    /**
     * @return true if the caller is running on this loop
     */
    boolean inEventLoop();

    /**
     * Stop accepting tasks. Tasks already queued may be dropped.
     */
    @Override
    void close();

    @FunctionalInterface
    interface Cancellable {
        void cancel();
    }
}
