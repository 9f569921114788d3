/*
 * Licensed to the Apache Software Foundation (ASF) under one or more
 * contributor license agreements.  See the NOTICE file distributed with
 * this work for additional information regarding copyright ownership.
 * The ASF licenses this file to You under the Apache License, Version 2.0
 * (the "License"); you may not use this file except in compliance with
 * the License.  You may obtain a copy of the License at
 *
 *      http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.quire.plugins.observation;

import static com.google.common.base.Preconditions.checkArgument;
import static com.google.common.base.Preconditions.checkNotNull;

import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import javax.annotation.Nonnull;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Coalesces bursts of triggers into a single run of a task. The first
 * trigger schedules the task after the configured delay; further triggers
 * before it runs are absorbed. Since the task reads its input when it runs,
 * it always works on the latest state. A trigger arriving while the task
 * runs schedules one more run.
 */
public class RecomputeScheduler {

    private static final Logger log = LoggerFactory.getLogger(RecomputeScheduler.class);

    private final Runnable task;
    private final ScheduledExecutorService executor;
    private final long delayMillis;

    private ScheduledFuture<?> scheduled;

    private boolean stopped;

    public RecomputeScheduler(@Nonnull Runnable task, @Nonnull ScheduledExecutorService executor, long delayMillis) {
        checkArgument(delayMillis >= 0);
        this.task = checkNotNull(task);
        this.executor = checkNotNull(executor);
        this.delayMillis = delayMillis;
    }

    /**
     * Requests a run of the task.
     *
     * @return {@code true} if a new run was scheduled, {@code false} if the
     *         trigger was absorbed by a pending run or the scheduler is
     *         stopped
     */
    public synchronized boolean trigger() {
        if (stopped || scheduled != null) {
            return false;
        }
        try {
            scheduled = executor.schedule(new Runnable() {
                @Override
                public void run() {
                    runTask();
                }
            }, delayMillis, TimeUnit.MILLISECONDS);
            return true;
        } catch (RejectedExecutionException e) {
            log.warn("Could not schedule recompute, executor is shut down", e);
            return false;
        }
    }

    /**
     * Runs a pending task right away in the calling thread.
     *
     * @return {@code true} if a pending run was executed
     */
    public boolean flush() {
        synchronized (this) {
            if (scheduled == null || !scheduled.cancel(false)) {
                return false;
            }
        }
        runTask();
        return true;
    }

    public synchronized boolean isPending() {
        return scheduled != null;
    }

    /**
     * Cancels a pending run and ignores all further triggers.
     */
    public synchronized void stop() {
        stopped = true;
        if (scheduled != null) {
            scheduled.cancel(false);
            scheduled = null;
        }
    }

    private void runTask() {
        synchronized (this) {
            scheduled = null;
            if (stopped) {
                return;
            }
        }
        task.run();
    }

    @Override
    public String toString() {
        return "RecomputeScheduler[" + task + ']';
    }
}
