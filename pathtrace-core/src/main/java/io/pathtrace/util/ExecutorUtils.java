/*
 * Licensed to Elasticsearch B.V. under one or more contributor
 * license agreements. See the NOTICE file distributed with
 * this work for additional information regarding copyright
 * ownership. Elasticsearch B.V. licenses this file to you under
 * the Apache License, Version 2.0 (the "License"); you may
 * not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */
package io.pathtrace.util;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.annotation.Nullable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledThreadPoolExecutor;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;

public final class ExecutorUtils {

    private static final Logger logger = LoggerFactory.getLogger(ExecutorUtils.class);
    private static final String THREAD_PREFIX = "pathtrace-";

    private ExecutorUtils() {
    }

    /**
     * Creates a scheduler backed by a single daemon thread named {@code pathtrace-<threadPurpose>},
     * so that background work of pathtrace never keeps the application from exiting.
     * Failures of scheduled tasks are logged.
     */
    public static ScheduledThreadPoolExecutor createSingleThreadSchedulingDaemonPool(final String threadPurpose) {
        final ScheduledThreadPoolExecutor executor = new ScheduledThreadPoolExecutor(1, new DaemonThreadFactory(THREAD_PREFIX + threadPurpose)) {
            @Override
            protected void afterExecute(Runnable r, Throwable t) {
                super.afterExecute(r, t);
                logFailure(threadPurpose, r, t);
            }

            @Override
            public String toString() {
                return THREAD_PREFIX + threadPurpose + " scheduler";
            }
        };
        executor.setMaximumPoolSize(1);
        executor.setExecuteExistingDelayedTasksAfterShutdownPolicy(false);
        return executor;
    }

    /**
     * Interrupts the running task and waits for the executor to terminate.
     *
     * @return whether the executor has terminated within the timeout
     */
    public static boolean shutdownAndWaitTermination(ExecutorService executor, long timeoutMillis) {
        executor.shutdownNow();
        try {
            if (executor.awaitTermination(timeoutMillis, TimeUnit.MILLISECONDS)) {
                return true;
            }
            logger.warn("{} did not terminate within {} ms", executor, timeoutMillis);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
        return false;
    }

    private static void logFailure(String threadPurpose, Runnable r, @Nullable Throwable t) {
        // a periodic task that threw is done, and its exception is only accessible through the future
        if (t == null && r instanceof Future<?> && ((Future<?>) r).isDone()) {
            try {
                ((Future<?>) r).get();
            } catch (CancellationException e) {
                logger.debug("Task of {} was cancelled", threadPurpose);
            } catch (ExecutionException e) {
                t = e.getCause();
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
        if (t != null) {
            logger.error("Task of " + threadPurpose + " failed", t);
        }
    }

    private static class DaemonThreadFactory implements ThreadFactory {

        private final String threadName;

        private DaemonThreadFactory(String threadName) {
            this.threadName = threadName;
        }

        @Override
        public Thread newThread(Runnable r) {
            final Thread thread = new Thread(r, threadName);
            thread.setDaemon(true);
            logger.debug("Created thread {}", threadName);
            return thread;
        }
    }
}
