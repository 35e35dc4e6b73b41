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
package io.pathtrace.api;

import javax.annotation.Nullable;

/**
 * A single traced operation.
 * <p>
 * A tracer moves strictly from <em>created</em> to <em>started</em> to <em>ended</em>.
 * Starting a tracer attaches it to the calling thread's path:
 * if another tracer is active on that thread, the new tracer becomes its child.
 * </p>
 * <p>
 * A tracer is bound to the thread which created it.
 * Calling any method from another thread throws a {@link ThreadAffinityException}.
 * </p>
 * <p>
 * The preferred way to use a tracer is {@link #call(TracedCallable)} or {@link #run(TracedRunnable)},
 * which start the tracer, record a failure escaping the block and always end the tracer:
 * </p>
 * <pre>
 * sdk.traceSqlDatabaseRequest(database, "SELECT * FROM users").run(() -&gt; executeQuery());
 * </pre>
 * Alternatively, use the tracer manually:
 * <pre>
 * DatabaseRequestTracer tracer = sdk.traceSqlDatabaseRequest(database, "SELECT * FROM users");
 * tracer.start();
 * try {
 *     executeQuery();
 * } catch (Exception e) {
 *     tracer.markFailed(e);
 *     throw e;
 * } finally {
 *     tracer.end();
 * }
 * </pre>
 */
public interface Tracer extends AutoCloseable {

    /**
     * Starts this tracer and pushes it onto the path of the current thread.
     *
     * @throws IllegalStateException   if the tracer has already been started or ended
     * @throws ThreadAffinityException if called from another thread than the one which created the tracer
     * @throws PathStructureException  if the path of the current thread is too deep
     */
    void start();

    /**
     * Ends this tracer.
     * <p>
     * Ending an ended tracer has no effect.
     * Ending a tracer which has not been started discards it.
     * </p>
     *
     * @throws PathStructureException  if a child of this tracer is still running,
     *                                 or if this tracer is not the innermost active tracer of its path
     * @throws ThreadAffinityException if called from another thread than the one which created the tracer
     */
    void end();

    /**
     * Same as {@link #end()}, so that tracers can be used in try-with-resources statements.
     */
    @Override
    void close();

    /**
     * Marks this tracer as failed.
     * May only be called once, while the tracer is started.
     *
     * @param errorClass the (fully qualified) class name of the error
     * @param message    a description of the error
     * @throws IllegalStateException if the tracer is not started or has already been marked as failed
     */
    void markFailed(@Nullable String errorClass, @Nullable String message);

    /**
     * Marks this tracer as failed, using the fully qualified class name and the message of the throwable.
     *
     * @param throwable the cause of the failure
     * @see #markFailed(String, String)
     */
    void markFailed(Throwable throwable);

    /**
     * Starts this tracer, calls the callable and ends the tracer.
     * If the callable throws, the throwable is recorded with {@link #markFailed(Throwable)}
     * (unless the tracer has already been marked as failed) and rethrown.
     *
     * @param callable the traced code
     * @param <T>      the result type
     * @param <E>      the exception type the callable may throw
     * @return the result of the callable
     * @throws E the exception thrown by the callable
     */
    <T, E extends Exception> T call(TracedCallable<T, E> callable) throws E;

    /**
     * Like {@link #call(TracedCallable)}, for code without a result.
     *
     * @param runnable the traced code
     * @param <E>      the exception type the runnable may throw
     * @throws E the exception thrown by the runnable
     */
    <E extends Exception> void run(TracedRunnable<E> runnable) throws E;
}
