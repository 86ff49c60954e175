/**
 * Executor factories for pipeline stage threads.
 * <p><strong>Role:</strong> Infrastructure utilities configuring the one-thread-per-stage executor.</p>
 * <p><strong>Concurrency:</strong> Threads are non-daemon so a JVM shutdown waits for stages to drain.</p>
 */
package ca.gc.cra.geotag.infrastructure.exec;
