/**
 * Use case orchestrating session analysis across a bounded worker pool.
 * <p><strong>Role:</strong> Application layer; driven by the CLI, drives bundle sources and report sinks.</p>
 * <p><strong>Concurrency:</strong> One worker per session at a time; results are joined before reporting.</p>
 * <p><strong>Metrics:</strong> Emits {@code analysis.sessions.*}, {@code analysis.connections.*} and
 * {@code analysis.session.*} observations.</p>
 */
package ca.gc.cra.warden.application.pipeline;
