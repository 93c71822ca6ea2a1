/**
 * Metrics adapters: readable in-process counters and OpenTelemetry export.
 */
package ca.gc.cra.ftrace.infrastructure.metrics;
