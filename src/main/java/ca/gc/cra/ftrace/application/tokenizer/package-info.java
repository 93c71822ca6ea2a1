/**
 * Per-CPU ftrace bundle tokenization: clock domain mapping, per-event timestamp extraction, and compact scheduling
 * decoding.
 *
 * <p>Malformed input never escapes as an exception; it is reported through {@code MetricsPort} counters named in
 * {@link ca.gc.cra.ftrace.application.tokenizer.FtraceStats}.</p>
 *
 * @since 0.1.0
 */
package ca.gc.cra.ftrace.application.tokenizer;
