/**
 * Ports through which the tokenizer and the import pipeline reach clocks, strings, event sinks, trace sources, and
 * diagnostic counters.
 */
package ca.gc.cra.ftrace.application.port;
