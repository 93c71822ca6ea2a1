/**
 * Trace packet sources.
 */
package ca.gc.cra.ftrace.infrastructure.trace;
