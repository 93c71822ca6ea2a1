/**
 * Event sink adapters.
 */
package ca.gc.cra.ftrace.infrastructure.sink;
