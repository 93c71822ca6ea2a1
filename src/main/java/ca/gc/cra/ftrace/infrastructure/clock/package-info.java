/**
 * Clock conversion adapters.
 */
package ca.gc.cra.ftrace.infrastructure.clock;
