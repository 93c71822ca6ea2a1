/**
 * String pool adapters.
 */
package ca.gc.cra.ftrace.infrastructure.strings;
