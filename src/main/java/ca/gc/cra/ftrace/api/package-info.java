/**
 * Command-line entry points and argument handling.
 */
package ca.gc.cra.ftrace.api;
