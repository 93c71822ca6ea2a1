/**
 * Runtime logging controls for the command line.
 */
package ca.gc.cra.ftrace.logging;
