/**
 * Configuration loading, merging and pipeline wiring for the command line.
 */
package ca.gc.cra.ftrace.config;
