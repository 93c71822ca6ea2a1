/**
 * Input validation for configuration and command-line values.
 */
package ca.gc.cra.ftrace.validation;
