/**
 * Use cases that drive the tokenizer from a trace packet source.
 */
package ca.gc.cra.ftrace.application.pipeline;
