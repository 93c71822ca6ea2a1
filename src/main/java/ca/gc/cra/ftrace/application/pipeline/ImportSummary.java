package ca.gc.cra.ftrace.application.pipeline;

/**
 * Totals reported by a completed {@link TraceImportUseCase} run.
 *
 * @param packetsRead trace packets pulled from the source
 * @param bundlesTokenized ftrace bundles handed to the tokenizer without an unsupported-clock error
 * @param bundlesSkipped bundles skipped under {@link UnsupportedClockPolicy#SKIP}
 * @param clockSnapshots clock snapshots recorded
 * @param malformedPackets packets whose fields could not be decoded
 * @since 0.1.0
 */
public record ImportSummary(
    long packetsRead, long bundlesTokenized, long bundlesSkipped, long clockSnapshots, long malformedPackets) {}
