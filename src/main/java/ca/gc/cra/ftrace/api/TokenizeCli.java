package ca.gc.cra.ftrace.api;

import ca.gc.cra.ftrace.application.pipeline.ImportSummary;
import ca.gc.cra.ftrace.application.pipeline.TraceImportUseCase;
import ca.gc.cra.ftrace.application.tokenizer.FtraceTokenizerException;
import ca.gc.cra.ftrace.config.CompositionRoot;
import ca.gc.cra.ftrace.config.ConfigDefaults;
import ca.gc.cra.ftrace.config.ConfigMerger;
import ca.gc.cra.ftrace.config.TokenizeConfig;
import ca.gc.cra.ftrace.config.YamlConfigLoader;
import ca.gc.cra.ftrace.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.ftrace.infrastructure.sink.NdjsonEventSink;
import ca.gc.cra.ftrace.logging.LoggingConfigurator;
import ca.gc.cra.ftrace.validation.Paths;
import ca.gc.cra.ftrace.validation.Strings;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@code tokenize} command: reads a trace file, tokenizes its ftrace bundles and writes the events as NDJSON.
 */
public final class TokenizeCli {
  private static final Logger log = LoggerFactory.getLogger(TokenizeCli.class);
  private static final String SUMMARY_USAGE =
      "usage: tokenize in=TRACE [out=DIR] [compactSchedClockFailure=ABORT_BATCH|SKIP_ROW] "
          + "[unsupportedClock=FAIL|SKIP] [includeEventPayload=true|false] [config=FILE.yaml] "
          + "[--dry-run] [--allow-overwrite] [metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      ftrace tokenize

      Usage:
        tokenize in=./trace.pftrace out=./tokenized [options]

      Required:
        in=PATH                      Trace file (serialized Trace message)

      Optional:
        out=DIR                      Output directory for events.ndjson (default ~/.ftrace/out)
        compactSchedClockFailure=ABORT_BATCH|SKIP_ROW
                                     On a compact sched row whose clock cannot be converted, drop the rest
                                     of the batch (default) or only that row
        unsupportedClock=FAIL|SKIP   Abort on bundles with a local/unknown clock (default) or skip them
        includeEventPayload=true|false  Hex-encode raw ftrace events in the output (default false)
        config=FILE.yaml             Load 'common' and 'tokenize' sections; CLI values win
        --dry-run                    Validate inputs and print the plan without tokenizing
        --allow-overwrite            Permit writing into a non-empty output directory
        metricsExporter=otlp|none    Export counters with OpenTelemetry (default none)
        otelEndpoint=URL             OTLP gRPC endpoint when metricsExporter=otlp
        otelResourceAttributes=K=V,...  Extra OpenTelemetry resource attributes
        --verbose                    Enable DEBUG logging
        --help                       Show this message
      """;

  private TokenizeCli() {}

  /**
   * Runs the command.
   *
   * @param args command arguments
   * @return exit code describing the outcome
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for tokenize");
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Optional<Map<String, String>> yaml = Optional.empty();
    String configPath = kv.remove("config");
    if (configPath != null && !configPath.isBlank()) {
      Path yamlPath = Path.of(configPath.trim());
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        return ExitCode.CONFIG_ERROR;
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, "tokenize");
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> effective;
    TokenizeConfig config;
    boolean dryRun;
    boolean allowOverwrite;
    try {
      effective = ConfigMerger.buildEffectiveConfig(yaml, kv, ConfigDefaults.forTokenize(), log::warn);
      dryRun = input.hasFlag("--dry-run") || Strings.parseBoolean("dryRun", effective.get("dryRun"), false);
      allowOverwrite = input.hasFlag("--allow-overwrite")
          || Strings.parseBoolean("allowOverwrite", effective.get("allowOverwrite"), false);
      config = TokenizeConfig.fromMap(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid tokenize arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    Path outputDirectory;
    try {
      Paths.validateReadableFile("in", config.input());
      outputDirectory = Paths.validateWritableDir(config.outputDirectory(), !dryRun, allowOverwrite);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid tokenize path configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    if (dryRun) {
      printDryRunPlan(config, outputDirectory, allowOverwrite);
      return ExitCode.SUCCESS;
    }

    try (OpenTelemetryMetricsAdapter exporter = new OpenTelemetryMetricsAdapter(config.telemetry())) {
      CompositionRoot root = new CompositionRoot(config, exporter);
      TraceImportUseCase useCase = root.traceImportUseCase();
      log.info("Tokenizing {} into {}", config.input(), outputDirectory);
      ImportSummary summary = useCase.run();
      exporter.forceFlush();
      printSummary(summary, root.stats().snapshot(), outputDirectory);
      return ExitCode.SUCCESS;
    } catch (FtraceTokenizerException ex) {
      log.error("Trace rejected: {} (clock {})", ex.getMessage(), ex.clock());
      return ExitCode.DECODE_ERROR;
    } catch (IOException ex) {
      log.error("Tokenize I/O failure for {}", config.input(), ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Tokenize configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Tokenize interrupted; shutting down", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while tokenizing", ex);
      return ExitCode.RUNTIME_FAILURE;
    } catch (Exception ex) {
      log.error("Unexpected checked exception while tokenizing", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void printDryRunPlan(TokenizeConfig config, Path outputDirectory, boolean allowOverwrite) {
    CliPrinter.printLines(
        "Tokenize dry-run: no files will be produced.",
        " Input trace               : " + config.input(),
        " Output file               : " + outputDirectory.resolve(NdjsonEventSink.FILE_NAME),
        " Compact sched clock fail  : " + config.compactSchedClockFailure(),
        " Unsupported clock         : " + config.unsupportedClock(),
        " Include event payload     : " + config.includeEventPayload(),
        " Metrics exporter          : " + config.telemetry().exporter(),
        " Allow overwrite           : " + allowOverwrite,
        " Re-run without --dry-run to tokenize.");
  }

  private static void printSummary(ImportSummary summary, Map<String, Long> counters, Path outputDirectory) {
    CliPrinter.printLines(
        "Tokenize complete: " + outputDirectory.resolve(NdjsonEventSink.FILE_NAME),
        " Packets read        : " + summary.packetsRead(),
        " Bundles tokenized   : " + summary.bundlesTokenized(),
        " Bundles skipped     : " + summary.bundlesSkipped(),
        " Clock snapshots     : " + summary.clockSnapshots(),
        " Malformed packets   : " + summary.malformedPackets(),
        " Counters:");
    counters.forEach((name, value) -> CliPrinter.println("  " + name + " = " + value));
  }
}
