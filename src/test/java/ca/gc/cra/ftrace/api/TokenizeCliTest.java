package ca.gc.cra.ftrace.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.ftrace.testutil.ProtoWriter;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class TokenizeCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(TokenizeCli.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
      appender.stop();
      logger.setAdditive(originalAdditive);
      logger.setLevel(originalLevel);
    }
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpPrintsCommandUsage() {
    ExitCode code = TokenizeCli.run(new String[] {"--help"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("ftrace tokenize"));
    assertTrue(buffer.toString().contains("compactSchedClockFailure"));
  }

  @Test
  void missingInputReturnsUsageAndInvalidArgs() {
    ExitCode code = TokenizeCli.run(new String[] {"out=" + tempDir.resolve("out")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: tokenize"));
    assertTrue(loggedError("in is required"));
  }

  @Test
  void unknownArgumentIsRejected() {
    ExitCode code = TokenizeCli.run(new String[] {"in=trace", "bogus=1"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(loggedError("Unknown argument key: bogus"));
  }

  @Test
  void argumentWithoutValueIsRejected() {
    ExitCode code = TokenizeCli.run(new String[] {"trace.pftrace"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: tokenize"));
  }

  @Test
  void missingInputFileReturnsInvalidArgs() {
    ExitCode code = TokenizeCli.run(new String[] {
        "in=" + tempDir.resolve("absent.pftrace"),
        "out=" + tempDir.resolve("out")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(loggedError("does not exist"));
  }

  @Test
  void missingConfigFileReturnsConfigError() {
    ExitCode code = TokenizeCli.run(new String[] {"config=" + tempDir.resolve("absent.yaml")});

    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void dryRunPrintsPlanAndDoesNotCreateOutputs() throws IOException {
    Path trace = writeTrace(bundle(0, 0, 100));
    Path out = tempDir.resolve("out");

    ExitCode code = TokenizeCli.run(new String[] {"in=" + trace, "out=" + out, "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Tokenize dry-run: no files will be produced."));
    assertFalse(Files.exists(out));
  }

  @Test
  void runWritesEventsAndPrintsSummary() throws IOException {
    Path trace = writeTrace(bundle(2, 0, 100), bundle(3, 0, 250));
    Path out = tempDir.resolve("out");

    ExitCode code = TokenizeCli.run(new String[] {"in=" + trace, "out=" + out});

    assertEquals(ExitCode.SUCCESS, code);
    List<String> lines = Files.readAllLines(out.resolve("events.ndjson"), StandardCharsets.UTF_8);
    assertEquals(2, lines.size());
    assertTrue(lines.get(0).contains("\"cpu\":2"));
    assertTrue(lines.get(1).contains("\"ts\":250"));
    String printed = buffer.toString();
    assertTrue(printed.contains("Tokenize complete:"));
    assertTrue(printed.contains("trace.bundles.tokenized = 2"));
  }

  @Test
  void localClockReturnsDecodeError() throws IOException {
    Path trace = writeTrace(bundle(0, 3, 100));

    ExitCode code = TokenizeCli.run(new String[] {"in=" + trace, "out=" + tempDir.resolve("out")});

    assertEquals(ExitCode.DECODE_ERROR, code);
    assertTrue(loggedError("local clock"));
  }

  @Test
  void localClockSkippedWhenConfigured() throws IOException {
    Path trace = writeTrace(bundle(0, 3, 100), bundle(0, 0, 200));

    ExitCode code = TokenizeCli.run(new String[] {
        "in=" + trace, "out=" + tempDir.resolve("out"), "unsupportedClock=SKIP"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("ftrace.bundle.unsupported_clock = 1"));
  }

  @Test
  void yamlConfigSuppliesSettings() throws IOException {
    Path trace = writeTrace(bundle(0, 0, 100));
    Path out = tempDir.resolve("yaml-out");
    Path yaml = tempDir.resolve("ftrace.yaml");
    Files.writeString(yaml, "tokenize:\n  in: " + trace + "\n  out: " + out + "\n  includeEventPayload: true\n");

    ExitCode code = TokenizeCli.run(new String[] {"config=" + yaml});

    assertEquals(ExitCode.SUCCESS, code);
    String content = Files.readString(out.resolve("events.ndjson"), StandardCharsets.UTF_8);
    assertTrue(content.contains("\"payload\":\"08"));
  }

  @Test
  void nonEmptyOutputRequiresAllowOverwrite() throws IOException {
    Path trace = writeTrace(bundle(0, 0, 100));
    Path out = Files.createDirectory(tempDir.resolve("out"));
    Files.writeString(out.resolve("events.ndjson"), "stale\n");

    ExitCode rejected = TokenizeCli.run(new String[] {"in=" + trace, "out=" + out});
    ExitCode accepted = TokenizeCli.run(new String[] {"in=" + trace, "out=" + out, "--allow-overwrite"});

    assertEquals(ExitCode.INVALID_ARGS, rejected);
    assertEquals(ExitCode.SUCCESS, accepted);
    assertFalse(Files.readString(out.resolve("events.ndjson")).contains("stale"));
  }

  private boolean loggedError(String fragment) {
    return appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR && event.getFormattedMessage().contains(fragment));
  }

  private Path writeTrace(ProtoWriter... bundles) throws IOException {
    ProtoWriter trace = new ProtoWriter();
    for (ProtoWriter bundle : bundles) {
      trace.message(1, new ProtoWriter().message(1, bundle));
    }
    Path path = tempDir.resolve("trace.pftrace");
    Files.write(path, trace.toByteArray());
    return path;
  }

  private static ProtoWriter bundle(int cpu, int ftraceClock, long timestamp) {
    ProtoWriter event = new ProtoWriter().varint(1, timestamp).varint(2, 77).bytes(4, new byte[10]);
    ProtoWriter bundle = new ProtoWriter().varint(1, cpu).message(2, event);
    if (ftraceClock != 0) {
      bundle.varint(5, ftraceClock);
    }
    return bundle;
  }
}
