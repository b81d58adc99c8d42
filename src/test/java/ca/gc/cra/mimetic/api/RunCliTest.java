package ca.gc.cra.mimetic.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class RunCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(SessionCliSupport.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    CliPrinter.clearTestWriter();
  }

  private boolean hasLogContaining(String text) {
    return appender.list.stream().anyMatch(event -> event.getFormattedMessage().contains(text));
  }

  @Test
  void dryRunPrintsPlanWithYamlAndCliOverrides() throws IOException {
    Path yaml = tempDir.resolve("mimetic.yaml");
    Files.writeString(yaml, """
        common:
          pairing: strict
          actuator:
            left:
              endpoint: 10.0.0.1:8000
        run:
          targetFps: 20
        """);

    ExitCode code = RunCli.run(new String[] {
        "config=" + yaml, "targetFps=15", "actuator.mimetic.endpoint=", "--dry-run"});

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("MIMETIC run dry-run plan:"), out);
    assertTrue(out.contains("pairing         : strict"), out);
    assertTrue(out.contains("actuator left : http://10.0.0.1:8000/position"), out);
    assertFalse(out.contains("actuator mimetic"), out);
    assertTrue(out.contains("target fps      : 15"), out);
    assertTrue(hasLogContaining("CLI overrides YAML for key: targetFps"));
  }

  @Test
  void dryRunFromConfigValue() {
    assertEquals(ExitCode.SUCCESS, RunCli.run(new String[] {"dryRun=true"}));
    assertTrue(buffer.toString().contains("dry-run plan"));
  }

  @Test
  void malformedArgumentPrintsUsage() {
    ExitCode code = RunCli.run(new String[] {"targetFps"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: run"));
    assertTrue(hasLogContaining("expected key=value"));
  }

  @Test
  void invalidValueIsRejected() {
    ExitCode code = RunCli.run(new String[] {"alpha.x=2", "--dry-run"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(hasLogContaining("Invalid run arguments"));
  }

  @Test
  void httpDetectorWithoutEndpointIsRejected() {
    assertEquals(ExitCode.INVALID_ARGS, RunCli.run(new String[] {"detector=http", "--dry-run"}));
    assertTrue(hasLogContaining("detectorEndpoint is required"));
  }

  @Test
  void missingConfigFileIsRejected() {
    ExitCode code = RunCli.run(new String[] {"config=" + tempDir.resolve("absent.yaml")});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(hasLogContaining("Configuration file does not exist"));
  }

  @Test
  void helpPrintsOptions() {
    assertEquals(ExitCode.SUCCESS, RunCli.run(new String[] {"-h"}));
    assertTrue(buffer.toString().contains("actuator.NAME.endpoint=HOST:PORT"));
    assertTrue(buffer.toString().contains("threshold=N                  Minimum smoothed change, in degrees"));
    assertFalse(buffer.toString().contains("actuator change"));
  }

  @Test
  void shortSyntheticRunWritesPoseLog() throws IOException {
    Path poseLog = tempDir.resolve("poses.ndjson");

    ExitCode code = RunCli.run(new String[] {
        "actuator.mimetic.endpoint=",
        "frameWidth=64",
        "frameHeight=48",
        "captureFps=60",
        "poseLog=" + poseLog,
        "runForMs=600"});

    assertEquals(ExitCode.SUCCESS, code);
    List<String> lines = Files.readAllLines(poseLog);
    assertFalse(lines.isEmpty());
    assertTrue(lines.get(0).startsWith("{\"timestamp\":"), lines.get(0));
  }
}
