package ca.gc.cra.mimetic.api;

import ca.gc.cra.mimetic.application.pipeline.InitializationException;
import ca.gc.cra.mimetic.application.pipeline.MimicSession;
import ca.gc.cra.mimetic.config.CompositionRoot;
import ca.gc.cra.mimetic.config.MimicConfig;
import ca.gc.cra.mimetic.domain.motion.AngleOffset;
import ca.gc.cra.mimetic.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.mimetic.infrastructure.time.MonotonicClockAdapter;
import ca.gc.cra.mimetic.logging.LoggingConfigurator;
import java.io.IOException;
import java.time.Duration;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the mimicry pipeline until interrupted or until {@code runForMs} elapses.
 *
 * @since 0.1.0
 */
public final class RunCli {
  private static final Logger log = LoggerFactory.getLogger(RunCli.class);
  private static final String MODE = "run";
  private static final Duration WAIT_SLICE = Duration.ofSeconds(1);
  static final String SUMMARY_USAGE =
      "usage: run [config=PATH] [source=synthetic|images:DIR] [detector=synthetic|http] "
          + "[detectorEndpoint=HOST:PORT] [actuator.NAME.endpoint=HOST:PORT] [calibrate=true|false] "
          + "[poseLog=PATH] [runForMs=N] [--dry-run] [--verbose]";
  private static final String HELP_TEXT = """
      MIMETIC run: mirror head pose and height onto robot actuators

      Usage:
        run [config=PATH] [options]

      Sources:
        source=synthetic             Generated test pattern (default)
        source=images:DIR            Replay png/jpg/bmp files from DIR in name order
        frameWidth=N frameHeight=N   Capture size (default 640x480)
        captureFps=1-240             Camera rate (default 30)

      Detection:
        detector=synthetic|http      Landmark backend (default synthetic)
        detectorEndpoint=HOST:PORT   Landmark service; required when detector=http
        detectWidth=N detectHeight=N Size frames are scaled to before detection (default 320x180)
        mirror=true|false            Mirror frames before detection (default true)
        detectorTimeoutMs=N          Landmark request timeout (default 1000)
        pairing=latest|strict        How face and pose results are combined (default latest)

      Motion:
        targetFps=1-240              Control loop rate (default 30)
        alpha.x|y|z|h|e=0-1          Smoothing weight of the newest sample (pitch, roll, yaw, height, ears)
        sendRate=HZ                  Maximum payload rate per channel set (default 10)
        threshold=N                  Minimum smoothed change, in degrees or height units, before
                                     a payload is sent (default 2.0)
        minDurationMs=N maxDurationMs=N  Movement duration bounds
        calibrate=true|false         Capture a neutral pose before starting (default false)

      Actuators:
        actuator.NAME.endpoint=HOST:PORT  Add or replace a slot; blank removes it
        actuator.NAME.enabled=true|false  Enable or disable a slot (default true)
        sendMinIntervalMs=N          Minimum spacing between posts per slot (default 100)
        sendQueueCapacity=N          Pending payloads per slot (default 32)

      Other:
        poseLog=PATH                 Append NDJSON pose records to PATH
        runForMs=N                   Stop after N ms (default 0: until interrupted)
        metricsExporter=otlp|none    Metrics export (default none)
        otelEndpoint=URL             OTLP endpoint when metricsExporter=otlp
        otelResourceAttributes=K=V,...  Extra OpenTelemetry resource attributes
        --dry-run                    Validate and print the plan without starting
        --verbose                    Enable DEBUG logging
        --help                       Show this message
      """;

  private RunCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  /**
   * Runs the command and returns its exit code without terminating the JVM.
   *
   * @param args command arguments
   * @return exit code
   */
  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for run command");
    }

    SessionCliSupport.Prepared prepared;
    try {
      prepared = SessionCliSupport.prepare(MODE, input, SUMMARY_USAGE);
    } catch (SessionCliSupport.CliAbort abort) {
      return abort.exitCode();
    }
    if (prepared.dryRun()) {
      CliPrinter.printLines(SessionCliSupport.plan(MODE, prepared));
      return ExitCode.SUCCESS;
    }
    return execute(prepared);
  }

  private static ExitCode execute(SessionCliSupport.Prepared prepared) {
    MimicConfig config = prepared.config();
    try (OpenTelemetryMetricsAdapter metrics = new OpenTelemetryMetricsAdapter(prepared.telemetry())) {
      CompositionRoot root = new CompositionRoot(config, metrics, new MonotonicClockAdapter());
      MimicSession session = root.buildSession();
      Thread hook = new Thread(session::stop, "mimetic-shutdown");
      Runtime.getRuntime().addShutdownHook(hook);
      try {
        session.initialize();
        if (config.calibrate()) {
          AngleOffset offset = session.calibrate();
          log.info("Calibrated neutral pose: pitch={} roll={} yaw={}",
              offset.pitch(), offset.roll(), offset.yaw());
        }
        session.start();
        log.info("Mimicry running; press Ctrl+C to stop");
        awaitEnd(session, config.runFor());
      } finally {
        session.stop();
        removeHook(hook);
      }
      log.info("Mimicry stopped");
      return ExitCode.SUCCESS;
    } catch (InitializationException ex) {
      log.error("Session failed to initialize: {}", ex.getMessage());
      return ExitCode.INIT_FAILURE;
    } catch (IOException ex) {
      log.error("I/O failure while starting the session", ex);
      return ExitCode.IO_ERROR;
    } catch (IllegalArgumentException ex) {
      log.error("Session configuration error: {}", ex.getMessage(), ex);
      return ExitCode.CONFIG_ERROR;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Run interrupted; session stopped", ex);
      return ExitCode.INTERRUPTED;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in mimicry session", ex);
      return ExitCode.RUNTIME_FAILURE;
    }
  }

  private static void awaitEnd(MimicSession session, Duration runFor) throws InterruptedException {
    if (!runFor.isZero()) {
      if (!session.awaitStopped(runFor)) {
        log.info("Run duration of {} ms reached", runFor.toMillis());
      }
      return;
    }
    while (!session.awaitStopped(WAIT_SLICE)) {
      // Shutdown hook stops the session.
    }
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM already shutting down; hook left in place");
    }
  }
}
