package ca.gc.cra.mimetic.api;

import ca.gc.cra.mimetic.config.ActuatorSlotConfig;
import ca.gc.cra.mimetic.config.ConfigMerger;
import ca.gc.cra.mimetic.config.DefaultsForMode;
import ca.gc.cra.mimetic.config.MimicConfig;
import ca.gc.cra.mimetic.config.YamlConfigLoader;
import ca.gc.cra.mimetic.infrastructure.metrics.TelemetrySettings;
import ca.gc.cra.mimetic.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Configuration steps shared by {@code run} and {@code calibrate}: argument parsing, YAML loading,
 * precedence merge, telemetry extraction and session config validation.
 */
final class SessionCliSupport {
  private static final Logger log = LoggerFactory.getLogger(SessionCliSupport.class);

  private SessionCliSupport() {}

  /**
   * Resolves the effective configuration for a command.
   *
   * @param mode {@code run} or {@code calibrate}
   * @param input parsed command-line input
   * @param usage one-line usage printed after argument errors
   * @return validated inputs for the command
   * @throws CliAbort carrying the exit code when anything is rejected
   */
  static Prepared prepare(String mode, CliInput input, String usage) throws CliAbort {
    Map<String, String> cli;
    try {
      cli = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      throw invalid("Invalid argument: {}", ex.getMessage(), usage);
    }

    String configPath = ConfigCliUtils.extractConfigPath(cli);
    Optional<Map<String, String>> yaml = loadYaml(configPath, mode, usage);

    Map<String, String> effective;
    try {
      effective = new LinkedHashMap<>(ConfigMerger.buildEffectiveConfig(
          mode, yaml, cli, DefaultsForMode.asFlatMap(mode), log::warn));
    } catch (IllegalArgumentException ex) {
      throw invalid("Invalid " + mode + " configuration: {}", ex.getMessage(), usage);
    }

    try {
      if (!input.verbose() && ConfigCliUtils.parseBoolean(effective, "verbose")) {
        LoggingConfigurator.enableVerboseLogging();
        log.debug("Verbose logging enabled from configuration");
      }
      boolean dryRun = input.dryRun() || ConfigCliUtils.parseBoolean(effective, "dryRun");
      TelemetrySettings telemetry = TelemetryConfigurator.extract(effective);
      MimicConfig config = MimicConfig.fromMap(effective);
      return new Prepared(config, telemetry, dryRun);
    } catch (IllegalArgumentException ex) {
      throw invalid("Invalid " + mode + " arguments: {}", ex.getMessage(), usage);
    }
  }

  /**
   * Lines describing what a command would do, printed for {@code --dry-run}.
   *
   * @param mode command name
   * @param prepared resolved inputs
   * @return plan lines
   */
  static String[] plan(String mode, Prepared prepared) {
    MimicConfig config = prepared.config();
    List<String> lines = new ArrayList<>();
    lines.add("MIMETIC " + mode + " dry-run plan:");
    lines.add("  source          : " + config.source() + " (" + config.frameWidth() + "x"
        + config.frameHeight() + " @ " + config.captureFps() + " fps)");
    lines.add("  detector        : " + config.detector().name().toLowerCase(Locale.ROOT)
        + (config.detectorEndpoint() == null ? "" : " at " + config.detectorEndpoint()));
    lines.add("  detect size     : " + config.session().detectWidth() + "x" + config.session().detectHeight()
        + (config.session().mirror() ? " mirrored" : ""));
    lines.add("  pairing         : " + config.fusion().policy().name().toLowerCase(Locale.ROOT)
        + " (ring " + config.fusion().capacity() + ")");
    if (config.actuators().isEmpty()) {
      lines.add("  actuators       : none");
    }
    for (ActuatorSlotConfig slot : config.actuators()) {
      lines.add("  actuator " + slot.name() + " : " + slot.positionUri() + (slot.enabled() ? "" : " (disabled)"));
    }
    lines.add("  target fps      : " + config.session().targetFps());
    lines.add("  send rate       : " + config.session().smoothing().rateHz() + " Hz, threshold "
        + config.session().smoothing().threshold());
    lines.add("  calibrate       : " + (mode.equals("calibrate") || config.calibrate()));
    lines.add("  pose log        : " + config.poseLogPath().map(Path::toString).orElse("disabled"));
    lines.add("  run for         : " + (config.runFor().isZero() ? "until interrupted" : config.runFor()));
    lines.add("  metrics         : " + prepared.telemetry().exporter()
        + (prepared.telemetry().enabled() ? " -> " + prepared.telemetry().endpoint() : ""));
    return lines.toArray(String[]::new);
  }

  private static Optional<Map<String, String>> loadYaml(String configPath, String mode, String usage)
      throws CliAbort {
    if (configPath == null) {
      return Optional.empty();
    }
    Path path = Path.of(configPath);
    if (!Files.isRegularFile(path)) {
      throw invalid("Configuration file does not exist: {}", path, usage);
    }
    try {
      return YamlConfigLoader.load(path, mode);
    } catch (IllegalArgumentException ex) {
      throw invalid("Invalid YAML configuration: {}", ex.getMessage(), usage);
    } catch (IOException ex) {
      log.error("Unable to read configuration file {}", path, ex);
      throw new CliAbort(ExitCode.IO_ERROR);
    }
  }

  private static CliAbort invalid(String message, Object detail, String usage) {
    log.error(message, detail);
    CliPrinter.println(usage);
    return new CliAbort(ExitCode.INVALID_ARGS);
  }

  /**
   * Resolved command inputs.
   *
   * @param config session configuration
   * @param telemetry metrics exporter settings
   * @param dryRun print the plan instead of running
   */
  record Prepared(MimicConfig config, TelemetrySettings telemetry, boolean dryRun) {}

  /** Stops a command early with a specific exit code; the cause has already been logged. */
  static final class CliAbort extends Exception {
    private static final long serialVersionUID = 1L;
    private final transient ExitCode exitCode;

    CliAbort(ExitCode exitCode) {
      super(null, null, false, false);
      this.exitCode = exitCode;
    }

    ExitCode exitCode() {
      return exitCode;
    }
  }
}
