package ca.gc.cra.vartrunc.api;

import ca.gc.cra.vartrunc.application.json.CompactJsonWriter;
import ca.gc.cra.vartrunc.application.json.JsonSupport;
import ca.gc.cra.vartrunc.application.port.MetricsPort;
import ca.gc.cra.vartrunc.application.truncate.JsonSizeEstimator;
import ca.gc.cra.vartrunc.application.truncate.TruncationResult;
import ca.gc.cra.vartrunc.application.truncate.ValueTruncator;
import ca.gc.cra.vartrunc.config.TruncatorConfig;
import ca.gc.cra.vartrunc.domain.segment.Segments;
import ca.gc.cra.vartrunc.domain.value.MaxDepthExceededException;
import ca.gc.cra.vartrunc.domain.value.Value;
import ca.gc.cra.vartrunc.logging.LoggingConfigurator;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Truncates a JSON document read from a file and prints the compact result.
 *
 * @since 0.1.0
 */
public final class TruncateCli {
  private static final Logger log = LoggerFactory.getLogger(TruncateCli.class);
  private static final String SECTION = "truncate";
  private static final String SUMMARY_USAGE =
      "usage: truncate in=FILE [config=FILE.yaml] [stringLengthLimit=N] [arrayElementLimit=N] "
          + "[maxSizeBytes=N] [arrayItemCharLimit=N] [objectValueCharLimit=N] "
          + "[metricsExporter=otlp|none] [otelEndpoint=URL]";
  private static final String HELP_TEXT = """
      VARTRUNC truncate

      Usage:
        truncate in=./payload.json [options]

      Required:
        in=FILE                    JSON document to truncate

      Optional (validated):
        config=FILE.yaml           YAML file; 'common' and 'truncate' sections apply
        stringLengthLimit=N        Characters kept per string, ellipsis included (default 5000, min 4)
        arrayElementLimit=N        Elements kept per array (default 100, min 1)
        maxSizeBytes=N             Compact-JSON byte budget of the result (default 10240)
        arrayItemCharLimit=N       Ceiling for strings nested in arrays (default 1000)
        objectValueCharLimit=N     Ceiling for strings nested in objects (default 5000)
        metricsExporter=otlp|none  Configure metrics exporter (default none)
        otelEndpoint=URL           OTLP metrics endpoint when exporter=otlp
        --verbose                  Enable DEBUG logging
        --help                     Show this message

      Output:
        The truncated document as compact JSON, then a line truncated=true|false.
        Precedence is CLI > YAML > defaults.
      """;

  private TruncateCli() {}

  /**
   * Entry point invoked by the JVM.
   *
   * @param args raw CLI arguments
   */
  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
      log.debug("Verbose logging enabled for truncate CLI");
    }

    Map<String, String> effective;
    try {
      input.requireNoWords();
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      effective = ConfigCliUtils.effectiveConfig(SECTION, kv, log);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid truncate arguments: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Unable to read configuration file", ex);
      return ExitCode.IO_ERROR;
    }
    if (ConfigCliUtils.parseBoolean(effective, "verbose")) {
      LoggingConfigurator.enableVerboseLogging();
    }

    String in = effective.get("in");
    if (in == null || in.isBlank()) {
      log.error("Invalid truncate arguments: in is required");
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    Path inputPath = Path.of(in).toAbsolutePath().normalize();
    if (!Files.isRegularFile(inputPath)) {
      log.error("Input file does not exist: {}", inputPath);
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    TruncatorConfig config;
    MetricsPort metrics;
    try {
      config = TruncatorConfig.fromMap(effective);
      metrics = TelemetryConfigurator.configureMetrics(effective);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid truncate configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }

    try {
      Value value = new JsonSupport().parse(Files.readString(inputPath, StandardCharsets.UTF_8));
      TruncationResult result = new ValueTruncator(config, metrics).truncateValue(value);
      String json = new CompactJsonWriter().write(Segments.valueOf(result.result()));
      log.info("Truncated {} from {} bytes to {} bytes (truncated={}, result={})",
          inputPath, JsonSizeEstimator.estimate(value), JsonSizeEstimator.utf8Length(json),
          result.truncated(), result.result().type());
      CliPrinter.printLines(json, "truncated=" + result.truncated());
      return ExitCode.SUCCESS;
    } catch (MaxDepthExceededException ex) {
      log.error("Input document {} is nested too deeply: {}", inputPath, ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (IllegalArgumentException ex) {
      log.error("Input document {} is not valid JSON: {}", inputPath, ex.getMessage());
      return ExitCode.INVALID_ARGS;
    } catch (IOException ex) {
      log.error("Failed to read input document {}", inputPath, ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure while truncating {}", inputPath, ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      TelemetryConfigurator.close(metrics);
    }
  }
}
