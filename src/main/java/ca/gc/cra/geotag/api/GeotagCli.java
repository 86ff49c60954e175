package ca.gc.cra.geotag.api;

import ca.gc.cra.geotag.application.pipeline.GeotagUseCase;
import ca.gc.cra.geotag.application.pipeline.RunSummary;
import ca.gc.cra.geotag.application.port.MetricsPort;
import ca.gc.cra.geotag.config.CompositionRoot;
import ca.gc.cra.geotag.config.ConfigMerger;
import ca.gc.cra.geotag.config.DefaultsForMode;
import ca.gc.cra.geotag.config.GeotagConfig;
import ca.gc.cra.geotag.config.YamlConfigLoader;
import ca.gc.cra.geotag.infrastructure.metrics.NoOpMetricsAdapter;
import ca.gc.cra.geotag.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import ca.gc.cra.geotag.logging.LoggingConfigurator;
import ca.gc.cra.geotag.logging.Logs;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@code geotag run} and {@code geotag plan} subcommands.
 * <p><strong>Flow:</strong> flags and {@code key=value} pairs are parsed, an optional YAML file is layered over
 * the mode defaults, the merged map is validated into {@link GeotagConfig}, and {@link CompositionRoot} builds the
 * run. {@code plan} stops after printing the effective settings and active stages.</p>
 * <p><strong>Interrupts:</strong> during {@code run} a JVM shutdown hook (SIGINT) asks the driver to stop
 * submitting and waits until queued photos have drained.</p>
 *
 * @since 0.1.0
 */
public final class GeotagCli {
  private static final Logger log = LoggerFactory.getLogger(GeotagCli.class);
  private static final Set<String> KNOWN_FLAGS =
      Set.of("--help", "--verbose", "--dry-run", "--overwrite", "--geocode");
  private static final Set<String> SECRET_KEYS = Set.of("geonamesUser");
  static final String SUMMARY_USAGE =
      "usage: geotag <run|plan> photos=DIR [gpx=FILE] [augment=CSV] [results=CSV] [geocode=true "
          + "geonamesUser=NAME] [config=YAML] [--dry-run] [--overwrite] [--verbose]";
  static final String HELP_TEXT = """
      GEOTAG photo geotagging pipeline

      Usage:
        geotag run  [options]   Correlate, geocode and write metadata for every photo
        geotag plan [options]   Print the effective settings and active stages; touches nothing

      Inputs:
        photos=DIR                Photo directory; metadata lives in <photo>.json sidecars (required)
        gpx=FILE                  GPS track (GPX 1.0/1.1); enables the correlate stage
        augment=CSV               Prior results (File,Latitude,Longitude,Elevation,City,ProvinceState,CountryName)
        config=FILE               YAML file with 'common' and 'geotag' sections

      Correlation:
        policy=average|nearest|next|prev   Position choice between track points (default average)
        maxDelta=SECONDS          Time gap threshold (default 600)
        maxDistance=METRES        Track gap distance threshold (default 1000)
        satisfy=any|all           Whether one or both thresholds must hold (default any)
        timezone=ZONE|auto        Camera clock zone (default UTC); auto asks GeoNames for the first track point
        timeOffset=SECONDS        Camera clock error, positive when the camera runs ahead (default 0)

      Geocoding:
        geocode=true              Resolve City/ProvinceState/CountryName
        geonamesUser=NAME         GeoNames account name
        geonamesUrl=URL           Service root (default http://api.geonames.org)
        throttle=PER_HOUR         Maximum lookups per hour, 0 for unlimited (default 0)
        countryFields.<Country>=CITY_FIELD,PROVINCE_FIELD   Per-country locality fields

      Output:
        results=CSV               One row per photo (File,Date,Latitude,Longitude,Elevation,City,...)
        queueCapacity=N           Inter-stage queue capacity, 1-1024 (default 16)
        metricsExporter=otlp|none OpenTelemetry metrics exporter (default otlp)
        otelEndpoint=URL          OTLP endpoint
        otelResourceAttributes=K=V,...

      Flags:
        --dry-run                 Do not write metadata sidecars
        --overwrite               Replace positions and place names photos already carry
        --geocode                 Same as geocode=true
        --verbose                 Enable DEBUG logging
        --help                    Show this message
      """;

  private GeotagCli() {}

  /**
   * Runs a subcommand.
   *
   * @param mode {@code run} or {@code plan}
   * @param args arguments following the subcommand
   * @return exit status
   */
  static ExitCode run(String mode, String[] args) {
    CliInput input = CliInput.parse(args);
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }
    for (String flag : input.flags()) {
      if (!KNOWN_FLAGS.contains(flag)) {
        log.error("Unknown flag: {}", flag);
        CliPrinter.println(SUMMARY_USAGE);
        return ExitCode.INVALID_ARGS;
      }
    }

    Map<String, String> kv;
    try {
      kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_ARGS;
    }
    ConfigCliUtils.applyFlags(input, kv);

    Optional<Map<String, String>> yaml = Optional.empty();
    String configPath = ConfigCliUtils.extractConfigPath(kv);
    if (configPath != null) {
      Path yamlPath = Path.of(configPath);
      if (!Files.exists(yamlPath)) {
        log.error("Configuration file does not exist: {}", yamlPath);
        return ExitCode.CONFIG_ERROR;
      }
      try {
        yaml = YamlConfigLoader.load(yamlPath, YamlConfigLoader.GEOTAG_SECTION);
      } catch (IllegalArgumentException ex) {
        log.error("Invalid YAML configuration: {}", ex.getMessage());
        return ExitCode.CONFIG_ERROR;
      } catch (IOException ex) {
        log.error("Unable to read configuration file {}", yamlPath, ex);
        return ExitCode.IO_ERROR;
      }
    }

    Map<String, String> effective;
    String exporter;
    GeotagConfig config;
    try {
      effective = ConfigMerger.buildEffectiveConfig(yaml, kv, DefaultsForMode.asFlatMap(mode), log::warn);
      Map<String, String> configInputs = new LinkedHashMap<>(effective);
      exporter = TelemetryConfigurator.configureMetrics(configInputs);
      config = GeotagConfig.fromMap(configInputs);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode, ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.CONFIG_ERROR;
    }

    if ("plan".equals(mode)) {
      return plan(config, effective);
    }
    MetricsPort metrics = "none".equals(exporter) ? new NoOpMetricsAdapter() : new OpenTelemetryMetricsAdapter();
    try {
      return execute(new CompositionRoot(config, metrics));
    } finally {
      if (metrics instanceof OpenTelemetryMetricsAdapter otel) {
        otel.close();
      }
    }
  }

  static ExitCode execute(CompositionRoot root) {
    GeotagUseCase useCase;
    try {
      useCase = root.geotagUseCase();
    } catch (IOException ex) {
      log.error("Unable to prepare geotag run: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    }

    Thread hook = new Thread(() -> {
      useCase.requestStop();
      try {
        useCase.awaitCompletion();
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
        log.warn("Shutdown hook interrupted before the pipeline drained");
      }
    }, "geotag-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);
    try {
      RunSummary summary = useCase.run();
      CliPrinter.println(String.format(
          "stages=%s photos=%d submitted=%d written=%d dropped=%d%s",
          String.join(">", summary.stages()),
          summary.discovered(),
          summary.submitted(),
          summary.written(),
          summary.dropped(),
          summary.interrupted() ? " interrupted" : ""));
      return summary.interrupted() ? ExitCode.INTERRUPTED : ExitCode.SUCCESS;
    } catch (IOException ex) {
      log.error("Geotag run failed: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in geotag run", ex);
      return ExitCode.RUNTIME_FAILURE;
    } finally {
      removeHook(hook);
    }
  }

  private static ExitCode plan(GeotagConfig config, Map<String, String> effective) {
    List<String> stages;
    try {
      stages = new CompositionRoot(config, new NoOpMetricsAdapter()).plannedStages();
    } catch (IOException ex) {
      log.error("Unable to read track for plan: {}", ex.getMessage(), ex);
      return ExitCode.IO_ERROR;
    }
    List<String> lines = new ArrayList<>();
    lines.add("GEOTAG plan");
    lines.add("  stages: " + String.join(" > ", stages));
    if (config.gpx().isPresent() && !stages.contains("correlate")) {
      lines.add("  note: track has no usable points; correlation disabled");
    }
    lines.add("  settings:");
    for (Map.Entry<String, String> entry : new TreeMap<>(effective).entrySet()) {
      String value = SECRET_KEYS.contains(entry.getKey()) ? Logs.redact(entry.getValue()) : entry.getValue();
      lines.add("    " + entry.getKey() + "=" + value);
    }
    CliPrinter.printLines(lines);
    return ExitCode.SUCCESS;
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM already shutting down; shutdown hook stays registered");
    }
  }
}
