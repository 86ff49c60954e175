package ca.gc.cra.geotag.config;

import ca.gc.cra.geotag.application.geocode.LocationResolver;
import ca.gc.cra.geotag.application.geocode.Throttle;
import ca.gc.cra.geotag.application.pipeline.AugmentStage;
import ca.gc.cra.geotag.application.pipeline.CorrelateStage;
import ca.gc.cra.geotag.application.pipeline.GeocodeStage;
import ca.gc.cra.geotag.application.pipeline.GeotagUseCase;
import ca.gc.cra.geotag.application.pipeline.Pipeline;
import ca.gc.cra.geotag.application.pipeline.PipelineAssembler;
import ca.gc.cra.geotag.application.pipeline.WriterStage;
import ca.gc.cra.geotag.application.port.ClockPort;
import ca.gc.cra.geotag.application.port.MetadataStore;
import ca.gc.cra.geotag.application.port.MetricsPort;
import ca.gc.cra.geotag.application.port.PlaceLookup;
import ca.gc.cra.geotag.application.port.PlaceLookupException;
import ca.gc.cra.geotag.application.port.ResultSink;
import ca.gc.cra.geotag.application.port.TrackSource;
import ca.gc.cra.geotag.domain.geo.Track;
import ca.gc.cra.geotag.domain.place.CountryFieldTable;
import ca.gc.cra.geotag.infrastructure.geonames.GeoNamesPlaceLookup;
import ca.gc.cra.geotag.infrastructure.gpx.GpxTrackReader;
import ca.gc.cra.geotag.infrastructure.metadata.JsonSidecarMetadataStore;
import ca.gc.cra.geotag.infrastructure.tabular.CsvAugmentSource;
import ca.gc.cra.geotag.infrastructure.tabular.CsvResultSink;
import java.io.IOException;
import java.nio.file.Path;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Wires GEOTAG ports, adapters and stages from a {@link GeotagConfig}.
 * <p><strong>Role:</strong> The only place that knows which adapter implements each port. The CLI asks it for a
 * ready {@link GeotagUseCase} ({@code run}) or the list of stages a run would activate ({@code plan}).</p>
 * <p><strong>Startup faults:</strong> unreadable track or augment files, and a failed automatic time-zone lookup,
 * surface as {@link IOException} before any photo is touched.</p>
 * <p>Not thread-safe; used once from the CLI thread.</p>
 *
 * @since 0.1.0
 */
public final class CompositionRoot {
  private static final Logger log = LoggerFactory.getLogger(CompositionRoot.class);

  private final GeotagConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private final Function<Path, MetadataStore> storeFactory;
  private final Function<GeotagConfig, PlaceLookup> lookupFactory;
  private PlaceLookup placeLookup;
  private Track track;

  /**
   * Creates a root using the production adapters.
   *
   * @param config validated configuration
   * @param metrics metrics sink shared by every stage
   */
  public CompositionRoot(GeotagConfig config, MetricsPort metrics) {
    this(
        config,
        metrics,
        ClockPort.SYSTEM,
        JsonSidecarMetadataStore::new,
        cfg -> new GeoNamesPlaceLookup(cfg.geonamesUrl(), cfg.geonamesUser().orElseThrow()));
  }

  CompositionRoot(
      GeotagConfig config,
      MetricsPort metrics,
      ClockPort clock,
      Function<Path, MetadataStore> storeFactory,
      Function<GeotagConfig, PlaceLookup> lookupFactory) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.storeFactory = Objects.requireNonNull(storeFactory, "storeFactory");
    this.lookupFactory = Objects.requireNonNull(lookupFactory, "lookupFactory");
  }

  /**
   * Builds the use case for {@code geotag run}.
   *
   * @return unstarted use case over the configured photo directory
   * @throws IOException if a configured input cannot be read or the camera time zone cannot be resolved
   */
  public GeotagUseCase geotagUseCase() throws IOException {
    MetadataStore store = storeFactory.apply(config.photos());
    Optional<AugmentStage> augment = augmentStage();
    Optional<CorrelateStage> correlate = correlateStage();
    Optional<GeocodeStage> geocode = geocodeStage();
    ResultSink results = resultSink();
    WriterStage writer = new WriterStage(store, results, config.dryRun());
    Pipeline pipeline =
        PipelineAssembler.assemble(augment, correlate, geocode, writer, config.queueCapacity(), metrics);
    log.info("Assembled pipeline {} over {}{}", pipeline.stageNames(), config.photos(),
        config.dryRun() ? " (dry run)" : "");
    return new GeotagUseCase(store, pipeline, writer, metrics);
  }

  /**
   * Lists the stages a run would activate, without contacting the place service or opening outputs.
   *
   * @return stage names in chain order
   * @throws IOException if the track file cannot be read
   */
  public List<String> plannedStages() throws IOException {
    List<String> stages = new ArrayList<>(4);
    if (config.augment().isPresent()) {
      stages.add("augment");
    }
    if (config.gpx().isPresent() && !track().isEmpty()) {
      stages.add("correlate");
    }
    if (config.geocode()) {
      stages.add("geocode");
    }
    stages.add("writer");
    return List.copyOf(stages);
  }

  /**
   * Returns the normalized track, reading the GPX file on first use.
   *
   * @return track; empty when no file is configured or the file has no usable points
   * @throws IOException if the file cannot be read or parsed
   */
  public Track track() throws IOException {
    if (track == null) {
      if (config.gpx().isEmpty()) {
        track = Track.empty();
      } else {
        TrackSource source = new GpxTrackReader(config.gpx().get());
        track = Track.build(source.read());
      }
    }
    return track;
  }

  private Optional<AugmentStage> augmentStage() throws IOException {
    if (config.augment().isEmpty()) {
      return Optional.empty();
    }
    return Optional.of(new AugmentStage(new CsvAugmentSource(config.augment().get()).load()));
  }

  private Optional<CorrelateStage> correlateStage() throws IOException {
    if (config.gpx().isEmpty()) {
      return Optional.empty();
    }
    Track loaded = track();
    if (loaded.isEmpty()) {
      log.warn("Track {} has no usable points; correlation disabled", config.gpx().get());
      return Optional.empty();
    }
    ZoneId zone = cameraZone(loaded);
    log.info("Correlating against {} track points ({} to {}), camera zone {}, offset {}",
        loaded.size(), loaded.first().time(), loaded.last().time(), zone, config.timeOffset());
    return Optional.of(new CorrelateStage(
        loaded, config.correlation(), zone, config.timeOffset(), config.overwrite(), metrics));
  }

  private ZoneId cameraZone(Track loaded) throws IOException {
    if (config.timezone().isPresent()) {
      return config.timezone().get();
    }
    try {
      ZoneId zone = placeLookup().timezone(loaded.first().position());
      log.info("Resolved camera time zone {} from the first track point", zone);
      return zone;
    } catch (PlaceLookupException ex) {
      throw new IOException("Unable to resolve the camera time zone automatically: " + ex.getMessage(), ex);
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      throw new IOException("Interrupted while resolving the camera time zone", ex);
    }
  }

  private Optional<GeocodeStage> geocodeStage() {
    if (!config.geocode()) {
      return Optional.empty();
    }
    LocationResolver resolver = new LocationResolver(
        placeLookup(),
        new Throttle(config.throttle(), clock),
        CountryFieldTable.withOverrides(config.countryFields()),
        metrics);
    return Optional.of(new GeocodeStage(resolver, config.overwrite()));
  }

  private ResultSink resultSink() throws IOException {
    if (config.results().isEmpty()) {
      return ResultSink.NONE;
    }
    return new CsvResultSink(config.results().get());
  }

  private PlaceLookup placeLookup() {
    if (placeLookup == null) {
      placeLookup = lookupFactory.apply(config);
    }
    return placeLookup;
  }
}
