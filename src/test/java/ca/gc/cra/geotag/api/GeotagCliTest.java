package ca.gc.cra.geotag.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
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

class GeotagCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(GeotagCli.class);
    appender = new ListAppender<>();
    logger.setAdditive(false);
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer, true));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    logger.setAdditive(true);
    appender.stop();
    CliPrinter.clearTestWriter();
    System.clearProperty("otel.metrics.exporter");
    System.clearProperty("otel.exporter.otlp.endpoint");
    System.clearProperty("otel.resource.attributes");
  }

  @Test
  void helpPrintsOptions() {
    ExitCode code = GeotagCli.run("run", new String[] {"--help"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("geotag run"));
    assertTrue(buffer.toString().contains("countryFields.<Country>"));
  }

  @Test
  void unknownFlagIsInvalidArgs() {
    ExitCode code = GeotagCli.run("run", new String[] {"--frobnicate", "photos=" + tempDir});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: geotag"));
    assertTrue(hasError("Unknown flag"));
  }

  @Test
  void malformedArgumentIsInvalidArgs() {
    ExitCode code = GeotagCli.run("run", new String[] {"photos"});

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(hasError("key=value"));
  }

  @Test
  void missingPhotosIsConfigError() {
    ExitCode code = GeotagCli.run("run", new String[] {
        "results=" + tempDir.resolve("out.csv"), "metricsExporter=none"});

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(hasError("photos is required"));
  }

  @Test
  void nothingToDoIsConfigError() {
    ExitCode code = GeotagCli.run("run", new String[] {"photos=" + tempDir, "metricsExporter=none"});

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(hasError("Nothing to do"));
  }

  @Test
  void missingConfigFileIsConfigError() {
    ExitCode code = GeotagCli.run("run", new String[] {
        "photos=" + tempDir, "config=" + tempDir.resolve("absent.yaml")});

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(hasError("does not exist"));
  }

  @Test
  void malformedYamlIsConfigError() throws Exception {
    Path yaml = Files.writeString(tempDir.resolve("geotag.yaml"), "geotag: [unclosed\n");

    ExitCode code = GeotagCli.run("run", new String[] {"photos=" + tempDir, "config=" + yaml});

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(hasError("Invalid YAML"));
  }

  @Test
  void yamlSuppliesSettingsForPlan() throws Exception {
    Path photos = Files.createDirectory(tempDir.resolve("photos"));
    Path yaml = Files.writeString(tempDir.resolve("geotag.yaml"), """
        common:
          metricsExporter: none
        geotag:
          results: %s
          policy: nearest
        """.formatted(tempDir.resolve("out.csv")));

    ExitCode code = GeotagCli.run("plan", new String[] {"photos=" + photos, "config=" + yaml});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("policy=nearest"));
  }

  @Test
  void planPrintsStagesAndRedactsAccount() throws Exception {
    Path photos = Files.createDirectory(tempDir.resolve("photos"));
    Path results = tempDir.resolve("out.csv");

    ExitCode code = GeotagCli.run("plan", new String[] {
        "photos=" + photos,
        "results=" + results,
        "--geocode",
        "geonamesUser=secret-account",
        "metricsExporter=none"});

    assertEquals(ExitCode.SUCCESS, code);
    String output = buffer.toString();
    assertTrue(output.contains("GEOTAG plan"));
    assertTrue(output.contains("stages: geocode > writer"));
    assertTrue(output.contains("geonamesUser=[REDACTED]"));
    assertTrue(output.contains("dryRun=true"));
    assertFalse(output.contains("secret-account"));
    assertFalse(Files.exists(results), "plan must not create outputs");
  }

  @Test
  void runWritesResultsForEachPhoto() throws Exception {
    Path photos = Files.createDirectory(tempDir.resolve("photos"));
    Files.writeString(photos.resolve("IMG_1.jpg"), "jpeg");
    Files.writeString(photos.resolve("IMG_1.jpg.json"), """
        {"Exif.Photo.DateTimeOriginal": "2024:05:01 12:00:30"}
        """);
    Path results = tempDir.resolve("out.csv");

    ExitCode code = GeotagCli.run("run", new String[] {
        "photos=" + photos, "results=" + results, "metricsExporter=none"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("stages=writer photos=1"));
    List<String> lines = Files.readAllLines(results, StandardCharsets.UTF_8);
    assertEquals(2, lines.size());
    assertTrue(lines.get(1).startsWith("IMG_1.jpg,"));
    assertTrue(lines.get(1).contains("2024:05:01 12:00:30"));
  }

  private boolean hasError(String fragment) {
    return appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR && event.getFormattedMessage().contains(fragment));
  }
}
