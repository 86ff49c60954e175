package ca.gc.cra.geotag.infrastructure.tabular;

import static org.junit.jupiter.api.Assertions.assertEquals;

import ca.gc.cra.geotag.application.port.AugmentRow;
import ca.gc.cra.geotag.domain.item.ResultField;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class CsvResultSinkTest {

  @TempDir
  Path dir;

  @Test
  void writesHeaderAndOneRowPerRecord() throws Exception {
    Path out = dir.resolve("results.csv");
    Map<ResultField, String> full = new EnumMap<>(ResultField.class);
    full.put(ResultField.FILE, "IMG_1.jpg");
    full.put(ResultField.DATE, "2024:06:01 12:00:00");
    full.put(ResultField.LATITUDE, "45.5");
    full.put(ResultField.LONGITUDE, "-75.5");
    full.put(ResultField.CITY, "Saint-Jean, QC");

    try (CsvResultSink sink = new CsvResultSink(out)) {
      sink.record(full);
      sink.record(Map.of(ResultField.FILE, "IMG_2.jpg"));
    }

    List<String> lines = Files.readAllLines(out, StandardCharsets.UTF_8);
    assertEquals(3, lines.size());
    assertEquals("File,Date,Latitude,Longitude,Elevation,City,ProvinceState,CountryName", lines.get(0));
    List<Map<String, String>> rows = readBack(out);
    assertEquals("2024:06:01 12:00:00", rows.get(0).get("Date"));
    assertEquals("Saint-Jean, QC", rows.get(0).get("City"));
    assertEquals("", rows.get(0).get("Elevation"));
    assertEquals("IMG_2.jpg", rows.get(1).get("File"));
    assertEquals("", rows.get(1).get("CountryName"));
  }

  @Test
  void outputReadsBackAsAugmentInput() throws Exception {
    Path out = dir.resolve("results.csv");
    Map<ResultField, String> row = new EnumMap<>(ResultField.class);
    row.put(ResultField.FILE, "IMG_1.jpg");
    row.put(ResultField.LATITUDE, "45.5");
    row.put(ResultField.LONGITUDE, "-75.5");
    row.put(ResultField.PROVINCE_STATE, "Ontario");

    try (CsvResultSink sink = new CsvResultSink(out)) {
      sink.record(row);
    }

    AugmentRow parsed = new CsvAugmentSource(out).load().get("IMG_1.jpg");
    assertEquals(45.5d, parsed.latitude());
    assertEquals(-75.5d, parsed.longitude());
    assertEquals("Ontario", parsed.provinceState());
  }

  @Test
  void rowsAreVisibleBeforeClose() throws Exception {
    Path out = dir.resolve("results.csv");

    try (CsvResultSink sink = new CsvResultSink(out)) {
      sink.record(Map.of(ResultField.FILE, "IMG_1.jpg"));

      assertEquals(2, Files.readAllLines(out, StandardCharsets.UTF_8).size());
    }
  }

  private static List<Map<String, String>> readBack(Path file) throws IOException {
    try (MappingIterator<Map<String, String>> it = new CsvMapper()
        .readerForMapOf(String.class)
        .with(CsvSchema.emptySchema().withHeader())
        .readValues(file.toFile())) {
      return it.readAll();
    }
  }
}
