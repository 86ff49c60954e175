package ca.gc.cra.geotag.infrastructure.tabular;

import ca.gc.cra.geotag.application.port.AugmentRow;
import ca.gc.cra.geotag.application.port.AugmentSource;
import ca.gc.cra.geotag.domain.item.ResultField;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.databind.RuntimeJsonMappingException;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link AugmentSource} reading a CSV file with a header row, typically the result file of an earlier run.
 *
 * <p>Recognised columns are {@code File}, {@code Latitude}, {@code Longitude}, {@code Elevation},
 * {@code City}, {@code ProvinceState} and {@code CountryName}; others are ignored. Blank cells are absent.
 * A later row for the same file replaces an earlier one. Cells are passed on as text; numbers are checked by the
 * augment stage for each photo.</p>
 *
 * @since 0.1.0
 */
public final class CsvAugmentSource implements AugmentSource {
  private static final Logger log = LoggerFactory.getLogger(CsvAugmentSource.class);

  private final Path file;
  private final CsvMapper mapper = new CsvMapper();

  public CsvAugmentSource(Path file) {
    this.file = Objects.requireNonNull(file, "file");
  }

  @Override
  public Map<String, AugmentRow> load() throws IOException {
    CsvSchema schema = CsvSchema.emptySchema().withHeader();
    Map<String, AugmentRow> rows = new LinkedHashMap<>();
    try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
        MappingIterator<Map<String, String>> it =
            mapper.readerForMapOf(String.class).with(schema).readValues(reader)) {
      int line = 1;
      while (it.hasNext()) {
        line++;
        Map<String, String> cells = it.next();
        if (!cells.containsKey(ResultField.FILE.header())) {
          throw new IOException("Augment file " + file + " has no " + ResultField.FILE.header() + " column");
        }
        String identity = cell(cells, ResultField.FILE);
        if (identity == null) {
          log.warn("Augment file {} line {} has no file name; ignoring", file, line);
          continue;
        }
        rows.put(identity, new AugmentRow(
            identity,
            cell(cells, ResultField.LATITUDE),
            cell(cells, ResultField.LONGITUDE),
            cell(cells, ResultField.ELEVATION),
            cell(cells, ResultField.CITY),
            cell(cells, ResultField.PROVINCE_STATE),
            cell(cells, ResultField.COUNTRY_NAME)));
      }
    } catch (RuntimeJsonMappingException ex) {
      throw new IOException("Malformed augment file " + file + ": " + ex.getMessage(), ex);
    }
    log.info("Loaded {} augment rows from {}", rows.size(), file);
    return rows;
  }

  private static String cell(Map<String, String> cells, ResultField field) {
    String value = cells.get(field.header());
    if (value == null || value.isBlank()) {
      return null;
    }
    return value.trim();
  }
}
