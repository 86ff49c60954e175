package ca.gc.cra.geotag.infrastructure.tabular;

import ca.gc.cra.geotag.application.port.ResultSink;
import ca.gc.cra.geotag.domain.item.ResultField;
import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * {@link ResultSink} writing one CSV row per item with a header of every {@link ResultField} column.
 * <p>Rows are flushed as they arrive so an interrupted run keeps every completed row. Confined to the
 * writer stage thread.</p>
 *
 * @since 0.1.0
 */
public final class CsvResultSink implements ResultSink {
  private final Path file;
  private final Writer out;
  private final SequenceWriter rows;

  /**
   * Opens (truncating) the result file and writes the header.
   *
   * @param file destination CSV file
   * @throws IOException if the file cannot be created
   */
  public CsvResultSink(Path file) throws IOException {
    this.file = Objects.requireNonNull(file, "file");
    CsvSchema.Builder schema = CsvSchema.builder().setUseHeader(true);
    for (ResultField field : ResultField.values()) {
      schema.addColumn(field.header());
    }
    this.out = Files.newBufferedWriter(file, StandardCharsets.UTF_8);
    this.rows = new CsvMapper().writer(schema.build()).writeValues(out);
  }

  @Override
  public void record(Map<ResultField, String> row) throws IOException {
    List<String> cells = new ArrayList<>(ResultField.values().length);
    for (ResultField field : ResultField.values()) {
      cells.add(row.getOrDefault(field, ""));
    }
    rows.write(cells);
    rows.flush();
  }

  @Override
  public void close() throws IOException {
    try {
      rows.close();
    } finally {
      out.close();
    }
  }

  @Override
  public String toString() {
    return "CsvResultSink[" + file + "]";
  }
}
