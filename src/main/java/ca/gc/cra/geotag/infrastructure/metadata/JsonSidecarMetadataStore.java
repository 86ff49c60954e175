package ca.gc.cra.geotag.infrastructure.metadata;

import ca.gc.cra.geotag.application.port.MetadataStore;
import ca.gc.cra.geotag.domain.item.Rational;
import ca.gc.cra.geotag.domain.item.TagValue;
import ca.gc.cra.geotag.domain.item.WorkItem;
import com.fasterxml.jackson.core.JsonFactory;
import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.JsonToken;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.LocalDateTime;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.SortedSet;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link MetadataStore} keeping each photo's tags in a JSON sidecar next to it
 * ({@code IMG_0001.jpg} is described by {@code IMG_0001.jpg.json}).
 * <p><strong>Role:</strong> Default store for {@code geotag run}; photos themselves are never rewritten.</p>
 * <p><strong>Format:</strong> one JSON object keyed by tag name. {@link TagValue.Text} is a string,
 * {@link TagValue.Integer} a number, {@link TagValue.RationalList} an array of {@code "n/d"} strings, and
 * {@link TagValue.Timestamp} an object {@code {"localDateTime": "yyyy-MM-ddTHH:mm:ss"}}.</p>
 * <p><strong>Thread-safety:</strong> Stateless apart from the directory; enumeration/load on the driver and
 * commits on the writer thread touch disjoint files.</p>
 * <p>Commits write a temporary file and move it over the sidecar, atomically where the file system allows.</p>
 *
 * @since 0.1.0
 */
public final class JsonSidecarMetadataStore implements MetadataStore {
  private static final Logger log = LoggerFactory.getLogger(JsonSidecarMetadataStore.class);
  static final String SIDECAR_SUFFIX = ".json";
  private static final String TIMESTAMP_FIELD = "localDateTime";
  private static final Set<String> PHOTO_EXTENSIONS = Set.of(
      "jpg", "jpeg", "tif", "tiff", "png", "heic", "dng", "cr2", "cr3", "nef", "arw", "orf", "rw2");

  private final Path directory;
  private final JsonFactory jsonFactory = new JsonFactory();

  /**
   * Creates a store over a photo directory.
   *
   * @param directory directory holding the photos and their sidecars
   */
  public JsonSidecarMetadataStore(Path directory) {
    this.directory = Objects.requireNonNull(directory, "directory");
  }

  @Override
  public SortedSet<String> identities() throws IOException {
    SortedSet<String> identities = new TreeSet<>();
    try (DirectoryStream<Path> stream = Files.newDirectoryStream(directory)) {
      for (Path entry : stream) {
        if (Files.isRegularFile(entry) && isPhoto(entry.getFileName().toString())) {
          identities.add(entry.getFileName().toString());
        }
      }
    }
    return identities;
  }

  static boolean isPhoto(String fileName) {
    int dot = fileName.lastIndexOf('.');
    if (dot <= 0 || dot == fileName.length() - 1) {
      return false;
    }
    return PHOTO_EXTENSIONS.contains(fileName.substring(dot + 1).toLowerCase(Locale.ROOT));
  }

  @Override
  public Map<String, TagValue> load(String identity) throws IOException {
    Path sidecar = sidecar(identity);
    if (!Files.exists(sidecar)) {
      return Map.of();
    }
    try (InputStream in = Files.newInputStream(sidecar);
        JsonParser parser = jsonFactory.createParser(in)) {
      return readTags(parser, sidecar);
    } catch (JsonProcessingException ex) {
      throw new IOException("Malformed sidecar " + sidecar + ": " + ex.getOriginalMessage(), ex);
    }
  }

  @Override
  public boolean commit(WorkItem item) throws IOException {
    if (!item.isDirty()) {
      return true;
    }
    if (!Files.exists(directory.resolve(item.identity()))) {
      log.warn("Photo {} disappeared; refusing to write an orphan sidecar", item.identity());
      return false;
    }
    Path target = sidecar(item.identity());
    Path temp = Files.createTempFile(directory, "." + item.identity() + ".", ".tmp");
    try {
      try (OutputStream out = Files.newOutputStream(temp);
          JsonGenerator gen = jsonFactory.createGenerator(out)) {
        gen.useDefaultPrettyPrinter();
        writeTags(gen, item.metadata());
      }
      move(temp, target);
    } finally {
      Files.deleteIfExists(temp);
    }
    item.markClean();
    log.debug("Wrote sidecar {}", target);
    return true;
  }

  Path sidecar(String identity) {
    return directory.resolve(identity + SIDECAR_SUFFIX);
  }

  private static void move(Path source, Path target) throws IOException {
    try {
      Files.move(source, target, StandardCopyOption.ATOMIC_MOVE, StandardCopyOption.REPLACE_EXISTING);
    } catch (AtomicMoveNotSupportedException ex) {
      log.debug("Atomic move unsupported for {}; replacing in place", target);
      Files.move(source, target, StandardCopyOption.REPLACE_EXISTING);
    }
  }

  private static Map<String, TagValue> readTags(JsonParser parser, Path sidecar) throws IOException {
    if (parser.nextToken() != JsonToken.START_OBJECT) {
      throw new IOException("Sidecar " + sidecar + " must contain a JSON object");
    }
    Map<String, TagValue> tags = new LinkedHashMap<>();
    while (parser.nextToken() == JsonToken.FIELD_NAME) {
      String tag = parser.getCurrentName();
      JsonToken token = parser.nextToken();
      tags.put(tag, readValue(parser, token, tag, sidecar));
    }
    return tags;
  }

  private static TagValue readValue(JsonParser parser, JsonToken token, String tag, Path sidecar)
      throws IOException {
    switch (token) {
      case VALUE_STRING:
        return TagValue.text(parser.getText());
      case VALUE_NUMBER_INT:
        return TagValue.integer(parser.getLongValue());
      case START_ARRAY: {
        List<Rational> values = new ArrayList<>();
        while (parser.nextToken() != JsonToken.END_ARRAY) {
          try {
            values.add(Rational.parse(parser.getText()));
          } catch (IllegalArgumentException ex) {
            throw new IOException("Tag " + tag + " in " + sidecar + " holds a malformed rational", ex);
          }
        }
        return TagValue.rationals(values);
      }
      case START_OBJECT: {
        String local = null;
        while (parser.nextToken() == JsonToken.FIELD_NAME) {
          String field = parser.getCurrentName();
          parser.nextToken();
          if (TIMESTAMP_FIELD.equals(field)) {
            local = parser.getText();
          } else {
            parser.skipChildren();
          }
        }
        if (local == null) {
          throw new IOException("Tag " + tag + " in " + sidecar + " is an object without " + TIMESTAMP_FIELD);
        }
        try {
          return TagValue.timestamp(LocalDateTime.parse(local));
        } catch (DateTimeParseException ex) {
          throw new IOException("Tag " + tag + " in " + sidecar + " holds a malformed timestamp", ex);
        }
      }
      default:
        throw new IOException("Tag " + tag + " in " + sidecar + " has unsupported JSON type " + token);
    }
  }

  private static void writeTags(JsonGenerator gen, Map<String, TagValue> tags) throws IOException {
    gen.writeStartObject();
    for (Map.Entry<String, TagValue> entry : tags.entrySet()) {
      gen.writeFieldName(entry.getKey());
      TagValue value = entry.getValue();
      if (value instanceof TagValue.Text text) {
        gen.writeString(text.value());
      } else if (value instanceof TagValue.Integer integer) {
        gen.writeNumber(integer.value());
      } else if (value instanceof TagValue.RationalList list) {
        gen.writeStartArray();
        for (Rational rational : list.values()) {
          gen.writeString(rational.toString());
        }
        gen.writeEndArray();
      } else if (value instanceof TagValue.Timestamp ts) {
        gen.writeStartObject();
        gen.writeStringField(TIMESTAMP_FIELD, ts.value().toString());
        gen.writeEndObject();
      }
    }
    gen.writeEndObject();
  }
}
