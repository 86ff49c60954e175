package ca.gc.cra.geotag.infrastructure.geonames;

import ca.gc.cra.geotag.application.port.PlaceLookup;
import ca.gc.cra.geotag.application.port.PlaceLookupException;
import ca.gc.cra.geotag.domain.geo.Position;
import ca.gc.cra.geotag.domain.place.LocalityRecord;
import ca.gc.cra.geotag.logging.Logs;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.DateTimeException;
import java.time.Duration;
import java.time.ZoneId;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> {@link PlaceLookup} backed by the GeoNames JSON web services
 * ({@code findNearbyPlaceNameJSON}, {@code countryInfoJSON}, {@code timezoneJSON}).
 * <p><strong>Role:</strong> Infrastructure adapter wrapped by {@code LocationResolver}, which adds caching and
 * pacing. No retries happen here.</p>
 * <p><strong>Errors:</strong> transport failures, non-200 statuses, GeoNames {@code status} objects and
 * responses missing the expected fields all surface as {@link PlaceLookupException}. Response excerpts in
 * messages are truncated.</p>
 * <p><strong>Thread-safety:</strong> Safe for concurrent use; {@link HttpClient} and {@link ObjectMapper}
 * are thread-safe.</p>
 *
 * @since 0.1.0
 */
public final class GeoNamesPlaceLookup implements PlaceLookup {
  private static final Logger log = LoggerFactory.getLogger(GeoNamesPlaceLookup.class);
  /** Public GeoNames endpoint. */
  public static final String DEFAULT_BASE_URL = "http://api.geonames.org";
  private static final Duration CONNECT_TIMEOUT = Duration.ofSeconds(10);
  private static final Duration REQUEST_TIMEOUT = Duration.ofSeconds(30);
  private static final int MAX_EXCERPT_BYTES = 256;

  private final HttpClient client;
  private final ObjectMapper mapper = new ObjectMapper();
  private final String baseUrl;
  private final String username;

  /**
   * Creates a lookup with a default HTTP client.
   *
   * @param baseUrl service root, e.g. {@link #DEFAULT_BASE_URL}
   * @param username GeoNames account name sent as the {@code username} query parameter
   */
  public GeoNamesPlaceLookup(String baseUrl, String username) {
    this(HttpClient.newBuilder().connectTimeout(CONNECT_TIMEOUT).build(), baseUrl, username);
  }

  GeoNamesPlaceLookup(HttpClient client, String baseUrl, String username) {
    this.client = Objects.requireNonNull(client, "client");
    String trimmed = Objects.requireNonNull(baseUrl, "baseUrl").trim();
    this.baseUrl = trimmed.endsWith("/") ? trimmed.substring(0, trimmed.length() - 1) : trimmed;
    this.username = Objects.requireNonNull(username, "username");
  }

  @Override
  public LocalityRecord location(double latitude, double longitude)
      throws PlaceLookupException, InterruptedException {
    JsonNode root = get("findNearbyPlaceNameJSON", coordinates(latitude, longitude));
    JsonNode first = root.path("geonames").path(0);
    if (!first.isObject()) {
      throw new PlaceLookupException(String.format(Locale.ROOT,
          "No populated place near %.5f,%.5f", latitude, longitude));
    }
    Map<String, String> fields = new LinkedHashMap<>();
    Iterator<Map.Entry<String, JsonNode>> it = first.fields();
    while (it.hasNext()) {
      Map.Entry<String, JsonNode> entry = it.next();
      if (entry.getValue().isValueNode() && !entry.getValue().isNull()) {
        fields.put(entry.getKey(), entry.getValue().asText());
      }
    }
    return new LocalityRecord(first.path("countryCode").asText(""), fields);
  }

  @Override
  public String countryName(String countryCode) throws PlaceLookupException, InterruptedException {
    JsonNode root = get("countryInfoJSON", "country=" + encode(countryCode));
    String name = root.path("geonames").path(0).path("countryName").asText("");
    if (name.isBlank()) {
      throw new PlaceLookupException("Unknown country code " + countryCode);
    }
    return name;
  }

  @Override
  public ZoneId timezone(Position position) throws PlaceLookupException, InterruptedException {
    JsonNode root = get("timezoneJSON", coordinates(position.latitude(), position.longitude()));
    String zone = root.path("timezoneId").asText("");
    if (zone.isBlank()) {
      throw new PlaceLookupException("No time zone reported for " + position);
    }
    try {
      return ZoneId.of(zone);
    } catch (DateTimeException ex) {
      throw new PlaceLookupException("GeoNames returned unknown time zone " + zone, ex);
    }
  }

  private JsonNode get(String service, String query) throws PlaceLookupException, InterruptedException {
    URI uri = URI.create(baseUrl + "/" + service + "?" + query + "&username=" + encode(username));
    HttpRequest request = HttpRequest.newBuilder(uri)
        .timeout(REQUEST_TIMEOUT)
        .header("Accept", "application/json")
        .GET()
        .build();
    log.debug("GeoNames request {}?{}", service, query);
    HttpResponse<String> response;
    try {
      response = client.send(request, HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
    } catch (IOException ex) {
      throw new PlaceLookupException("GeoNames " + service + " request failed: " + ex.getMessage(), ex);
    }
    String body = response.body();
    if (response.statusCode() != 200) {
      throw new PlaceLookupException("GeoNames " + service + " returned HTTP " + response.statusCode()
          + ": " + Logs.truncate(body, MAX_EXCERPT_BYTES));
    }
    JsonNode root;
    try {
      root = mapper.readTree(body);
    } catch (JsonProcessingException ex) {
      throw new PlaceLookupException("GeoNames " + service + " returned malformed JSON: "
          + Logs.truncate(body, MAX_EXCERPT_BYTES), ex);
    }
    JsonNode status = root == null ? null : root.get("status");
    if (status != null) {
      throw new PlaceLookupException("GeoNames " + service + " error " + status.path("value").asText("?")
          + ": " + status.path("message").asText(""));
    }
    if (root == null || !root.isObject()) {
      throw new PlaceLookupException("GeoNames " + service + " returned an unexpected payload: "
          + Logs.truncate(body, MAX_EXCERPT_BYTES));
    }
    return root;
  }

  private static String coordinates(double latitude, double longitude) {
    return String.format(Locale.ROOT, "lat=%.6f&lng=%.6f", latitude, longitude);
  }

  private static String encode(String value) {
    return URLEncoder.encode(value, StandardCharsets.UTF_8);
  }
}
