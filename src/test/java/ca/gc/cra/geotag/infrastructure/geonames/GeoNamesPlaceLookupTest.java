package ca.gc.cra.geotag.infrastructure.geonames;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.geotag.application.port.PlaceLookupException;
import ca.gc.cra.geotag.domain.geo.Position;
import ca.gc.cra.geotag.domain.place.LocalityRecord;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpServer;
import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.nio.charset.StandardCharsets;
import java.time.ZoneId;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class GeoNamesPlaceLookupTest {
  private HttpServer server;
  private final List<String> queries = new CopyOnWriteArrayList<>();
  private volatile int status = 200;
  private volatile String body = "{}";

  @BeforeEach
  void setUp() throws IOException {
    server = HttpServer.create(new InetSocketAddress("127.0.0.1", 0), 0);
    server.createContext("/", this::respond);
    server.start();
  }

  @AfterEach
  void tearDown() {
    if (server != null) {
      server.stop(0);
    }
  }

  @Test
  void locationReturnsFieldsOfNearestPlace() throws Exception {
    body = """
        {"geonames":[{"name":"Ottawa","adminName1":"Ontario","adminCode1":"08",
          "countryCode":"CA","population":812129,"bbox":{"east":1}}]}
        """;

    LocalityRecord record = lookup().location(45.4215d, -75.6972d);

    assertEquals("CA", record.countryCode());
    assertEquals("Ottawa", record.field("name").orElseThrow());
    assertEquals("812129", record.field("population").orElseThrow());
    assertTrue(record.field("bbox").isEmpty());
    String query = queries.get(0);
    assertTrue(query.startsWith("/findNearbyPlaceNameJSON?lat=45.421500&lng=-75.697200"), query);
    assertTrue(query.endsWith("&username=demo+user"), query);
  }

  @Test
  void locationWithoutPlacesFails() {
    body = "{\"geonames\":[]}";

    assertThrows(PlaceLookupException.class, () -> lookup().location(0d, -30d));
  }

  @Test
  void countryNameFromCountryInfo() throws Exception {
    body = "{\"geonames\":[{\"countryName\":\"Canada\",\"countryCode\":\"CA\"}]}";

    assertEquals("Canada", lookup().countryName("CA"));
    assertTrue(queries.get(0).startsWith("/countryInfoJSON?country=CA&"));
  }

  @Test
  void timezoneFromTimezoneService() throws Exception {
    body = "{\"timezoneId\":\"America/Toronto\",\"gmtOffset\":-5}";

    assertEquals(ZoneId.of("America/Toronto"), lookup().timezone(Position.of(45.42d, -75.69d)));
    assertTrue(queries.get(0).startsWith("/timezoneJSON?"));
  }

  @Test
  void unknownTimezoneIdFails() {
    body = "{\"timezoneId\":\"Mars/Olympus\"}";

    assertThrows(PlaceLookupException.class, () -> lookup().timezone(Position.of(1d, 1d)));
  }

  @Test
  void serviceStatusBecomesLookupError() {
    body = "{\"status\":{\"message\":\"user account not enabled\",\"value\":10}}";

    PlaceLookupException ex =
        assertThrows(PlaceLookupException.class, () -> lookup().location(1d, 1d));
    assertEquals("GeoNames findNearbyPlaceNameJSON error 10: user account not enabled", ex.getMessage());
  }

  @Test
  void httpErrorBecomesLookupError() {
    status = 503;
    body = "maintenance";

    PlaceLookupException ex = assertThrows(PlaceLookupException.class, () -> lookup().countryName("CA"));
    assertTrue(ex.getMessage().contains("HTTP 503"), ex.getMessage());
  }

  @Test
  void malformedJsonBecomesLookupError() {
    body = "<html>not json</html>";

    assertThrows(PlaceLookupException.class, () -> lookup().location(1d, 1d));
  }

  @Test
  void unreachableServerBecomesLookupError() throws Exception {
    int port = server.getAddress().getPort();
    server.stop(0);
    server = null;

    GeoNamesPlaceLookup lookup = new GeoNamesPlaceLookup("http://127.0.0.1:" + port, "demo");

    assertThrows(PlaceLookupException.class, () -> lookup.countryName("CA"));
  }

  private GeoNamesPlaceLookup lookup() {
    return new GeoNamesPlaceLookup("http://127.0.0.1:" + server.getAddress().getPort() + "/", "demo user");
  }

  private void respond(HttpExchange exchange) throws IOException {
    queries.add(exchange.getRequestURI().getRawPath() + "?" + exchange.getRequestURI().getRawQuery());
    byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
    exchange.getResponseHeaders().add("Content-Type", "application/json");
    exchange.sendResponseHeaders(status, bytes.length);
    try (OutputStream out = exchange.getResponseBody()) {
      out.write(bytes);
    }
  }
}
