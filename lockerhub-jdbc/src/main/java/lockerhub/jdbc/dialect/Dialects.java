package lockerhub.jdbc.dialect;

import lockerhub.jdbc.spi.Dialect;

import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.DatabaseMetaData;
import java.sql.SQLException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.ServiceLoader;

/**
 * Registry of the dialects found on the classpath.
 *
 * <p>Dialects are loaded via {@link ServiceLoader} from
 * {@code META-INF/services/lockerhub.jdbc.spi.Dialect}. A kiosk running on SQLite and a
 * central server on PostgreSQL pick theirs from the JDBC URL:
 *
 * <pre>{@code
 * Dialect dialect = Dialects.detect(dataSource);
 * Dialect dialect = Dialects.detect("jdbc:sqlite:/var/lib/lockers/eform.db");
 * Dialect dialect = Dialects.get("postgresql");
 * }</pre>
 */
public final class Dialects {

  private static final List<Dialect> DIALECTS = ServiceLoader.load(Dialect.class)
      .stream()
      .map(ServiceLoader.Provider::get)
      .toList();

  private static final Map<String, Dialect> BY_NAME = new LinkedHashMap<>();
  private static final Map<String, Dialect> BY_URL_PREFIX = new LinkedHashMap<>();

  static {
    for (Dialect dialect : DIALECTS) {
      BY_NAME.put(dialect.name().toLowerCase(Locale.ROOT), dialect);
      for (String prefix : dialect.jdbcUrlPrefixes()) {
        BY_URL_PREFIX.put(prefix.toLowerCase(Locale.ROOT), dialect);
      }
    }
  }

  private Dialects() {
  }

  public static List<Dialect> all() {
    return DIALECTS;
  }

  /**
   * @param name dialect name, case-insensitive
   * @throws IllegalArgumentException if no such dialect is registered
   */
  public static Dialect get(String name) {
    Dialect dialect = BY_NAME.get(name.toLowerCase(Locale.ROOT));
    if (dialect == null) {
      throw new IllegalArgumentException("Unknown dialect: " + name
          + ". Available: " + BY_NAME.keySet());
    }
    return dialect;
  }

  /**
   * Finds the dialect whose URL prefix matches {@code jdbcUrl}, ignoring case.
   */
  public static Optional<Dialect> find(String jdbcUrl) {
    if (jdbcUrl == null) {
      return Optional.empty();
    }
    String url = jdbcUrl.toLowerCase(Locale.ROOT);
    return BY_URL_PREFIX.entrySet().stream()
        .filter(e -> url.startsWith(e.getKey()))
        .map(Map.Entry::getValue)
        .findFirst();
  }

  /**
   * Detects the dialect from a JDBC URL.
   *
   * @throws IllegalArgumentException if the URL is empty or no dialect matches
   */
  public static Dialect detect(String jdbcUrl) {
    if (jdbcUrl == null || jdbcUrl.isBlank()) {
      throw new IllegalArgumentException("JDBC URL cannot be null or empty");
    }
    return find(jdbcUrl).orElseThrow(() -> new IllegalArgumentException(
        "No dialect found for JDBC URL: " + jdbcUrl + ". Supported prefixes: " + BY_URL_PREFIX.keySet()));
  }

  /**
   * Detects the dialect of a live data source, from its URL or, for pools that hide the
   * URL, from the database product name.
   *
   * @throws IllegalStateException if no connection can be opened or nothing matches
   */
  public static Dialect detect(DataSource dataSource) {
    try (Connection conn = dataSource.getConnection()) {
      DatabaseMetaData meta = conn.getMetaData();
      String url = meta.getURL();
      Optional<Dialect> byUrl = find(url);
      if (byUrl.isPresent()) {
        return byUrl.get();
      }
      String product = meta.getDatabaseProductName();
      return find(productUrlPrefix(product)).orElseThrow(() -> new IllegalStateException(
          "No dialect for database product " + product + " at " + url));
    } catch (SQLException e) {
      throw new IllegalStateException("Failed to detect dialect from DataSource", e);
    }
  }

  private static String productUrlPrefix(String productName) {
    if (productName == null) {
      return null;
    }
    return "jdbc:" + productName.toLowerCase(Locale.ROOT).replace(" ", "") + ":";
  }
}
