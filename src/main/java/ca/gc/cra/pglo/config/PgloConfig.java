package ca.gc.cra.pglo.config;

import ca.gc.cra.pglo.application.pipeline.TransferOptions;
import ca.gc.cra.pglo.domain.lob.LargeObjectFlags;
import ca.gc.cra.pglo.logging.Logs;
import ca.gc.cra.pglo.validation.Numbers;
import java.time.Duration;
import java.util.Map;
import java.util.Objects;

/**
 * <strong>What:</strong> Connection and transfer settings shared by every command.
 * <p><strong>Sources:</strong> Built from the merged CLI/YAML/default map by {@link #fromMap(Map)}; connection
 * settings left blank there fall back to {@code PGLO_JDBC_URL}, {@code PGLO_USER} and {@code PGLO_PASSWORD}.</p>
 * <p>The URL {@value #MEMORY_URL} selects the in-process store instead of PostgreSQL.</p>
 *
 * @param jdbcUrl JDBC URL, or {@code null} when not configured
 * @param user login role, or {@code null}
 * @param password password, or {@code null}; never printed by {@link #toString()}
 * @param bufferSize bytes per backend call, 1 to 64 MiB
 * @param timeout whole-call timeout, or {@code null} for none
 * @since PGLO 0.1-doc
 */
public record PgloConfig(String jdbcUrl, String user, String password, int bufferSize, Duration timeout) {
  /** URL selecting the in-memory store. */
  public static final String MEMORY_URL = "mem:";
  /** Largest accepted chunk size. */
  public static final int MAX_BUFFER_SIZE = 64 * 1024 * 1024;
  static final String ENV_URL = "PGLO_JDBC_URL";
  static final String ENV_USER = "PGLO_USER";
  static final String ENV_PASSWORD = "PGLO_PASSWORD";

  /**
   * Validates ranges.
   *
   * @throws IllegalArgumentException if {@code bufferSize} is out of range or {@code timeout} negative
   */
  public PgloConfig {
    Numbers.requireRange("bufferSize", bufferSize, 1, MAX_BUFFER_SIZE);
    if (timeout != null && timeout.isNegative()) {
      throw new IllegalArgumentException("timeout must not be negative");
    }
  }

  /**
   * No connection, 64 KiB chunks, 60 second timeout.
   *
   * @return default configuration
   */
  public static PgloConfig defaults() {
    return new PgloConfig(
        null, null, null, LargeObjectFlags.DEFAULT_TRANSFER_BUFFER_SIZE, TransferOptions.DEFAULT_TIMEOUT);
  }

  /**
   * Builds a configuration from flattened keys, falling back to the process environment.
   *
   * @param options keys {@code url}, {@code user}, {@code password}, {@code bufferSize}, {@code timeoutMs}
   * @return configuration
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static PgloConfig fromMap(Map<String, String> options) {
    return fromMap(options, System.getenv());
  }

  /**
   * Builds a configuration from flattened keys and an explicit environment.
   *
   * @param options flattened keys
   * @param env environment consulted for blank connection settings
   * @return configuration
   * @throws IllegalArgumentException if a value is malformed or out of range
   */
  public static PgloConfig fromMap(Map<String, String> options, Map<String, String> env) {
    Objects.requireNonNull(options, "options");
    Map<String, String> environment = env == null ? Map.of() : env;
    PgloConfig defaults = defaults();
    String url = firstNonBlank(options.get("url"), environment.get(ENV_URL));
    String user = firstNonBlank(options.get("user"), environment.get(ENV_USER));
    String password = firstNonBlank(options.get("password"), environment.get(ENV_PASSWORD));

    int bufferSize = defaults.bufferSize();
    String rawBuffer = options.get("bufferSize");
    if (rawBuffer != null && !rawBuffer.isBlank()) {
      bufferSize = (int) Numbers.requireRange(
          "bufferSize", Numbers.parseLong("bufferSize", rawBuffer), 1, MAX_BUFFER_SIZE);
    }

    Duration timeout = defaults.timeout();
    String rawTimeout = options.get("timeoutMs");
    if (rawTimeout != null && !rawTimeout.isBlank()) {
      long millis = Numbers.requireRange("timeoutMs", Numbers.parseLong("timeoutMs", rawTimeout), 0, Long.MAX_VALUE);
      timeout = millis == 0 ? null : Duration.ofMillis(millis);
    }
    return new PgloConfig(url, user, password, bufferSize, timeout);
  }

  /**
   * Returns the JDBC URL, failing when none was configured.
   *
   * @return URL
   * @throws IllegalArgumentException when no URL is set
   */
  public String requireJdbcUrl() {
    if (jdbcUrl == null) {
      throw new IllegalArgumentException("url is required (or set " + ENV_URL + ")");
    }
    return jdbcUrl;
  }

  /**
   * Indicates whether the in-memory store is selected.
   *
   * @return {@code true} for {@value #MEMORY_URL}
   */
  public boolean usesMemoryStore() {
    return MEMORY_URL.equals(jdbcUrl);
  }

  /**
   * Derives transfer options for the use cases.
   *
   * @return chunk size and timeout
   */
  public TransferOptions transferOptions() {
    return new TransferOptions(bufferSize, timeout);
  }

  @Override
  public String toString() {
    return "PgloConfig[jdbcUrl=" + Logs.redactUrl(jdbcUrl)
        + ", user=" + (user == null ? "<default>" : user)
        + ", password=" + Logs.redact(password)
        + ", bufferSize=" + bufferSize
        + ", timeout=" + (timeout == null ? "none" : timeout.toMillis() + "ms") + ']';
  }

  private static String firstNonBlank(String first, String second) {
    if (first != null && !first.isBlank()) {
      return first.trim();
    }
    if (second != null && !second.isBlank()) {
      return second.trim();
    }
    return null;
  }
}
