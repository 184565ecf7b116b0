package ca.gc.cra.pglo.infrastructure.jdbc;

import ca.gc.cra.pglo.logging.Logs;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.SQLException;
import java.util.Objects;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link ConnectionFactory} over {@link DriverManager}; the PostgreSQL driver registers itself from the runtime
 * classpath.
 *
 * @since PGLO 0.1-doc
 */
public final class DriverManagerConnectionFactory implements ConnectionFactory {
  private static final Logger log = LoggerFactory.getLogger(DriverManagerConnectionFactory.class);

  private final String url;
  private final Properties properties = new Properties();

  /**
   * Creates a factory.
   *
   * @param url JDBC URL, e.g. {@code jdbc:postgresql://localhost/app}
   * @param user login role; {@code null} to rely on the URL
   * @param password password; {@code null} to rely on the URL or the pgpass file
   */
  public DriverManagerConnectionFactory(String url, String user, String password) {
    this.url = Objects.requireNonNull(url, "url");
    if (user != null) {
      properties.setProperty("user", user);
    }
    if (password != null) {
      properties.setProperty("password", password);
    }
  }

  @Override
  public Connection open() throws SQLException {
    log.debug("Connecting to {} as {} (password {})",
        Logs.redactUrl(url),
        properties.getProperty("user", "<default>"),
        Logs.redact(properties.getProperty("password")));
    return DriverManager.getConnection(url, properties);
  }
}
