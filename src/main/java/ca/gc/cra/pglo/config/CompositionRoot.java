package ca.gc.cra.pglo.config;

import ca.gc.cra.pglo.application.pipeline.ExportUseCase;
import ca.gc.cra.pglo.application.pipeline.ImportUseCase;
import ca.gc.cra.pglo.application.pipeline.LargeObjectRepository;
import ca.gc.cra.pglo.application.pipeline.LargeObjectUploadWriter;
import ca.gc.cra.pglo.application.port.ClockPort;
import ca.gc.cra.pglo.application.port.MetricsPort;
import ca.gc.cra.pglo.application.port.TransactionPort;
import ca.gc.cra.pglo.infrastructure.jdbc.DriverManagerConnectionFactory;
import ca.gc.cra.pglo.infrastructure.jdbc.JdbcTransactionManager;
import ca.gc.cra.pglo.infrastructure.memory.InMemoryLargeObjectStore;
import java.util.Objects;

/**
 * <strong>What:</strong> Wires use cases to the backend selected by {@link PgloConfig}.
 * <p><strong>Role:</strong> Composition root for the CLI and for embedding applications that want the same wiring.</p>
 * <p><strong>Responsibilities:</strong>
 * <ul>
 *   <li>Pick the JDBC transaction manager, or the in-memory store for {@value PgloConfig#MEMORY_URL}.</li>
 *   <li>Share one {@link TransactionPort}, metrics port and clock across every use case it builds.</li>
 * </ul>
 * <p><strong>Thread-safety:</strong> The transaction port is created once, lazily, under the instance lock.</p>
 *
 * @since PGLO 0.1-doc
 */
public final class CompositionRoot {
  private final PgloConfig config;
  private final MetricsPort metrics;
  private final ClockPort clock;
  private TransactionPort transactions;

  /**
   * Creates a root on the system clock whose backend follows {@code config}.
   *
   * @param config effective configuration
   * @param metrics metrics sink
   */
  public CompositionRoot(PgloConfig config, MetricsPort metrics) {
    this(config, metrics, ClockPort.SYSTEM, null);
  }

  /**
   * Creates a root with an explicit clock and, optionally, a preconfigured transaction port.
   *
   * @param config effective configuration
   * @param metrics metrics sink
   * @param clock time source
   * @param transactions backend to use instead of the one {@code config} selects; {@code null} to follow config
   */
  public CompositionRoot(PgloConfig config, MetricsPort metrics, ClockPort clock, TransactionPort transactions) {
    this.config = Objects.requireNonNull(config, "config");
    this.metrics = Objects.requireNonNull(metrics, "metrics");
    this.clock = Objects.requireNonNull(clock, "clock");
    this.transactions = transactions;
  }

  public PgloConfig config() {
    return config;
  }

  public MetricsPort metrics() {
    return metrics;
  }

  /**
   * Returns the shared transaction port, creating it on first use.
   *
   * @return transaction port
   * @throws IllegalArgumentException if no JDBC URL is configured
   */
  public synchronized TransactionPort transactions() {
    if (transactions == null) {
      if (config.usesMemoryStore()) {
        transactions = new InMemoryLargeObjectStore(clock);
      } else {
        transactions = new JdbcTransactionManager(
            new DriverManagerConnectionFactory(config.requireJdbcUrl(), config.user(), config.password()), clock);
      }
    }
    return transactions;
  }

  public LargeObjectRepository repository() {
    return new LargeObjectRepository(transactions(), metrics, clock, config.transferOptions());
  }

  public ImportUseCase importUseCase() {
    return new ImportUseCase(transactions(), metrics, clock);
  }

  public ExportUseCase exportUseCase() {
    return new ExportUseCase(transactions(), metrics, clock);
  }

  public LargeObjectUploadWriter uploadWriter() {
    return new LargeObjectUploadWriter(transactions(), metrics, config.transferOptions());
  }
}
