package io.relata.orm.exec;

/**
 * Service-discovered factory for {@link Database}s.
 * <p>
 * Registered under {@code io.relata.orm.exec.DatabaseProvider} in {@code META-INF/relata.factories}
 * and selected by {@link DatabaseConfig#driver()}.
 */
public interface DatabaseProvider {
  String driver();

  Database open(DatabaseConfig config);
}
