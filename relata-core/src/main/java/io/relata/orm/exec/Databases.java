package io.relata.orm.exec;

import io.relata.orm.error.ConfigurationException;
import io.relata.orm.util.RelataFactoriesLoader;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/** Opens a {@link Database} through whichever {@link DatabaseProvider} is registered for the configured driver. */
public final class Databases {
  private Databases() {}

  public static Database open(DatabaseConfig config) {
    return open(config, RelataFactoriesLoader.load(DatabaseProvider.class));
  }

  static Database open(DatabaseConfig config, List<DatabaseProvider> providers) {
    Objects.requireNonNull(config, "config");
    for (DatabaseProvider p : providers) {
      if (config.driver().equals(p.driver())) return p.open(config);
    }
    String known = providers.stream().map(DatabaseProvider::driver).collect(Collectors.joining(", "));
    throw new ConfigurationException("No DatabaseProvider registered for driver '" + config.driver()
        + "' (known: [" + known + "])");
  }
}
