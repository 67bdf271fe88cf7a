package io.relata.orm.util;

import io.relata.orm.error.ConfigurationException;

import java.io.IOException;
import java.io.InputStream;
import java.net.URL;
import java.util.*;

/**
 * spring.factories-style service lookup for relata.
 * <p>
 * Reads every {@code META-INF/relata.factories} resource on the classpath. Each resource is a Java
 * Properties file mapping an SPI interface name to one or more implementation class names:
 *
 * <pre>
 * io.relata.orm.exec.DatabaseProvider=io.relata.orm.jdbc.sqlite.SqliteDatabaseProvider
 * io.relata.orm.model.ModelProvider=com.acme.OrderModels,com.acme.CustomerModels
 * </pre>
 *
 * Implementations need a public no-arg constructor. Duplicates across resources are instantiated once.
 */
public final class RelataFactoriesLoader {
  public static final String RESOURCE = "META-INF/relata.factories";

  private RelataFactoriesLoader() {}

  public static <T> List<T> load(Class<T> spiType) {
    return load(spiType, Thread.currentThread().getContextClassLoader());
  }

  public static <T> List<T> load(Class<T> spiType, ClassLoader cl) {
    Objects.requireNonNull(spiType, "spiType");
    if (cl == null) cl = RelataFactoriesLoader.class.getClassLoader();

    Set<String> implNames = new LinkedHashSet<>();
    for (URL url : resources(cl)) {
      String v = read(url).getProperty(spiType.getName());
      if (v == null || v.isBlank()) continue;
      for (String part : v.split(",")) {
        String name = part.trim();
        if (!name.isEmpty()) implNames.add(name);
      }
    }

    List<T> out = new ArrayList<>(implNames.size());
    for (String implName : implNames) {
      out.add(newInstance(implName, spiType, cl));
    }
    return out;
  }

  private static List<URL> resources(ClassLoader cl) {
    try {
      return Collections.list(cl.getResources(RESOURCE));
    } catch (IOException e) {
      throw new ConfigurationException("Failed to enumerate " + RESOURCE, e);
    }
  }

  private static Properties read(URL url) {
    Properties p = new Properties();
    try (InputStream in = url.openStream()) {
      p.load(in);
    } catch (IOException e) {
      throw new ConfigurationException("Failed to load " + RESOURCE + " from " + url, e);
    }
    return p;
  }

  private static <T> T newInstance(String implName, Class<T> spiType, ClassLoader cl) {
    Class<?> raw;
    try {
      raw = Class.forName(implName, true, cl);
    } catch (ClassNotFoundException e) {
      throw new ConfigurationException("Class " + implName + " listed in " + RESOURCE + " was not found", e);
    }
    if (!spiType.isAssignableFrom(raw)) {
      throw new ConfigurationException("Class " + implName + " does not implement " + spiType.getName());
    }
    try {
      return spiType.cast(raw.getDeclaredConstructor().newInstance());
    } catch (ReflectiveOperationException e) {
      throw new ConfigurationException("Failed to instantiate " + implName + " for SPI " + spiType.getName(), e);
    }
  }
}
