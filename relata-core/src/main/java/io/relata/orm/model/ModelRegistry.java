package io.relata.orm.model;

import io.relata.orm.error.ConfigurationException;
import io.relata.orm.util.RelataFactoriesLoader;

import java.util.*;

public final class ModelRegistry {
  private final Map<Class<?>, Model<?>> byType;

  public ModelRegistry() {
    this(RelataFactoriesLoader.load(ModelProvider.class));
  }

  public ModelRegistry(List<ModelProvider> providers) {
    Map<Class<?>, Model<?>> out = new LinkedHashMap<>();
    for (ModelProvider p : providers) {
      if (p == null) continue;
      List<Model<?>> models = p.models();
      if (models == null) continue;
      for (Model<?> m : models) {
        if (m == null) continue;
        Model<?> existing = out.putIfAbsent(m.entityType(), m);
        if (existing != null) {
          throw new ConfigurationException("Duplicate Model for type '" + m.entityType().getName()
              + "' from providers. Existing=" + existing + ", new=" + m);
        }
      }
    }
    this.byType = Collections.unmodifiableMap(out);
  }

  public <T> Model<T> get(Class<T> type) {
    Objects.requireNonNull(type, "type");
    Model<?> m = byType.get(type);
    if (m == null) throw new ConfigurationException("No Model registered for type: " + type.getName());
    @SuppressWarnings("unchecked")
    Model<T> typed = (Model<T>) m;
    return typed;
  }

  public Collection<Model<?>> all() {
    return byType.values();
  }
}
