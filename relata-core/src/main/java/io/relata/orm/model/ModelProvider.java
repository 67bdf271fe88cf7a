package io.relata.orm.model;

import java.util.List;

/**
 * Service-discovered source of {@link Model}s, listed under {@code io.relata.orm.model.ModelProvider}
 * in {@code META-INF/relata.factories}.
 */
public interface ModelProvider {
  List<Model<?>> models();
}
