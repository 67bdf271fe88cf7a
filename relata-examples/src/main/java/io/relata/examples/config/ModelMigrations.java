package io.relata.examples.config;

import io.relata.orm.migration.Migration;
import io.relata.orm.migration.MigrationManager;
import io.relata.orm.migration.MigrationTemplates;
import io.relata.orm.model.Model;
import io.relata.orm.model.ModelRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Creates one table per registered model. A model whose migration name is already tracked is skipped,
 * so restarting against the same database file runs nothing.
 */
public final class ModelMigrations {
  private static final Logger log = LoggerFactory.getLogger(ModelMigrations.class);

  private ModelMigrations() {}

  public static List<Migration> apply(MigrationManager manager, ModelRegistry models) {
    manager.init();
    Set<String> done = new HashSet<>();
    for (Migration m : manager.getExecutedMigrations()) done.add(m.name());

    List<Migration> todo = new ArrayList<>();
    for (Model<?> model : models.all()) {
      Migration m = MigrationTemplates.forModel(model);
      if (!done.contains(m.name())) todo.add(m);
    }
    List<Migration> ran = manager.runMigrations(todo);
    log.info("relata.examples migrations ran={} alreadyApplied={}", ran.size(), done.size());
    return ran;
  }
}
