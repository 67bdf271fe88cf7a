package io.relata.examples.config;

import io.relata.examples.domain.Customer;
import io.relata.orm.exec.Database;
import io.relata.orm.exec.Databases;
import io.relata.orm.migration.MigrationManager;
import io.relata.orm.model.ModelRegistry;
import io.relata.orm.repository.Repository;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
@EnableConfigurationProperties(RelataProperties.class)
public class RelataExampleConfig {

  @Bean(destroyMethod = "close")
  public Database database(RelataProperties props) {
    return Databases.open(props.toDatabaseConfig());
  }

  @Bean
  public ModelRegistry modelRegistry() {
    // Models come from META-INF/relata.factories on the classpath.
    return new ModelRegistry();
  }

  // The manager would close the shared Database; the database bean owns that.
  @Bean(destroyMethod = "")
  public MigrationManager migrationManager(Database database) {
    return new MigrationManager(database);
  }

  @Bean
  public ApplicationRunner migrateOnStartup(RelataProperties props, MigrationManager migrations, ModelRegistry models) {
    return args -> {
      if (props.isMigrateOnStartup()) ModelMigrations.apply(migrations, models);
    };
  }

  @Bean
  public Repository<Customer> customerRepository(Database database, ModelRegistry models) {
    return new Repository<>(database, models.get(Customer.class));
  }
}
