package io.relata.examples.domain;

import io.relata.orm.model.Model;
import io.relata.orm.model.ModelProvider;

import java.util.List;

public final class CustomerModels implements ModelProvider {
  public static final Model<Customer> CUSTOMER = Model.builder(Customer.class, "customers")
      .primaryKey("id", "TEXT", Customer::id)
      .column("first_name", "TEXT", Customer::firstName)
      .column("last_name", "TEXT", Customer::lastName)
      .column("email", "TEXT", Customer::email)
      .nullableColumn("phone", "TEXT", Customer::phone)
      .column("active", "INTEGER", Customer::active)
      .decoder(r -> new Customer(
          r.getText(0),
          r.getText(1),
          r.getText(2),
          r.getText(3),
          r.getTextOrNull(4),
          r.getBoolean(5)))
      .build();

  @Override
  public List<Model<?>> models() {
    return List.of(CUSTOMER);
  }
}
