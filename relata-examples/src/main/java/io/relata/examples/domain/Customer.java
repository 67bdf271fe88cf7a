package io.relata.examples.domain;

public record Customer(String id, String firstName, String lastName, String email, String phone, boolean active) {
  public Customer withId(String id) {
    return new Customer(id, firstName, lastName, email, phone, active);
  }
}
