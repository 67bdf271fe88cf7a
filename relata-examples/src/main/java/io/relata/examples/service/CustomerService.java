package io.relata.examples.service;

import io.relata.examples.domain.Customer;
import io.relata.orm.query.FilterOperator;
import io.relata.orm.query.PaginatedResult;
import io.relata.orm.query.Pagination;
import io.relata.orm.query.SearchFilter;
import io.relata.orm.repository.Repository;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Service
public final class CustomerService {
  private static final String[] SEARCHABLE = {"first_name", "last_name", "email"};

  private final Repository<Customer> customers;

  public CustomerService(Repository<Customer> customers) {
    this.customers = customers;
  }

  public Customer create(Customer c) {
    Customer withId = (c.id() == null) ? c.withId(UUID.randomUUID().toString()) : c;
    return customers.create(withId);
  }

  public Optional<Customer> get(String id) {
    return customers.findById(id);
  }

  public List<Customer> search(FilterOperator filter) {
    return (filter == null) ? customers.findAll() : customers.findWhere(filter);
  }

  public PaginatedResult<Customer> page(FilterOperator filter, Pagination pagination) {
    return customers.findWherePaginated(filter, pagination);
  }

  public PaginatedResult<Customer> find(String term, Pagination pagination) {
    return customers.search(SearchFilter.of(term, SEARCHABLE), pagination);
  }

  public long count(FilterOperator filter) {
    return (filter == null) ? customers.count() : customers.countWhere(filter);
  }

  public Customer update(Customer c) {
    return customers.update(c);
  }

  public boolean delete(String id) {
    Optional<Customer> existing = customers.findById(id);
    if (existing.isEmpty()) return false;
    return customers.delete(existing.get());
  }
}
