package io.relata.examples.web;

import io.relata.examples.domain.Customer;
import io.relata.examples.service.CustomerService;
import io.relata.orm.query.FilterOperator;
import io.relata.orm.query.PaginatedResult;
import io.relata.orm.query.Pagination;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/customers")
public final class CustomerController {
  private final CustomerService customers;

  public CustomerController(CustomerService customers) {
    this.customers = customers;
  }

  public record CreateCustomerRequest(String firstName, String lastName, String email, String phone) {}

  @PostMapping
  public Customer create(@RequestBody CreateCustomerRequest req) {
    return customers.create(new Customer(null, req.firstName(), req.lastName(), req.email(), req.phone(), true));
  }

  @GetMapping("/{id}")
  public ResponseEntity<Customer> get(@PathVariable("id") String id) {
    return customers.get(id).map(ResponseEntity::ok).orElseGet(() -> ResponseEntity.notFound().build());
  }

  @DeleteMapping("/{id}")
  public ResponseEntity<Void> delete(@PathVariable("id") String id) {
    return customers.delete(id) ? ResponseEntity.noContent().build() : ResponseEntity.notFound().build();
  }

  @PostMapping(value = "/search", consumes = MediaType.APPLICATION_JSON_VALUE)
  public List<Customer> search(@RequestBody FilterOperator filter) {
    return customers.search(filter);
  }

  @PostMapping("/count")
  public long count(@RequestBody(required = false) FilterOperator filter) {
    return customers.count(filter);
  }

  @GetMapping
  public PaginatedResult<Customer> page(@RequestParam(name = "page", defaultValue = "1") int page,
                                        @RequestParam(name = "perPage", defaultValue = "20") int perPage) {
    return customers.page(null, new Pagination(page, perPage));
  }

  @GetMapping("/find")
  public PaginatedResult<Customer> find(@RequestParam("q") String term,
                                        @RequestParam(name = "page", defaultValue = "1") int page,
                                        @RequestParam(name = "perPage", defaultValue = "20") int perPage) {
    return customers.find(term, new Pagination(page, perPage));
  }

  @ExceptionHandler(IllegalArgumentException.class)
  public ResponseEntity<String> badRequest(IllegalArgumentException e) {
    return ResponseEntity.badRequest().body(e.getMessage());
  }
}
