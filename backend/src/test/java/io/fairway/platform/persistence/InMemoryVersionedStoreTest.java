package io.fairway.platform.persistence;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import io.fairway.platform.customer.Customer;
import java.time.Instant;
import java.util.Map;
import java.util.UUID;
import org.junit.jupiter.api.Test;

class InMemoryVersionedStoreTest {

  private static final Instant NOW = Instant.parse("2025-01-01T00:00:00Z");

  private final InMemoryVersionedStore<UUID, Customer> store =
      new InMemoryVersionedStore<>("customer");

  private Customer newCustomer() {
    return new Customer(
        UUID.randomUUID().toString(), "pro@example.com", "Pro Shop", Map.of(), "tok_visa", NOW);
  }

  @Test
  void save_assignsVersionOneOnInsert() {
    var customer = newCustomer();

    store.save(customer.getId(), customer);

    assertThat(customer.getVersion()).isEqualTo(1L);
    assertThat(store.find(customer.getId())).get().extracting(Customer::getVersion).isEqualTo(1L);
  }

  @Test
  void save_withStaleCopy_isRejected() {
    var customer = newCustomer();
    store.save(customer.getId(), customer);

    var first = store.find(customer.getId()).orElseThrow();
    var second = store.find(customer.getId()).orElseThrow();
    first.updatePaymentMethod("tok_first", NOW.plusSeconds(1));
    store.save(first.getId(), first);

    second.updatePaymentMethod("tok_second", NOW.plusSeconds(2));
    assertThatThrownBy(() -> store.save(second.getId(), second))
        .isInstanceOf(StaleVersionException.class);
    assertThat(store.find(customer.getId()).orElseThrow().getDefaultPaymentMethod())
        .isEqualTo("tok_first");
  }

  @Test
  void find_returnsCopiesThatDoNotLeakMutations() {
    var customer = newCustomer();
    store.save(customer.getId(), customer);

    var copy = store.find(customer.getId()).orElseThrow();
    copy.updatePaymentMethod("tok_local", NOW.plusSeconds(5));

    assertThat(store.find(customer.getId()).orElseThrow().getDefaultPaymentMethod())
        .isEqualTo("tok_visa");
  }

  @Test
  void findAll_filtersByPredicate() {
    var a = newCustomer();
    var b = newCustomer();
    store.save(a.getId(), a);
    store.save(b.getId(), b);

    assertThat(store.findAll(c -> c.getTenantId().equals(a.getTenantId())))
        .extracting(Customer::getId)
        .containsExactly(a.getId());
    assertThat(store.size()).isEqualTo(2);
  }
}
