package com.truetickets.tickets.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.truetickets.api.v1.model.Customer;
import com.truetickets.api.v1.model.Device;
import com.truetickets.api.v1.model.ImmutableCreateCustomerRequest;
import com.truetickets.api.v1.model.ImmutableCustomer;
import com.truetickets.api.v1.model.ImmutablePhoneNumber;
import com.truetickets.api.v1.model.ImmutableTicket;
import com.truetickets.api.v1.model.ImmutableUpdateCustomerRequest;
import com.truetickets.api.v1.model.PhoneNumber;
import com.truetickets.api.v1.model.Ticket;
import com.truetickets.api.v1.model.TicketStatus;
import com.truetickets.server.exception.BadInputException;
import com.truetickets.server.exception.InternalException;
import com.truetickets.server.exception.NotFoundException;
import com.truetickets.tickets.converter.CustomerConverter;
import com.truetickets.tickets.dao.Attributes;
import com.truetickets.tickets.dao.DynamoDbStore;
import com.truetickets.tickets.dao.ItemBuilder;
import com.truetickets.tickets.dao.TableNames;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItem;

@ExtendWith(MockitoExtension.class)
class CustomerManagerTest {

  private static final Instant NOW = Instant.parse("2024-03-15T12:00:00Z");
  private static final String CUSTOMER_ID = "abc123defg";
  private static final PhoneNumber PHONE = ImmutablePhoneNumber.builder().number("5551234567").build();

  @Mock private DynamoDbStore dynamoDbStore;
  @Mock private IndexManager indexManager;
  @Mock private IdentifierManager identifierManager;

  private final List<TransactWriteItem> writes = List.of(TransactWriteItem.builder().build());
  private final CustomerConverter customerConverter = new CustomerConverter();
  private CustomerManager customerManager;

  @BeforeEach
  void setUp() {
    customerManager = new CustomerManager(dynamoDbStore, indexManager, identifierManager, customerConverter,
        Clock.fixed(NOW, ZoneOffset.UTC));
  }

  @Test
  void get_notFound() {
    when(dynamoDbStore.get(TableNames.CUSTOMERS, ItemBuilder.key(Attributes.CUSTOMER_ID, CUSTOMER_ID), false))
        .thenReturn(Optional.empty());

    assertThatExceptionOfType(NotFoundException.class)
        .isThrownBy(() -> customerManager.get(CUSTOMER_ID))
        .withMessageContaining("Customer Not Found");
  }

  @Test
  void create() {
    when(identifierManager.shortId(IdentifierManager.CUSTOMER_ID_LENGTH)).thenReturn(CUSTOMER_ID);
    when(indexManager.customerCreate(any(Customer.class))).thenReturn(writes);

    final String customerId = customerManager.create(ImmutableCreateCustomerRequest.builder()
        .fullName("  Jane Doe ")
        .email(" ")
        .addPhoneNumbers(PHONE)
        .build());

    assertThat(customerId).isEqualTo(CUSTOMER_ID);
    verify(indexManager).customerCreate(ImmutableCustomer.builder()
        .customerId(CUSTOMER_ID)
        .fullName("Jane Doe")
        .addPhoneNumbers(PHONE)
        .createdAt(NOW.getEpochSecond())
        .lastUpdated(NOW.getEpochSecond())
        .build());
    verify(dynamoDbStore).transactWrite(writes);
  }

  @Test
  void create_withoutPhones() {
    assertThatExceptionOfType(BadInputException.class)
        .isThrownBy(() -> customerManager.create(ImmutableCreateCustomerRequest.builder()
            .fullName("Jane Doe")
            .build()))
        .withMessageContaining("Invalid Phone Numbers");
    verifyNoInteractions(dynamoDbStore);
  }

  @Test
  void create_duplicatePhones() {
    assertThatExceptionOfType(BadInputException.class)
        .isThrownBy(() -> customerManager.create(ImmutableCreateCustomerRequest.builder()
            .fullName("Jane Doe")
            .addPhoneNumbers(PHONE, ImmutablePhoneNumber.builder().number("5551234567").prefersTexting(true).build())
            .build()))
        .withMessageContaining("listed twice");
  }

  @Test
  void create_blankName() {
    assertThatExceptionOfType(BadInputException.class)
        .isThrownBy(() -> customerManager.create(ImmutableCreateCustomerRequest.builder()
            .fullName("")
            .addPhoneNumbers(PHONE)
            .build()))
        .withMessageContaining("Invalid Name");
  }

  @Test
  void update_nothingToChange() {
    assertThatExceptionOfType(BadInputException.class)
        .isThrownBy(() -> customerManager.update(CUSTOMER_ID, ImmutableUpdateCustomerRequest.builder().build()))
        .withMessageContaining("No Changes");
    verifyNoInteractions(dynamoDbStore);
  }

  @Test
  void update_emptyPhones() {
    assertThatExceptionOfType(BadInputException.class)
        .isThrownBy(() -> customerManager.update(CUSTOMER_ID, ImmutableUpdateCustomerRequest.builder()
            .phoneNumbers(List.of())
            .build()));
  }

  @Test
  void withCustomers() {
    final Customer customer = ImmutableCustomer.builder()
        .customerId(CUSTOMER_ID)
        .fullName("Jane Doe")
        .addPhoneNumbers(PHONE)
        .build();
    when(dynamoDbStore.batchGet(TableNames.CUSTOMERS,
        List.of(ItemBuilder.key(Attributes.CUSTOMER_ID, CUSTOMER_ID)),
        Attributes.CUSTOMER_ID, Attributes.FULL_NAME, Attributes.EMAIL, Attributes.PHONE_NUMBERS,
        Attributes.CREATED_AT, Attributes.LAST_UPDATED))
        .thenReturn(List.of(customerConverter.toItem(customer)));

    final List<Ticket> result = customerManager.withCustomers(List.of(ticket(2, CUSTOMER_ID), ticket(1, CUSTOMER_ID)));

    assertThat(result).extracting(Ticket::ticketNumber).containsExactly(2L, 1L);
    assertThat(result).allSatisfy(t -> assertThat(t.customer()).contains(customer));
  }

  @Test
  void withCustomers_missingCustomer() {
    when(dynamoDbStore.batchGet(TableNames.CUSTOMERS,
        List.of(ItemBuilder.key(Attributes.CUSTOMER_ID, CUSTOMER_ID)),
        Attributes.CUSTOMER_ID, Attributes.FULL_NAME, Attributes.EMAIL, Attributes.PHONE_NUMBERS,
        Attributes.CREATED_AT, Attributes.LAST_UPDATED))
        .thenReturn(List.of());

    assertThatExceptionOfType(InternalException.class)
        .isThrownBy(() -> customerManager.withCustomers(List.of(ticket(7, CUSTOMER_ID))))
        .withMessageContaining("Data Integrity Error");
  }

  @Test
  void withCustomers_noCustomerIds() {
    assertThatExceptionOfType(InternalException.class)
        .isThrownBy(() -> customerManager.withCustomers(List.of(ticket(7, ""))))
        .withMessageContaining("Data Integrity Error");
    verifyNoInteractions(dynamoDbStore);
  }

  @Test
  void withCustomers_none() {
    assertThat(customerManager.withCustomers(List.of())).isEmpty();
  }

  private Ticket ticket(final long number, final String customerId) {
    return ImmutableTicket.builder()
        .ticketNumber(number)
        .customerId(customerId)
        .subject("cracked screen")
        .device(Device.PHONE)
        .status(TicketStatus.DIAGNOSING)
        .createdAt(NOW.getEpochSecond())
        .lastUpdated(NOW.getEpochSecond())
        .build();
  }

}
