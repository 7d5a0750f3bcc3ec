package com.truetickets.tickets.manager;

import static org.assertj.core.api.Assertions.assertThat;

import com.truetickets.api.v1.model.Customer;
import com.truetickets.api.v1.model.Device;
import com.truetickets.api.v1.model.ImmutableCustomer;
import com.truetickets.api.v1.model.ImmutablePhoneNumber;
import com.truetickets.api.v1.model.ImmutableTicket;
import com.truetickets.api.v1.model.ImmutableUpdateCustomerRequest;
import com.truetickets.api.v1.model.ImmutableUpdateTicketRequest;
import com.truetickets.api.v1.model.PhoneNumber;
import com.truetickets.api.v1.model.Ticket;
import com.truetickets.api.v1.model.TicketStatus;
import com.truetickets.tickets.converter.AttributeValues;
import com.truetickets.tickets.converter.CustomerConverter;
import com.truetickets.tickets.converter.TicketConverter;
import com.truetickets.tickets.dao.Attributes;
import com.truetickets.tickets.dao.TableNames;
import java.util.List;
import java.util.stream.Collectors;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItem;

class IndexManagerTest {

  private final IndexManager indexManager = new IndexManager(new CustomerConverter(), new TicketConverter());

  @Test
  void customerCreate_rowPerPhone() {
    final Customer customer = ImmutableCustomer.builder()
        .customerId("c1")
        .fullName("Jane DOE")
        .addPhoneNumbers(phone("555-0100"), phone("555-0101"))
        .build();

    final List<TransactWriteItem> items = indexManager.customerCreate(customer);

    assertThat(items).hasSize(4);
    assertThat(items.get(0).put().tableName()).isEqualTo(TableNames.CUSTOMERS);
    assertThat(items.get(0).put().conditionExpression()).isEqualTo("attribute_not_exists(#customer_id)");
    assertThat(items.get(1).put().item().get(Attributes.FULL_NAME_LC).s()).isEqualTo("jane doe");
    assertThat(phonePuts(items)).containsExactly("555-0100", "555-0101");
  }

  @Test
  void customerUpdate_phoneDiff() {
    final List<TransactWriteItem> items = indexManager.customerUpdate("c1",
        List.of(phone("555-0100"), phone("555-0101")),
        ImmutableUpdateCustomerRequest.builder()
            .phoneNumbers(List.of(phone("555-0101"), phone("555-0200")))
            .build(),
        50L);

    assertThat(items.get(0).update().conditionExpression())
        .startsWith("attribute_exists(#customer_id) AND #phone_numbers = ");
    assertThat(phoneDeletes(items)).containsExactly("555-0100");
    assertThat(phonePuts(items)).containsExactly("555-0200");
  }

  @Test
  void customerUpdate_nameOnly() {
    final List<TransactWriteItem> items = indexManager.customerUpdate("c1", List.of(phone("555-0100")),
        ImmutableUpdateCustomerRequest.builder().fullName("New NAME").build(), 50L);

    assertThat(items).hasSize(2);
    assertThat(items.get(0).update().conditionExpression()).isEqualTo("attribute_exists(#customer_id)");
    assertThat(items.get(1).update().tableName()).isEqualTo(TableNames.CUSTOMER_NAMES);
    assertThat(items.get(1).update().expressionAttributeValues())
        .containsValue(AttributeValues.s("new name"));
  }

  @Test
  void customerUpdate_trimsNameAndEmail() {
    final List<TransactWriteItem> items = indexManager.customerUpdate("c1", List.of(phone("555-0100")),
        ImmutableUpdateCustomerRequest.builder().fullName("  Jane Doe ").email("   ").build(), 50L);

    assertThat(items.get(0).update().expressionAttributeValues())
        .containsValue(AttributeValues.s("Jane Doe"))
        .doesNotContainValue(AttributeValues.s("  Jane Doe "));
    assertThat(items.get(0).update().updateExpression()).contains("REMOVE #email");
    assertThat(items.get(1).update().expressionAttributeValues())
        .containsValue(AttributeValues.s("jane doe"));
  }

  @Test
  void customerUpsert_dropsStalePhones() {
    final Customer customer = ImmutableCustomer.builder()
        .customerId("c1")
        .fullName("Jane")
        .addPhoneNumbers(phone("555-0200"))
        .build();

    final List<TransactWriteItem> items = indexManager.customerUpsert(customer, List.of(phone("555-0100")));

    assertThat(items.get(0).put().conditionExpression()).isNull();
    assertThat(phoneDeletes(items)).containsExactly("555-0100");
    assertThat(phonePuts(items)).containsExactly("555-0200");
  }

  @Test
  void ticketCreate_order() {
    final List<TransactWriteItem> items = indexManager.ticketCreate(ticket());

    assertThat(items).hasSize(3);
    assertThat(items.get(IndexManager.TICKET_CREATE_CUSTOMER_CHECK).conditionCheck().tableName())
        .isEqualTo(TableNames.CUSTOMERS);
    assertThat(items.get(IndexManager.TICKET_CREATE_TICKET_PUT).put().conditionExpression())
        .isEqualTo("attribute_not_exists(#ticket_number)");
    assertThat(items.get(2).put().item().get(Attributes.SUBJECT_LC).s()).isEqualTo("iphone screen");
  }

  @Test
  void ticketUpdate_rewritesStatusDevice() {
    final List<TransactWriteItem> items = indexManager.ticketUpdate(7L, TicketStatus.DIAGNOSING, Device.PHONE,
        ImmutableUpdateTicketRequest.builder().device(Device.TABLET).build(), 50L);

    assertThat(items).hasSize(1);
    assertThat(items.get(0).update().expressionAttributeValues())
        .containsValue(AttributeValues.s("Diagnosing#Tablet"));
    assertThat(items.get(0).update().conditionExpression()).startsWith("#status = ").contains("#device = ");
  }

  @Test
  void ticketUpdate_subjectAndEmptyLists() {
    final List<TransactWriteItem> items = indexManager.ticketUpdate(7L, TicketStatus.DIAGNOSING, Device.PHONE,
        ImmutableUpdateTicketRequest.builder()
            .subject("Cracked Back")
            .password("")
            .lineItems(List.of())
            .build(),
        50L);

    assertThat(items).hasSize(2);
    assertThat(items.get(0).update().updateExpression())
        .doesNotContain("#status_device")
        .contains("REMOVE #password, #line_items");
    assertThat(items.get(1).put().item().get(Attributes.SUBJECT_LC).s()).isEqualTo("cracked back");
  }

  @Test
  void ticketUpdate_trimsSubject() {
    final List<TransactWriteItem> items = indexManager.ticketUpdate(7L, TicketStatus.DIAGNOSING, Device.PHONE,
        ImmutableUpdateTicketRequest.builder().subject("  Cracked Back ").build(), 50L);

    assertThat(items.get(0).update().expressionAttributeValues())
        .containsValue(AttributeValues.s("Cracked Back"));
    assertThat(items.get(1).put().item().get(Attributes.SUBJECT_LC).s()).isEqualTo("cracked back");
  }

  private Ticket ticket() {
    return ImmutableTicket.builder()
        .ticketNumber(7L)
        .customerId("c1")
        .subject("iPhone Screen")
        .device(Device.PHONE)
        .status(TicketStatus.DIAGNOSING)
        .createdAt(1L)
        .lastUpdated(1L)
        .build();
  }

  private PhoneNumber phone(final String number) {
    return ImmutablePhoneNumber.builder().number(number).build();
  }

  private List<String> phonePuts(final List<TransactWriteItem> items) {
    return items.stream()
        .filter(item -> item.put() != null && item.put().tableName().equals(TableNames.CUSTOMER_PHONE_INDEX))
        .map(item -> item.put().item().get(Attributes.PHONE_NUMBER).s())
        .collect(Collectors.toList());
  }

  private List<String> phoneDeletes(final List<TransactWriteItem> items) {
    return items.stream()
        .filter(item -> item.delete() != null && item.delete().tableName().equals(TableNames.CUSTOMER_PHONE_INDEX))
        .map(item -> item.delete().key().get(Attributes.PHONE_NUMBER).s())
        .collect(Collectors.toList());
  }

}
