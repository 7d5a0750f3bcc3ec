package com.truetickets.tickets.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.truetickets.api.v1.model.Device;
import com.truetickets.api.v1.model.ImmutableLineItem;
import com.truetickets.api.v1.model.LineItem;
import com.truetickets.api.v1.model.TicketStatus;
import com.truetickets.server.exception.BadInputException;
import com.truetickets.server.exception.ConflictException;
import com.truetickets.server.exception.NotFoundException;
import com.truetickets.tickets.converter.AttributeValues;
import com.truetickets.tickets.converter.TicketConverter;
import com.truetickets.tickets.dao.Attributes;
import com.truetickets.tickets.dao.DynamoDbStore;
import com.truetickets.tickets.dao.ItemBuilder;
import com.truetickets.tickets.dao.TableNames;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;

@ExtendWith(MockitoExtension.class)
class PaymentManagerTest {

  private static final long TICKET = 1001L;
  private static final Map<String, AttributeValue> KEY = ItemBuilder.key(Attributes.TICKET_NUMBER, TICKET);
  private static final LineItem SCREEN = ImmutableLineItem.builder().subject("Screen").priceCents(12000).build();
  private static final LineItem LABOR = ImmutableLineItem.builder().subject("Labor").priceCents(3000).build();

  @Mock private DynamoDbStore dynamoDbStore;
  @Mock private StoreConfigManager storeConfigManager;
  @Captor private ArgumentCaptor<UpdateItemRequest> updateCaptor;

  private final TicketConverter ticketConverter = new TicketConverter();
  private PaymentManager paymentManager;

  @BeforeEach
  void setUp() {
    paymentManager = new PaymentManager(dynamoDbStore, storeConfigManager, ticketConverter,
        Clock.fixed(Instant.ofEpochSecond(1700000000L), ZoneOffset.UTC));
  }

  @Test
  void totalWithTax() {
    assertThat(PaymentManager.totalWithTax(15000, 8.0)).isEqualTo(16200L);
    assertThat(PaymentManager.totalWithTax(999, 8.25)).isEqualTo(1081L);
    assertThat(PaymentManager.totalWithTax(0, 8.0)).isZero();
    assertThat(PaymentManager.totalWithTax(1000, 0)).isEqualTo(1000L);
  }

  @Test
  void receipt() {
    assertThat(PaymentManager.receipt("[Payment Taken]", List.of(SCREEN, LABOR), 16200L))
        .isEqualTo("[Payment Taken]\n- Screen: $120.00\n- Labor: $30.00\nTotal: $162.00");
    assertThat(PaymentManager.receipt("[Payment Taken]", List.of(), 5L))
        .isEqualTo("[Payment Taken]\nTotal: $0.05");
  }

  @Test
  void takePayment_conditionedOnWhatWasRead() {
    stored(TicketStatus.IN_PROGRESS, SCREEN, LABOR);
    when(storeConfigManager.taxRate()).thenReturn(8.0);
    when(dynamoDbStore.update(updateCaptor.capture())).thenReturn(Map.of());

    assertThat(paymentManager.takePayment(TICKET, "Bob")).isEqualTo(16200L);

    final UpdateItemRequest request = updateCaptor.getValue();
    assertThat(request.conditionExpression())
        .isEqualTo("#status <> :v7 AND #device = :v8 AND #line_items = :v9");
    assertThat(request.expressionAttributeValues())
        .containsEntry(":v0", AttributeValues.s("Resolved"))
        .containsEntry(":v1", AttributeValues.s("Resolved#Phone"))
        .containsEntry(":v2", AttributeValues.n(1700000000L))
        .containsEntry(":v3", AttributeValues.n(16200L))
        .containsEntry(":v9", ticketConverter.lineItems(List.of(SCREEN, LABOR)));
    assertThat(request.updateExpression()).contains("list_append(if_not_exists(#comments");
  }

  @Test
  void takePayment_noLineItems() {
    stored(TicketStatus.READY);
    when(storeConfigManager.taxRate()).thenReturn(8.0);
    when(dynamoDbStore.update(updateCaptor.capture())).thenReturn(Map.of());

    assertThat(paymentManager.takePayment(TICKET, "Bob")).isZero();
    assertThat(updateCaptor.getValue().conditionExpression()).endsWith("attribute_not_exists(#line_items)");
  }

  @Test
  void takePayment_alreadyResolved() {
    stored(TicketStatus.RESOLVED, SCREEN);

    assertThatExceptionOfType(ConflictException.class)
        .isThrownBy(() -> paymentManager.takePayment(TICKET, "Bob"));
    verify(dynamoDbStore, never()).update(any(UpdateItemRequest.class));
  }

  @Test
  void takePayment_missingTicket() {
    when(dynamoDbStore.get(TableNames.TICKETS, KEY, true, Attributes.LINE_ITEMS, Attributes.DEVICE, Attributes.STATUS))
        .thenReturn(Optional.empty());

    assertThatExceptionOfType(NotFoundException.class)
        .isThrownBy(() -> paymentManager.takePayment(TICKET, "Bob"));
  }

  @Test
  void refundPayment_notResolved() {
    stored(TicketStatus.IN_PROGRESS, SCREEN);

    assertThatExceptionOfType(BadInputException.class)
        .isThrownBy(() -> paymentManager.refundPayment(TICKET, "Bob"))
        .withMessageContaining("Ticket must be Resolved to refund");
    verify(dynamoDbStore, never()).update(any(UpdateItemRequest.class));
  }

  @Test
  void refundPayment_removesPayment() {
    stored(TicketStatus.RESOLVED, SCREEN);
    when(dynamoDbStore.update(updateCaptor.capture())).thenReturn(Map.of());

    paymentManager.refundPayment(TICKET, "Bob");

    final UpdateItemRequest request = updateCaptor.getValue();
    assertThat(request.updateExpression()).endsWith("REMOVE #paid_at, #total_paid_cents");
    assertThat(request.expressionAttributeValues())
        .containsEntry(":v0", AttributeValues.s("In Progress"))
        .containsEntry(":v1", AttributeValues.s("In Progress#Phone"));
  }

  @Test
  void declineRepair_noLineItems() {
    stored(TicketStatus.DIAGNOSING);

    assertThatExceptionOfType(BadInputException.class)
        .isThrownBy(() -> paymentManager.declineRepair(TICKET, "Bob"));
  }

  private void stored(final TicketStatus status, final LineItem... lineItems) {
    final Map<String, AttributeValue> item = new HashMap<>();
    item.put(Attributes.STATUS, AttributeValues.s(status.displayName()));
    item.put(Attributes.DEVICE, AttributeValues.s(Device.PHONE.displayName()));
    if (lineItems.length > 0) {
      item.put(Attributes.LINE_ITEMS, ticketConverter.lineItems(List.of(lineItems)));
    }
    when(dynamoDbStore.get(TableNames.TICKETS, KEY, true, Attributes.LINE_ITEMS, Attributes.DEVICE, Attributes.STATUS))
        .thenReturn(Optional.of(item));
  }

}
