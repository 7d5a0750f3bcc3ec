package com.truetickets.tickets.migration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.truetickets.api.v1.model.Customer;
import com.truetickets.api.v1.model.Device;
import com.truetickets.api.v1.model.PhoneNumber;
import com.truetickets.api.v1.model.Ticket;
import com.truetickets.api.v1.model.TicketStatus;
import com.truetickets.server.exception.InternalException;
import com.truetickets.tickets.model.ImmutableUpstreamComment;
import com.truetickets.tickets.model.ImmutableUpstreamCustomer;
import com.truetickets.tickets.model.ImmutableUpstreamProperties;
import com.truetickets.tickets.model.ImmutableUpstreamTicket;
import com.truetickets.tickets.model.ImmutableUpstreamTicketField;
import com.truetickets.tickets.model.UpstreamCustomer;
import com.truetickets.tickets.model.UpstreamProperties;
import com.truetickets.tickets.model.UpstreamTicket;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;

class LegacyTicketNormalizerTest {

  private static final String CREATED = "2023-06-01T10:00:00-05:00";
  private static final long CREATED_SECONDS = 1685631600L;

  private final LegacyTicketNormalizer normalizer = new LegacyTicketNormalizer();

  @Test
  void device() {
    assertThat(LegacyTicketNormalizer.device("iPhone 12 cracked screen")).isEqualTo(Device.PHONE);
    assertThat(LegacyTicketNormalizer.device("Dell  laptop no power")).isEqualTo(Device.LAPTOP);
    assertThat(LegacyTicketNormalizer.device("PS5 hdmi port")).isEqualTo(Device.CONSOLE);
    assertThat(LegacyTicketNormalizer.device("ipad then iphone")).isEqualTo(Device.TABLET);
    assertThat(LegacyTicketNormalizer.device("toaster")).isEqualTo(Device.OTHER);
  }

  @Test
  void device_wholeWordsOnly() {
    assertThat(LegacyTicketNormalizer.device("iphones")).isEqualTo(Device.OTHER);
  }

  @Test
  void status() {
    assertThat(LegacyTicketNormalizer.status("New")).isEqualTo(TicketStatus.DIAGNOSING);
    assertThat(LegacyTicketNormalizer.status("Customer Reply")).isEqualTo(TicketStatus.READY);
    assertThat(LegacyTicketNormalizer.status("Ready!")).isEqualTo(TicketStatus.READY);
    assertThat(LegacyTicketNormalizer.status("Resolved")).isEqualTo(TicketStatus.RESOLVED);
    assertThat(LegacyTicketNormalizer.status("Invoiced")).isEqualTo(TicketStatus.OTHER);
  }

  @Test
  void epochSeconds_unreadable() {
    assertThatExceptionOfType(InternalException.class)
        .isThrownBy(() -> LegacyTicketNormalizer.epochSeconds("yesterday"))
        .withMessageContaining("Timestamp Parse Error");
  }

  @Test
  void password_computerTicketPrefersPasswordField() {
    final UpstreamTicket ticket = ticket(properties("hunter2", "1234", "5678"), 9818L);

    assertThat(LegacyTicketNormalizer.password(ticket)).contains("hunter2");
  }

  @Test
  void password_phoneTicketPrefersPhoneField() {
    final UpstreamTicket ticket = ticket(properties("hunter2", "1234", "5678"), 9801L);

    assertThat(LegacyTicketNormalizer.password(ticket)).contains("5678");
  }

  @Test
  void password_otherTypeUsesFallback() {
    final UpstreamTicket ticket = ticket(properties("hunter2", "1234", "5678"), 1L);

    assertThat(LegacyTicketNormalizer.password(ticket)).contains("1234");
  }

  @Test
  void password_noneMeansNoPassword() {
    assertThat(LegacyTicketNormalizer.password(ticket(properties("N/A", " none ", null), 9836L))).isEmpty();
  }

  @Test
  void password_typeFromTicketFields() {
    final UpstreamTicket ticket = ImmutableUpstreamTicket.copyOf(ticket(properties("hunter2", "1234", "5678"), 1L))
        .withTicketFields(ImmutableUpstreamTicketField.builder().ticketTypeId(9801L).build());

    assertThat(LegacyTicketNormalizer.password(ticket)).contains("5678");
  }

  @Test
  void password_withoutProperties() {
    assertThat(LegacyTicketNormalizer.password(baseTicket().build())).isEmpty();
  }

  @Test
  void itemsLeft() {
    final UpstreamTicket withCharger = baseTicket()
        .properties(ImmutableUpstreamProperties.builder().acCharger("Yes").build())
        .build();
    final UpstreamTicket withoutCharger = baseTicket()
        .properties(ImmutableUpstreamProperties.builder().acCharger("0").build())
        .build();

    assertThat(LegacyTicketNormalizer.itemsLeft(withCharger)).containsExactly(LegacyTicketNormalizer.AC_CHARGER);
    assertThat(LegacyTicketNormalizer.itemsLeft(withoutCharger)).isEmpty();
    assertThat(LegacyTicketNormalizer.itemsLeft(baseTicket().build())).isEmpty();
  }

  @Test
  void unescape() {
    assertThat(LegacyTicketNormalizer.unescape("https://files.example.com/a?x=1\\u0026y=2&amp;z=3"))
        .isEqualTo("https://files.example.com/a?x=1&y=2&z=3");
  }

  @Test
  void phoneNumbers() {
    final UpstreamCustomer customer = ImmutableUpstreamCustomer.copyOf(upstreamCustomer())
        .withPhone(" 5551234567 ")
        .withMobile("5551234567");

    assertThat(LegacyTicketNormalizer.phoneNumbers(customer))
        .extracting(PhoneNumber::number)
        .containsExactly("5551234567");
  }

  @Test
  void phoneNumbers_blankSkipped() {
    final UpstreamCustomer customer = ImmutableUpstreamCustomer.copyOf(upstreamCustomer())
        .withPhone("")
        .withMobile("5559876543");

    assertThat(LegacyTicketNormalizer.phoneNumbers(customer))
        .extracting(PhoneNumber::number)
        .containsExactly("5559876543");
  }

  @Test
  void customer() {
    final Customer customer = normalizer.customer(baseTicket().build());

    assertThat(customer.customerId()).isEqualTo("31337");
    assertThat(customer.fullName()).isEqualTo("Jane Doe");
    assertThat(customer.email()).isEmpty();
    assertThat(customer.phoneNumbers()).extracting(PhoneNumber::number).containsExactly("5551234567");
    assertThat(customer.createdAt()).contains(CREATED_SECONDS);
    assertThat(customer.lastUpdated()).contains(CREATED_SECONDS);
  }

  @Test
  void ticket() {
    final UpstreamTicket upstream = baseTicket()
        .status("Waiting on Customer")
        .addComments(ImmutableUpstreamComment.builder()
            .body("Called, no answer")
            .tech("Sam")
            .createdAt("2023-06-02T10:00:00-05:00")
            .build())
        .addComments(ImmutableUpstreamComment.builder().createdAt("not a time").build())
        .build();

    final Ticket ticket = normalizer.ticket(upstream, List.of("https://bucket/attachments/1005/a.jpg"));

    assertThat(ticket.ticketNumber()).isEqualTo(1005L);
    assertThat(ticket.customerId()).isEqualTo("31337");
    assertThat(ticket.device()).isEqualTo(Device.PHONE);
    assertThat(ticket.status()).isEqualTo(TicketStatus.WAITING_OTHER);
    assertThat(ticket.attachments()).containsExactly("https://bucket/attachments/1005/a.jpg");
    assertThat(ticket.createdAt()).isEqualTo(CREATED_SECONDS);
    assertThat(ticket.lastUpdated()).isEqualTo(CREATED_SECONDS + 3600);
    assertThat(ticket.comments()).hasSize(2);
    assertThat(ticket.comments().get(0).commentBody()).isEqualTo("Called, no answer");
    assertThat(ticket.comments().get(0).createdAt()).isEqualTo(CREATED_SECONDS + 86400);
    assertThat(ticket.comments().get(1).commentBody()).isEmpty();
    assertThat(ticket.comments().get(1).createdAt()).isEqualTo(CREATED_SECONDS);
    assertThat(ticket.paidAt()).isEmpty();
  }

  private UpstreamProperties properties(final String password, final String passwordOrNone,
                                        final String passwordForPhone) {
    return ImmutableUpstreamProperties.builder()
        .password(Optional.ofNullable(password))
        .passwordOrNone(Optional.ofNullable(passwordOrNone))
        .passwordForPhone(Optional.ofNullable(passwordForPhone))
        .build();
  }

  private UpstreamTicket ticket(final UpstreamProperties properties, final long typeId) {
    return baseTicket().properties(properties).ticketTypeId(typeId).build();
  }

  private UpstreamCustomer upstreamCustomer() {
    return ImmutableUpstreamCustomer.builder()
        .businessAndFullName("Jane Doe")
        .email("  ")
        .phone("5551234567")
        .createdAt(CREATED)
        .build();
  }

  private ImmutableUpstreamTicket.Builder baseTicket() {
    return ImmutableUpstreamTicket.builder()
        .number(1005L)
        .subject("iPhone 12 screen")
        .status("New")
        .createdAt(CREATED)
        .updatedAt("2023-06-01T11:00:00-05:00")
        .customerId(31337L)
        .customer(upstreamCustomer());
  }

}
