package com.truetickets.tickets.migration;

import com.truetickets.api.v1.model.Comment;
import com.truetickets.api.v1.model.Customer;
import com.truetickets.api.v1.model.Device;
import com.truetickets.api.v1.model.ImmutableComment;
import com.truetickets.api.v1.model.ImmutableCustomer;
import com.truetickets.api.v1.model.ImmutablePhoneNumber;
import com.truetickets.api.v1.model.ImmutableTicket;
import com.truetickets.api.v1.model.PhoneNumber;
import com.truetickets.api.v1.model.Ticket;
import com.truetickets.api.v1.model.TicketStatus;
import com.truetickets.server.exception.InternalException;
import com.truetickets.tickets.model.UpstreamComment;
import com.truetickets.tickets.model.UpstreamCustomer;
import com.truetickets.tickets.model.UpstreamProperties;
import com.truetickets.tickets.model.UpstreamTicket;
import com.truetickets.tickets.model.UpstreamTicketField;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Turns legacy tickets into our customers and tickets.
 */
@Singleton
public class LegacyTicketNormalizer {

  /**
   * Item recorded when the legacy ticket says the charger was left.
   */
  public static final String AC_CHARGER = "AC Charger";

  private static final Logger LOGGER = LoggerFactory.getLogger(LegacyTicketNormalizer.class);
  private static final Set<String> NO_PASSWORD = Set.of("n", "na", "n/a", "none");
  private static final Set<String> YES = Set.of("true", "yes", "1");
  private static final Map<String, Device> DEVICE_KEYWORDS = deviceKeywords();
  private static final Map<String, TicketStatus> STATUSES = Map.of(
      "New", TicketStatus.DIAGNOSING,
      "Scheduled", TicketStatus.FINDING_PRICE,
      "Call Customer", TicketStatus.APPROVAL_NEEDED,
      "Waiting for Parts", TicketStatus.WAITING_FOR_PARTS,
      "Waiting on Customer", TicketStatus.WAITING_OTHER,
      "In Progress", TicketStatus.IN_PROGRESS,
      "Customer Reply", TicketStatus.READY,
      "Ready!", TicketStatus.READY,
      "Resolved", TicketStatus.RESOLVED);

  /**
   * Instantiates a new Legacy ticket normalizer.
   */
  @Inject
  public LegacyTicketNormalizer() {
    LOGGER.info("LegacyTicketNormalizer()");
  }

  private static Map<String, Device> deviceKeywords() {
    final Map<String, Device> keywords = new LinkedHashMap<>();
    List.of("iphone", "iph", "ip", "galaxy", "pixel", "oneplus", "samsung", "huawei", "phone", "moto")
        .forEach(word -> keywords.put(word, Device.PHONE));
    List.of("ipad", "tablet", "kindle", "tab")
        .forEach(word -> keywords.put(word, Device.TABLET));
    List.of("laptop", "macbook", "thinkpad", "elitebook", "chromebook", "inspiron", "predator", "latitude", "ltop")
        .forEach(word -> keywords.put(word, Device.LAPTOP));
    List.of("desktop", "dtop", "pc", "tower", "omen")
        .forEach(word -> keywords.put(word, Device.DESKTOP));
    List.of("watch", "smartwatch")
        .forEach(word -> keywords.put(word, Device.WATCH));
    List.of("playstation", "xbox", "nintendo", "switch", "ps6", "ps5", "ps4", "console", "controller")
        .forEach(word -> keywords.put(word, Device.CONSOLE));
    return Map.copyOf(keywords);
  }

  /**
   * Device of the first word of the subject that names one.
   *
   * @param subject the subject
   * @return the device, other when no word matches
   */
  public static Device device(final String subject) {
    for (String word : subject.toLowerCase(Locale.ROOT).split("\\s+")) {
      final Device device = DEVICE_KEYWORDS.get(word);
      if (device != null) {
        return device;
      }
    }
    return Device.OTHER;
  }

  /**
   * Our status for the legacy status.
   *
   * @param upstreamStatus the upstream status
   * @return the ticket status
   */
  public static TicketStatus status(final String upstreamStatus) {
    return STATUSES.getOrDefault(upstreamStatus, TicketStatus.OTHER);
  }

  /**
   * Epoch seconds of an RFC 3339 timestamp.
   *
   * @param timestamp the timestamp
   * @return the long
   */
  public static long epochSeconds(final String timestamp) {
    try {
      return OffsetDateTime.parse(timestamp).toEpochSecond();
    } catch (DateTimeParseException e) {
      throw new InternalException("Timestamp Parse Error", "Could not parse timestamp '" + timestamp + "'.", e);
    }
  }

  /**
   * The password of the device. Which field is checked first depends on the ticket type, the field that says to
   * type none is the fallback. Values meaning no password are dropped.
   *
   * @param ticket the ticket
   * @return the optional
   */
  public static Optional<String> password(final UpstreamTicket ticket) {
    final Optional<UpstreamProperties> properties = ticket.properties();
    if (properties.isEmpty()) {
      return Optional.empty();
    }
    final Optional<Long> typeId = ticket.ticketFields().stream()
        .findFirst()
        .flatMap(UpstreamTicketField::ticketTypeId)
        .or(ticket::ticketTypeId);
    final Function<UpstreamProperties, Optional<String>> preferred;
    if (typeId.filter(id -> id == 9818L || id == 9836L).isPresent()) {
      preferred = UpstreamProperties::password;
    } else if (typeId.filter(id -> id == 9801L).isPresent()) {
      preferred = UpstreamProperties::passwordForPhone;
    } else {
      preferred = p -> Optional.empty();
    }
    return preferred.apply(properties.get()).filter(LegacyTicketNormalizer::isPassword)
        .or(() -> properties.get().passwordOrNone().filter(LegacyTicketNormalizer::isPassword));
  }

  private static boolean isPassword(final String value) {
    final String normalized = value.trim().toLowerCase(Locale.ROOT);
    return !normalized.isEmpty() && !NO_PASSWORD.contains(normalized);
  }

  /**
   * Items left with the device.
   *
   * @param ticket the ticket
   * @return the list
   */
  public static List<String> itemsLeft(final UpstreamTicket ticket) {
    final boolean charger = ticket.properties()
        .flatMap(UpstreamProperties::acCharger)
        .map(value -> YES.contains(value.trim().toLowerCase(Locale.ROOT)))
        .orElse(false);
    return charger ? List.of(AC_CHARGER) : List.of();
  }

  /**
   * The download url of a legacy attachment with escaped ampersands restored.
   *
   * @param url the url
   * @return the string
   */
  public static String unescape(final String url) {
    return url.replace("\\u0026", "&").replace("&amp;", "&");
  }

  /**
   * Phone numbers of the legacy customer, phone first then mobile, without blanks and repeats.
   *
   * @param customer the customer
   * @return the list
   */
  public static List<PhoneNumber> phoneNumbers(final UpstreamCustomer customer) {
    final Set<String> numbers = new LinkedHashSet<>();
    customer.phone().map(String::trim).filter(number -> !number.isEmpty()).ifPresent(numbers::add);
    customer.mobile().map(String::trim).filter(number -> !number.isEmpty()).ifPresent(numbers::add);
    return numbers.stream()
        .map(number -> (PhoneNumber) ImmutablePhoneNumber.builder().number(number).build())
        .toList();
  }

  /**
   * The customer of the legacy ticket. The legacy customer id is kept.
   *
   * @param ticket the ticket
   * @return the customer
   */
  public Customer customer(final UpstreamTicket ticket) {
    LOGGER.trace("customer({})", ticket.number());
    final UpstreamCustomer upstream = ticket.customer();
    final long createdAt = epochSeconds(upstream.createdAt());
    return ImmutableCustomer.builder()
        .customerId(Long.toString(ticket.customerId()))
        .fullName(upstream.businessAndFullName())
        .email(upstream.email().map(String::trim).filter(email -> !email.isEmpty()))
        .phoneNumbers(phoneNumbers(upstream))
        .createdAt(createdAt)
        .lastUpdated(upstream.updatedAt().map(LegacyTicketNormalizer::epochSeconds).orElse(createdAt))
        .build();
  }

  /**
   * The ticket, with the attachments already copied to our store.
   *
   * @param ticket         the ticket
   * @param attachmentUrls the attachment urls
   * @return the ticket
   */
  public Ticket ticket(final UpstreamTicket ticket, final List<String> attachmentUrls) {
    LOGGER.trace("ticket({})", ticket.number());
    final long createdAt = epochSeconds(ticket.createdAt());
    return ImmutableTicket.builder()
        .ticketNumber(ticket.number())
        .customerId(Long.toString(ticket.customerId()))
        .subject(ticket.subject())
        .device(device(ticket.subject()))
        .status(status(ticket.status()))
        .password(password(ticket))
        .itemsLeft(itemsLeft(ticket))
        .attachments(attachmentUrls)
        .comments(ticket.comments().stream().map(comment -> comment(comment, createdAt)).toList())
        .createdAt(createdAt)
        .lastUpdated(epochSeconds(ticket.updatedAt()))
        .build();
  }

  private Comment comment(final UpstreamComment comment, final long fallback) {
    long createdAt = fallback;
    if (comment.createdAt().isPresent()) {
      try {
        createdAt = OffsetDateTime.parse(comment.createdAt().get()).toEpochSecond();
      } catch (DateTimeParseException e) {
        LOGGER.warn("comment(): unreadable timestamp {}, using the ticket's", comment.createdAt().get());
      }
    }
    return ImmutableComment.builder()
        .commentBody(comment.body().orElse(""))
        .techName(comment.tech().orElse(""))
        .createdAt(createdAt)
        .build();
  }

}
