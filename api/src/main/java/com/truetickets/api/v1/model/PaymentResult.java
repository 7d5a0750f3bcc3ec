package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * Outcome of taking a payment.
 */
@Value.Immutable
@JsonSerialize(as = ImmutablePaymentResult.class)
@JsonDeserialize(as = ImmutablePaymentResult.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface PaymentResult {

  /**
   * Message sent back on success.
   */
  String PAYMENT_TAKEN = "Payment taken and ticket resolved";

  /**
   * Of payment result.
   *
   * @param ticketNumber   the ticket number
   * @param totalPaidCents the amount charged, tax included
   * @return the payment result
   */
  static PaymentResult of(final long ticketNumber, final long totalPaidCents) {
    return ImmutablePaymentResult.builder()
        .ticketNumber(ticketNumber)
        .totalPaidCents(totalPaidCents)
        .build();
  }

  @JsonProperty("success")
  @Value.Default
  default boolean success() {
    return true;
  }

  @JsonProperty("message")
  @Value.Default
  default String message() {
    return PAYMENT_TAKEN;
  }

  @JsonProperty("ticket_number")
  long ticketNumber();

  /**
   * The amount charged in cents, tax included.
   *
   * @return the total
   */
  @JsonProperty("total_paid_cents")
  long totalPaidCents();

}
