package com.truetickets.api.v1.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonSerialize;
import org.immutables.value.Value;

/**
 * A phone number of a customer. The number is free-form and matched exactly by the phone index.
 */
@Value.Immutable
@JsonSerialize(as = ImmutablePhoneNumber.class)
@JsonDeserialize(as = ImmutablePhoneNumber.class)
@JsonIgnoreProperties(ignoreUnknown = true)
public interface PhoneNumber {

  /**
   * Number string.
   *
   * @return the string
   */
  @JsonProperty("number")
  String number();

  /**
   * If the customer prefers text messages on this number.
   *
   * @return the boolean
   */
  @JsonProperty("prefers_texting")
  @Value.Default
  default boolean prefersTexting() {
    return false;
  }

  /**
   * If the person on this number does not speak english.
   *
   * @return the boolean
   */
  @JsonProperty("no_english")
  @Value.Default
  default boolean noEnglish() {
    return false;
  }

}
