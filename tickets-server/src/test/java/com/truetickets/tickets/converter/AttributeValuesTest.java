package com.truetickets.tickets.converter;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.truetickets.server.exception.InternalException;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

class AttributeValuesTest {

  @Test
  void string_present() {
    assertThat(AttributeValues.string(Map.of("a", AttributeValues.s("x")), "a")).isEqualTo("x");
  }

  @Test
  void string_missing() {
    assertThatExceptionOfType(InternalException.class)
        .isThrownBy(() -> AttributeValues.string(Map.of(), "a"))
        .withMessageContaining("Missing attribute a");
  }

  @Test
  void string_wrongType() {
    assertThatExceptionOfType(InternalException.class)
        .isThrownBy(() -> AttributeValues.string(Map.of("a", AttributeValues.n(1L)), "a"));
  }

  @Test
  void optionalString_null() {
    assertThat(AttributeValues.optionalString(Map.of("a", AttributeValue.fromNul(true)), "a")).isEmpty();
  }

  @Test
  void number_andDecimal() {
    final Map<String, AttributeValue> item = Map.of("n", AttributeValues.n(42L), "d", AttributeValues.n(8.25));

    assertThat(AttributeValues.number(item, "n")).isEqualTo(42L);
    assertThat(AttributeValues.optionalDecimal(item, "d")).contains(8.25);
    assertThat(AttributeValues.optionalNumber(item, "missing")).isEmpty();
  }

  @Test
  void number_notANumber() {
    assertThatExceptionOfType(InternalException.class)
        .isThrownBy(() -> AttributeValues.number(Map.of("n", AttributeValue.fromN("abc")), "n"));
  }

  @Test
  void flag_defaultsFalse() {
    assertThat(AttributeValues.flag(Map.of(), "b")).isFalse();
    assertThat(AttributeValues.flag(Map.of("b", AttributeValues.bool(true)), "b")).isTrue();
  }

  @Test
  void list_elements() {
    final Map<String, AttributeValue> item = Map.of("l",
        AttributeValue.fromL(List.of(AttributeValues.s("a"), AttributeValues.s("b"))));

    assertThat(AttributeValues.list(item, "l", AttributeValues::stringElement)).containsExactly("a", "b");
    assertThat(AttributeValues.list(item, "missing", AttributeValues::stringElement)).isEmpty();
  }

  @Test
  void list_wrongType() {
    assertThatExceptionOfType(InternalException.class)
        .isThrownBy(() -> AttributeValues.list(Map.of("l", AttributeValues.s("a")), "l",
            AttributeValues::stringElement));
  }

}
