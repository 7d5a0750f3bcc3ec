package com.truetickets.tickets.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.truetickets.server.exception.BadInputException;
import org.junit.jupiter.api.Test;

class ParametersTest {

  @Test
  void present_emptyCounts() {
    assertThat(Parameters.present("")).isTrue();
    assertThat(Parameters.present(null)).isFalse();
    assertThat(Parameters.countPresent("", null, "x")).isEqualTo(2);
  }

  @Test
  void required() {
    assertThat(Parameters.required("name", " value ")).isEqualTo("value");
    assertThatExceptionOfType(BadInputException.class)
        .isThrownBy(() -> Parameters.required("name", " "))
        .withMessageContaining("name is required");
  }

  @Test
  void requiredLong() {
    assertThat(Parameters.requiredLong("number", "42")).isEqualTo(42L);
    assertThatExceptionOfType(BadInputException.class)
        .isThrownBy(() -> Parameters.requiredLong("number", "4x2"))
        .withMessageContaining("must be a whole number");
  }

  @Test
  void requiredInt_outOfRange() {
    assertThat(Parameters.requiredInt("count", "-3")).isEqualTo(-3);
    assertThatExceptionOfType(BadInputException.class)
        .isThrownBy(() -> Parameters.requiredInt("count", "9999999999"))
        .withMessageContaining("out of range");
  }

  @Test
  void body_missing() {
    assertThat(Parameters.body("x")).isEqualTo("x");
    assertThatExceptionOfType(BadInputException.class)
        .isThrownBy(() -> Parameters.body(null))
        .withMessageContaining("Missing Body");
  }

}
