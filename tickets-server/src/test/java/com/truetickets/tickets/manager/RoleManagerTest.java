package com.truetickets.tickets.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;

import com.truetickets.server.exception.ForbiddenException;
import org.junit.jupiter.api.Test;

class RoleManagerTest {

  private final RoleManager roleManager = new RoleManager();

  @Test
  void requireUser() {
    assertThat(roleManager.requireUser(" Alice ")).isEqualTo("Alice");
  }

  @Test
  void requireUser_blank() {
    assertThatExceptionOfType(ForbiddenException.class).isThrownBy(() -> roleManager.requireUser(" "));
    assertThatExceptionOfType(ForbiddenException.class).isThrownBy(() -> roleManager.requireUser(null));
  }

  @Test
  void requireManager() {
    assertThatCode(() -> roleManager.requireManager(RoleManager.EMPLOYEE + ", " + RoleManager.MANAGER))
        .doesNotThrowAnyException();
    assertThatCode(() -> roleManager.requireManager(RoleManager.ADMIN)).doesNotThrowAnyException();
  }

  @Test
  void requireManager_employee() {
    assertThatExceptionOfType(ForbiddenException.class)
        .isThrownBy(() -> roleManager.requireManager(RoleManager.EMPLOYEE));
  }

  @Test
  void requireOwner_manager() {
    assertThatExceptionOfType(ForbiddenException.class)
        .isThrownBy(() -> roleManager.requireOwner(RoleManager.MANAGER));
    assertThatCode(() -> roleManager.requireOwner(RoleManager.OWNER)).doesNotThrowAnyException();
  }

  @Test
  void groups() {
    assertThat(roleManager.groups("a, b,,c ")).containsExactly("a", "b", "c");
    assertThat(roleManager.groups(null)).isEmpty();
  }

}
