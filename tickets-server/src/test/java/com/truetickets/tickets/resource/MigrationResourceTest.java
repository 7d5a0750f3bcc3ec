package com.truetickets.tickets.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.truetickets.api.v1.model.MigrationResult;
import com.truetickets.server.exception.BadInputException;
import com.truetickets.server.exception.ForbiddenException;
import com.truetickets.tickets.manager.RoleManager;
import com.truetickets.tickets.migration.MigrationManager;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MigrationResourceTest {

  @Mock private MigrationManager migrationManager;
  @Mock private MigrationResult migrationResult;

  private MigrationResource migrationResource;

  @BeforeEach
  void setUp() {
    migrationResource = new MigrationResource(migrationManager, new RoleManager());
  }

  @Test
  void migrate() {
    when(migrationManager.migrate(1200L, 5)).thenReturn(migrationResult);

    assertThat(migrationResource.migrate(RoleManager.OWNER, "1200", "5")).isEqualTo(migrationResult);
  }

  @Test
  void migrate_managerIsNotEnough() {
    assertThatExceptionOfType(ForbiddenException.class)
        .isThrownBy(() -> migrationResource.migrate(RoleManager.MANAGER, "1200", "5"))
        .withMessageContaining("Owner");
    verifyNoInteractions(migrationManager);
  }

  @Test
  void migrate_missingCount() {
    assertThatExceptionOfType(BadInputException.class)
        .isThrownBy(() -> migrationResource.migrate(RoleManager.ADMIN, "1200", null));
    verifyNoInteractions(migrationManager);
  }

}
