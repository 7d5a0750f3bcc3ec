package com.truetickets.tickets.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.reset;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.truetickets.api.v1.CallerHeaders;
import com.truetickets.api.v1.model.ErrorResponse;
import com.truetickets.api.v1.model.PaymentResult;
import com.truetickets.server.exception.BadInputException;
import com.truetickets.server.resource.ServiceExceptionMapper;
import com.truetickets.tickets.manager.PaymentManager;
import com.truetickets.tickets.manager.RoleManager;
import io.dropwizard.testing.junit5.DropwizardExtensionsSupport;
import io.dropwizard.testing.junit5.ResourceExtension;
import jakarta.ws.rs.client.Entity;
import jakarta.ws.rs.core.Response;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;

@ExtendWith(DropwizardExtensionsSupport.class)
class PaymentsResourceHttpTest {

  private static final PaymentManager PAYMENT_MANAGER = mock(PaymentManager.class);
  private static final ResourceExtension EXT = ResourceExtension.builder()
      .setRegisterDefaultExceptionMappers(false)
      .addResource(new PaymentsResource(PAYMENT_MANAGER, new RoleManager()))
      .addProvider(new ServiceExceptionMapper())
      .build();

  @AfterEach
  void tearDown() {
    reset(PAYMENT_MANAGER);
  }

  @Test
  void takePayment() {
    when(PAYMENT_MANAGER.takePayment(41L, "Sam")).thenReturn(16200L);

    final Response response = EXT.target("/take_payment")
        .queryParam("ticket_number", 41)
        .request()
        .header(CallerHeaders.USER_NAME, "Sam")
        .post(Entity.json("{}"));

    assertThat(response.getStatus()).isEqualTo(200);
    final PaymentResult result = response.readEntity(PaymentResult.class);
    assertThat(result.ticketNumber()).isEqualTo(41L);
    assertThat(result.totalPaidCents()).isEqualTo(16200L);
    assertThat(result.success()).isTrue();
  }

  @Test
  void refundPayment_employeeIsForbidden() {
    final Response response = EXT.target("/refund_payment")
        .queryParam("ticket_number", 41)
        .request()
        .header(CallerHeaders.USER_NAME, "Sam")
        .header(CallerHeaders.USER_GROUPS, RoleManager.EMPLOYEE)
        .post(Entity.json("{}"));

    assertThat(response.getStatus()).isEqualTo(403);
    assertThat(response.readEntity(ErrorResponse.class).error()).isEqualTo("Forbidden");
    verifyNoInteractions(PAYMENT_MANAGER);
  }

  @Test
  void declineRepair_managerErrorKeepsItsEnvelope() {
    doThrow(new BadInputException("No Line Items", "There is nothing to decline.",
            "Add the quoted line items first."))
        .when(PAYMENT_MANAGER).declineRepair(41L, "Sam");

    final Response response = EXT.target("/dont_fix")
        .queryParam("ticket_number", 41)
        .request()
        .header(CallerHeaders.USER_NAME, "Sam")
        .post(Entity.json("{}"));

    assertThat(response.getStatus()).isEqualTo(400);
    final ErrorResponse error = response.readEntity(ErrorResponse.class);
    assertThat(error.error()).isEqualTo("No Line Items");
    assertThat(error.details()).isEqualTo("There is nothing to decline.");
    assertThat(error.suggestion()).contains("Add the quoted line items first.");
  }

  @Test
  void takePayment_badNumber() {
    final Response response = EXT.target("/take_payment")
        .queryParam("ticket_number", "forty")
        .request()
        .header(CallerHeaders.USER_NAME, "Sam")
        .post(Entity.json("{}"));

    assertThat(response.getStatus()).isEqualTo(400);
    assertThat(response.readEntity(ErrorResponse.class).error()).isEqualTo("Invalid Parameter");
  }

}
