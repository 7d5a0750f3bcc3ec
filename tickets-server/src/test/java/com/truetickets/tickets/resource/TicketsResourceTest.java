package com.truetickets.tickets.resource;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.truetickets.api.v1.model.CommentRequest;
import com.truetickets.api.v1.model.Device;
import com.truetickets.api.v1.model.Ticket;
import com.truetickets.api.v1.model.TicketReference;
import com.truetickets.api.v1.model.TicketStatus;
import com.truetickets.api.v1.model.UpdateTicketRequest;
import com.truetickets.server.exception.BadInputException;
import com.truetickets.tickets.manager.TicketManager;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class TicketsResourceTest {

  @Mock private TicketManager ticketManager;
  @Mock private Ticket ticket;
  @Mock private UpdateTicketRequest updateTicketRequest;
  @Mock private CommentRequest commentRequest;

  @InjectMocks private TicketsResource ticketsResource;

  @Test
  void find_byNumber() {
    when(ticketManager.get(12L)).thenReturn(ticket);

    assertThat(ticketsResource.find("12", null, null, null, null, null, null).getEntity()).isEqualTo(ticket);
  }

  @Test
  void find_bySuffix() {
    when(ticketManager.bySuffix(7)).thenReturn(List.of(ticket));

    assertThat(ticketsResource.find(null, "007", null, null, null, null, null).getEntity())
        .isEqualTo(List.of(ticket));
  }

  @Test
  void find_badSuffix() {
    assertThatExceptionOfType(BadInputException.class)
        .isThrownBy(() -> ticketsResource.find(null, "1234", null, null, null, null, null));
    verifyNoInteractions(ticketManager);
  }

  @Test
  void find_recentWithFilters() {
    when(ticketManager.recent(Optional.of(Device.LAPTOP), List.of(TicketStatus.READY, TicketStatus.WAITING_OTHER)))
        .thenReturn(List.of(ticket));

    assertThat(ticketsResource.find(null, null, null, null, "", "Laptop", "Ready|Waiting (Other)|Ready")
        .getEntity()).isEqualTo(List.of(ticket));
  }

  @Test
  void find_recentWithoutFilters() {
    when(ticketManager.recent(Optional.empty(), List.of())).thenReturn(List.of());

    assertThat(ticketsResource.find(null, null, null, null, "", " ", null).getEntity()).isEqualTo(List.of());
  }

  @Test
  void find_unknownStatus() {
    assertThatExceptionOfType(BadInputException.class)
        .isThrownBy(() -> ticketsResource.find(null, null, null, null, "", null, "Lost"))
        .withMessageContaining("Unknown status");
  }

  @Test
  void find_exactlyOneSelector() {
    assertThatExceptionOfType(BadInputException.class)
        .isThrownBy(() -> ticketsResource.find("1", null, "screen", null, null, null, null));
    assertThatExceptionOfType(BadInputException.class)
        .isThrownBy(() -> ticketsResource.find(null, null, null, null, null, null, null));
    verifyNoInteractions(ticketManager);
  }

  @Test
  void find_filtersNeedRecent() {
    assertThatExceptionOfType(BadInputException.class)
        .isThrownBy(() -> ticketsResource.find(null, null, null, "abc", null, "Phone", null))
        .withMessageContaining("only allowed with get_recent");
  }

  @Test
  void update() {
    assertThat(ticketsResource.update("12", updateTicketRequest)).isEqualTo(TicketReference.of(12L));

    verify(ticketManager).update(12L, updateTicketRequest);
  }

  @Test
  void update_withoutBody() {
    assertThatExceptionOfType(BadInputException.class)
        .isThrownBy(() -> ticketsResource.update("12", null));
    verifyNoInteractions(ticketManager);
  }

  @Test
  void addComment() {
    assertThat(ticketsResource.addComment("12", commentRequest)).isEqualTo(TicketReference.of(12L));

    verify(ticketManager).addComment(12L, commentRequest);
  }

  @Test
  void lastUpdated() {
    when(ticketManager.lastUpdated(12L)).thenReturn(1700000000L);

    assertThat(ticketsResource.lastUpdated("12").lastUpdated()).isEqualTo(1700000000L);
  }

}
