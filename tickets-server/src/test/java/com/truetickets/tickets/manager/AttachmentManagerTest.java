package com.truetickets.tickets.manager;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatExceptionOfType;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

import com.truetickets.api.v1.model.ImmutableUploadAttachmentRequest;
import com.truetickets.server.exception.BadInputException;
import com.truetickets.server.exception.NotFoundException;
import com.truetickets.tickets.blob.BlobStore;
import com.truetickets.tickets.converter.AttributeValues;
import com.truetickets.tickets.dao.Attributes;
import com.truetickets.tickets.dao.DynamoDbStore;
import com.truetickets.tickets.dao.ItemBuilder;
import com.truetickets.tickets.dao.StoreConflictException;
import com.truetickets.tickets.dao.TableNames;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Captor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;

@ExtendWith(MockitoExtension.class)
class AttachmentManagerTest {

  private static final long TICKET = 12L;
  private static final Map<String, AttributeValue> KEY = ItemBuilder.key(Attributes.TICKET_NUMBER, TICKET);
  private static final String PNG = "data:image/png;base64,aGVsbG8=";

  @Mock private DynamoDbStore dynamoDbStore;
  @Mock private BlobStore blobStore;
  @Mock private IdentifierManager identifierManager;
  @Captor private ArgumentCaptor<byte[]> bytesCaptor;
  @Captor private ArgumentCaptor<UpdateItemRequest> updateCaptor;

  private AttachmentManager attachmentManager;

  @BeforeEach
  void setUp() {
    attachmentManager = new AttachmentManager(dynamoDbStore, blobStore, identifierManager,
        Clock.fixed(Instant.ofEpochSecond(100L), ZoneOffset.UTC));
  }

  @Test
  void contentType() {
    assertThat(AttachmentManager.contentType(PNG)).isEqualTo("image/png");
    assertThat(AttachmentManager.contentType("data:image/jpeg,aGVsbG8=")).isEqualTo("image/jpeg");
    assertThat(AttachmentManager.contentType("aGVsbG8=")).isEqualTo(AttachmentManager.DEFAULT_CONTENT_TYPE);
    assertThat(AttachmentManager.contentType("data:;base64,aGVsbG8=")).isEqualTo(AttachmentManager.DEFAULT_CONTENT_TYPE);
  }

  @Test
  void decode() {
    assertThat(new String(AttachmentManager.decode(PNG), StandardCharsets.UTF_8)).isEqualTo("hello");
    assertThat(new String(AttachmentManager.decode("aGVsbG8="), StandardCharsets.UTF_8)).isEqualTo("hello");
  }

  @Test
  void decode_invalid() {
    assertThatExceptionOfType(BadInputException.class)
        .isThrownBy(() -> AttachmentManager.decode("data:image/png;base64,not*base64"))
        .withMessageContaining("Invalid base64 data");
    assertThatExceptionOfType(BadInputException.class)
        .isThrownBy(() -> AttachmentManager.decode("data:image/png;base64,"));
  }

  @Test
  void decode_truncated() {
    assertThatExceptionOfType(BadInputException.class)
        .isThrownBy(() -> AttachmentManager.decode("A"))
        .withMessageContaining("Invalid base64 data");
    assertThatExceptionOfType(BadInputException.class)
        .isThrownBy(() -> AttachmentManager.decode("data:image/png;base64,aGVsbG9"));
  }

  @Test
  void decode_paddingInTheMiddle() {
    assertThatExceptionOfType(BadInputException.class)
        .isThrownBy(() -> AttachmentManager.decode("Zm=9v"))
        .withMessageContaining("Invalid base64 data");
    assertThatExceptionOfType(BadInputException.class)
        .isThrownBy(() -> AttachmentManager.decode("aGVs=bG8="));
  }

  @Test
  void decode_unpaddedAndWrapped() {
    assertThat(new String(AttachmentManager.decode("aGVsbG8"), StandardCharsets.UTF_8)).isEqualTo("hello");
    assertThat(new String(AttachmentManager.decode("aGVs\nbG8="), StandardCharsets.UTF_8)).isEqualTo("hello");
  }

  @Test
  void key() {
    assertThat(AttachmentManager.key(TICKET, 100L, "ab12", Optional.of("my photo?.jpg")))
        .isEqualTo("attachments/12/100_ab12_my_photo_.jpg");
    assertThat(AttachmentManager.key(TICKET, 100L, "ab12", Optional.of("  ")))
        .isEqualTo("attachments/12/100_ab12");
    assertThat(AttachmentManager.key(TICKET, 100L, "ab12", Optional.empty()))
        .isEqualTo("attachments/12/100_ab12");
  }

  @Test
  void upload() {
    when(dynamoDbStore.get(TableNames.TICKETS, KEY, false, Attributes.TICKET_NUMBER))
        .thenReturn(Optional.of(KEY));
    when(identifierManager.shortId(4)).thenReturn("ab12");
    when(blobStore.put(eq("attachments/12/100_ab12_screen.png"), bytesCaptor.capture(), eq("image/png")))
        .thenReturn("https://bucket/attachments/12/100_ab12_screen.png");
    when(dynamoDbStore.update(updateCaptor.capture())).thenReturn(Map.of());

    final String url = attachmentManager.upload(ImmutableUploadAttachmentRequest.builder()
        .ticketId(TICKET)
        .imageData(PNG)
        .fileName("screen.png")
        .build());

    assertThat(url).isEqualTo("https://bucket/attachments/12/100_ab12_screen.png");
    assertThat(new String(bytesCaptor.getValue(), StandardCharsets.UTF_8)).isEqualTo("hello");
    final UpdateItemRequest request = updateCaptor.getValue();
    assertThat(request.conditionExpression()).isEqualTo("attribute_exists(#ticket_number)");
    assertThat(request.expressionAttributeValues())
        .containsValue(AttributeValue.fromL(List.of(AttributeValues.s(url))));
  }

  @Test
  void upload_missingTicket() {
    when(dynamoDbStore.get(TableNames.TICKETS, KEY, false, Attributes.TICKET_NUMBER))
        .thenReturn(Optional.empty());

    assertThatExceptionOfType(NotFoundException.class)
        .isThrownBy(() -> attachmentManager.upload(ImmutableUploadAttachmentRequest.builder()
            .ticketId(TICKET)
            .imageData(PNG)
            .build()));
    verifyNoInteractions(blobStore);
  }

  @Test
  void link_ticketGone() {
    when(dynamoDbStore.update(any(UpdateItemRequest.class)))
        .thenThrow(new StoreConflictException(List.of(), null));

    assertThatExceptionOfType(NotFoundException.class)
        .isThrownBy(() -> attachmentManager.link(TICKET, "https://bucket/x", 100L));
  }

  @Test
  void upload_badDataNeverReachesStore() {
    assertThatExceptionOfType(BadInputException.class)
        .isThrownBy(() -> attachmentManager.upload(ImmutableUploadAttachmentRequest.builder()
            .ticketId(TICKET)
            .imageData("%%%")
            .build()));
    verifyNoInteractions(dynamoDbStore, blobStore);
  }

}
