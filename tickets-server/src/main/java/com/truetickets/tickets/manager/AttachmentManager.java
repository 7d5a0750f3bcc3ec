package com.truetickets.tickets.manager;

import com.truetickets.api.v1.model.UploadAttachmentRequest;
import com.truetickets.server.exception.BadInputException;
import com.truetickets.server.exception.NotFoundException;
import com.truetickets.tickets.blob.BlobStore;
import com.truetickets.tickets.converter.AttributeValues;
import com.truetickets.tickets.dao.Attributes;
import com.truetickets.tickets.dao.DynamoDbStore;
import com.truetickets.tickets.dao.ExpressionBuilder;
import com.truetickets.tickets.dao.ItemBuilder;
import com.truetickets.tickets.dao.StoreConflictException;
import com.truetickets.tickets.dao.TableNames;
import java.time.Clock;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import javax.inject.Inject;
import java.util.regex.Pattern;
import javax.inject.Singleton;
import org.apache.commons.codec.CodecPolicy;
import org.apache.commons.codec.binary.Base64;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;
import software.amazon.awssdk.services.dynamodb.model.UpdateItemRequest;

/**
 * Uploads files to the blob store and links them to their ticket.
 */
@Singleton
public class AttachmentManager {

  /**
   * Content type when the upload does not say.
   */
  public static final String DEFAULT_CONTENT_TYPE = "application/octet-stream";

  private static final Logger LOGGER = LoggerFactory.getLogger(AttachmentManager.class);
  private static final int ID_LENGTH = 4;
  // Padding only at the end.
  private static final Pattern BASE64 = Pattern.compile("[A-Za-z0-9+/_-]+={0,2}");

  private final DynamoDbStore dynamoDbStore;
  private final BlobStore blobStore;
  private final IdentifierManager identifierManager;
  private final Clock clock;

  /**
   * Instantiates a new Attachment manager.
   *
   * @param dynamoDbStore     the dynamo db store
   * @param blobStore         the blob store
   * @param identifierManager the identifier manager
   * @param clock             the clock
   */
  @Inject
  public AttachmentManager(final DynamoDbStore dynamoDbStore,
                           final BlobStore blobStore,
                           final IdentifierManager identifierManager,
                           final Clock clock) {
    LOGGER.info("AttachmentManager({},{})", dynamoDbStore, blobStore);
    this.dynamoDbStore = dynamoDbStore;
    this.blobStore = blobStore;
    this.identifierManager = identifierManager;
    this.clock = clock;
  }

  /**
   * Content type of a data url, like {@code image/png} for {@code data:image/png;base64,...}.
   *
   * @param imageData the image data
   * @return the content type, the default for raw base64
   */
  public static String contentType(final String imageData) {
    if (!imageData.startsWith("data:")) {
      return DEFAULT_CONTENT_TYPE;
    }
    final int end = imageData.indexOf(';');
    final int comma = imageData.indexOf(',');
    final int stop = end < 0 || (comma >= 0 && comma < end) ? comma : end;
    if (stop <= "data:".length()) {
      return DEFAULT_CONTENT_TYPE;
    }
    return imageData.substring("data:".length(), stop);
  }

  /**
   * The bytes of a data url or raw base64 string. Truncated input and misplaced padding are
   * rejected rather than decoded partially.
   *
   * @param imageData the image data
   * @return the bytes
   */
  public static byte[] decode(final String imageData) {
    final String payload = imageData.substring(imageData.lastIndexOf(',') + 1).replaceAll("\\s", "");
    if (!BASE64.matcher(payload).matches()) {
      throw invalidBase64();
    }
    try {
      return new Base64(0, null, false, CodecPolicy.STRICT).decode(payload);
    } catch (IllegalArgumentException e) {
      LOGGER.debug("decode:rejected:{}", e.getMessage());
      throw invalidBase64();
    }
  }

  private static BadInputException invalidBase64() {
    return new BadInputException("Invalid base64 data", "Could not decode the image data.",
        "Send a data url or plain base64.");
  }

  /**
   * Key the file is stored under.
   *
   * @param ticketNumber the ticket number
   * @param timestamp    the timestamp
   * @param shortId      the short id
   * @param fileName     the file name
   * @return the string
   */
  public static String key(final long ticketNumber,
                           final long timestamp,
                           final String shortId,
                           final Optional<String> fileName) {
    final String suffix = fileName
        .map(String::trim)
        .filter(name -> !name.isEmpty())
        .map(name -> "_" + name.replaceAll("[^A-Za-z0-9._-]", "_"))
        .orElse("");
    return String.format("attachments/%d/%d_%s%s", ticketNumber, timestamp, shortId, suffix);
  }

  /**
   * Upload the file and append its url to the ticket.
   *
   * @param request the request
   * @return the url
   */
  public String upload(final UploadAttachmentRequest request) {
    LOGGER.trace("upload({},{})", request.ticketId(), request.fileName());
    final byte[] bytes = decode(request.imageData());
    final long ticketNumber = request.ticketId();
    if (dynamoDbStore.get(TableNames.TICKETS, ticketKey(ticketNumber), false, Attributes.TICKET_NUMBER).isEmpty()) {
      throw notFound(ticketNumber);
    }
    final long now = clock.instant().getEpochSecond();
    final String url = blobStore.put(
        key(ticketNumber, now, identifierManager.shortId(ID_LENGTH), request.fileName()),
        bytes,
        contentType(request.imageData()));
    link(ticketNumber, url, now);
    LOGGER.debug("upload({}) -> {}", ticketNumber, url);
    return url;
  }

  /**
   * Appends the url to the ticket's attachments.
   *
   * @param ticketNumber the ticket number
   * @param url          the url
   * @param now          the now
   */
  public void link(final long ticketNumber, final String url, final long now) {
    final ExpressionBuilder update = new ExpressionBuilder()
        .append(Attributes.ATTACHMENTS, List.of(AttributeValues.s(url)))
        .set(Attributes.LAST_UPDATED, AttributeValues.n(now));
    final UpdateItemRequest request = UpdateItemRequest.builder()
        .tableName(TableNames.TICKETS)
        .key(ticketKey(ticketNumber))
        .updateExpression(update.updateExpression())
        .conditionExpression("attribute_exists(" + update.name(Attributes.TICKET_NUMBER) + ")")
        .expressionAttributeNames(update.names())
        .expressionAttributeValues(update.values())
        .build();
    try {
      dynamoDbStore.update(request);
    } catch (StoreConflictException e) {
      throw notFound(ticketNumber);
    }
  }

  private Map<String, AttributeValue> ticketKey(final long ticketNumber) {
    return ItemBuilder.key(Attributes.TICKET_NUMBER, ticketNumber);
  }

  private NotFoundException notFound(final long ticketNumber) {
    return new NotFoundException("Ticket Not Found", "No ticket with number " + ticketNumber + ".");
  }

}
