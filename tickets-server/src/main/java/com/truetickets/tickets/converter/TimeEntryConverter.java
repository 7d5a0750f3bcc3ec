package com.truetickets.tickets.converter;

import com.truetickets.api.v1.model.ImmutableTimeEntry;
import com.truetickets.api.v1.model.TimeEntry;
import com.truetickets.tickets.dao.Attributes;
import com.truetickets.tickets.dao.ItemBuilder;
import java.util.Map;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.AttributeValue;

/**
 * Time entries all live in the one partition, ordered by timestamp.
 */
@Singleton
public class TimeEntryConverter {

  private static final Logger LOGGER = LoggerFactory.getLogger(TimeEntryConverter.class);

  /**
   * Instantiates a new Time entry converter.
   */
  @Inject
  public TimeEntryConverter() {
    LOGGER.info("TimeEntryConverter()");
  }

  /**
   * Key of the entry at the timestamp.
   *
   * @param timestamp the timestamp
   * @return the map
   */
  public Map<String, AttributeValue> key(final long timestamp) {
    return Map.of(
        Attributes.PK, AttributeValues.s(Attributes.ALL),
        Attributes.TIMESTAMP, AttributeValues.n(timestamp));
  }

  public Map<String, AttributeValue> toItem(final TimeEntry entry) {
    return ItemBuilder.item()
        .with(Attributes.PK, Attributes.ALL)
        .with(Attributes.TIMESTAMP, entry.timestamp())
        .with(Attributes.USER_NAME, entry.userName())
        .with(Attributes.IS_CLOCK_OUT, entry.isClockOut())
        .build();
  }

  public TimeEntry fromItem(final Map<String, AttributeValue> item) {
    return ImmutableTimeEntry.builder()
        .userName(AttributeValues.string(item, Attributes.USER_NAME))
        .timestamp(AttributeValues.number(item, Attributes.TIMESTAMP))
        .isClockOut(AttributeValues.flag(item, Attributes.IS_CLOCK_OUT))
        .build();
  }

}
