package com.truetickets.tickets.manager;

import static com.truetickets.tickets.converter.AttributeValues.bool;
import static com.truetickets.tickets.converter.AttributeValues.n;
import static com.truetickets.tickets.converter.AttributeValues.s;

import com.truetickets.api.v1.model.ClockLogs;
import com.truetickets.api.v1.model.ClockResponse;
import com.truetickets.api.v1.model.ClockStatus;
import com.truetickets.api.v1.model.ImmutableClockLogs;
import com.truetickets.api.v1.model.ImmutableClockResponse;
import com.truetickets.api.v1.model.ImmutableClockStatus;
import com.truetickets.api.v1.model.ImmutableTimeEntry;
import com.truetickets.api.v1.model.TimeEntry;
import com.truetickets.api.v1.model.TimeSegment;
import com.truetickets.api.v1.model.UpdateClockLogsRequest;
import com.truetickets.server.exception.BadInputException;
import com.truetickets.tickets.converter.AttributeValues;
import com.truetickets.tickets.converter.StoreConfigConverter;
import com.truetickets.tickets.converter.TimeEntryConverter;
import com.truetickets.tickets.dao.Attributes;
import com.truetickets.tickets.dao.DynamoDbStore;
import com.truetickets.tickets.dao.ExpressionBuilder;
import com.truetickets.tickets.dao.TableNames;
import com.truetickets.tickets.dao.TransactItems;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;
import software.amazon.awssdk.services.dynamodb.model.TransactWriteItem;

/**
 * The timeclock. Each clock in or out writes a time entry and flips the user's clock state in one transaction, and
 * the flip is conditioned on the state it leaves, so a double clock in fails instead of writing two entries.
 */
@Singleton
public class ClockManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(ClockManager.class);

  private final DynamoDbStore dynamoDbStore;
  private final TimeEntryConverter timeEntryConverter;
  private final StoreConfigConverter storeConfigConverter;
  private final WageManager wageManager;
  private final Clock clock;

  /**
   * Instantiates a new Clock manager.
   *
   * @param dynamoDbStore        the dynamo db store
   * @param timeEntryConverter   the time entry converter
   * @param storeConfigConverter the store config converter
   * @param wageManager          the wage manager
   * @param clock                the clock
   */
  @Inject
  public ClockManager(final DynamoDbStore dynamoDbStore,
                      final TimeEntryConverter timeEntryConverter,
                      final StoreConfigConverter storeConfigConverter,
                      final WageManager wageManager,
                      final Clock clock) {
    LOGGER.info("ClockManager({},{})", dynamoDbStore, wageManager);
    this.dynamoDbStore = dynamoDbStore;
    this.timeEntryConverter = timeEntryConverter;
    this.storeConfigConverter = storeConfigConverter;
    this.wageManager = wageManager;
    this.clock = clock;
  }

  /**
   * Clock the user in or out.
   *
   * @param userName   the user name
   * @param clockingIn true to clock in, false to clock out
   * @return the clock response
   */
  public ClockResponse clock(final String userName, final boolean clockingIn) {
    LOGGER.trace("clock({},{})", userName, clockingIn);
    final long now = clock.instant().getEpochSecond();
    final TimeEntry entry = ImmutableTimeEntry.builder()
        .userName(userName)
        .timestamp(now)
        .isClockOut(!clockingIn)
        .build();
    final ExpressionBuilder entryCondition = new ExpressionBuilder();
    final ExpressionBuilder stateCondition = new ExpressionBuilder();
    final String clockedIn = stateCondition.name(Attributes.CLOCKED_IN);
    final String condition = clockingIn
        ? String.format("%s = %s OR attribute_not_exists(%s)", clockedIn, stateCondition.value(bool(false)), clockedIn)
        : String.format("%s = %s", clockedIn, stateCondition.value(bool(true)));
    dynamoDbStore.transactWrite(List.of(
        TransactItems.put(TableNames.TIME_ENTRIES, timeEntryConverter.toItem(entry), entryCondition,
            "attribute_not_exists(" + entryCondition.name(Attributes.TIMESTAMP) + ")"),
        TransactItems.put(TableNames.CONFIG, storeConfigConverter.clockStateItem(userName, clockingIn, now),
            stateCondition, condition)));
    LOGGER.info("clock({}): {} at {}", userName, clockingIn ? "in" : "out", now);
    return ImmutableClockResponse.builder()
        .message(String.format("Successfully %s for %s", clockingIn ? "Clocked In" : "Clocked Out", userName))
        .clockedIn(clockingIn)
        .timestamp(now)
        .build();
  }

  /**
   * If the user is clocked in, read consistently. Users that never clocked in are clocked out.
   *
   * @param userName the user name
   * @return the clock status
   */
  public ClockStatus status(final String userName) {
    LOGGER.trace("status({})", userName);
    final boolean clockedIn = dynamoDbStore.get(TableNames.CONFIG, storeConfigConverter.clockStateKey(userName), true,
            Attributes.CLOCKED_IN)
        .map(item -> AttributeValues.flag(item, Attributes.CLOCKED_IN))
        .orElse(false);
    return ImmutableClockStatus.builder().clockedIn(clockedIn).build();
  }

  /**
   * Every entry between the times, inclusive, and the wages of the users that have entries.
   *
   * @param start the start
   * @param end   the end
   * @return the clock logs
   */
  public ClockLogs logs(final long start, final long end) {
    LOGGER.trace("logs({},{})", start, end);
    if (start > end) {
      throw new BadInputException("Invalid Range", "start must not be after end.");
    }
    final List<TimeEntry> entries = entries(start, end);
    final Set<String> users = new LinkedHashSet<>();
    entries.forEach(entry -> users.add(entry.userName()));
    return ImmutableClockLogs.builder()
        .clockLogs(entries)
        .wages(wageManager.wages(users))
        .build();
  }

  /**
   * Replace the user's entries of a day with the segments. Each segment becomes a clock in at its start and a clock
   * out at its end. Entries of other users are left alone, and a segment may not reuse their timestamps.
   *
   * @param request the request
   * @return the clock logs of the day after the change
   */
  public ClockLogs updateLogs(final UpdateClockLogsRequest request) {
    LOGGER.trace("updateLogs({},{},{})", request.userName(), request.startOfDay(), request.endOfDay());
    validate(request);
    final String userName = request.userName();
    final List<TimeEntry> existing = entries(request.startOfDay(), request.endOfDay());

    final Set<Long> newTimestamps = new HashSet<>();
    for (TimeSegment segment : request.segments()) {
      newTimestamps.add(segment.start());
      newTimestamps.add(segment.end());
    }
    final List<TransactWriteItem> items = new ArrayList<>();
    for (TimeEntry entry : existing) {
      if (!entry.userName().equals(userName)) {
        if (newTimestamps.contains(entry.timestamp())) {
          throw new BadInputException("Invalid Segments",
              "Timestamp " + entry.timestamp() + " is already used by another user's entry.");
        }
      } else if (!newTimestamps.contains(entry.timestamp())) {
        items.add(TransactItems.delete(TableNames.TIME_ENTRIES, timeEntryConverter.key(entry.timestamp())));
      }
    }
    for (TimeSegment segment : request.segments()) {
      items.add(ownedPut(userName, segment.start(), false));
      items.add(ownedPut(userName, segment.end(), true));
    }
    if (items.size() > DynamoDbStore.MAX_TRANSACTION_ITEMS) {
      throw new BadInputException("Too Many Changes",
          String.format("This change needs %d writes, at most %d can be made at once.",
              items.size(), DynamoDbStore.MAX_TRANSACTION_ITEMS));
    }
    dynamoDbStore.transactWrite(items);
    return logs(request.startOfDay(), request.endOfDay());
  }

  private TransactWriteItem ownedPut(final String userName, final long timestamp, final boolean isClockOut) {
    final TimeEntry entry = ImmutableTimeEntry.builder()
        .userName(userName)
        .timestamp(timestamp)
        .isClockOut(isClockOut)
        .build();
    final ExpressionBuilder condition = new ExpressionBuilder();
    return TransactItems.put(TableNames.TIME_ENTRIES, timeEntryConverter.toItem(entry), condition,
        String.format("attribute_not_exists(%s) OR %s = %s",
            condition.name(Attributes.TIMESTAMP), condition.name(Attributes.USER_NAME),
            condition.value(s(userName))));
  }

  private void validate(final UpdateClockLogsRequest request) {
    if (request.userName().isBlank()) {
      throw new BadInputException("Missing Field", "user_name is required.");
    }
    if (request.startOfDay() >= request.endOfDay()) {
      throw new BadInputException("Invalid Range", "start_of_day must be before end_of_day.");
    }
    final Set<Long> seen = new HashSet<>();
    for (TimeSegment segment : request.segments()) {
      if (segment.start() >= segment.end()) {
        throw new BadInputException("Invalid Segments", "Each segment must start before it ends.");
      }
      if (segment.start() < request.startOfDay() || segment.end() > request.endOfDay()) {
        throw new BadInputException("Invalid Segments", "Segments must be within the day.");
      }
      if (!seen.add(segment.start()) || !seen.add(segment.end())) {
        throw new BadInputException("Invalid Segments", "Two entries can not share a timestamp.");
      }
    }
  }

  private List<TimeEntry> entries(final long start, final long end) {
    final ExpressionBuilder expressions = new ExpressionBuilder();
    final QueryRequest request = QueryRequest.builder()
        .tableName(TableNames.TIME_ENTRIES)
        .keyConditionExpression(String.format("%s = %s AND %s BETWEEN %s AND %s",
            expressions.name(Attributes.PK), expressions.value(s(Attributes.ALL)),
            expressions.name(Attributes.TIMESTAMP), expressions.value(n(start)), expressions.value(n(end))))
        .expressionAttributeNames(expressions.names())
        .expressionAttributeValues(expressions.values())
        .build();
    return dynamoDbStore.query(request, Integer.MAX_VALUE).stream()
        .map(timeEntryConverter::fromItem)
        .toList();
  }

}
