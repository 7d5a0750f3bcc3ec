package com.truetickets.tickets.manager;

import com.truetickets.api.v1.model.ImmutableMonthPurchases;
import com.truetickets.api.v1.model.MonthPurchases;
import com.truetickets.api.v1.model.Ticket;
import com.truetickets.api.v1.model.UpdatePurchasesRequest;
import com.truetickets.server.exception.BadInputException;
import com.truetickets.tickets.converter.AttributeValues;
import com.truetickets.tickets.converter.PurchasesConverter;
import com.truetickets.tickets.converter.TicketConverter;
import com.truetickets.tickets.dao.Attributes;
import com.truetickets.tickets.dao.DynamoDbStore;
import com.truetickets.tickets.dao.ExpressionBuilder;
import com.truetickets.tickets.dao.ItemBuilder;
import com.truetickets.tickets.dao.TableNames;
import java.time.DateTimeException;
import java.time.YearMonth;
import java.time.ZoneId;
import java.util.List;
import javax.inject.Inject;
import javax.inject.Singleton;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import software.amazon.awssdk.services.dynamodb.model.PutItemRequest;
import software.amazon.awssdk.services.dynamodb.model.QueryRequest;

/**
 * Monthly revenue and the purchases ledger. Months start and end at midnight in the shop's zone.
 */
@Singleton
public class FinancialsManager {

  private static final Logger LOGGER = LoggerFactory.getLogger(FinancialsManager.class);

  private final DynamoDbStore dynamoDbStore;
  private final CustomerManager customerManager;
  private final TicketConverter ticketConverter;
  private final PurchasesConverter purchasesConverter;
  private final ZoneId zoneId;

  /**
   * Instantiates a new Financials manager.
   *
   * @param dynamoDbStore      the dynamo db store
   * @param customerManager    the customer manager
   * @param ticketConverter    the ticket converter
   * @param purchasesConverter the purchases converter
   * @param zoneId             the shop's zone
   */
  @Inject
  public FinancialsManager(final DynamoDbStore dynamoDbStore,
                           final CustomerManager customerManager,
                           final TicketConverter ticketConverter,
                           final PurchasesConverter purchasesConverter,
                           final ZoneId zoneId) {
    LOGGER.info("FinancialsManager({},{},{})", dynamoDbStore, customerManager, zoneId);
    this.dynamoDbStore = dynamoDbStore;
    this.customerManager = customerManager;
    this.ticketConverter = ticketConverter;
    this.purchasesConverter = purchasesConverter;
    this.zoneId = zoneId;
  }

  /**
   * Every ticket paid during the month, oldest payment first, with its customer.
   *
   * @param year  the year
   * @param month the month, 1 to 12
   * @return the list
   */
  public List<Ticket> monthlyRevenue(final int year, final int month) {
    LOGGER.trace("monthlyRevenue({},{})", year, month);
    final YearMonth yearMonth = yearMonth(year, month);
    final long start = yearMonth.atDay(1).atStartOfDay(zoneId).toEpochSecond();
    final long end = yearMonth.plusMonths(1).atDay(1).atStartOfDay(zoneId).toEpochSecond() - 1;
    final ExpressionBuilder expressions = new ExpressionBuilder();
    final QueryRequest request = QueryRequest.builder()
        .tableName(TableNames.TICKETS)
        .indexName(TableNames.REVENUE_INDEX)
        .keyConditionExpression(String.format("%s = %s AND %s BETWEEN %s AND %s",
            expressions.name(Attributes.GSI_PK), expressions.value(AttributeValues.s(Attributes.ALL)),
            expressions.name(Attributes.PAID_AT), expressions.value(AttributeValues.n(start)),
            expressions.value(AttributeValues.n(end))))
        .expressionAttributeNames(expressions.names())
        .expressionAttributeValues(expressions.values())
        .build();
    final List<Ticket> tickets = dynamoDbStore.query(request, Integer.MAX_VALUE).stream()
        .map(ticketConverter::fromItem)
        .toList();
    LOGGER.debug("monthlyRevenue({}) -> {} tickets", yearMonth, tickets.size());
    return customerManager.withCustomers(tickets);
  }

  /**
   * The purchases of the month, with no items when none were recorded.
   *
   * @param year  the year
   * @param month the month
   * @return the month purchases
   */
  public MonthPurchases purchases(final int year, final int month) {
    LOGGER.trace("purchases({},{})", year, month);
    final String monthYear = yearMonth(year, month).toString();
    return dynamoDbStore.get(TableNames.PURCHASES, ItemBuilder.key(Attributes.MONTH_YEAR, monthYear), false)
        .map(purchasesConverter::fromItem)
        .orElseGet(() -> ImmutableMonthPurchases.builder().monthYear(monthYear).build());
  }

  /**
   * Replace the purchases of the month.
   *
   * @param year    the year
   * @param month   the month
   * @param request the request
   * @return the month purchases
   */
  public MonthPurchases updatePurchases(final int year, final int month, final UpdatePurchasesRequest request) {
    LOGGER.trace("updatePurchases({},{})", year, month);
    final MonthPurchases purchases = ImmutableMonthPurchases.builder()
        .monthYear(yearMonth(year, month).toString())
        .items(request.items())
        .build();
    dynamoDbStore.put(PutItemRequest.builder()
        .tableName(TableNames.PURCHASES)
        .item(purchasesConverter.toItem(purchases))
        .build());
    return purchases;
  }

  private YearMonth yearMonth(final int year, final int month) {
    try {
      return YearMonth.of(year, month);
    } catch (DateTimeException e) {
      throw new BadInputException("Invalid Parameter", "year and month do not name a month.");
    }
  }

}
