package com.truetickets.tickets.dao;

/**
 * Names of the tables and indexes. The item attribute names in {@link Attributes} match these tables.
 */
public final class TableNames {

  public static final String CUSTOMERS = "Customers";
  public static final String CUSTOMER_NAMES = "CustomerNames";
  public static final String CUSTOMER_PHONE_INDEX = "CustomerPhoneIndex";
  public static final String TICKETS = "Tickets";
  public static final String TICKET_SUBJECTS = "TicketSubjects";
  public static final String TIME_ENTRIES = "TimeEntries";
  public static final String PURCHASES = "Purchases";
  public static final String CONFIG = "Config";
  public static final String COUNTERS = "Counters";

  /**
   * On Tickets: customer_id, ticket_number.
   */
  public static final String CUSTOMER_ID_INDEX = "CustomerIdIndex";
  /**
   * On Tickets and TicketSubjects: gsi_pk, ticket_number.
   */
  public static final String TICKET_NUMBER_INDEX = "TicketNumberIndex";
  /**
   * On Tickets, sparse: gsi_pk, paid_at.
   */
  public static final String REVENUE_INDEX = "RevenueIndex";
  /**
   * On Tickets: status_device, ticket_number.
   */
  public static final String STATUS_DEVICE_INDEX = "StatusDeviceIndex";

  private TableNames() {
  }
}
