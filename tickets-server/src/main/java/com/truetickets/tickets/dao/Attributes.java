package com.truetickets.tickets.dao;

/**
 * Attribute names of the stored items. Clients of the tables depend on these exact names.
 */
public final class Attributes {

  // Customers
  public static final String CUSTOMER_ID = "customer_id";
  public static final String FULL_NAME = "full_name";
  public static final String EMAIL = "email";
  public static final String PHONE_NUMBERS = "phone_numbers";
  public static final String NUMBER = "number";
  public static final String PREFERS_TEXTING = "prefers_texting";
  public static final String NO_ENGLISH = "no_english";
  public static final String CREATED_AT = "created_at";
  public static final String LAST_UPDATED = "last_updated";

  // Index tables
  public static final String FULL_NAME_LC = "full_name_lc";
  public static final String PHONE_NUMBER = "phone_number";
  public static final String SUBJECT_LC = "subject_lc";
  public static final String GSI_PK = "gsi_pk";

  // Tickets
  public static final String TICKET_NUMBER = "ticket_number";
  public static final String SUBJECT = "subject";
  public static final String DEVICE = "device";
  public static final String STATUS = "status";
  public static final String STATUS_DEVICE = "status_device";
  public static final String PASSWORD = "password";
  public static final String ITEMS_LEFT = "items_left";
  public static final String ATTACHMENTS = "attachments";
  public static final String COMMENTS = "comments";
  public static final String COMMENT_BODY = "comment_body";
  public static final String TECH_NAME = "tech_name";
  public static final String LINE_ITEMS = "line_items";
  public static final String PRICE_CENTS = "price_cents";
  public static final String PAID_AT = "paid_at";
  public static final String TOTAL_PAID_CENTS = "total_paid_cents";

  // TimeEntries, Config, Purchases, Counters
  public static final String PK = "pk";
  public static final String TIMESTAMP = "timestamp";
  public static final String USER_NAME = "user_name";
  public static final String IS_CLOCK_OUT = "is_clock_out";
  public static final String CLOCKED_IN = "clocked_in";
  public static final String WAGE_CENTS = "wage_cents";
  public static final String MONTH_YEAR = "month_year";
  public static final String ITEMS = "items";
  public static final String NAME = "name";
  public static final String AMOUNT_CENTS = "amount_cents";
  public static final String COUNTER_NAME = "counter_name";
  public static final String COUNTER_VALUE = "counter_value";
  public static final String STORE_NAME = "store_name";
  public static final String TAX_RATE = "tax_rate";
  public static final String ADDRESS = "address";
  public static final String CITY = "city";
  public static final String STATE = "state";
  public static final String ZIP = "zip";
  public static final String PHONE = "phone";
  public static final String DISCLAIMER = "disclaimer";

  /**
   * The constant partition value used by the ordered indexes and the time entries.
   */
  public static final String ALL = "ALL";

  private Attributes() {
  }
}
