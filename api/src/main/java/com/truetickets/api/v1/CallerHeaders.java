package com.truetickets.api.v1;

/**
 * Headers the API gateway sets from the authenticated caller's token.
 */
public final class CallerHeaders {

  /**
   * The user name of the caller.
   */
  public static final String USER_NAME = "X-User-Name";

  /**
   * Comma separated group names of the caller.
   */
  public static final String USER_GROUPS = "X-User-Groups";

  private CallerHeaders() {
  }

}
