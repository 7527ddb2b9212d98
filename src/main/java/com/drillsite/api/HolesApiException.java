package com.drillsite.api;

/**
 * Ошибка обращения к Holes API: таймаут, отказ соединения, HTTP-статус не 2xx,
 * некорректный JSON или ответ с {@code "success": false}.
 */
public class HolesApiException extends Exception {

  private final int statusCode;

  public HolesApiException(String message) {
    this(message, -1, null);
  }

  public HolesApiException(String message, Throwable cause) {
    this(message, -1, cause);
  }

  public HolesApiException(String message, int statusCode, Throwable cause) {
    super(message, cause);
    this.statusCode = statusCode;
  }

  /**
   * @return HTTP-статус ответа или -1, если ответа не было.
   */
  public int getStatusCode() {
    return statusCode;
  }
}
