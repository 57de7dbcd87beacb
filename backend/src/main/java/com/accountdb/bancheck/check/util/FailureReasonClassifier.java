package com.accountdb.bancheck.check.util;

import com.accountdb.bancheck.check.model.HttpFetchResult;

import java.util.Locale;

public final class FailureReasonClassifier {
  public static final String TIMEOUT = "TIMEOUT";
  public static final String CONNECTION_FAILURE = "CONNECTION_FAILURE";
  public static final String PROXY_FAILURE = "PROXY_FAILURE";
  public static final String DNS_FAILURE = "DNS_FAILURE";
  public static final String TLS_FAILURE = "TLS_FAILURE";
  public static final String HTTP_404_NOT_FOUND = "HTTP_404_NOT_FOUND";
  public static final String HTTP_4XX = "HTTP_4XX";
  public static final String HTTP_429_RATE_LIMIT = "HTTP_429_RATE_LIMIT";
  public static final String HTTP_5XX = "HTTP_5XX";
  public static final String INTERRUPTED = "INTERRUPTED";
  public static final String INVALID_URL = "INVALID_URL";
  public static final String UNKNOWN = "UNKNOWN";

  private FailureReasonClassifier() {}

  public static String classify(HttpFetchResult result) {
    if (result == null) {
      return UNKNOWN;
    }
    if (result.errorCode() != null && !result.errorCode().isBlank()) {
      return fromErrorCode(result.errorCode(), result.errorMessage());
    }
    return fromHttpStatus(result.statusCode());
  }

  public static String fromHttpStatus(Integer status) {
    if (status == null || status <= 0) {
      return UNKNOWN;
    }
    if (status == 404) {
      return HTTP_404_NOT_FOUND;
    }
    if (status == 407) {
      return PROXY_FAILURE;
    }
    if (status == 408) {
      return TIMEOUT;
    }
    if (status == 429) {
      return HTTP_429_RATE_LIMIT;
    }
    if (status >= 500 && status < 600) {
      return HTTP_5XX;
    }
    if (status >= 400 && status < 500) {
      return HTTP_4XX;
    }
    return UNKNOWN;
  }

  public static String fromErrorCode(String errorCode, String errorMessage) {
    if (errorCode == null || errorCode.isBlank()) {
      return UNKNOWN;
    }
    String code = errorCode.toLowerCase(Locale.ROOT);
    if (code.contains("timeout")) {
      return TIMEOUT;
    }
    if (code.contains("interrupted")) {
      return INTERRUPTED;
    }
    if (code.contains("invalid_url")) {
      return INVALID_URL;
    }
    if (code.contains("io_error")) {
      String lower = errorMessage == null ? "" : errorMessage.toLowerCase(Locale.ROOT);
      if (lower.contains("unknownhost")
          || lower.contains("name or service not known")
          || lower.contains("no such host")) {
        return DNS_FAILURE;
      }
      if (lower.contains("ssl") || lower.contains("handshake")) {
        return TLS_FAILURE;
      }
      if (lower.contains("proxy") || lower.contains("tunnel")) {
        return PROXY_FAILURE;
      }
      return CONNECTION_FAILURE;
    }
    return UNKNOWN;
  }

  public static boolean isRetryable(String reasonCode) {
    if (reasonCode == null) {
      return false;
    }
    return switch (reasonCode) {
      case TIMEOUT, CONNECTION_FAILURE, PROXY_FAILURE, DNS_FAILURE, TLS_FAILURE, HTTP_429_RATE_LIMIT, HTTP_5XX ->
          true;
      default -> false;
    };
  }

  public static boolean countsAgainstProxy(String reasonCode) {
    if (reasonCode == null) {
      return false;
    }
    return switch (reasonCode) {
      case TIMEOUT, CONNECTION_FAILURE, PROXY_FAILURE, TLS_FAILURE, HTTP_429_RATE_LIMIT, HTTP_5XX -> true;
      default -> false;
    };
  }

  public static String describe(String reasonCode, HttpFetchResult result) {
    if (result == null) {
      return reasonCode;
    }
    if (result.errorCode() != null) {
      String message = result.errorMessage();
      return message == null || message.isBlank() ? reasonCode : reasonCode + ": " + message;
    }
    return reasonCode + ": HTTP " + result.statusCode();
  }
}
