package com.gruelbox.retry.jackson;

import com.fasterxml.jackson.databind.JsonNode;
import com.gruelbox.retry.FailureCategory;
import com.gruelbox.retry.InvalidPolicyException;
import com.gruelbox.retry.RetryPolicy;
import com.gruelbox.retry.RetryableFailures;
import com.gruelbox.retry.StandardFailureCategory;
import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.function.Function;

/** Field names and tree conversion shared by the serializer, deserializer and loader. */
final class RetryPolicyFields {

  static final String MAX_ATTEMPTS = "maxAttempts";
  static final String INITIAL_DELAY = "initialDelay";
  static final String BACKOFF_MULTIPLIER = "backoffMultiplier";
  static final String RETRY_ON = "retryOn";
  static final String MAX_DELAY = "maxDelay";
  static final String DEADLINE = "deadline";

  static final List<String> ALL =
      List.of(MAX_ATTEMPTS, INITIAL_DELAY, BACKOFF_MULTIPLIER, RETRY_ON, MAX_DELAY, DEADLINE);

  private RetryPolicyFields() {}

  static RetryPolicy fromTree(JsonNode node, Function<String, FailureCategory> categoryResolver) {
    if (node == null || !node.isObject()) {
      throw new InvalidPolicyException("RetryPolicy must be an object, got " + node);
    }
    var builder = RetryPolicy.builder();
    if (present(node, MAX_ATTEMPTS)) {
      builder.maxAttempts(toInt(MAX_ATTEMPTS, node.get(MAX_ATTEMPTS)));
    }
    if (present(node, INITIAL_DELAY)) {
      builder.initialDelay(toDuration(INITIAL_DELAY, node.get(INITIAL_DELAY)));
    }
    if (present(node, BACKOFF_MULTIPLIER)) {
      builder.backoffMultiplier(toDouble(BACKOFF_MULTIPLIER, node.get(BACKOFF_MULTIPLIER)));
    }
    if (present(node, RETRY_ON)) {
      builder.retryableFailures(toRetryableFailures(node.get(RETRY_ON), categoryResolver));
    }
    if (present(node, MAX_DELAY)) {
      builder.maxDelay(toDuration(MAX_DELAY, node.get(MAX_DELAY)));
    }
    if (present(node, DEADLINE)) {
      builder.deadline(toDuration(DEADLINE, node.get(DEADLINE)));
    }
    return builder.build();
  }

  static Function<String, FailureCategory> standardCategories() {
    return StandardFailureCategory::valueOf;
  }

  private static boolean present(JsonNode node, String field) {
    JsonNode value = node.get(field);
    return value != null && !value.isNull();
  }

  private static int toInt(String field, JsonNode node) {
    if (node.isIntegralNumber() && node.canConvertToInt()) {
      return node.intValue();
    }
    try {
      return Integer.parseInt(node.asText().trim());
    } catch (NumberFormatException e) {
      throw invalid(field, "is not an integer", node);
    }
  }

  private static double toDouble(String field, JsonNode node) {
    if (node.isNumber()) {
      return node.doubleValue();
    }
    try {
      return Double.parseDouble(node.asText().trim());
    } catch (NumberFormatException e) {
      throw invalid(field, "is not a number", node);
    }
  }

  /** ISO-8601 ({@code PT1.5S}) or a number of seconds ({@code 1.5}). */
  static Duration toDuration(String field, JsonNode node) {
    try {
      if (node.isNumber()) {
        return secondsToDuration(node.decimalValue());
      }
      String text = node.asText().trim();
      if (text.toUpperCase(Locale.ROOT).startsWith("P")
          || text.toUpperCase(Locale.ROOT).startsWith("-P")) {
        return Duration.parse(text);
      }
      return secondsToDuration(new BigDecimal(text));
    } catch (DateTimeParseException | ArithmeticException | NumberFormatException e) {
      throw invalid(field, "is not a duration", node);
    }
  }

  private static Duration secondsToDuration(BigDecimal seconds) {
    return Duration.ofNanos(
        seconds.movePointRight(9).setScale(0, RoundingMode.HALF_UP).longValueExact());
  }

  private static RetryableFailures toRetryableFailures(
      JsonNode node, Function<String, FailureCategory> categoryResolver) {
    List<String> names = new ArrayList<>();
    if (node.isArray()) {
      node.forEach(it -> names.add(it.asText().trim()));
    } else if (!node.isTextual()) {
      throw invalid(RETRY_ON, "must be a list or a comma-separated string", node);
    } else {
      for (String name : node.asText().split(",")) {
        if (!name.isBlank()) {
          names.add(name.trim());
        }
      }
    }
    if (names.size() == 1 && "ALL".equalsIgnoreCase(names.get(0))) {
      return RetryableFailures.all();
    }
    List<FailureCategory> categories = new ArrayList<>();
    for (String name : names) {
      FailureCategory category;
      try {
        category = categoryResolver.apply(name.toUpperCase(Locale.ROOT));
      } catch (IllegalArgumentException e) {
        category = null;
      }
      if (category == null) {
        throw new InvalidPolicyException(
            "RetryPolicy." + RETRY_ON + " contains unknown failure category '" + name + "'");
      }
      categories.add(category);
    }
    return RetryableFailures.of(categories);
  }

  private static InvalidPolicyException invalid(String field, String problem, JsonNode node) {
    return new InvalidPolicyException("RetryPolicy." + field + " " + problem + ": " + node);
  }
}
