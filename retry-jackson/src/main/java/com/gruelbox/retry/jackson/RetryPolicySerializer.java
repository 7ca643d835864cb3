package com.gruelbox.retry.jackson;

import static com.gruelbox.retry.jackson.RetryPolicyFields.BACKOFF_MULTIPLIER;
import static com.gruelbox.retry.jackson.RetryPolicyFields.DEADLINE;
import static com.gruelbox.retry.jackson.RetryPolicyFields.INITIAL_DELAY;
import static com.gruelbox.retry.jackson.RetryPolicyFields.MAX_ATTEMPTS;
import static com.gruelbox.retry.jackson.RetryPolicyFields.MAX_DELAY;
import static com.gruelbox.retry.jackson.RetryPolicyFields.RETRY_ON;

import com.fasterxml.jackson.core.JsonGenerator;
import com.fasterxml.jackson.databind.JsonSerializer;
import com.fasterxml.jackson.databind.SerializerProvider;
import com.gruelbox.retry.FailureCategory;
import com.gruelbox.retry.RetryPolicy;
import java.io.IOException;
import java.util.Comparator;

class RetryPolicySerializer extends JsonSerializer<RetryPolicy> {

  @Override
  public void serialize(RetryPolicy policy, JsonGenerator gen, SerializerProvider serializers)
      throws IOException {
    gen.writeStartObject();
    gen.writeNumberField(MAX_ATTEMPTS, policy.getMaxAttempts());
    gen.writeStringField(INITIAL_DELAY, policy.getInitialDelay().toString());
    gen.writeNumberField(BACKOFF_MULTIPLIER, policy.getBackoffMultiplier());
    // Absent means every category is retryable
    if (!policy.getRetryableFailures().isAll()) {
      gen.writeArrayFieldStart(RETRY_ON);
      String[] names =
          policy.getRetryableFailures().getCategories().stream()
              .map(FailureCategory::name)
              .sorted(Comparator.naturalOrder())
              .toArray(String[]::new);
      for (String name : names) {
        gen.writeString(name);
      }
      gen.writeEndArray();
    }
    if (policy.getMaxDelay() != null) {
      gen.writeStringField(MAX_DELAY, policy.getMaxDelay().toString());
    }
    if (policy.getDeadline() != null) {
      gen.writeStringField(DEADLINE, policy.getDeadline().toString());
    }
    gen.writeEndObject();
  }
}
