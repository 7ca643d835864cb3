package com.gruelbox.retry.jackson;

import com.fasterxml.jackson.core.JsonParser;
import com.fasterxml.jackson.core.ObjectCodec;
import com.fasterxml.jackson.databind.DeserializationContext;
import com.fasterxml.jackson.databind.JsonDeserializer;
import com.fasterxml.jackson.databind.JsonMappingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.gruelbox.retry.FailureCategory;
import com.gruelbox.retry.InvalidPolicyException;
import com.gruelbox.retry.PolicyOverflowException;
import com.gruelbox.retry.RetryPolicy;
import java.io.IOException;
import java.util.function.Function;

class RetryPolicyDeserializer extends JsonDeserializer<RetryPolicy> {

  private final Function<String, FailureCategory> categoryResolver;

  RetryPolicyDeserializer(Function<String, FailureCategory> categoryResolver) {
    this.categoryResolver = categoryResolver;
  }

  @Override
  public RetryPolicy deserialize(JsonParser p, DeserializationContext c) throws IOException {
    ObjectCodec oc = p.getCodec();
    JsonNode policy = oc.readTree(p);
    try {
      return RetryPolicyFields.fromTree(policy, categoryResolver);
    } catch (InvalidPolicyException | PolicyOverflowException e) {
      throw JsonMappingException.from(p, e.getMessage(), e);
    }
  }
}
