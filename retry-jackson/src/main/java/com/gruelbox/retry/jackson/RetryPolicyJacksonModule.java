package com.gruelbox.retry.jackson;

import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.Module;
import com.fasterxml.jackson.databind.module.SimpleDeserializers;
import com.fasterxml.jackson.databind.module.SimpleSerializers;
import com.gruelbox.retry.FailureCategory;
import com.gruelbox.retry.RetryPolicy;
import java.util.function.Function;

/**
 * Registers (de)serialization of {@link RetryPolicy} with an {@code ObjectMapper}.
 *
 * <p>Durations are written as ISO-8601 strings and may be read either in that form or as a number
 * of seconds. Retryable categories are written by name and resolved using the supplied resolver,
 * which defaults to {@link com.gruelbox.retry.StandardFailureCategory#valueOf(String)}.
 */
public class RetryPolicyJacksonModule extends Module {

  private final Function<String, FailureCategory> categoryResolver;

  public RetryPolicyJacksonModule() {
    this(RetryPolicyFields.standardCategories());
  }

  public RetryPolicyJacksonModule(Function<String, FailureCategory> categoryResolver) {
    this.categoryResolver = categoryResolver;
  }

  @Override
  public String getModuleName() {
    return "RetryPolicyJacksonModule";
  }

  @Override
  public Version version() {
    return Version.unknownVersion();
  }

  @Override
  public void setupModule(SetupContext setupContext) {
    SimpleSerializers serializers = new SimpleSerializers();
    serializers.addSerializer(RetryPolicy.class, new RetryPolicySerializer());
    setupContext.addSerializers(serializers);

    SimpleDeserializers deserializers = new SimpleDeserializers();
    deserializers.addDeserializer(
        RetryPolicy.class, new RetryPolicyDeserializer(categoryResolver));
    setupContext.addDeserializers(deserializers);
  }
}
