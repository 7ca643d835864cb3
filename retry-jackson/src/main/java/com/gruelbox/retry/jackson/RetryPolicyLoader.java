package com.gruelbox.retry.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.fasterxml.jackson.databind.node.TextNode;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.gruelbox.retry.FailureCategory;
import com.gruelbox.retry.InvalidPolicyException;
import com.gruelbox.retry.PolicyOverflowException;
import com.gruelbox.retry.RetryPolicy;
import java.io.IOException;
import java.io.Reader;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.function.Function;
import lombok.Builder;
import lombok.extern.slf4j.Slf4j;

/**
 * Loads named {@link RetryPolicy}s from a configuration document.
 *
 * <p>The document maps policy names to policies:
 *
 * <pre>kafka:
 *   maxAttempts: 5
 *   initialDelay: PT0.5S
 *   retryOn: [TRANSIENT, UNAVAILABLE]
 * database:
 *   maxAttempts: 3
 *   initialDelay: 2
 *   deadline: PT30S</pre>
 *
 * <p>Any field missing from a policy is looked up in the environment as {@code <NAME>_<FIELD>} in
 * upper snake case, so {@code KAFKA_MAX_ATTEMPTS=7} supplies {@code maxAttempts} for {@code kafka}.
 * Anything still missing takes the {@link RetryPolicy} default.
 */
@Slf4j
public final class RetryPolicyLoader {

  private final ObjectMapper mapper;
  private final Map<String, String> environment;
  private final Function<String, FailureCategory> categoryResolver;

  /**
   * @param mapper Reads and writes documents. Defaults to a YAML mapper. The {@link
   *     RetryPolicyJacksonModule} is registered on a copy.
   * @param environment Source of fallback values. Defaults to {@link System#getenv()}.
   * @param categoryResolver Maps names in {@code retryOn} to categories. Defaults to {@link
   *     com.gruelbox.retry.StandardFailureCategory}.
   */
  @Builder
  private RetryPolicyLoader(
      ObjectMapper mapper,
      Map<String, String> environment,
      Function<String, FailureCategory> categoryResolver) {
    this.categoryResolver =
        categoryResolver == null ? RetryPolicyFields.standardCategories() : categoryResolver;
    ObjectMapper base = mapper == null ? new ObjectMapper(new YAMLFactory()) : mapper.copy();
    this.mapper = base.registerModule(new RetryPolicyJacksonModule(this.categoryResolver));
    this.environment = environment == null ? System.getenv() : Map.copyOf(environment);
  }

  /**
   * @return A loader reading YAML with fallback to the process environment.
   */
  public static RetryPolicyLoader create() {
    return builder().build();
  }

  /**
   * Reads every policy in the document.
   *
   * @param reader The document. Not closed.
   * @return Policies by name, in document order.
   * @throws IOException If the document cannot be read or parsed.
   * @throws InvalidPolicyException If any policy is invalid.
   * @throws PolicyOverflowException If any policy's delays outgrow a {@link java.time.Duration}.
   */
  public Map<String, RetryPolicy> loadAll(Reader reader) throws IOException {
    JsonNode root = readDocument(reader);
    Map<String, RetryPolicy> result = new LinkedHashMap<>();
    root.fields()
        .forEachRemaining(
            entry -> result.put(entry.getKey(), toPolicy(entry.getKey(), entry.getValue())));
    log.info("Loaded {} retry policies: {}", result.size(), result.keySet());
    return Collections.unmodifiableMap(result);
  }

  /**
   * Reads a single named policy. If the document has no entry for the name, the policy is built
   * from the environment and defaults alone.
   *
   * @param reader The document. Not closed.
   * @param name The policy name.
   * @return The policy.
   * @throws IOException If the document cannot be read or parsed.
   * @throws InvalidPolicyException If the policy is invalid.
   */
  public RetryPolicy load(Reader reader, String name) throws IOException {
    JsonNode root = readDocument(reader);
    JsonNode node = root.get(name);
    if (node == null || node.isNull()) {
      log.debug("No policy named {} in document; using environment and defaults", name);
      return fromEnvironment(name);
    }
    return toPolicy(name, node);
  }

  /**
   * Builds a policy from environment variables and defaults only.
   *
   * @param name The policy name.
   * @return The policy.
   */
  public RetryPolicy fromEnvironment(String name) {
    return toPolicy(name, mapper.createObjectNode());
  }

  /**
   * Writes policies as a document which {@link #loadAll(Reader)} reads back.
   *
   * @param policies Policies by name.
   * @return The document.
   * @throws JsonProcessingException If serialization fails.
   */
  public String dump(Map<String, RetryPolicy> policies) throws JsonProcessingException {
    ObjectNode root = mapper.createObjectNode();
    policies.forEach((name, policy) -> root.set(name, mapper.valueToTree(policy)));
    return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(root);
  }

  /**
   * @param policyName The policy name.
   * @param field The policy field, e.g. {@code maxAttempts}.
   * @return The environment variable consulted when the field is missing, e.g. {@code
   *     KAFKA_MAX_ATTEMPTS}.
   */
  public static String environmentKey(String policyName, String field) {
    return toUpperSnake(policyName) + "_" + toUpperSnake(field);
  }

  private JsonNode readDocument(Reader reader) throws IOException {
    JsonNode root = mapper.readTree(reader);
    if (root == null || root.isMissingNode() || root.isNull()) {
      return mapper.createObjectNode();
    }
    if (!root.isObject()) {
      throw new InvalidPolicyException(
          "Policy document must map names to policies, got " + root.getNodeType());
    }
    return root;
  }

  private RetryPolicy toPolicy(String name, JsonNode node) {
    if (!node.isObject()) {
      throw new InvalidPolicyException(
          "Policy '" + name + "' must be a mapping, got " + node.getNodeType());
    }
    ObjectNode merged = ((ObjectNode) node).deepCopy();
    for (String field : RetryPolicyFields.ALL) {
      JsonNode value = merged.get(field);
      if (value != null && !value.isNull()) {
        continue;
      }
      String key = environmentKey(name, field);
      String fromEnvironment = environment.get(key);
      if (fromEnvironment != null && !fromEnvironment.isBlank()) {
        log.debug("Policy {}: {} taken from environment variable {}", name, field, key);
        merged.set(field, TextNode.valueOf(fromEnvironment));
      }
    }
    try {
      return RetryPolicyFields.fromTree(merged, categoryResolver);
    } catch (InvalidPolicyException e) {
      throw new InvalidPolicyException("Policy '" + name + "': " + e.getMessage(), e);
    } catch (PolicyOverflowException e) {
      throw new PolicyOverflowException("Policy '" + name + "': " + e.getMessage(), e);
    }
  }

  private static String toUpperSnake(String text) {
    StringBuilder result = new StringBuilder(text.length() + 8);
    for (int i = 0; i < text.length(); i++) {
      char c = text.charAt(i);
      if (Character.isUpperCase(c) && i > 0 && Character.isLowerCase(text.charAt(i - 1))) {
        result.append('_');
      }
      result.append(Character.isLetterOrDigit(c) ? c : '_');
    }
    return result.toString().toUpperCase(Locale.ROOT);
  }
}
