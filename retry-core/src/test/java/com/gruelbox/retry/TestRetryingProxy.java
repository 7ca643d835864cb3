package com.gruelbox.retry;

import static com.gruelbox.retry.StandardFailureCategory.INVALID;
import static com.gruelbox.retry.StandardFailureCategory.TRANSIENT;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.sameInstance;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.time.Duration;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;

class TestRetryingProxy {

  interface MessageProducer {
    String send(String topic, String payload) throws OperationFailedException;
  }

  static class FlakyProducer implements MessageProducer {

    private final AtomicInteger calls = new AtomicInteger();
    private final int failures;
    private final OperationFailedException failure;

    FlakyProducer(int failures, OperationFailedException failure) {
      this.failures = failures;
      this.failure = failure;
    }

    @Override
    public String send(String topic, String payload) throws OperationFailedException {
      if (calls.incrementAndGet() <= failures) {
        throw failure;
      }
      return topic + ":" + payload;
    }

    @Override
    public String toString() {
      return "FlakyProducer";
    }
  }

  private final RetryExecutor executor =
      RetryExecutor.builder()
          .policy(
              RetryPolicy.builder()
                  .maxAttempts(3)
                  .initialDelay(Duration.ofMillis(1))
                  .retryOn(TRANSIENT)
                  .build())
          .sleeper((duration, token) -> true)
          .build();

  @Test
  void retriesInterfaceCalls() throws OperationFailedException {
    var target = new FlakyProducer(2, new OperationFailedException(TRANSIENT, "broker busy"));
    MessageProducer producer = executor.proxy(MessageProducer.class, target);

    assertEquals("orders:hello", producer.send("orders", "hello"));
    assertEquals(3, target.calls.get());
  }

  @Test
  void rethrowsTheTargetsException() {
    var failure = new OperationFailedException(INVALID, "bad payload");
    var target = new FlakyProducer(Integer.MAX_VALUE, failure);
    MessageProducer producer = executor.proxy(MessageProducer.class, target);

    var thrown =
        assertThrows(OperationFailedException.class, () -> producer.send("orders", "hello"));

    assertThat(thrown, sameInstance(failure));
    assertEquals(1, target.calls.get());
  }

  @Test
  void objectMethodsPassThrough() {
    var target = new FlakyProducer(0, null);
    MessageProducer producer = executor.proxy(MessageProducer.class, target);
    assertEquals("FlakyProducer", producer.toString());
    assertEquals(0, target.calls.get());
  }

  @Test
  void onlyInterfacesCanBeProxied() {
    assertThrows(
        IllegalArgumentException.class,
        () -> executor.proxy(FlakyProducer.class, new FlakyProducer(0, null)));
  }
}
