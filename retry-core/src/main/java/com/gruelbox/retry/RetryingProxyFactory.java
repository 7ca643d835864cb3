package com.gruelbox.retry;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import lombok.extern.slf4j.Slf4j;

/** Builds the dynamic proxies returned by {@link RetryExecutor#proxy(Class, Object)}. */
@Slf4j
final class RetryingProxyFactory {

  private RetryingProxyFactory() {}

  @SuppressWarnings({"unchecked", "cast"})
  static <T> T createProxy(
      RetryExecutor executor, Class<T> type, T target, AttemptObserver observer) {
    if (type == null || !type.isInterface()) {
      throw new IllegalArgumentException("Only interfaces can be proxied, got " + type);
    }
    if (target == null) {
      throw new IllegalArgumentException("target may not be null");
    }
    log.debug("Creating retrying proxy of {} for {}", type.getName(), target);
    return (T)
        Proxy.newProxyInstance(
            type.getClassLoader(),
            new Class<?>[] {type},
            (proxy, method, args) -> {
              if (method.getDeclaringClass() == Object.class) {
                return invokeDirect(method, target, args);
              }
              return executor
                  .execute(() -> invokeUnwrapped(method, target, args), observer)
                  .getOrThrow();
            });
  }

  private static Object invokeDirect(Method method, Object target, Object[] args)
      throws Throwable {
    try {
      return method.invoke(target, args);
    } catch (InvocationTargetException e) {
      throw e.getCause();
    }
  }

  private static Object invokeUnwrapped(Method method, Object target, Object[] args)
      throws Exception {
    // Non-public interfaces in other packages are otherwise unreachable from here
    method.setAccessible(true);
    try {
      return method.invoke(target, args);
    } catch (InvocationTargetException e) {
      Throwable cause = e.getCause();
      if (cause instanceof Exception) {
        throw (Exception) cause;
      }
      if (cause instanceof Error) {
        throw (Error) cause;
      }
      throw e;
    }
  }
}
