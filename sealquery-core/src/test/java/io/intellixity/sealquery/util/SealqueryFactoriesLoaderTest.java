package io.intellixity.sealquery.util;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

final class SealqueryFactoriesLoaderTest {

  interface Greeter {
    String greet();
  }

  public static final class HelloGreeter implements Greeter {
    @Override public String greet() { return "hello"; }
  }

  public static final class HiGreeter implements Greeter {
    @Override public String greet() { return "hi"; }
  }

  interface Unregistered {}

  @Test
  void loadsRegisteredImplementationsOnceInOrder() {
    List<Greeter> greeters = SealqueryFactoriesLoader.load(Greeter.class);
    assertEquals(List.of("hello", "hi"), greeters.stream().map(Greeter::greet).toList());
  }

  @Test
  void unregisteredTypeLoadsNothing() {
    assertTrue(SealqueryFactoriesLoader.load(Unregistered.class).isEmpty());
  }
}
