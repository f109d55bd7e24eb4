package com.scylladb.admin;

import static org.junit.Assert.*;

import java.time.Duration;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import org.junit.Test;

public class AdminConfigTest {

  @Test
  public void testDefaults() {
    AdminConfig config = AdminConfig.builder().build();
    assertEquals(AdminConfig.DEFAULT_REQUEST_TIMEOUT, config.getRequestTimeout());
    assertEquals(FanOutPolicy.RUN_TO_COMPLETION, config.getFanOutPolicy());
    assertEquals("ROW", config.getExplainOptions().getReplicationMode());
    assertTrue(config.isSharedExecutor());
    assertNotNull(config.getExecutor());
    assertNull(config.getExplainEngineSupplier());
  }

  @Test
  public void testDefaultExecutorIsShared() {
    assertSame(
        AdminConfig.builder().build().getExecutor(), AdminConfig.builder().build().getExecutor());
  }

  @Test
  public void testCustomExecutorIsOwned() {
    ExecutorService executor = Executors.newSingleThreadExecutor();
    try {
      AdminConfig config = AdminConfig.builder().withExecutor(executor).build();
      assertSame(executor, config.getExecutor());
      assertFalse(config.isSharedExecutor());
    } finally {
      executor.shutdown();
    }
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNegativeTimeoutIsRejected() {
    AdminConfig.builder().withRequestTimeout(Duration.ofSeconds(-1)).build();
  }

  @Test(expected = IllegalArgumentException.class)
  public void testNullPolicyIsRejected() {
    AdminConfig.builder().withFanOutPolicy(null).build();
  }
}
