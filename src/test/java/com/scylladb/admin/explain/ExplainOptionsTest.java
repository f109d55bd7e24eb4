package com.scylladb.admin.explain;

import static org.junit.Assert.*;

import org.junit.Test;

public class ExplainOptionsTest {

  @Test
  public void testDefaults() {
    ExplainOptions options = ExplainOptions.defaults();
    assertEquals("ROW", options.getReplicationMode());
    assertFalse(options.isNormalize());
    assertFalse(options.isStrictDdl());
  }

  @Test
  public void testStatementMode() {
    ExplainOptions options =
        ExplainOptions.builder().withReplicationMode("STATEMENT").withNormalize(true).build();
    assertEquals("STATEMENT", options.getReplicationMode());
    assertTrue(options.isNormalize());
  }

  @Test(expected = IllegalArgumentException.class)
  public void testUnknownReplicationModeIsRejected() {
    ExplainOptions.builder().withReplicationMode("MIXED").build();
  }
}
