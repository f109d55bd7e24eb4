package com.scylladb.admin.internal;

/**
 * An output slot written by exactly one fan-out step and read after the fan-out returns.
 *
 * <p>The slot is not synchronized. Visibility of the written value to the reader comes from the
 * completion barrier in {@link FanOut#runAll}: every write happens before the barrier is released,
 * and every read happens after it.
 *
 * @param <T> the value type
 * @since 1.0.0
 */
public final class ResultSlot<T> {
  private final String name;
  private T value;
  private boolean written;

  /**
   * Creates an empty slot.
   *
   * @param name slot name used in error messages
   */
  public ResultSlot(String name) {
    this.name = name;
  }

  /**
   * Stores the value.
   *
   * @param value the value, may be null
   * @throws IllegalStateException if the slot was already written
   */
  public void set(T value) {
    if (written) {
      throw new IllegalStateException("slot " + name + " already written");
    }
    this.value = value;
    this.written = true;
  }

  /**
   * Returns the stored value.
   *
   * @return the value
   * @throws IllegalStateException if the slot was never written
   */
  public T get() {
    if (!written) {
      throw new IllegalStateException("slot " + name + " was never written");
    }
    return value;
  }

  /**
   * Returns whether the slot holds a value.
   *
   * @return true once {@link #set(Object)} has been called
   */
  public boolean isWritten() {
    return written;
  }

  @Override
  public String toString() {
    return "ResultSlot{name='" + name + "', written=" + written + "}";
  }
}
