package io.github.panghy.asynctest.done;

/**
 * Resolution state of a single done item. An item leaves {@link #NOT_COMPLETE} at most once.
 */
public enum DoneState {
  NOT_COMPLETE,
  SUCCESS,
  ERROR;

  public boolean isResolved() {
    return this != NOT_COMPLETE;
  }
}
