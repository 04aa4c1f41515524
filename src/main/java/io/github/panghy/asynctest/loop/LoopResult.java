package io.github.panghy.asynctest.loop;

import io.github.panghy.asynctest.error.ResolutionException;

/**
 * Outcome of an event loop run, as reported to the test harness.
 *
 * @param state        The final completion state
 * @param errorMessage The composed error message, empty unless the state is ERROR
 * @param errorTag     The tag of the done item that failed, or null
 * @param failure      The recorded failure, or null unless the state is ERROR
 */
public record LoopResult(CompletionState state, String errorMessage, String errorTag,
                         ResolutionException failure) {

  public boolean isSuccess() {
    return state == CompletionState.SUCCESS;
  }

  public boolean isFailure() {
    return state == CompletionState.ERROR;
  }
}
