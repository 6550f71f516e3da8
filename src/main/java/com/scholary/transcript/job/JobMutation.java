package com.scholary.transcript.job;

/**
 * A change applied to a job under its per-job lock.
 *
 * <p>A mutation receives a private working copy. Throwing {@link IllegalTransitionException}
 * rejects the change and leaves the committed snapshot untouched.
 */
@FunctionalInterface
public interface JobMutation {

  void apply(TranscriptionJob job);
}
