package org.danilorossi.mailguard.helpers;

import java.time.Duration;
import lombok.Getter;
import lombok.NonNull;

/**
 * Budget di tempo di una passata. Controllato in modo cooperativo tra un passo e l'altro; le
 * singole chiamate di rete restano limitate dai timeout del socket.
 */
public final class Deadline {

  private static final Deadline NONE = new Deadline(Long.MAX_VALUE, "unbounded");

  private final long deadlineNanos;
  @Getter private final String label;

  private Deadline(final long deadlineNanos, final String label) {
    this.deadlineNanos = deadlineNanos;
    this.label = label;
  }

  public static Deadline in(@NonNull final Duration budget, final String label) {
    return new Deadline(System.nanoTime() + budget.toNanos(), label);
  }

  public static Deadline none() {
    return NONE;
  }

  public boolean isExpired() {
    return this != NONE && System.nanoTime() - deadlineNanos >= 0;
  }

  /** Lancia ExceededException se il budget è finito o il thread è stato interrotto. */
  public void check() {
    if (Thread.currentThread().isInterrupted())
      throw new ExceededException(LangUtils.s("{}: interrupted", label));
    if (isExpired()) throw new ExceededException(LangUtils.s("{}: time budget exceeded", label));
  }

  public static final class ExceededException extends RuntimeException {
    public ExceededException(final String msg) {
      super(msg);
    }
  }
}
