package org.danilorossi.mailguard.model;

public enum SaveOutcome {
  SAVED,
  ALREADY_EXISTS // non è un errore: l'idempotenza è voluta
}
