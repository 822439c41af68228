package org.danilorossi.mailguard.imap;

/** Ciclo di vita di una connessione: solo READY e SELECTED permettono search/fetch. */
public enum ConnectionState {
  DISCONNECTED,
  AUTHENTICATING,
  READY,
  SELECTED,
  CLOSED;

  public boolean canSelect() {
    return this == READY || this == SELECTED;
  }
}
