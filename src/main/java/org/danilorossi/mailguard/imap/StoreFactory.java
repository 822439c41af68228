package org.danilorossi.mailguard.imap;

import jakarta.mail.MessagingException;
import jakarta.mail.Session;
import jakarta.mail.Store;
import org.danilorossi.mailguard.model.Account;

/** Crea lo Store Jakarta Mail (non ancora connesso) per un account. */
@FunctionalInterface
public interface StoreFactory {

  Store create(Account account) throws MessagingException;

  static StoreFactory jakarta() {
    return account ->
        Session.getInstance(account.toProperties()).getStore(account.getStoreProtocol());
  }
}
