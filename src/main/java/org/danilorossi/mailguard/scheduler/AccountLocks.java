package org.danilorossi.mailguard.scheduler;

import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;

/** Al massimo una passata in corso per account, anche tra tick diversi o richieste manuali. */
public class AccountLocks {

  private final ConcurrentHashMap<Long, ReentrantLock> locks = new ConcurrentHashMap<>();

  /** Non bloccante: false se un'altra passata sull'account è ancora in corso. */
  public boolean tryAcquire(final long accountId) {
    return locks.computeIfAbsent(accountId, id -> new ReentrantLock()).tryLock();
  }

  /** Va chiamato dallo stesso thread che ha acquisito il lock. */
  public void release(final long accountId) {
    final ReentrantLock lock = locks.get(accountId);
    if (lock != null && lock.isHeldByCurrentThread()) lock.unlock();
  }
}
