/*
 * Copyright (c) 2024, PostgreSQL Global Development Group
 * See the LICENSE file in the project root for more information.
 */

package org.pgcore.core.v3;

import org.pgcore.log.Log;
import org.pgcore.log.Logger;
import org.pgcore.util.GT;
import org.pgcore.util.PSQLException;
import org.pgcore.util.PSQLState;

import java.sql.SQLException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.BitSet;
import java.util.Deque;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bounded cache of executed statements, least recently used first. Decides when a statement is
 * parsed under a server side name and tracks which names still have to be closed.
 *
 * <p>Each entry owns a slot number and the statement name derived from it. Slots of evicted
 * entries are handed to the entry that replaces them; a name is only parsed again after the
 * Close for its previous owner has been queued, and queued Closes are always sent ahead of the
 * Parse messages of the same request.</p>
 */
public class StatementCache {

  private static Log LOGGER = Logger.getLogger(StatementCache.class.getName());

  private static final String INVALID_SQL_STATEMENT_NAME = PSQLState.INVALID_SQL_STATEMENT_NAME.getState();

  private final LinkedHashMap<StatementKey, CachedStatement> entries =
      new LinkedHashMap<StatementKey, CachedStatement>();
  private final BitSet usedSlots = new BitSet();
  private final Deque<String> statementsToClose = new ArrayDeque<String>();
  private int closeInFlight;
  private StatementKey lastTouchedKey;
  private int prepareThreshold;
  private int maxSize;

  public StatementCache(int prepareThreshold, int maxSize) {
    this.prepareThreshold = Math.max(0, prepareThreshold);
    this.maxSize = Math.max(0, maxSize);
  }

  /**
   * @return whether statements are cached at all; a threshold of zero disables the cache
   */
  public boolean isEnabled() {
    return prepareThreshold > 0 && maxSize > 0;
  }

  public int getPrepareThreshold() {
    return prepareThreshold;
  }

  /**
   * Changes the prepare threshold. Zero disables the cache, closing every prepared statement.
   *
   * @param prepareThreshold executions before a statement is prepared
   */
  public void setPrepareThreshold(int prepareThreshold) {
    this.prepareThreshold = Math.max(0, prepareThreshold);
    if (this.prepareThreshold == 0) {
      evictDownTo(0);
    }
  }

  public int getMaxSize() {
    return maxSize;
  }

  /**
   * Changes the capacity, evicting least recently used entries that no longer fit.
   *
   * @param maxSize maximum number of entries
   */
  public void setMaxSize(int maxSize) {
    this.maxSize = Math.max(0, maxSize);
    evictDownTo(this.maxSize);
  }

  public int size() {
    return entries.size();
  }

  /**
   * Looks up an entry without changing its position.
   *
   * @param key statement key
   * @return the entry or null
   */
  public CachedStatement get(StatementKey key) {
    return isEnabled() ? entries.get(key) : null;
  }

  /**
   * @param entry entry about to be executed
   * @return whether this execution should parse the statement under its server side name
   */
  public boolean shouldPrepare(CachedStatement entry) {
    return entry != null && !entry.isPrepared() && entry.getExecuteCount() + 1 >= prepareThreshold;
  }

  public boolean hasStatementsToClose() {
    return !statementsToClose.isEmpty();
  }

  /**
   * @return statement names waiting for a Close, oldest first, without taking them
   */
  public List<String> peekStatementsToClose() {
    return new ArrayList<String>(statementsToClose);
  }

  /**
   * Hands out the names whose Close has to be sent with the next request; each one is then
   * expected to be confirmed by a CloseComplete.
   *
   * @return statement names to close, oldest first
   */
  public List<String> takeStatementsToClose() {
    List<String> names = new ArrayList<String>(statementsToClose);
    statementsToClose.clear();
    closeInFlight += names.size();
    return names;
  }

  public int getCloseInFlight() {
    return closeInFlight;
  }

  /**
   * Called on ParseComplete for a named Parse of {@code entry}. An entry that left the cache
   * while its Parse was in flight gets its name queued for a Close, as the server now holds it.
   *
   * @param entry the entry that was parsed
   */
  public void onParseComplete(CachedStatement entry) {
    if (entries.get(entry.key) == entry) {
      entry.setPrepared(true);
      if (LOGGER.isDebugEnabled()) {
        LOGGER.debug(" statement " + entry.getName() + " is now prepared");
      }
      return;
    }
    statementsToClose.add(entry.getName());
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug(" statement " + entry.getName() + " was evicted while being parsed, closing it");
    }
  }

  /**
   * Called on CloseComplete.
   *
   * @throws PSQLException if no Close is outstanding
   */
  public void onCloseComplete() throws PSQLException {
    if (closeInFlight == 0) {
      throw new PSQLException(GT.tr("Received CloseComplete without an outstanding Close"),
          PSQLState.PROTOCOL_VIOLATION);
    }
    closeInFlight--;
  }

  /**
   * Bookkeeping after one execution, on ReadyForQuery.
   *
   * @param key key of the executed statement, null if the cache was not consulted
   * @param entry the entry the execution used, or null if there was none
   * @param wasPrepared whether the entry was already prepared when the request was built
   * @param error the failure of the cycle, or null
   * @param resultCount number of results the cycle produced
   */
  public void afterExecution(StatementKey key, CachedStatement entry, boolean wasPrepared,
      SQLException error, int resultCount) {
    if (closeInFlight > 0) {
      LOGGER.debug(" " + closeInFlight + " Close messages were not confirmed before ReadyForQuery");
      closeInFlight = 0;
    }
    if (!isEnabled() || key == null) {
      return;
    }
    if (entry != null) {
      if (entries.get(key) != entry) {
        // evicted or invalidated while the request was in flight
        return;
      }
      if (error == null) {
        if (!wasPrepared) {
          entry.increaseExecuteCount();
        }
        touch(key, entry);
      } else if (entry.isPrepared()) {
        String state = error.getSQLState();
        if (!INVALID_SQL_STATEMENT_NAME.equals(state)) {
          statementsToClose.add(entry.getName());
        }
        if (LOGGER.isDebugEnabled()) {
          LOGGER.debug(" execution of " + entry.getName() + " failed with " + state + ", resetting it");
        }
        entry.reset();
      }
      return;
    }
    if (error == null && resultCount == 1 && !entries.containsKey(key)) {
      insert(key);
    }
  }

  /**
   * Forgets all entries, for when the server dropped every prepared statement
   * ({@code DISCARD ALL}, {@code DEALLOCATE ALL}). Queued Closes are dropped too.
   */
  public void invalidateAll() {
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug(" invalidating " + entries.size() + " cached statements");
    }
    entries.clear();
    usedSlots.clear();
    statementsToClose.clear();
    lastTouchedKey = null;
  }

  private void touch(StatementKey key, CachedStatement entry) {
    if (key.equals(lastTouchedKey)) {
      return;
    }
    entries.remove(key);
    entries.put(key, entry);
    lastTouchedKey = key;
  }

  private void insert(StatementKey key) {
    int slot;
    if (entries.size() >= maxSize) {
      CachedStatement evicted = evictEldest();
      slot = evicted.getSlot();
    } else {
      slot = usedSlots.nextClearBit(0);
    }
    usedSlots.set(slot);
    CachedStatement entry = new CachedStatement(key, slot);
    entries.put(key, entry);
    lastTouchedKey = key;
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug(" caching " + entry);
    }
  }

  private CachedStatement evictEldest() {
    Iterator<Map.Entry<StatementKey, CachedStatement>> it = entries.entrySet().iterator();
    CachedStatement evicted = it.next().getValue();
    it.remove();
    usedSlots.clear(evicted.getSlot());
    if (evicted.key.equals(lastTouchedKey)) {
      lastTouchedKey = null;
    }
    if (evicted.isPrepared()) {
      statementsToClose.add(evicted.getName());
    }
    if (LOGGER.isDebugEnabled()) {
      LOGGER.debug(" evicting " + evicted);
    }
    return evicted;
  }

  private void evictDownTo(int size) {
    while (entries.size() > size) {
      evictEldest();
    }
  }
}
