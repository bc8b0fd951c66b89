/*
 * SPDX-License-Identifier: Apache-2.0
 *
 * The OpenSearch Contributors require contributions made to
 * this file be licensed under the Apache-2.0 license or a
 * compatible open source license.
 *
 * Modifications Copyright OpenSearch Contributors. See
 * GitHub history for details.
 */

package org.opensearch.b2c.keys;

import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.RejectedExecutionException;
import java.util.function.LongSupplier;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Holds the active {@link KeySet} snapshot of one validator and coordinates its replacement.
 * <p>
 * Reading the snapshot never blocks. A refresh runs on the given executor; while it is in
 * flight, further {@link #refresh()} calls are joined onto it and receive the very same future,
 * so any number of concurrent callers cause exactly one fetch. The snapshot is replaced only
 * when the fetch succeeds. Cancelling the shared future cancels it for all joined callers and
 * leaves the snapshot untouched.
 */
public class SelfRefreshingKeySet {
    private static final Logger log = LogManager.getLogger(SelfRefreshingKeySet.class);

    private final KeySetProvider keySetProvider;
    private final ExecutorService executor;
    private final LongSupplier currentTimeMillis;
    private volatile KeySet keySet;
    private RefreshFuture refreshInProgress;
    private long refreshCount = 0;
    private long coalescedRefreshCount = 0;
    private long recentRefreshCount = 0;
    private long refreshTime = 0;
    private int refreshRateLimitTimeWindowMs = 10000;
    private int refreshRateLimitCount = 10;

    public SelfRefreshingKeySet(KeySetProvider keySetProvider, KeySet initialKeySet, ExecutorService executor) {
        this(keySetProvider, initialKeySet, executor, System::currentTimeMillis);
    }

    public SelfRefreshingKeySet(KeySetProvider keySetProvider, KeySet initialKeySet, ExecutorService executor, LongSupplier currentTimeMillis) {
        this.keySetProvider = Objects.requireNonNull(keySetProvider, "keySetProvider");
        this.keySet = Objects.requireNonNull(initialKeySet, "initialKeySet");
        this.executor = Objects.requireNonNull(executor, "executor");
        this.currentTimeMillis = Objects.requireNonNull(currentTimeMillis, "currentTimeMillis");
    }

    /**
     * @return the latest successfully fetched snapshot
     */
    public KeySet current() {
        return keySet;
    }

    /**
     * Fetches a new key set and makes it the active snapshot.
     *
     * @return a future completing normally once the new snapshot is active, or exceptionally with
     *         a {@link KeyFetchException} if the fetch failed or was refused by the rate limit
     */
    public CompletableFuture<Void> refresh() {
        final RefreshFuture future;

        synchronized (this) {
            if (refreshInProgress != null) {
                coalescedRefreshCount++;
                log.debug("Joining refresh {} already in progress", refreshCount);
                return refreshInProgress;
            }

            long now = currentTimeMillis.getAsLong();

            if (now - refreshTime < refreshRateLimitTimeWindowMs) {
                recentRefreshCount++;

                if (recentRefreshCount > refreshRateLimitCount) {
                    log.warn("Refusing key refresh, {} refreshes within {} ms", recentRefreshCount, refreshRateLimitTimeWindowMs);
                    return CompletableFuture.failedFuture(
                        new KeyFetchException("Too many key refreshes recently: " + recentRefreshCount)
                    );
                }
            } else {
                refreshTime = now;
                recentRefreshCount = 1;
            }

            refreshCount++;
            future = new RefreshFuture(refreshCount);
            refreshInProgress = future;
        }

        log.info("Performing key refresh {}", future.refreshNumber);

        try {
            future.task = executor.submit(() -> performRefresh(future));
        } catch (RejectedExecutionException e) {
            fail(future, new KeyFetchException("Did not try to refresh keys because the executor rejected the task", e));
        }

        return future;
    }

    private void performRefresh(RefreshFuture future) {
        KeySet newKeySet;

        try {
            newKeySet = keySetProvider.get();

            if (newKeySet == null) {
                throw new KeyFetchException("Key set provider " + keySetProvider + " yielded null");
            }
        } catch (KeyFetchException e) {
            log.warn("Key refresh {} failed", future.refreshNumber, e);
            fail(future, e);
            return;
        } catch (RuntimeException e) {
            log.warn("Key refresh {} failed", future.refreshNumber, e);
            fail(future, new KeyFetchException("Key set provider " + keySetProvider + " failed: " + e, e));
            return;
        }

        synchronized (this) {
            if (future.cancelled) {
                log.info("Key refresh {} was cancelled, discarding {}", future.refreshNumber, newKeySet);
                return;
            }

            keySet = newKeySet;
            future.committed = true;

            if (refreshInProgress == future) {
                refreshInProgress = null;
            }
        }

        log.info("Key refresh {} finished, now using {}", future.refreshNumber, newKeySet);
        future.complete(null);
    }

    private void fail(RefreshFuture future, KeyFetchException e) {
        synchronized (this) {
            if (refreshInProgress == future) {
                refreshInProgress = null;
            }
        }

        future.completeExceptionally(e);
    }

    public synchronized long getRefreshCount() {
        return refreshCount;
    }

    public synchronized long getCoalescedRefreshCount() {
        return coalescedRefreshCount;
    }

    public synchronized int getRefreshRateLimitTimeWindowMs() {
        return refreshRateLimitTimeWindowMs;
    }

    public synchronized void setRefreshRateLimitTimeWindowMs(int refreshRateLimitTimeWindowMs) {
        this.refreshRateLimitTimeWindowMs = refreshRateLimitTimeWindowMs;
    }

    public synchronized int getRefreshRateLimitCount() {
        return refreshRateLimitCount;
    }

    public synchronized void setRefreshRateLimitCount(int refreshRateLimitCount) {
        this.refreshRateLimitCount = refreshRateLimitCount;
    }

    /**
     * The future shared by all callers of one refresh. Cancellation and the snapshot swap are
     * mutually exclusive: once the new snapshot is active the future can no longer be cancelled.
     */
    private final class RefreshFuture extends CompletableFuture<Void> {
        private final long refreshNumber;
        private volatile Future<?> task;
        // guarded by SelfRefreshingKeySet.this
        private boolean committed;
        private boolean cancelled;

        private RefreshFuture(long refreshNumber) {
            this.refreshNumber = refreshNumber;
        }

        @Override
        public boolean cancel(boolean mayInterruptIfRunning) {
            synchronized (SelfRefreshingKeySet.this) {
                if (committed || isDone()) {
                    return false;
                }

                cancelled = true;

                if (refreshInProgress == this) {
                    refreshInProgress = null;
                }
            }

            log.info("Key refresh {} cancelled", refreshNumber);

            Future<?> runningTask = task;

            if (runningTask != null) {
                runningTask.cancel(mayInterruptIfRunning);
            }

            return super.cancel(mayInterruptIfRunning);
        }
    }
}
