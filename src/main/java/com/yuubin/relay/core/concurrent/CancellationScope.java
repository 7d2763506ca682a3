package com.yuubin.relay.core.concurrent;

import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Node in a tree of cancellation signals.
 * <p>
 * Cancelling a scope cancels every descendant but never its parent or
 * siblings. A child created under an already cancelled scope starts out
 * cancelled. Cancellation is one-way and idempotent.
 * </p>
 */
public final class CancellationScope {

    private final String name;
    private final CancellationScope parent;
    private final CountDownLatch cancelled = new CountDownLatch(1);
    private final Set<CancellationScope> children = ConcurrentHashMap.newKeySet();

    private CancellationScope(String name, CancellationScope parent) {
        this.name = name;
        this.parent = parent;
    }

    /**
     * Creates a scope with no parent.
     * 
     * @param name Name used in log messages.
     * @return A live root scope.
     */
    public static CancellationScope root(String name) {
        return new CancellationScope(name, null);
    }

    /**
     * Creates a child scope that is cancelled together with this one.
     * 
     * @param childName Name used in log messages.
     * @return The new child scope.
     */
    public CancellationScope newChild(String childName) {
        CancellationScope child = new CancellationScope(name + "/" + childName, this);
        children.add(child);
        // Re-check after publishing: a concurrent cancel() may have missed the child.
        if (isCancelled()) {
            child.cancel();
        }
        return child;
    }

    /**
     * Cancels this scope and all of its descendants.
     */
    public void cancel() {
        if (cancelled.getCount() == 0) {
            return;
        }
        cancelled.countDown();
        for (CancellationScope child : children) {
            child.cancel();
        }
        children.clear();
        if (parent != null) {
            parent.children.remove(this);
        }
    }

    public boolean isCancelled() {
        return cancelled.getCount() == 0;
    }

    /**
     * Waits until this scope is cancelled or the timeout elapses.
     * 
     * @param timeout Maximum time to wait.
     * @param unit    Unit of the timeout.
     * @return True if the scope is cancelled.
     * @throws InterruptedException If the waiting thread is interrupted.
     */
    public boolean awaitCancellation(long timeout, TimeUnit unit) throws InterruptedException {
        return cancelled.await(timeout, unit);
    }

    public String getName() {
        return name;
    }

    @Override
    public String toString() {
        return "CancellationScope[" + name + (isCancelled() ? ", cancelled" : "") + "]";
    }
}
