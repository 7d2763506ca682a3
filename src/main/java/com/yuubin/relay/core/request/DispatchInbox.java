package com.yuubin.relay.core.request;

import java.util.EnumMap;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.Semaphore;
import java.util.concurrent.TimeUnit;

import com.yuubin.relay.core.concurrent.CancellationScope;
import com.yuubin.relay.core.connection.ChannelRole;
import com.yuubin.relay.core.exceptions.RelayException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Input side of the dispatch loop: one bounded request queue shared by both
 * pollers, one fault queue per role, and a semaphore that lets the single
 * consumer wait on all of them at once.
 * <p>
 * Every successful enqueue releases exactly one permit and every
 * {@code take*} call consumes one, so a consumer that acquires a permit will
 * find at least one item.
 * </p>
 */
public class DispatchInbox {

    private static final Logger log = LoggerFactory.getLogger(DispatchInbox.class);

    /** Pending faults kept per role; one is enough to trigger handling. */
    static final int FAULT_CAPACITY = 16;

    private final BlockingQueue<Request> requests;
    private final Map<ChannelRole, BlockingQueue<ChannelFault>> faults = new EnumMap<>(ChannelRole.class);
    private final Semaphore pending = new Semaphore(0);

    /**
     * Creates an inbox.
     * 
     * @param requestCapacity Capacity of the request queue; a full queue blocks
     *                        the producing poller.
     */
    public DispatchInbox(int requestCapacity) {
        this.requests = new ArrayBlockingQueue<>(requestCapacity);
        for (ChannelRole role : ChannelRole.values()) {
            faults.put(role, new LinkedBlockingQueue<>(FAULT_CAPACITY));
        }
    }

    /**
     * Offers a request, waiting up to the timeout for space.
     * 
     * @param request The request.
     * @param timeout Maximum time to wait for space.
     * @param unit    Unit of the timeout.
     * @return True if the request was queued.
     * @throws InterruptedException If interrupted while waiting.
     */
    public boolean offerRequest(Request request, long timeout, TimeUnit unit) throws InterruptedException {
        if (requests.offer(request, timeout, unit)) {
            pending.release();
            return true;
        }
        return false;
    }

    /**
     * Signals a fault that is not tied to a connection generation.
     * 
     * @param role  The faulted role.
     * @param fault The cause.
     */
    public void raise(ChannelRole role, RelayException fault) {
        raise(role, fault, null);
    }

    /**
     * Signals a fault for a role. Never blocks.
     * 
     * @param role   The faulted role.
     * @param fault  The cause.
     * @param origin Scope of the generation raising it; null if none.
     */
    public void raise(ChannelRole role, RelayException fault, CancellationScope origin) {
        if (faults.get(role).offer(new ChannelFault(fault, origin))) {
            pending.release();
        } else {
            log.warn("Dropping {} fault, {} already pending: {}", role.label(), FAULT_CAPACITY, fault.getMessage());
        }
    }

    /**
     * Waits until at least one item may be available.
     * 
     * @param timeout Maximum time to wait.
     * @param unit    Unit of the timeout.
     * @return True if a permit was acquired.
     * @throws InterruptedException If interrupted while waiting.
     */
    public boolean awaitPending(long timeout, TimeUnit unit) throws InterruptedException {
        return pending.tryAcquire(timeout, unit);
    }

    /**
     * Releases a spurious permit so a waiting consumer re-checks its state.
     */
    public void wakeUp() {
        pending.release();
    }

    /**
     * Removes the next fault of a role. Meant for a consumer that already
     * holds the permit from {@link #awaitPending}.
     * 
     * @param role The role.
     * @return The fault, or null if none is pending.
     */
    public ChannelFault pollFault(ChannelRole role) {
        return faults.get(role).poll();
    }

    /**
     * Removes the next request. Meant for a consumer that already holds the
     * permit from {@link #awaitPending}.
     * 
     * @return The request, or null if none is pending.
     */
    public Request pollRequest() {
        return requests.poll();
    }

    /**
     * Waits for the next fault of a role and consumes its permit.
     * 
     * @param role    The role.
     * @param timeout Maximum time to wait.
     * @param unit    Unit of the timeout.
     * @return The fault cause, or null on timeout.
     * @throws InterruptedException If interrupted while waiting.
     */
    public RelayException takeFault(ChannelRole role, long timeout, TimeUnit unit) throws InterruptedException {
        ChannelFault fault = faults.get(role).poll(timeout, unit);
        if (fault == null) {
            return null;
        }
        pending.tryAcquire();
        return fault.cause();
    }

    /**
     * Waits for the next request and consumes its permit.
     * 
     * @param timeout Maximum time to wait.
     * @param unit    Unit of the timeout.
     * @return The request, or null on timeout.
     * @throws InterruptedException If interrupted while waiting.
     */
    public Request takeRequest(long timeout, TimeUnit unit) throws InterruptedException {
        Request request = requests.poll(timeout, unit);
        if (request != null) {
            pending.tryAcquire();
        }
        return request;
    }

    public int pendingRequests() {
        return requests.size();
    }

    public int pendingFaults(ChannelRole role) {
        return faults.get(role).size();
    }
}
