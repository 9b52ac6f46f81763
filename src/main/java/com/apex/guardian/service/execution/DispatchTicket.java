package com.apex.guardian.service.execution;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Shared between the coordinator and one account's task. Whichever side moves first wins: the
 * coordinator cancels the account before its entry order is sent, or the account commits to the
 * entry and the coordinator has to report it.
 */
public final class DispatchTicket {

    enum State {
        PENDING,
        ENTERING,
        CANCELLED
    }

    private final AtomicReference<State> state = new AtomicReference<>(State.PENDING);
    private volatile String entryOrderId;

    /**
     * @return false when the coordinator already gave up on this account
     */
    boolean beginEntry() {
        return state.compareAndSet(State.PENDING, State.ENTERING);
    }

    void entryPlaced(String orderId) {
        this.entryOrderId = orderId;
    }

    /**
     * @return false when the entry order was already sent
     */
    boolean cancel() {
        return state.compareAndSet(State.PENDING, State.CANCELLED) || state.get() == State.CANCELLED;
    }

    boolean isCancelled() {
        return state.get() == State.CANCELLED;
    }

    String entryOrderId() {
        return entryOrderId;
    }
}
