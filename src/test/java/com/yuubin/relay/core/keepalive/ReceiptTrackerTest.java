package com.yuubin.relay.core.keepalive;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReceiptTrackerTest {

    @Test
    void last_neverMovesBackwards() {
        ReceiptTracker receipts = new ReceiptTracker();
        assertThat(receipts.last()).isEmpty();

        receipts.record(50);
        receipts.record(20);

        assertThat(receipts.last()).hasValue(50);
    }

    @Test
    void record_acceptsNegativeMonotonicTimes() {
        ReceiptTracker receipts = new ReceiptTracker();
        receipts.record(-10);

        assertThat(receipts.last()).hasValue(-10);
    }
}
