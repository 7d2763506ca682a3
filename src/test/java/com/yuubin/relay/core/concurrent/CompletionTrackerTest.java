package com.yuubin.relay.core.concurrent;

import org.junit.jupiter.api.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CompletionTrackerTest {

    @Test
    void awaitIdle_waitsForEveryBegin() throws Exception {
        CompletionTracker tracker = new CompletionTracker();
        tracker.begin();
        tracker.begin();

        assertThat(tracker.awaitIdle(10, TimeUnit.MILLISECONDS)).isFalse();

        CompletableFuture.runAsync(() -> {
            tracker.done();
            tracker.done();
        });

        assertThat(tracker.awaitIdle(2, TimeUnit.SECONDS)).isTrue();
        assertThat(tracker.getActive()).isZero();
    }

    @Test
    void awaitIdle_onIdleTracker_returnsImmediately() throws Exception {
        assertThat(new CompletionTracker().awaitIdle(0, TimeUnit.MILLISECONDS)).isTrue();
    }

    @Test
    void done_withoutBegin_fails() {
        assertThatThrownBy(() -> new CompletionTracker().done()).isInstanceOf(IllegalStateException.class);
    }
}
