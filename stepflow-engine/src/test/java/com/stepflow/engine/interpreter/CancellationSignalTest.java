package com.stepflow.engine.interpreter;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;

import static org.assertj.core.api.Assertions.*;

class CancellationSignalTest {

    @Test
    @DisplayName("Cancelling a parent cancels its children with the same reason")
    void testParentCancelsChildren() {
        CancellationSignal parent = new CancellationSignal();
        CancellationSignal child = parent.child();
        CancellationSignal grandChild = child.child();

        assertThat(parent.cancel(CancellationSignal.Reason.TIMEOUT)).isTrue();

        assertThat(child.isCancelled()).isTrue();
        assertThat(grandChild.reason()).isEqualTo(CancellationSignal.Reason.TIMEOUT);
    }

    @Test
    @DisplayName("Cancelling a child leaves the parent and siblings running")
    void testChildDoesNotCancelParent() {
        CancellationSignal parent = new CancellationSignal();
        CancellationSignal first = parent.child();
        CancellationSignal second = parent.child();

        first.cancel(CancellationSignal.Reason.ABORTED);

        assertThat(parent.isCancelled()).isFalse();
        assertThat(second.isCancelled()).isFalse();
    }

    @Test
    @DisplayName("Only the first cancel wins and listeners run once")
    void testCancelOnce() {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger calls = new AtomicInteger();
        signal.onCancel(calls::incrementAndGet);

        assertThat(signal.cancel(CancellationSignal.Reason.ABORTED)).isTrue();
        assertThat(signal.cancel(CancellationSignal.Reason.TIMEOUT)).isFalse();

        assertThat(calls.get()).isEqualTo(1);
        assertThat(signal.reason()).isEqualTo(CancellationSignal.Reason.ABORTED);
    }

    @Test
    @DisplayName("Listener registered after cancellation runs immediately")
    void testLateListener() {
        CancellationSignal signal = new CancellationSignal();
        signal.cancel(CancellationSignal.Reason.ABORTED);
        List<String> calls = new ArrayList<>();

        signal.onCancel(() -> calls.add("late"));

        assertThat(calls).containsExactly("late");
    }

    @Test
    @DisplayName("Removed listeners and detached children are not notified")
    void testRemoveAndDetach() {
        CancellationSignal parent = new CancellationSignal();
        CancellationSignal child = parent.child();
        AtomicInteger calls = new AtomicInteger();
        parent.onCancel(calls::incrementAndGet).remove();
        child.detach();

        parent.cancel(CancellationSignal.Reason.ABORTED);

        assertThat(calls.get()).isZero();
        assertThat(child.isCancelled()).isFalse();
    }

    @Test
    @DisplayName("A failing listener does not prevent the others from running")
    void testFailingListener() {
        CancellationSignal signal = new CancellationSignal();
        AtomicInteger calls = new AtomicInteger();
        signal.onCancel(() -> {
            throw new IllegalStateException("listener failure");
        });
        signal.onCancel(calls::incrementAndGet);

        signal.cancel(CancellationSignal.Reason.ABORTED);

        assertThat(calls.get()).isEqualTo(1);
    }
}
