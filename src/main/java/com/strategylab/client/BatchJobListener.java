package com.strategylab.client;

/** Callbacks from {@link BatchJobPoller}. Both run on the poller's scheduler thread. */
public interface BatchJobListener {

    /** Called after every successful merge, including the one that made the job terminal. */
    default void onUpdate(BatchJobMirror mirror) {
    }

    /** Called once when a mirror first reaches {@code finished} or {@code failed}. */
    default void onTerminal(BatchJobMirror mirror) {
    }
}
