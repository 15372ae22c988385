package com.phillippitts.vani.testutil;

import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs speech tasks inline on the caller and counts them, so a test can tell
 * whether a reply was handed to the speaker at all.
 */
public class SyncExecutor implements Executor {

    private final AtomicInteger executed = new AtomicInteger();

    @Override
    public void execute(Runnable command) {
        executed.incrementAndGet();
        command.run();
    }

    public int executedCount() {
        return executed.get();
    }
}
