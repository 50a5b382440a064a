package com.example.migrationcompare.application;

/**
 * Receives progress from a running comparison. The engine never touches job state directly.
 */
public interface ProgressSink {

    /** Called once, right before the first input row is consumed. */
    void started();

    void phase(String message);

    /**
     * @param keysProcessed monotonically increasing count of aligned keys classified so far
     * @param estimatedTotal current estimate of the key count, {@code null} while unknown
     */
    void progress(long keysProcessed, Long estimatedTotal);

    ProgressSink NONE = new ProgressSink() {
        @Override
        public void started() {}

        @Override
        public void phase(String message) {}

        @Override
        public void progress(long keysProcessed, Long estimatedTotal) {}
    };
}
