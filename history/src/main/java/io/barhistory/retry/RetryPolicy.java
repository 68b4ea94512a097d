package io.barhistory.retry;

public interface RetryPolicy {
    boolean shouldRetry(int attempt, Exception e);
    long backoffMillis(int attempt);

    RetryPolicy NEVER = new RetryPolicy() {
        @Override public boolean shouldRetry(int attempt, Exception e) { return false; }
        @Override public long backoffMillis(int attempt) { return 0; }
    };
}
