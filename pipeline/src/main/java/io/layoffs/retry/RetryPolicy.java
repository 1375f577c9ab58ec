package io.layoffs.retry;

public interface RetryPolicy {
    RetryPolicy NEVER = new RetryPolicy() {
        @Override public boolean shouldRetry(int attempt, Exception e) { return false; }
        @Override public long backoffMillis(int attempt) { return 0; }
    };

    boolean shouldRetry(int attempt, Exception e);

    long backoffMillis(int attempt);
}
