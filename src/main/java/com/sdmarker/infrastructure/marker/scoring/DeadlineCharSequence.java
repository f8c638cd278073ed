package com.sdmarker.infrastructure.marker.scoring;

import com.sdmarker.domain.marker.exception.MarkerMatchTimeoutException;

/**
 * CharSequence view that aborts a running regex once its deadline has passed.
 * java.util.regex reads the input only through charAt, so runaway backtracking hits the check.
 */
final class DeadlineCharSequence implements CharSequence {

    private final CharSequence delegate;
    private final long deadlineNanos;
    private final String pattern;
    private final long timeoutMillis;

    private DeadlineCharSequence(CharSequence delegate, long deadlineNanos, String pattern, long timeoutMillis) {
        this.delegate = delegate;
        this.deadlineNanos = deadlineNanos;
        this.pattern = pattern;
        this.timeoutMillis = timeoutMillis;
    }

    /**
     * Wrap the text for one match run of the given pattern. A non-positive timeout disables the guard.
     */
    static CharSequence guard(CharSequence text, String pattern, long timeoutMillis) {
        if (timeoutMillis <= 0) {
            return text;
        }
        return new DeadlineCharSequence(text, System.nanoTime() + timeoutMillis * 1_000_000L, pattern, timeoutMillis);
    }

    @Override
    public char charAt(int index) {
        if (System.nanoTime() - deadlineNanos > 0) {
            throw new MarkerMatchTimeoutException(pattern, timeoutMillis);
        }
        return delegate.charAt(index);
    }

    @Override
    public int length() {
        return delegate.length();
    }

    @Override
    public CharSequence subSequence(int start, int end) {
        return new DeadlineCharSequence(delegate.subSequence(start, end), deadlineNanos, pattern, timeoutMillis);
    }

    @Override
    public String toString() {
        return delegate.toString();
    }
}
