package com.phillippitts.mathspeech.service.transform;

import com.phillippitts.mathspeech.exception.ConversionTimeoutException;

/**
 * CharSequence view that aborts regular expression evaluation once a deadline passes.
 *
 * <p>{@link java.util.regex.Matcher} reads its input only through {@link #charAt}, so a
 * backtracking pattern keeps calling it. The clock is sampled every {@value #CHECK_INTERVAL}
 * reads.
 */
final class DeadlineCharSequence implements CharSequence {

    static final int CHECK_INTERVAL = 1024;

    private final CharSequence delegate;
    private final long deadlineNanos;
    private final long timeoutMs;
    private final String ruleId;
    private int reads;

    DeadlineCharSequence(CharSequence delegate, long deadlineNanos, long timeoutMs, String ruleId) {
        this.delegate = delegate;
        this.deadlineNanos = deadlineNanos;
        this.timeoutMs = timeoutMs;
        this.ruleId = ruleId;
    }

    @Override
    public char charAt(int index) {
        if (++reads >= CHECK_INTERVAL) {
            reads = 0;
            checkDeadline();
        }
        return delegate.charAt(index);
    }

    @Override
    public int length() {
        return delegate.length();
    }

    @Override
    public CharSequence subSequence(int start, int end) {
        return delegate.subSequence(start, end);
    }

    @Override
    public String toString() {
        return delegate.toString();
    }

    void checkDeadline() {
        if (System.nanoTime() - deadlineNanos > 0) {
            throw new ConversionTimeoutException(timeoutMs, ruleId);
        }
    }
}
