package com.measure.compiler.model;

public final class ReviewProgress {
    private final int total;
    private final int approved;
    private final int pending;
    private final int flagged;

    public ReviewProgress(int total, int approved, int pending, int flagged) {
        this.total = total;
        this.approved = approved;
        this.pending = pending;
        this.flagged = flagged;
    }

    /**
     * Fresh counters: everything pending.
     */
    public static ReviewProgress allPending(int total) {
        return new ReviewProgress(total, 0, total, 0);
    }

    public int getTotal() {
        return total;
    }

    public int getApproved() {
        return approved;
    }

    public int getPending() {
        return pending;
    }

    public int getFlagged() {
        return flagged;
    }

    public boolean isComplete() {
        return total > 0 && approved == total;
    }
}
