package com.refactorguard.transform;

/**
 * How the conditional-chain rule wraps a branch body that is not a single
 * expression statement into a callable.
 */
public enum BranchBodyPolicy {
    /**
     * Lossy: the body becomes the no-op {@code () -> {}} and its statements are
     * dropped. The rewrite carries a note naming what was lost.
     */
    PLACEHOLDER,
    /** Decline the whole chain. */
    REJECT,
    /**
     * Wrap the full statement sequence in a block lambda. Declines bodies that
     * jump out of the branch or assign locals declared outside it.
     */
    CLOSURE
}
