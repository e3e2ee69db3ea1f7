package com.reputationscorer.stream.config;

/**
 * What to publish for a wallet whose activity has no "dexes" block.
 * A "dexes" block with no transactions is always scored (inactive) and is not governed by this policy.
 */
public enum MissingDexDataPolicy {
    /** Success envelope with zero zscore and no categories. */
    EMPTY_SUCCESS,
    /** Failure envelope with a "no dex data" error. */
    FAILURE
}
