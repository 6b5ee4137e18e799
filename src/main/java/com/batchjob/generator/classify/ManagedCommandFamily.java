package com.batchjob.generator.classify;

/**
 * Refinement of {@link LineCategory#MANAGED_COMMAND}.
 */
public enum ManagedCommandFamily {

    /**
     * dbcheck, dchain, keybuild, pexport: wrapped in the retry scaffold.
     */
    RETRYABLE,

    /**
     * Single import: retry when importing one file, fail fast on a comma separated list.
     */
    PIMPORT,

    /**
     * Everything else under the processing root, checked by return code column.
     */
    BALANCE_TEST
}
