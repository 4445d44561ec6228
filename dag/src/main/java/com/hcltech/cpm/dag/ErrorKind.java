package com.hcltech.cpm.dag;

/** Why a schedule could not be produced. None of these are retryable. */
public enum ErrorKind {
    NOT_FOUND,
    DUPLICATE_IDENTIFIER,
    CYCLIC_DEPENDENCY,
    /** Internal consistency violation: a bug, not bad input. */
    BACKWARD_PASS_UNDERDETERMINED
}
