package com.workforce.core.protocol;

/**
 * Reviewer decision on a deliverable.
 */
public enum Verdict {
    PASS,
    REVISE
}
