package com.workforce.core.model;

/**
 * How the evaluation loop ended for a run.
 * CEILING_REACHED marks a deliverable returned after exhausting revisions, never a clean pass.
 */
public enum EvaluationOutcome {
    NOT_REVIEWED,
    PASSED,
    CEILING_REACHED
}
