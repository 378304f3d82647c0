package com.rowguard.backend;

import com.rowguard.transform.TransformCandidate;
import com.rowguard.validation.ValidationOutcome;

/**
 * Deep check performed by the native backend on a candidate transform, after the
 * candidate's own local checks passed.
 *
 * <p>May throw {@link com.rowguard.exception.NotSupportedException}, which the dispatch
 * converts into a fallback tag.
 */
@FunctionalInterface
public interface NativeValidator {

    /** Accepts every candidate. */
    NativeValidator ACCEPT_ALL = candidate -> ValidationOutcome.passed();

    ValidationOutcome validate(TransformCandidate candidate);
}
