package com.recoveryplatform.common.model;

/**
 * Why a score component degraded to an incomplete value.
 *
 * <p>Neither case is an error in the exception sense: the component scores 0,
 * its completeness flag is false, and the composite is marked partial.
 */
public enum DataGap {
    /** A required metric has no sample for the scored day. */
    MISSING_SAMPLE,
    /** The personal baseline window is under-covered. */
    INSUFFICIENT_BASELINE
}
