package org.exquisite.model.enums;

/**
 * How the overlap strip of a reference mask is encoded.
 */
public enum MaskStyle {
    /** Overlap strip fully editable. */
    HARD,
    /** Linear ramp from preserve at the keep boundary to free at the seam. */
    RAMP
}
