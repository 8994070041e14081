package org.exquisite.model.enums;

public enum MaskClass {
    MUST_PRESERVE,
    FREELY_EDITABLE,
    GRADED;

    public static MaskClass of(int maskValue) {
        if (maskValue >= 255) {
            return MUST_PRESERVE;
        }
        if (maskValue <= 0) {
            return FREELY_EDITABLE;
        }
        return GRADED;
    }
}
