package io.layoffs.cleaning;

/**
 * How absent key fields compare when looking for duplicates.
 */
public enum AbsentKeyMatching {
    /** Two absent values are equal, so rows that only differ in "unknown" fields collapse. */
    EQUAL,
    /** A key with any absent field never matches another key; such rows always survive. */
    DISTINCT
}
