package com.p14n.pgtopics.data;

/**
 * What the store did with an event whose subscriber failed.
 */
public enum FailAction {
    RETRYING,
    DEAD_LETTERED,
    FAILED;

    public String dbValue() {
        return name().toLowerCase();
    }
}
