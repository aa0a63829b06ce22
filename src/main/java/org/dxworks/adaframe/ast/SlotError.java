package org.dxworks.adaframe.ast;

/**
 * Why a {@link Slot} holds no value at all.
 */
public enum SlotError {
    /** The node's kind does not declare the requested field. */
    FIELD_NOT_APPLICABLE,
    /** Generic child access outside {@code [0, childCount)}. */
    INDEX_OUT_OF_RANGE
}
