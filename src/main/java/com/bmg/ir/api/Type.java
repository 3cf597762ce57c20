package com.bmg.ir.api;

/**
 * The kind of result a node produces.
 */
public enum Type {
    /** No value. The result of an observation or query node. */
    NONE,
    /** A scalar real value. */
    REAL,
    /** A distribution of real values. */
    DISTRIBUTION
}
