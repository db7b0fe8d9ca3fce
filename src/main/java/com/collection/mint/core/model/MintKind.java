package com.collection.mint.core.model;

/**
 * The path a batch of tokens was minted through.
 */
public enum MintKind {
    RESERVED,
    OG,
    WL,
    PUBLIC,
    OPERATOR
}
