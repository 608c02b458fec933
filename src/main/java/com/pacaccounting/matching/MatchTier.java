package com.pacaccounting.matching;

/**
 * Strategy that resolved a company name against the ledger, in the order they are tried.
 */
public enum MatchTier {
    EXACT,
    TOKEN_INCLUSION,
    FUZZY,
    NONE
}
