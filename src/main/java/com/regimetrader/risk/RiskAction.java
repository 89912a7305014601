package com.regimetrader.risk;

/** What the risk overlay did with a step's candidate order. */
public enum RiskAction {
    /** No candidate and no limit breach. */
    NO_ACTION,
    /** Candidate passed with an already valid quantity. */
    PASSED,
    /** Candidate passed after quantity normalization. */
    RESIZED,
    /** Candidate would breach the hard limit and inventory is within the safety buffer. */
    BLOCKED,
    /** Candidate would breach the hard limit; replaced with an unwind towards the buffer. */
    BLOCKED_UNWIND,
    /** No candidate but inventory already at the hard limit. */
    EMERGENCY_UNWIND
}
