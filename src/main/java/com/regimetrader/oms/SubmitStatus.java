package com.regimetrader.oms;

/** Outcome of {@link OrderLifecycleManager#submit}. */
public enum SubmitStatus {
    /** Sent to the exchange and resting locally. */
    ACCEPTED,
    /** Not sent: resting-order cap reached; oldest orders were cancelled to make room. */
    DEFERRED,
    /** Not sent: the gateway failed. */
    REJECTED
}
