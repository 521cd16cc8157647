package com.upgradegate.gate;

/**
 * Result of consulting the reviewer. A caller has to handle the failure
 * case explicitly; there is no way to read an opinion out of a failure.
 */
public sealed interface GateOutcome {

    /** The gate is switched off; the rule verdict stands. */
    record Disabled() implements GateOutcome {}

    record Reviewed(ReviewResponse response) implements GateOutcome {}

    record Failed(String cause) implements GateOutcome {}
}
