package com.upgradegate.policy;

/**
 * A single deterministic readiness check. Conditions never call external
 * systems and never throw for missing metrics; an absent value is judged
 * at its least favourable level.
 */
public interface UpgradeCondition {

    /** Stable identifier, e.g. "cpu". */
    String conditionId();

    ConditionOutcome evaluate(EvaluationContext context);
}
