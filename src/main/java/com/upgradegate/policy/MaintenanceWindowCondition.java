package com.upgradegate.policy;

import com.upgradegate.inventory.MaintenanceWindow;

/**
 * The evaluation time must fall inside the device's maintenance window, or
 * the policy's global window when the device has none. With no window at
 * all the condition passes unless the policy requires one.
 */
public class MaintenanceWindowCondition implements UpgradeCondition {

    @Override
    public String conditionId() {
        return "maintenance_window";
    }

    @Override
    public ConditionOutcome evaluate(EvaluationContext context) {
        MaintenanceWindow deviceWindow = context.device().maintenanceWindow();
        MaintenanceWindow window = deviceWindow != null ? deviceWindow : context.policy().upgradeWindow();

        if (window == null) {
            boolean required = context.policy().requireMaintenanceWindow();
            return new ConditionOutcome(conditionId(), "Maintenance window",
                "none configured",
                required ? "a window is required" : "no window restriction",
                !required);
        }

        boolean inside = window.contains(context.evaluatedAt());
        return new ConditionOutcome(conditionId(), "Maintenance window",
            (inside ? "inside " : "outside ") + (deviceWindow != null ? "device window" : "global window"),
            window.describe(),
            inside);
    }
}
