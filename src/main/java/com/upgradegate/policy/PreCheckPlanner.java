package com.upgradegate.policy;

import com.upgradegate.inventory.PolicyRule;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Derives the checks the dry-run precheck must perform: the global list
 * followed by whatever the matching vendor rule demands, without duplicates.
 */
public class PreCheckPlanner {

    public static final String FIRMWARE_COMPATIBILITY = "firmware_compatibility_check";
    public static final String MEMORY_REQUIREMENTS = "memory_requirements_check";
    public static final String BOOTFLASH_SPACE = "bootflash_space_check";

    public List<String> plan(List<String> globalChecks, PolicyRule vendorRule) {
        Set<String> checks = new LinkedHashSet<>(globalChecks);
        if (vendorRule != null) {
            if (vendorRule.compatibilityCheck()) {
                checks.add(FIRMWARE_COMPATIBILITY);
            }
            if (vendorRule.minimumMemoryMb() != null) {
                checks.add(MEMORY_REQUIREMENTS);
            }
            if (vendorRule.bootflashRequirementMb() != null) {
                checks.add(BOOTFLASH_SPACE);
            }
        }
        return List.copyOf(new ArrayList<>(checks));
    }
}
