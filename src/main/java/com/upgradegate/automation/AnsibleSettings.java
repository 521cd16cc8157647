package com.upgradegate.automation;

import java.nio.file.Path;
import java.time.Duration;

public record AnsibleSettings(
    Path ansibleDir,
    String inventoryFile,
    String upgradePlaybook,
    String rollbackPlaybook,
    Duration timeout
) {
}
