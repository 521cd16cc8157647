package com.upgradegate.api;

import com.upgradegate.audit.AuditEvent;
import com.upgradegate.audit.DeviceHistory;
import com.upgradegate.upgrade.Decision;
import com.upgradegate.upgrade.UpgradeGateService;
import com.upgradegate.upgrade.UpgradeMode;
import com.upgradegate.upgrade.UpgradeRecord;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/v1/devices/{deviceId}")
public class DeviceUpgradeController {

    private final UpgradeGateService upgradeGateService;

    public DeviceUpgradeController(UpgradeGateService upgradeGateService) {
        this.upgradeGateService = upgradeGateService;
    }

    @PostMapping("/evaluate")
    public Decision evaluate(@PathVariable String deviceId) {
        return upgradeGateService.evaluate(deviceId);
    }

    /**
     * Defaults to {@code plan_only}; real execution must be asked for explicitly.
     */
    @PostMapping("/upgrade")
    public UpgradeRecord upgrade(@PathVariable String deviceId,
                                 @RequestParam(defaultValue = "plan_only") String mode) {
        return upgradeGateService.upgrade(deviceId, UpgradeMode.fromValue(mode));
    }

    @PostMapping("/rollback")
    public UpgradeRecord rollback(@PathVariable String deviceId) {
        return upgradeGateService.rollback(deviceId);
    }

    @GetMapping("/attempts")
    public List<UpgradeRecord> attempts(@PathVariable String deviceId) {
        return upgradeGateService.attempts(deviceId);
    }

    @GetMapping("/audit")
    public List<AuditEvent> audit(@PathVariable String deviceId,
                                  @RequestParam(defaultValue = "100") int limit) {
        return upgradeGateService.auditTrail(deviceId, Math.min(limit, 1000));
    }

    @GetMapping("/history")
    public ResponseEntity<DeviceHistory> history(@PathVariable String deviceId) {
        return upgradeGateService.history(deviceId)
            .map(ResponseEntity::ok)
            .orElse(ResponseEntity.notFound().build());
    }
}
