package com.upgradegate.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.DecimalMax;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Bound once at startup from {@code upgrade-gate.*}.
 *
 * <p>Nothing outside the configuration classes reads this object; each
 * {@code @Configuration} converts its slice into an immutable value
 * ({@code PolicyStore}, {@code GateSettings}, ...) that is handed to the
 * components it builds.</p>
 */
@ConfigurationProperties(prefix = "upgrade-gate")
@Validated
public class UpgradeGateProperties {

    @Valid
    private PolicyProperties policy = new PolicyProperties();

    @Valid
    private Gate gate = new Gate();

    @Valid
    private Telemetry telemetry = new Telemetry();

    @Valid
    private Automation automation = new Automation();

    @Valid
    private Inventory inventory = new Inventory();

    public PolicyProperties getPolicy() {
        return policy;
    }

    public void setPolicy(PolicyProperties policy) {
        this.policy = policy;
    }

    public Gate getGate() {
        return gate;
    }

    public void setGate(Gate gate) {
        this.gate = gate;
    }

    public Telemetry getTelemetry() {
        return telemetry;
    }

    public void setTelemetry(Telemetry telemetry) {
        this.telemetry = telemetry;
    }

    public Automation getAutomation() {
        return automation;
    }

    public void setAutomation(Automation automation) {
        this.automation = automation;
    }

    public Inventory getInventory() {
        return inventory;
    }

    public void setInventory(Inventory inventory) {
        this.inventory = inventory;
    }

    public static class PolicyProperties {

        @Valid
        private Defaults defaults = new Defaults();

        @Valid
        private List<Rule> vendorRules = new ArrayList<>();

        /** Global upgrade window; devices with their own window override it. */
        @Valid
        private Window upgradeWindow;

        public Defaults getDefaults() {
            return defaults;
        }

        public void setDefaults(Defaults defaults) {
            this.defaults = defaults;
        }

        public List<Rule> getVendorRules() {
            return vendorRules;
        }

        public void setVendorRules(List<Rule> vendorRules) {
            this.vendorRules = vendorRules;
        }

        public Window getUpgradeWindow() {
            return upgradeWindow;
        }

        public void setUpgradeWindow(Window upgradeWindow) {
            this.upgradeWindow = upgradeWindow;
        }
    }

    public static class Defaults {

        @DecimalMin("0.0")
        @DecimalMax("100.0")
        private double maxCpuPercent = 70.0;

        @DecimalMin("0.0")
        @DecimalMax("100.0")
        private double minFreeMemPercent = 30.0;

        @Min(0)
        private int maxCriticalErrors = 0;

        private boolean blockIfCriticalErrors = true;

        /** Telemetry look-back, e.g. "2h". */
        @NotBlank
        private String window = "2h";

        private boolean requireMaintenanceWindow = false;

        private List<String> preChecks = new ArrayList<>();

        public double getMaxCpuPercent() {
            return maxCpuPercent;
        }

        public void setMaxCpuPercent(double maxCpuPercent) {
            this.maxCpuPercent = maxCpuPercent;
        }

        public double getMinFreeMemPercent() {
            return minFreeMemPercent;
        }

        public void setMinFreeMemPercent(double minFreeMemPercent) {
            this.minFreeMemPercent = minFreeMemPercent;
        }

        public int getMaxCriticalErrors() {
            return maxCriticalErrors;
        }

        public void setMaxCriticalErrors(int maxCriticalErrors) {
            this.maxCriticalErrors = maxCriticalErrors;
        }

        public boolean isBlockIfCriticalErrors() {
            return blockIfCriticalErrors;
        }

        public void setBlockIfCriticalErrors(boolean blockIfCriticalErrors) {
            this.blockIfCriticalErrors = blockIfCriticalErrors;
        }

        public String getWindow() {
            return window;
        }

        public void setWindow(String window) {
            this.window = window;
        }

        public boolean isRequireMaintenanceWindow() {
            return requireMaintenanceWindow;
        }

        public void setRequireMaintenanceWindow(boolean requireMaintenanceWindow) {
            this.requireMaintenanceWindow = requireMaintenanceWindow;
        }

        public List<String> getPreChecks() {
            return preChecks;
        }

        public void setPreChecks(List<String> preChecks) {
            this.preChecks = preChecks;
        }
    }

    /**
     * Vendor/model policy row. Unset thresholds fall back to {@link Defaults}.
     */
    public static class Rule {

        @NotBlank
        private String vendor;

        @NotBlank
        private String model;

        private Double maxCpuPercent;
        private Double minFreeMemPercent;
        private Integer maxCriticalErrors;
        private Boolean blockIfCriticalErrors;
        private boolean compatibilityCheck;
        private Integer minimumMemoryMb;
        private Integer bootflashRequirementMb;

        public String getVendor() {
            return vendor;
        }

        public void setVendor(String vendor) {
            this.vendor = vendor;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public Double getMaxCpuPercent() {
            return maxCpuPercent;
        }

        public void setMaxCpuPercent(Double maxCpuPercent) {
            this.maxCpuPercent = maxCpuPercent;
        }

        public Double getMinFreeMemPercent() {
            return minFreeMemPercent;
        }

        public void setMinFreeMemPercent(Double minFreeMemPercent) {
            this.minFreeMemPercent = minFreeMemPercent;
        }

        public Integer getMaxCriticalErrors() {
            return maxCriticalErrors;
        }

        public void setMaxCriticalErrors(Integer maxCriticalErrors) {
            this.maxCriticalErrors = maxCriticalErrors;
        }

        public Boolean getBlockIfCriticalErrors() {
            return blockIfCriticalErrors;
        }

        public void setBlockIfCriticalErrors(Boolean blockIfCriticalErrors) {
            this.blockIfCriticalErrors = blockIfCriticalErrors;
        }

        public boolean isCompatibilityCheck() {
            return compatibilityCheck;
        }

        public void setCompatibilityCheck(boolean compatibilityCheck) {
            this.compatibilityCheck = compatibilityCheck;
        }

        public Integer getMinimumMemoryMb() {
            return minimumMemoryMb;
        }

        public void setMinimumMemoryMb(Integer minimumMemoryMb) {
            this.minimumMemoryMb = minimumMemoryMb;
        }

        public Integer getBootflashRequirementMb() {
            return bootflashRequirementMb;
        }

        public void setBootflashRequirementMb(Integer bootflashRequirementMb) {
            this.bootflashRequirementMb = bootflashRequirementMb;
        }
    }

    public static class Window {

        @Min(0)
        @Max(23)
        private int startHour = 0;

        @Min(1)
        @Max(24)
        private int endHour = 24;

        /** Day names, e.g. "saturday". Empty means every day. */
        private List<String> allowedDays = new ArrayList<>();

        private String zone = "UTC";

        public int getStartHour() {
            return startHour;
        }

        public void setStartHour(int startHour) {
            this.startHour = startHour;
        }

        public int getEndHour() {
            return endHour;
        }

        public void setEndHour(int endHour) {
            this.endHour = endHour;
        }

        public List<String> getAllowedDays() {
            return allowedDays;
        }

        public void setAllowedDays(List<String> allowedDays) {
            this.allowedDays = allowedDays;
        }

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }
    }

    public static class Gate {

        /** When false, the rule verdict passes through unmodified. */
        private boolean enabled = false;

        private String url = "http://localhost:8090/v1/review";

        private String model = "";

        private Duration timeout = Duration.ofSeconds(20);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Telemetry {

        /** Shared deadline for the three health reads. */
        private Duration timeout = Duration.ofSeconds(10);

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Automation {

        private String ansibleDir = "ansible";
        private String inventoryFile = "inventory.ini";
        private String upgradePlaybook = "upgrade.yml";
        private String rollbackPlaybook = "rollback.yml";
        private Duration timeout = Duration.ofMinutes(5);

        public String getAnsibleDir() {
            return ansibleDir;
        }

        public void setAnsibleDir(String ansibleDir) {
            this.ansibleDir = ansibleDir;
        }

        public String getInventoryFile() {
            return inventoryFile;
        }

        public void setInventoryFile(String inventoryFile) {
            this.inventoryFile = inventoryFile;
        }

        public String getUpgradePlaybook() {
            return upgradePlaybook;
        }

        public void setUpgradePlaybook(String upgradePlaybook) {
            this.upgradePlaybook = upgradePlaybook;
        }

        public String getRollbackPlaybook() {
            return rollbackPlaybook;
        }

        public void setRollbackPlaybook(String rollbackPlaybook) {
            this.rollbackPlaybook = rollbackPlaybook;
        }

        public Duration getTimeout() {
            return timeout;
        }

        public void setTimeout(Duration timeout) {
            this.timeout = timeout;
        }
    }

    public static class Inventory {

        @Valid
        private List<DeviceEntry> devices = new ArrayList<>();

        @Valid
        private List<Rule> policies = new ArrayList<>();

        public List<DeviceEntry> getDevices() {
            return devices;
        }

        public void setDevices(List<DeviceEntry> devices) {
            this.devices = devices;
        }

        public List<Rule> getPolicies() {
            return policies;
        }

        public void setPolicies(List<Rule> policies) {
            this.policies = policies;
        }
    }

    public static class DeviceEntry {

        @NotBlank
        private String id;

        private String hostname;
        private String mgmtAddress;

        @NotBlank
        private String vendor;

        @NotBlank
        private String model;

        @NotBlank
        private String currentVersion;

        private String targetVersion;

        @Valid
        private Window maintenanceWindow;

        private String notes;

        public String getId() {
            return id;
        }

        public void setId(String id) {
            this.id = id;
        }

        public String getHostname() {
            return hostname;
        }

        public void setHostname(String hostname) {
            this.hostname = hostname;
        }

        public String getMgmtAddress() {
            return mgmtAddress;
        }

        public void setMgmtAddress(String mgmtAddress) {
            this.mgmtAddress = mgmtAddress;
        }

        public String getVendor() {
            return vendor;
        }

        public void setVendor(String vendor) {
            this.vendor = vendor;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getCurrentVersion() {
            return currentVersion;
        }

        public void setCurrentVersion(String currentVersion) {
            this.currentVersion = currentVersion;
        }

        public String getTargetVersion() {
            return targetVersion;
        }

        public void setTargetVersion(String targetVersion) {
            this.targetVersion = targetVersion;
        }

        public Window getMaintenanceWindow() {
            return maintenanceWindow;
        }

        public void setMaintenanceWindow(Window maintenanceWindow) {
            this.maintenanceWindow = maintenanceWindow;
        }

        public String getNotes() {
            return notes;
        }

        public void setNotes(String notes) {
            this.notes = notes;
        }
    }
}
