package com.upgradegate.support;

import com.upgradegate.audit.AuditEvent;
import com.upgradegate.audit.AuditStoreException;
import com.upgradegate.audit.InMemoryAuditStore;
import com.upgradegate.policy.Verdict;
import com.upgradegate.upgrade.AttemptKind;
import com.upgradegate.upgrade.UpgradeMode;
import com.upgradegate.upgrade.UpgradeRecord;
import com.upgradegate.upgrade.UpgradeStatus;

import java.time.Instant;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * In-memory audit store that can be told to fail specific writes.
 */
public class FlakyAuditStore extends InMemoryAuditStore {

    private volatile boolean failCreate;
    private volatile String failEvent;
    private final Set<UpgradeStatus> failStatuses = EnumSet.noneOf(UpgradeStatus.class);
    private final List<UpgradeStatus> storedStatuses = new CopyOnWriteArrayList<>();

    public FlakyAuditStore failCreate() {
        failCreate = true;
        return this;
    }

    public synchronized FlakyAuditStore failStatus(UpgradeStatus status) {
        failStatuses.add(status);
        return this;
    }

    public FlakyAuditStore failEvent(String eventName) {
        failEvent = eventName;
        return this;
    }

    public synchronized void heal() {
        failCreate = false;
        failEvent = null;
        failStatuses.clear();
    }

    @Override
    public UpgradeRecord createAttempt(String deviceId, AttemptKind kind, UpgradeMode mode,
                                       Verdict verdict, Instant createdAt) {
        if (failCreate) {
            throw new AuditStoreException("database is read-only");
        }
        return super.createAttempt(deviceId, kind, mode, verdict, createdAt);
    }

    @Override
    public void updateStatus(UpgradeRecord record) {
        synchronized (this) {
            if (failStatuses.contains(record.status())) {
                throw new AuditStoreException("lost connection while writing " + record.status().getValue());
            }
        }
        super.updateStatus(record);
        storedStatuses.add(record.status());
    }

    /** Every status successfully written, in write order. */
    public List<UpgradeStatus> storedStatuses() {
        return List.copyOf(storedStatuses);
    }

    @Override
    public AuditEvent appendEvent(String deviceId, String attemptId, String eventName,
                                  Map<String, Object> payload, Instant occurredAt) {
        if (eventName.equals(failEvent)) {
            throw new AuditStoreException("lost connection while appending " + eventName);
        }
        return super.appendEvent(deviceId, attemptId, eventName, payload, occurredAt);
    }
}
