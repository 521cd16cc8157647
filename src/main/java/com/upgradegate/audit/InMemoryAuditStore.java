package com.upgradegate.audit;

import com.upgradegate.policy.Verdict;
import com.upgradegate.upgrade.AttemptKind;
import com.upgradegate.upgrade.UpgradeMode;
import com.upgradegate.upgrade.UpgradeRecord;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

@Component
public class InMemoryAuditStore implements AuditStore {

    private final CopyOnWriteArrayList<AuditEvent> events = new CopyOnWriteArrayList<>();
    private final AtomicLong sequence = new AtomicLong(0);

    private final ConcurrentHashMap<String, UpgradeRecord> attempts = new ConcurrentHashMap<>();
    private final CopyOnWriteArrayList<String> attemptOrder = new CopyOnWriteArrayList<>();

    @Override
    public UpgradeRecord createAttempt(String deviceId, AttemptKind kind, UpgradeMode mode,
                                       Verdict verdict, Instant createdAt) {
        String attemptId = "att-" + UUID.randomUUID();
        UpgradeRecord record = UpgradeRecord.pending(attemptId, deviceId, kind, mode, verdict, createdAt);
        attempts.put(attemptId, record);
        attemptOrder.add(attemptId);
        return record;
    }

    @Override
    public void updateStatus(UpgradeRecord record) {
        attempts.compute(record.attemptId(), (id, stored) -> {
            if (stored == null) {
                throw new AuditStoreException("unknown attempt " + id);
            }
            if (!stored.kind().allows(stored.status(), record.status())) {
                throw new IllegalStateException("attempt " + id + " is " + stored.status().getValue()
                    + ", refusing to store " + record.status().getValue());
            }
            return record;
        });
    }

    @Override
    public AuditEvent appendEvent(String deviceId, String attemptId, String eventName,
                                  Map<String, Object> payload, Instant occurredAt) {
        // sequence and add under one lock so the list stays in sequence order
        synchronized (events) {
            AuditEvent event = new AuditEvent(sequence.incrementAndGet(), deviceId, attemptId, eventName,
                payload == null ? Map.of() : Collections.unmodifiableMap(payload), occurredAt);
            events.add(event);
            return event;
        }
    }

    @Override
    public Optional<UpgradeRecord> findAttempt(String attemptId) {
        return Optional.ofNullable(attempts.get(attemptId));
    }

    @Override
    public List<UpgradeRecord> attempts(String deviceId) {
        return attemptOrder.stream()
            .map(attempts::get)
            .filter(r -> r != null && deviceId.equals(r.deviceId()))
            .collect(Collectors.toCollection(ArrayList::new));
    }

    @Override
    public List<AuditEvent> events(String deviceId, int limit) {
        if (limit <= 0) {
            return Collections.emptyList();
        }
        List<AuditEvent> matching = events.stream()
            .filter(e -> deviceId.equals(e.deviceId()))
            .collect(Collectors.toCollection(ArrayList::new));
        return matching.size() <= limit
            ? matching
            : new ArrayList<>(matching.subList(matching.size() - limit, matching.size()));
    }

    @Override
    public long latestSequence() {
        return sequence.get();
    }
}
