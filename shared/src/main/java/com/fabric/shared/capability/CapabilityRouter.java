package com.fabric.shared.capability;

import com.fabric.shared.error.CapabilityNotFoundException;
import lombok.extern.slf4j.Slf4j;

import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Static intent type → saga table.
 *
 * Filled from {@link RealmModule}s during startup, then frozen. A duplicate registration is a
 * configuration error and fails startup.
 */
@Slf4j
public class CapabilityRouter {

    private final Map<IntentType, CapabilityRegistration> table = new EnumMap<>(IntentType.class);
    private volatile boolean frozen;

    public CapabilityRouter() {
    }

    public CapabilityRouter(List<RealmModule> realms) {
        realms.forEach(realm -> {
            realm.registerCapabilities(this);
            log.info("Realm registered: realm={}", realm.name());
        });
        freeze();
    }

    public synchronized void register(IntentType intentType, String realmName, SagaDefinition definition) {
        if (frozen) {
            throw new IllegalStateException("Capability table is frozen; cannot register " + intentType);
        }
        CapabilityRegistration existing = table.get(intentType);
        if (existing != null) {
            throw new IllegalStateException(String.format(
                    "Duplicate capability registration: intentType=%s, realm=%s, alreadyRegisteredBy=%s",
                    intentType, realmName, existing.getRealmName()));
        }
        table.put(intentType, new CapabilityRegistration(intentType, realmName, definition));
        log.info("Capability registered: intentType={}, realm={}, steps={}",
                intentType.wireName(), realmName, definition.stepCount());
    }

    public CapabilityRegistration resolve(IntentType intentType) {
        CapabilityRegistration registration = table.get(intentType);
        if (registration == null) {
            throw new CapabilityNotFoundException(intentType.wireName());
        }
        return registration;
    }

    public synchronized void freeze() {
        frozen = true;
    }

    public boolean isFrozen() {
        return frozen;
    }

    public Collection<CapabilityRegistration> registrations() {
        return List.copyOf(table.values());
    }
}
