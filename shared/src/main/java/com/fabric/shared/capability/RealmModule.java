package com.fabric.shared.capability;

/**
 * Plug-in point for domain realms. Every realm bean is asked once at startup to register
 * its sagas; the router table is frozen afterwards.
 */
public interface RealmModule {

    String name();

    void registerCapabilities(CapabilityRouter router);
}
