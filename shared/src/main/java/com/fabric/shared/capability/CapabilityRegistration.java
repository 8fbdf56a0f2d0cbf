package com.fabric.shared.capability;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@ToString(exclude = "definition")
public class CapabilityRegistration {

    private final IntentType intentType;
    private final String realmName;
    private final SagaDefinition definition;
}
