package com.fabric.shared.error;

public class CapabilityNotFoundException extends PlatformException {

    private static final long serialVersionUID = 1L;

    public CapabilityNotFoundException(String intentType) {
        super(ErrorCode.CAPABILITY_NOT_FOUND, "No capability registered for intent type: " + intentType);
    }
}
