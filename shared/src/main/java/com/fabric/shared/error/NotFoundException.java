package com.fabric.shared.error;

/**
 * A tenant-scoped lookup found nothing. Records owned by another tenant also end up here.
 */
public class NotFoundException extends PlatformException {

    private static final long serialVersionUID = 1L;

    public NotFoundException(String kind, String id) {
        super(ErrorCode.NOT_FOUND, kind + " not found: " + id);
    }
}
