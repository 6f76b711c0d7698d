package org.schemaforge.error;

import lombok.Getter;
import org.schemaforge.render.Platform;

@Getter
public class UnsupportedCapabilityException extends SchemaForgeException {

    private final Platform platform;
    private final String capability;

    public UnsupportedCapabilityException(Platform platform, String capability, String detail) {
        super(platform.token() + " does not support " + capability + (detail == null ? "" : ": " + detail));
        this.platform = platform;
        this.capability = capability;
    }
}
