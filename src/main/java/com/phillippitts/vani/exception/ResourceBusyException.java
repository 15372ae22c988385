package com.phillippitts.vani.exception;

/**
 * An exclusive device (microphone, camera) stayed held by another capture past the wait timeout.
 */
public class ResourceBusyException extends VaniException {

    private final String resourceName;

    public ResourceBusyException(String resourceName, long timeoutMs) {
        super(resourceName + " busy after " + timeoutMs + "ms wait");
        this.resourceName = resourceName;
    }

    public String getResourceName() {
        return resourceName;
    }
}
