package com.work.lock.worker.web.dto;

public class LockStatusResponse {

    private final String key;
    private final boolean locked;
    private final String instanceId;
    private final boolean degraded;

    public LockStatusResponse(String key, boolean locked, String instanceId, boolean degraded) {
        this.key = key;
        this.locked = locked;
        this.instanceId = instanceId;
        this.degraded = degraded;
    }

    public String getKey() {
        return key;
    }

    public boolean isLocked() {
        return locked;
    }

    public String getInstanceId() {
        return instanceId;
    }

    public boolean isDegraded() {
        return degraded;
    }
}
