package com.uptime.keeper.monitor.registry;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.NOT_FOUND)
public class TargetNotFoundException extends RuntimeException {
    public TargetNotFoundException(String targetId) {
        super("Target not found: " + targetId);
    }
}
