package com.uptime.keeper.monitor.registry;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.CONFLICT)
public class DuplicateTargetException extends RuntimeException {
    public DuplicateTargetException(String targetId) {
        super("Target already registered: " + targetId);
    }
}
