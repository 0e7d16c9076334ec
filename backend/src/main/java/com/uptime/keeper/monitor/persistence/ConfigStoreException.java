package com.uptime.keeper.monitor.persistence;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.SERVICE_UNAVAILABLE)
public class ConfigStoreException extends RuntimeException {
    public ConfigStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
