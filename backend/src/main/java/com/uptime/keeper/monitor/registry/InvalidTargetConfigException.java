package com.uptime.keeper.monitor.registry;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

import java.util.List;

@ResponseStatus(HttpStatus.BAD_REQUEST)
public class InvalidTargetConfigException extends RuntimeException {
    private final List<String> problems;

    public InvalidTargetConfigException(List<String> problems) {
        super("Invalid target configuration: " + String.join("; ", problems));
        this.problems = List.copyOf(problems);
    }

    public List<String> getProblems() {
        return problems;
    }
}
