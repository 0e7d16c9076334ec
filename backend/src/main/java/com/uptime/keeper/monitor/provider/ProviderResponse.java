package com.uptime.keeper.monitor.provider;

public record ProviderResponse(
    Kind kind,
    Integer statusCode,
    String message
) {
    public enum Kind {
        ACCEPTED,
        RATE_LIMITED,
        ERROR
    }

    public static ProviderResponse accepted(int statusCode) {
        return new ProviderResponse(Kind.ACCEPTED, statusCode, null);
    }

    public static ProviderResponse rateLimited(int statusCode) {
        return new ProviderResponse(Kind.RATE_LIMITED, statusCode, "provider_rate_limited");
    }

    public static ProviderResponse error(Integer statusCode, String message) {
        return new ProviderResponse(Kind.ERROR, statusCode, message);
    }

    public static ProviderResponse fromStatus(int statusCode) {
        if (statusCode >= 200 && statusCode < 300) {
            return accepted(statusCode);
        }
        if (statusCode == 429) {
            return rateLimited(statusCode);
        }
        return error(statusCode, "http_" + statusCode);
    }
}
