package com.uptime.keeper.monitor.provider;

import com.uptime.keeper.monitor.model.ProviderType;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Component
public class HostingProviderRegistry {
    private final Map<ProviderType, HostingProvider> providers = new EnumMap<>(ProviderType.class);

    public HostingProviderRegistry(List<HostingProvider> providers) {
        for (HostingProvider provider : providers) {
            HostingProvider previous = this.providers.put(provider.type(), provider);
            if (previous != null) {
                throw new IllegalStateException("Duplicate hosting provider for " + provider.type());
            }
        }
    }

    public Optional<HostingProvider> forType(ProviderType type) {
        return type == null ? Optional.empty() : Optional.ofNullable(providers.get(type));
    }
}
