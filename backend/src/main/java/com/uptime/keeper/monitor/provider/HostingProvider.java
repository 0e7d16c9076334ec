package com.uptime.keeper.monitor.provider;

import com.uptime.keeper.monitor.model.ProviderType;
import com.uptime.keeper.monitor.model.Target;

/**
 * Triggers a redeploy of a target on its hosting platform. Implementations report
 * transport failures as {@link ProviderResponse.Kind#ERROR} rather than throwing.
 */
public interface HostingProvider {

    ProviderType type();

    ProviderResponse redeploy(Target target);
}
