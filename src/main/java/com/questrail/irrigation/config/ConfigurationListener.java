package com.questrail.irrigation.config;

import java.util.Set;

/**
 * Notified after a configuration mutation has been applied.
 *
 * <p>Called on the mutating thread, outside of the configuration lock. Used to
 * persist settings (the engine writes back ET values every time it accrues or
 * debits them).</p>
 */
@FunctionalInterface
public interface ConfigurationListener
{
    /**
     * @param changedKeys form keys (see {@link ControllerConfiguration#asMap()}) whose values changed
     */
    void onConfigurationChanged(ControllerConfiguration configuration, Set<String> changedKeys);
}
