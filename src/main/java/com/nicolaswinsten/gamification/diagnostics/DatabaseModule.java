package com.nicolaswinsten.gamification.diagnostics;

/**
 * An optional database integration. When no implementation is registered the probe reports
 * the module as missing; that is the normal state of the demo.
 */
public interface DatabaseModule {

    /** The configured handle, or {@code null} when the module is present but not initialised. */
    DatabaseHandle handle();
}
