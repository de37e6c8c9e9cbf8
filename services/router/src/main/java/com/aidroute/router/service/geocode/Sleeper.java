// =============================================================================
// AidRoute - Sleeper
// =============================================================================
package com.aidroute.router.service.geocode;

import java.util.concurrent.TimeUnit;

/**
 * Blocking pause, replaceable in tests.
 */
@FunctionalInterface
public interface Sleeper {

    Sleeper SYSTEM = TimeUnit.NANOSECONDS::sleep;

    void sleep(long nanos) throws InterruptedException;
}
