package com.astroplatform.common.ephemeris;

/** Hands out a provider per compute or per batch worker; providers are never shared across threads. */
@FunctionalInterface
public interface EphemerisProviderFactory {

    EphemerisProvider open();
}
