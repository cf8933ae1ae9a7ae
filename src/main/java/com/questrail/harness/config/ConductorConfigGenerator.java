package com.questrail.harness.config;

/**
 * Produces the text of a conductor's configuration file. The format belongs
 * to the conductor; the harness only writes or uploads the result.
 */
@FunctionalInterface
public interface ConductorConfigGenerator
{
    String generate(ConfigSeedArgs seed, GlobalConfig global);
}
