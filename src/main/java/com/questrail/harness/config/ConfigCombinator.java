package com.questrail.harness.config;

/**
 * Merges several players into the configuration of a single conductor.
 */
@FunctionalInterface
public interface ConfigCombinator
{
    PlayerConfig combine(PlayerConfigs players);
}
