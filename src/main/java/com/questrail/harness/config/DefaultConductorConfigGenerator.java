package com.questrail.harness.config;

import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.questrail.harness.util.Jsons;

/**
 * Generates a conductor config with one admin interface on the seed's admin
 * port, an environment directory under the seed's config dir and the global
 * network and logging settings.
 *
 * <p>The output is JSON, which conductors that read YAML accept unchanged.</p>
 */
public final class DefaultConductorConfigGenerator implements ConductorConfigGenerator
{
    public static final DefaultConductorConfigGenerator INSTANCE = new DefaultConductorConfigGenerator();

    private DefaultConductorConfigGenerator() {
    }

    @Override
    public String generate(ConfigSeedArgs seed, GlobalConfig global)
    {
        ObjectNode config = Jsons.object();
        config.put("environment_path", seed.configDir().resolve("env").toString());
        config.put("use_dangerous_test_keystore", true);

        ArrayNode adminInterfaces = config.putArray("admin_interfaces");
        ObjectNode driver = adminInterfaces.addObject().putObject("driver");
        driver.put("type", "websocket");
        driver.put("port", seed.adminPort());

        ObjectNode network = config.putObject("network");
        network.put("network_type", global.networkTransport());
        network.put("network_id", seed.uuid());

        config.put("log_level", global.logLevel());
        config.put("conductor_name", seed.conductorName());
        global.extra().forEach((key, value) -> config.set(key, Jsons.toTree(value)));

        return config.toPrettyString();
    }
}
