package com.questrail.harness.config;

import com.questrail.harness.api.AppSource;
import com.questrail.harness.api.DnaDeclaration;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.UnaryOperator;
import java.util.stream.Collectors;

/**
 * What one player runs: its instances, each installed as a cell whose
 * nickname is the instance id, all inside one application.
 *
 * @param instances one declaration per instance; {@link DnaDeclaration#nick()} is the instance id
 * @param appId     application id to install under; generated when empty
 */
public record PlayerConfig(List<DnaDeclaration> instances, Optional<String> appId) {

    public PlayerConfig {
        instances = List.copyOf(Objects.requireNonNull(instances, "instances"));
        Objects.requireNonNull(appId, "appId");
        if (instances.isEmpty()) {
            throw new IllegalArgumentException("A player needs at least one instance");
        }
        Set<String> ids = new LinkedHashSet<>();
        for (DnaDeclaration instance : instances) {
            if (!ids.add(instance.nick())) {
                throw new IllegalArgumentException("Duplicate instance id: " + instance.nick());
            }
        }
    }

    public static PlayerConfig of(DnaDeclaration... instances) {
        return new PlayerConfig(List.of(instances), Optional.empty());
    }

    public PlayerConfig withAppId(String appId) {
        return new PlayerConfig(instances, Optional.of(appId));
    }

    public List<String> instanceIds() {
        return instances.stream().map(DnaDeclaration::nick).collect(Collectors.toList());
    }

    /**
     * Same instances under new ids.
     */
    public PlayerConfig renamed(UnaryOperator<String> rename) {
        List<DnaDeclaration> renamed = new ArrayList<>(instances.size());
        for (DnaDeclaration d : instances) {
            renamed.add(new DnaDeclaration(rename.apply(d.nick()), d.source(), d.uid(), d.properties(), d.membraneProof()));
        }
        return new PlayerConfig(renamed, appId);
    }

    public AppSource toAppSource() {
        return new AppSource.Dnas(instances);
    }
}
