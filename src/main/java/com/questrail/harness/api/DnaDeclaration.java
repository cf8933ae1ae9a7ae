package com.questrail.harness.api;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * One DNA of an application: its source, the cell nickname it will be
 * installed under, and optional registration parameters.
 *
 * @param nick          cell nickname, unique within the application
 * @param source        where the DNA is loaded from
 * @param uid           network disambiguator, if any
 * @param properties    DNA properties forwarded verbatim on registration
 * @param membraneProof base64 membrane proof, if any
 */
public record DnaDeclaration(String nick,
                             DnaSource source,
                             Optional<String> uid,
                             Map<String, Object> properties,
                             Optional<String> membraneProof) {

    public DnaDeclaration {
        Objects.requireNonNull(nick, "nick");
        Objects.requireNonNull(source, "source");
        Objects.requireNonNull(uid, "uid");
        properties = Map.copyOf(Objects.requireNonNull(properties, "properties"));
        Objects.requireNonNull(membraneProof, "membraneProof");
    }

    public static DnaDeclaration of(String nick, DnaSource source) {
        return new DnaDeclaration(nick, source, Optional.empty(), Map.of(), Optional.empty());
    }

    public DnaDeclaration withUid(String uid) {
        return new DnaDeclaration(nick, source, Optional.of(uid), properties, membraneProof);
    }
}
