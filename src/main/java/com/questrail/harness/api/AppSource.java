package com.questrail.harness.api;

import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

/**
 * What to install as an application: either an explicit list of DNAs, each
 * registered individually before install, or a packaged bundle installed in
 * one request.
 */
public sealed interface AppSource permits AppSource.Dnas, AppSource.Bundle
{
    record Dnas(List<DnaDeclaration> dnas) implements AppSource {
        public Dnas {
            dnas = List.copyOf(Objects.requireNonNull(dnas, "dnas"));
            if (dnas.isEmpty()) {
                throw new IllegalArgumentException("An application needs at least one DNA");
            }
        }
    }

    /**
     * @param source         bundle location (path or URL)
     * @param membraneProofs cell nickname to base64 membrane proof
     * @param uid            network disambiguator applied to every DNA in the bundle
     */
    record Bundle(DnaSource source, Map<String, String> membraneProofs, Optional<String> uid) implements AppSource {
        public Bundle {
            Objects.requireNonNull(source, "source");
            if (source instanceof DnaSource.Hash) {
                throw new IllegalArgumentException("A bundle must be referenced by path or url");
            }
            membraneProofs = Map.copyOf(Objects.requireNonNull(membraneProofs, "membraneProofs"));
            Objects.requireNonNull(uid, "uid");
        }
    }

    static AppSource dnas(DnaDeclaration... dnas) {
        return new Dnas(List.of(dnas));
    }

    static AppSource bundle(DnaSource source) {
        return new Bundle(source, Map.of(), Optional.empty());
    }
}
