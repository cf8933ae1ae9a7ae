package com.questrail.harness.api;

import java.util.Objects;

/**
 * Where a DNA comes from. Exactly one of a file path, an already-registered
 * content hash, or a remote URL.
 *
 * <p>{@link Path} and {@link Url} sources are resolved by the conductor's
 * backend before registration: a local conductor reads paths directly, a
 * tunneled conductor asks its remote control server to fetch the resource.</p>
 */
public sealed interface DnaSource permits DnaSource.Path, DnaSource.Hash, DnaSource.Url
{
    record Path(String path) implements DnaSource {
        public Path {
            Objects.requireNonNull(path, "path");
        }
    }

    record Hash(String hash) implements DnaSource {
        public Hash {
            Objects.requireNonNull(hash, "hash");
        }
    }

    record Url(String url) implements DnaSource {
        public Url {
            Objects.requireNonNull(url, "url");
        }
    }

    static DnaSource path(String path) {
        return new Path(path);
    }

    static DnaSource hash(String hash) {
        return new Hash(hash);
    }

    static DnaSource url(String url) {
        return new Url(url);
    }
}
