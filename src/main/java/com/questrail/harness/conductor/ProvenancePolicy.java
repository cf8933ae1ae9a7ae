package com.questrail.harness.conductor;

import com.questrail.harness.api.CellId;

import java.util.Objects;

/**
 * Chooses the provenance (author key) sent with a function call.
 *
 * <p>{@link #CALLEE_AGENT} signs every call with the callee cell's own agent
 * key, which always grants authorship. That matches what current conductors
 * expect from a test harness. A conductor that injects provenance itself, or a
 * scenario that needs a distinct caller identity, swaps in another policy.</p>
 */
@FunctionalInterface
public interface ProvenancePolicy
{
    ProvenancePolicy CALLEE_AGENT = CellId::agentKey;

    String provenanceFor(CellId callee);

    static ProvenancePolicy fixed(String agentKey) {
        Objects.requireNonNull(agentKey, "agentKey");
        return callee -> agentKey;
    }
}
