package com.qqsuccubus.fleet.core.model;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

/**
 * One inconsistency found by a state consistency check.
 */
@Value
@Builder
public class DivergenceReport {
    Kind kind;

    /**
     * Orphaned node for {@link Kind#ORPHANED}, winning node for {@link Kind#CONFLICT}.
     */
    String nodeId;

    /**
     * Contested resource for {@link Kind#CONFLICT}, otherwise the orphan's own key (may be null).
     */
    String resourceKey;

    /**
     * Nodes whose entries lost the conflict. Empty for orphans.
     */
    @Singular
    List<String> losingNodeIds;

    /**
     * Version of the orphaned or winning entry.
     */
    long version;

    String detail;

    public enum Kind {
        /**
         * State whose owning node is absent or dead; collected by the check.
         */
        ORPHANED,

        /**
         * Several live nodes claim the same resource with different versions or contents.
         */
        CONFLICT
    }
}
