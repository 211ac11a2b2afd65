package org.neuralchilli.planner.core;

import org.neuralchilli.planner.domain.Block;
import org.neuralchilli.planner.domain.TaskId;

import java.util.Map;

/**
 * Collapses the physical block records of one logical task to a single id.
 * Implementations never throw: an id that cannot be resolved is its own canonical id.
 */
public interface IdentityResolver {

    TaskId canonicalId(long rawId);

    /**
     * Resolver that also consults the given fetched blocks when the host's live
     * state does not know an id
     */
    default IdentityResolver withWorkingSet(Map<Long, Block> workingSet) {
        return this;
    }
}
