package org.neuralchilli.planner.core;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.neuralchilli.planner.domain.Block;
import org.neuralchilli.planner.domain.TaskId;
import org.neuralchilli.planner.store.BlockStore;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Resolves mirror blocks to the block they mirror.
 *
 * The host's live block state is preferred; the fetched working set is the
 * fallback. Mirror chains are followed until a non-mirror block or an unknown id.
 */
@ApplicationScoped
public class MirrorIdentityResolver implements IdentityResolver {

    private final BlockStore blockStore;

    @Inject
    public MirrorIdentityResolver(BlockStore blockStore) {
        this.blockStore = blockStore;
    }

    @Override
    public TaskId canonicalId(long rawId) {
        return resolve(rawId, Map.of());
    }

    @Override
    public IdentityResolver withWorkingSet(Map<Long, Block> workingSet) {
        Map<Long, Block> snapshot = Map.copyOf(workingSet);
        return rawId -> resolve(rawId, snapshot);
    }

    private TaskId resolve(long rawId, Map<Long, Block> workingSet) {
        List<Long> path = new ArrayList<>();
        long current = rawId;

        while (!path.contains(current)) {
            path.add(current);
            Optional<Long> mirrored = lookup(current, workingSet).flatMap(Block::mirroredId);
            if (mirrored.isEmpty()) {
                return TaskId.of(current);
            }
            current = mirrored.get();
        }

        // Mirrors pointing at each other: every member resolves to the lowest id
        List<Long> cycle = path.subList(path.indexOf(current), path.size());
        return TaskId.of(cycle.stream().mapToLong(Long::longValue).min().orElse(current));
    }

    private Optional<Block> lookup(long id, Map<Long, Block> workingSet) {
        Optional<Block> live = blockStore.findBlock(id);
        if (live.isPresent()) {
            return live;
        }
        return Optional.ofNullable(workingSet.get(id));
    }
}
