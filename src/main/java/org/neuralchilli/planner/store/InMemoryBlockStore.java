package org.neuralchilli.planner.store;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.planner.domain.Block;
import org.neuralchilli.planner.domain.BlockProperty;
import org.neuralchilli.planner.domain.BlockRef;
import org.neuralchilli.planner.domain.MovePosition;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Block store held in memory, filled from YAML snapshots or directly by tests.
 *
 * Writes are serialized on the store; structural changes touch several
 * blocks and must not interleave with payload writes.
 */
@ApplicationScoped
public class InMemoryBlockStore implements BlockStore {

    private static final Logger log = LoggerFactory.getLogger(InMemoryBlockStore.class);
    private static final long FIRST_GENERATED_REF_ID = 1_000_000L;

    private final Map<Long, Block> blocks = new ConcurrentHashMap<>();
    private final AtomicLong refIds = new AtomicLong(FIRST_GENERATED_REF_ID);
    private final AtomicLong blockIds = new AtomicLong(1L);

    /**
     * Replace the whole content of the store
     */
    public synchronized void replaceAll(Collection<Block> snapshot) {
        blocks.clear();
        snapshot.forEach(this::put);
        log.debug("Block store replaced: {} blocks", blocks.size());
    }

    public synchronized void put(Block block) {
        blocks.put(block.id(), block);
        blockIds.accumulateAndGet(block.id() + 1, Math::max);
        block.refs().forEach(ref -> refIds.accumulateAndGet(ref.id() + 1, Math::max));
    }

    public synchronized void clear() {
        blocks.clear();
    }

    public int size() {
        return blocks.size();
    }

    @Override
    public List<Block> fetchTaggedBlocks(String tagAlias) {
        return blocks.values().stream()
                .filter(block -> block.tagRef(tagAlias).isPresent())
                .sorted(Comparator.comparingLong(Block::id))
                .toList();
    }

    @Override
    public Optional<Block> findBlock(long blockId) {
        return Optional.ofNullable(blocks.get(blockId));
    }

    @Override
    public synchronized void setTagData(long blockId, String tagAlias, List<BlockProperty> properties) {
        long tagTarget = resolveTagTarget(tagAlias);
        blocks.compute(blockId, (id, block) -> {
            Block existing = requireBlock(id, block);
            BlockRef tagRef = existing.tagRef(tagAlias)
                    .orElseGet(() -> BlockRef.tag(refIds.getAndIncrement(), tagTarget, tagAlias, List.of()));
            return existing.withTagRef(mergePayload(tagRef, properties));
        });
    }

    @Override
    public synchronized void setBlockProperty(long blockId, BlockProperty property) {
        blocks.compute(blockId, (id, block) -> {
            Block existing = requireBlock(id, block);
            return existing.withProperty(property.name(), property.value() == null ? null : property);
        });
    }

    @Override
    public synchronized void removeTag(long blockId, String tagAlias) {
        blocks.compute(blockId, (id, block) -> requireBlock(id, block).withoutTagRef(tagAlias));
    }

    @Override
    public synchronized Block insertChild(long parentId, String text) {
        Block parent = requireBlock(parentId, blocks.get(parentId));
        Block child = Block.builder(blockIds.getAndIncrement())
                .parent(parentId)
                .text(text)
                .build();

        blocks.put(child.id(), child);
        blocks.put(parentId, parent.withChildren(withChildAt(parent.children(), child.id(), parent.children().size())));
        log.debug("Inserted block {} under {}", child.id(), parentId);
        return child;
    }

    @Override
    public synchronized void moveBlock(long blockId, long targetId, MovePosition position) {
        Block block = requireBlock(blockId, blocks.get(blockId));
        Block target = requireBlock(targetId, blocks.get(targetId));
        if (position == null) {
            throw new IllegalArgumentException("Move position is required");
        }
        if (isSelfOrAncestor(blockId, target)) {
            throw new IllegalArgumentException(
                    "Cannot move block " + blockId + " relative to " + targetId + " inside its own subtree");
        }

        if (block.parent() != null) {
            Block oldParent = blocks.get(block.parent());
            if (oldParent != null) {
                blocks.put(oldParent.id(), oldParent.withChildren(withoutChild(oldParent.children(), blockId)));
            }
        }

        Long newParentId = position == MovePosition.CHILD ? Long.valueOf(targetId) : target.parent();
        if (newParentId != null) {
            Block newParent = blocks.get(newParentId);
            if (newParent != null) {
                List<Long> siblings = withoutChild(newParent.children(), blockId);
                blocks.put(newParentId, newParent.withChildren(
                        withChildAt(siblings, blockId, insertionIndex(siblings, targetId, position))));
            }
        }

        blocks.put(blockId, blocks.get(blockId).withParent(newParentId));
        log.debug("Moved block {} {} block {}", blockId, position, targetId);
    }

    /**
     * Whether {@code blockId} is the target or one of its ancestors
     */
    private boolean isSelfOrAncestor(long blockId, Block target) {
        Set<Long> visited = new HashSet<>();
        Block current = target;
        while (current != null && visited.add(current.id())) {
            if (current.id() == blockId) {
                return true;
            }
            current = current.parent() == null ? null : blocks.get(current.parent());
        }
        return false;
    }

    private static int insertionIndex(List<Long> siblings, long targetId, MovePosition position) {
        int targetIndex = siblings.indexOf(targetId);
        if (position == MovePosition.CHILD || targetIndex < 0) {
            return siblings.size();
        }
        return position == MovePosition.BEFORE ? targetIndex : targetIndex + 1;
    }

    private static List<Long> withoutChild(List<Long> children, long childId) {
        List<Long> updated = new ArrayList<>(children);
        updated.remove(Long.valueOf(childId));
        return updated;
    }

    private static List<Long> withChildAt(List<Long> children, long childId, int index) {
        List<Long> updated = new ArrayList<>(children);
        updated.add(index, childId);
        return updated;
    }

    private Block requireBlock(long id, Block block) {
        if (block == null) {
            throw new IllegalArgumentException("Block not found: " + id);
        }
        return block;
    }

    private BlockRef mergePayload(BlockRef tagRef, List<BlockProperty> properties) {
        List<BlockProperty> merged = new ArrayList<>();
        for (BlockProperty existing : tagRef.data()) {
            boolean overwritten = properties.stream().anyMatch(p -> p.name().equals(existing.name()));
            if (!overwritten) {
                merged.add(existing);
            }
        }
        for (BlockProperty property : properties) {
            if (property.value() != null) {
                merged.add(property);
            }
        }
        return new BlockRef(tagRef.id(), tagRef.to(), tagRef.type(), tagRef.alias(), merged);
    }

    /**
     * Target of a new tag ref: the tag block itself when another block already
     * references it, else 0
     */
    private long resolveTagTarget(String tagAlias) {
        return blocks.values().stream()
                .flatMap(block -> block.tagRef(tagAlias).stream())
                .mapToLong(BlockRef::to)
                .findFirst()
                .orElse(0L);
    }
}
