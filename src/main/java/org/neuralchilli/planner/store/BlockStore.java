package org.neuralchilli.planner.store;

import org.neuralchilli.planner.domain.Block;
import org.neuralchilli.planner.domain.BlockProperty;
import org.neuralchilli.planner.domain.MovePosition;

import java.util.List;
import java.util.Optional;

/**
 * The host outline store, as seen by the planner.
 *
 * Reads return immutable snapshots. Writes are applied synchronously;
 * callers that change task data must invalidate the evaluation cache
 * (see {@code TaskMutationService}).
 */
public interface BlockStore {

    /**
     * Every block carrying the tag with the given alias. One backend call.
     */
    List<Block> fetchTaggedBlocks(String tagAlias);

    /**
     * Live state of a block, if the host knows it
     */
    Optional<Block> findBlock(long blockId);

    /**
     * Merge properties into the block's tag payload, adding the tag when missing.
     * Properties with a null value are removed from the payload.
     *
     * @throws IllegalArgumentException if the block does not exist
     */
    void setTagData(long blockId, String tagAlias, List<BlockProperty> properties);

    /**
     * Set a block-level property, or remove it when {@code property.value()} is null
     *
     * @throws IllegalArgumentException if the block does not exist
     */
    void setBlockProperty(long blockId, BlockProperty property);

    /**
     * Remove the tag reference from a block
     *
     * @throws IllegalArgumentException if the block does not exist
     */
    void removeTag(long blockId, String tagAlias);

    /**
     * Create an untagged block as the last child of the parent
     *
     * @return the new block
     * @throws IllegalArgumentException if the parent does not exist
     */
    Block insertChild(long parentId, String text);

    /**
     * Move a block, with its subtree, next to or below the target block
     *
     * @throws IllegalArgumentException if either block does not exist, or the
     *                                  target lies inside the moved subtree
     */
    void moveBlock(long blockId, long targetId, MovePosition position);
}
