package org.neuralchilli.planner.domain;

import java.util.List;
import java.util.Optional;

/**
 * A typed reference from one block to another. Tag references carry the
 * task property payload in {@code data}.
 */
public record BlockRef(
        long id,
        long to,
        int type,
        String alias,
        List<BlockProperty> data
) {
    public static final int TAG_REF_TYPE = 2;

    public BlockRef {
        data = data == null ? List.of() : List.copyOf(data);
    }

    public static BlockRef tag(long id, long to, String alias, List<BlockProperty> data) {
        return new BlockRef(id, to, TAG_REF_TYPE, alias, data);
    }

    public boolean isTagRef(String tagAlias) {
        return type == TAG_REF_TYPE && alias != null && alias.equals(tagAlias);
    }

    public Optional<BlockProperty> property(String name) {
        return data.stream().filter(p -> p.name().equals(name)).findFirst();
    }
}
