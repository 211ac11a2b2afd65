package org.neuralchilli.planner.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * One physical block of the host outline store.
 * Read-only projection; the engine never mutates blocks.
 */
public record Block(
        long id,
        Long parent,
        List<Long> children,
        String text,
        List<BlockRef> refs,
        List<BlockProperty> properties
) {
    public static final String REPR_PROPERTY = "_repr";
    public static final String MIRROR_REPR_TYPE = "mirror";

    public Block {
        children = children == null ? List.of() : List.copyOf(children);
        refs = refs == null ? List.of() : List.copyOf(refs);
        properties = properties == null ? List.of() : List.copyOf(properties);
        if (text == null) {
            text = "";
        }
    }

    /**
     * Find the tag reference for the given alias, if this block carries it
     */
    public Optional<BlockRef> tagRef(String tagAlias) {
        return refs.stream().filter(ref -> ref.isTagRef(tagAlias)).findFirst();
    }

    public Optional<BlockRef> ref(long refId) {
        return refs.stream().filter(ref -> ref.id() == refId).findFirst();
    }

    public Optional<BlockProperty> property(String name) {
        return properties.stream().filter(p -> p.name().equals(name)).findFirst();
    }

    /**
     * Id of the block this one mirrors, when it is a mirror representation
     */
    public Optional<Long> mirroredId() {
        return property(REPR_PROPERTY)
                .map(BlockProperty::value)
                .filter(Map.class::isInstance)
                .map(Map.class::cast)
                .filter(repr -> MIRROR_REPR_TYPE.equals(repr.get("type")))
                .map(repr -> repr.get("mirroredId"))
                .filter(Number.class::isInstance)
                .map(id -> ((Number) id).longValue());
    }

    /**
     * Copy with the given tag reference replaced (or appended when absent)
     */
    public Block withTagRef(BlockRef tagRef) {
        List<BlockRef> updated = new ArrayList<>();
        boolean replaced = false;
        for (BlockRef ref : refs) {
            if (ref.isTagRef(tagRef.alias())) {
                updated.add(tagRef);
                replaced = true;
            } else {
                updated.add(ref);
            }
        }
        if (!replaced) {
            updated.add(tagRef);
        }
        return new Block(id, parent, children, text, updated, properties);
    }

    public Block withParent(Long parent) {
        return new Block(id, parent, children, text, refs, properties);
    }

    public Block withChildren(List<Long> children) {
        return new Block(id, parent, children, text, refs, properties);
    }

    public Block withoutTagRef(String tagAlias) {
        List<BlockRef> updated = refs.stream().filter(ref -> !ref.isTagRef(tagAlias)).toList();
        return new Block(id, parent, children, text, updated, properties);
    }

    /**
     * Copy with the named property set (or removed when {@code property} is null)
     */
    public Block withProperty(String name, BlockProperty property) {
        List<BlockProperty> updated = new ArrayList<>();
        for (BlockProperty existing : properties) {
            if (!existing.name().equals(name)) {
                updated.add(existing);
            }
        }
        if (property != null) {
            updated.add(property);
        }
        return new Block(id, parent, children, text, refs, updated);
    }

    public static Builder builder(long id) {
        return new Builder(id);
    }

    public static class Builder {
        private final long id;
        private Long parent;
        private List<Long> children = List.of();
        private String text = "";
        private List<BlockRef> refs = List.of();
        private List<BlockProperty> properties = List.of();

        public Builder(long id) {
            this.id = id;
        }

        public Builder parent(Long parent) {
            this.parent = parent;
            return this;
        }

        public Builder children(List<Long> children) {
            this.children = children;
            return this;
        }

        public Builder text(String text) {
            this.text = text;
            return this;
        }

        public Builder refs(List<BlockRef> refs) {
            this.refs = refs;
            return this;
        }

        public Builder properties(List<BlockProperty> properties) {
            this.properties = properties;
            return this;
        }

        public Block build() {
            return new Block(id, parent, children, text, refs, properties);
        }
    }
}
