package io.surfworks.graphforge.core.types;

import java.util.List;

/**
 * Stable handle to a {@link Type} owned by a {@link TypeArena}.
 *
 * <p>Handles are only minted by the arena, one per distinct structural type,
 * so two handles describe equal types exactly when they are the same object.
 * {@code equals} is therefore left as identity.
 */
public final class TypeRef {

    private final int id;
    private final Type type;

    TypeRef(int id, Type type) {
        this.id = id;
        this.type = type;
    }

    /**
     * Index of this type in its arena.
     */
    public int id() {
        return id;
    }

    public Type type() {
        return type;
    }

    public ElemKind elemKind() {
        return type.elemKind();
    }

    public List<Integer> dims() {
        return type.dims();
    }

    public long size() {
        return type.size();
    }

    public boolean isQuantized() {
        return type.isQuantized();
    }

    @Override
    public String toString() {
        return type.toString();
    }
}
