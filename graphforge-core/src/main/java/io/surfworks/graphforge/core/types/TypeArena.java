package io.surfworks.graphforge.core.types;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Owns the distinct tensor types of a module.
 *
 * <p>Every request for a type goes through {@link #uniqueType(Type)}, which
 * returns the existing handle for a structurally equal type or registers a
 * new one. Lookup is a linear scan: graphs hold far fewer distinct types than
 * nodes, and in exchange every other type comparison is a reference check.
 *
 * <p>Handles are never removed; they live as long as the arena.
 */
public final class TypeArena {

    private final List<TypeRef> types = new ArrayList<>();

    public TypeRef uniqueType(Type type) {
        Objects.requireNonNull(type, "type");
        for (TypeRef ref : types) {
            if (ref.type().equals(type)) {
                return ref;
            }
        }
        TypeRef ref = new TypeRef(types.size(), type);
        types.add(ref);
        return ref;
    }

    public TypeRef uniqueType(ElemKind elemKind, List<Integer> dims) {
        return uniqueType(new Type(elemKind, dims));
    }

    public TypeRef uniqueType(ElemKind elemKind, List<Integer> dims, float scale, int offset) {
        return uniqueType(new Type(elemKind, dims, scale, offset));
    }

    /**
     * Returns the type with the element kind (and quantization parameters) of
     * {@code ref} but the given dimensions.
     */
    public TypeRef uniqueTypeWithNewShape(TypeRef ref, List<Integer> dims) {
        return uniqueType(ref.type().withDims(dims));
    }

    public TypeRef voidType() {
        return uniqueType(Type.VOID);
    }

    /**
     * Re-interns a handle that may come from another arena.
     */
    public TypeRef adopt(TypeRef ref) {
        if (ref.id() < types.size() && types.get(ref.id()) == ref) {
            return ref;
        }
        return uniqueType(ref.type());
    }

    public int size() {
        return types.size();
    }

    public List<TypeRef> types() {
        return Collections.unmodifiableList(types);
    }
}
