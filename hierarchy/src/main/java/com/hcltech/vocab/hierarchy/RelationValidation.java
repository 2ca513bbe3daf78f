package com.hcltech.vocab.hierarchy;

import com.hcltech.vocab.common.errorsor.ErrorsOr;

import java.util.*;

/** Referential integrity of a relation mapping: every child must itself be a key. */
public interface RelationValidation {

    /** Validate and return success (Boolean.TRUE) or one error per undefined child, in mapping order. Never throws. */
    static <N> ErrorsOr<Boolean> validate(Map<N, ? extends Collection<N>> relations) {
        Objects.requireNonNull(relations, "relations");
        List<String> errors = new ArrayList<>();
        Set<N> reported = new HashSet<>();
        for (var en : relations.entrySet()) {
            for (N child : childrenOf(en.getValue())) {
                if (!relations.containsKey(child) && reported.add(child)) {
                    errors.add(StructuralException.undefinedChild(String.valueOf(child)).getMessage());
                }
            }
        }
        return errors.isEmpty() ? ErrorsOr.lift(Boolean.TRUE) : ErrorsOr.errors(errors);
    }

    static <N> Collection<N> childrenOf(Collection<N> children) {
        return children == null ? List.of() : children;
    }
}
