package org.pragmatica.qmark.lint.questionmark;

import org.pragmatica.qmark.types.Ty;
import org.pragmatica.qmark.types.TypeFamily;

import java.util.Optional;

/// Semantic family of the value a guard inspects.
enum GuardFamily {
    /// A value or its absence; the absent state carries no payload.
    OPTION(TypeFamily.OPTION, "is_none", "Some", Verdict.FAILURE_MARKER),
    /// A value or a failure carrying a payload.
    RESULT(TypeFamily.RESULT, "is_err", "Ok", Verdict.SAME_ORIGIN);

    private final TypeFamily typeFamily;
    private final String emptinessPredicate;
    private final String successWrapper;
    private final Verdict earlyReturnVerdict;

    GuardFamily(TypeFamily typeFamily, String emptinessPredicate, String successWrapper, Verdict earlyReturnVerdict) {
        this.typeFamily = typeFamily;
        this.emptinessPredicate = emptinessPredicate;
        this.successWrapper = successWrapper;
        this.earlyReturnVerdict = earlyReturnVerdict;
    }

    static Optional<GuardFamily> of(Ty ty) {
        for (var family : values()) {
            if (ty.is(family.typeFamily)) {
                return Optional.of(family);
            }
        }
        return Optional.empty();
    }

    /// Zero-argument predicate that tests for the empty or failed state.
    String emptinessPredicate() {
        return emptinessPredicate;
    }

    /// Constructor that wraps a present or successful value.
    String successWrapper() {
        return successWrapper;
    }

    /// Verdict a guard's early return must reach when it is guarded by the emptiness predicate.
    Verdict earlyReturnVerdict() {
        return earlyReturnVerdict;
    }
}
