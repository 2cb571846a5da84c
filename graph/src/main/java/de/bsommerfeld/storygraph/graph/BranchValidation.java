package de.bsommerfeld.storygraph.graph;

/**
 * Outcome of walking a branch head back to its root.
 *
 * @param valid  {@code true} when the walk reached a root without cycling
 * @param reason diagnostic for an invalid head, {@code null} when valid
 */
public record BranchValidation(boolean valid, CorruptionReason reason) {

    private static final BranchValidation VALID = new BranchValidation(true, null);

    public BranchValidation {
        if (valid == (reason != null)) {
            throw new IllegalArgumentException("A reason is required exactly when the head is invalid");
        }
    }

    public static BranchValidation ok() {
        return VALID;
    }

    public static BranchValidation corrupted(CorruptionReason reason) {
        return new BranchValidation(false, reason);
    }

    /**
     * Human-readable reason, {@code "ok"} for a valid head.
     */
    public String describe() {
        return valid ? "ok" : reason.description();
    }
}
