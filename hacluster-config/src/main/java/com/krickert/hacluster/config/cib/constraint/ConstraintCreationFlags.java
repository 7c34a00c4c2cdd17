package com.krickert.hacluster.config.cib.constraint;

import lombok.Builder;

/**
 * Caller decisions applied while creating a constraint.
 *
 * @param canRepairToClone       Replace a resource inside a clone or master by the wrapper itself.
 * @param resourceInCloneAllowed Keep a resource inside a clone or master as requested.
 * @param duplicationAllowed     Create the constraint even if an equal one already exists.
 */
@Builder(toBuilder = true)
public record ConstraintCreationFlags(
        boolean canRepairToClone,
        boolean resourceInCloneAllowed,
        boolean duplicationAllowed
) {
    public static ConstraintCreationFlags defaults() {
        return new ConstraintCreationFlags(false, false, false);
    }
}
