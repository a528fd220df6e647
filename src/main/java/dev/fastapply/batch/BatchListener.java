package dev.fastapply.batch;

import dev.fastapply.error.BatchError;
import dev.fastapply.model.Automation;

/**
 * Side channel for batch outcomes, e.g. a toast or a badge.
 * Implementations must not block; exceptions they throw are logged and ignored.
 */
public interface BatchListener {

    BatchListener NO_OP = new BatchListener() {
    };

    default void onBatchSent(Automation automation, int jobCount) {
    }

    default void onBatchError(BatchError error) {
    }
}
