package com.eyelevel.documenttranslator.worker;

import com.eyelevel.documenttranslator.model.TranslationJob;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.Objects;
import java.util.function.Consumer;

/**
 * Result of one stage's unit of work. The worker loop turns it into exactly one record transition.
 */
@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public final class StageOutcome {

    public enum Type {
        /**
         * Apply the updates and hand the job to the next stage.
         */
        ADVANCE,
        /**
         * The last stage finished; record the output and complete the job.
         */
        COMPLETE,
        /**
         * Mark the job failed with the given reason.
         */
        FAILURE,
        /**
         * The job went terminal while the stage was running; drop the result.
         */
        ABORTED
    }

    private static final Consumer<TranslationJob> NO_UPDATES = job -> {
    };

    private final Type type;
    private final Consumer<TranslationJob> updates;
    private final String outputRef;
    private final String reason;

    public static StageOutcome advance(Consumer<TranslationJob> updates) {
        return new StageOutcome(Type.ADVANCE, Objects.requireNonNull(updates), null, null);
    }

    public static StageOutcome advance() {
        return advance(NO_UPDATES);
    }

    public static StageOutcome complete(String outputRef) {
        return new StageOutcome(Type.COMPLETE, NO_UPDATES, Objects.requireNonNull(outputRef), null);
    }

    public static StageOutcome failure(String reason) {
        return new StageOutcome(Type.FAILURE, NO_UPDATES, null, reason);
    }

    public static StageOutcome aborted(String reason) {
        return new StageOutcome(Type.ABORTED, NO_UPDATES, null, reason);
    }
}
