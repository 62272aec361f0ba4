package io.recovery.dead;

/**
 * Lookup into business state telling whether the work for a subject has already
 * been done, so replaying its dead letter would be redundant.
 */
@FunctionalInterface
public interface ProcessedSubjectCheck {

    /**
     * @param subjectId the {@code candidate_id} of the dead-lettered message
     * @return {@code true} if no replay is needed
     */
    boolean isProcessed(String subjectId);
}
