package fr.lapetina.sessionpool.execution;

import fr.lapetina.sessionpool.domain.model.ErrorType;
import fr.lapetina.sessionpool.domain.model.GenerationRequest;
import fr.lapetina.sessionpool.domain.model.GenerationResult;
import fr.lapetina.sessionpool.domain.model.RequestStatus;

import java.time.Instant;
import java.util.Objects;

/**
 * What a job produced, held back until the worker's bookkeeping is done.
 */
public record JobOutcome(GenerationResult result, ErrorType errorType, String error) {

    public JobOutcome {
        if (result == null) {
            errorType = errorType != null ? errorType : ErrorType.INTERNAL_ERROR;
        }
    }

    public static JobOutcome success(GenerationResult result) {
        return new JobOutcome(Objects.requireNonNull(result, "Result is required"), null, null);
    }

    public static JobOutcome failure(ErrorType errorType, String error) {
        return new JobOutcome(null, errorType, error);
    }

    public boolean succeeded() {
        return result != null;
    }

    public RequestStatus status() {
        return succeeded() ? RequestStatus.COMPLETED : RequestStatus.FAILED;
    }

    /**
     * Moves a PROCESSING request to its terminal state.
     *
     * @return false if the request had already left PROCESSING
     */
    public boolean applyTo(GenerationRequest request, Instant now) {
        return succeeded() ? request.complete(result, now) : request.fail(errorType, error, now);
    }
}
