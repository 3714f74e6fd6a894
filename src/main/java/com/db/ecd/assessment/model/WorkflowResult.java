package com.db.ecd.assessment.model;

import com.db.ecd.assessment.constant.WorkflowError;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Outcome of a workflow action: either a value or a failure kind with a reviewer-facing message.
 */
@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class WorkflowResult<T> {

    private final T value;
    private final WorkflowError error;
    private final String message;

    public static <T> WorkflowResult<T> success(T value, String message) {
        return new WorkflowResult<>(value, null, message);
    }

    public static <T> WorkflowResult<T> success(T value) {
        return success(value, null);
    }

    public static <T> WorkflowResult<T> failure(WorkflowError error, String message) {
        return new WorkflowResult<>(null, error, message);
    }

    public boolean isSuccess() {
        return error == null;
    }
}
