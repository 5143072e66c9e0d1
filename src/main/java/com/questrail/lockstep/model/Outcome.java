package com.questrail.lockstep.model;

import com.questrail.lockstep.api.ErrorCode;

import java.util.Objects;

/**
 * Outcome
 * -----------------------------------------------------------------------------
 * Primary result of applying one operation: either the primary storage after a
 * successful call, or the normalized error the call failed with.
 *
 * <p>Both sides report outcomes in the same {@link ErrorCode} space, so a model
 * outcome and a system outcome are directly comparable with {@code equals}.</p>
 *
 * @param <S> primary storage type
 */
public sealed interface Outcome<S> permits Outcome.Success, Outcome.Failure
{
    static <S> Outcome<S> success(S storage) {
        return new Success<>(storage);
    }

    static <S> Outcome<S> failure(ErrorCode error) {
        return new Failure<>(error);
    }

    boolean isSuccess();

    record Success<S>(S storage) implements Outcome<S> {
        public Success {
            Objects.requireNonNull(storage, "storage");
        }

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public String toString() {
            return "Right " + storage;
        }
    }

    record Failure<S>(ErrorCode error) implements Outcome<S> {
        public Failure {
            Objects.requireNonNull(error, "error");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public String toString() {
            return "Left " + error + " (" + error.code() + ")";
        }
    }
}
