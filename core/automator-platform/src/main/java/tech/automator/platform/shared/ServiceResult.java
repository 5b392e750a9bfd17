package tech.automator.platform.shared;

import java.util.List;
import java.util.function.Function;

/**
 * Outcome of a service operation: either a value or a coded failure.
 *
 * Services return failures as values instead of throwing, so callers compose steps
 * and the resource layer turns the final result into an envelope.
 *
 * @param <T> success value type
 */
public sealed interface ServiceResult<T> permits ServiceResult.Success, ServiceResult.Failure {

    record Success<T>(T value) implements ServiceResult<T> {
    }

    record Failure<T>(ErrorCode code, List<ErrorDetail> errors) implements ServiceResult<T> {

        public Failure {
            errors = List.copyOf(errors);
        }

        /**
         * Re-type this failure for a caller with a different success type.
         */
        public <U> Failure<U> cast() {
            return new Failure<>(code, errors);
        }
    }

    static <T> ServiceResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> ServiceResult<T> failure(ErrorCode code) {
        return new Failure<>(code, List.of(ErrorDetail.of(code)));
    }

    static <T> ServiceResult<T> failure(ErrorCode code, String field) {
        return new Failure<>(code, List.of(ErrorDetail.of(code, field)));
    }

    static <T> ServiceResult<T> failure(ErrorCode code, List<ErrorDetail> errors) {
        return new Failure<>(code, errors);
    }

    default boolean isSuccess() {
        return this instanceof Success;
    }

    /**
     * @throws IllegalStateException if this is a failure
     */
    default T value() {
        if (this instanceof Success<T> success) {
            return success.value();
        }
        throw new IllegalStateException("No value on failed result: " + ((Failure<T>) this).code());
    }

    default <U> ServiceResult<U> map(Function<? super T, ? extends U> mapper) {
        if (this instanceof Success<T> success) {
            return new Success<>(mapper.apply(success.value()));
        }
        return ((Failure<T>) this).cast();
    }

    default <U> ServiceResult<U> flatMap(Function<? super T, ServiceResult<U>> mapper) {
        if (this instanceof Success<T> success) {
            return mapper.apply(success.value());
        }
        return ((Failure<T>) this).cast();
    }
}
