package com.staycheckout.common.result;

import com.staycheckout.common.dto.ErrorResponse;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of a domain operation: either a value or a typed failure.
 * Domain services return this instead of throwing for expected failures; the web layer
 * turns it into a response with {@link #toResponse(HttpStatus)}.
 *
 * @param <T> Type of the success value
 */
public sealed interface Result<T> permits Result.Success, Result.Failure {

    static <T> Result<T> success(T value) {
        return new Success<>(value);
    }

    static <T> Result<T> failure(ErrorKind kind, String message) {
        return new Failure<>(kind, message);
    }

    static <T> Result<T> invalidInput(String message) {
        return failure(ErrorKind.INVALID_INPUT, message);
    }

    static <T> Result<T> notFound(String message) {
        return failure(ErrorKind.NOT_FOUND, message);
    }

    static <T> Result<T> conflict(String message) {
        return failure(ErrorKind.CONFLICT, message);
    }

    boolean isSuccess();

    /**
     * Transforms the success value; failures pass through unchanged.
     */
    <U> Result<U> map(Function<? super T, ? extends U> mapper);

    /**
     * Chains another operation that can itself fail; failures short-circuit.
     */
    <U> Result<U> flatMap(Function<? super T, Result<U>> mapper);

    /**
     * Maps a success to {@code successStatus} with the value as body, and a failure to the
     * status of its {@link ErrorKind} with an {@link ErrorResponse} body.
     */
    ResponseEntity<Object> toResponse(HttpStatus successStatus);

    record Success<T>(T value) implements Result<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
            return mapper.apply(value);
        }

        @Override
        public ResponseEntity<Object> toResponse(HttpStatus successStatus) {
            return ResponseEntity.status(successStatus).body(value);
        }
    }

    record Failure<T>(ErrorKind kind, String message) implements Result<T> {

        public Failure {
            Objects.requireNonNull(kind, "kind");
        }

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public <U> Result<U> map(Function<? super T, ? extends U> mapper) {
            return new Failure<>(kind, message);
        }

        @Override
        public <U> Result<U> flatMap(Function<? super T, Result<U>> mapper) {
            return new Failure<>(kind, message);
        }

        @Override
        public ResponseEntity<Object> toResponse(HttpStatus successStatus) {
            return ResponseEntity.status(kind.httpStatus()).body(ErrorResponse.of(message));
        }
    }
}
