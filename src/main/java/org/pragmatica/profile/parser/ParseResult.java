package org.pragmatica.profile.parser;

import org.pragmatica.profile.error.ParseError;

import java.util.Optional;
import java.util.function.Function;

/**
 * Outcome of a parse: either a value or the first error encountered.
 */
public sealed interface ParseResult<T> {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * The parsed value.
     *
     * @throws IllegalStateException if the parse failed
     */
    T unwrap();

    Optional<ParseError> error();

    <R> ParseResult<R> map(Function<? super T, ? extends R> mapper);

    <R> R fold(Function<? super ParseError, ? extends R> onFailure, Function<? super T, ? extends R> onSuccess);

    static <T> ParseResult<T> success(T value) {
        return new Success<>(value);
    }

    static <T> ParseResult<T> failure(ParseError error) {
        return new Failure<>(error);
    }

    record Success<T>(T value) implements ParseResult<T> {

        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public T unwrap() {
            return value;
        }

        @Override
        public Optional<ParseError> error() {
            return Optional.empty();
        }

        @Override
        public <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Success<>(mapper.apply(value));
        }

        @Override
        public <R> R fold(Function<? super ParseError, ? extends R> onFailure,
                          Function<? super T, ? extends R> onSuccess) {
            return onSuccess.apply(value);
        }
    }

    record Failure<T>(ParseError cause) implements ParseResult<T> {

        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public T unwrap() {
            throw new IllegalStateException("Parse failed at " + cause.span() + ": " + cause.message());
        }

        @Override
        public Optional<ParseError> error() {
            return Optional.of(cause);
        }

        @Override
        public <R> ParseResult<R> map(Function<? super T, ? extends R> mapper) {
            return new Failure<>(cause);
        }

        @Override
        public <R> R fold(Function<? super ParseError, ? extends R> onFailure,
                          Function<? super T, ? extends R> onSuccess) {
            return onFailure.apply(cause);
        }
    }
}
