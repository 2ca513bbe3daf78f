package com.hcltech.vocab.common.errorsor;

import com.hcltech.vocab.common.function.ThrowingFunction;
import com.hcltech.vocab.common.function.ThrowingSupplier;

import java.util.List;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Either a value or a non-empty list of error messages.
 * <p>
 * Conversions that must never throw (end-to-end hierarchy conversions, JSON decoding) return this
 * instead of raising, so that callers can report every problem in one place.
 */
public interface ErrorsOr<T> {

    boolean isError();

    boolean isValue();

    Optional<T> getValue();

    List<String> getErrors();

    ErrorsOr<T> addPrefixIfError(String prefix);

    <T1> T1 fold(Function<T, T1> onValue, Function<List<String>, T1> onError);

    // --- Helpers ---
    static <T> ErrorsOr<T> lift(T value) {
        return new Value<>(value);
    }

    static <T> ErrorsOr<T> error(String error) {
        return new Error<>(List.of(error));
    }

    static <T> ErrorsOr<T> errors(List<String> errors) {
        return new Error<>(errors);
    }

    default T valueOrThrow() {
        return getValue().orElseThrow(() ->
                new IllegalStateException("Expected value but got errors: " + getErrors()));
    }

    default List<String> errorsOrThrow() {
        if (isError()) return getErrors();
        throw new IllegalStateException("Expected errors but got value: " + getValue().orElse(null));
    }

    default T valueOrDefault(T defaultValue) {
        return getValue().orElse(defaultValue);
    }

    // --- Functional helpers ---
    default <U> ErrorsOr<U> map(Function<? super T, ? extends U> f) {
        return isError() ? ErrorsOr.errors(getErrors()) : ErrorsOr.lift(f.apply(getValue().get()));
    }

    default <U> ErrorsOr<U> flatMap(Function<? super T, ErrorsOr<U>> f) {
        return isError() ? ErrorsOr.errors(getErrors()) : f.apply(getValue().get());
    }

    default void ifError(Consumer<? super List<String>> consumer) {
        if (isError()) consumer.accept(getErrors());
    }

    /** Runs the body; any exception becomes a single error produced by {@code toMsg}. */
    static <T> ErrorsOr<T> trying(ThrowingSupplier<T> body, Function<Exception, String> toMsg) {
        try {
            return ErrorsOr.lift(body.get());
        } catch (Exception e) {
            return ErrorsOr.error(toMsg.apply(e));
        }
    }

    /** Runs the body, reporting an exception by its message (or its class name if it has none). */
    static <T> ErrorsOr<T> trying(ThrowingSupplier<T> body) {
        return trying(body, ErrorsOr::describe);
    }

    /** Map + try: apply f to the value, turning an exception into an error. */
    default <U> ErrorsOr<U> mapTry(ThrowingFunction<? super T, ? extends U> f) {
        if (isError()) return ErrorsOr.errors(getErrors());
        try {
            return ErrorsOr.lift(f.apply(getValue().get()));
        } catch (Exception e) {
            return ErrorsOr.error(describe(e));
        }
    }

    private static String describe(Exception e) {
        return e.getMessage() == null ? e.getClass().getSimpleName() : e.getMessage();
    }
}
