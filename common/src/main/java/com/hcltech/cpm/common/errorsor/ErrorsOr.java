package com.hcltech.cpm.common.errorsor;

import com.hcltech.cpm.common.function.ThrowingSupplier;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;

/**
 * Either a value or a non-empty list of error messages.
 * <p>
 * Used where all problems should be reported together (input validation,
 * file loading) rather than failing on the first one.
 */
public interface ErrorsOr<T> {

    boolean isError();

    boolean isValue();

    Optional<T> getValue();

    List<String> getErrors();

    ErrorsOr<T> addPrefixIfError(String prefix);

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

    /** Values in order if every item is a value, otherwise every error of every item. */
    static <T> ErrorsOr<List<T>> sequence(List<ErrorsOr<T>> items) {
        List<T> values = new ArrayList<>(items.size());
        List<String> errors = new ArrayList<>();
        for (ErrorsOr<T> item : items) {
            if (item.isError()) errors.addAll(item.getErrors());
            else values.add(item.getValue().get());
        }
        return errors.isEmpty() ? lift(List.copyOf(values)) : errors(errors);
    }

    default T valueOrThrow() {
        return getValue().orElseThrow(() ->
                new IllegalStateException("Expected value but got errors: " + getErrors()));
    }

    default List<String> errorsOrThrow() {
        if (isError()) return getErrors();
        throw new IllegalStateException("Expected errors but got value: " + getValue().orElse(null));
    }

    default <U> ErrorsOr<U> flatMap(Function<? super T, ErrorsOr<U>> f) {
        return isError() ? ErrorsOr.errors(getErrors()) : f.apply(getValue().get());
    }

    /** Wrap a throwing supplier, turning the exception into a message with {@code toMsg}. */
    static <T> ErrorsOr<T> trying(ThrowingSupplier<T> body, Function<Exception, String> toMsg) {
        try {
            return ErrorsOr.lift(body.get());
        } catch (Exception e) {
            return ErrorsOr.error(toMsg.apply(e));
        }
    }
}
