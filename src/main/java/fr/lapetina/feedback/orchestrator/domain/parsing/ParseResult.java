package fr.lapetina.feedback.orchestrator.domain.parsing;

import java.util.Objects;
import java.util.function.Function;

/**
 * Outcome of parsing or decoding a remote reply: either a value with the strategy
 * that produced it, or a {@link ParseError}.
 */
public record ParseResult<T>(T value, ParseStrategy strategy, ParseError error) {

    public ParseResult {
        if ((value == null) == (error == null)) {
            throw new IllegalArgumentException("Exactly one of value or error must be set");
        }
    }

    public static <T> ParseResult<T> success(T value, ParseStrategy strategy) {
        return new ParseResult<>(Objects.requireNonNull(value, "Value is required"), strategy, null);
    }

    public static <T> ParseResult<T> failure(ParseError error) {
        return new ParseResult<>(null, null, Objects.requireNonNull(error, "Error is required"));
    }

    public static <T> ParseResult<T> failure(String raw, String message) {
        return failure(new ParseError(raw, message, null));
    }

    public boolean isSuccess() {
        return error == null;
    }

    public boolean isFailure() {
        return error != null;
    }

    /**
     * Chains a further step that may itself fail; failures short-circuit.
     */
    public <R> ParseResult<R> flatMap(Function<T, ParseResult<R>> next) {
        if (isFailure()) {
            return failure(error);
        }
        ParseResult<R> result = next.apply(value);
        if (result.isSuccess() && result.strategy() == null) {
            return success(result.value(), strategy);
        }
        return result;
    }
}
