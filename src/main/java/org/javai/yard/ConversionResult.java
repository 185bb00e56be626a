package org.javai.yard;

import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Outcome of {@link ShuntingYard#toPostfix(Iterable)}: either the complete postfix
 * sequence or the error that stopped the conversion. A failure never carries partial output.
 *
 * @param <V> the value type
 * @param <F> the function name type
 * @param <O> the operator type
 */
public sealed interface ConversionResult<V, F, O extends Operator> {

	record Success<V, F, O extends Operator>(List<OutputToken<V, F, O>> output)
			implements ConversionResult<V, F, O> {
		public Success {
			output = List.copyOf(output);
		}
	}

	record Failure<V, F, O extends Operator>(ConversionError error) implements ConversionResult<V, F, O> {
		public Failure {
			Objects.requireNonNull(error, "error must not be null");
		}
	}

	default boolean isSuccess() {
		return this instanceof Success;
	}

	default Optional<List<OutputToken<V, F, O>>> outputTokens() {
		if (this instanceof Success<V, F, O> success) {
			return Optional.of(success.output());
		}
		return Optional.empty();
	}

	default Optional<ConversionError> conversionError() {
		if (this instanceof Failure<V, F, O> failure) {
			return Optional.of(failure.error());
		}
		return Optional.empty();
	}

	/**
	 * @return the postfix tokens
	 * @throws ConversionException if the conversion failed
	 */
	default List<OutputToken<V, F, O>> orElseThrow() {
		if (this instanceof Failure<V, F, O> failure) {
			throw new ConversionException(failure.error());
		}
		return ((Success<V, F, O>) this).output();
	}
}
