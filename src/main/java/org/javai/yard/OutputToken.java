package org.javai.yard;

import java.util.Objects;

/**
 * A token of a postfix (reverse Polish) expression, as produced by {@link ShuntingYard}.
 * A stack evaluator consumes these left to right: values are pushed, operators and
 * functions pop their operands and push their result.
 *
 * @param <V> the caller's value type
 * @param <F> the caller's function name type
 * @param <O> the caller's operator type
 */
public sealed interface OutputToken<V, F, O extends Operator> {

	static <V, F, O extends Operator> OutputToken<V, F, O> value(V value) {
		return new Value<>(value);
	}

	static <V, F, O extends Operator> OutputToken<V, F, O> operator(O operator) {
		return new OperatorToken<>(operator);
	}

	static <V, F, O extends Operator> OutputToken<V, F, O> function(F name) {
		return new Function<>(name);
	}

	record Value<V, F, O extends Operator>(V value) implements OutputToken<V, F, O> {
		public Value {
			Objects.requireNonNull(value, "value must not be null");
		}

		@Override
		public String toString() {
			return "Value(" + value + ")";
		}
	}

	record OperatorToken<V, F, O extends Operator>(O operator) implements OutputToken<V, F, O> {
		public OperatorToken {
			Objects.requireNonNull(operator, "operator must not be null");
		}

		@Override
		public String toString() {
			return "Operator(" + operator + ")";
		}
	}

	record Function<V, F, O extends Operator>(F name) implements OutputToken<V, F, O> {
		public Function {
			Objects.requireNonNull(name, "function name must not be null");
		}

		@Override
		public String toString() {
			return "Function(" + name + ")";
		}
	}
}
