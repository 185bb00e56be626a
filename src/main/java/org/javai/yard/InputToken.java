package org.javai.yard;

import java.util.Objects;

/**
 * A token of an infix expression, in written left-to-right order.
 * <p>
 * Token kinds:
 * <ul>
 *   <li>{@link Value} - an operand, passed through unexamined</li>
 *   <li>{@link OperatorToken} - an operator such as {@code +} or {@code **}</li>
 *   <li>{@link Function} - the name of a function call, followed by its {@link LeftParen}</li>
 *   <li>{@link LeftParen} and {@link RightParen} - grouping or call parentheses</li>
 *   <li>{@link ArgSeparator} - the comma between function arguments</li>
 * </ul>
 *
 * @param <V> the caller's value type
 * @param <F> the caller's function name type
 * @param <O> the caller's operator type
 */
public sealed interface InputToken<V, F, O extends Operator> {

	static <V, F, O extends Operator> InputToken<V, F, O> value(V value) {
		return new Value<>(value);
	}

	static <V, F, O extends Operator> InputToken<V, F, O> operator(O operator) {
		return new OperatorToken<>(operator);
	}

	static <V, F, O extends Operator> InputToken<V, F, O> function(F name) {
		return new Function<>(name);
	}

	static <V, F, O extends Operator> InputToken<V, F, O> leftParen() {
		return new LeftParen<>();
	}

	static <V, F, O extends Operator> InputToken<V, F, O> rightParen() {
		return new RightParen<>();
	}

	static <V, F, O extends Operator> InputToken<V, F, O> argSeparator() {
		return new ArgSeparator<>();
	}

	record Value<V, F, O extends Operator>(V value) implements InputToken<V, F, O> {
		public Value {
			Objects.requireNonNull(value, "value must not be null");
		}

		@Override
		public String toString() {
			return "Value(" + value + ")";
		}
	}

	record OperatorToken<V, F, O extends Operator>(O operator) implements InputToken<V, F, O> {
		public OperatorToken {
			Objects.requireNonNull(operator, "operator must not be null");
		}

		@Override
		public String toString() {
			return "Operator(" + operator + ")";
		}
	}

	record Function<V, F, O extends Operator>(F name) implements InputToken<V, F, O> {
		public Function {
			Objects.requireNonNull(name, "function name must not be null");
		}

		@Override
		public String toString() {
			return "Function(" + name + ")";
		}
	}

	record LeftParen<V, F, O extends Operator>() implements InputToken<V, F, O> {
		@Override
		public String toString() {
			return "LeftParen";
		}
	}

	record RightParen<V, F, O extends Operator>() implements InputToken<V, F, O> {
		@Override
		public String toString() {
			return "RightParen";
		}
	}

	record ArgSeparator<V, F, O extends Operator>() implements InputToken<V, F, O> {
		@Override
		public String toString() {
			return "ArgSeparator";
		}
	}
}
