package org.javai.yard;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Deque;
import java.util.List;
import java.util.Objects;
import org.javai.yard.StackEntry.LeftParenMarker;
import org.javai.yard.StackEntry.PendingFunction;
import org.javai.yard.StackEntry.PendingOperator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Converts infix token sequences to postfix (reverse Polish) order using the
 * shunting-yard algorithm, extended for function calls and argument separators.
 * <p>
 * Only parenthesis and function-call balance is checked. Operand/operator adjacency
 * (two values in a row, a trailing operator) is left to whoever evaluates the output.
 * <p>
 * Example usage:
 *
 * <pre>
 * // 5 + 2 * sin(123)
 * ConversionResult&lt;Integer, String, StandardOperator&gt; result = ShuntingYard.toPostfix(List.of(
 *         InputToken.value(5), InputToken.operator(ADD), InputToken.value(2),
 *         InputToken.operator(MULTIPLY), InputToken.function("sin"),
 *         InputToken.leftParen(), InputToken.value(123), InputToken.rightParen()));
 * // 5 2 123 sin * +
 * List&lt;OutputToken&lt;Integer, String, StandardOperator&gt;&gt; postfix = result.orElseThrow();
 * </pre>
 *
 * All methods are stateless and safe to call concurrently.
 */
public final class ShuntingYard {

	private static final Logger logger = LoggerFactory.getLogger(ShuntingYard.class);

	private ShuntingYard() {
	}

	/**
	 * Converts an infix token sequence to postfix order.
	 *
	 * @param infix the tokens in written order
	 * @return the postfix tokens, or the imbalance that prevented conversion
	 * @throws NullPointerException if {@code infix} or one of its tokens is null
	 * @throws IllegalArgumentException if an operator reports a negative precedence
	 */
	public static <V, F, O extends Operator> ConversionResult<V, F, O> toPostfix(
			Iterable<? extends InputToken<V, F, O>> infix) {
		Objects.requireNonNull(infix, "infix tokens must not be null");
		Conversion<V, F, O> conversion = new Conversion<>();
		int position = 0;
		for (InputToken<V, F, O> token : infix) {
			Objects.requireNonNull(token, "token at position " + position + " is null");
			ConversionError error = conversion.accept(token, position);
			if (error != null) {
				return fail(error);
			}
			position++;
		}
		ConversionError error = conversion.drain();
		if (error != null) {
			return fail(error);
		}
		logger.trace("Converted {} infix tokens to {} postfix tokens", position, conversion.output.size());
		return new ConversionResult.Success<>(conversion.output);
	}

	@SafeVarargs
	public static <V, F, O extends Operator> ConversionResult<V, F, O> toPostfix(InputToken<V, F, O>... infix) {
		return toPostfix(Arrays.asList(infix));
	}

	/**
	 * Converts an infix token sequence to postfix order.
	 *
	 * @throws ConversionException if the parentheses or function calls are unbalanced
	 */
	public static <V, F, O extends Operator> List<OutputToken<V, F, O>> toPostfixOrThrow(
			Iterable<? extends InputToken<V, F, O>> infix) {
		ConversionResult<V, F, O> result = toPostfix(infix);
		return result.orElseThrow();
	}

	private static <V, F, O extends Operator> ConversionResult<V, F, O> fail(ConversionError error) {
		logger.debug("Infix conversion failed: {} at position {}", error.kind(), error.position());
		return new ConversionResult.Failure<>(error);
	}

	/**
	 * Working state of a single conversion. Never shared between calls.
	 */
	private static final class Conversion<V, F, O extends Operator> {

		private final List<OutputToken<V, F, O>> output = new ArrayList<>();
		private final Deque<StackEntry<F, O>> stack = new ArrayDeque<>();

		/**
		 * @return the error the token causes, or null if conversion can continue
		 */
		ConversionError accept(InputToken<V, F, O> token, int position) {
			if (token instanceof InputToken.Value<V, F, O> value) {
				output.add(new OutputToken.Value<>(value.value()));
			} else if (token instanceof InputToken.Function<V, F, O> function) {
				stack.push(new PendingFunction<>(function.name(), position));
			} else if (token instanceof InputToken.LeftParen) {
				stack.push(new LeftParenMarker<>(position));
			} else if (token instanceof InputToken.OperatorToken<V, F, O> operator) {
				pushOperator(operator.operator());
			} else if (token instanceof InputToken.RightParen) {
				return closeParen(position);
			} else if (token instanceof InputToken.ArgSeparator) {
				popOperators();
			}
			return null;
		}

		private void pushOperator(O incoming) {
			int precedence = checkedPrecedence(incoming);
			while (stack.peek() instanceof PendingOperator<F, O> pending) {
				int stackedPrecedence = checkedPrecedence(pending.operator());
				if (stackedPrecedence > precedence
						|| (stackedPrecedence == precedence && incoming.isLeftAssociative())) {
					stack.pop();
					output.add(new OutputToken.OperatorToken<>(pending.operator()));
				} else {
					break;
				}
			}
			stack.push(new PendingOperator<>(incoming));
		}

		private ConversionError closeParen(int position) {
			// Everything above the nearest open parenthesis belongs to the group being closed
			while (!(stack.peek() instanceof LeftParenMarker)) {
				if (stack.isEmpty()) {
					return ConversionError.unmatchedRightParen(position);
				}
				emit(stack.pop());
			}
			stack.pop();
			if (stack.peek() instanceof PendingFunction) {
				emit(stack.pop());
			}
			return null;
		}

		private void popOperators() {
			while (stack.peek() instanceof PendingOperator<F, O> pending) {
				stack.pop();
				output.add(new OutputToken.OperatorToken<>(pending.operator()));
			}
		}

		private void emit(StackEntry<F, O> entry) {
			if (entry instanceof PendingOperator<F, O> pending) {
				output.add(new OutputToken.OperatorToken<>(pending.operator()));
			} else if (entry instanceof PendingFunction<F, O> function) {
				output.add(new OutputToken.Function<>(function.name()));
			}
		}

		/**
		 * Empties the stack into the output at end of input.
		 *
		 * @return the error for the innermost unclosed parenthesis or call, or null
		 */
		ConversionError drain() {
			while (!stack.isEmpty()) {
				StackEntry<F, O> entry = stack.pop();
				if (entry instanceof PendingOperator<F, O> pending) {
					output.add(new OutputToken.OperatorToken<>(pending.operator()));
				} else if (entry instanceof LeftParenMarker<F, O> marker) {
					return ConversionError.unmatchedLeftParen(marker.position());
				} else if (entry instanceof PendingFunction<F, O> function) {
					return ConversionError.unclosedFunction(function.position(), function.name());
				}
			}
			return null;
		}

		private static int checkedPrecedence(Operator operator) {
			int precedence = operator.precedence();
			if (precedence < 0) {
				throw new IllegalArgumentException(
						"Operator " + operator + " reports negative precedence " + precedence);
			}
			return precedence;
		}
	}
}
