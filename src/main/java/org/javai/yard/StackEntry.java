package org.javai.yard;

/**
 * Entry of the converter's working stack. Operators, open parentheses and pending
 * function calls share one stack so their relative order has a single source of truth.
 *
 * @param <F> the function name type
 * @param <O> the operator type
 */
sealed interface StackEntry<F, O extends Operator> {

	/**
	 * An operator waiting for its right operand to be complete.
	 */
	record PendingOperator<F, O extends Operator>(O operator) implements StackEntry<F, O> {
	}

	/**
	 * An open parenthesis, remembered with the input position that opened it.
	 */
	record LeftParenMarker<F, O extends Operator>(int position) implements StackEntry<F, O> {
	}

	/**
	 * A function whose argument list has not been closed yet.
	 */
	record PendingFunction<F, O extends Operator>(F name, int position) implements StackEntry<F, O> {
	}
}
