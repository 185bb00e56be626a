package org.javai.yard;

/**
 * Capability every operator handed to {@link ShuntingYard} must expose.
 * <p>
 * Callers implement this on their own operator vocabulary (an enum, a record, a class
 * wrapping an evaluation strategy...). The converter queries nothing but these two
 * properties, so implementations need not define {@code equals}, {@code hashCode} or an
 * ordering. Implementations must be free of observable side effects and safe to query
 * from several threads.
 *
 * @see org.javai.yard.standard.StandardOperator
 */
public interface Operator {

	/**
	 * Binding strength of this operator. Higher binds tighter.
	 *
	 * @return a non-negative rank
	 */
	int precedence();

	/**
	 * Whether operators of equal precedence group from the left, as in
	 * {@code a - b - c == (a - b) - c}.
	 *
	 * @return {@code true} for left associative, {@code false} for right associative
	 */
	boolean isLeftAssociative();
}
