package org.javai.yard;

/**
 * Tie-break rule for a run of operators sharing the same precedence.
 */
public enum Associativity {

	/**
	 * {@code a op b op c} groups as {@code (a op b) op c}.
	 */
	LEFT,

	/**
	 * {@code a op b op c} groups as {@code a op (b op c)}.
	 */
	RIGHT;

	public boolean isLeft() {
		return this == LEFT;
	}

	/**
	 * Reads the associativity of any operator.
	 */
	public static Associativity of(Operator operator) {
		return operator.isLeftAssociative() ? LEFT : RIGHT;
	}
}
