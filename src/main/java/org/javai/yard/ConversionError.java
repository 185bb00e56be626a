package org.javai.yard;

import java.util.Objects;

/**
 * Why an infix token sequence could not be converted.
 *
 * @param kind the imbalance detected
 * @param position zero-based index of the offending input token
 * @param function name of the unclosed function call, or null when the offending token
 *                 is a parenthesis
 */
public record ConversionError(Kind kind, int position, Object function) {

	public ConversionError {
		Objects.requireNonNull(kind, "kind must not be null");
		if (position < 0) {
			throw new IllegalArgumentException("position must not be negative: " + position);
		}
	}

	public ConversionError(Kind kind, int position) {
		this(kind, position, null);
	}

	public enum Kind {
		/**
		 * A right parenthesis with no open left parenthesis to close.
		 */
		UNMATCHED_RIGHT_PAREN,

		/**
		 * A left parenthesis or function call still open at end of input.
		 */
		UNMATCHED_LEFT_PAREN
	}

	public static ConversionError unmatchedRightParen(int position) {
		return new ConversionError(Kind.UNMATCHED_RIGHT_PAREN, position);
	}

	public static ConversionError unmatchedLeftParen(int position) {
		return new ConversionError(Kind.UNMATCHED_LEFT_PAREN, position);
	}

	public static ConversionError unclosedFunction(int position, Object function) {
		return new ConversionError(Kind.UNMATCHED_LEFT_PAREN, position,
				Objects.requireNonNull(function, "function must not be null"));
	}

	public String message() {
		return switch (kind) {
			case UNMATCHED_RIGHT_PAREN -> "Unmatched ')' at position " + position
					+ ": no matching opening parenthesis";
			case UNMATCHED_LEFT_PAREN -> function != null
					? "Unclosed call to '" + function + "' at position " + position + ": reached end of input"
					: "Unmatched '(' at position " + position + ": reached end of input";
		};
	}
}
