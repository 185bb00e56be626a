package org.javai.yard;

/**
 * Thrown by the {@code OrThrow} conveniences when an infix sequence cannot be converted.
 */
public class ConversionException extends RuntimeException {

	private final ConversionError error;

	public ConversionException(ConversionError error) {
		super(error.message());
		this.error = error;
	}

	public ConversionError error() {
		return error;
	}
}
