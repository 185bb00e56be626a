package org.javai.yard.standard;

import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;
import java.util.stream.Collectors;
import org.javai.yard.Associativity;
import org.javai.yard.Operator;

/**
 * Ready-made arithmetic, comparison and logical operators.
 * <p>
 * Precedence ranks follow the JavaScript operator precedence table
 * (<a href="https://developer.mozilla.org/en-US/docs/Web/JavaScript/Reference/Operators/Operator_precedence">MDN</a>),
 * so expressions group the way a script author expects. Exponentiation is the only
 * right-associative operator. Callers with a different vocabulary implement
 * {@link Operator} themselves instead.
 */
public enum StandardOperator implements Operator {

	EXPONENT("**", 13, Associativity.RIGHT),
	MULTIPLY("*", 12, Associativity.LEFT),
	DIVIDE("/", 12, Associativity.LEFT),
	REMAINDER("%", 12, Associativity.LEFT),
	ADD("+", 11, Associativity.LEFT),
	SUBTRACT("-", 11, Associativity.LEFT),
	LESS_THAN("<", 9, Associativity.LEFT),
	LESS_EQUAL("<=", 9, Associativity.LEFT),
	GREATER_THAN(">", 9, Associativity.LEFT),
	GREATER_EQUAL(">=", 9, Associativity.LEFT),
	EQUAL("==", 8, Associativity.LEFT),
	NOT_EQUAL("!=", 8, Associativity.LEFT),
	BITWISE_AND("&", 7, Associativity.LEFT),
	BITWISE_XOR("^", 6, Associativity.LEFT),
	BITWISE_OR("|", 5, Associativity.LEFT),
	AND("&&", 4, Associativity.LEFT),
	OR("||", 3, Associativity.LEFT);

	private static final Map<String, StandardOperator> BY_SYMBOL = Arrays.stream(values())
			.collect(Collectors.toUnmodifiableMap(StandardOperator::symbol, Function.identity()));

	// Longest first so "**" wins over "*" and "<=" over "<"
	private static final List<String> SYMBOLS = Arrays.stream(values())
			.map(StandardOperator::symbol)
			.sorted(Comparator.comparingInt(String::length).reversed())
			.toList();

	private final String symbol;
	private final int precedence;
	private final Associativity associativity;

	StandardOperator(String symbol, int precedence, Associativity associativity) {
		this.symbol = symbol;
		this.precedence = precedence;
		this.associativity = associativity;
	}

	public String symbol() {
		return symbol;
	}

	public Associativity associativity() {
		return associativity;
	}

	@Override
	public int precedence() {
		return precedence;
	}

	@Override
	public boolean isLeftAssociative() {
		return associativity.isLeft();
	}

	public static Optional<StandardOperator> fromSymbol(String symbol) {
		return Optional.ofNullable(symbol).map(BY_SYMBOL::get);
	}

	/**
	 * @return every operator symbol, longest first, for greedy tokenizers
	 */
	public static List<String> symbols() {
		return SYMBOLS;
	}
}
