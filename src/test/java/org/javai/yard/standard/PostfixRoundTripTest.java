package org.javai.yard.standard;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;
import java.util.stream.Stream;
import org.javai.yard.InputToken;
import org.javai.yard.OutputToken;
import org.javai.yard.ShuntingYard;
import org.javai.yard.testsupport.InfixTokenizer;
import org.javai.yard.testsupport.PostfixEvaluator;
import org.javai.yard.testsupport.RecursiveDescentEvaluator;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.MethodSource;

/**
 * Postfix output evaluated on a stack must agree with direct infix evaluation.
 */
@DisplayName("Postfix round trip over StandardOperator")
class PostfixRoundTripTest {

	private static final String[] BINARY = StandardOperator.symbols().toArray(String[]::new);
	private static final String[] UNARY_FUNCTIONS = {"sin", "cos", "abs", "sqrt"};
	private static final String[] BINARY_FUNCTIONS = {"max", "min"};

	private static double viaPostfix(String expression) {
		List<InputToken<Double, String, StandardOperator>> infix = InfixTokenizer.tokenize(expression);
		List<OutputToken<Double, String, StandardOperator>> postfix = ShuntingYard.toPostfixOrThrow(infix);
		return PostfixEvaluator.evaluate(postfix);
	}

	@ParameterizedTest(name = "{0} = {1}")
	@CsvSource(delimiter = ';', value = {
			"1 + 2 * 3; 7",
			"(1 + 2) * 3; 9",
			"10 - 4 - 3; 3",
			"100 / 10 / 5; 2",
			"2 ** 3 ** 2; 512",
			"(2 ** 3) ** 2; 64",
			"17 % 5 * 2; 4",
			"1 + 2 < 4 == 1; 1",
			"3 | 4 ^ 6 & 5; 3",
			"0 || 1 && 0; 0",
			"max(2, 3) / 3 * 4; 4",
			"clamp(12, 0, 10) - min(4, abs(3 - 5)); 8",
			"5 + 2 * sqrt(16); 13"
	})
	void knownExpressions(String expression, double expected) {
		assertThat(viaPostfix(expression)).isEqualTo(expected);
		assertThat(RecursiveDescentEvaluator.evaluate(expression)).isEqualTo(expected);
	}

	@ParameterizedTest
	@MethodSource("randomExpressions")
	void agreesWithRecursiveDescent(String expression) {
		// boxed so NaN results compare equal
		assertThat((Object) viaPostfix(expression))
				.as(expression)
				.isEqualTo(RecursiveDescentEvaluator.evaluate(expression));
	}

	@Test
	void functionResultFeedsSurroundingOperators() {
		double result = viaPostfix("1 + 2 - clamp(3 * 2 + 1, 0, 100) * 4 / 5");
		assertThat(result).isCloseTo(-2.6, within(1e-9));
	}

	static Stream<String> randomExpressions() {
		Random random = new Random(20240611L);
		return IntStream.range(0, 250).mapToObj(i -> expression(random, 4));
	}

	private static String expression(Random random, int depth) {
		if (depth == 0) {
			return atom(random);
		}
		int choice = random.nextInt(10);
		if (choice < 5) {
			return expression(random, depth - 1) + " " + pick(random, BINARY) + " " + expression(random, depth - 1);
		}
		if (choice < 6) {
			return "(" + expression(random, depth - 1) + ")";
		}
		if (choice < 7) {
			return pick(random, UNARY_FUNCTIONS) + "(" + expression(random, depth - 1) + ")";
		}
		if (choice < 8) {
			return pick(random, BINARY_FUNCTIONS) + "(" + expression(random, depth - 1) + ", "
					+ expression(random, depth - 1) + ")";
		}
		return atom(random);
	}

	private static String atom(Random random) {
		return Integer.toString(random.nextInt(10));
	}

	private static String pick(Random random, String[] choices) {
		return choices[random.nextInt(choices.length)];
	}
}
