package org.javai.yard;

import static org.assertj.core.api.Assertions.assertThat;

import org.apache.logging.log4j.Level;
import org.javai.yard.standard.StandardOperator;
import org.javai.yard.testsupport.LogCaptor;
import org.junit.jupiter.api.Test;

class ShuntingYardLoggingTest {

	@Test
	void failureIsLoggedAtDebug() {
		try (LogCaptor captor = LogCaptor.forClass(ShuntingYard.class, Level.DEBUG)) {
			ShuntingYard.toPostfix(
					InputToken.<Integer, String, StandardOperator>value(1),
					InputToken.rightParen());

			assertThat(captor.messagesAt(Level.DEBUG))
					.containsExactly("Infix conversion failed: UNMATCHED_RIGHT_PAREN at position 1");
		}
	}

	@Test
	void successIsLoggedOnlyAtTrace() {
		try (LogCaptor captor = LogCaptor.forClass(ShuntingYard.class, Level.TRACE)) {
			ShuntingYard.toPostfix(
					InputToken.<Integer, String, StandardOperator>value(1),
					InputToken.operator(StandardOperator.ADD),
					InputToken.value(2));

			assertThat(captor.messagesAt(Level.DEBUG)).isEmpty();
			assertThat(captor.messagesAt(Level.TRACE))
					.containsExactly("Converted 3 infix tokens to 3 postfix tokens");
		}
	}
}
