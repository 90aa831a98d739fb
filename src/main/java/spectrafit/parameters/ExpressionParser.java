/**
 * SpectraFit
 * ExpressionParser.java
 *
 * Line-shape fitting engine for 1-D spectra.
 *
 */

package spectrafit.parameters;

import java.util.Locale;

import spectrafit.exception.InvalidExpressionException;

/**
 * Recursive-descent parser for parameter expressions. The grammar is limited
 * to arithmetic:
 *
 * <pre>
 * expr    := term (('+' | '-') term)*
 * term    := unary (('*' | '/') unary)*
 * unary   := ('-' | '+') unary | primary
 * primary := number | name | '(' expr ')'
 * </pre>
 *
 * Names are letters, digits and underscores starting with a letter or an
 * underscore, and are lower-cased. Function calls, powers, attribute access
 * and anything else are rejected.
 */
public final class ExpressionParser {

	private final String text;
	private int pos;

	private ExpressionParser(final String text) {
		this.text = text;
	}

	/**
	 * @throws InvalidExpressionException if {@code text} is not in the grammar
	 */
	public static Expression parse(final String text) {
		if (text == null || text.trim().isEmpty()) {
			throw new InvalidExpressionException(String.valueOf(text),
				"empty expression");
		}
		final ExpressionParser parser = new ExpressionParser(text);
		final Expression e = parser.expression();
		parser.skipWhitespace();
		if (parser.pos < text.length()) {
			throw parser.error("unexpected '" + text.charAt(parser.pos) + "'");
		}
		return e;
	}

	private Expression expression() {
		Expression e = term();
		while (true) {
			final char c = peek();
			if (c == '+' || c == '-') {
				pos++;
				e = new Expression.Binary(c, e, term());
			}
			else {
				return e;
			}
		}
	}

	private Expression term() {
		Expression e = unary();
		while (true) {
			final char c = peek();
			if (c == '*' || c == '/') {
				pos++;
				if (c == '*' && peek() == '*') {
					throw error("'**' is not supported");
				}
				e = new Expression.Binary(c, e, unary());
			}
			else {
				return e;
			}
		}
	}

	private Expression unary() {
		final char c = peek();
		if (c == '-') {
			pos++;
			return new Expression.Negation(unary());
		}
		if (c == '+') {
			pos++;
			return unary();
		}
		return primary();
	}

	private Expression primary() {
		final char c = peek();
		if (c == '(') {
			pos++;
			final Expression e = expression();
			if (peek() != ')') throw error("missing ')'");
			pos++;
			return e;
		}
		if (Character.isDigit(c) || c == '.') {
			return number();
		}
		if (Character.isLetter(c) || c == '_') {
			final int start = pos;
			while (pos < text.length() && (Character.isLetterOrDigit(text.charAt(
				pos)) || text.charAt(pos) == '_'))
			{
				pos++;
			}
			final String name = text.substring(start, pos).toLowerCase(Locale.ROOT);
			if (peek() == '(') throw error("function calls are not supported");
			if (peek() == '.') throw error("attribute access is not supported");
			return new Expression.Reference(name, -1);
		}
		if (c == 0) throw error("unexpected end of expression");
		throw error("unexpected '" + c + "'");
	}

	private Expression number() {
		final int start = pos;
		while (pos < text.length() && (Character.isDigit(text.charAt(pos)) || text
			.charAt(pos) == '.'))
		{
			pos++;
		}
		if (pos < text.length() && (text.charAt(pos) == 'e' || text.charAt(
			pos) == 'E'))
		{
			int p = pos + 1;
			if (p < text.length() && (text.charAt(p) == '+' || text.charAt(
				p) == '-')) p++;
			if (p < text.length() && Character.isDigit(text.charAt(p))) {
				pos = p;
				while (pos < text.length() && Character.isDigit(text.charAt(pos)))
					pos++;
			}
		}
		final String literal = text.substring(start, pos);
		if (pos < text.length() && (Character.isLetter(text.charAt(pos)) || text
			.charAt(pos) == '_'))
		{
			throw error("malformed number '" + literal + text.charAt(pos) + "'");
		}
		try {
			return new Expression.Constant(Double.parseDouble(literal));
		}
		catch (final NumberFormatException e) {
			throw error("malformed number '" + literal + "'");
		}
	}

	/** @return the next non-blank character, or 0 at the end */
	private char peek() {
		skipWhitespace();
		return pos < text.length() ? text.charAt(pos) : 0;
	}

	private void skipWhitespace() {
		while (pos < text.length() && Character.isWhitespace(text.charAt(pos)))
			pos++;
	}

	private InvalidExpressionException error(final String reason) {
		return new InvalidExpressionException(text, reason + " at position " +
			pos);
	}
}
