package de.codesourcery.sicxe.parser;

/**
 * Splits one source line into whitespace-separated fields.
 *
 * Text between single quotes (<code>C'A B'</code>) is kept in one field.
 */
public final class Scanner {

	private final String input;
	private int index;

	public Scanner(String input) {
		this.input = input;
	}

	public boolean eof() {
		return index >= input.length();
	}

	private void assertNotEOF() {
		if ( eof() ) {
			throw new IllegalStateException("Already at EOF");
		}
	}

	public char peek() {
		assertNotEOF();
		return input.charAt(index);
	}

	public char next() {
		assertNotEOF();
		return input.charAt(index++);
	}

	public void skipWhitespace()
	{
		while ( ! eof() && Character.isWhitespace( peek() ) ) {
			index++;
		}
	}

	/**
	 * Reads the next field.
	 *
	 * @return the field or <code>null</code> if there is none left on this line
	 */
	public String nextField()
	{
		skipWhitespace();
		if ( eof() ) {
			return null;
		}
		final StringBuilder buffer = new StringBuilder();
		boolean quoted = false;
		while ( ! eof() && ( quoted || ! Character.isWhitespace( peek() ) ) )
		{
			final char c = next();
			if ( c == '\'' ) {
				quoted = ! quoted;
			}
			buffer.append( c );
		}
		return buffer.toString();
	}
}
