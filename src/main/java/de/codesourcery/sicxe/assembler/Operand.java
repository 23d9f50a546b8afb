package de.codesourcery.sicxe.assembler;

import org.apache.commons.lang.StringUtils;

import de.codesourcery.sicxe.utils.Misc;

/**
 * Syntax of a memory operand: <code>[#|@]value[,X]</code>.
 */
public final class Operand
{
	public static final char IMMEDIATE_PREFIX = '#';
	public static final char INDIRECT_PREFIX = '@';
	public static final String INDEX_SUFFIX = ",X";

	public final String text;
	public final AddressingMode mode;
	public final boolean indexed;
	/**
	 * Symbol name or decimal constant with prefix and suffix stripped.
	 */
	public final String value;

	private Operand(String text, AddressingMode mode, boolean indexed, String value)
	{
		this.text = text;
		this.mode = mode;
		this.indexed = indexed;
		this.value = value;
	}

	public static Operand parse(String text)
	{
		String s = StringUtils.deleteWhitespace( StringUtils.defaultString( text ) );

		AddressingMode mode = AddressingMode.SIMPLE;
		if ( s.length() > 0 && s.charAt(0) == IMMEDIATE_PREFIX ) {
			mode = AddressingMode.IMMEDIATE;
			s = s.substring(1);
		}
		else if ( s.length() > 0 && s.charAt(0) == INDIRECT_PREFIX ) {
			mode = AddressingMode.INDIRECT;
			s = s.substring(1);
		}

		final boolean indexed = s.endsWith( INDEX_SUFFIX );
		if ( indexed ) {
			s = s.substring( 0 , s.length() - INDEX_SUFFIX.length() );
		}
		return new Operand( text , mode , indexed , s );
	}

	public boolean isConstant() {
		return Misc.isDecimal( value );
	}

	public static boolean isSymbolName(String s)
	{
		if ( StringUtils.isEmpty( s ) || ! Character.isLetter( s.charAt(0) ) ) {
			return false;
		}
		for ( int i = 1 ; i < s.length() ; i++ ) {
			final char c = s.charAt(i);
			if ( ! Character.isLetterOrDigit( c ) && c != '_' ) {
				return false;
			}
		}
		return true;
	}

	@Override
	public String toString() {
		return text;
	}
}
