package de.codesourcery.sicxe.assembler;

import static de.codesourcery.sicxe.assembler.diagnostics.ErrorKind.INVALID_LITERAL;
import static de.codesourcery.sicxe.assembler.diagnostics.ErrorKind.INVALID_RESERVE_OPERAND;
import static de.codesourcery.sicxe.assembler.diagnostics.ErrorKind.VALUE_OUT_OF_RANGE;

import org.apache.commons.lang.StringUtils;

import de.codesourcery.sicxe.Constants;
import de.codesourcery.sicxe.assembler.diagnostics.Outcome;
import de.codesourcery.sicxe.utils.Misc;

/**
 * Operands of the storage directives BYTE, WORD, RESB and RESW.
 *
 * <p>Literals are written <code>C'text'</code> (one byte per character) or
 * <code>X'hexdigits'</code> (one byte per digit pair). WORD literals are
 * padded with leading zeros to a full word.</p>
 */
public final class DataEncoder
{
	private DataEncoder() {
	}

	/**
	 * Number of bytes reserved by RESB/RESW.
	 */
	public static Outcome<Integer> reserveSize(Mnemonic mnemonic,String operand)
	{
		final int unitSize;
		switch( mnemonic )
		{
			case RESB: unitSize = 1; break;
			case RESW: unitSize = Constants.WORD_SIZE; break;
			default:
				throw new IllegalArgumentException("Not a reserve directive: "+mnemonic);
		}

		final String s = StringUtils.trimToEmpty( operand );
		if ( isCharacterLiteral( s ) || s.startsWith("C'") ) {
			return Outcome.failure( INVALID_RESERVE_OPERAND , mnemonic+" does not support character operands" );
		}

		final Integer count;
		if ( isHexLiteral( s ) ) {
			count = Misc.parseHex( literalBody( s ) );
		} else {
			count = Misc.parseDecimal( s );
		}
		if ( count == null || count < 0 ) {
			return Outcome.failure( INVALID_RESERVE_OPERAND , mnemonic+" requires a non-negative count, got '"+s+"'" );
		}
		return Outcome.success( (int) Math.min( (long) count * unitSize , Integer.MAX_VALUE ) );
	}

	public static Outcome<byte[]> encodeByte(String operand)
	{
		final String s = StringUtils.trimToEmpty( operand );
		if ( isCharacterLiteral( s ) )
		{
			final String body = literalBody( s );
			if ( body.isEmpty() ) {
				return Outcome.failure( INVALID_LITERAL , "Empty character literal" );
			}
			final byte[] result = new byte[ body.length() ];
			for ( int i = 0 ; i < body.length() ; i++ )
			{
				final char c = body.charAt(i);
				if ( c > 0xff ) {
					return Outcome.failure( INVALID_LITERAL , "Character '"+c+"' does not fit into a byte" );
				}
				result[i] = (byte) c;
			}
			return Outcome.success( result );
		}

		if ( isHexLiteral( s ) )
		{
			final String body = literalBody( s );
			if ( body.isEmpty() || ( body.length() & 1 ) != 0 || ! Misc.isHex( body ) ) {
				return Outcome.failure( INVALID_LITERAL , "Hex literal needs an even, non-zero number of hex digits: "+s );
			}
			final byte[] result = new byte[ body.length() / 2 ];
			for ( int i = 0 ; i < result.length ; i++ ) {
				result[i] = (byte) Integer.parseInt( body.substring( i*2 , i*2 + 2 ) , 16 );
			}
			return Outcome.success( result );
		}

		final Integer value = Misc.parseDecimal( s );
		if ( value == null ) {
			return Outcome.failure( INVALID_LITERAL , "Invalid BYTE operand: '"+s+"'" );
		}
		if ( value < Constants.BYTE_VALUE_MIN || value > Constants.BYTE_VALUE_MAX ) {
			return Outcome.failure( VALUE_OUT_OF_RANGE , "BYTE value out of range ("+Constants.BYTE_VALUE_MIN+"..."+Constants.BYTE_VALUE_MAX+"): "+value );
		}
		return Outcome.success( new byte[] { (byte) value.intValue() } );
	}

	/**
	 * Checks the syntax of a WORD operand: a symbol, a decimal constant or a literal
	 * of at most three bytes.
	 *
	 * @return the size in bytes
	 */
	public static Outcome<Integer> wordSize(String operand)
	{
		final String s = StringUtils.trimToEmpty( operand );
		if ( isCharacterLiteral( s ) || isHexLiteral( s ) ) {
			return wordLiteral( s ).map( bytes -> Constants.WORD_SIZE );
		}
		if ( ! Misc.isDecimal( s ) && ! Operand.isSymbolName( s ) ) {
			return Outcome.failure( INVALID_LITERAL , "Invalid WORD operand: '"+s+"'" );
		}
		return Outcome.success( Constants.WORD_SIZE );
	}

	public static Outcome<byte[]> encodeWord(String operand,AddressingModeAnalyzer analyzer)
	{
		final String s = StringUtils.trimToEmpty( operand );
		if ( isCharacterLiteral( s ) || isHexLiteral( s ) ) {
			return wordLiteral( s );
		}
		return wordSize( s ).flatMap( size -> analyzer.resolveValue( s ) )
				.flatMap( DataEncoder::encodeWordValue );
	}

	/*
	 * C'..' with up to 3 characters or X'..' with up to 6 hex digits,
	 * right-aligned in the word.
	 */
	private static Outcome<byte[]> wordLiteral(String s)
	{
		final String body = literalBody( s );
		final long value;
		if ( isHexLiteral( s ) )
		{
			if ( body.isEmpty() || body.length() > 2 * Constants.WORD_SIZE || ! Misc.isHex( body ) ) {
				return Outcome.failure( INVALID_LITERAL , "WORD hex literal needs 1 to "+( 2 * Constants.WORD_SIZE )+" hex digits: "+s );
			}
			value = Long.parseLong( body , 16 );
		}
		else
		{
			final Outcome<byte[]> chars = encodeByte( s );
			if ( chars.isFailure() ) {
				return chars;
			}
			if ( chars.getValue().length > Constants.WORD_SIZE ) {
				return Outcome.failure( INVALID_LITERAL , "WORD character literal must not exceed "+Constants.WORD_SIZE+" characters: "+s );
			}
			long v = 0;
			for ( byte b : chars.getValue() ) {
				v = v << 8 | ( b & 0xff );
			}
			value = v;
		}
		return Outcome.success( new byte[] { (byte) ( value >> 16 ) , (byte) ( value >> 8 ) , (byte) value } );
	}

	public static Outcome<byte[]> encodeWordValue(int value)
	{
		if ( value < Constants.WORD_VALUE_MIN || value > Constants.WORD_VALUE_MAX ) {
			return Outcome.failure( VALUE_OUT_OF_RANGE , "WORD value out of range: "+value );
		}
		return Outcome.success( new byte[] { (byte) ( value >> 16 ) , (byte) ( value >> 8 ) , (byte) value } );
	}

	public static boolean isCharacterLiteral(String s) {
		return isLiteral( s , 'C' );
	}

	public static boolean isHexLiteral(String s) {
		return isLiteral( s , 'X' );
	}

	private static boolean isLiteral(String s,char type) {
		return s != null && s.length() >= 3 && s.charAt(0) == type && s.charAt(1) == '\'' && s.charAt( s.length() - 1 ) == '\'';
	}

	private static String literalBody(String s) {
		return s.substring( 2 , s.length() - 1 );
	}
}
