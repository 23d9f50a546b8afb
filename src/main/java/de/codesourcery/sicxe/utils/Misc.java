package de.codesourcery.sicxe.utils;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.apache.commons.lang.StringUtils;

public class Misc
{
	private static final Pattern VALID_HEX_STRING = Pattern.compile("^([0-9a-fA-F]+)$");

	private static final Pattern VALID_DECIMAL_STRING = Pattern.compile("^(-?[0-9]+)$");

	/**
	 * Parses a hexadecimal number without any prefix.
	 *
	 * @param input
	 * @return the value or <code>null</code> if the input is no valid hex number. Values too large
	 * for an <code>int</code> are clamped to {@link Integer#MAX_VALUE}.
	 */
	public static Integer parseHex(String input)
	{
		if ( input != null )
		{
			final Matcher matcher = VALID_HEX_STRING.matcher( input.trim() );
			if ( matcher.matches() ) {
				return clamp( Long.parseLong( trimLeadingZeros( matcher.group(1) , 15 ) , 16 ) );
			}
		}
		return null;
	}

	/**
	 * Parses an optionally signed decimal number.
	 *
	 * @param input
	 * @return the value or <code>null</code> if the input is no valid decimal number. Values
	 * outside of the <code>int</code> range are clamped.
	 */
	public static Integer parseDecimal(String input)
	{
		if ( input != null )
		{
			final Matcher matcher = VALID_DECIMAL_STRING.matcher( input.trim() );
			if ( matcher.matches() )
			{
				final String digits = matcher.group(1);
				final boolean negative = digits.startsWith("-");
				final String magnitude = trimLeadingZeros( negative ? digits.substring(1) : digits , 18 );
				final long value = Long.parseLong( magnitude );
				return clamp( negative ? -value : value );
			}
		}
		return null;
	}

	public static boolean isDecimal(String input) {
		return input != null && VALID_DECIMAL_STRING.matcher( input.trim() ).matches();
	}

	public static boolean isHex(String input) {
		return input != null && VALID_HEX_STRING.matcher( input.trim() ).matches();
	}

	private static String trimLeadingZeros(String digits,int maxLength)
	{
		final String stripped = StringUtils.stripStart( digits , "0" );
		if ( stripped.isEmpty() ) {
			return "0";
		}
		// anything longer is out of range for our purposes anyway
		return stripped.length() > maxLength ? StringUtils.repeat( "9" , maxLength ) : stripped;
	}

	private static int clamp(long value)
	{
		if ( value > Integer.MAX_VALUE ) {
			return Integer.MAX_VALUE;
		}
		if ( value < Integer.MIN_VALUE ) {
			return Integer.MIN_VALUE;
		}
		return (int) value;
	}
}
