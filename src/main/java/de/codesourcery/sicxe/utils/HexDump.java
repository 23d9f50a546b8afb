package de.codesourcery.sicxe.utils;

import org.apache.commons.lang.StringUtils;

public class HexDump {

	/**
	 * Renders a 20-bit SIC/XE address as five uppercase hex digits.
	 */
	public static String toAdr(int address) {
		return StringUtils.leftPad( Integer.toHexString( address & 0xfffff ).toUpperCase() , 5 , '0' );
	}

	public static String byteToString(byte value) {
		return StringUtils.leftPad( Integer.toHexString( value & 0xff ).toUpperCase() , 2 , '0' );
	}

	/**
	 * Object code notation, two uppercase hex digits per byte without separators.
	 */
	public static String toHex(byte[] data)
	{
		final StringBuilder buffer = new StringBuilder( data.length * 2 );
		for ( byte b : data ) {
			buffer.append( byteToString( b ) );
		}
		return buffer.toString();
	}
}
