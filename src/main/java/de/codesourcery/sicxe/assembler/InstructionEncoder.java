package de.codesourcery.sicxe.assembler;

/**
 * Packs opcode, flags and operand fields into the SIC/XE instruction layouts.
 *
 * <pre>
 * format 1:  oooooooo
 * format 2:  oooooooo rrrrrrrr
 * format 3:  oooooo n i | x b p e dddd | dddddddd
 * format 4:  oooooo n i | x b p e aaaa | aaaaaaaa | aaaaaaaa
 * </pre>
 */
public final class InstructionEncoder
{
	private InstructionEncoder() {
	}

	public static byte[] encodeFormat1(Mnemonic mnemonic)
	{
		assertFormat( mnemonic , InstructionFormat.FORMAT_1 );
		return new byte[] { (byte) mnemonic.getOpcode() };
	}

	public static byte[] encodeFormat2(Mnemonic mnemonic,RegisterFields fields)
	{
		assertFormat( mnemonic , InstructionFormat.FORMAT_2 );
		return new byte[] { (byte) mnemonic.getOpcode() , (byte) ( fields.r1 << 4 | fields.r2 ) };
	}

	/**
	 * Encodes a format 3 or, if the decision uses {@link AddressCalculation#EXTENDED}, a format 4 instruction.
	 * Negative displacements end up in two's complement.
	 */
	public static byte[] encodeFormat3(Mnemonic mnemonic,AddressingDecision decision)
	{
		assertFormat( mnemonic , InstructionFormat.FORMAT_3 );

		final int flags = decision.getFlags();
		final int first = ( mnemonic.getOpcode() & 0xfc ) | ( flags >> 4 & 0b11 );
		final int xbpe = ( flags & 0b1111 ) << 4;

		if ( decision.getFieldWidth() == 12 )
		{
			final int field = decision.value & 0xfff;
			return new byte[] {
					(byte) first,
					(byte) ( xbpe | field >> 8 ),
					(byte) ( field & 0xff ) };
		}
		final int field = decision.value & 0xfffff;
		return new byte[] {
				(byte) first,
				(byte) ( xbpe | field >> 16 ),
				(byte) ( field >> 8 & 0xff ),
				(byte) ( field & 0xff ) };
	}

	private static void assertFormat(Mnemonic mnemonic,InstructionFormat expected)
	{
		if ( mnemonic.getFormat() != expected ) {
			throw new IllegalArgumentException( mnemonic+" is not a "+expected+" instruction");
		}
	}
}
