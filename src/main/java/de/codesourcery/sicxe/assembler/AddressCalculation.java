package de.codesourcery.sicxe.assembler;

/**
 * How the target address is derived from the instruction's address field.
 */
public enum AddressCalculation
{
	PC_RELATIVE(Flag.P.bit,12),
	BASE_RELATIVE(Flag.B.bit,12),
	/**
	 * Field holds the value itself, b=p=0.
	 */
	ABSOLUTE(0,12),
	/**
	 * Format 4, 20-bit field.
	 */
	EXTENDED(Flag.E.bit,20);

	public final int flags;
	public final int fieldWidth;

	private AddressCalculation(int flags,int fieldWidth) {
		this.flags = flags;
		this.fieldWidth = fieldWidth;
	}
}
