package de.codesourcery.sicxe.assembler;

public enum AddressingMode
{
	/**
	 * LDA #3
	 */
	IMMEDIATE(Flag.I.bit),
	/**
	 * LDA ALPHA
	 */
	SIMPLE(Flag.N.bit | Flag.I.bit),
	/**
	 * J @RETADR
	 */
	INDIRECT(Flag.N.bit);

	public final int flags;

	private AddressingMode(int flags) {
		this.flags = flags;
	}
}
