package de.codesourcery.sicxe.assembler;

/**
 * Addressing flags of format 3/4 instructions.
 *
 * The bit values are laid out the way the six flags follow each other in the
 * instruction: n and i end up in the low bits of the opcode byte, x,b,p,e in
 * the high nibble of the second byte.
 */
public enum Flag
{
	N(0b100000), // indirect
	I(0b010000), // immediate
	X(0b001000), // indexed
	B(0b000100), // base-relative
	P(0b000010), // pc-relative
	E(0b000001); // extended

	public final int bit;

	private Flag(int bit) {
		this.bit = bit;
	}

	public boolean isSet(int flags) {
		return ( flags & bit ) != 0;
	}
}
