package de.codesourcery.sicxe.assembler;

/**
 * The two operand nibbles of a format 2 instruction.
 */
public final class RegisterFields
{
	public final int r1;
	public final int r2;

	public RegisterFields(int r1, int r2)
	{
		if ( r1 < 0 || r1 > 15 || r2 < 0 || r2 > 15 ) {
			throw new IllegalArgumentException("Nibbles out of range: "+r1+","+r2);
		}
		this.r1 = r1;
		this.r2 = r2;
	}

	@Override
	public String toString() {
		return r1+","+r2;
	}
}
