package de.codesourcery.sicxe.assembler;

import org.apache.commons.lang.Validate;

/**
 * The analyzed operand of a format 3/4 instruction: which flags to set
 * and what goes into the address field.
 */
public final class AddressingDecision
{
	public final AddressingMode mode;
	public final boolean indexed;
	public final AddressCalculation calculation;
	/**
	 * Displacement, absolute address or immediate constant, possibly negative.
	 */
	public final int value;

	public AddressingDecision(AddressingMode mode, boolean indexed, AddressCalculation calculation, int value)
	{
		Validate.notNull(mode, "mode must not be NULL");
		Validate.notNull(calculation, "calculation must not be NULL");
		if ( indexed && mode != AddressingMode.SIMPLE ) {
			throw new IllegalArgumentException("Indexed addressing requires simple mode, got "+mode);
		}
		this.mode = mode;
		this.indexed = indexed;
		this.calculation = calculation;
		this.value = value;
	}

	/**
	 * @return n,i,x,b,p,e packed into the low six bits
	 * @see Flag
	 */
	public int getFlags() {
		return mode.flags | ( indexed ? Flag.X.bit : 0 ) | calculation.flags;
	}

	public boolean isSet(Flag flag) {
		return flag.isSet( getFlags() );
	}

	public int getFieldWidth() {
		return calculation.fieldWidth;
	}

	@Override
	public String toString() {
		return mode+( indexed ? ",X" : "" )+" "+calculation+" "+value;
	}
}
