package de.codesourcery.sicxe;

/**
 * Machine constants of the SIC/XE architecture as far as the assembler needs them.
 *
 * @author tobias.gierke@code-sourcery.de
 */
public class Constants
{
	// memory layout
	public static final int WORD_SIZE = 3; // bytes
	public static final int MAX_ADDRESS = 0xfffff; // 1 MiB address space

	// format 3 displacement field
	public static final int PC_RELATIVE_MIN = -2048;
	public static final int PC_RELATIVE_MAX = 2047;
	public static final int BASE_RELATIVE_MAX = 4095;
	public static final int FORMAT3_FIELD_MAX = 0xfff;

	// format 4 address field
	public static final int FORMAT4_FIELD_MAX = 0xfffff;

	// WORD directive, 24 bits either signed or unsigned
	public static final int WORD_VALUE_MIN = -(1<<23);
	public static final int WORD_VALUE_MAX = 0xffffff;

	// BYTE directive with a numeric operand
	public static final int BYTE_VALUE_MIN = -128;
	public static final int BYTE_VALUE_MAX = 255;
}
