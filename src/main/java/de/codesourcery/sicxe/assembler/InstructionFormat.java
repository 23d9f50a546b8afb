package de.codesourcery.sicxe.assembler;

public enum InstructionFormat
{
	FORMAT_1(1),
	FORMAT_2(2),
	/**
	 * Format 3, or format 4 when the mnemonic carries the extended marker.
	 */
	FORMAT_3(3),
	DIRECTIVE(0);

	private final int length;

	private InstructionFormat(int length) {
		this.length = length;
	}

	/**
	 * Length in bytes, directives have no fixed length.
	 */
	public int getLength() {
		return length;
	}
}
