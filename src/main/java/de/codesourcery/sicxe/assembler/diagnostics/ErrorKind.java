package de.codesourcery.sicxe.assembler.diagnostics;

public enum ErrorKind
{
	INVALID_RESERVE_OPERAND("RESB/RESW require a numeric count"),
	SVC_OPERAND_OUT_OF_RANGE("SVC operand n must be of format 0 <= n < 16"),
	REGISTER_OUT_OF_RANGE("Operands r1,r2 must be of format 0 <= r1,r2 < 16"),
	OPERAND_OUT_OF_RANGE("Operand n must be of format 0 < n < 17 and operand r must be of format 0 <= r < 16"),
	NO_BASE_DECLARED("No BASE was declared, cannot use base relative addressing"),
	ADDRESSING_MODE_UNAVAILABLE("Cannot use PC or Base relative addressing"),
	INDEXED_WITH_IMMEDIATE_OR_INDIRECT("Indexed addressing is used with Immediate or Indirect addressing"),
	DUPLICATE_SYMBOL("Symbol is duplicately-defined"),
	UNDEFINED_SYMBOL("Undefined symbol"),
	INVALID_OPERAND("Invalid operand"),
	INVALID_LITERAL("Invalid literal"),
	VALUE_OUT_OF_RANGE("Value does not fit into the operand field"),
	EXTENDED_FORMAT_NOT_ALLOWED("Only format 3 instructions may use the extended format"),
	// fatal
	UNKNOWN_MNEMONIC("Unknown mnemonic",true),
	MALFORMED_PROGRAM_BOUNDS("Malformed program bounds",true);

	private final String description;
	private final boolean fatal;

	private ErrorKind(String description) {
		this(description,false);
	}

	private ErrorKind(String description,boolean fatal) {
		this.description = description;
		this.fatal = fatal;
	}

	public String getDescription() {
		return description;
	}

	/**
	 * Whether this kind of error prevents any further length accounting and
	 * thus aborts the whole assembly run.
	 */
	public boolean isFatal() {
		return fatal;
	}
}
