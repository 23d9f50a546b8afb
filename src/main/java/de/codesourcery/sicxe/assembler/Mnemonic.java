package de.codesourcery.sicxe.assembler;

import static de.codesourcery.sicxe.assembler.InstructionFormat.DIRECTIVE;
import static de.codesourcery.sicxe.assembler.InstructionFormat.FORMAT_1;
import static de.codesourcery.sicxe.assembler.InstructionFormat.FORMAT_2;
import static de.codesourcery.sicxe.assembler.InstructionFormat.FORMAT_3;

import java.util.Optional;

/**
 * The SIC/XE instruction set plus the assembler directives.
 *
 * Opcodes are given as the full byte, for format 3/4 instructions the lower
 * two bits are replaced by the n and i flags during encoding.
 */
public enum Mnemonic
{
	// format 1
	FIX(FORMAT_1,0xC4,OperandKind.NONE),
	FLOAT(FORMAT_1,0xC0,OperandKind.NONE),
	HIO(FORMAT_1,0xF4,OperandKind.NONE),
	NORM(FORMAT_1,0xC8,OperandKind.NONE),
	SIO(FORMAT_1,0xF0,OperandKind.NONE),
	TIO(FORMAT_1,0xF8,OperandKind.NONE),
	// format 2
	ADDR(FORMAT_2,0x90,OperandKind.REGISTER_REGISTER),
	CLEAR(FORMAT_2,0xB4,OperandKind.REGISTER),
	COMPR(FORMAT_2,0xA0,OperandKind.REGISTER_REGISTER),
	DIVR(FORMAT_2,0x9C,OperandKind.REGISTER_REGISTER),
	MULR(FORMAT_2,0x98,OperandKind.REGISTER_REGISTER),
	RMO(FORMAT_2,0xAC,OperandKind.REGISTER_REGISTER),
	SHIFTL(FORMAT_2,0xA4,OperandKind.REGISTER_COUNT),
	SHIFTR(FORMAT_2,0xA8,OperandKind.REGISTER_COUNT),
	SUBR(FORMAT_2,0x94,OperandKind.REGISTER_REGISTER),
	SVC(FORMAT_2,0xB0,OperandKind.COUNT),
	TIXR(FORMAT_2,0xB8,OperandKind.REGISTER),
	// format 3/4
	ADD(FORMAT_3,0x18),
	ADDF(FORMAT_3,0x58),
	AND(FORMAT_3,0x40),
	COMP(FORMAT_3,0x28),
	COMPF(FORMAT_3,0x88),
	DIV(FORMAT_3,0x24),
	DIVF(FORMAT_3,0x64),
	J(FORMAT_3,0x3C),
	JEQ(FORMAT_3,0x30),
	JGT(FORMAT_3,0x34),
	JLT(FORMAT_3,0x38),
	JSUB(FORMAT_3,0x48),
	LDA(FORMAT_3,0x00),
	LDB(FORMAT_3,0x68),
	LDCH(FORMAT_3,0x50),
	LDF(FORMAT_3,0x70),
	LDL(FORMAT_3,0x08),
	LDS(FORMAT_3,0x6C),
	LDT(FORMAT_3,0x74),
	LDX(FORMAT_3,0x04),
	LPS(FORMAT_3,0xD0),
	MUL(FORMAT_3,0x20),
	MULF(FORMAT_3,0x60),
	OR(FORMAT_3,0x44),
	RD(FORMAT_3,0xD8),
	RSUB(FORMAT_3,0x4C,OperandKind.NONE),
	SSK(FORMAT_3,0xEC),
	STA(FORMAT_3,0x0C),
	STB(FORMAT_3,0x78),
	STCH(FORMAT_3,0x54),
	STF(FORMAT_3,0x80),
	STI(FORMAT_3,0xD4),
	STL(FORMAT_3,0x14),
	STS(FORMAT_3,0x7C),
	STSW(FORMAT_3,0xE8),
	STT(FORMAT_3,0x84),
	STX(FORMAT_3,0x10),
	SUB(FORMAT_3,0x1C),
	SUBF(FORMAT_3,0x5C),
	TD(FORMAT_3,0xE0),
	TIX(FORMAT_3,0x2C),
	WD(FORMAT_3,0xDC),
	// directives
	START,
	END,
	BASE,
	NOBASE,
	BYTE,
	WORD,
	RESB,
	RESW;

	private final InstructionFormat format;
	private final int opcode;
	private final OperandKind operandKind;

	private Mnemonic() {
		this(DIRECTIVE,0,OperandKind.DIRECTIVE);
	}

	private Mnemonic(InstructionFormat format,int opcode) {
		this(format,opcode,OperandKind.MEMORY);
	}

	private Mnemonic(InstructionFormat format,int opcode,OperandKind operandKind)
	{
		this.format = format;
		this.opcode = opcode;
		this.operandKind = operandKind;
	}

	public InstructionFormat getFormat() {
		return format;
	}

	public int getOpcode() {
		return opcode;
	}

	public OperandKind getOperandKind() {
		return operandKind;
	}

	public boolean isDirective() {
		return format == DIRECTIVE;
	}

	/**
	 * Whether this mnemonic may carry the extended-format marker.
	 */
	public boolean supportsExtendedFormat() {
		return format == FORMAT_3;
	}

	/**
	 * Looks up a mnemonic without any extended-format marker.
	 *
	 * @param s mnemonic, case-sensitive
	 */
	public static Optional<Mnemonic> lookup(String s)
	{
		if ( s != null ) {
			for ( final Mnemonic m : values() ) {
				if ( m.name().equals( s ) ) {
					return Optional.of( m );
				}
			}
		}
		return Optional.empty();
	}
}
