package de.codesourcery.sicxe.assembler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.apache.commons.lang.Validate;

import de.codesourcery.sicxe.assembler.diagnostics.Diagnostic;
import de.codesourcery.sicxe.assembler.diagnostics.ErrorKind;
import de.codesourcery.sicxe.utils.HexDump;

/**
 * Object code of one source line.
 */
public final class EncodedLine
{
	private final int lineNumber;
	private final int address;
	private final int length;
	private final byte[] bytes;
	private final List<Diagnostic> diagnostics;

	public EncodedLine(int lineNumber,int address,int length,byte[] bytes,List<Diagnostic> diagnostics)
	{
		Validate.notNull(bytes, "bytes must not be NULL");
		Validate.notNull(diagnostics, "diagnostics must not be NULL");
		this.lineNumber = lineNumber;
		this.address = address;
		this.length = length;
		this.bytes = bytes.clone();
		this.diagnostics = Collections.unmodifiableList( new ArrayList<>( diagnostics ) );
	}

	public int getLineNumber() {
		return lineNumber;
	}

	public int getAddress() {
		return address;
	}

	/**
	 * Number of bytes this line occupies in memory. Differs from the number of emitted bytes
	 * for RESB/RESW and for lines that failed to encode.
	 */
	public int getLength() {
		return length;
	}

	public byte[] getBytes() {
		return bytes.clone();
	}

	public boolean hasBytes() {
		return bytes.length > 0;
	}

	public String getObjectCode() {
		return HexDump.toHex( bytes );
	}

	public List<Diagnostic> getDiagnostics() {
		return diagnostics;
	}

	public boolean hasErrors() {
		return ! diagnostics.isEmpty();
	}

	public boolean hasError(ErrorKind kind) {
		return diagnostics.stream().anyMatch( d -> d.hasKind( kind ) );
	}

	public boolean contains(int adr) {
		return adr >= address && adr < address + length;
	}

	@Override
	public String toString() {
		return HexDump.toAdr( address )+" "+getObjectCode()+( hasErrors() ? " "+diagnostics : "" );
	}
}
