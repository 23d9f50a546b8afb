package de.codesourcery.sicxe.assembler.diagnostics;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.Validate;

/**
 * An error attributed to a source line.
 */
public final class Diagnostic
{
	public final int lineNumber;
	public final ErrorKind kind;
	public final String message;

	public Diagnostic(int lineNumber, ErrorKind kind, String message)
	{
		Validate.notNull(kind, "kind must not be NULL");
		this.lineNumber = lineNumber;
		this.kind = kind;
		this.message = StringUtils.isBlank( message ) ? kind.getDescription() : message;
	}

	public static Diagnostic of(int lineNumber, ErrorKind kind) {
		return new Diagnostic(lineNumber,kind,null);
	}

	public boolean isFatal() {
		return kind.isFatal();
	}

	public boolean hasKind(ErrorKind k) {
		return k.equals( this.kind );
	}

	@Override
	public String toString() {
		return "Error on line "+lineNumber+": "+message+" ["+kind+"]";
	}
}
