package de.codesourcery.sicxe.assembler.exceptions;

import de.codesourcery.sicxe.assembler.diagnostics.Diagnostic;

/**
 * Thrown from inside a pass when the location counter can no longer be
 * maintained and the run must be aborted.
 */
public class FatalAssemblyException extends RuntimeException {

	public final Diagnostic diagnostic;

	public FatalAssemblyException(Diagnostic diagnostic)
	{
		super( diagnostic.toString() );
		if ( ! diagnostic.isFatal() ) {
			throw new IllegalArgumentException("Not a fatal error: "+diagnostic);
		}
		this.diagnostic = diagnostic;
	}
}
