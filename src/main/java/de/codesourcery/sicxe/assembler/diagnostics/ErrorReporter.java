package de.codesourcery.sicxe.assembler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Collects the diagnostics of one assembly run in the order they were detected.
 */
public class ErrorReporter
{
	private static final Logger LOG = LoggerFactory.getLogger(ErrorReporter.class);

	private final List<Diagnostic> diagnostics = new ArrayList<>();

	// by index of the offending record in the input, line numbers need not be unique
	private final Map<Integer,List<Diagnostic>> byRecord = new HashMap<>();

	/**
	 * Reports a diagnostic that concerns the run as a whole.
	 */
	public void report(Diagnostic diagnostic)
	{
		Validate.notNull(diagnostic, "diagnostic must not be NULL");
		LOG.debug("{}", diagnostic);
		diagnostics.add( diagnostic );
	}

	/**
	 * Reports a diagnostic caused by the record at <code>recordIndex</code>.
	 */
	public void report(int recordIndex,Diagnostic diagnostic)
	{
		report( diagnostic );
		byRecord.computeIfAbsent( recordIndex , k -> new ArrayList<>() ).add( diagnostic );
	}

	public void report(int recordIndex,int lineNumber,Outcome<?> failure) {
		report( recordIndex , failure.toDiagnostic( lineNumber ) );
	}

	public List<Diagnostic> getDiagnostics() {
		return Collections.unmodifiableList( new ArrayList<>( diagnostics ) );
	}

	public List<Diagnostic> getDiagnosticsForRecord(int recordIndex)
	{
		final List<Diagnostic> result = byRecord.get( recordIndex );
		return result == null ? Collections.<Diagnostic>emptyList() : Collections.unmodifiableList( new ArrayList<>( result ) );
	}

	public boolean hasErrors() {
		return ! diagnostics.isEmpty();
	}

	public boolean hasFatalErrors() {
		return diagnostics.stream().anyMatch( Diagnostic::isFatal );
	}

	public int count(ErrorKind kind) {
		return (int) diagnostics.stream().filter( d -> d.hasKind( kind ) ).count();
	}
}
