package de.codesourcery.sicxe.assembler.diagnostics;

import java.util.List;

import junit.framework.TestCase;

public class ErrorReporterTest extends TestCase {

	public void testCollectsInOrder()
	{
		final ErrorReporter reporter = new ErrorReporter();
		assertFalse( reporter.hasErrors() );

		reporter.report( 0 , new Diagnostic( 3 , ErrorKind.UNDEFINED_SYMBOL , "Undefined symbol X" ) );
		reporter.report( 1 , 1 , Outcome.failure( ErrorKind.INVALID_LITERAL ) );
		reporter.report( 0 , Diagnostic.of( 3 , ErrorKind.UNDEFINED_SYMBOL ) );

		final List<Diagnostic> all = reporter.getDiagnostics();
		assertEquals( 3 , all.size() );
		assertEquals( 3 , all.get(0).lineNumber );
		assertEquals( 1 , all.get(1).lineNumber );
		assertEquals( 2 , reporter.getDiagnosticsForRecord( 0 ).size() );
		assertEquals( ErrorKind.INVALID_LITERAL , reporter.getDiagnosticsForRecord( 1 ).get(0).kind );
		assertTrue( reporter.getDiagnosticsForRecord( 2 ).isEmpty() );
		assertEquals( 2 , reporter.count( ErrorKind.UNDEFINED_SYMBOL ) );
		assertTrue( reporter.hasErrors() );
		assertFalse( reporter.hasFatalErrors() );
	}

	public void testRecordsSharingALineNumberKeepTheirOwnDiagnostics()
	{
		final ErrorReporter reporter = new ErrorReporter();
		reporter.report( 4 , 0 , Outcome.failure( ErrorKind.SVC_OPERAND_OUT_OF_RANGE ) );

		assertEquals( 1 , reporter.getDiagnosticsForRecord( 4 ).size() );
		assertTrue( reporter.getDiagnosticsForRecord( 5 ).isEmpty() );
	}

	public void testRunLevelDiagnosticsBelongToNoRecord()
	{
		final ErrorReporter reporter = new ErrorReporter();
		reporter.report( Diagnostic.of( 0 , ErrorKind.MALFORMED_PROGRAM_BOUNDS ) );

		assertEquals( 1 , reporter.getDiagnostics().size() );
		assertTrue( reporter.getDiagnosticsForRecord( 0 ).isEmpty() );
	}

	public void testFatal()
	{
		final ErrorReporter reporter = new ErrorReporter();
		reporter.report( Diagnostic.of( 1 , ErrorKind.UNKNOWN_MNEMONIC ) );
		assertTrue( reporter.hasFatalErrors() );
	}

	public void testDiagnosticToString()
	{
		final Diagnostic diagnostic = new Diagnostic( 7 , ErrorKind.DUPLICATE_SYMBOL , null );
		assertEquals( "Error on line 7: Symbol is duplicately-defined [DUPLICATE_SYMBOL]" , diagnostic.toString() );
	}

	public void testFatalKinds()
	{
		for ( ErrorKind kind : ErrorKind.values() ) {
			final boolean expected = kind == ErrorKind.UNKNOWN_MNEMONIC || kind == ErrorKind.MALFORMED_PROGRAM_BOUNDS;
			assertEquals( kind.name() , expected , kind.isFatal() );
		}
	}
}
