package de.codesourcery.sicxe.assembler;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;

import de.codesourcery.sicxe.assembler.diagnostics.Diagnostic;
import de.codesourcery.sicxe.assembler.diagnostics.ErrorKind;
import de.codesourcery.sicxe.parser.SourceParser;
import de.codesourcery.sicxe.utils.HexDump;
import junit.framework.TestCase;

public class AssemblerTest extends TestCase {

	// the COPY program from Beck, "System Software", fig. 2.5
	private static final String[] COPY_PROGRAM = {
		"COPY   START  0",              // 1
		"FIRST  STL    RETADR",         // 2
		"       LDB    #LENGTH",        // 3
		"       BASE   LENGTH",         // 4
		"CLOOP  +JSUB  RDREC",          // 5
		"       LDA    LENGTH",         // 6
		"       COMP   #0",             // 7
		"       JEQ    ENDFIL",         // 8
		"       +JSUB  WRREC",          // 9
		"       J      CLOOP",          // 10
		"ENDFIL LDA    EOF",            // 11
		"       STA    BUFFER",         // 12
		"       LDA    #3",             // 13
		"       STA    LENGTH",         // 14
		"       +JSUB  WRREC",          // 15
		"       J      @RETADR",        // 16
		"EOF    BYTE   C'EOF'",         // 17
		"RETADR RESW   1",              // 18
		"LENGTH RESW   1",              // 19
		"BUFFER RESB   4096",           // 20
		". subroutine to read a record into the buffer", // 21
		"RDREC  CLEAR  X",              // 22
		"       CLEAR  A",              // 23
		"       CLEAR  S",              // 24
		"       +LDT   #4096",          // 25
		"RLOOP  TD     INPUT",          // 26
		"       JEQ    RLOOP",          // 27
		"       RD     INPUT",          // 28
		"       COMPR  A,S",            // 29
		"       JEQ    EXIT",           // 30
		"       STCH   BUFFER,X",       // 31
		"       TIXR   T",              // 32
		"       JLT    RLOOP",          // 33
		"EXIT   STX    LENGTH",         // 34
		"       RSUB",                  // 35
		"INPUT  BYTE   X'F1'",          // 36
		"WRREC  CLEAR  X",              // 37
		"       LDT    LENGTH",         // 38
		"WLOOP  TD     OUTPUT",         // 39
		"       JEQ    WLOOP",          // 40
		"       LDCH   BUFFER,X",       // 41
		"       WD     OUTPUT",         // 42
		"       TIXR   T",              // 43
		"       JLT    WLOOP",          // 44
		"       RSUB",                  // 45
		"OUTPUT BYTE   X'05'",          // 46
		"       END    FIRST"           // 47
	};

	private Assembler assembler;

	@Override
	protected void setUp() throws Exception {
		assembler = new Assembler();
	}

	private AssemblyResult assemble(String... lines) {
		return assembler.assemble( String.join("\n", lines ) );
	}

	private static void assertObjectCode(AssemblyResult result,int lineNumber,String expectedHex)
	{
		final EncodedLine line = result.getLine( lineNumber ).orElseThrow( () -> new AssertionError("No line "+lineNumber) );
		assertEquals( "Object code mismatch on line "+lineNumber+" ("+line+")" , expectedHex , line.getObjectCode() );
	}

	private static void assertAddress(AssemblyResult result,int lineNumber,int expectedAddress)
	{
		final EncodedLine line = result.getLine( lineNumber ).orElseThrow( () -> new AssertionError("No line "+lineNumber) );
		assertEquals( "Address mismatch on line "+lineNumber , HexDump.toAdr( expectedAddress ) , HexDump.toAdr( line.getAddress() ) );
	}

	private static void assertOnlyError(AssemblyResult result,int lineNumber,ErrorKind kind)
	{
		final List<Diagnostic> diagnostics = result.getDiagnostics();
		assertEquals( "Expected exactly one diagnostic but got "+diagnostics , 1 , diagnostics.size() );
		assertEquals( kind , diagnostics.get(0).kind );
		assertEquals( lineNumber , diagnostics.get(0).lineNumber );
	}

	public void testForwardReferenceResolvesPcRelative()
	{
		final AssemblyResult result = assemble( "LOOP   STA ALPHA" , "ALPHA  RESW 1" );

		assertEquals( AssemblerState.DONE , result.getState() );
		assertTrue( "Unexpected errors: "+result.getDiagnostics() , result.getDiagnostics().isEmpty() );

		final EncodedLine sta = result.getLine( 1 ).get();
		assertEquals( 3 , sta.getBytes().length );
		assertTrue( Flag.P.isSet( ( sta.getBytes()[1] & 0xf0 ) >> 4 ) );
		assertObjectCode( result , 1 , "0F2000" );

		assertEquals( 3 , result.getSymbolTable().resolve( "ALPHA" ) );
		assertFalse( result.getLine( 2 ).get().hasBytes() );
	}

	public void testCopyProgram()
	{
		final AssemblyResult result = assemble( COPY_PROGRAM );

		assertTrue( "Unexpected errors: "+result.getDiagnostics() , result.isSuccess() );
		assertEquals( 46 , result.getLines().size() );

		assertObjectCode( result ,  2 , "17202D" );
		assertObjectCode( result ,  3 , "69202D" );
		assertObjectCode( result ,  4 , "" );
		assertObjectCode( result ,  5 , "4B101036" );
		assertObjectCode( result ,  6 , "032026" );
		assertObjectCode( result ,  7 , "290000" );
		assertObjectCode( result ,  8 , "332007" );
		assertObjectCode( result ,  9 , "4B10105D" );
		assertObjectCode( result , 10 , "3F2FEC" );
		assertObjectCode( result , 11 , "032010" );
		assertObjectCode( result , 12 , "0F2016" );
		assertObjectCode( result , 13 , "010003" );
		assertObjectCode( result , 14 , "0F200D" );
		assertObjectCode( result , 15 , "4B10105D" );
		assertObjectCode( result , 16 , "3E2003" );
		assertObjectCode( result , 17 , "454F46" );
		assertObjectCode( result , 18 , "" );
		assertObjectCode( result , 22 , "B410" );
		assertObjectCode( result , 23 , "B400" );
		assertObjectCode( result , 24 , "B440" );
		assertObjectCode( result , 25 , "75101000" );
		assertObjectCode( result , 26 , "E32019" );
		assertObjectCode( result , 27 , "332FFA" );
		assertObjectCode( result , 28 , "DB2013" );
		assertObjectCode( result , 29 , "A004" );
		assertObjectCode( result , 30 , "332008" );
		assertObjectCode( result , 31 , "57C003" );
		assertObjectCode( result , 32 , "B850" );
		assertObjectCode( result , 33 , "3B2FEA" );
		assertObjectCode( result , 34 , "134000" );
		assertObjectCode( result , 35 , "4F0000" );
		assertObjectCode( result , 36 , "F1" );
		assertObjectCode( result , 37 , "B410" );
		assertObjectCode( result , 38 , "774000" );
		assertObjectCode( result , 39 , "E32011" );
		assertObjectCode( result , 40 , "332FFA" );
		assertObjectCode( result , 41 , "53C003" );
		assertObjectCode( result , 42 , "DF2008" );
		assertObjectCode( result , 43 , "B850" );
		assertObjectCode( result , 44 , "3B2FEF" );
		assertObjectCode( result , 45 , "4F0000" );
		assertObjectCode( result , 46 , "05" );

		assertAddress( result , 20 , 0x0036 );
		assertAddress( result , 22 , 0x1036 );
		assertAddress( result , 46 , 0x1076 );

		assertEquals( 0 , result.getStartAddress() );
		assertEquals( 0x1077 , result.getProgramLength() );
		assertEquals( 0 , result.getEntryPoint() );
	}

	public void testLabelAddressesMatchBetweenPasses()
	{
		final AssemblyResult result = assemble( COPY_PROGRAM );

		for ( Label label : result.getSymbolTable().getSymbols() )
		{
			final EncodedLine line = result.getLine( label.getLineNumber() ).get();
			assertEquals( "Address of "+label , label.getAddress() , line.getAddress() );
		}
		assertEquals( 0x0030 , result.getSymbolTable().resolve("RETADR") );
		assertEquals( 0x105D , result.getSymbolTable().resolve("WRREC") );
	}

	public void testStartSetsOrigin()
	{
		final AssemblyResult result = assemble(
				"PROG   START 1000",
				"FIRST  LDA   ALPHA",
				"ALPHA  WORD  5",
				"       END   FIRST");

		assertTrue( result.isSuccess() );
		assertEquals( 0x1000 , result.getStartAddress() );
		assertEquals( 0x1000 , result.getSymbolTable().resolve("PROG") );
		assertEquals( 0x1003 , result.getSymbolTable().resolve("ALPHA") );
		assertObjectCode( result , 2 , "032000" );
		assertObjectCode( result , 3 , "000005" );
		assertEquals( 6 , result.getProgramLength() );
		assertEquals( 0x1000 , result.getEntryPoint() );
		assertEquals( Integer.valueOf( 3 ) , result.getLineNumberForAddress( 0x1004 ).get() );
		assertFalse( result.getLineNumberForAddress( 0x0fff ).isPresent() );
	}

	public void testPcRelativeUpperBoundary()
	{
		final AssemblyResult result = assemble(
				"       LDA    TARGET",
				"       RESB   2047",
				"TARGET WORD   5");

		assertTrue( result.getDiagnostics().toString() , result.isSuccess() );
		assertObjectCode( result , 1 , "0327FF" );
	}

	public void testOneBeyondPcRelativeRangeWithoutBaseFails()
	{
		final AssemblyResult result = assemble(
				"       LDA    TARGET",
				"       RESB   2048",
				"TARGET WORD   5");

		assertOnlyError( result , 1 , ErrorKind.NO_BASE_DECLARED );
		assertFalse( result.getLine( 1 ).get().hasBytes() );
		assertEquals( AssemblerState.DONE , result.getState() );
	}

	public void testOneBeyondPcRelativeRangeUsesBase()
	{
		final AssemblyResult result = assemble(
				"       BASE   TARGET",
				"       LDA    TARGET",
				"       RESB   2048",
				"TARGET WORD   5");

		assertTrue( result.getDiagnostics().toString() , result.isSuccess() );
		assertObjectCode( result , 2 , "034000" );
	}

	public void testUnreachableTarget()
	{
		final AssemblyResult result = assemble(
				"       BASE   FIRST",
				"FIRST  LDA    TARGET",
				"       RESB   5000",
				"TARGET WORD   5");

		assertOnlyError( result , 2 , ErrorKind.ADDRESSING_MODE_UNAVAILABLE );
	}

	public void testNoBaseClearsBaseRegister()
	{
		final AssemblyResult result = assemble(
				"       BASE   TARGET",
				"       NOBASE",
				"       LDA    TARGET",
				"       RESB   2048",
				"TARGET WORD   5");

		assertOnlyError( result , 3 , ErrorKind.NO_BASE_DECLARED );
	}

	public void testDuplicateSymbolKeepsFirstBinding()
	{
		final AssemblyResult result = assemble(
				"ALPHA  WORD   1",
				"ALPHA  WORD   2",
				"       LDA    ALPHA");

		assertOnlyError( result , 2 , ErrorKind.DUPLICATE_SYMBOL );
		assertEquals( 0 , result.getSymbolTable().resolve("ALPHA") );
		assertObjectCode( result , 2 , "000002" );
		assertTrue( result.getLine( 2 ).get().hasError( ErrorKind.DUPLICATE_SYMBOL ) );
		// LDA @ 6 , next instruction @ 9 => displacement -9
		assertObjectCode( result , 3 , "032FF7" );
	}

	public void testIndexedWithImmediateOrIndirectIsRejected()
	{
		final AssemblyResult result = assemble(
				"       LDA    #ALPHA,X",
				"       LDA    @ALPHA,X",
				"ALPHA  WORD   1");

		assertEquals( 2 , result.count( ErrorKind.INDEXED_WITH_IMMEDIATE_OR_INDIRECT ) );
		assertEquals( 2 , result.getDiagnostics().size() );
		assertFalse( result.getLine( 1 ).get().hasBytes() );
		assertFalse( result.getLine( 2 ).get().hasBytes() );
	}

	public void testSvc()
	{
		final AssemblyResult result = assemble( "       SVC    15" , "       SVC    16" );

		assertObjectCode( result , 1 , "B0F0" );
		assertOnlyError( result , 2 , ErrorKind.SVC_OPERAND_OUT_OF_RANGE );
		assertObjectCode( result , 2 , "" );
	}

	public void testReserveWords()
	{
		final AssemblyResult result = assemble(
				"TABLE  RESW   3",
				"NEXT   WORD   0");

		assertTrue( result.isSuccess() );
		assertEquals( 9 , result.getSymbolTable().resolve("NEXT") );
		assertEquals( 9 , result.getLine( 1 ).get().getLength() );
		assertFalse( result.getLine( 1 ).get().hasBytes() );
	}

	public void testReserveWordsWithNonNumericOperand()
	{
		final AssemblyResult result = assemble(
				"TABLE  RESW   ABC",
				"NEXT   WORD   0");

		assertOnlyError( result , 1 , ErrorKind.INVALID_RESERVE_OPERAND );
		assertEquals( 0 , result.getSymbolTable().resolve("NEXT") );
	}

	public void testReserveBytesWithCharacterOperand()
	{
		final AssemblyResult result = assemble( "BUF    RESB   C'AB'" );
		assertOnlyError( result , 1 , ErrorKind.INVALID_RESERVE_OPERAND );
	}

	public void testErrorsDoNotStopAssembly()
	{
		final AssemblyResult result = assemble(
				"       LDA    UNDEF",
				"       LDA    #5",
				"       CLEAR  Q",
				"       +RMO   A,X",
				"       FIX");

		assertEquals( AssemblerState.DONE , result.getState() );
		assertEquals( 3 , result.getDiagnostics().size() );
		assertTrue( result.getLine( 1 ).get().hasError( ErrorKind.UNDEFINED_SYMBOL ) );
		assertObjectCode( result , 2 , "010005" );
		assertTrue( result.getLine( 3 ).get().hasError( ErrorKind.INVALID_OPERAND ) );
		assertTrue( result.getLine( 4 ).get().hasError( ErrorKind.EXTENDED_FORMAT_NOT_ALLOWED ) );
		assertAddress( result , 5 , 10 );
		assertObjectCode( result , 5 , "C4" );
	}

	public void testMalformedLiteralOccupiesNoSpace()
	{
		final AssemblyResult result = assemble(
				"BAD    WORD   X'1234567'",
				"NEXT   WORD   7");

		assertOnlyError( result , 1 , ErrorKind.INVALID_LITERAL );
		assertEquals( 0 , result.getSymbolTable().resolve("NEXT") );
		assertObjectCode( result , 2 , "000007" );
	}

	public void testUndefinedBaseSymbol()
	{
		final AssemblyResult result = assemble( "       BASE   NOWHERE" , "       RSUB" );
		assertOnlyError( result , 1 , ErrorKind.UNDEFINED_SYMBOL );
		assertObjectCode( result , 2 , "4F0000" );
	}

	public void testUnknownMnemonicIsFatal()
	{
		final AssemblyResult result = assemble(
				"       LDA    #1",
				"       FOO    ALPHA",
				"       LDA    UNDEF");

		assertEquals( AssemblerState.FAILED , result.getState() );
		assertTrue( result.isFailed() );
		assertOnlyError( result , 2 , ErrorKind.UNKNOWN_MNEMONIC );
		assertTrue( result.getLines().isEmpty() );
	}

	public void testMisplacedStartIsFatal()
	{
		final AssemblyResult result = assemble( "       LDA    #1" , "       START  100" );
		assertTrue( result.isFailed() );
		assertOnlyError( result , 2 , ErrorKind.MALFORMED_PROGRAM_BOUNDS );
	}

	public void testProgramExceedingAddressSpaceIsFatal()
	{
		final AssemblyResult result = assemble( "       START  FFFFF" , "       RESB   2" );
		assertTrue( result.isFailed() );
		assertOnlyError( result , 2 , ErrorKind.MALFORMED_PROGRAM_BOUNDS );
	}

	public void testProgramFillingAddressSpace()
	{
		final AssemblyResult result = assemble( "       START  FFFFF" , "       RESB   1" );
		assertTrue( result.isSuccess() );
		assertEquals( 1 , result.getProgramLength() );
	}

	public void testStatementsAfterEndAreIgnored()
	{
		final AssemblyResult result = assemble(
				"FIRST  RSUB",
				"       END    FIRST",
				"LATE   LDA    UNDEF");

		assertTrue( result.isSuccess() );
		assertEquals( 2 , result.getLines().size() );
		assertFalse( result.getSymbolTable().isDefined("LATE") );
	}

	public void testUndefinedEntryPoint()
	{
		final AssemblyResult result = assemble( "       RSUB" , "       END    MAIN" );
		assertOnlyError( result , 2 , ErrorKind.UNDEFINED_SYMBOL );
	}

	public void testAssembleRecords()
	{
		final List<SourceRecord> records = Arrays.asList(
				new SourceRecord( 10 , "LOOP" , "+J" , "LOOP" ),
				new SourceRecord( 20 , "TIXR" , "T" ) );

		final AssemblyResult result = assembler.assemble( records );
		assertTrue( result.isSuccess() );
		assertObjectCode( result , 10 , "3F100000" );
		assertObjectCode( result , 20 , "B850" );
		assertAddress( result , 20 , 4 );
	}

	public void testDuplicateLabelWithSharedLineNumbers()
	{
		final List<SourceRecord> records = Arrays.asList(
				new SourceRecord( 0 , "A" , "RESB" , "1" ),
				new SourceRecord( 0 , "A" , "RESB" , "1" ),
				new SourceRecord( 0 , null , "LDA" , "A" ) );

		final AssemblyResult result = assembler.assemble( records );
		assertEquals( AssemblerState.DONE , result.getState() );
		assertEquals( 1 , result.getDiagnostics().size() );
		assertEquals( ErrorKind.DUPLICATE_SYMBOL , result.getDiagnostics().get(0).kind );
		assertEquals( 0 , result.getSymbolTable().resolve( "A" ) );

		final List<EncodedLine> lines = result.getLines();
		assertEquals( 3 , lines.size() );
		assertFalse( lines.get(0).hasErrors() );
		assertTrue( lines.get(1).hasError( ErrorKind.DUPLICATE_SYMBOL ) );
		assertEquals( 1 , lines.get(1).getAddress() );
		// LDA @ 2 , next instruction @ 5 => displacement -5
		assertEquals( "032FFB" , lines.get(2).getObjectCode() );
		assertFalse( lines.get(2).hasErrors() );
	}

	public void testDiagnosticsStayWithTheirRecord()
	{
		final List<SourceRecord> records = Arrays.asList(
				new SourceRecord( 0 , "SVC" , "16" ),
				new SourceRecord( 0 , "SVC" , "15" ) );

		final AssemblyResult result = assembler.assemble( records );
		assertEquals( 1 , result.getDiagnostics().size() );

		final List<EncodedLine> lines = result.getLines();
		assertTrue( lines.get(0).hasError( ErrorKind.SVC_OPERAND_OUT_OF_RANGE ) );
		assertFalse( lines.get(0).hasBytes() );
		assertFalse( lines.get(1).hasErrors() );
		assertEquals( "B0F0" , lines.get(1).getObjectCode() );
	}

	public void testWordLiterals()
	{
		final AssemblyResult result = assemble(
				"W      WORD   X'000010'",
				"       WORD   C'EOF'",
				"       WORD   X'F1'");

		assertTrue( result.getDiagnostics().toString() , result.isSuccess() );
		assertObjectCode( result , 1 , "000010" );
		assertObjectCode( result , 2 , "454F46" );
		assertObjectCode( result , 3 , "0000F1" );
	}

	public void testStateTransitions()
	{
		assertEquals( AssemblerState.IDLE , assembler.getState() );
		assemble( "       RSUB" );
		assertEquals( AssemblerState.DONE , assembler.getState() );
	}

	public void testEachRunIsIndependent()
	{
		final AssemblyResult first = assemble( "ALPHA  WORD   1" );
		final AssemblyResult second = assemble( "ALPHA  WORD   2" );

		assertTrue( first.isSuccess() );
		assertTrue( second.isSuccess() );
		assertEquals( 1 , first.getSymbolTable().size() );
	}

	public void testSourceParserRoundTripsWithStream() throws Exception
	{
		final List<SourceRecord> records = new SourceParser().parse( new ByteArrayInputStream( String.join("\n", COPY_PROGRAM ).getBytes( StandardCharsets.UTF_8 ) ) );
		assertEquals( 46 , records.size() );
		assertTrue( assembler.assemble( records ).isSuccess() );
	}
}
