package de.codesourcery.sicxe.assembler;

import de.codesourcery.sicxe.assembler.diagnostics.ErrorKind;
import de.codesourcery.sicxe.assembler.diagnostics.Outcome;
import junit.framework.TestCase;

public class LocationCounterTest extends TestCase {

	private static int sizeOf(String mnemonic,String operand)
	{
		final SourceRecord record = new SourceRecord( 1 , mnemonic , operand );
		final Outcome<Integer> size = LocationCounter.sizeOf( record , Mnemonic.lookup( record.getBaseMnemonic() ).get() );
		assertTrue( "Sizing failed: "+size , size.isSuccess() );
		return size.getValue();
	}

	public void testInstructionSizes()
	{
		assertEquals( 1 , sizeOf( "FIX" , "" ) );
		assertEquals( 2 , sizeOf( "CLEAR" , "X" ) );
		assertEquals( 3 , sizeOf( "LDA" , "ALPHA" ) );
		assertEquals( 4 , sizeOf( "+LDA" , "ALPHA" ) );
		assertEquals( 3 , sizeOf( "RSUB" , "" ) );
	}

	public void testExtendedMarkerDoesNotChangeFormat2Size() {
		assertEquals( 2 , sizeOf( "+CLEAR" , "X" ) );
	}

	public void testDirectiveSizes()
	{
		assertEquals( 0 , sizeOf( "START" , "1000" ) );
		assertEquals( 0 , sizeOf( "END" , "FIRST" ) );
		assertEquals( 0 , sizeOf( "BASE" , "LENGTH" ) );
		assertEquals( 0 , sizeOf( "NOBASE" , "" ) );
		assertEquals( 3 , sizeOf( "WORD" , "5" ) );
		assertEquals( 3 , sizeOf( "BYTE" , "C'EOF'" ) );
		assertEquals( 1 , sizeOf( "BYTE" , "X'F1'" ) );
		assertEquals( 1 , sizeOf( "BYTE" , "12" ) );
		assertEquals( 12 , sizeOf( "RESW" , "4" ) );
		assertEquals( 4096 , sizeOf( "RESB" , "4096" ) );
	}

	public void testSizingFailure()
	{
		final Outcome<Integer> size = LocationCounter.sizeOf( new SourceRecord( 1 , "RESW" , "ABC" ) , Mnemonic.RESW );
		assertTrue( size.isFailure() );
		assertEquals( ErrorKind.INVALID_RESERVE_OPERAND , size.getError() );

		final Outcome<Integer> word = LocationCounter.sizeOf( new SourceRecord( 1 , "WORD" , "C'ABCD'" ) , Mnemonic.WORD );
		assertEquals( ErrorKind.INVALID_LITERAL , word.getError() );

		final Outcome<Integer> bytes = LocationCounter.sizeOf( new SourceRecord( 1 , "BYTE" , "X'1'" ) , Mnemonic.BYTE );
		assertEquals( ErrorKind.INVALID_LITERAL , bytes.getError() );
	}

	public void testAdvance()
	{
		final LocationCounter counter = new LocationCounter();
		counter.reset( 0x1000 );
		counter.advance( 3 );
		counter.advance( 0 );
		assertEquals( 0x1003 , counter.getCurrentAddress() );

		try {
			counter.advance( -1 );
			fail("Should've failed");
		} catch(IllegalArgumentException e) {
			// ok
		}
		assertEquals( 0x1003 , counter.getCurrentAddress() );
	}
}
