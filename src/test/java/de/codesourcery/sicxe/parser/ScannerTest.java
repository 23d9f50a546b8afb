package de.codesourcery.sicxe.parser;

import junit.framework.TestCase;

public class ScannerTest extends TestCase {

	public void testFields()
	{
		final Scanner scanner = new Scanner("  LDA\t BUFFER,X  ");
		assertEquals( "LDA" , scanner.nextField() );
		assertEquals( "BUFFER,X" , scanner.nextField() );
		assertNull( scanner.nextField() );
		assertTrue( scanner.eof() );
	}

	public void testQuotedField()
	{
		final Scanner scanner = new Scanner("C'A B' X");
		assertEquals( "C'A B'" , scanner.nextField() );
		assertEquals( "X" , scanner.nextField() );
	}

	public void testPeekAndNext()
	{
		final Scanner scanner = new Scanner("ab");
		assertEquals( 'a' , scanner.peek() );
		assertEquals( 'a' , scanner.next() );
		assertEquals( 'b' , scanner.next() );
		try {
			scanner.peek();
			fail("Should've failed");
		} catch(IllegalStateException e) {
			// ok
		}
	}
}
