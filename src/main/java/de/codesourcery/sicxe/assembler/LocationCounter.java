package de.codesourcery.sicxe.assembler;

import de.codesourcery.sicxe.assembler.diagnostics.Outcome;

/**
 * Running address cursor of one pass.
 */
public final class LocationCounter
{
	private int currentAddress;

	public void reset(int address)
	{
		if ( address < 0 ) {
			throw new IllegalArgumentException("Address must be >= 0: "+address);
		}
		this.currentAddress = address;
	}

	public int getCurrentAddress() {
		return currentAddress;
	}

	public void advance(int bytes)
	{
		if ( bytes < 0 ) {
			throw new IllegalArgumentException("Location counter must not move backwards: "+bytes);
		}
		currentAddress += bytes;
	}

	/**
	 * Number of bytes a source line occupies.
	 *
	 * Both passes use this method so they always agree on addresses.
	 * A misplaced extended marker does not change the length, it is reported during encoding.
	 *
	 * @return byte count or a failure if the operand of a sizing directive is malformed
	 */
	public static Outcome<Integer> sizeOf(SourceRecord record,Mnemonic mnemonic)
	{
		switch( mnemonic.getFormat() )
		{
			case FORMAT_1:
			case FORMAT_2:
				return Outcome.success( mnemonic.getFormat().getLength() );
			case FORMAT_3:
				return Outcome.success( record.isExtended() ? 4 : 3 );
			case DIRECTIVE:
				return sizeOfDirective( record , mnemonic );
			default:
				throw new IllegalStateException("Unhandled format "+mnemonic.getFormat());
		}
	}

	private static Outcome<Integer> sizeOfDirective(SourceRecord record,Mnemonic mnemonic)
	{
		switch( mnemonic )
		{
			case START:
			case END:
			case BASE:
			case NOBASE:
				return Outcome.success( 0 );
			case RESB:
			case RESW:
				return DataEncoder.reserveSize( mnemonic , record.getOperand() );
			case BYTE:
				return DataEncoder.encodeByte( record.getOperand() ).map( bytes -> bytes.length );
			case WORD:
				return DataEncoder.wordSize( record.getOperand() );
			default:
				throw new IllegalArgumentException("Not a directive: "+mnemonic);
		}
	}
}
