package de.codesourcery.sicxe.assembler;

import static de.codesourcery.sicxe.assembler.diagnostics.ErrorKind.EXTENDED_FORMAT_NOT_ALLOWED;
import static de.codesourcery.sicxe.assembler.diagnostics.ErrorKind.INVALID_OPERAND;
import static de.codesourcery.sicxe.assembler.diagnostics.ErrorKind.VALUE_OUT_OF_RANGE;

import java.util.ArrayList;
import java.util.List;

import org.apache.commons.lang.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.codesourcery.sicxe.Constants;
import de.codesourcery.sicxe.assembler.diagnostics.ErrorReporter;
import de.codesourcery.sicxe.assembler.diagnostics.Outcome;
import de.codesourcery.sicxe.utils.HexDump;

/**
 * Encodes every source line against the symbol table built by {@link FirstPass}.
 *
 * A line that fails to encode yields an {@link EncodedLine} without bytes, the
 * remaining lines are assembled regardless.
 */
public class SecondPass
{
	private static final Logger LOG = LoggerFactory.getLogger(SecondPass.class);

	private static final byte[] NO_BYTES = new byte[0];

	private final AssemblyContext context;
	private final AddressingModeAnalyzer analyzer;

	public SecondPass(AssemblyContext context)
	{
		Validate.notNull(context, "context must not be NULL");
		this.context = context;
		this.analyzer = new AddressingModeAnalyzer( context );
	}

	public List<EncodedLine> run(List<SourceRecord> records)
	{
		final LocationCounter counter = context.getLocationCounter();
		final ErrorReporter reporter = context.getErrorReporter();

		counter.reset( context.getOrigin() );
		context.clearBaseAddress();

		final List<EncodedLine> result = new ArrayList<>();
		for ( int index = 0 ; index <= context.getLastRecordIndex() ; index++ )
		{
			final SourceRecord record = records.get( index );
			final Mnemonic mnemonic = Mnemonic.lookup( record.getBaseMnemonic() ).orElseThrow( () ->
				new IllegalStateException("Pass 1 accepted unknown mnemonic in "+record) );

			final int address = counter.getCurrentAddress();
			assertConsistentAddress( index , record , address );

			final Outcome<Integer> size = LocationCounter.sizeOf( record , mnemonic );
			byte[] bytes = NO_BYTES;
			int length = 0;
			// sizing failures were already reported by pass 1
			if ( size.isSuccess() )
			{
				length = size.getValue();
				final Outcome<byte[]> encoded = encode( record , mnemonic , address , length );
				if ( encoded.isSuccess() ) {
					bytes = encoded.getValue();
				} else {
					reporter.report( index , record.getLineNumber() , encoded );
				}
				counter.advance( length );
			}

			final EncodedLine line = new EncodedLine( record.getLineNumber() , address , length , bytes , reporter.getDiagnosticsForRecord( index ) );
			if ( LOG.isDebugEnabled() ) {
				LOG.debug("{} -> {}", record , line );
			}
			result.add( line );
		}
		return result;
	}

	private void assertConsistentAddress(int index,SourceRecord record,int address)
	{
		final int expected = context.getRecordedAddress( index );
		if ( address != expected ) {
			throw new IllegalStateException("Location counter diverged on "+record+": pass 1 = "+HexDump.toAdr( expected )+", pass 2 = "+HexDump.toAdr( address ) );
		}
		if ( context.definesLabel( index ) )
		{
			final Label label = context.getSymbolTable().getLabel( record.getLabel() );
			if ( label.getAddress() != address ) {
				throw new IllegalStateException("Address of "+label+" differs from pass 2 address "+HexDump.toAdr( address ) );
			}
		}
	}

	private Outcome<byte[]> encode(SourceRecord record,Mnemonic mnemonic,int address,int length)
	{
		if ( record.isExtended() && ! mnemonic.supportsExtendedFormat() ) {
			return Outcome.failure( EXTENDED_FORMAT_NOT_ALLOWED , "Only format 3 instructions may use the extended format, "+mnemonic+" does not" );
		}

		switch( mnemonic.getFormat() )
		{
			case FORMAT_1:
				if ( record.hasOperand() ) {
					return Outcome.failure( INVALID_OPERAND , mnemonic+" takes no operand" );
				}
				return Outcome.success( InstructionEncoder.encodeFormat1( mnemonic ) );
			case FORMAT_2:
				return analyzer.analyzeRegisterOperand( mnemonic , record.getOperand() )
						.map( fields -> InstructionEncoder.encodeFormat2( mnemonic , fields ) );
			case FORMAT_3:
				return analyzer.analyzeMemoryOperand( mnemonic , record.getOperand() , record.isExtended() , address , length )
						.map( decision -> InstructionEncoder.encodeFormat3( mnemonic , decision ) );
			case DIRECTIVE:
				return encodeDirective( record , mnemonic );
			default:
				throw new IllegalStateException("Unhandled format "+mnemonic.getFormat());
		}
	}

	private Outcome<byte[]> encodeDirective(SourceRecord record,Mnemonic mnemonic)
	{
		switch( mnemonic )
		{
			case START:
			case RESB:
			case RESW:
				return Outcome.success( NO_BYTES );
			case BYTE:
				return DataEncoder.encodeByte( record.getOperand() );
			case WORD:
				return DataEncoder.encodeWord( record.getOperand() , analyzer );
			case BASE:
				if ( ! record.hasOperand() ) {
					return Outcome.failure( INVALID_OPERAND , "BASE requires an operand" );
				}
				final Outcome<Integer> base = analyzer.resolveValue( record.getOperand() );
				if ( base.isFailure() ) {
					return base.propagate();
				}
				if ( base.getValue() < 0 || base.getValue() > Constants.MAX_ADDRESS ) {
					return Outcome.failure( VALUE_OUT_OF_RANGE , "Base address out of range: "+base.getValue() );
				}
				context.setBaseAddress( base.getValue() );
				return Outcome.success( NO_BYTES );
			case NOBASE:
				if ( record.hasOperand() ) {
					return Outcome.failure( INVALID_OPERAND , "NOBASE takes no operand" );
				}
				context.clearBaseAddress();
				return Outcome.success( NO_BYTES );
			case END:
				if ( record.hasOperand() )
				{
					final Outcome<Integer> entry = analyzer.resolveValue( record.getOperand() );
					if ( entry.isFailure() ) {
						return entry.propagate();
					}
					context.setEntryPoint( entry.getValue() );
				}
				return Outcome.success( NO_BYTES );
			default:
				throw new IllegalArgumentException("Not a directive: "+mnemonic);
		}
	}
}
