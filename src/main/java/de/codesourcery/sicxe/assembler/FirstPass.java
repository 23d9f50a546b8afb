package de.codesourcery.sicxe.assembler;

import java.util.List;

import org.apache.commons.lang.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.codesourcery.sicxe.Constants;
import de.codesourcery.sicxe.assembler.diagnostics.Diagnostic;
import de.codesourcery.sicxe.assembler.diagnostics.ErrorKind;
import de.codesourcery.sicxe.assembler.diagnostics.ErrorReporter;
import de.codesourcery.sicxe.assembler.diagnostics.Outcome;
import de.codesourcery.sicxe.assembler.exceptions.FatalAssemblyException;
import de.codesourcery.sicxe.utils.HexDump;
import de.codesourcery.sicxe.utils.Misc;

/**
 * Assigns an address to every source line and builds the symbol table.
 */
public class FirstPass
{
	private static final Logger LOG = LoggerFactory.getLogger(FirstPass.class);

	private final AssemblyContext context;

	public FirstPass(AssemblyContext context)
	{
		Validate.notNull(context, "context must not be NULL");
		this.context = context;
	}

	/**
	 * @throws FatalAssemblyException if an unknown mnemonic or malformed program bounds
	 * make further length accounting impossible
	 */
	public void run(List<SourceRecord> records) throws FatalAssemblyException
	{
		context.setOrigin( determineOrigin( records ) );

		final LocationCounter counter = context.getLocationCounter();
		final ErrorReporter reporter = context.getErrorReporter();

		int index = 0;
		for ( ; index < records.size() ; index++ )
		{
			final SourceRecord record = records.get( index );
			final Mnemonic mnemonic = lookupMnemonic( record );

			if ( mnemonic == Mnemonic.START && index != 0 ) {
				throw fatal( record , ErrorKind.MALFORMED_PROGRAM_BOUNDS , "START must be the first statement of the program" );
			}

			final int address = counter.getCurrentAddress();
			context.recordAddress( index , address );

			if ( record.hasLabel() ) {
				defineLabel( index , record , address );
			}

			final Outcome<Integer> size = LocationCounter.sizeOf( record , mnemonic );
			if ( size.isFailure() )
			{
				reporter.report( index , record.getLineNumber() , size );
			}
			else
			{
				if ( (long) address + size.getValue() > Constants.MAX_ADDRESS + 1L ) {
					throw fatal( record , ErrorKind.MALFORMED_PROGRAM_BOUNDS , "Program exceeds the address space at "+HexDump.toAdr( address ) );
				}
				counter.advance( size.getValue() );
			}

			if ( mnemonic == Mnemonic.END ) {
				break;
			}
		}

		final int lastIndex = Math.min( index , records.size() - 1 );
		context.setLastRecordIndex( lastIndex );
		context.setEndAddress( counter.getCurrentAddress() );

		if ( lastIndex < records.size() - 1 ) {
			LOG.warn("Ignoring {} statement(s) after END on line {}", records.size() - 1 - lastIndex , records.get( lastIndex ).getLineNumber() );
		}
		LOG.debug("Pass 1 finished, {} symbols, end address {}", context.getSymbolTable().size() , HexDump.toAdr( context.getEndAddress() ) );
	}

	private void defineLabel(int index,SourceRecord record,int address)
	{
		final ISymbolTable symbolTable = context.getSymbolTable();
		if ( symbolTable.isDefined( record.getLabel() ) )
		{
			final Label existing = symbolTable.getLabel( record.getLabel() );
			context.getErrorReporter().report( index , new Diagnostic( record.getLineNumber() , ErrorKind.DUPLICATE_SYMBOL ,
					"Symbol "+record.getLabel()+" is duplicately-defined, first defined on line "+existing.getLineNumber() ) );
			return;
		}
		final Label label = symbolTable.define( record.getLabel() , address , record.getLineNumber() );
		context.markLabelDefinition( index );
		LOG.debug("Defined {}", label );
	}

	private int determineOrigin(List<SourceRecord> records)
	{
		if ( records.isEmpty() || ! Mnemonic.START.name().equals( records.get(0).getBaseMnemonic() ) ) {
			return 0;
		}
		final SourceRecord start = records.get(0);
		if ( ! start.hasOperand() ) {
			return 0;
		}
		final Integer origin = Misc.parseHex( start.getOperand() );
		if ( origin == null || origin > Constants.MAX_ADDRESS ) {
			throw fatal( start , ErrorKind.MALFORMED_PROGRAM_BOUNDS , "START requires a hexadecimal address between 0 and "+HexDump.toAdr( Constants.MAX_ADDRESS )+", got '"+start.getOperand()+"'" );
		}
		return origin;
	}

	protected static Mnemonic lookupMnemonic(SourceRecord record)
	{
		return Mnemonic.lookup( record.getBaseMnemonic() ).orElseThrow( () ->
			fatal( record , ErrorKind.UNKNOWN_MNEMONIC , "Unknown mnemonic '"+record.getMnemonic()+"'" ) );
	}

	private static FatalAssemblyException fatal(SourceRecord record,ErrorKind kind,String message) {
		return new FatalAssemblyException( new Diagnostic( record.getLineNumber() , kind , message ) );
	}
}
