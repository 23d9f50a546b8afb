package de.codesourcery.sicxe.assembler;

import java.util.Collections;
import java.util.List;

import org.apache.commons.lang.Validate;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import de.codesourcery.sicxe.assembler.exceptions.FatalAssemblyException;
import de.codesourcery.sicxe.parser.SourceParser;
import de.codesourcery.sicxe.utils.HexDump;

/**
 * Two-pass SIC/XE assembler.
 *
 * <p>Pass 1 assigns addresses and collects labels, pass 2 encodes all lines
 * against the finished symbol table. Errors on individual lines are collected and
 * do not stop the run, only an unknown mnemonic or malformed program bounds
 * abort it.</p>
 *
 * <p>Instances are not thread-safe, use one instance per concurrent run.</p>
 */
public class Assembler
{
	private static final Logger LOG = LoggerFactory.getLogger(Assembler.class);

	protected AssemblyContext context;

	public AssemblyResult assemble(String source) {
		return assemble( new SourceParser().parse( source ) );
	}

	public AssemblyResult assemble(List<SourceRecord> records)
	{
		Validate.notNull(records, "records must not be NULL");
		Validate.noNullElements(records, "records must not contain NULL elements");

		context = new AssemblyContext();
		try
		{
			context.setState( AssemblerState.PASS1_RUNNING );
			new FirstPass( context ).run( records );
			context.setState( AssemblerState.PASS1_COMPLETE );

			context.setState( AssemblerState.PASS2_RUNNING );
			final List<EncodedLine> lines = new SecondPass( context ).run( records );
			context.setState( AssemblerState.DONE );

			final AssemblyResult result = new AssemblyResult( context , lines );
			LOG.info("Assembled {} lines, start address {}, program length {} bytes, {} error(s)", lines.size() , HexDump.toAdr( result.getStartAddress() ) , result.getProgramLength() , result.getDiagnostics().size() );
			return result;
		}
		catch(FatalAssemblyException e)
		{
			LOG.error("Assembly aborted: {}", e.diagnostic );
			context.getErrorReporter().report( e.diagnostic );
			context.setState( AssemblerState.FAILED );
			return new AssemblyResult( context , Collections.<EncodedLine>emptyList() );
		}
	}

	public AssemblerState getState() {
		return context == null ? AssemblerState.IDLE : context.getState();
	}
}
