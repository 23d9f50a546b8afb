package de.codesourcery.sicxe.assembler;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import de.codesourcery.sicxe.Constants;
import de.codesourcery.sicxe.assembler.diagnostics.ErrorReporter;
import de.codesourcery.sicxe.utils.HexDump;

/**
 * Owns everything one assembly run mutates. A new instance is created per run,
 * instances must not be shared between threads.
 */
public class AssemblyContext implements ICompilationContext
{
	private final ISymbolTable symbolTable = new SymbolTable();
	private final LocationCounter locationCounter = new LocationCounter();
	private final ErrorReporter errorReporter = new ErrorReporter();

	// pass 1 address of each record, by record index
	private final List<Integer> recordAddresses = new ArrayList<>();
	// indices of the records whose label made it into the symbol table
	private final Set<Integer> labelDefinitions = new HashSet<>();

	private AssemblerState state = AssemblerState.IDLE;

	private int origin;
	private boolean originSet;
	private Integer baseAddress;
	private int endAddress;
	private int lastRecordIndex = -1;
	private Integer entryPoint;

	@Override
	public void setOrigin(int adr)
	{
		if ( originSet ) {
			throw new IllegalStateException("Origin address already set to "+HexDump.toAdr( origin )+" , cannot set it more than once");
		}
		if ( adr < 0 || adr > Constants.MAX_ADDRESS ) {
			throw new IllegalArgumentException("Origin out of range: "+adr);
		}
		this.origin = adr;
		this.originSet = true;
		locationCounter.reset( adr );
	}

	@Override
	public int getOrigin() {
		return origin;
	}

	@Override
	public int getCurrentAddress() {
		return locationCounter.getCurrentAddress();
	}

	@Override
	public LocationCounter getLocationCounter() {
		return locationCounter;
	}

	@Override
	public ISymbolTable getSymbolTable() {
		return symbolTable;
	}

	@Override
	public ErrorReporter getErrorReporter() {
		return errorReporter;
	}

	@Override
	public Optional<Integer> getBaseAddress() {
		return Optional.ofNullable( baseAddress );
	}

	@Override
	public void setBaseAddress(int address) {
		this.baseAddress = address;
	}

	@Override
	public void clearBaseAddress() {
		this.baseAddress = null;
	}

	@Override
	public AssemblerState getState() {
		return state;
	}

	public void setState(AssemblerState next)
	{
		if ( ! state.canTransitionTo( next ) ) {
			throw new IllegalStateException("Illegal state transition "+state+" -> "+next);
		}
		this.state = next;
	}

	public void recordAddress(int recordIndex,int address)
	{
		if ( recordIndex != recordAddresses.size() ) {
			throw new IllegalStateException("Records must be recorded in order, expected index "+recordAddresses.size()+" but got "+recordIndex);
		}
		recordAddresses.add( address );
	}

	/**
	 * Address a record was assigned during pass 1.
	 */
	public int getRecordedAddress(int recordIndex) {
		return recordAddresses.get( recordIndex );
	}

	public void markLabelDefinition(int recordIndex) {
		labelDefinitions.add( recordIndex );
	}

	/**
	 * @return whether the label of the record at this index is the one bound in the symbol table
	 */
	public boolean definesLabel(int recordIndex) {
		return labelDefinitions.contains( recordIndex );
	}

	/**
	 * Index of the last record taking part in the assembly (END or the last record).
	 */
	public int getLastRecordIndex() {
		return lastRecordIndex;
	}

	public void setLastRecordIndex(int lastRecordIndex) {
		this.lastRecordIndex = lastRecordIndex;
	}

	public int getEndAddress() {
		return endAddress;
	}

	public void setEndAddress(int endAddress) {
		this.endAddress = endAddress;
	}

	/**
	 * @return entry point given by END, or the origin if END had no operand
	 */
	public int getEntryPoint() {
		return entryPoint == null ? origin : entryPoint;
	}

	public void setEntryPoint(int entryPoint) {
		this.entryPoint = entryPoint;
	}
}
