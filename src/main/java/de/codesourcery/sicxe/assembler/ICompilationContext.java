package de.codesourcery.sicxe.assembler;

import java.util.Optional;

import de.codesourcery.sicxe.assembler.diagnostics.ErrorReporter;

/**
 * State of a single assembly run, shared by both passes.
 */
public interface ICompilationContext
{
	public void setOrigin(int adr);

	public int getOrigin();

	public int getCurrentAddress();

	public LocationCounter getLocationCounter();

	public ISymbolTable getSymbolTable();

	public ErrorReporter getErrorReporter();

	public Optional<Integer> getBaseAddress();

	public void setBaseAddress(int address);

	public void clearBaseAddress();

	public AssemblerState getState();
}
