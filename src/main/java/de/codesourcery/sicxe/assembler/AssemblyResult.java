package de.codesourcery.sicxe.assembler;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

import de.codesourcery.sicxe.assembler.diagnostics.Diagnostic;
import de.codesourcery.sicxe.assembler.diagnostics.ErrorKind;

/**
 * Everything a listing or object-file writer needs from one assembly run.
 */
public final class AssemblyResult
{
	private final AssemblerState state;
	private final List<EncodedLine> lines;
	private final ISymbolTable symbolTable;
	private final List<Diagnostic> diagnostics;
	private final int startAddress;
	private final int endAddress;
	private final int entryPoint;

	public AssemblyResult(AssemblyContext context,List<EncodedLine> lines)
	{
		this.state = context.getState();
		this.lines = Collections.unmodifiableList( new ArrayList<>( lines ) );
		this.symbolTable = context.getSymbolTable();
		this.diagnostics = context.getErrorReporter().getDiagnostics();
		this.startAddress = context.getOrigin();
		this.endAddress = context.getEndAddress();
		this.entryPoint = context.getEntryPoint();
	}

	public AssemblerState getState() {
		return state;
	}

	public boolean isFailed() {
		return state == AssemblerState.FAILED;
	}

	/**
	 * @return <code>true</code> if the run completed without any diagnostics
	 */
	public boolean isSuccess() {
		return state == AssemblerState.DONE && diagnostics.isEmpty();
	}

	public List<EncodedLine> getLines() {
		return lines;
	}

	public Optional<EncodedLine> getLine(int lineNumber) {
		return lines.stream().filter( l -> l.getLineNumber() == lineNumber ).findFirst();
	}

	public ISymbolTable getSymbolTable() {
		return symbolTable;
	}

	public List<Diagnostic> getDiagnostics() {
		return diagnostics;
	}

	public boolean hasErrors() {
		return ! diagnostics.isEmpty();
	}

	public int count(ErrorKind kind) {
		return (int) diagnostics.stream().filter( d -> d.hasKind( kind ) ).count();
	}

	public int getStartAddress() {
		return startAddress;
	}

	public int getProgramLength() {
		return endAddress - startAddress;
	}

	public int getEntryPoint() {
		return entryPoint;
	}

	public Optional<Integer> getLineNumberForAddress(int adr)
	{
		for ( EncodedLine line : lines ) {
			if ( line.contains( adr ) ) {
				return Optional.of( line.getLineNumber() );
			}
		}
		return Optional.empty();
	}
}
