package de.codesourcery.sicxe.assembler;

import java.util.List;

import de.codesourcery.sicxe.assembler.exceptions.DuplicateSymbolException;
import de.codesourcery.sicxe.assembler.exceptions.UnknownSymbolException;

public interface ISymbolTable
{
	/**
	 * Binds a name to an address.
	 *
	 * @throws DuplicateSymbolException if the name is already bound, the existing binding is kept
	 */
	public Label define(String name,int address,int lineNumber) throws DuplicateSymbolException;

	/**
	 * @throws UnknownSymbolException
	 */
	public int resolve(String name) throws UnknownSymbolException;

	public Label getLabel(String name) throws UnknownSymbolException;

	public boolean isDefined(String name);

	/**
	 * All symbols ordered by address.
	 */
	public List<Label> getSymbols();

	public int size();
}
