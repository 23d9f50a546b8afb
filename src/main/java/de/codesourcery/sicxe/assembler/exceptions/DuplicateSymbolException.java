package de.codesourcery.sicxe.assembler.exceptions;

import de.codesourcery.sicxe.assembler.Label;


public class DuplicateSymbolException extends RuntimeException {

	public final Label existing;
	public final int rejectedAddress;

	public DuplicateSymbolException(Label existing,int rejectedAddress)
	{
		super("Duplicate symbol "+existing.getName()+" , already defined as "+existing);
		this.existing = existing;
		this.rejectedAddress = rejectedAddress;
	}
}
