package de.codesourcery.sicxe.assembler.exceptions;


public class UnknownSymbolException extends RuntimeException {

	public final String name;

	public UnknownSymbolException(String name)
	{
		super("Unknown symbol "+name);
		this.name = name;
	}
}
