package de.codesourcery.sicxe.assembler;

import de.codesourcery.sicxe.utils.HexDump;

public final class Label
{
	private final String name;
	private final int address;
	private final int lineNumber;

	public Label(String name,int address,int lineNumber)
	{
		if ( name == null || name.isEmpty() ) {
			throw new IllegalArgumentException("name must not be NULL or empty");
		}
		if ( address < 0 ) {
			throw new IllegalArgumentException("address must be >= 0");
		}
		this.name = name;
		this.address = address;
		this.lineNumber = lineNumber;
	}

	public String getName() {
		return name;
	}

	public int getAddress() {
		return address;
	}

	/**
	 * Source line that defined this label.
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	@Override
	public String toString() {
		return "label '"+name+"' = "+HexDump.toAdr( address )+" (line "+lineNumber+")";
	}
}
