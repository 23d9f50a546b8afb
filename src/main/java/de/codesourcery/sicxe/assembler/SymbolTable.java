package de.codesourcery.sicxe.assembler;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.Validate;

import de.codesourcery.sicxe.assembler.exceptions.DuplicateSymbolException;
import de.codesourcery.sicxe.assembler.exceptions.UnknownSymbolException;
import de.codesourcery.sicxe.utils.HexDump;

public class SymbolTable implements ISymbolTable {

	private final Map<String,Label> symbols = new HashMap<>();

	@Override
	public Label define(String name, int address, int lineNumber)
	{
		Validate.notEmpty(name, "name must not be NULL or empty");
		final Label existing = symbols.get( name );
		if ( existing != null ) {
			throw new DuplicateSymbolException( existing , address );
		}
		final Label label = new Label( name , address , lineNumber );
		symbols.put( name , label );
		return label;
	}

	@Override
	public int resolve(String name) {
		return getLabel( name ).getAddress();
	}

	@Override
	public Label getLabel(String name)
	{
		final Label result = name == null ? null : symbols.get( name );
		if ( result == null ) {
			throw new UnknownSymbolException( name );
		}
		return result;
	}

	@Override
	public boolean isDefined(String name) {
		return name != null && symbols.containsKey( name );
	}

	@Override
	public List<Label> getSymbols()
	{
		final List<Label> result = new ArrayList<>( symbols.values() );
		result.sort( Comparator.comparingInt( Label::getAddress ).thenComparing( Label::getName ) );
		return result;
	}

	@Override
	public int size() {
		return symbols.size();
	}

	@Override
	public String toString()
	{
		final StringBuilder buffer = new StringBuilder("=== Symbol table ===\n");
		for ( Label label : getSymbols() )
		{
			buffer.append("\n").append( StringUtils.leftPad( label.getName() , 10 ) ).append(": ").append( HexDump.toAdr( label.getAddress() ) );
		}
		return buffer.toString();
	}
}
