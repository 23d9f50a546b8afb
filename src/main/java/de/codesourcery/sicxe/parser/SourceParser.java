package de.codesourcery.sicxe.parser;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.apache.commons.io.IOUtils;
import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.Validate;

import de.codesourcery.sicxe.assembler.SourceRecord;

/**
 * Turns SIC/XE source text into {@link SourceRecord}s.
 *
 * <ul>
 *   <li>lines starting with a dot are comments</li>
 *   <li>a line starting with a letter carries a label in its first field</li>
 *   <li>a line with a single field only holds a mnemonic</li>
 *   <li>fields after the operand are treated as comment</li>
 * </ul>
 */
public class SourceParser
{
	public static final char COMMENT_MARKER = '.';

	public List<SourceRecord> parse(InputStream in) throws IOException
	{
		Validate.notNull(in, "in must not be NULL");
		return parse( IOUtils.toString( in , StandardCharsets.UTF_8 ) );
	}

	public List<SourceRecord> parse(String source)
	{
		Validate.notNull(source, "source must not be NULL");
		final List<SourceRecord> result = new ArrayList<>();
		final String[] lines = source.split("\r?\n",-1);
		for ( int i = 0 ; i < lines.length ; i++ ) {
			parseLine( lines[i] , i+1 ).ifPresent( result::add );
		}
		return result;
	}

	/**
	 * @param line
	 * @param lineNumber 1-based line number
	 * @return the record or nothing for blank and comment lines
	 */
	public Optional<SourceRecord> parseLine(String line,int lineNumber)
	{
		if ( StringUtils.isBlank( line ) || isCommentLine( line ) ) {
			return Optional.empty();
		}

		final Scanner scanner = new Scanner( line );
		final List<String> fields = new ArrayList<>();
		for ( int i = 0 ; i < 3 ; i++ )
		{
			final String field = scanner.nextField();
			if ( field == null ) {
				break;
			}
			fields.add( field );
		}

		if ( fields.size() == 1 ) {
			return Optional.of( new SourceRecord( lineNumber , fields.get(0) , "" ) );
		}
		if ( hasLabel( line ) )
		{
			final String operand = fields.size() > 2 ? fields.get(2) : "";
			return Optional.of( new SourceRecord( lineNumber , fields.get(0) , fields.get(1) , operand ) );
		}
		return Optional.of( new SourceRecord( lineNumber , fields.get(0) , fields.get(1) ) );
	}

	public static boolean isCommentLine(String line) {
		return line.length() > 0 && line.charAt(0) == COMMENT_MARKER;
	}

	public static boolean hasLabel(String line) {
		return line.length() > 0 && Character.isLetter( line.charAt(0) );
	}
}
