package de.codesourcery.sicxe.assembler;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.Validate;

/**
 * One source line, already split into label, mnemonic and operand.
 */
public final class SourceRecord
{
	public static final char EXTENDED_MARKER = '+';

	private final int lineNumber;
	private final String label;
	private final String mnemonic;
	private final String operand;

	public SourceRecord(int lineNumber,String label,String mnemonic,String operand)
	{
		Validate.isTrue( StringUtils.isNotBlank( mnemonic ) , "mnemonic must not be NULL or blank");
		this.lineNumber = lineNumber;
		this.label = StringUtils.isBlank( label ) ? null : label.trim();
		this.mnemonic = mnemonic.trim();
		this.operand = operand == null ? "" : operand.trim();
	}

	public SourceRecord(int lineNumber,String mnemonic,String operand) {
		this(lineNumber,null,mnemonic,operand);
	}

	public int getLineNumber() {
		return lineNumber;
	}

	public boolean hasLabel() {
		return label != null;
	}

	/**
	 * @return label or <code>null</code>
	 */
	public String getLabel() {
		return label;
	}

	/**
	 * Mnemonic as written, including any extended-format marker.
	 */
	public String getMnemonic() {
		return mnemonic;
	}

	public String getBaseMnemonic() {
		return isExtended() ? mnemonic.substring(1) : mnemonic;
	}

	public boolean isExtended() {
		return mnemonic.charAt(0) == EXTENDED_MARKER;
	}

	/**
	 * Operand text, never <code>null</code>.
	 */
	public String getOperand() {
		return operand;
	}

	public boolean hasOperand() {
		return ! operand.isEmpty();
	}

	@Override
	public String toString() {
		return "line "+lineNumber+": "+(label == null ? "" : label)+" "+mnemonic+" "+operand;
	}
}
