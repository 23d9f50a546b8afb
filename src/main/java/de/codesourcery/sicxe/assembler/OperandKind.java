package de.codesourcery.sicxe.assembler;

public enum OperandKind
{
	/** FIX, RSUB */
	NONE,
	/** LDA BUFFER,X */
	MEMORY,
	/** CLEAR X */
	REGISTER,
	/** COMPR A,S */
	REGISTER_REGISTER,
	/** SHIFTL T,4 */
	REGISTER_COUNT,
	/** SVC 3 */
	COUNT,
	DIRECTIVE;
}
