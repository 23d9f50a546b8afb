package de.codesourcery.sicxe.assembler;

import static de.codesourcery.sicxe.assembler.diagnostics.ErrorKind.ADDRESSING_MODE_UNAVAILABLE;
import static de.codesourcery.sicxe.assembler.diagnostics.ErrorKind.INDEXED_WITH_IMMEDIATE_OR_INDIRECT;
import static de.codesourcery.sicxe.assembler.diagnostics.ErrorKind.INVALID_OPERAND;
import static de.codesourcery.sicxe.assembler.diagnostics.ErrorKind.NO_BASE_DECLARED;
import static de.codesourcery.sicxe.assembler.diagnostics.ErrorKind.OPERAND_OUT_OF_RANGE;
import static de.codesourcery.sicxe.assembler.diagnostics.ErrorKind.REGISTER_OUT_OF_RANGE;
import static de.codesourcery.sicxe.assembler.diagnostics.ErrorKind.SVC_OPERAND_OUT_OF_RANGE;
import static de.codesourcery.sicxe.assembler.diagnostics.ErrorKind.UNDEFINED_SYMBOL;
import static de.codesourcery.sicxe.assembler.diagnostics.ErrorKind.VALUE_OUT_OF_RANGE;

import java.util.Optional;

import org.apache.commons.lang.StringUtils;
import org.apache.commons.lang.Validate;

import de.codesourcery.sicxe.Constants;
import de.codesourcery.sicxe.assembler.diagnostics.Outcome;
import de.codesourcery.sicxe.utils.HexDump;
import de.codesourcery.sicxe.utils.Misc;

/**
 * Picks the addressing mode for an instruction operand and computes the value
 * of the operand field.
 *
 * <p>Format 3 references try pc-relative addressing first, then base-relative.
 * Format 4 always uses the absolute 20-bit address.</p>
 */
public class AddressingModeAnalyzer
{
	private final ICompilationContext context;

	public AddressingModeAnalyzer(ICompilationContext context)
	{
		Validate.notNull(context, "context must not be NULL");
		this.context = context;
	}

	/**
	 * Analyzes the operand of a format 3/4 instruction.
	 *
	 * @param mnemonic
	 * @param operandText raw operand
	 * @param extended whether the format 4 marker was present
	 * @param address address of the instruction itself
	 * @param length instruction length in bytes (3 or 4)
	 */
	public Outcome<AddressingDecision> analyzeMemoryOperand(Mnemonic mnemonic,String operandText,boolean extended,int address,int length)
	{
		if ( mnemonic.getFormat() != InstructionFormat.FORMAT_3 ) {
			throw new IllegalArgumentException("Not a format 3/4 instruction: "+mnemonic);
		}

		if ( mnemonic.getOperandKind() == OperandKind.NONE )
		{
			if ( StringUtils.isNotBlank( operandText ) ) {
				return Outcome.failure( INVALID_OPERAND , mnemonic+" takes no operand" );
			}
			final AddressCalculation calc = extended ? AddressCalculation.EXTENDED : AddressCalculation.ABSOLUTE;
			return Outcome.success( new AddressingDecision( AddressingMode.SIMPLE , false , calc , 0 ) );
		}

		if ( StringUtils.isBlank( operandText ) ) {
			return Outcome.failure( INVALID_OPERAND , mnemonic+" requires an operand" );
		}

		final Operand operand = Operand.parse( operandText );
		if ( operand.indexed && operand.mode != AddressingMode.SIMPLE ) {
			return Outcome.failure( INDEXED_WITH_IMMEDIATE_OR_INDIRECT );
		}

		final Outcome<Integer> target = resolveValue( operand.value );
		if ( target.isFailure() ) {
			return target.propagate();
		}
		final int value = target.getValue();

		if ( extended )
		{
			if ( value < 0 || value > Constants.FORMAT4_FIELD_MAX ) {
				return Outcome.failure( VALUE_OUT_OF_RANGE , "Value "+value+" does not fit into a 20-bit address field" );
			}
			return Outcome.success( new AddressingDecision( operand.mode , operand.indexed , AddressCalculation.EXTENDED , value ) );
		}

		if ( operand.isConstant() )
		{
			if ( value >= 0 && value <= Constants.FORMAT3_FIELD_MAX ) {
				return Outcome.success( new AddressingDecision( operand.mode , operand.indexed , AddressCalculation.ABSOLUTE , value ) );
			}
			if ( value < 0 || operand.mode == AddressingMode.IMMEDIATE ) {
				return Outcome.failure( VALUE_OUT_OF_RANGE , "Value "+value+" does not fit into a 12-bit field, use the extended format" );
			}
			// large constant addresses go through relative addressing like symbols
		}
		return relativeTo( operand , value , address + length );
	}

	private Outcome<AddressingDecision> relativeTo(Operand operand,int targetAddress,int nextInstructionAddress)
	{
		final int pcDisplacement = targetAddress - nextInstructionAddress;
		if ( pcDisplacement >= Constants.PC_RELATIVE_MIN && pcDisplacement <= Constants.PC_RELATIVE_MAX ) {
			return Outcome.success( new AddressingDecision( operand.mode , operand.indexed , AddressCalculation.PC_RELATIVE , pcDisplacement ) );
		}

		final Optional<Integer> base = context.getBaseAddress();
		if ( ! base.isPresent() ) {
			return Outcome.failure( NO_BASE_DECLARED , "No BASE was declared, cannot reach "+HexDump.toAdr( targetAddress )+" pc-relative from "+HexDump.toAdr( nextInstructionAddress ) );
		}

		final int baseDisplacement = targetAddress - base.get();
		if ( baseDisplacement >= 0 && baseDisplacement <= Constants.BASE_RELATIVE_MAX ) {
			return Outcome.success( new AddressingDecision( operand.mode , operand.indexed , AddressCalculation.BASE_RELATIVE , baseDisplacement ) );
		}
		return Outcome.failure( ADDRESSING_MODE_UNAVAILABLE , "Cannot use PC or Base relative addressing to reach "+HexDump.toAdr( targetAddress ) );
	}

	/**
	 * Analyzes the operand of a format 2 instruction.
	 */
	public Outcome<RegisterFields> analyzeRegisterOperand(Mnemonic mnemonic,String operandText)
	{
		final String[] parts = StringUtils.split( StringUtils.deleteWhitespace( StringUtils.defaultString( operandText ) ) , ',' );

		switch( mnemonic.getOperandKind() )
		{
			case REGISTER:
				if ( parts.length != 1 ) {
					return Outcome.failure( INVALID_OPERAND , mnemonic+" expects a single register" );
				}
				final Outcome<Integer> single = registerNumber( parts[0] );
				if ( single.isFailure() ) {
					return single.propagate();
				}
				if ( ! isValidRegister( single.getValue() ) ) {
					return Outcome.failure( REGISTER_OUT_OF_RANGE , "Register "+single.getValue()+" must be of format 0 <= r < 16" );
				}
				return Outcome.success( new RegisterFields( single.getValue() , 0 ) );
			case REGISTER_REGISTER:
				if ( parts.length != 2 ) {
					return Outcome.failure( INVALID_OPERAND , mnemonic+" expects two registers r1,r2" );
				}
				final Outcome<Integer> r1 = registerNumber( parts[0] );
				if ( r1.isFailure() ) {
					return r1.propagate();
				}
				final Outcome<Integer> r2 = registerNumber( parts[1] );
				if ( r2.isFailure() ) {
					return r2.propagate();
				}
				if ( ! isValidRegister( r1.getValue() ) || ! isValidRegister( r2.getValue() ) ) {
					return Outcome.failure( REGISTER_OUT_OF_RANGE , mnemonic+" operands r1,r2 must be of format 0 <= r1,r2 < 16" );
				}
				return Outcome.success( new RegisterFields( r1.getValue() , r2.getValue() ) );
			case REGISTER_COUNT:
				if ( parts.length != 2 ) {
					return Outcome.failure( INVALID_OPERAND , mnemonic+" expects a register and a count r,n" );
				}
				final Outcome<Integer> r = registerNumber( parts[0] );
				if ( r.isFailure() ) {
					return r.propagate();
				}
				final Integer n = Misc.parseDecimal( parts[1] );
				if ( n == null ) {
					return Outcome.failure( INVALID_OPERAND , "Count must be a decimal number: "+parts[1] );
				}
				// the field holds n-1, so n=0 is not encodable while r=0 is
				if ( ! ( n > 0 && n < 17 && isValidRegister( r.getValue() ) ) ) {
					return Outcome.failure( OPERAND_OUT_OF_RANGE , mnemonic+" operand n must be of format 0 < n < 17 and operand r must be of format 0 <= r < 16" );
				}
				return Outcome.success( new RegisterFields( r.getValue() , n - 1 ) );
			case COUNT:
				if ( parts.length != 1 ) {
					return Outcome.failure( INVALID_OPERAND , mnemonic+" expects a single number" );
				}
				final Integer svc = Misc.parseDecimal( parts[0] );
				if ( svc == null ) {
					return Outcome.failure( INVALID_OPERAND , "Operand must be a decimal number: "+parts[0] );
				}
				if ( svc < 0 || svc >= 16 ) {
					return Outcome.failure( SVC_OPERAND_OUT_OF_RANGE );
				}
				return Outcome.success( new RegisterFields( svc , 0 ) );
			default:
				throw new IllegalArgumentException("Not a format 2 instruction: "+mnemonic);
		}
	}

	/**
	 * Evaluates a symbol name or a decimal constant.
	 */
	public Outcome<Integer> resolveValue(String text)
	{
		final String value = StringUtils.trimToEmpty( text );
		if ( Misc.isDecimal( value ) ) {
			return Outcome.success( Misc.parseDecimal( value ) );
		}
		if ( ! Operand.isSymbolName( value ) ) {
			return Outcome.failure( INVALID_OPERAND , "Invalid operand: '"+value+"'" );
		}
		if ( ! context.getSymbolTable().isDefined( value ) ) {
			return Outcome.failure( UNDEFINED_SYMBOL , "Undefined symbol "+value );
		}
		return Outcome.success( context.getSymbolTable().resolve( value ) );
	}

	private static Outcome<Integer> registerNumber(String s)
	{
		final Integer number = Misc.parseDecimal( s );
		if ( number != null ) {
			return Outcome.success( number );
		}
		final Optional<Register> register = Register.lookup( s );
		if ( register.isPresent() ) {
			return Outcome.success( register.get().number );
		}
		return Outcome.failure( INVALID_OPERAND , "Unknown register: '"+s+"'" );
	}

	private static boolean isValidRegister(int number) {
		return number >= 0 && number < 16;
	}
}
