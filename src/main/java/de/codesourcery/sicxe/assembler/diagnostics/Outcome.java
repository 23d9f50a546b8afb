package de.codesourcery.sicxe.assembler.diagnostics;

import java.util.function.Function;

import org.apache.commons.lang.Validate;

/**
 * Result of one assembly step, either a value or a tagged failure.
 *
 * @param <T> type of the value
 */
public final class Outcome<T>
{
	private final T value;
	private final ErrorKind error;
	private final String message;

	private Outcome(T value, ErrorKind error, String message)
	{
		this.value = value;
		this.error = error;
		this.message = message;
	}

	public static <T> Outcome<T> success(T value)
	{
		Validate.notNull(value, "value must not be NULL");
		return new Outcome<>(value,null,null);
	}

	public static <T> Outcome<T> failure(ErrorKind error, String message)
	{
		Validate.notNull(error, "error must not be NULL");
		return new Outcome<>(null,error,message == null ? error.getDescription() : message);
	}

	public static <T> Outcome<T> failure(ErrorKind error) {
		return failure(error,null);
	}

	public boolean isSuccess() {
		return error == null;
	}

	public boolean isFailure() {
		return error != null;
	}

	public T getValue()
	{
		if ( isFailure() ) {
			throw new IllegalStateException("getValue() invoked on failed outcome: "+this);
		}
		return value;
	}

	public ErrorKind getError() {
		return error;
	}

	public String getMessage() {
		return message;
	}

	public <R> Outcome<R> map(Function<? super T,? extends R> mapper)
	{
		if ( isFailure() ) {
			return propagate();
		}
		return success( mapper.apply( value ) );
	}

	public <R> Outcome<R> flatMap(Function<? super T,Outcome<R>> mapper)
	{
		if ( isFailure() ) {
			return propagate();
		}
		return mapper.apply( value );
	}

	/**
	 * Re-types a failure so it can be handed upwards.
	 */
	@SuppressWarnings("unchecked")
	public <R> Outcome<R> propagate()
	{
		if ( isSuccess() ) {
			throw new IllegalStateException("Cannot propagate a successful outcome");
		}
		return (Outcome<R>) this;
	}

	public Diagnostic toDiagnostic(int lineNumber)
	{
		if ( isSuccess() ) {
			throw new IllegalStateException("Outcome has no error");
		}
		return new Diagnostic(lineNumber,error,message);
	}

	@Override
	public String toString() {
		return isSuccess() ? "Success[ "+value+" ]" : "Failure[ "+error+" , "+message+" ]";
	}
}
