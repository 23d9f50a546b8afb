package de.codesourcery.sicxe.assembler;

public enum AssemblerState
{
	IDLE,
	PASS1_RUNNING,
	PASS1_COMPLETE,
	PASS2_RUNNING,
	DONE,
	/**
	 * A fatal error aborted the run.
	 */
	FAILED;

	public boolean canTransitionTo(AssemblerState next)
	{
		switch( this )
		{
			case IDLE:           return next == PASS1_RUNNING;
			case PASS1_RUNNING:  return next == PASS1_COMPLETE || next == FAILED;
			case PASS1_COMPLETE: return next == PASS2_RUNNING;
			case PASS2_RUNNING:  return next == DONE || next == FAILED;
			case DONE:
			case FAILED:
				return false;
			default:
				throw new IllegalStateException("Unhandled state "+this);
		}
	}

	public boolean isTerminal() {
		return this == DONE || this == FAILED;
	}
}
