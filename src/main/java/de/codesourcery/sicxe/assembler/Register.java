package de.codesourcery.sicxe.assembler;

import java.util.Optional;

public enum Register
{
	A(0),
	X(1),
	L(2),
	B(3),
	S(4),
	T(5),
	F(6),
	PC(8),
	SW(9);

	public final int number;

	private Register(int number) {
		this.number = number;
	}

	public static Optional<Register> lookup(String s)
	{
		for ( Register r : values() ) {
			if ( r.name().equals( s ) ) {
				return Optional.of( r );
			}
		}
		return Optional.empty();
	}
}
