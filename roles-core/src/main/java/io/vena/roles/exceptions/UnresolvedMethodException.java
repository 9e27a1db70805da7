package io.vena.roles.exceptions;

/**
 * Indicates that a method name could not be resolved to an implementation:
 * either a role declaration names a method its declaring entity doesn't define,
 * or an invocation names a method that no entity in the invocant's ancestry defines.
 */
public class UnresolvedMethodException extends IllegalArgumentException {
	public UnresolvedMethodException(String message) { super(message); }
	public UnresolvedMethodException(String message, Throwable cause) { super(message, cause); }
	public UnresolvedMethodException(Throwable cause) { super(cause); }
}
