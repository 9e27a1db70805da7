package io.vena.roles.exceptions;

public class CyclicInheritanceException extends IllegalStateException {
	public CyclicInheritanceException(String message) { super(message); }
	public CyclicInheritanceException(String message, Throwable cause) { super(message, cause); }
	public CyclicInheritanceException(Throwable cause) { super(cause); }
}
