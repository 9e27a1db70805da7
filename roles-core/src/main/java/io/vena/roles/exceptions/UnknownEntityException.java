package io.vena.roles.exceptions;

public class UnknownEntityException extends IllegalArgumentException {
	public UnknownEntityException(String message) { super(message); }
	public UnknownEntityException(String message, Throwable cause) { super(message, cause); }
	public UnknownEntityException(Throwable cause) { super(cause); }
}
