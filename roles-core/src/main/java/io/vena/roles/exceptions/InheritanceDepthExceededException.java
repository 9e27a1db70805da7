package io.vena.roles.exceptions;

import io.vena.roles.RolesSettings;

/**
 * Thrown when an ancestry walk goes deeper than
 * {@link RolesSettings#maxInheritanceDepth()}.
 */
public class InheritanceDepthExceededException extends IllegalStateException {
	public InheritanceDepthExceededException(String message) { super(message); }
	public InheritanceDepthExceededException(String message, Throwable cause) { super(message, cause); }
	public InheritanceDepthExceededException(Throwable cause) { super(cause); }
}
