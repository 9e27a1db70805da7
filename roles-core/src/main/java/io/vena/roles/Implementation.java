package io.vena.roles;

/**
 * The body of a method in an {@link Entity}'s method table.
 *
 * <p>
 * Implementations are shared by reference: installing a role's method into a
 * performing entity puts the very same object into the performer's table.
 */
@FunctionalInterface
public interface Implementation {
	/**
	 * @param self the {@link Entity} or {@link Instance} on which the method was invoked
	 */
	Object invoke(Invocant self, Object... args);
}
