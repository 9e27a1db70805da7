package io.vena.roles;

import lombok.NonNull;
import org.jetbrains.annotations.Nullable;

/**
 * Answers whether an invocant performs a role, either directly or through its ancestors.
 */
public interface RoleQuery {
	/**
	 * @param invocant an entity name, an {@link Invocant}, a {@link Class},
	 *                 or any other object, which stands for its class.
	 *                 A class stands for the entity with its {@link Class#getName() name}.
	 * @return true if the invocant's entity is named <code>roleName</code>,
	 * or it or any of its ancestors declared that it performs <code>roleName</code>
	 */
	boolean does(Object invocant, String roleName);

	static String entityNameOf(@NonNull Object invocant) {
		if (invocant instanceof String) {
			return (String) invocant;
		} else if (invocant instanceof Invocant) {
			return ((Invocant) invocant).entityName();
		} else {
			return javaTypeOf(invocant).getName();
		}
	}

	/**
	 * @return the Java type an invocant stands for, or null if it stands for an entity by name
	 */
	static @Nullable Class<?> javaTypeOf(@NonNull Object invocant) {
		if (invocant instanceof String || invocant instanceof Invocant) {
			return null;
		} else if (invocant instanceof Class) {
			return (Class<?>) invocant;
		} else {
			return invocant.getClass();
		}
	}
}
