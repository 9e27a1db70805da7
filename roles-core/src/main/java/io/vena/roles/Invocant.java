package io.vena.roles;

/**
 * Something that can be asked what roles it performs:
 * an {@link Entity} itself, or an {@link Instance} of one.
 */
public interface Invocant {
	String entityName();

	/**
	 * @return the {@link RoleQuery} responsible for this invocant's entity
	 */
	RoleQuery roleQuery();

	default boolean does(String roleName) {
		return roleQuery().does(this, roleName);
	}
}
