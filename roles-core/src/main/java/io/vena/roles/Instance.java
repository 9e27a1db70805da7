package io.vena.roles;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

import static lombok.AccessLevel.PACKAGE;

/**
 * An object of some {@link Entity}. Carries no state of its own;
 * it exists so methods can be invoked and roles tested on something other than the entity itself.
 */
@RequiredArgsConstructor(access = PACKAGE)
public final class Instance implements Invocant {
	@Getter private final Entity entity;

	@Override
	public String entityName() {
		return entity.name();
	}

	@Override
	public RoleQuery roleQuery() {
		return entity.roleQuery();
	}

	/**
	 * Invokes the named method as found by {@link Entity#resolve}, with this instance as <code>self</code>.
	 */
	public Object invoke(String methodName, Object... args) {
		return entity.resolveRequired(methodName).invoke(this, args);
	}

	public boolean can(String methodName) {
		return entity.can(methodName);
	}

	@Override
	public String toString() {
		return entity.name() + "@" + Integer.toHexString(System.identityHashCode(this));
	}
}
