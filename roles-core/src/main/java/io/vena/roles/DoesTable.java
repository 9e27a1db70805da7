package io.vena.roles;

import java.util.Set;
import lombok.NonNull;
import org.pcollections.OrderedPMap;
import org.pcollections.OrderedPSet;

import static java.util.Collections.unmodifiableSet;

/**
 * Records which roles each entity has explicitly declared it performs.
 * Performance inherited from ancestors is not stored here;
 * see {@link Roles#does(Object, String)}.
 */
public final class DoesTable {
	private volatile OrderedPMap<String, OrderedPSet<String>> rolesByEntity = OrderedPMap.empty();

	/**
	 * @return true if this is a new relation; false if it was already recorded
	 */
	synchronized boolean record(@NonNull String entityName, @NonNull String roleName) {
		OrderedPSet<String> existing = rolesByEntity.getOrDefault(entityName, OrderedPSet.empty());
		if (existing.contains(roleName)) {
			return false;
		}
		rolesByEntity = rolesByEntity.plus(entityName, existing.plus(roleName));
		return true;
	}

	public boolean contains(@NonNull String entityName, @NonNull String roleName) {
		OrderedPSet<String> roles = rolesByEntity.get(entityName);
		return roles != null && roles.contains(roleName);
	}

	/**
	 * @return the roles <code>entityName</code> declared directly, in declaration order
	 */
	public Set<String> declaredRoles(@NonNull String entityName) {
		return unmodifiableSet(rolesByEntity.getOrDefault(entityName, OrderedPSet.empty()));
	}

	public Set<String> entityNames() {
		return unmodifiableSet(rolesByEntity.keySet());
	}

	@Override
	public String toString() {
		return rolesByEntity.toString();
	}
}
