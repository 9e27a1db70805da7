package io.vena.roles;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Set;
import lombok.NonNull;
import org.pcollections.OrderedPMap;
import org.pcollections.PVector;
import org.pcollections.TreePVector;

import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableSet;

/**
 * Maps role names to their ordered {@link MethodBinding}s.
 *
 * <p>
 * Only grows: a role, once registered, is never removed, and its bindings are only ever appended to.
 * Reads are lock-free and see a consistent snapshot; writes are serialized.
 */
public final class RoleRegistry {
	private volatile OrderedPMap<String, PVector<MethodBinding>> bindingsByRole = OrderedPMap.empty();

	/**
	 * Appends <code>bindings</code> to the role named <code>roleName</code>,
	 * registering the role if it doesn't exist yet. An empty collection still registers the role.
	 *
	 * @return the role as it stands after the append
	 */
	synchronized Role append(@NonNull String roleName, @NonNull Collection<MethodBinding> bindings) {
		PVector<MethodBinding> existing = bindingsByRole.get(roleName);
		PVector<MethodBinding> updated = (existing == null)
			? TreePVector.from(bindings)
			: existing.plusAll(bindings);
		bindingsByRole = bindingsByRole.plus(roleName, updated);
		return new Role(roleName, unmodifiableList(updated));
	}

	/**
	 * @return a snapshot of the named role; a role that was never declared has no bindings
	 */
	public Role role(@NonNull String roleName) {
		return new Role(roleName, bindings(roleName));
	}

	public List<MethodBinding> bindings(@NonNull String roleName) {
		PVector<MethodBinding> result = bindingsByRole.get(roleName);
		if (result == null) {
			return List.of();
		} else {
			return unmodifiableList(result);
		}
	}

	public boolean isDeclared(@NonNull String roleName) {
		return bindingsByRole.containsKey(roleName);
	}

	/**
	 * @return the registered role names in the order they were first registered
	 */
	public Set<String> roleNames() {
		return unmodifiableSet(bindingsByRole.keySet());
	}

	public List<Role> roles() {
		OrderedPMap<String, PVector<MethodBinding>> snapshot = bindingsByRole;
		List<Role> result = new ArrayList<>(snapshot.size());
		snapshot.forEach((name, bindings) -> result.add(new Role(name, unmodifiableList(bindings))));
		return unmodifiableList(result);
	}

	@Override
	public String toString() {
		return bindingsByRole.toString();
	}
}
