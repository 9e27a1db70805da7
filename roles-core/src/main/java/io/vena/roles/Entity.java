package io.vena.roles;

import io.vena.roles.exceptions.UnresolvedMethodException;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import lombok.Getter;
import lombok.NonNull;
import org.jetbrains.annotations.Nullable;
import org.pcollections.OrderedPMap;
import org.pcollections.PVector;
import org.pcollections.TreePVector;

import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableMap;

/**
 * A named type with its own method table and an ordered list of parents.
 *
 * <p>
 * The method table holds only the methods defined on this entity or installed into it
 * by performing a role; inherited methods are found by {@link #resolve}.
 * Parents are referred to by name and need not be declared yet.
 */
public final class Entity implements Invocant {
	@Getter private final String name;
	private final Roles roles;

	private volatile PVector<String> parents = TreePVector.empty();
	private volatile OrderedPMap<String, Implementation> methods = OrderedPMap.empty();

	Entity(String name, Roles roles) {
		this.name = name;
		this.roles = roles;
	}

	@Override
	public String entityName() {
		return name;
	}

	@Override
	public RoleQuery roleQuery() {
		return roles;
	}

	/**
	 * Defines or redefines a method in this entity's own table.
	 * Roles that already captured the old implementation are unaffected.
	 *
	 * @return <code>this</code>
	 */
	public synchronized Entity define(@NonNull String methodName, @NonNull Implementation implementation) {
		methods = methods.plus(methodName, implementation);
		return this;
	}

	/**
	 * @return true if <code>implementation</code> was added;
	 * false if this entity already defines <code>methodName</code>, in which case nothing changes.
	 */
	synchronized boolean defineIfAbsent(String methodName, Implementation implementation) {
		if (methods.containsKey(methodName)) {
			return false;
		}
		methods = methods.plus(methodName, implementation);
		return true;
	}

	/**
	 * Appends parents, skipping any that are already listed.
	 *
	 * @return <code>this</code>
	 */
	public synchronized Entity inherit(@NonNull String... parentNames) {
		PVector<String> updated = parents;
		for (String parent: parentNames) {
			if (!updated.contains(parent)) {
				updated = updated.plus(EntityTable.validName(parent));
			}
		}
		parents = updated;
		return this;
	}

	public List<String> parents() {
		return unmodifiableList(parents);
	}

	/**
	 * @return true if this entity's own table has the method; inherited methods don't count
	 */
	public boolean defines(@NonNull String methodName) {
		return methods.containsKey(methodName);
	}

	/**
	 * @return the implementation in this entity's own table, or null if there's none
	 */
	public @Nullable Implementation method(@NonNull String methodName) {
		return methods.get(methodName);
	}

	/**
	 * @return an unmodifiable snapshot of this entity's own method table, in definition order
	 */
	public Map<String, Implementation> methods() {
		return unmodifiableMap(methods);
	}

	/**
	 * Finds the implementation to dispatch to, searching this entity's own table first,
	 * then its ancestors in the same order as {@link Roles#does}.
	 */
	public Optional<Implementation> resolve(@NonNull String methodName) {
		EntityTable entities = roles.entities();
		return roles.walker()
			.find(name, entityName -> entities.lookup(entityName)
				.map(e -> e.defines(methodName))
				.orElse(false))
			.map(entityName -> entities.get(entityName).method(methodName));
	}

	Implementation resolveRequired(String methodName) {
		return resolve(methodName).orElseThrow(() ->
			new UnresolvedMethodException("Can't locate method \"" + methodName + "\" via entity \"" + name + "\""));
	}

	public boolean can(String methodName) {
		return resolve(methodName).isPresent();
	}

	/**
	 * Invokes the named method with this entity itself as <code>self</code>.
	 */
	public Object invoke(String methodName, Object... args) {
		return resolveRequired(methodName).invoke(this, args);
	}

	public Instance newInstance() {
		return new Instance(this);
	}

	@Override
	public String toString() {
		return name;
	}
}
