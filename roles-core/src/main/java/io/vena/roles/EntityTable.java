package io.vena.roles;

import io.vena.roles.exceptions.UnknownEntityException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;

import static java.util.Arrays.asList;
import static java.util.Collections.unmodifiableSet;
import static java.util.stream.Collectors.toList;
import static lombok.AccessLevel.PACKAGE;

/**
 * All the {@link Entity entities} known to one {@link Roles}, by name.
 * Entities are never removed.
 */
@RequiredArgsConstructor(access = PACKAGE)
public final class EntityTable implements InheritanceGraph {
	private final Roles roles;
	private final ConcurrentMap<String, Entity> entitiesByName = new ConcurrentHashMap<>();

	/**
	 * Java types seen as invocants, with their supertypes, by {@link Class#getName() name}.
	 * Consulted for the parents of names that aren't declared entities.
	 */
	private final ConcurrentMap<String, Class<?>> javaTypesByName = new ConcurrentHashMap<>();

	/**
	 * Declares a new entity, or reopens an existing one.
	 * Either way, <code>parentNames</code> are appended to its parents as though by {@link Entity#inherit}.
	 *
	 * @throws IllegalArgumentException if <code>name</code> or any of <code>parentNames</code>
	 * is not a valid entity name, in which case nothing is declared
	 */
	public Entity declare(@NonNull String name, @NonNull String... parentNames) {
		for (String parent: parentNames) {
			validName(parent);
		}
		Entity entity = entitiesByName.computeIfAbsent(validName(name), n -> new Entity(n, roles));
		return entity.inherit(parentNames);
	}

	/**
	 * @throws UnknownEntityException if no entity named <code>name</code> has been declared
	 */
	public Entity get(@NonNull String name) {
		Entity result = entitiesByName.get(name);
		if (result == null) {
			throw new UnknownEntityException("No such entity: \"" + name + "\"");
		} else {
			return result;
		}
	}

	public Optional<Entity> lookup(@NonNull String name) {
		return Optional.ofNullable(entitiesByName.get(name));
	}

	public boolean contains(@NonNull String name) {
		return entitiesByName.containsKey(name);
	}

	public Set<String> names() {
		return unmodifiableSet(entitiesByName.keySet());
	}

	/**
	 * Makes the supertypes of <code>type</code> available as parents of the entity named after it,
	 * for as long as no entity of that name is declared.
	 * Superclass comes first, then interfaces in declaration order.
	 */
	void rememberJavaType(@NonNull Class<?> type) {
		Deque<Class<?>> pending = new ArrayDeque<>();
		pending.push(type);
		while (!pending.isEmpty()) {
			Class<?> next = pending.pop();
			if (javaTypesByName.putIfAbsent(next.getName(), next) == null) {
				javaSupertypes(next).forEach(pending::push);
			}
		}
	}

	@Override
	public List<String> parentsOf(@NonNull String entityName) {
		Entity entity = entitiesByName.get(entityName);
		if (entity != null) {
			return entity.parents();
		}
		Class<?> type = javaTypesByName.get(entityName);
		if (type == null) {
			return List.of();
		} else {
			return javaSupertypes(type).stream()
				.map(Class::getName)
				.collect(toList());
		}
	}

	private static List<Class<?>> javaSupertypes(Class<?> type) {
		List<Class<?>> result = new ArrayList<>();
		if (type.getSuperclass() != null) {
			result.add(type.getSuperclass());
		}
		result.addAll(asList(type.getInterfaces()));
		return result;
	}

	static String validName(String name) {
		if (name.isEmpty()) {
			throw new IllegalArgumentException("Entity name can't be empty");
		} else if (!name.equals(name.strip())) {
			throw new IllegalArgumentException("Entity name can't start or end with whitespace: \"" + name + "\"");
		}
		return name;
	}
}
