package io.vena.roles;

import io.vena.roles.exceptions.CyclicInheritanceException;
import io.vena.roles.exceptions.UnknownEntityException;
import io.vena.roles.exceptions.UnresolvedMethodException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import lombok.Getter;
import lombok.NonNull;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Arrays.asList;
import static java.util.Collections.singletonList;
import static java.util.Collections.unmodifiableList;
import static java.util.Collections.unmodifiableSet;

/**
 * Lets entities declare named bundles of methods ("roles"), acquire the methods of roles
 * they perform without inheriting from the declaring entity, and be asked whether they
 * perform a given role.
 *
 * <p>
 * A role is registered by an entity that already defines its methods:
 * <pre>
 *     roles.entity("Animal")
 *         .define("eat", (self, args) -> "chomp chomp")
 *         .define("sleep", (self, args) -> "snore snore");
 *     roles.role("Animal", "eat", "sleep");
 * </pre>
 * Another entity then declares that it performs the role, which installs whichever
 * of the role's methods it doesn't already define:
 * <pre>
 *     roles.entity("Dog");
 *     roles.perform("Dog", "Animal");
 *     roles.entity("RoboDog", "Dog");
 *     roles.does("RoboDog", "Animal"); // true
 * </pre>
 *
 * <p>
 * The tables in here only grow; nothing is ever unregistered.
 * Declarations are serialized on this object; queries take no locks.
 * Use {@link #processWide()} for a single shared instance,
 * or construct independent instances where isolation is wanted, such as in tests.
 */
public class Roles implements RoleQuery {
	@Getter private final RolesSettings settings;
	@Getter private final EntityTable entities;
	@Getter private final RoleRegistry registry = new RoleRegistry();
	@Getter private final DoesTable doesTable = new DoesTable();
	private final MethodInstaller installer = new MethodInstaller();
	private final InheritanceWalker walker;

	public Roles() {
		this(RolesSettings.defaults());
	}

	public Roles(@NonNull RolesSettings settings) {
		settings.validate();
		this.settings = settings;
		this.entities = new EntityTable(this);
		this.walker = new InheritanceWalker(entities, settings.maxInheritanceDepth());
	}

	/**
	 * @return the instance shared by the whole process, created on first use with default settings
	 */
	public static Roles processWide() {
		return ProcessWide.INSTANCE;
	}

	private static final class ProcessWide {
		static final Roles INSTANCE = new Roles();
	}

	/**
	 * Shorthand for {@link EntityTable#declare}.
	 */
	public Entity entity(String name, String... parentNames) {
		return entities.declare(name, parentNames);
	}

	InheritanceWalker walker() {
		return walker;
	}

	/////////////////
	//
	//  Declarations
	//

	/**
	 * Registers the given methods of <code>entityName</code> under a role of the same name.
	 *
	 * @return the role as it stands after registration
	 * @throws UnknownEntityException if <code>entityName</code> hasn't been declared
	 * @throws UnresolvedMethodException if the entity doesn't define one of the methods,
	 * in which case the registry is unchanged
	 */
	public Role role(String entityName, String... methodNames) {
		return role(entityName, asList(methodNames));
	}

	public synchronized Role role(@NonNull String entityName, @NonNull Collection<String> methodNames) {
		return register(entities.get(entityName), entityName, methodNames);
	}

	/**
	 * Registers several roles at once, all of whose methods come from <code>entityName</code>,
	 * under the role names given by the keys of <code>methodsByRole</code>.
	 * Roles are registered in the map's iteration order.
	 *
	 * <p>
	 * All methods are resolved before anything is registered,
	 * so if one fails, no role is affected.
	 *
	 * @return the roles as they stand after registration
	 */
	public synchronized List<Role> multi(@NonNull String entityName, @NonNull Map<String, ? extends Collection<String>> methodsByRole) {
		Entity source = entities.get(entityName);
		Map<String, List<MethodBinding>> captured = new LinkedHashMap<>();
		methodsByRole.forEach((roleName, methodNames) ->
			captured.put(roleName, installer.capture(source, roleName, methodNames)));
		List<Role> result = new ArrayList<>(captured.size());
		captured.forEach((roleName, bindings) -> result.add(append(source, roleName, bindings)));
		return unmodifiableList(result);
	}

	/**
	 * Declares that <code>performerName</code> performs each of the given roles, in order.
	 *
	 * <p>
	 * For each role, every method currently registered for it is installed into the performer
	 * unless the performer already defines a method with that name. This includes methods
	 * installed by an earlier role in the same call, so the first role listed wins any conflict.
	 * Methods registered for the role after this call are not installed retroactively;
	 * repeating the declaration picks them up.
	 *
	 * @return the names of the methods installed, in the order they were installed
	 * @throws UnknownEntityException if <code>performerName</code> hasn't been declared
	 */
	public synchronized List<String> perform(@NonNull String performerName, @NonNull String... roleNames) {
		Entity performer = entities.get(performerName);
		List<String> installed = new ArrayList<>();
		for (String roleName: roleNames) {
			Role role = registry.role(roleName);
			if (role.isEmpty() && !registry.isDeclared(roleName)) {
				LOGGER.debug("{} performs undeclared role {}", performerName, roleName);
			}
			installed.addAll(installer.install(role, performer));
			if (doesTable.record(performerName, roleName)) {
				LOGGER.debug("{} does {}", performerName, roleName);
			}
		}
		return unmodifiableList(installed);
	}

	/**
	 * Applies a set of labelled declarations on behalf of <code>entityName</code>,
	 * in the iteration order of <code>declarations</code>.
	 * See {@link DeclarationLabel} for the recognized labels and the values they accept.
	 *
	 * @throws IllegalArgumentException if a value has the wrong shape for its label,
	 * or if a label is unrecognized and {@link RolesSettings#strictLabels()} is set
	 */
	public synchronized void declare(@NonNull String entityName, @NonNull Map<String, ?> declarations) {
		for (Map.Entry<String, ?> entry: declarations.entrySet()) {
			String label = entry.getKey();
			Object value = entry.getValue();
			DeclarationLabel kind = DeclarationLabel.fromLabel(label).orElse(null);
			if (kind == null) {
				if (settings.strictLabels()) {
					throw new IllegalArgumentException("Unrecognized declaration label \"" + label + "\" for entity \"" + entityName + "\"");
				} else {
					LOGGER.warn("Ignoring unrecognized declaration label \"{}\" for entity {}", label, entityName);
					continue;
				}
			}
			switch (kind) {
				case ROLE:
					role(entityName, names(value, label));
					break;
				case MULTI:
					multi(entityName, namesByRole(value, label));
					break;
				case DOES:
					perform(entityName, names(value, label).toArray(new String[0]));
					break;
				default:
					throw new AssertionError("Unexpected label: " + kind);
			}
		}
	}

	private Role register(Entity source, String roleName, Collection<String> methodNames) {
		return append(source, roleName, installer.capture(source, roleName, methodNames));
	}

	private Role append(Entity source, String roleName, List<MethodBinding> bindings) {
		Role result = registry.append(roleName, bindings);
		LOGGER.debug("Entity {} registered role {} with {}", source.name(), roleName, bindings);
		return result;
	}

	/**
	 * Accepts a single name or a collection of names.
	 */
	private static List<String> names(Object value, String label) {
		if (value instanceof String) {
			return singletonList((String) value);
		} else if (value instanceof Collection) {
			List<String> result = new ArrayList<>();
			for (Object element: (Collection<?>) value) {
				if (element instanceof String) {
					result.add((String) element);
				} else {
					throw new IllegalArgumentException("Expected names for \"" + label + "\"; found " + element);
				}
			}
			return result;
		} else {
			throw new IllegalArgumentException("Expected a name or collection of names for \"" + label + "\"; found " + value);
		}
	}

	private static Map<String, List<String>> namesByRole(Object value, String label) {
		if (!(value instanceof Map)) {
			throw new IllegalArgumentException("Expected a map of role names to method names for \"" + label + "\"; found " + value);
		}
		Map<String, List<String>> result = new LinkedHashMap<>();
		((Map<?, ?>) value).forEach((roleName, methodNames) -> {
			if (!(roleName instanceof String)) {
				throw new IllegalArgumentException("Expected a role name for \"" + label + "\"; found " + roleName);
			}
			result.put((String) roleName, names(methodNames, label + "." + roleName));
		});
		return result;
	}

	/////////////////
	//
	//  Queries
	//

	/**
	 * Checks, for the invocant's entity and then each of its ancestors in turn,
	 * whether its name is <code>roleName</code> or it has declared that it performs <code>roleName</code>.
	 * A role nobody declared is simply not performed.
	 *
	 * @throws CyclicInheritanceException if the ancestry contains a cycle that's reached before a match is found
	 */
	@Override
	public boolean does(@NonNull Object invocant, @NonNull String roleName) {
		String entityName = entityNameOf(invocant);
		return walker.find(entityName, e -> e.equals(roleName) || doesTable.contains(e, roleName))
			.isPresent();
	}

	/**
	 * @return every role for which {@link #does} would return true for <code>invocant</code>:
	 * the names of the entity and its ancestors, and the roles each of them declared,
	 * in traversal order
	 * @throws CyclicInheritanceException if the ancestry contains a cycle, even where
	 * {@link #does} would have found a match before reaching it
	 */
	public Set<String> performedRoles(@NonNull Object invocant) {
		Set<String> result = new LinkedHashSet<>();
		for (String entityName: walker.ancestry(entityNameOf(invocant))) {
			result.add(entityName);
			result.addAll(doesTable.declaredRoles(entityName));
		}
		return unmodifiableSet(result);
	}

	/**
	 * A Java object or class stands for its type, whose Java supertypes act as parents
	 * unless an entity of the same name has been declared.
	 */
	private String entityNameOf(Object invocant) {
		Class<?> javaType = RoleQuery.javaTypeOf(invocant);
		if (javaType != null) {
			entities.rememberJavaType(javaType);
		}
		return RoleQuery.entityNameOf(invocant);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(Roles.class);
}
