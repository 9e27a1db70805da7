package io.vena.roles;

import io.vena.roles.exceptions.UnresolvedMethodException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Collections.unmodifiableList;

/**
 * Moves method implementations between entities and the {@link RoleRegistry}.
 */
final class MethodInstaller {

	/**
	 * Captures the current implementations of <code>methodNames</code> from <code>source</code>'s own table.
	 * Later redefinitions on <code>source</code> don't affect the returned bindings.
	 *
	 * @throws UnresolvedMethodException if <code>source</code> doesn't define one of the methods,
	 * in which case nothing is captured
	 */
	List<MethodBinding> capture(Entity source, String roleName, Collection<String> methodNames) {
		List<MethodBinding> result = new ArrayList<>(methodNames.size());
		for (String methodName: methodNames) {
			Implementation implementation = source.method(methodName);
			if (implementation == null) {
				throw new UnresolvedMethodException("Role \"" + roleName + "\" names method \"" + methodName + "\" which entity \"" + source.name() + "\" does not define");
			}
			result.add(new MethodBinding(methodName, implementation));
		}
		return unmodifiableList(result);
	}

	/**
	 * Installs each of the role's bindings into <code>performer</code>'s own table,
	 * unless the performer already defines a method with that name.
	 *
	 * @return the names of the methods actually installed, in binding order
	 */
	List<String> install(Role role, Entity performer) {
		List<String> installed = new ArrayList<>();
		for (MethodBinding binding: role.bindings()) {
			if (performer.defineIfAbsent(binding.name(), binding.implementation())) {
				installed.add(binding.name());
			} else if (performer.method(binding.name()) != binding.implementation()) {
				LOGGER.debug("{} keeps its own {}; not installing the one from role {}", performer.name(), binding.name(), role.name());
			}
		}
		LOGGER.debug("Installed {} method{} from role {} into {}: {}",
			installed.size(), (installed.size() == 1)? "" : "s", role.name(), performer.name(), installed);
		return unmodifiableList(installed);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(MethodInstaller.class);
}
