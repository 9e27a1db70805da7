package io.vena.roles;

import java.util.List;
import lombok.NonNull;
import lombok.Value;

import static java.util.stream.Collectors.toList;

/**
 * An immutable snapshot of the bindings registered under a role name
 * at the time it was obtained from the {@link RoleRegistry}.
 */
@Value
public class Role {
	@NonNull String name;

	/**
	 * In registration order. May contain the same method name more than once
	 * if the role was declared repeatedly; the first occurrence is the one that gets installed.
	 */
	@NonNull List<MethodBinding> bindings;

	public List<String> methodNames() {
		return bindings.stream()
			.map(MethodBinding::name)
			.distinct()
			.collect(toList());
	}

	public boolean isEmpty() {
		return bindings.isEmpty();
	}
}
