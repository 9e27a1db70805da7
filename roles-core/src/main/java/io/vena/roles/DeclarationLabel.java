package io.vena.roles;

import java.util.Arrays;
import java.util.Optional;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * The labels recognized by {@link Roles#declare}.
 */
@RequiredArgsConstructor
public enum DeclarationLabel {
	/**
	 * Value is a method name or a collection of them.
	 * Registers a role named after the declaring entity.
	 */
	ROLE("role"),

	/**
	 * Value is a map from role name to a method name or a collection of them.
	 */
	MULTI("multi"),

	/**
	 * Value is a role name or a collection of them, which the declaring entity performs.
	 */
	DOES("does"),
	;

	@Getter private final String label;

	public static Optional<DeclarationLabel> fromLabel(String label) {
		return Arrays.stream(values())
			.filter(v -> v.label.equals(label))
			.findFirst();
	}
}
