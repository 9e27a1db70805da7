package io.vena.roles;

import lombok.Builder;
import lombok.Builder.Default;
import lombok.Value;

@Value
@Builder
public class RolesSettings {
	/**
	 * How many levels of ancestors a {@link Roles#does} query or a method lookup may climb
	 * before giving up with {@link io.vena.roles.exceptions.InheritanceDepthExceededException}.
	 */
	@Default int maxInheritanceDepth = 1024;

	/**
	 * If true, {@link Roles#declare} rejects labels it doesn't recognize.
	 * Otherwise they're ignored with a warning.
	 */
	@Default boolean strictLabels = false;

	public static RolesSettings defaults() {
		return RolesSettings.builder().build();
	}

	public void validate() {
		if (maxInheritanceDepth() < 1) {
			throw new IllegalArgumentException("maxInheritanceDepth must be positive: " + maxInheritanceDepth());
		}
	}
}
