package io.vena.roles;

import lombok.NonNull;
import lombok.Value;

/**
 * A method name paired with the {@link Implementation} that was captured
 * when the owning {@link Role} was declared.
 */
@Value
public class MethodBinding {
	@NonNull String name;
	@NonNull Implementation implementation;

	@Override
	public String toString() {
		return name;
	}
}
