package io.vena.roles;

import java.util.List;

/**
 * Read-only view of the parent links between entities.
 */
public interface InheritanceGraph {
	/**
	 * @return the declared parents of <code>entityName</code> in declaration order;
	 * empty if the entity has no parents or is unknown
	 */
	List<String> parentsOf(String entityName);
}
