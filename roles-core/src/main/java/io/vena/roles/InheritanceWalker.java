package io.vena.roles;

import io.vena.roles.exceptions.CyclicInheritanceException;
import io.vena.roles.exceptions.InheritanceDepthExceededException;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Predicate;
import lombok.NonNull;
import lombok.RequiredArgsConstructor;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import static java.util.Collections.unmodifiableList;

/**
 * Depth-first, preorder traversal of an {@link InheritanceGraph}:
 * an entity is visited before its parents, and parents are visited in declared order,
 * each one's own ancestry being exhausted before moving on to the next.
 *
 * <p>
 * The traversal is iterative, so deep hierarchies don't consume Java stack.
 * An ancestor reachable along more than one path (a "diamond") is visited once.
 * Reaching an entity that is already on the current path is a cycle,
 * and is reported with {@link CyclicInheritanceException}.
 */
@RequiredArgsConstructor
public final class InheritanceWalker {
	private final InheritanceGraph graph;

	/**
	 * Number of levels above the starting entity that may be visited.
	 */
	private final int maxDepth;

	/**
	 * @return the first entity, in traversal order starting with <code>start</code> itself,
	 * that satisfies <code>test</code>; empty if there's none.
	 * @throws CyclicInheritanceException if the walk encounters a cycle before finding a match
	 * @throws InheritanceDepthExceededException if the walk goes more than <code>maxDepth</code> levels deep
	 */
	public Optional<String> find(@NonNull String start, @NonNull Predicate<String> test) {
		if (test.test(start)) {
			return Optional.of(start);
		}
		Deque<Frame> path = new ArrayDeque<>();
		Set<String> onPath = new HashSet<>();
		Set<String> exhausted = new HashSet<>();
		path.push(new Frame(start, graph.parentsOf(start).iterator()));
		onPath.add(start);
		while (!path.isEmpty()) {
			Frame top = path.peek();
			if (!top.parents.hasNext()) {
				path.pop();
				onPath.remove(top.entityName);
				exhausted.add(top.entityName);
				continue;
			}
			String parent = top.parents.next();
			if (onPath.contains(parent)) {
				throw new CyclicInheritanceException("Cyclic inheritance: " + describeCycle(path, parent));
			} else if (exhausted.contains(parent)) {
				continue;
			} else if (path.size() > maxDepth) {
				throw new InheritanceDepthExceededException("Ancestry of \"" + start + "\" is more than " + maxDepth + " levels deep at \"" + parent + "\"");
			}
			LOGGER.trace("Visiting {} via {}", parent, top.entityName);
			if (test.test(parent)) {
				return Optional.of(parent);
			}
			path.push(new Frame(parent, graph.parentsOf(parent).iterator()));
			onPath.add(parent);
		}
		return Optional.empty();
	}

	/**
	 * @return <code>start</code> followed by all its ancestors, in traversal order
	 */
	public List<String> ancestry(@NonNull String start) {
		List<String> result = new ArrayList<>();
		find(start, entityName -> {
			result.add(entityName);
			return false;
		});
		return unmodifiableList(result);
	}

	private static String describeCycle(Deque<Frame> path, String repeated) {
		List<String> names = new ArrayList<>(path.size() + 1);
		path.descendingIterator().forEachRemaining(f -> names.add(f.entityName));
		List<String> cycle = new ArrayList<>(names.subList(names.indexOf(repeated), names.size()));
		cycle.add(repeated);
		return String.join(" -> ", cycle);
	}

	@RequiredArgsConstructor
	private static final class Frame {
		final String entityName;
		final Iterator<String> parents;
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(InheritanceWalker.class);
}
