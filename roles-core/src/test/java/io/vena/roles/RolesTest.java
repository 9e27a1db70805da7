package io.vena.roles;

import io.vena.roles.exceptions.UnknownEntityException;
import io.vena.roles.exceptions.UnresolvedMethodException;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Stream;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.MethodSource;
import org.junit.jupiter.params.provider.ValueSource;

import static java.util.Arrays.asList;
import static java.util.Collections.emptyList;
import static java.util.stream.Collectors.toList;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.contains;
import static org.hamcrest.Matchers.empty;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RolesTest extends AbstractRolesTest {

	@Test
	void performer_getsRoleMethods() {
		Entity animal = declareAnimal();
		Entity dog = roles.entity("Dog");

		assertEquals(asList("eat", "sleep"), roles.perform("Dog", "Animal"));

		assertSame(animal.method("eat"), dog.method("eat"));
		assertSame(animal.method("sleep"), dog.method("sleep"));
		assertEquals("chomp chomp", dog.invoke("eat"));
		assertEquals("snore snore", dog.newInstance().invoke("sleep"));
		assertTrue(roles.does("Dog", "Animal"));
	}

	@Test
	void does_sameAnswerFromEveryKindOfInvocant() {
		declareAnimal();
		Entity dog = roles.entity("Dog");
		roles.perform("Dog", "Animal");

		assertTrue(roles.does("Dog", "Animal"));
		assertTrue(roles.does(dog, "Animal"));
		assertTrue(dog.does("Animal"));
		assertTrue(dog.newInstance().does("Animal"));
		assertTrue(roles.does(dog.newInstance(), "Animal"));
	}

	@Test
	void subclass_performsParentsRoles() {
		declareAnimal();
		roles.entity("Dog");
		roles.perform("Dog", "Animal");
		Entity roboDog = roles.entity("RoboDog", "Dog");

		assertTrue(roles.does("RoboDog", "Animal"));
		assertTrue(roboDog.newInstance().does("Animal"));
		assertTrue(roles.does("RoboDog", "Dog"), "Inheritance is a special case of performing a role");
		assertThat(roles.doesTable().declaredRoles("RoboDog"), empty());
		assertFalse(roboDog.defines("eat"), "Nothing is installed into subclasses");
		assertEquals("chomp chomp", roboDog.newInstance().invoke("eat"));
	}

	@Test
	void unknownRole_isNotPerformed() {
		declareAnimal();
		roles.entity("Dog");
		roles.perform("Dog", "Animal");

		assertFalse(roles.does("Dog", "NoSuchRole"));
		assertFalse(roles.registry().isDeclared("NoSuchRole"));
		assertThat(roles.doesTable().declaredRoles("Dog"), contains("Animal"));
	}

	@ParameterizedTest
	@ValueSource(strings = { "Animal", "Dog", "NeverDeclared" })
	void everyEntity_performsItself(String name) {
		declareAnimal();
		roles.entity("Dog");
		assertTrue(roles.does(name, name));
	}

	@Test
	void declaringEntity_doesNotPerformOthersByDeclaringARole() {
		declareAnimal();
		roles.entity("Dog");
		roles.perform("Dog", "Animal");
		assertFalse(roles.does("Animal", "Dog"));
	}

	@Test
	void existingMethod_isKept() {
		declareAnimal();
		Entity dog = roles.entity("Dog").define("eat", returning("kibble crunch"));

		assertEquals(asList("sleep"), roles.perform("Dog", "Animal"));

		assertEquals("kibble crunch", dog.invoke("eat"));
		assertEquals("snore snore", dog.invoke("sleep"));
	}

	@Test
	void performTwice_sameAsOnce() {
		declareAnimal();
		Entity dog = roles.entity("Dog");
		roles.perform("Dog", "Animal");
		Map<String, Implementation> methodsAfterOnce = dog.methods();
		List<String> rolesAfterOnce = List.copyOf(roles.doesTable().declaredRoles("Dog"));

		assertEquals(emptyList(), roles.perform("Dog", "Animal"));

		assertEquals(methodsAfterOnce, dog.methods());
		assertEquals(rolesAfterOnce, List.copyOf(roles.doesTable().declaredRoles("Dog")));
	}

	@Test
	void redefinitionAfterRoleDeclared_notSeenByRole() {
		Entity animal = declareAnimal();
		animal.define("eat", returning("nom nom"));
		Entity dog = roles.entity("Dog");
		roles.perform("Dog", "Animal");

		assertEquals("nom nom", animal.invoke("eat"));
		assertEquals("chomp chomp", dog.invoke("eat"));
	}

	@Test
	void methodsAddedToRoleLater_pickedUpByRepeatedPerform() {
		Entity animal = roles.entity("Animal")
			.define("eat", returning("chomp chomp"))
			.define("sleep", returning("snore snore"));
		roles.role("Animal", "eat");
		Entity dog = roles.entity("Dog");

		assertEquals(asList("eat"), roles.perform("Dog", "Animal"));
		roles.role("Animal", "sleep");
		assertFalse(dog.defines("sleep"), "Registering more methods must not install them retroactively");

		assertEquals(asList("sleep"), roles.perform("Dog", "Animal"));
		assertSame(animal.method("sleep"), dog.method("sleep"));
	}

	@Test
	void unresolvedMethod_failsWithoutRegistering() {
		roles.entity("Animal").define("eat", returning("chomp chomp"));

		UnresolvedMethodException e = assertThrows(UnresolvedMethodException.class,
			() -> roles.role("Animal", "eat", "fly"));

		assertTrue(e.getMessage().contains("\"fly\""), e.getMessage());
		assertFalse(roles.registry().isDeclared("Animal"));
	}

	@Test
	void undeclaredEntity_cannotDeclare() {
		assertThrows(UnknownEntityException.class, () -> roles.role("Nobody", "eat"));
		assertThrows(UnknownEntityException.class, () -> roles.perform("Nobody", "Animal"));
		assertFalse(roles.does("Nobody", "Animal"));
	}

	@Test
	void roleWithNoMethods_isStillDeclared() {
		roles.entity("Marker");
		Role role = roles.role("Marker");
		roles.entity("Tagged");

		assertTrue(role.isEmpty());
		assertTrue(roles.registry().isDeclared("Marker"));
		assertEquals(emptyList(), roles.perform("Tagged", "Marker"));
		assertTrue(roles.does("Tagged", "Marker"));
	}

	@Test
	void performingUndeclaredRole_recordsRelation() {
		roles.entity("Dog");
		assertEquals(emptyList(), roles.perform("Dog", "Lifeguard"));
		assertTrue(roles.does("Dog", "Lifeguard"));
	}

	@ParameterizedTest
	@MethodSource("vehicleRoleOrders")
	void multi_registersIndependentRoles(List<String> roleOrder) {
		roles.entity("MultiRoles")
			.define("drive_around", returning("vroom"))
			.define("steering_wheel", returning("wheel"))
			.define("fly_around", returning("whoosh"))
			.define("yoke", returning("yoke"));
		Map<String, List<String>> vehicles = Map.of(
			"car", asList("drive_around", "steering_wheel"),
			"plane", asList("fly_around", "yoke"));
		Map<String, List<String>> ordered = new LinkedHashMap<>();
		roleOrder.forEach(r -> ordered.put(r, vehicles.get(r)));

		List<Role> registered = roles.multi("MultiRoles", ordered);

		assertEquals(roleOrder, registered.stream().map(Role::name).collect(toList()));
		assertEquals(asList("drive_around", "steering_wheel"), roles.registry().role("car").methodNames());
		assertEquals(asList("fly_around", "yoke"), roles.registry().role("plane").methodNames());
		assertFalse(roles.registry().isDeclared("MultiRoles"));

		Entity flyingCar = roles.entity("FlyingCar");
		roles.perform("FlyingCar", "car", "plane");
		assertTrue(roles.does("FlyingCar", "car"));
		assertTrue(roles.does("FlyingCar", "plane"));
		assertEquals("whoosh", flyingCar.invoke("fly_around"));
		assertFalse(roles.does("MultiRoles", "car"), "Exporting a role is not performing it");
	}

	static Stream<List<String>> vehicleRoleOrders() {
		return Stream.of(
			asList("car", "plane"),
			asList("plane", "car"));
	}

	@Test
	void multi_unresolvedMethod_registersNothing() {
		roles.entity("MultiRoles").define("drive_around", returning("vroom"));
		Map<String, List<String>> vehicles = new LinkedHashMap<>();
		vehicles.put("car", asList("drive_around"));
		vehicles.put("plane", asList("fly_around"));

		assertThrows(UnresolvedMethodException.class, () -> roles.multi("MultiRoles", vehicles));
		assertThat(roles.registry().roleNames(), empty());
	}

	@Test
	void conflictingRoles_firstListedWins() {
		roles.entity("Car").define("move", returning("drive"));
		roles.role("Car", "move");
		roles.entity("Boat").define("move", returning("sail"));
		roles.role("Boat", "move");
		Entity amphicar = roles.entity("Amphicar");
		Entity duck = roles.entity("DuckBoat");

		roles.perform("Amphicar", "Car", "Boat");
		roles.perform("DuckBoat", "Boat", "Car");

		assertEquals("drive", amphicar.invoke("move"));
		assertEquals("sail", duck.invoke("move"));
		assertTrue(amphicar.does("Boat"));
		assertTrue(duck.does("Car"));
	}

	@ParameterizedTest
	@ValueSource(ints = { 1, 2, 10, 500 })
	void performance_isInheritedAtAnyDepth(int depth) {
		declareAnimal();
		roles.entity("Level0");
		roles.perform("Level0", "Animal");
		for (int i = 1; i <= depth; i++) {
			roles.entity("Level" + i, "Level" + (i-1));
		}
		assertTrue(roles.does("Level" + depth, "Animal"));
		assertFalse(roles.does("Level" + depth, "Plant"));
	}

	@Test
	void performedRoles_inTraversalOrder() {
		declareAnimal();
		roles.entity("Dog");
		roles.perform("Dog", "Animal");
		roles.perform("Dog", "Lifeguard");
		roles.entity("RoboDog", "Dog");

		assertThat(roles.performedRoles("RoboDog"), contains("RoboDog", "Dog", "Animal", "Lifeguard"));
		assertThat(roles.performedRoles("Nobody"), contains("Nobody"));
	}

	@Test
	void plainJavaObject_isItsClass() {
		assertTrue(roles.does("some string", "some string"), "A String invocant is an entity name");
		assertTrue(roles.does(new StringBuilder(), StringBuilder.class.getName()));
		assertFalse(roles.does(new StringBuilder(), "Animal"));
	}

	@Test
	void javaObject_performsRolesOfItsSupertypes() {
		declareAnimal();
		roles.entity(Base.class.getName());
		roles.perform(Base.class.getName(), "Animal");
		roles.entity(Swimming.class.getName());
		roles.perform(Swimming.class.getName(), "Lifeguard");

		assertTrue(roles.does(new Derived(), "Animal"));
		assertTrue(roles.does(new Derived(), "Lifeguard"));
		assertFalse(roles.does(new Derived(), "Plant"));
		assertFalse(roles.does(new Base(), "Lifeguard"));
		assertThat(roles.performedRoles(new Derived()), contains(
			Derived.class.getName(), Base.class.getName(), "Animal",
			Swimming.class.getName(), "Lifeguard"));
	}

	@Test
	void javaObject_walksUndeclaredSupertypes() {
		declareAnimal();
		roles.entity(Object.class.getName());
		roles.perform(Object.class.getName(), "Animal");

		assertTrue(roles.does(new Derived(), "Animal"), "Derived -> Base -> Object, none of them declared except Object");
		assertTrue(roles.does(new Derived(), Base.class.getName()));
	}

	@Test
	void classInvocant_standsForItsEntity() {
		declareAnimal();
		roles.entity(Base.class.getName());
		roles.perform(Base.class.getName(), "Animal");

		assertTrue(roles.does(String.class, String.class.getName()));
		assertFalse(roles.does(String.class, Class.class.getName()));
		assertTrue(roles.does(Base.class, "Animal"));
		assertTrue(roles.does(Derived.class, "Animal"));
	}

	@Test
	void declaredEntity_takesPrecedenceOverJavaSupertypes() {
		declareAnimal();
		roles.entity(Base.class.getName());
		roles.perform(Base.class.getName(), "Animal");
		roles.entity(Derived.class.getName());

		assertFalse(roles.does(new Derived(), "Animal"), "A declared entity's parents are only the ones it declared");
		assertTrue(roles.does(new Base(), "Animal"));
	}

	static class Base { }
	interface Swimming { }
	static class Derived extends Base implements Swimming { }

	@Test
	void processWide_isSingleton() {
		assertSame(Roles.processWide(), Roles.processWide());
		assertEquals(RolesSettings.defaults(), Roles.processWide().settings());
	}
}
