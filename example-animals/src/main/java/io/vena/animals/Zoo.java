package io.vena.animals;

import io.vena.roles.Entity;
import io.vena.roles.Instance;
import io.vena.roles.Roles;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import lombok.Getter;

import static java.util.Arrays.asList;
import static java.util.Collections.singletonMap;
import static java.util.Collections.unmodifiableList;

/**
 * A handful of entities that share behaviour through roles rather than ancestry.
 */
public class Zoo {
	@Getter private final Roles roles;

	public Zoo(Roles roles) {
		this.roles = roles;

		roles.entity("Animal")
			.define("eat", (self, args) -> self.entityName() + " goes chomp chomp")
			.define("sleep", (self, args) -> self.entityName() + " goes snore snore");
		roles.declare("Animal", singletonMap("role", asList("eat", "sleep")));

		roles.entity("Lifeguard")
			.define("rescue_drowning_swimmer", (self, args) -> self.entityName() + " rescues " + args[0])
			.define("scan_ocean", (self, args) -> self.entityName() + " scans the ocean");
		roles.declare("Lifeguard", singletonMap("role", asList("rescue_drowning_swimmer", "scan_ocean")));

		roles.entity("Vehicles")
			.define("drive_around", (self, args) -> self.entityName() + " drives around")
			.define("steering_wheel", (self, args) -> "a steering wheel")
			.define("fly_around", (self, args) -> self.entityName() + " flies around")
			.define("yoke", (self, args) -> "a yoke");
		Map<String, Object> vehicles = new LinkedHashMap<>();
		vehicles.put("car", asList("drive_around", "steering_wheel"));
		vehicles.put("plane", asList("fly_around", "yoke"));
		roles.declare("Vehicles", singletonMap("multi", vehicles));

		// Dogs sleep their own way
		roles.entity("Dog")
			.define("sleep", (self, args) -> self.entityName() + " turns in circles three times, then lies down");
		roles.declare("Dog", singletonMap("does", asList("Animal", "Lifeguard")));

		roles.entity("RoboDog", "Dog");

		roles.entity("Human");
		roles.declare("Human", singletonMap("does", "Lifeguard"));

		roles.entity("FlyingCar");
		roles.declare("FlyingCar", singletonMap("does", asList("car", "plane")));
	}

	public Instance adopt(String entityName) {
		Entity entity = roles.entities().get(entityName);
		return entity.newInstance();
	}

	/**
	 * @return one line per entity, naming the roles it performs
	 */
	public List<String> rollCall() {
		List<String> result = new ArrayList<>();
		for (String name: asList("Dog", "RoboDog", "Human", "FlyingCar")) {
			result.add(name + " does " + roles.performedRoles(name));
		}
		return unmodifiableList(result);
	}

	/**
	 * @return what everyone who can rescue a drowning swimmer says when asked to
	 */
	public List<String> rescueSquad(String swimmer) {
		List<String> result = new ArrayList<>();
		for (String name: roles.entities().names()) {
			if (roles.does(name, "Lifeguard") && !name.equals("Lifeguard")) {
				result.add((String) adopt(name).invoke("rescue_drowning_swimmer", swimmer));
			}
		}
		result.sort(null);
		return unmodifiableList(result);
	}
}
