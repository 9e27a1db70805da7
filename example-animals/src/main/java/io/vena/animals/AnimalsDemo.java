package io.vena.animals;

import io.vena.roles.Instance;
import io.vena.roles.Roles;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class AnimalsDemo {
	public static void main(String[] args) {
		Zoo zoo = new Zoo(Roles.processWide());
		zoo.rollCall().forEach(LOGGER::info);

		Instance roboDog = zoo.adopt("RoboDog");
		LOGGER.info("{}", roboDog.invoke("eat"));
		LOGGER.info("{}", roboDog.invoke("sleep"));
		LOGGER.info("RoboDog is a Lifeguard: {}", roboDog.does("Lifeguard"));
		LOGGER.info("RoboDog is a plane: {}", roboDog.does("plane"));

		String swimmer = (args.length >= 1)? args[0] : "a tourist";
		zoo.rescueSquad(swimmer).forEach(LOGGER::info);
	}

	private static final Logger LOGGER = LoggerFactory.getLogger(AnimalsDemo.class);
}
