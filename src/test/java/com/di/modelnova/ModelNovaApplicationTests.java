package com.di.modelnova;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.DisplayName;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Smoke test for ModelNovaApplication. The lifecycle components are covered by plain unit tests wired by hand,
 * so no Spring context is started here.
 */
@DisplayName("ModelNovaApplication Tests")
class ModelNovaApplicationTests {

	@Test
	@DisplayName("Should have main class")
	void testMainClassExists() {
		Class<?> mainClass = ModelNovaApplication.class;
		assertNotNull(mainClass);
		assertEquals("ModelNovaApplication", mainClass.getSimpleName());
	}

	@Test
	@DisplayName("Should have main method")
	void testMainMethodExists() throws NoSuchMethodException {
		var mainMethod = ModelNovaApplication.class.getMethod("main", String[].class);
		assertNotNull(mainMethod);
		assertTrue(java.lang.reflect.Modifier.isStatic(mainMethod.getModifiers()));
		assertTrue(java.lang.reflect.Modifier.isPublic(mainMethod.getModifiers()));
	}

}
