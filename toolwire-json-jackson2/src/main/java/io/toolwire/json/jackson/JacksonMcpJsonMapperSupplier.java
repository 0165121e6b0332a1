/*
 * Copyright 2025-2025 the original author or authors.
 */

package io.toolwire.json.jackson;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

import io.toolwire.json.McpJsonMapper;
import io.toolwire.json.McpJsonMapperSupplier;

/**
 * A supplier of {@link McpJsonMapper} instances backed by Jackson 2. Registered under
 * {@code META-INF/services} so that {@link McpJsonMapper#getDefault()} finds it.
 */
public class JacksonMcpJsonMapperSupplier implements McpJsonMapperSupplier {

	@Override
	public McpJsonMapper get() {
		return new JacksonMcpJsonMapper(createObjectMapper());
	}

	/**
	 * Creates the protocol {@link ObjectMapper}.
	 * <p>
	 * The mapper is configured to:
	 * <ul>
	 * <li>Not call {@code setAccessible()} on constructors/fields, so that only public
	 * schema types are bound</li>
	 * <li>Use the {@link ParameterNamesModule} to discover constructor parameter names
	 * from bytecode (requires the {@code -parameters} compiler flag set in the parent
	 * pom.xml)</li>
	 * <li>Ignore unknown properties, since peers may send newer protocol fields</li>
	 * </ul>
	 * @return the configured ObjectMapper
	 */
	static ObjectMapper createObjectMapper() {
		return JsonMapper.builder()
			.disable(MapperFeature.CAN_OVERRIDE_ACCESS_MODIFIERS)
			.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
			.addModule(new ParameterNamesModule())
			.build();
	}

}
