package org.springaicommunity.github.importer;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Factory for consistently configured Jackson mappers.
 *
 * <p>
 * The JSON mapper uses {@link PropertyNamingStrategies#SNAKE_CASE} so that reports
 * written by the CLI use snake_case keys (e.g.&nbsp;{@code issuesCreated} &rarr;
 * {@code issues_created}). Readers navigate JSON trees explicitly and are not affected
 * by the naming strategy.
 */
public final class ObjectMapperFactory {

	private ObjectMapperFactory() {
	}

	/**
	 * Create a new JSON {@link ObjectMapper} with standard configuration.
	 * @return configured ObjectMapper
	 */
	public static ObjectMapper create() {
		ObjectMapper mapper = new ObjectMapper();
		mapper.registerModule(new JavaTimeModule());
		mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
		mapper.setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE);
		return mapper;
	}

	/**
	 * Create a mapper for reading TOML mapping files.
	 * @return TOML mapper
	 */
	public static TomlMapper createToml() {
		return new TomlMapper();
	}

}
