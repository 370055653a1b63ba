package eu.virtualparadox.comunex.catalog.converter;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.nio.file.Path;

/**
 * Stores workspace paths as normalized strings so lookups by path compare equal.
 */
@Converter(autoApply = true)
public class PathConverter implements AttributeConverter<Path, String> {

    @Override
    public String convertToDatabaseColumn(final Path attribute) {
        return attribute == null ? null : attribute.normalize().toString();
    }

    @Override
    public Path convertToEntityAttribute(final String dbData) {
        return dbData == null || dbData.isBlank() ? null : Path.of(dbData);
    }
}
