package uk.gegc.recall.features.concept.domain.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

/**
 * Stores phrasing types by their external value ("multiple-choice") rather than the enum name.
 */
@Converter
public class PhrasingTypeConverter implements AttributeConverter<PhrasingType, String> {

    @Override
    public String convertToDatabaseColumn(PhrasingType attribute) {
        return attribute == null ? null : attribute.getValue();
    }

    @Override
    public PhrasingType convertToEntityAttribute(String dbData) {
        return dbData == null ? null : PhrasingType.fromValue(dbData);
    }
}
