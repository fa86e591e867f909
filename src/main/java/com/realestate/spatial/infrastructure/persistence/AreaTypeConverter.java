package com.realestate.spatial.infrastructure.persistence;

import com.realestate.spatial.domain.model.AreaType;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class AreaTypeConverter implements AttributeConverter<AreaType, String> {

    @Override
    public String convertToDatabaseColumn(AreaType type) {
        return type == null ? null : type.getCode();
    }

    @Override
    public AreaType convertToEntityAttribute(String code) {
        return code == null ? null : AreaType.fromCode(code);
    }
}
