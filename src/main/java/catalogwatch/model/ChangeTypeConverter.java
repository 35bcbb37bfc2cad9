package catalogwatch.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class ChangeTypeConverter implements AttributeConverter<ChangeType, String> {

    @Override
    public String convertToDatabaseColumn(ChangeType type) {
        return type == null ? null : type.getCode();
    }

    @Override
    public ChangeType convertToEntityAttribute(String code) {
        return code == null ? null : ChangeType.fromCode(code);
    }
}
