package catalogwatch.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

@Converter(autoApply = true)
public class CrawlStatusConverter implements AttributeConverter<CrawlStatus, String> {

    @Override
    public String convertToDatabaseColumn(CrawlStatus status) {
        return status == null ? null : status.getCode();
    }

    @Override
    public CrawlStatus convertToEntityAttribute(String code) {
        return code == null ? null : CrawlStatus.fromCode(code);
    }
}
