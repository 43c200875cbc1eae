package tw.gc.greyoak.score.entities;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import tw.gc.greyoak.score.enums.GuardrailFlag;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Stores the ordered flag list as comma-separated codes, e.g. "LowDataHold,SectorBear".
 */
@Converter
public class GuardrailFlagsConverter implements AttributeConverter<List<GuardrailFlag>, String> {

    private static final String SEPARATOR = ",";

    @Override
    public String convertToDatabaseColumn(List<GuardrailFlag> flags) {
        if (flags == null || flags.isEmpty()) {
            return "";
        }
        return flags.stream().map(GuardrailFlag::getCode).collect(Collectors.joining(SEPARATOR));
    }

    @Override
    public List<GuardrailFlag> convertToEntityAttribute(String column) {
        List<GuardrailFlag> flags = new ArrayList<>();
        if (column == null || column.isBlank()) {
            return flags;
        }
        for (String code : column.split(SEPARATOR)) {
            flags.add(GuardrailFlag.fromCode(code.trim()));
        }
        return flags;
    }
}
