package com.seat.exchange.models.converters;

import com.seat.exchange.dto.enums.BerthType;
import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;
import org.apache.commons.lang3.StringUtils;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;

@Converter
public class BerthTypeSetConverter implements AttributeConverter<Set<BerthType>, String> {

    @Override
    public String convertToDatabaseColumn(Set<BerthType> attribute) {
        if (attribute == null || attribute.isEmpty()) {
            return "";
        }
        return attribute.stream().map(Enum::name).sorted().collect(Collectors.joining(","));
    }

    @Override
    public Set<BerthType> convertToEntityAttribute(String dbData) {
        Set<BerthType> berths = EnumSet.noneOf(BerthType.class);
        if (StringUtils.isBlank(dbData)) {
            return berths;
        }
        Arrays.stream(dbData.split(","))
                .map(String::trim)
                .filter(StringUtils::isNotEmpty)
                .map(BerthType::valueOf)
                .forEach(berths::add);
        return berths;
    }
}
