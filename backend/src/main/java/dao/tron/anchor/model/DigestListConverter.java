package dao.tron.anchor.model;

import jakarta.persistence.AttributeConverter;
import jakarta.persistence.Converter;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Stores an ordered list of hex digests as one comma separated column.
 */
@Converter
public class DigestListConverter implements AttributeConverter<List<String>, String> {

    @Override
    public String convertToDatabaseColumn(List<String> digests) {
        if (digests == null) return null;
        return String.join(",", digests);
    }

    @Override
    public List<String> convertToEntityAttribute(String column) {
        if (column == null || column.isEmpty()) return new ArrayList<>();
        return new ArrayList<>(Arrays.asList(column.split(",")));
    }
}
