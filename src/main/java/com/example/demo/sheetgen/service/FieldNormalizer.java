package com.example.demo.sheetgen.service;

import com.example.demo.sheetgen.model.DataType;
import com.example.demo.sheetgen.model.Document;
import com.example.demo.sheetgen.model.Field;
import com.example.demo.sheetgen.model.NormalizedDocument;
import com.example.demo.sheetgen.model.NormalizedSection;
import com.example.demo.sheetgen.model.TableColumn;
import com.example.demo.sheetgen.model.TableField;
import com.example.demo.sheetgen.util.SheetNames;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Groups a document's fields by section and separates scalar fields from tables.
 *
 * Sections keep the order in which their names are first seen. A section name that
 * reappears later in the input is merged into its first occurrence: its fields are
 * appended to that section, after the fields already collected.
 */
@Slf4j
@Component
public class FieldNormalizer {

    public static final String DEFAULT_SECTION = "General";

    private static final Pattern NUMERIC = Pattern.compile(
            "[-+]?[$€£¥]?\\s?(\\d{1,3}(,\\d{3})+|\\d+)(\\.\\d+)?|[-+]?[$€£¥]?\\s?\\.\\d+");

    private static final List<DateTimeFormatter> DATE_FORMATS = List.of(
            DateTimeFormatter.ISO_LOCAL_DATE,
            DateTimeFormatter.ofPattern("MM/dd/yyyy", Locale.US),
            DateTimeFormatter.ofPattern("M/d/yyyy", Locale.US),
            DateTimeFormatter.ofPattern("dd-MM-yyyy", Locale.US),
            DateTimeFormatter.ofPattern("dd.MM.yyyy", Locale.US),
            DateTimeFormatter.ofPattern("MMM d, yyyy", Locale.US),
            DateTimeFormatter.ofPattern("d MMM yyyy", Locale.US),
            DateTimeFormatter.ISO_LOCAL_DATE_TIME,
            DateTimeFormatter.ISO_OFFSET_DATE_TIME
    );

    public NormalizedDocument normalize(Document document) {
        String title = SheetNames.titleFor(document.getClassifiedType(), document.getFileName());
        String sheetName = SheetNames.sheetNameFor(title, document.getFileName());
        List<NormalizedSection> sections = normalize(document.getFields());
        log.debug("Normalized '{}' into {} section(s) for sheet '{}'", document.getFileName(), sections.size(), sheetName);
        return new NormalizedDocument(document.getFileName(), title, sheetName, sections);
    }

    /**
     * @param fields flat field list, each field naming its section
     * @return sections in first-seen order, repeated names merged
     */
    public List<NormalizedSection> normalize(List<Field> fields) {
        if (fields == null || fields.isEmpty()) {
            return List.of();
        }

        Map<String, SectionBuilder> sections = new LinkedHashMap<>();
        String previousSection = null;
        for (Field field : fields) {
            if (field == null) {
                continue;
            }
            String sectionName = sectionNameOf(field);
            SectionBuilder builder = sections.get(sectionName);
            if (builder == null) {
                builder = new SectionBuilder(sectionName);
                sections.put(sectionName, builder);
            } else if (!sectionName.equals(previousSection)) {
                log.debug("Merging non-contiguous occurrence of section '{}' (field '{}') into its first occurrence",
                        sectionName, field.label());
            }
            builder.add(field);
            previousSection = sectionName;
        }

        List<NormalizedSection> result = new ArrayList<>(sections.size());
        for (SectionBuilder builder : sections.values()) {
            result.add(builder.build());
        }
        return Collections.unmodifiableList(result);
    }

    /**
     * Resolves the columns and records of a table field. Column names come from the
     * records in first-seen order; a table without records falls back to its declared
     * columns.
     */
    TableField toTableField(Field field) {
        List<Map<String, Object>> records = recordsOf(field);

        Set<String> names = new LinkedHashSet<>();
        for (Map<String, Object> record : records) {
            names.addAll(record.keySet());
        }
        if (names.isEmpty() && field.getColumns() != null) {
            names.addAll(field.getColumns());
        }

        List<TableColumn> columns = new ArrayList<>(names.size());
        for (String name : names) {
            columns.add(new TableColumn(name, inferColumnType(name, records)));
        }
        return new TableField(field, List.copyOf(columns), records);
    }

    /**
     * Number when every non-null value is numeric, Date when every non-null value is a
     * recognised date, otherwise (including all-null columns) String.
     */
    DataType inferColumnType(String column, List<Map<String, Object>> records) {
        boolean sawValue = false;
        boolean allNumeric = true;
        boolean allDates = true;
        for (Map<String, Object> record : records) {
            Object value = record.get(column);
            if (value == null || (value instanceof String && ((String) value).isBlank())) {
                continue;
            }
            sawValue = true;
            allNumeric &= isNumeric(value);
            allDates &= isDate(value);
            if (!allNumeric && !allDates) {
                return DataType.STRING;
            }
        }
        if (!sawValue) {
            return DataType.STRING;
        }
        return allNumeric ? DataType.NUMBER : allDates ? DataType.DATE : DataType.STRING;
    }

    static boolean isNumeric(Object value) {
        if (value instanceof Number) {
            return true;
        }
        return value instanceof String && NUMERIC.matcher(((String) value).trim()).matches();
    }

    static boolean isDate(Object value) {
        if (!(value instanceof String)) {
            return false;
        }
        String text = ((String) value).trim();
        for (DateTimeFormatter format : DATE_FORMATS) {
            if (parses(text, format)) {
                return true;
            }
        }
        return false;
    }

    private static boolean parses(String text, DateTimeFormatter format) {
        try {
            format.parse(text);
            return true;
        } catch (DateTimeParseException e) {
            return false;
        }
    }

    private static String sectionNameOf(Field field) {
        String section = field.getSection();
        return section == null || section.isBlank() ? DEFAULT_SECTION : section.trim();
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> recordsOf(Field field) {
        Object value = field.getValue();
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            log.warn("Table field '{}' holds a {} instead of a list of records; treating it as empty",
                    field.label(), value.getClass().getSimpleName());
            return List.of();
        }
        List<Map<String, Object>> records = new ArrayList<>();
        int index = 0;
        for (Object item : (List<?>) value) {
            if (item instanceof Map) {
                records.add(Collections.unmodifiableMap(new LinkedHashMap<>((Map<String, Object>) item)));
            } else {
                log.warn("Skipping record #{} of table field '{}': expected an object, got {}",
                        index, field.label(), item == null ? "null" : item.getClass().getSimpleName());
            }
            index++;
        }
        return Collections.unmodifiableList(records);
    }

    private final class SectionBuilder {
        private final String name;
        private final List<Field> scalars = new ArrayList<>();
        private final List<TableField> tables = new ArrayList<>();

        SectionBuilder(String name) {
            this.name = name;
        }

        void add(Field field) {
            if (field.isTable()) {
                tables.add(toTableField(field));
            } else {
                scalars.add(field);
            }
        }

        NormalizedSection build() {
            return new NormalizedSection(name, List.copyOf(scalars), List.copyOf(tables));
        }
    }
}
