package com.example.demo.sheetgen.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * A single extracted field. Scalar fields carry a String/Number/Date value (or null);
 * {@link DataType#TABLE} fields carry an ordered list of records, each record an
 * ordered map of column name to scalar value.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Field {

    @JsonProperty("field_name")
    String name;

    @JsonProperty("field_key")
    String key;

    String section;

    @JsonProperty("data_type")
    DataType dataType;

    Object value;

    /**
     * Optional column names for a table field. Only consulted when the table has no
     * records to derive its columns from.
     */
    List<String> columns;

    /**
     * Text shown in the label column: the field name, falling back to the key.
     */
    public String label() {
        if (name != null) {
            return name;
        }
        return key != null ? key : "";
    }

    @JsonIgnore
    public boolean isTable() {
        return dataType == DataType.TABLE;
    }
}
