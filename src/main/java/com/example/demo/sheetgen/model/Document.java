package com.example.demo.sheetgen.model;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Builder;
import lombok.Value;
import lombok.extern.jackson.Jacksonized;

import java.util.List;

/**
 * One extracted source file: its name, the document category assigned upstream
 * (e.g. "bank_statement") and its fields. Each document becomes one sheet.
 */
@Value
@Builder
@Jacksonized
@JsonIgnoreProperties(ignoreUnknown = true)
public class Document {

    @JsonProperty("file_name")
    String fileName;

    @JsonProperty("classified_file_type")
    String classifiedType;

    List<Field> fields;
}
