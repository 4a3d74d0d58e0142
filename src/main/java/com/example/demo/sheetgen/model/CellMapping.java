package com.example.demo.sheetgen.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.annotation.JsonUnwrapped;
import lombok.Value;

/**
 * One occupied cell: its address (e.g. "B4"), its value and its style. Serializes to the
 * flat producer shape, with the style attributes next to the coordinate and value.
 */
@Value
@JsonPropertyOrder({"cell_coordinate", "cell_value"})
public class CellMapping {

    @JsonProperty("cell_coordinate")
    String coordinate;

    /**
     * A String, Number or Boolean; never null.
     */
    @JsonProperty("cell_value")
    Object value;

    @JsonUnwrapped
    CellStyle style;
}
