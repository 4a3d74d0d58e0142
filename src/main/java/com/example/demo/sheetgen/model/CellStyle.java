package com.example.demo.sheetgen.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import lombok.Builder;
import lombok.Value;

/**
 * Complete set of visual attributes for one cell. Colors are 6-character hex strings
 * without a leading '#'; a null background means no fill.
 */
@Value
@Builder(toBuilder = true)
@JsonPropertyOrder({
        "font_size", "font_color", "background_color", "is_bold", "is_italic",
        "horizontal_alignment", "vertical_alignment",
        "border_top", "border_bottom", "border_left", "border_right", "border_color"
})
public class CellStyle {

    @JsonProperty("font_size")
    int fontSize;

    @JsonProperty("font_color")
    String fontColor;

    @JsonProperty("background_color")
    String backgroundColor;

    @JsonProperty("is_bold")
    boolean bold;

    @JsonProperty("is_italic")
    boolean italic;

    @JsonProperty("horizontal_alignment")
    HorizontalAlign horizontalAlignment;

    @JsonProperty("vertical_alignment")
    VerticalAlign verticalAlignment;

    @JsonProperty("border_top")
    BorderWeight borderTop;

    @JsonProperty("border_bottom")
    BorderWeight borderBottom;

    @JsonProperty("border_left")
    BorderWeight borderLeft;

    @JsonProperty("border_right")
    BorderWeight borderRight;

    @JsonProperty("border_color")
    String borderColor;
}
