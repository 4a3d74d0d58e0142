package com.example.demo.sheetgen.config;

import com.example.demo.sheetgen.model.SheetNamePolicy;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

/**
 * Layout and rendering settings.
 *
 * Example application.yml:
 *
 * sheetgen:
 *   layout:
 *     duplicate-sheet-names: suffix   # or "fail"
 *     wrap-text: true
 *
 * Only the service layer reads these; the layout engine receives them as arguments.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Component
@ConfigurationProperties(prefix = "sheetgen.layout")
public class LayoutProperties {

    /**
     * What to do when two documents derive the same sheet name
     */
    private SheetNamePolicy duplicateSheetNames = SheetNamePolicy.SUFFIX;

    /**
     * Wrap text in every styled cell
     */
    private boolean wrapText = true;
}
