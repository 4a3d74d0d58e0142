package com.example.demo.sheetgen.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Request object for layout generation: the extracted files to lay out, one sheet each.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class DocumentLayoutRequest {
    /**
     * Extracted documents, in the order their sheets should appear
     */
    @Builder.Default
    private List<Document> files = new ArrayList<>();
}
