package com.example.demo.sheetgen.model;

import lombok.Value;

import java.util.List;

@Value
public class NormalizedDocument {
    String fileName;
    String title;
    String sheetName;
    List<NormalizedSection> sections;
}
