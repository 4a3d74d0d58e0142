package com.example.demo.sheetgen.model;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Reading extracted documents in the upstream snake_case shape.
 */
public class DocumentJsonTest {

    private final ObjectMapper objectMapper = new ObjectMapper();

    @Test
    public void testDocumentIsReadFromUpstreamShape() throws Exception {
        String json = "{\"file_name\": \"statement.pdf\", \"classified_file_type\": \"bank_statement\","
                + " \"page_count\": 3,"
                + " \"fields\": ["
                + "  {\"field_name\": \"Balance\", \"field_key\": \"balance\", \"section\": \"Account Information\","
                + "   \"data_type\": \"number\", \"value\": 1000, \"confidence\": 0.97},"
                + "  {\"field_name\": \"Transactions\", \"field_key\": \"transactions\", \"section\": \"History\","
                + "   \"data_type\": \"Table\", \"value\": [{\"Date\": \"2024-01-05\", \"Amount\": -4.5, \"Description\": \"Coffee\"}]}"
                + " ]}";

        Document document = objectMapper.readValue(json, Document.class);

        assertEquals("statement.pdf", document.getFileName());
        assertEquals("bank_statement", document.getClassifiedType());
        assertEquals(2, document.getFields().size());

        Field balance = document.getFields().get(0);
        assertEquals("Balance", balance.getName());
        assertEquals("balance", balance.getKey());
        assertEquals(DataType.NUMBER, balance.getDataType());
        assertEquals(1000, balance.getValue());
        assertFalse(balance.isTable());

        Field transactions = document.getFields().get(1);
        assertTrue(transactions.isTable());
        List<?> records = (List<?>) transactions.getValue();
        Map<?, ?> record = (Map<?, ?>) records.get(0);
        assertEquals(List.of("Date", "Amount", "Description"), new ArrayList<>(record.keySet()));
    }

    @Test
    public void testUnknownDataTypeIsRejected() {
        String json = "{\"field_name\": \"Balance\", \"data_type\": \"Currency\", \"value\": 10}";

        assertThrows(JsonProcessingException.class, () -> objectMapper.readValue(json, Field.class));
    }

    @Test
    public void testLabelFallsBackToKey() {
        assertEquals("gross_pay", Field.builder().key("gross_pay").build().label());
        assertEquals("", Field.builder().build().label());
    }

    @Test
    public void testRequestSerializesInUpstreamShape() throws Exception {
        Document document = Document.builder()
                .fileName("paystub.pdf")
                .classifiedType("pay_stub")
                .fields(List.of(Field.builder().name("Net Pay").dataType(DataType.NUMBER).value(3100).build()))
                .build();

        String json = objectMapper.writeValueAsString(new DocumentLayoutRequest(List.of(document)));

        assertTrue(json.contains("\"file_name\":\"paystub.pdf\""), json);
        assertTrue(json.contains("\"data_type\":\"Number\""), json);
        assertFalse(json.contains("\"table\""), json);
        assertEquals(document, objectMapper.readValue(json, DocumentLayoutRequest.class).getFiles().get(0));
    }
}
