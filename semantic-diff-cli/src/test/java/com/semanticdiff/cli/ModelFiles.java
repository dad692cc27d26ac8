package com.semanticdiff.cli;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * JSON model fixtures for command tests.
 */
final class ModelFiles {

    static final String SALES_V1 = """
        {
          "name": "Sales",
          "version": "1.0",
          "entities": [
            {
              "name": "Customer",
              "description": "A customer",
              "properties": [
                {"name": "Id", "data_type": "Integer", "required": true}
              ]
            }
          ],
          "business_rules": [
            {"name": "HighValueOrder", "entity": "Order", "condition": "Amount > 10000", "action": "flag"}
          ]
        }
        """;

    static final String SALES_V2 = """
        {
          "name": "Sales",
          "version": "1.1",
          "entities": [
            {
              "name": "Customer",
              "description": "A customer",
              "properties": [
                {"name": "Id", "data_type": "Integer", "required": true},
                {"name": "Email", "data_type": "String"}
              ]
            }
          ],
          "business_rules": [
            {"name": "HighValueOrder", "entity": "Order", "condition": "Amount > 10000", "action": "flag"}
          ]
        }
        """;

    private ModelFiles() {
        // Utility class
    }

    static Path write(Path dir, String fileName, String json) throws IOException {
        Path file = dir.resolve(fileName);
        Files.writeString(file, json);
        return file;
    }

    static String customerModel(String name, String description, String idType) {
        return """
            {
              "name": "%s",
              "version": "1.0",
              "entities": [
                {
                  "name": "Customer",
                  "description": "%s",
                  "properties": [{"name": "Id", "data_type": "%s"}]
                }
              ]
            }
            """.formatted(name, description, idType);
    }
}
