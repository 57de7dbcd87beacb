package com.accountdb.bancheck.check.service;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.springframework.stereotype.Component;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

@Component
public class IdentifierCsvReader {
    public static final String DEFAULT_COLUMN = "steam64_id";

    public List<String> readIdentifiers(InputStream input, String columnName) {
        String column = columnName == null || columnName.isBlank() ? DEFAULT_COLUMN : columnName.trim();
        if (input == null) {
            throw new BanCheckValidationException("CSV file is required");
        }
        try (Reader reader = skipByteOrderMark(new BufferedReader(new InputStreamReader(input, StandardCharsets.UTF_8)));
             CSVParser parser = csvParser(reader)) {
            String header = resolveHeader(parser.getHeaderMap(), column);
            List<String> identifiers = new ArrayList<>();
            for (CSVRecord record : parser) {
                if (!record.isSet(header)) {
                    continue;
                }
                String value = record.get(header);
                if (value != null && !value.isBlank()) {
                    identifiers.add(value.trim());
                }
            }
            return identifiers;
        } catch (IOException | UncheckedIOException | IllegalStateException e) {
            throw new BanCheckValidationException("Unable to parse CSV: " + rootMessage(e));
        }
    }

    private String resolveHeader(Map<String, Integer> headerMap, String column) {
        if (headerMap == null || headerMap.isEmpty()) {
            throw new BanCheckValidationException("Column '" + column + "' not found in CSV headers: []");
        }
        if (headerMap.containsKey(column)) {
            return column;
        }
        for (String header : headerMap.keySet()) {
            if (header != null && header.trim().equalsIgnoreCase(column)) {
                return header;
            }
        }
        throw new BanCheckValidationException(
            "Column '" + column + "' not found in CSV headers: " + new ArrayList<>(headerMap.keySet())
        );
    }

    private CSVParser csvParser(Reader reader) throws IOException {
        CSVFormat format = CSVFormat.DEFAULT.builder()
            .setHeader()
            .setSkipHeaderRecord(true)
            .setIgnoreSurroundingSpaces(true)
            .setIgnoreEmptyLines(true)
            .build();
        return format.parse(reader);
    }

    private Reader skipByteOrderMark(BufferedReader reader) throws IOException {
        reader.mark(1);
        int first = reader.read();
        if (first != '\uFEFF') {
            reader.reset();
        }
        return reader;
    }

    private String rootMessage(Throwable error) {
        Throwable current = error;
        while (current.getCause() != null && current.getCause() != current) {
            current = current.getCause();
        }
        return current.getMessage() == null ? current.getClass().getSimpleName() : current.getMessage();
    }
}
