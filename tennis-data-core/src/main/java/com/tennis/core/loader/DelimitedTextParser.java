package com.tennis.core.loader;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parser for delimiter-separated text with a header row.
 * Rows whose field count differs from the header are dropped.
 */
public class DelimitedTextParser {

    private static final Logger log = LoggerFactory.getLogger(DelimitedTextParser.class);

    private final char delimiter;

    public DelimitedTextParser(char delimiter) {
        this.delimiter = delimiter;
    }

    public static DelimitedTextParser csv() {
        return new DelimitedTextParser(',');
    }

    /**
     * Parse all rows into header-keyed maps that keep the header's column order.
     * The reader is consumed fully but not closed.
     */
    public List<Map<String, String>> parse(Reader source) throws IOException {
        BufferedReader reader = source instanceof BufferedReader br ? br : new BufferedReader(source);
        List<Map<String, String>> rows = new ArrayList<>();

        String headerLine = nextNonBlankLine(reader);
        if (headerLine == null) {
            return rows;
        }
        List<String> headers = parseLine(stripBom(headerLine));

        String line;
        int lineNum = 1;
        int dropped = 0;
        while ((line = reader.readLine()) != null) {
            lineNum++;
            if (line.isBlank()) continue;

            List<String> values = parseLine(line);
            if (values.size() != headers.size()) {
                dropped++;
                log.debug("Dropping line {}: {} fields, header has {}", lineNum, values.size(), headers.size());
                continue;
            }

            Map<String, String> row = new LinkedHashMap<>();
            for (int i = 0; i < headers.size(); i++) {
                row.put(headers.get(i), values.get(i));
            }
            rows.add(row);
        }

        if (dropped > 0) {
            log.debug("Dropped {} malformed rows out of {}", dropped, rows.size() + dropped);
        }
        return rows;
    }

    public List<Map<String, String>> parse(String content) {
        try {
            return parse(new StringReader(content));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    /**
     * Split one line. A quote toggles quoted state, inside which the delimiter is literal;
     * a doubled quote inside a quoted field is a literal quote. Fields are trimmed.
     */
    public List<String> parseLine(String line) {
        List<String> values = new ArrayList<>();
        boolean inQuotes = false;
        StringBuilder current = new StringBuilder();

        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);

            if (c == '"') {
                if (inQuotes && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    current.append('"');
                    i++;
                } else {
                    inQuotes = !inQuotes;
                }
            } else if (c == delimiter && !inQuotes) {
                values.add(current.toString().trim());
                current = new StringBuilder();
            } else if (c != '\r') {
                current.append(c);
            }
        }
        values.add(current.toString().trim());

        return values;
    }

    private static String nextNonBlankLine(BufferedReader reader) throws IOException {
        String line;
        while ((line = reader.readLine()) != null) {
            if (!line.isBlank()) return line;
        }
        return null;
    }

    private static String stripBom(String line) {
        return !line.isEmpty() && line.charAt(0) == '﻿' ? line.substring(1) : line;
    }
}
