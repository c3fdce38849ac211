package com.refactorguard.classifier.dataset;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reads the labelled training set. The CSV needs a header with the columns
 * {@value #CODE_BEFORE}, {@value #CODE_AFTER} and {@value #ERROR_INTRODUCED}
 * in any order; other columns are ignored and quoted values may span lines.
 */
public final class TrainingDataset {

    public static final String CODE_BEFORE = "code_before";
    public static final String CODE_AFTER = "code_after";
    public static final String ERROR_INTRODUCED = "error_introduced";

    private static final CsvMapper CSV = CsvMapper.builder()
            .enable(CsvParser.Feature.WRAP_AS_ARRAY)
            .build();

    private TrainingDataset() {
    }

    public static List<TrainingExample> load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    public static List<TrainingExample> read(Reader reader) throws IOException {
        List<TrainingExample> examples = new ArrayList<>();
        try (MappingIterator<String[]> rows = CSV.readerFor(String[].class).readValues(reader)) {
            if (!rows.hasNextValue()) {
                throw new DatasetFormatException("Dataset is empty, expected a header row");
            }
            List<String> header = Arrays.stream(rows.nextValue()).map(String::strip).toList();
            int before = column(header, CODE_BEFORE);
            int after = column(header, CODE_AFTER);
            int label = column(header, ERROR_INTRODUCED);

            int line = 1;
            while (rows.hasNextValue()) {
                String[] row = rows.nextValue();
                line++;
                if (row.length == 0 || (row.length == 1 && row[0].isBlank())) {
                    continue;
                }
                int width = Math.max(before, Math.max(after, label)) + 1;
                if (row.length < width) {
                    throw new DatasetFormatException("Row " + line + " has " + row.length
                            + " columns, expected at least " + width);
                }
                examples.add(new TrainingExample(row[before], row[after], parseLabel(row[label], line)));
            }
        }
        return examples;
    }

    private static int column(List<String> header, String name) {
        int index = header.indexOf(name);
        if (index < 0) {
            throw new DatasetFormatException("Dataset must contain '" + CODE_BEFORE + "', '" + CODE_AFTER
                    + "', and '" + ERROR_INTRODUCED + "' columns. Missing: " + name);
        }
        return index;
    }

    private static int parseLabel(String value, int line) {
        switch (value.strip()) {
            case "0":
                return 0;
            case "1":
                return 1;
            default:
                throw new DatasetFormatException("Row " + line + ": " + ERROR_INTRODUCED
                        + " must be 0 or 1 but was '" + value + "'");
        }
    }
}
