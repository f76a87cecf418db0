package com.autonomous.quota.service;

import com.autonomous.quota.exception.PriceCatalogLoadException;
import com.autonomous.quota.model.PriceEntry;
import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads pricing rows in the form {@code model,version,input,cached_input,output}.
 * The first row is a header and is skipped. Rows that cannot be priced are skipped with a warning.
 */
@Slf4j
public class PriceCatalogLoader {

    private static final int MIN_FIELDS = 5;

    private final CsvMapper csvMapper;

    public PriceCatalogLoader() {
        this.csvMapper = new CsvMapper();
        this.csvMapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.csvMapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
        this.csvMapper.enable(CsvParser.Feature.TRIM_SPACES);
    }

    public Map<String, PriceEntry> load(Resource resource) throws PriceCatalogLoadException {
        try (Reader reader = new InputStreamReader(resource.getInputStream(), StandardCharsets.UTF_8)) {
            return parse(reader);
        } catch (IOException e) {
            throw new PriceCatalogLoadException("cannot open pricing file: " + resource.getDescription(), e);
        }
    }

    public Map<String, PriceEntry> parse(Reader reader) throws PriceCatalogLoadException {
        List<String[]> records;
        try (MappingIterator<String[]> rows = csvMapper.readerFor(String[].class).readValues(reader)) {
            records = rows.readAll();
        } catch (IOException e) {
            throw new PriceCatalogLoadException("error reading CSV: " + e.getMessage(), e);
        }

        if (records.size() < 2) {
            throw new PriceCatalogLoadException("CSV file must contain at least header and one data row");
        }

        Map<String, PriceEntry> entries = new HashMap<>();
        for (String[] record : records.subList(1, records.size())) {
            if (record.length < MIN_FIELDS) {
                log.warn("Skipping incomplete row: {}", Arrays.toString(record));
                continue;
            }

            String model = record[0];
            String version = record[1];

            Double input = parseRate(record[2]);
            if (input == null) {
                log.warn("Invalid input price for model {}: '{}'", model, record[2]);
                continue;
            }

            Double cachedInput = parseRate(record[3]);

            Double output = parseRate(record[4]);
            if (output == null) {
                log.warn("Invalid output price for model {}: '{}'", model, record[4]);
                continue;
            }

            PriceEntry entry = PriceEntry.builder()
                .model(model)
                .version(version)
                .inputRate(input)
                .cachedInputRate(cachedInput != null ? cachedInput : 0.0)
                .outputRate(output)
                .build();

            entries.put(model, entry);
            if (!version.isEmpty() && !version.equals(model)) {
                entries.put(version, entry);
            }
        }
        return entries;
    }

    /**
     * @return the rate, or {@code null} when the value is empty, unparsable, negative or not finite
     */
    static Double parseRate(String value) {
        if (value == null || value.isBlank()) {
            return null;
        }
        try {
            double rate = Double.parseDouble(value.trim());
            if (rate < 0 || Double.isNaN(rate) || Double.isInfinite(rate)) {
                return null;
            }
            return rate;
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
