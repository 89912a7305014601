package com.regimetrader.reporting;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;
import com.regimetrader.exception.ReportException;
import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/** Writes report rows as CSV with a header line; columns follow the row type's property order. */
@Component
public class CsvReportWriter {

    private static final Logger log = LoggerFactory.getLogger(CsvReportWriter.class);

    private final CsvMapper csvMapper = new CsvMapper();

    public <T> Path write(Path target, List<T> rows, Class<T> rowType) {
        CsvSchema schema = csvMapper.schemaFor(rowType).withHeader();
        try {
            Path parent = target.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Writer writer = Files.newBufferedWriter(target, StandardCharsets.UTF_8);
                    SequenceWriter sequence = csvMapper.writer(schema).writeValues(writer)) {
                sequence.writeAll(rows);
            }
        } catch (IOException e) {
            throw new ReportException("Failed to write CSV report " + target, e);
        }
        log.info("Wrote {} rows to {}", rows.size(), target);
        return target;
    }
}
