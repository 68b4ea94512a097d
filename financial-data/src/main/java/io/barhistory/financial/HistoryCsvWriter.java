package io.barhistory.financial;

import io.barhistory.core.Field;
import io.barhistory.core.History;

import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.time.ZoneOffset;

/**
 * Writes an assembled history as CSV, one row per bar, with a column for every field the history carries.
 * Daily and coarser bars are written with a plain date so the file reads back through {@link CsvFileDriver}.
 */
public class HistoryCsvWriter {
    private final Path out;

    public HistoryCsvWriter(Path out) {
        this.out = out;
    }

    /** @return rows written, header excluded */
    public int write(History h) throws IOException {
        Path parent = out.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        try (BufferedWriter w = Files.newBufferedWriter(out, StandardCharsets.UTF_8)) {
            StringBuilder header = new StringBuilder("date");
            for (Field f : h.fieldProvided()) header.append(',').append(column(f));
            w.write(header.toString());
            w.newLine();
            for (int i = 0; i < h.nbBars(); i++) {
                StringBuilder row = new StringBuilder(date(h, i));
                if (h.open() != null) row.append(',').append(num(h.open()[i]));
                if (h.high() != null) row.append(',').append(num(h.high()[i]));
                if (h.low() != null) row.append(',').append(num(h.low()[i]));
                if (h.close() != null) row.append(',').append(num(h.close()[i]));
                if (h.volume() != null) row.append(',').append(h.volume()[i]);
                if (h.openInterest() != null) row.append(',').append(h.openInterest()[i]);
                w.write(row.toString());
                w.newLine();
            }
        }
        return h.nbBars();
    }

    private static String date(History h, int i) {
        LocalDateTime t = LocalDateTime.ofEpochSecond(h.timestamp()[i], 0, ZoneOffset.UTC);
        return h.period().isIntraday() ? t.toString() : t.toLocalDate().toString();
    }

    private static String column(Field f) {
        return f == Field.OPEN_INTEREST ? "openInterest" : f.name().toLowerCase();
    }

    private static String num(double d) {
        if (Double.isNaN(d)) return "";
        return Double.toString(d);
    }
}
