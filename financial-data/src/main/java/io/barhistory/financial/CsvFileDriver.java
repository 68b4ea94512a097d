package io.barhistory.financial;

import io.barhistory.core.Bar;
import io.barhistory.core.Driver;
import io.barhistory.core.Field;
import io.barhistory.core.Period;
import io.barhistory.core.PullResult;
import io.barhistory.core.SplitAdjust;
import io.barhistory.core.SupportedParameters;
import io.barhistory.core.ValueAdjust;
import io.barhistory.session.DriverSession;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Reads bars from a CSV file laid out as {@code date,open,high,low,close,volume[,openInterest]}, oldest first.
 * The date column holds {@code yyyy-MM-dd}, an ISO local date-time, or epoch seconds; all are UTC. Rows with
 * an empty price cell are skipped.
 */
public class CsvFileDriver implements Driver {
    private static final Logger log = LoggerFactory.getLogger(CsvFileDriver.class);

    private static final String HEADER = "date,open,high,low,close,volume";

    private final Path file;
    private final Period period;
    private final Set<Field> fields;
    private final List<SplitAdjust> splits = new ArrayList<>();
    private final List<ValueAdjust> valueAdjusts = new ArrayList<>();
    private final Map<DriverSession, Cursor> cursors = new ConcurrentHashMap<>();

    public CsvFileDriver(Path file, Period period) throws IOException {
        this.file = file;
        this.period = period;
        String header;
        try (BufferedReader br = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            header = br.readLine();
        }
        if (header == null) throw new IOException(file + " is empty");
        String h = header.trim().toLowerCase();
        if (h.equals(HEADER)) {
            fields = Field.of(Field.OPEN, Field.HIGH, Field.LOW, Field.CLOSE, Field.VOLUME);
        } else if (h.equals(HEADER + ",openinterest")) {
            fields = Field.all();
        } else {
            throw new IOException(file + ": unexpected header '" + header + "'");
        }
    }

    public CsvFileDriver withSplit(long timestamp, double factor) {
        splits.add(new SplitAdjust(timestamp, factor));
        return this;
    }

    public CsvFileDriver withValueAdjust(long timestamp, double amount) {
        valueAdjusts.add(new ValueAdjust(timestamp, amount));
        return this;
    }

    @Override
    public SupportedParameters describeSupportedParameters() {
        return SupportedParameters.of(period, fields);
    }

    @Override
    public PullResult pull(DriverSession session, Long start, Long end, Set<Field> wanted) throws IOException {
        Cursor cursor = cursors.get(session);
        if (cursor == null) {
            if (session.isCancellationRequested()) return PullResult.finished();
            cursor = open(session, wanted);
            cursors.put(session, cursor);
        }
        synchronized (cursor) {
            if (cursor.closed) return PullResult.finished();
            while (true) {
                String line = cursor.reader.readLine();
                if (line == null) {
                    close(session);
                    return PullResult.finished();
                }
                cursor.lineNo++;
                if (line.isBlank()) continue;
                String[] cols = line.split(",", -1);
                if (cols.length < 6) {
                    close(session);
                    return PullResult.error(file.getFileName() + ":" + cursor.lineNo + ": expected at least 6 columns");
                }
                if (cols[1].isEmpty() || cols[2].isEmpty() || cols[3].isEmpty() || cols[4].isEmpty()) {
                    log.debug("{}:{}: empty price, row skipped", file.getFileName(), cursor.lineNo);
                    continue;
                }
                Bar bar;
                try {
                    bar = parse(cols);
                } catch (NumberFormatException | DateTimeParseException e) {
                    close(session);
                    return PullResult.error(file.getFileName() + ":" + cursor.lineNo + ": " + e.getMessage());
                }
                // the session filters the range too; stop early once past the end
                if (end != null && bar.timestamp() > end) {
                    close(session);
                    return PullResult.finished();
                }
                if (start != null && bar.timestamp() < start) continue;
                return PullResult.bar(period, cursor.delivered, bar);
            }
        }
    }

    @Override
    public void cancel(DriverSession session) {
        close(session);
    }

    /** Sessions whose file is still open. */
    int openCursors() {
        return cursors.size();
    }

    private Cursor open(DriverSession session, Set<Field> wanted) throws IOException {
        Set<Field> delivered = EnumSet.noneOf(Field.class);
        delivered.addAll(fields);
        delivered.retainAll(wanted);
        BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8);
        reader.readLine(); // header
        for (SplitAdjust s : splits) session.addSplitAdjust(s.timestamp(), s.factor());
        for (ValueAdjust v : valueAdjusts) session.addValueAdjust(v.timestamp(), v.amount());
        log.debug("{}: reading {} as {} {}", session.describe(), file, period, delivered);
        return new Cursor(reader, delivered.isEmpty() ? fields : Field.copyOf(delivered));
    }

    private void close(DriverSession session) {
        Cursor c = cursors.remove(session);
        if (c == null) return;
        synchronized (c) {
            if (c.closed) return;
            c.closed = true;
            try {
                c.reader.close();
            } catch (IOException e) {
                log.warn("failed to close {}", file, e);
            }
        }
    }

    private static Bar parse(String[] cols) {
        long ts = parseTimestamp(cols[0].trim());
        long volume = cols[5].isEmpty() ? 0L : (long) Double.parseDouble(cols[5]);
        long oi = cols.length > 6 && !cols[6].isEmpty() ? (long) Double.parseDouble(cols[6]) : 0L;
        return new Bar(ts,
                Double.parseDouble(cols[1]), Double.parseDouble(cols[2]),
                Double.parseDouble(cols[3]), Double.parseDouble(cols[4]),
                volume, oi);
    }

    static long parseTimestamp(String s) {
        if (!s.isEmpty() && s.chars().allMatch(Character::isDigit)) return Long.parseLong(s);
        if (s.length() == 10) return LocalDate.parse(s).atStartOfDay().toEpochSecond(ZoneOffset.UTC);
        return LocalDateTime.parse(s.replace(' ', 'T')).toEpochSecond(ZoneOffset.UTC);
    }

    private static final class Cursor {
        final BufferedReader reader;
        final Set<Field> delivered;
        int lineNo = 1;
        boolean closed;

        Cursor(BufferedReader reader, Set<Field> delivered) {
            this.reader = reader;
            this.delivered = delivered;
        }
    }
}
