package io.barhistory.financial;

import com.codahale.metrics.MetricRegistry;
import com.codahale.metrics.Snapshot;
import com.google.inject.Guice;
import com.google.inject.Injector;
import io.barhistory.config.HistoryConfig;
import io.barhistory.core.AttachParams;
import io.barhistory.core.History;
import io.barhistory.core.HistoryException;
import io.barhistory.core.HistoryFlag;
import io.barhistory.core.Period;
import io.barhistory.core.RetCode;
import io.barhistory.ingestor.HistoryModule;
import io.barhistory.metrics.Metrics;
import io.barhistory.period.PeriodTransform;
import io.barhistory.runtime.HistoryBuilder;
import io.barhistory.runtime.HistoryBuilderFactory;
import picocli.CommandLine;

import java.nio.file.Path;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;

/**
 * CLI merging several CSV price files of one instrument into a single adjusted history.
 */
@CommandLine.Command(name = "history-csv", mixinStandardHelpOptions = true, description = "Merge CSV price files into one history")
public final class HistoryCsvMain implements Callable<Integer> {
    @CommandLine.Option(names = {"-i", "--input"}, required = true, split = ",",
            description = "Input CSV as path[@PERIOD], in priority order (comma-separated or repeat option)")
    List<String> inputs = new ArrayList<>();

    @CommandLine.Option(names = {"-o", "--out"}, description = "Output CSV file", defaultValue = "history.csv")
    String out;

    @CommandLine.Option(names = {"-t", "--target"}, description = "Period to transform the merged history into")
    Period target;

    @CommandLine.Option(names = {"-s", "--start"}, description = "Start date (yyyy-MM-dd)")
    LocalDate startDate;

    @CommandLine.Option(names = {"-e", "--end"}, description = "End date (yyyy-MM-dd), inclusive")
    LocalDate endDate;

    @CommandLine.Option(names = "--split", split = ",", description = "Split as yyyy-MM-dd:FACTOR")
    List<String> splits = new ArrayList<>();

    @CommandLine.Option(names = "--dividend", split = ",", description = "Value adjustment as yyyy-MM-dd:AMOUNT")
    List<String> dividends = new ArrayList<>();

    @CommandLine.Option(names = "--require-all", description = "Fail when any input fails instead of leaving it out")
    boolean requireAll;

    @CommandLine.Option(names = "--allow-incomplete", description = "Keep a trailing window not fully covered by the data")
    boolean allowIncomplete;

    @CommandLine.Option(names = "--no-adjust", description = "Ignore splits and dividends")
    boolean noAdjust;

    public static void main(String[] args) {
        int code = new CommandLine(new HistoryCsvMain()).setCaseInsensitiveEnumValuesAllowed(true).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() throws Exception {
        Set<HistoryFlag> flags = EnumSet.noneOf(HistoryFlag.class);
        if (allowIncomplete) flags.add(HistoryFlag.ALLOW_INCOMPLETE_PRICE_BARS);
        if (noAdjust) {
            flags.add(HistoryFlag.DISABLE_SPLIT_ADJUST);
            flags.add(HistoryFlag.DISABLE_VALUE_ADJUST);
        }

        Injector injector = Guice.createInjector(new HistoryModule(HistoryConfig.fromEnv()));
        try {
            HistoryBuilder builder = injector.getInstance(HistoryBuilderFactory.class).newBuilder(flags);
            Long start = startDate == null ? null : startDate.atStartOfDay().toEpochSecond(ZoneOffset.UTC);
            Long end = endDate == null ? null : endDate.plusDays(1).atStartOfDay().toEpochSecond(ZoneOffset.UTC) - 1;
            for (String input : inputs) {
                builder.attachSource(source(input, start, end));
            }

            History history = builder.build();
            if (target != null) {
                PeriodTransform.transformPeriod(history, target, flags, false);
            }
            int rows = new HistoryCsvWriter(Path.of(out)).write(history);

            printOnce(injector.getInstance(MetricRegistry.class));
            System.out.println("Saved " + rows + " " + history.period() + " bars " + history.fieldProvided() + " to " + out);
            if (history.retCode() != RetCode.SUCCESS) {
                System.out.println("Left out after " + history.retCode() + ": " + history.failedSources());
            }
            return 0;
        } catch (HistoryException e) {
            System.err.println("History build failed: " + e.getMessage());
            return e.retCode() == RetCode.BAD_PARAM ? 2 : 1;
        } finally {
            injector.getInstance(ExecutorService.class).shutdownNow();
        }
    }

    private AttachParams source(String input, Long start, Long end) throws Exception {
        int at = input.lastIndexOf('@');
        Path path = Path.of(at < 0 ? input : input.substring(0, at));
        Period period = at < 0 ? Period.DAILY : Period.valueOf(input.substring(at + 1).toUpperCase());
        CsvFileDriver driver = new CsvFileDriver(path, period);
        for (String s : splits) driver.withSplit(date(s), amount(s));
        for (String d : dividends) driver.withValueAdjust(date(d), amount(d));
        return AttachParams.builder(driver)
                .category("csv")
                .symbol(path.getFileName().toString())
                .period(period)
                .range(start, end)
                .allFields()
                .required(requireAll)
                .build();
    }

    private static long date(String option) {
        return LocalDate.parse(option.substring(0, option.indexOf(':'))).atStartOfDay().toEpochSecond(ZoneOffset.UTC);
    }

    private static double amount(String option) {
        return Double.parseDouble(option.substring(option.indexOf(':') + 1));
    }

    private static void printOnce(MetricRegistry r) {
        Snapshot build = r.timer(Metrics.BUILD_TIME).getSnapshot();
        System.out.println("[" + Instant.now() + "] metrics:" +
                " pulled=" + r.meter(Metrics.PULL_BARS).getCount() +
                " retries=" + r.meter(Metrics.PULL_RETRIES).getCount() +
                " sessionErrors=" + r.meter(Metrics.SESSION_ERRORS).getCount() +
                " mergeOps=" + r.histogram(Metrics.MERGE_OPS).getSnapshot().getMax() +
                " emitted=" + r.counter(Metrics.BARS_EMITTED).getCount() +
                " | build(ms)=" + String.format("%.3f", build.getMax() / 1_000_000.0));
    }
}
