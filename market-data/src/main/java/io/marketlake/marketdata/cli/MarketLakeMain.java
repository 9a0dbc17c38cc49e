package io.marketlake.marketdata.cli;

import com.codahale.metrics.MetricRegistry;
import com.google.inject.CreationException;
import com.google.inject.Guice;
import com.google.inject.Injector;
import com.google.inject.Key;
import com.google.inject.ProvisionException;
import com.google.inject.TypeLiteral;
import io.marketlake.config.IngestConfig;
import io.marketlake.job.JobSnapshot;
import io.marketlake.job.JobTracker;
import io.marketlake.marketdata.DatasetKind;
import io.marketlake.marketdata.FileGranularity;
import io.marketlake.marketdata.LogicalRequest;
import io.marketlake.marketdata.MarketDataModule;
import io.marketlake.marketdata.admin.JobStatusServer;
import io.marketlake.marketdata.dispatch.FailedSlot;
import io.marketlake.marketdata.dispatch.FanOutDispatcher;
import io.marketlake.marketdata.dispatch.IngestResult;
import io.marketlake.marketdata.dispatch.JobHandle;
import io.marketlake.marketdata.dispatch.SubmitMode;
import io.marketlake.marketdata.retrieve.Dataset;
import io.marketlake.marketdata.retrieve.MissingPolicy;
import io.marketlake.marketdata.retrieve.RetrievalScanner;
import io.marketlake.marketdata.schema.CanonicalTable;
import picocli.CommandLine;

import java.time.LocalDate;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletionException;

/**
 * CLI to ingest provider data into the lake and read it back.
 */
@CommandLine.Command(name = "market-lake", mixinStandardHelpOptions = true,
        description = "Ingest market data into partitioned storage and read it back",
        subcommands = {MarketLakeMain.Ingest.class, MarketLakeMain.Retrieve.class})
public final class MarketLakeMain implements Callable<Integer> {

    public static void main(String[] args) {
        int code = new CommandLine(new MarketLakeMain()).execute(args);
        System.exit(code);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }

    static DatasetKind parseKind(String s) { return DatasetKind.fromCliName(s); }

    abstract static class RequestOptions {
        @CommandLine.Option(names = {"-k", "--kind"}, required = true, converter = KindConverter.class,
                description = "option-quote, option-eod, stock-quote, stock-eod or earnings")
        DatasetKind kind;

        @CommandLine.Option(names = {"-s", "--symbol"}, description = "Root symbol (not used for earnings)")
        String symbol;

        @CommandLine.Option(names = "--start", description = "Start date (yyyy-MM-dd)")
        LocalDate start;

        @CommandLine.Option(names = "--end", description = "End date (yyyy-MM-dd); default end of the start's month")
        LocalDate end;

        @CommandLine.Option(names = {"-i", "--interval-ms"}, defaultValue = "3600000", description = "Bar interval for quote kinds")
        long intervalMs;

        @CommandLine.Option(names = {"-g", "--granularity"}, defaultValue = "MONTHLY", description = "MONTHLY or DAILY")
        FileGranularity granularity;

        LogicalRequest.Builder builder() {
            return LogicalRequest.builder(kind)
                    .symbol(symbol)
                    .range(start, end)
                    .intervalMs(intervalMs)
                    .granularity(granularity);
        }

        Injector injector() {
            return Guice.createInjector(new MarketDataModule(IngestConfig.fromEnv()));
        }
    }

    static final class KindConverter implements CommandLine.ITypeConverter<DatasetKind> {
        @Override
        public DatasetKind convert(String value) { return parseKind(value); }
    }

    @CommandLine.Command(name = "ingest", mixinStandardHelpOptions = true, description = "Fetch a range from the provider and store it")
    static final class Ingest extends RequestOptions implements Callable<Integer> {
        @CommandLine.Option(names = {"-x", "--expiration"}, defaultValue = "0", description = "Option expiration (0 = all)")
        int expiration;

        @CommandLine.Option(names = {"-f", "--force"}, description = "Fetch partitions that are already stored")
        boolean force;

        @CommandLine.Option(names = "--async", description = "Print the job id and poll progress instead of blocking")
        boolean async;

        @CommandLine.Option(names = "--status-port", description = "Serve /jobs/{id} and /metrics on this port while running")
        Integer statusPort;

        @Override
        public Integer call() throws Exception {
            LogicalRequest request;
            Injector injector;
            JobStatusServer status = null;
            try {
                request = builder().expiration(expiration).forceRefresh(force).build();
                injector = injector();
            } catch (IllegalArgumentException | ProvisionException | CreationException e) {
                System.err.println(e.getMessage());
                return 2;
            }
            try (FanOutDispatcher dispatcher = injector.getInstance(FanOutDispatcher.class)) {
                IngestConfig config = injector.getInstance(IngestConfig.class);
                int port = statusPort != null ? statusPort : config.statusPort();
                if (port > 0) {
                    status = new JobStatusServer(port,
                            injector.getInstance(Key.get(new TypeLiteral<JobTracker<CanonicalTable>>() {})),
                            injector.getInstance(MetricRegistry.class));
                    status.start();
                }
                JobHandle handle = dispatcher.submit(request, async ? SubmitMode.ASYNC : SubmitMode.SYNC);
                System.out.println("Submitted job " + handle.jobId());
                while (!handle.isDone()) {
                    JobSnapshot s = handle.snapshot();
                    System.out.printf("  %d/%d parts (%.1f%%), %d failed%n",
                            s.completedParts(), s.totalParts(), s.progressPercentage(), s.failedParts());
                    Thread.sleep(1_000);
                }
                IngestResult result = handle.join();
                System.out.println(result.summary());
                for (FailedSlot f : result.failedSlots()) {
                    System.out.println("  failed slot " + f.slot() + " " + f.uri() + ": " + f.reason());
                }
                for (String key : result.committedKeys()) System.out.println("  wrote " + key);
                return result.hasFailures() ? 1 : 0;
            } catch (CompletionException e) {
                System.err.println("Commit failed: " + e.getCause().getMessage());
                return 3;
            } catch (CancellationException e) {
                System.err.println("Job cancelled");
                return 4;
            } catch (IllegalArgumentException | IllegalStateException | ProvisionException | CreationException e) {
                System.err.println(e.getMessage());
                return 2;
            } finally {
                if (status != null) status.close();
            }
        }
    }

    @CommandLine.Command(name = "retrieve", mixinStandardHelpOptions = true, description = "Read stored partitions back")
    static final class Retrieve extends RequestOptions implements Callable<Integer> {
        @CommandLine.Option(names = {"-a", "--all"}, description = "Every stored partition for the symbol")
        boolean all;

        @CommandLine.Option(names = "--on-missing", defaultValue = "FAIL", description = "FAIL or SKIP")
        MissingPolicy onMissing;

        @Override
        public Integer call() {
            try {
                LogicalRequest request = builder().all(all).build();
                RetrievalScanner scanner = injector().getInstance(RetrievalScanner.class);
                Dataset dataset = scanner.retrieve(request, onMissing);
                CanonicalTable table = dataset.collect();
                System.out.println(table.rowCount() + " rows from " + dataset.partitionKeys().size() + " partition(s)");
                for (String key : dataset.partitionKeys()) System.out.println("  " + key);
                return 0;
            } catch (RuntimeException e) {
                System.err.println(e.getMessage());
                return 2;
            }
        }
    }
}
