package io.marketlake.marketdata;

import io.marketlake.marketdata.schema.SchemaRegistry;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;

/** Canned provider payloads shared by tests. */
public final class Fixtures {
    private Fixtures() {}

    public static String header(DatasetKind kind) {
        return String.join(",", SchemaRegistry.specFor(kind).names());
    }

    public static int yyyymmdd(LocalDate d) {
        return Integer.parseInt(d.format(DateTimeFormatter.BASIC_ISO_DATE));
    }

    public static String eodRow(LocalDate d, double close) {
        return "57600000,61200000,470.1,472.5,469.0," + close + ",1000,50,10,1,471.1,0,12,1,471.3,0," + yyyymmdd(d);
    }

    public static String quoteRow(LocalDate d, long msOfDay) {
        return msOfDay + ",10,1,471.1,0,12,1,471.3,0," + yyyymmdd(d);
    }

    public static String stockEodCsv(LocalDate d, int rows) {
        StringBuilder sb = new StringBuilder(header(DatasetKind.STOCK_EOD)).append('\n');
        for (int i = 0; i < rows; i++) sb.append(eodRow(d, 471.0 + i)).append('\n');
        return sb.toString();
    }

    public static String optionEodCsv(String root, LocalDate d, int rows) {
        StringBuilder sb = new StringBuilder(header(DatasetKind.OPTION_EOD)).append('\n');
        for (int i = 0; i < rows; i++) {
            sb.append(root).append(",20240119,").append(470000 + i * 5000).append(",C,")
                    .append(eodRow(d, 1.5 + i)).append('\n');
        }
        return sb.toString();
    }

    public static final String EARNINGS_JSON = "{\"data\":{\"asOf\":\"Mon, Sep 29, 2025\",\"headers\":{},\"rows\":["
            + "{\"symbol\":\"CCL\",\"name\":\"Carnival Corporation\",\"time\":\"time-pre-market\",\"eps\":\"$1.02\","
            + "\"epsForecast\":\"$1.32\",\"surprise\":\"12\",\"marketCap\":\"$43,130,276,450\","
            + "\"fiscalQuarterEnding\":\"Aug/2025\",\"noOfEsts\":\"6\"},"
            + "{\"symbol\":\"JEF \",\"name\":\"Jefferies\",\"time\":\"time-not-supplied\",\"eps\":\"($2.55)\","
            + "\"epsForecast\":\"N/A\",\"surprise\":\"N/A\",\"marketCap\":\"\",\"fiscalQuarterEnding\":\"\",\"noOfEsts\":\"N/A\"}"
            + "]}}";
}
