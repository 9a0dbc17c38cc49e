package io.marketlake.marketdata;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.junit.jupiter.api.Assertions.*;

class TradingCalendarsTest {

    @Test
    void nyseHolidays2024() {
        LocalDate[] holidays = {
                LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 15), LocalDate.of(2024, 2, 19),
                LocalDate.of(2024, 3, 29), LocalDate.of(2024, 5, 27), LocalDate.of(2024, 6, 19),
                LocalDate.of(2024, 7, 4), LocalDate.of(2024, 9, 2), LocalDate.of(2024, 11, 28),
                LocalDate.of(2024, 12, 25)};
        for (LocalDate d : holidays) {
            assertFalse(TradingCalendars.isUsEquityTradingDay(d), d + " should be closed");
        }
        assertTrue(TradingCalendars.isUsEquityTradingDay(LocalDate.of(2024, 3, 28)));
    }

    @Test
    void observedRules() {
        assertFalse(TradingCalendars.isUsEquityTradingDay(LocalDate.of(2021, 12, 24))); // Christmas on Saturday
        assertTrue(TradingCalendars.isUsEquityTradingDay(LocalDate.of(2021, 12, 31)));  // New Year on Saturday
        assertFalse(TradingCalendars.isUsEquityTradingDay(LocalDate.of(2022, 6, 20)));  // Juneteenth on Sunday
        assertTrue(TradingCalendars.isUsEquityTradingDay(LocalDate.of(2020, 6, 19)));
    }

    @Test
    void tradingDaysPerMonth() {
        assertEquals(21, TradingCalendars.tradingDays(LocalDate.of(2024, 1, 1), LocalDate.of(2024, 1, 31)).size());
        assertEquals(20, TradingCalendars.tradingDays(LocalDate.of(2023, 12, 1), LocalDate.of(2023, 12, 31)).size());
        assertTrue(TradingCalendars.tradingDays(LocalDate.of(2024, 1, 6), LocalDate.of(2024, 1, 7)).isEmpty());
    }
}
