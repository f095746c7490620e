package com.spreadsheet.formula.functions;

import com.spreadsheet.formula.models.ErrorKind;
import com.spreadsheet.formula.models.FormulaValue;

import java.time.Clock;
import java.time.DateTimeException;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.time.temporal.TemporalAdjusters;
import java.util.List;

import static com.spreadsheet.formula.functions.FunctionSupport.error;
import static com.spreadsheet.formula.functions.FunctionSupport.integer;
import static com.spreadsheet.formula.functions.FunctionSupport.number;
import static com.spreadsheet.formula.functions.FunctionSupport.optional;

/**
 * Date and time functions over serial numbers: whole days counted from 1899-12-30,
 * with the time of day as the fraction. TODAY and NOW read the supplied clock.
 */
final class DateTimeFunctions {

    static final LocalDate EPOCH = LocalDate.of(1899, 12, 30);
    private static final double SECONDS_PER_DAY = 86400;

    private final Clock clock;

    private DateTimeFunctions(Clock clock) {
        this.clock = clock;
    }

    static void register(FunctionRegistry registry, Clock clock) {
        DateTimeFunctions functions = new DateTimeFunctions(clock);
        registry.register("TODAY", 0, 0, args -> FormulaValue.number(toSerial(LocalDate.now(functions.clock))));
        registry.register("NOW", 0, 0, args -> functions.now());
        registry.register("DATE", 3, 3, DateTimeFunctions::date);
        registry.register("YEAR", 1, 1, args -> FormulaValue.number(toDate(args.get(0)).getYear()));
        registry.register("MONTH", 1, 1, args -> FormulaValue.number(toDate(args.get(0)).getMonthValue()));
        registry.register("DAY", 1, 1, args -> FormulaValue.number(toDate(args.get(0)).getDayOfMonth()));
        registry.register("HOUR", 1, 1, args -> FormulaValue.number(secondOfDay(args.get(0)) / 3600));
        registry.register("MINUTE", 1, 1, args -> FormulaValue.number(secondOfDay(args.get(0)) / 60 % 60));
        registry.register("SECOND", 1, 1, args -> FormulaValue.number(secondOfDay(args.get(0)) % 60));
        registry.register("TIME", 3, 3, DateTimeFunctions::time);
        registry.register("WEEKDAY", 1, 2, DateTimeFunctions::weekday);
        registry.register("EDATE", 2, 2, args -> FormulaValue.number(
                toSerial(toDate(args.get(0)).plusMonths(integer(args.get(1))))));
        registry.register("EOMONTH", 2, 2, args -> FormulaValue.number(toSerial(toDate(args.get(0))
                .plusMonths(integer(args.get(1)))
                .with(TemporalAdjusters.lastDayOfMonth()))));
    }

    static long toSerial(LocalDate date) {
        return ChronoUnit.DAYS.between(EPOCH, date);
    }

    private FormulaValue now() {
        LocalDateTime now = LocalDateTime.now(clock);
        return FormulaValue.number(toSerial(now.toLocalDate()) + now.toLocalTime().toSecondOfDay() / SECONDS_PER_DAY);
    }

    /**
     * DATE(year, month, day). Years 0-99 mean 1900-1999; months and days outside their
     * usual range roll over, so DATE(2024, 13, 1) is 2025-01-01.
     */
    private static FormulaValue date(List<FormulaValue> args) {
        int year = integer(args.get(0));
        int month = integer(args.get(1));
        int day = integer(args.get(2));
        if (year >= 0 && year <= 99) {
            year += 1900;
        }
        if (year < 1900 || year > 9999) {
            throw error(ErrorKind.NUM, "Year must be between 1900 and 9999");
        }
        LocalDate date;
        try {
            date = LocalDate.of(year, 1, 1)
                    .plusMonths(month - 1L)
                    .plusDays(day - 1L);
        } catch (DateTimeException e) {
            throw error(ErrorKind.NUM, "Date out of range: " + e.getMessage());
        }
        long serial = toSerial(date);
        if (serial < 0) {
            throw error(ErrorKind.NUM, "Date is before the first serial day");
        }
        return FormulaValue.number(serial);
    }

    private static LocalDate toDate(FormulaValue value) {
        double serial = number(value);
        if (serial < 0 || serial > toSerial(LocalDate.of(9999, 12, 31))) {
            throw error(ErrorKind.NUM, "Date serial number out of range");
        }
        return EPOCH.plusDays((long) Math.floor(serial));
    }

    private static long secondOfDay(FormulaValue value) {
        double serial = number(value);
        if (serial < 0) {
            throw error(ErrorKind.NUM, "Date serial number cannot be negative");
        }
        double fraction = serial - Math.floor(serial);
        return Math.round(fraction * SECONDS_PER_DAY) % (long) SECONDS_PER_DAY;
    }

    private static FormulaValue time(List<FormulaValue> args) {
        double hours = number(args.get(0));
        double minutes = number(args.get(1));
        double seconds = number(args.get(2));
        double total = hours * 3600 + minutes * 60 + seconds;
        if (hours < 0 || hours >= 32768 || total < 0) {
            throw error(ErrorKind.NUM, "Time out of range");
        }
        // only the time of day survives, as a fraction
        double secondsOfDay = Math.floor(total) % SECONDS_PER_DAY;
        return FormulaValue.number(secondsOfDay / SECONDS_PER_DAY);
    }

    /**
     * WEEKDAY(serial, [type]). Type 1: Sunday=1..Saturday=7; type 2: Monday=1..Sunday=7;
     * type 3: Monday=0..Sunday=6.
     */
    private static FormulaValue weekday(List<FormulaValue> args) {
        int isoDay = toDate(args.get(0)).getDayOfWeek().getValue();
        int type = integer(optional(args, 1, FormulaValue.number(1)));
        switch (type) {
            case 1:
                return FormulaValue.number(isoDay % 7 + 1);
            case 2:
                return FormulaValue.number(isoDay);
            case 3:
                return FormulaValue.number(isoDay - 1);
            default:
                throw error(ErrorKind.NUM, "Invalid WEEKDAY return type " + type);
        }
    }
}
