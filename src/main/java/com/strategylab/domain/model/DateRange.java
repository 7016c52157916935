package com.strategylab.domain.model;

import lombok.Value;

/** Backtest window as {@code YYYY-MM-DD} strings; {@code max} as start means full history. */
@Value
public class DateRange {

    String startDate;
    String endDate;

    public static DateRange of(String startDate, String endDate) {
        return new DateRange(startDate, endDate);
    }
}
