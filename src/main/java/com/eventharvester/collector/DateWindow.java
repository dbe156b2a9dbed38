package com.eventharvester.collector;

import lombok.Value;

import java.time.LocalDate;

/**
 * One fetch window of a calendar-style source, both ends inclusive.
 */
@Value
public class DateWindow {
    int index;
    LocalDate start;
    LocalDate end;
    String url;
}
