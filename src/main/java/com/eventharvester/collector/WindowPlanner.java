package com.eventharvester.collector;

import com.eventharvester.model.WindowSpec;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits the coverage horizon of a windowed source into consecutive fixed-length windows.
 * <p>
 * Каждое окно вычисляется от сегодняшней даты независимо (start_i = today + i*days),
 * поэтому переходы через границу месяца или года не дают ни пропусков, ни перекрытий.
 */
@Component
@RequiredArgsConstructor
public class WindowPlanner {

    private final Clock clock;

    public List<DateWindow> plan(WindowSpec spec) {
        LocalDate today = LocalDate.now(clock);
        DateTimeFormatter formatter = DateTimeFormatter.ofPattern(spec.getDatePattern());
        int days = Math.max(1, spec.getDays());

        List<DateWindow> windows = new ArrayList<>();
        for (int i = 0; i < spec.getCount(); i++) {
            LocalDate start = today.plusDays((long) i * days);
            LocalDate end = start.plusDays(days - 1L);
            String url = spec.getUrlTemplate()
                    .replace("{start}", formatter.format(start))
                    .replace("{end}", formatter.format(end));
            windows.add(new DateWindow(i, start, end, url));
        }
        return windows;
    }
}
