package com.branchload.reporting.api.service;

import com.branchload.reporting.api.client.SchedulingApiClient;
import com.branchload.reporting.config.EtlConfig;
import com.branchload.reporting.dto.platform.BookingPageResponse;
import com.branchload.reporting.dto.platform.RawBookingDto;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Booking Collector - pages through a branch's bookings for a date range
 * Stops on an empty page or once page * count reaches meta.total_count.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class BookingCollector {

    private final SchedulingApiClient schedulingApiClient;
    private final EtlConfig etlConfig;

    public List<RawBookingDto> collect(long branchId, LocalDate from, LocalDate to, Consumer<String> progress) {
        int count = Math.max(1, etlConfig.getPageSize());
        List<RawBookingDto> bookings = new ArrayList<>();
        int page = 1;

        while (true) {
            BookingPageResponse response = schedulingApiClient.fetchBookings(branchId, from, to, page, count);
            if (response.getRecordCount() == 0) {
                log.debug("Branch {}: page {} empty, stopping", branchId, page);
                break;
            }
            bookings.addAll(response.getData());

            int total = response.getTotalCount();
            progress.accept(progressText(branchId, page, total, count));

            if (total > 0 && (long) page * count >= total) {
                break;
            }
            page++;
        }

        log.info("📥 Branch {} [{}..{}]: collected {} bookings in {} page(s)",
                branchId, from, to, bookings.size(), page);
        return bookings;
    }

    static String progressText(long branchId, int page, int totalCount, int count) {
        if (totalCount <= 0) {
            return branchId + ": page " + page;
        }
        int estimatedPages = (totalCount + count - 1) / count;
        return branchId + ": page " + page + " / ~" + estimatedPages;
    }
}
