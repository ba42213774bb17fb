package com.branchload.reporting.dto.report;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;

/**
 * A day whose closing cash balance does not match the reconciled expectation
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CashDiscrepancy {

    private LocalDate date;
    private double expected;
    private double actual;
    private double diff;
}
