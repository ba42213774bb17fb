package com.branchload.reporting.entity;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Branch Entity - Maps to branches table
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Branch {

    private String code;
    private String name;
}
