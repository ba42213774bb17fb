package com.branchload.reporting.analytics;

import lombok.experimental.UtilityClass;

import java.util.ArrayList;
import java.util.List;

/**
 * Metric codes of the daily fact sheet and of the derived metrics
 */
@UtilityClass
public class MetricCodes {

    // Revenue
    public final String REVENUE_TOTAL = "revenue_total";
    public final String REVENUE_CASHLESS = "revenue_cashless";
    public final String REVENUE_CASH = "revenue_cash";
    public final String CASH_BALANCE_END_DAY = "cash_balance_end_day";
    public final String REVENUE_OPEN_SPACE = "revenue_open_space";
    public final String REVENUE_CABINETS = "revenue_cabinets";
    public final String REVENUE_LECTURE = "revenue_lecture";
    public final String REVENUE_LAB = "revenue_lab";
    public final String REVENUE_RETAIL = "revenue_retail";
    public final String REVENUE_SALON = "revenue_salon";
    public final String LOAD_PERCENT = "load_percent";

    // Coffee shop
    public final String COFFEE_REVENUE_TOTAL = "coffee_revenue_total";
    public final String COFFEE_CHECKS = "coffee_checks";
    public final String SOLD_FOOD_TOTAL = "sold_food_total";
    public final String REVENUE_DESSERTS = "revenue_desserts";
    public final String REVENUE_DRINKS_TOTAL = "revenue_drinks_total";
    public final String REVENUE_COFFEE_HOT = "revenue_coffee_hot";
    public final String REVENUE_DRINKS_COLD = "revenue_drinks_cold";
    public final String WRITTEN_OFF_FOOD_TOTAL = "written_off_food_total";

    // Cash movements
    public final String WITHDRAWALS_TOTAL = "withdrawals_total";
    public final String DEPOSIT_TOTAL = "deposit_total";

    public final String EXPENSE_FOOD_PURCHASE = "expense_food_purchase";

    // Derived
    public final String AVG_CHECK = "avg_check";
    public final String WRITEOFF_RATE = "writeoff_rate";
    public final String WRITEOFF_RATE_FULL = "writeoff_rate_full";
    public final String LAB_TO_OPEN_SPACE_RATIO = "lab_to_open_space_ratio";
    public final String REVENUE_PER_LOAD = "revenue_per_load";
    public final String COFFEE_REVENUE_PER_LOAD = "coffee_revenue_per_load";
    public final String TOTAL_EXPENSES = "total_expenses";
    public final String EXPENSE_RATIO = "expense_ratio";
    public final String GROSS_PROFIT = "gross_profit";
    public final String OPERATING_PROFIT = "operating_profit";
    public final String OPERATING_MARGIN = "operating_margin";
    public final String COWORKING_TOTAL = "coworking_total";

    public final List<String> EXPENSE_CODES = List.of(
            "expense_cleaning_salary",
            "expense_staff_salary",
            "expense_maintenance",
            "expense_facility",
            "expense_delivery_taxi",
            EXPENSE_FOOD_PURCHASE,
            "expense_marketing",
            "expense_hiring",
            "expense_cash_collection",
            "expense_other");

    public final List<String> COWORKING_CODES = List.of(
            REVENUE_OPEN_SPACE, REVENUE_CABINETS, REVENUE_LECTURE, REVENUE_LAB, REVENUE_RETAIL, REVENUE_SALON);

    public final List<String> FOOD_CODES = List.of(
            SOLD_FOOD_TOTAL,
            REVENUE_DESSERTS,
            "revenue_food_breakfast",
            "revenue_food_lunch",
            "revenue_food_croissants",
            "revenue_food_salads",
            "revenue_food_sandwiches");

    public final List<String> DRINK_CODES = List.of(
            REVENUE_DRINKS_TOTAL,
            "revenue_coffee",
            REVENUE_COFFEE_HOT,
            REVENUE_DRINKS_COLD,
            "revenue_drinks_seasonal");

    /** Codes read by the overview, in sheet order */
    public final List<String> BASE_CODES = buildBaseCodes();

    /** Revenue lines ranked as year-over-year drivers */
    public final List<String> DRIVER_CODES = List.of(
            REVENUE_OPEN_SPACE, REVENUE_CABINETS, REVENUE_LECTURE, REVENUE_LAB, REVENUE_RETAIL, REVENUE_SALON,
            REVENUE_DRINKS_TOTAL, SOLD_FOOD_TOTAL, REVENUE_DESSERTS);

    public final List<String> YOY_DELTA_CODES = List.of(
            REVENUE_TOTAL, COWORKING_TOTAL, COFFEE_REVENUE_TOTAL, LOAD_PERCENT, WRITTEN_OFF_FOOD_TOTAL);

    public final List<String> YEAR_SUMMARY_CODES = List.of(
            REVENUE_TOTAL, REVENUE_OPEN_SPACE, REVENUE_CABINETS, REVENUE_LECTURE, REVENUE_LAB,
            REVENUE_RETAIL, REVENUE_SALON, COFFEE_REVENUE_TOTAL);

    private List<String> buildBaseCodes() {
        List<String> codes = new ArrayList<>(List.of(
                REVENUE_TOTAL, REVENUE_CASHLESS, REVENUE_CASH, CASH_BALANCE_END_DAY));
        codes.addAll(COWORKING_CODES);
        codes.add(LOAD_PERCENT);
        codes.add(COFFEE_REVENUE_TOTAL);
        codes.add(COFFEE_CHECKS);
        codes.addAll(FOOD_CODES);
        codes.addAll(DRINK_CODES);
        codes.add(WRITTEN_OFF_FOOD_TOTAL);
        codes.add(WITHDRAWALS_TOTAL);
        codes.add(DEPOSIT_TOTAL);
        codes.addAll(EXPENSE_CODES);
        return List.copyOf(codes);
    }
}
