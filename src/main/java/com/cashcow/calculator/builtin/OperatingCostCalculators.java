package com.cashcow.calculator.builtin;

import com.cashcow.calculator.CalculatorRegistry;
import com.cashcow.domain.enums.CashFlowCategory;
import com.cashcow.domain.enums.EntityType;
import com.cashcow.domain.model.Equipment;
import com.cashcow.domain.model.Facility;
import com.cashcow.domain.model.Project;
import com.cashcow.domain.model.Software;
import java.util.List;

/**
 * Facility, software, equipment and project outflows.
 *
 * <p>Facility {@code recurring_calc} already includes utilities and insurance, so
 * {@code utilities_calc} is informational. Equipment depreciation is a non-cash figure and
 * carries no category.
 */
public final class OperatingCostCalculators {

    public static final String RECURRING = "recurring_calc";
    public static final String UTILITIES = "utilities_calc";
    public static final String ONE_TIME = "one_time_calc";
    public static final String MAINTENANCE = "maintenance_calc";
    public static final String DEPRECIATION = "depreciation_calc";
    public static final String BURN = "burn_calc";
    public static final String MILESTONE = "milestone_calc";

    private OperatingCostCalculators() {}

    static void register(CalculatorRegistry registry) {
        registry.register(EntityType.FACILITY, RECURRING, Facility.class,
                (facility, context) -> facility.calculateMonthlyCost(context.getAsOfDate()),
                "Rent and running costs due this month", CashFlowCategory.FACILITY_COSTS, List.of());
        registry.register(EntityType.FACILITY, UTILITIES, Facility.class,
                (facility, context) -> facility.isActive(context.getAsOfDate()) && facility.getUtilitiesMonthly() != null
                        ? facility.getUtilitiesMonthly()
                        : 0.0,
                "Monthly utilities");

        registry.register(EntityType.SOFTWARE, RECURRING, Software.class,
                (software, context) -> software.calculateMonthlyCost(context.getAsOfDate()),
                "Monthly subscription cost", CashFlowCategory.SOFTWARE_COSTS, List.of());

        registry.register(EntityType.EQUIPMENT, ONE_TIME, Equipment.class,
                (equipment, context) -> equipment.isActive(context.getAsOfDate())
                        ? equipment.purchaseCostDue(context.getAsOfDate())
                        : 0.0,
                "Purchase cost in the purchase month", CashFlowCategory.EQUIPMENT_COSTS, List.of());
        registry.register(EntityType.EQUIPMENT, MAINTENANCE, Equipment.class,
                (equipment, context) -> equipment.isActive(context.getAsOfDate())
                        ? equipment.calculateMonthlyMaintenance()
                        : 0.0,
                "Maintenance and support contracts", CashFlowCategory.EQUIPMENT_COSTS, List.of());
        registry.register(EntityType.EQUIPMENT, DEPRECIATION, Equipment.class,
                (equipment, context) -> equipment.isActive(context.getAsOfDate())
                        ? equipment.calculateMonthlyDepreciation(context.getAsOfDate())
                        : 0.0,
                "Straight-line depreciation (non-cash)");

        registry.register(EntityType.PROJECT, BURN, Project.class,
                (project, context) -> project.calculateMonthlyBurnRate(context.getAsOfDate()),
                "Budget burned this month", CashFlowCategory.PROJECT_COSTS, List.of());
        registry.register(EntityType.PROJECT, MILESTONE, Project.class,
                (project, context) -> project.isActive(context.getAsOfDate())
                        ? project.milestoneBudgetDue(context.getAsOfDate())
                        : 0.0,
                "Milestone budget falling in this month");
    }
}
