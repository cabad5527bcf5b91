package com.cashcow.calculator.builtin;

import com.cashcow.calculator.CalculatorRegistry;
import com.cashcow.domain.enums.CashFlowCategory;
import com.cashcow.domain.enums.EntityType;
import com.cashcow.domain.model.Sale;
import com.cashcow.domain.model.ServiceContract;
import java.util.List;

public final class RevenueCalculators {

    public static final String SALE_REVENUE = "revenue_calc";
    public static final String SERVICE_RECURRING = "recurring_calc";

    private RevenueCalculators() {}

    static void register(CalculatorRegistry registry) {
        registry.register(EntityType.SALE, SALE_REVENUE, Sale.class,
                (sale, context) -> sale.calculateMonthlyRevenue(context.getAsOfDate()),
                "Sale revenue recognised this month", CashFlowCategory.SALES_REVENUE, List.of());
        registry.register(EntityType.SERVICE, SERVICE_RECURRING, ServiceContract.class,
                (service, context) -> service.calculateMonthlyRevenue(context.getAsOfDate()),
                "Recurring service revenue", CashFlowCategory.SERVICE_REVENUE, List.of());
    }
}
