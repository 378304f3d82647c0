package com.rowguard.test;

import com.rowguard.expression.AttributeReference;
import com.rowguard.expression.Expression;
import com.rowguard.expression.FunctionCall;
import com.rowguard.expression.Literal;
import com.rowguard.plan.FileFormat;
import com.rowguard.plan.FilterExec;
import com.rowguard.plan.PhysicalPlan;
import com.rowguard.plan.ProjectExec;
import com.rowguard.plan.ScanExec;
import com.rowguard.types.PrimitiveType;
import com.rowguard.types.SchemaParser;

import java.util.Arrays;
import java.util.List;

/**
 * Small plan trees shared by the tests.
 */
public final class PlanFixtures {

    public static final String SALES_SCHEMA = "struct<id:bigint,region:string,amount:double,day:date>";

    public static ScanExec salesScan() {
        return ScanExec.fileSource("sales", FileFormat.PARQUET, SchemaParser.parse(SALES_SCHEMA));
    }

    public static ScanExec salesBatchScan() {
        return ScanExec.batch("sales", FileFormat.PARQUET, SchemaParser.parse(SALES_SCHEMA));
    }

    public static AttributeReference column(PhysicalPlan plan, String name) {
        return plan.output().stream()
            .filter(attribute -> attribute.name().equals(name))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException("No column " + name + " in " + plan));
    }

    /**
     * Returns {@code amount > 100} over the given plan.
     */
    public static Expression amountAbove100(PhysicalPlan plan) {
        return FunctionCall.of(">", PrimitiveType.BOOLEAN, column(plan, "amount"), Literal.of(100.0));
    }

    public static FilterExec filterOverScan() {
        ScanExec scan = salesScan();
        return new FilterExec(amountAbove100(scan), scan);
    }

    public static ProjectExec projectOf(PhysicalPlan child, String... names) {
        List<Expression> columns = Arrays.stream(names)
            .<Expression>map(name -> column(child, name))
            .toList();
        return new ProjectExec(columns, child);
    }

    /**
     * Nests {@code depth} calls of {@code abs} around a column, giving an expression of depth {@code depth + 1}.
     */
    public static Expression nestedAbs(Expression leaf, int depth) {
        Expression current = leaf;
        for (int i = 0; i < depth; i++) {
            current = FunctionCall.of("abs", current.dataType(), current);
        }
        return current;
    }

    private PlanFixtures() {
    }
}
