package com.rowguard.transform;

import com.rowguard.expression.AttributeReference;
import com.rowguard.plan.ScanExec;
import com.rowguard.types.StructField;
import com.rowguard.validation.ValidationOutcome;

import java.util.List;

/**
 * Native scan over a file source, batch or hive table scan.
 */
public final class ScanTransformer extends TransformCandidate {

    private final ScanExec scan;

    public ScanTransformer(ScanExec scan, TransformContext context) {
        super(scan, context);
        this.scan = scan;
    }

    @Override
    protected ValidationOutcome validateLocally() {
        List<StructField> fields = scan.output().stream()
            .map(ScanTransformer::toField)
            .toList();
        if (!context.backend().supportFileFormatRead(scan.format(), fields)) {
            return ValidationOutcome.failed(String.format("Unsupported file format %s or schema for %s",
                scan.format(), scan.tableName()));
        }
        converter.convertAll(scan.dataFilters());
        return ValidationOutcome.passed();
    }

    private static StructField toField(AttributeReference attribute) {
        return new StructField(attribute.name(), attribute.dataType(), attribute.nullable());
    }
}
