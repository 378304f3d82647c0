package com.rowguard.transform;

import com.rowguard.plan.WindowGroupLimitExec;
import com.rowguard.validation.ValidationOutcome;

import java.util.Locale;
import java.util.Set;

/**
 * Native per-partition top-N.
 */
public final class WindowGroupLimitTransformer extends TransformCandidate {

    private static final Set<String> RANK_LIKE = Set.of("row_number", "rank", "dense_rank");

    private final WindowGroupLimitExec limit;

    public WindowGroupLimitTransformer(WindowGroupLimitExec limit, TransformContext context) {
        super(limit, context);
        this.limit = limit;
    }

    @Override
    protected ValidationOutcome validateLocally() {
        String function = limit.rankFunction().toLowerCase(Locale.ROOT);
        if (!RANK_LIKE.contains(function)) {
            return ValidationOutcome.failed("Unsupported rank function for window group limit: " + function);
        }
        if (limit.limit() < 0) {
            return ValidationOutcome.failed("Negative window group limit: " + limit.limit());
        }
        converter.convertAll(limit.partitionSpec());
        converter.convertAll(limit.orderSpec());
        return ValidationOutcome.passed();
    }
}
