package com.rowguard.transform;

import com.rowguard.plan.WriteFilesExec;
import com.rowguard.validation.ValidationOutcome;

/**
 * Native file writer.
 */
public final class WriteFilesTransformer extends TransformCandidate {

    private final WriteFilesExec write;

    public WriteFilesTransformer(WriteFilesExec write, TransformContext context) {
        super(write, context);
        this.write = write;
    }

    @Override
    protected ValidationOutcome validateLocally() {
        if (!context.backend().supportFileFormatWrite(write.fileFormat())) {
            return ValidationOutcome.failed("Unsupported native write format: " + write.fileFormat());
        }
        if (write.numBuckets().isPresent()) {
            return ValidationOutcome.failed("Bucketed write is not supported");
        }
        converter.checkAttributes(write.child().output());
        return ValidationOutcome.passed();
    }
}
