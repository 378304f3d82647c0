package com.rowguard.transform;

import com.rowguard.backend.BackendSettings;
import com.rowguard.backend.NativeValidator;
import com.rowguard.config.RowguardConfig;

import java.util.Objects;

/**
 * Collaborators shared by every transform candidate of one run.
 *
 * @param backend the capabilities of the native backend
 * @param conf the configuration snapshot
 * @param nativeValidator the backend's deep check
 */
public record TransformContext(BackendSettings backend, RowguardConfig conf, NativeValidator nativeValidator) {

    public TransformContext {
        Objects.requireNonNull(backend, "backend must not be null");
        Objects.requireNonNull(conf, "conf must not be null");
        Objects.requireNonNull(nativeValidator, "nativeValidator must not be null");
    }

    public ExpressionConverter converter() {
        return new ExpressionConverter(backend);
    }
}
