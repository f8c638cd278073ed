package com.sdmarker.infrastructure.marker.compile;

public enum CompileMode {
    /** Stop at the first invalid pattern. */
    FAIL_FAST,
    /** Report every invalid pattern in one exception. */
    COLLECT_ALL
}
